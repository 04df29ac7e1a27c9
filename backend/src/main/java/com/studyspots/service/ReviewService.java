package com.studyspots.service;

import com.studyspots.dto.PhotoRequest;
import com.studyspots.dto.ReviewUpdateRequest;
import com.studyspots.exception.InvalidInputException;
import com.studyspots.exception.ResourceNotFoundException;
import com.studyspots.model.Photo;
import com.studyspots.model.Review;
import com.studyspots.repository.ReviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

// ========== Review Service ==========
@Service
@RequiredArgsConstructor
@Slf4j
public class ReviewService {

    private final ReviewRepository reviewRepository;

    public Review getReview(String id) {
        return reviewRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Review not found"));
    }

    public List<Review> getReviewsByStudySpot(String studySpotId) {
        return reviewRepository.findByStudySpotIdOrderByCreatedAtDesc(studySpotId);
    }

    public Review createReview(Review review) {
        LocalDateTime now = LocalDateTime.now();
        review.setId(null);
        review.setCreatedAt(now);
        review.setUpdatedAt(now);
        if (review.getPhotos() == null) {
            review.setPhotos(new ArrayList<>());
        }

        Review saved = reviewRepository.save(review);
        log.info("Created review {} for study spot: {}", saved.getId(), saved.getStudySpotId());
        return saved;
    }

    public Review updateReview(String id, ReviewUpdateRequest request) {
        Review existing = getReview(id);

        if (request.getOverallRating() != null) {
            existing.setOverallRating(requireRating(request.getOverallRating()));
        }
        if (request.getOutletAccessibility() != null) {
            existing.setOutletAccessibility(requireRating(request.getOutletAccessibility()));
        }
        if (request.getWifiQuality() != null) {
            existing.setWifiQuality(requireRating(request.getWifiQuality()));
        }
        if (request.getAtmosphere() != null) {
            existing.setAtmosphere(request.getAtmosphere());
        }
        if (request.getEnergyLevel() != null) {
            existing.setEnergyLevel(request.getEnergyLevel());
        }
        if (request.getStudyFriendly() != null) {
            existing.setStudyFriendly(request.getStudyFriendly());
        }
        existing.setUpdatedAt(LocalDateTime.now());

        return reviewRepository.save(existing);
    }

    public void deleteReview(String id) {
        if (!reviewRepository.existsById(id)) {
            throw new ResourceNotFoundException("Review not found");
        }
        reviewRepository.deleteById(id);
        log.info("Deleted review: {}", id);
    }

    public Review addPhoto(String reviewId, PhotoRequest request) {
        Review review = getReview(reviewId);

        Photo photo = Photo.builder()
            .id(new ObjectId().toHexString())
            .url(request.getUrl())
            .caption(request.getCaption())
            .build();
        if (review.getPhotos() == null) {
            review.setPhotos(new ArrayList<>());
        }
        review.getPhotos().add(photo);
        review.setUpdatedAt(LocalDateTime.now());

        Review saved = reviewRepository.save(review);
        log.info("Added photo {} to review {}", photo.getId(), reviewId);
        return saved;
    }

    private static double requireRating(double rating) {
        if (rating < 0 || rating > 5) {
            throw new InvalidInputException("Rating must be between 0 and 5");
        }
        return rating;
    }
}
