package com.studyspots.controller;

import com.studyspots.dto.PhotoRequest;
import com.studyspots.dto.ReviewUpdateRequest;
import com.studyspots.model.Review;
import com.studyspots.service.ReviewService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;
import java.util.List;

// ========== Review Controller ==========
@RestController
@RequestMapping("/reviews")
@RequiredArgsConstructor
@Tag(name = "Reviews", description = "Study spot review management")
public class ReviewController {

    private final ReviewService reviewService;

    @PostMapping({"", "/"})
    @Operation(summary = "Create review")
    public ResponseEntity<Review> createReview(@Valid @RequestBody Review review) {
        return ResponseEntity.status(HttpStatus.CREATED).body(reviewService.createReview(review));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get review by ID")
    public ResponseEntity<Review> getReview(@PathVariable String id) {
        return ResponseEntity.ok(reviewService.getReview(id));
    }

    @GetMapping("/by-spot/{studySpotId}")
    @Operation(summary = "Get reviews for a study spot, newest first")
    public ResponseEntity<List<Review>> getReviewsByStudySpot(@PathVariable String studySpotId) {
        return ResponseEntity.ok(reviewService.getReviewsByStudySpot(studySpotId));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update review")
    public ResponseEntity<Review> updateReview(
            @PathVariable String id,
            @RequestBody ReviewUpdateRequest request) {
        return ResponseEntity.ok(reviewService.updateReview(id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete review")
    public ResponseEntity<Void> deleteReview(@PathVariable String id) {
        reviewService.deleteReview(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/photos")
    @Operation(summary = "Attach a photo to a review")
    public ResponseEntity<Review> addPhoto(
            @PathVariable String id,
            @Valid @RequestBody PhotoRequest request) {
        return ResponseEntity.ok(reviewService.addPhoto(id, request));
    }
}
