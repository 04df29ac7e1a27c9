package com.studyspots.repository;

import com.studyspots.model.Review;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

// ========== Review Repository ==========
@Repository
public interface ReviewRepository extends MongoRepository<Review, String> {

    List<Review> findByStudySpotIdOrderByCreatedAtDesc(String studySpotId);
}
