package com.studyspots.repository;

import com.studyspots.model.Bookmark;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

// ========== Bookmark Repository ==========
@Repository
public interface BookmarkRepository extends MongoRepository<Bookmark, String> {

    boolean existsByUserIdAndCafeId(String userId, String cafeId);

    Optional<Bookmark> findByUserIdAndCafeId(String userId, String cafeId);

    // ObjectId order breaks ties between equal timestamps
    List<Bookmark> findByUserIdOrderByBookmarkedAtAscIdAsc(String userId);
}
