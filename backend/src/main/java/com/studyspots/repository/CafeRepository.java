package com.studyspots.repository;

import com.studyspots.model.Cafe;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

// ========== Cafe Repository ==========
@Repository
public interface CafeRepository extends MongoRepository<Cafe, String> {

    @Query("{ $or: [ { 'name': { $regex: ?0, $options: 'i' } }, "
        + "{ 'address.city': { $regex: ?0, $options: 'i' } }, "
        + "{ 'address.street': { $regex: ?0, $options: 'i' } } ] }")
    List<Cafe> search(String pattern);

    @Query("{ 'amenities': { $all: ?0 } }")
    List<Cafe> findByAllAmenities(List<String> amenities);

    List<Cafe> findByAverageRatingGreaterThanEqual(double minRating);
}
