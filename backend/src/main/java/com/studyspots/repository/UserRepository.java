package com.studyspots.repository;

import com.studyspots.model.User;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

// ========== User Repository ==========
@Repository
public interface UserRepository extends MongoRepository<User, String> {

    Optional<User> findByName(String name);

    boolean existsByName(String name);

    boolean existsByNameAndIdNot(String name, String id);

    @Query("{ 'name': { $regex: ?0, $options: 'i' } }")
    List<User> searchByName(String pattern);
}
