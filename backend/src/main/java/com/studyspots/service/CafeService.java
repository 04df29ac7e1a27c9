package com.studyspots.service;

import com.studyspots.config.StudySpotsProperties;
import com.studyspots.dto.CafeUpdateRequest;
import com.studyspots.exception.InvalidInputException;
import com.studyspots.exception.ResourceNotFoundException;
import com.studyspots.model.Cafe;
import com.studyspots.repository.CafeRepository;
import com.studyspots.repository.EntityPager;
import com.studyspots.util.GeoValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.geo.GeoJsonPoint;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.regex.Pattern;

// ========== Cafe Service ==========
@Service
@RequiredArgsConstructor
@Slf4j
public class CafeService {

    public static final double DEFAULT_MAX_DISTANCE_METERS = 5000;

    private final CafeRepository cafeRepository;
    private final EntityPager entityPager;
    private final MongoTemplate mongoTemplate;
    private final StudySpotsProperties properties;

    @Cacheable(value = "cafes", key = "#id")
    public Cafe getCafe(String id) {
        return cafeRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Cafe not found"));
    }

    public List<Cafe> listCafes(Integer skip, Integer limit) {
        int offset = skip != null ? skip : 0;
        int max = limit != null ? limit : properties.getPagination().getDefaultLimit();
        return entityPager.list(Cafe.class, offset, max);
    }

    public Cafe createCafe(Cafe cafe) {
        if (!GeoValidator.isValidLocation(cafe.getLocation())) {
            throw new InvalidInputException("Invalid coordinates provided");
        }

        LocalDateTime now = LocalDateTime.now();
        cafe.setId(null);
        cafe.setCreatedAt(now);
        cafe.setUpdatedAt(now);

        Cafe saved = cafeRepository.save(cafe);
        log.info("Created cafe: {} (ID: {})", saved.getName(), saved.getId());
        return saved;
    }

    @CacheEvict(value = "cafes", key = "#id")
    public Cafe updateCafe(String id, CafeUpdateRequest request) {
        Cafe existing = cafeRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Cafe not found"));

        if (request.getLocation() != null) {
            if (!GeoValidator.isValidLocation(request.getLocation())) {
                throw new InvalidInputException("Invalid coordinates provided");
            }
            existing.setLocation(request.getLocation());
        }
        if (request.getName() != null) {
            existing.setName(request.getName());
        }
        if (request.getAddress() != null) {
            existing.setAddress(request.getAddress());
        }
        if (request.getPhone() != null) {
            existing.setPhone(request.getPhone());
        }
        if (request.getWebsite() != null) {
            existing.setWebsite(request.getWebsite());
        }
        if (request.getOpeningHours() != null) {
            existing.setOpeningHours(request.getOpeningHours());
        }
        if (request.getAmenities() != null) {
            existing.setAmenities(request.getAmenities());
        }
        if (request.getThumbnailUrl() != null) {
            existing.setThumbnailUrl(request.getThumbnailUrl());
        }
        if (request.getWifiAccess() != null) {
            existing.setWifiAccess(request.getWifiAccess());
        }
        if (request.getOutletAccessibility() != null) {
            existing.setOutletAccessibility(request.getOutletAccessibility());
        }
        if (request.getAverageRating() != null) {
            existing.setAverageRating(request.getAverageRating());
        }
        existing.setUpdatedAt(LocalDateTime.now());

        Cafe saved = cafeRepository.save(existing);
        log.info("Updated cafe: {}", id);
        return saved;
    }

    @CacheEvict(value = "cafes", key = "#id")
    public void deleteCafe(String id) {
        if (!cafeRepository.existsById(id)) {
            throw new ResourceNotFoundException("Cafe not found");
        }
        // Bookmarks pointing at this cafe are left in place and skipped when listed
        cafeRepository.deleteById(id);
        log.info("Deleted cafe: {}", id);
    }

    public List<Cafe> searchCafes(String query) {
        if (query == null || query.isBlank()) {
            throw new InvalidInputException("Search query cannot be empty");
        }
        log.info("Searching cafes: {}", query);
        return cafeRepository.search(Pattern.quote(query.trim()));
    }

    public List<Cafe> findNearbyCafes(double longitude, double latitude, Double maxDistance) {
        double distance = maxDistance != null ? maxDistance : DEFAULT_MAX_DISTANCE_METERS;
        if (!GeoValidator.isValidCoordinate(longitude, latitude)) {
            throw new InvalidInputException("Invalid coordinates provided");
        }
        if (distance <= 0) {
            throw new InvalidInputException("Max distance must be greater than 0");
        }
        log.info("Finding cafes near [{}, {}] within {}m", longitude, latitude, distance);

        // maxDistance is in metres for GeoJSON points
        Query query = new Query(Criteria.where("location")
            .near(new GeoJsonPoint(longitude, latitude))
            .maxDistance(distance));
        return mongoTemplate.find(query, Cafe.class);
    }

    public List<Cafe> findCafesByAmenities(List<String> amenities) {
        if (amenities == null || amenities.isEmpty()) {
            throw new InvalidInputException("At least one amenity must be specified");
        }
        return cafeRepository.findByAllAmenities(amenities);
    }

    public List<Cafe> findCafesByRating(double minRating) {
        if (minRating < 1 || minRating > 5) {
            throw new InvalidInputException("Rating must be between 1 and 5");
        }
        return cafeRepository.findByAverageRatingGreaterThanEqual(minRating);
    }
}
