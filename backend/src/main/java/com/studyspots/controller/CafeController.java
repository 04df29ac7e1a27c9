package com.studyspots.controller;

import com.studyspots.dto.CafeUpdateRequest;
import com.studyspots.model.Cafe;
import com.studyspots.service.CafeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;
import java.util.List;

// ========== Cafe Controller ==========
@RestController
@RequestMapping("/cafes")
@RequiredArgsConstructor
@Tag(name = "Cafes", description = "Study spot catalog")
public class CafeController {

    private final CafeService cafeService;

    @PostMapping({"", "/"})
    @Operation(summary = "Create cafe")
    public ResponseEntity<Cafe> createCafe(@Valid @RequestBody Cafe cafe) {
        return ResponseEntity.status(HttpStatus.CREATED).body(cafeService.createCafe(cafe));
    }

    @GetMapping({"", "/"})
    @Operation(summary = "List cafes with skip/limit pagination")
    public ResponseEntity<List<Cafe>> getAllCafes(
            @RequestParam(required = false) Integer skip,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(cafeService.listCafes(skip, limit));
    }

    @GetMapping({"/search", "/search/"})
    @Operation(summary = "Search cafes by name, city or street")
    public ResponseEntity<List<Cafe>> searchCafes(@RequestParam String query) {
        return ResponseEntity.ok(cafeService.searchCafes(query));
    }

    @GetMapping({"/nearby", "/nearby/"})
    @Operation(summary = "Find cafes within a distance (metres) of a point")
    public ResponseEntity<List<Cafe>> findNearbyCafes(
            @RequestParam double longitude,
            @RequestParam double latitude,
            @RequestParam(name = "max_distance", required = false) Double maxDistance) {
        return ResponseEntity.ok(cafeService.findNearbyCafes(longitude, latitude, maxDistance));
    }

    @GetMapping({"/by-amenities", "/by-amenities/"})
    @Operation(summary = "Find cafes offering all of the given amenities")
    public ResponseEntity<List<Cafe>> findCafesByAmenities(@RequestParam List<String> amenities) {
        return ResponseEntity.ok(cafeService.findCafesByAmenities(amenities));
    }

    @GetMapping({"/by-rating", "/by-rating/"})
    @Operation(summary = "Find cafes with at least the given average rating")
    public ResponseEntity<List<Cafe>> findCafesByRating(
            @RequestParam(name = "min_rating") double minRating) {
        return ResponseEntity.ok(cafeService.findCafesByRating(minRating));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get cafe by ID")
    public ResponseEntity<Cafe> getCafeById(@PathVariable String id) {
        return ResponseEntity.ok(cafeService.getCafe(id));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update cafe")
    public ResponseEntity<Cafe> updateCafe(
            @PathVariable String id,
            @Valid @RequestBody CafeUpdateRequest request) {
        return ResponseEntity.ok(cafeService.updateCafe(id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete cafe")
    public ResponseEntity<Void> deleteCafe(@PathVariable String id) {
        cafeService.deleteCafe(id);
        return ResponseEntity.noContent().build();
    }
}
