package com.studyspots.controller;

import com.studyspots.dto.BookmarkRequest;
import com.studyspots.dto.BookmarkWithCafe;
import com.studyspots.model.Bookmark;
import com.studyspots.service.BookmarkEnrichmentService;
import com.studyspots.service.BookmarkService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;

// ========== Bookmark Controller ==========
@RestController
@RequiredArgsConstructor
@Tag(name = "Bookmarks", description = "Per-user cafe bookmarks")
public class BookmarkController {

    private final BookmarkService bookmarkService;
    private final BookmarkEnrichmentService bookmarkEnrichmentService;

    @PostMapping({"/bookmarks", "/bookmarks/"})
    @Operation(summary = "Create a bookmark for a user and cafe")
    public ResponseEntity<Bookmark> createBookmark(@Valid @RequestBody BookmarkRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(bookmarkService.createBookmark(request.getUserId(), request.getCafeId()));
    }

    @GetMapping("/bookmarks/{id}")
    @Operation(summary = "Get bookmark by ID")
    public ResponseEntity<Bookmark> getBookmark(@PathVariable String id) {
        return ResponseEntity.ok(bookmarkService.getBookmark(id));
    }

    @GetMapping("/users/{userId}/bookmarks")
    @Operation(summary = "Get a user's bookmarks with cafe details, oldest first")
    public ResponseEntity<List<BookmarkWithCafe>> getUserBookmarks(@PathVariable String userId) {
        return ResponseEntity.ok(bookmarkEnrichmentService.listUserBookmarks(userId));
    }

    @DeleteMapping("/bookmarks/{id}")
    @Operation(summary = "Delete bookmark by ID")
    public ResponseEntity<Void> deleteBookmark(@PathVariable String id) {
        bookmarkService.deleteBookmarkById(id);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/users/{userId}/bookmarks/{cafeId}")
    @Operation(summary = "Delete the bookmark for a user and cafe")
    public ResponseEntity<Void> deleteBookmarkByPair(
            @PathVariable String userId,
            @PathVariable String cafeId) {
        bookmarkService.deleteBookmarkByPair(userId, cafeId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/users/{userId}/bookmarks/{cafeId}/exists")
    @Operation(summary = "Check whether a user has bookmarked a cafe")
    public ResponseEntity<Map<String, Boolean>> bookmarkExists(
            @PathVariable String userId,
            @PathVariable String cafeId) {
        return ResponseEntity.ok(Map.of("exists", bookmarkService.existsForPair(userId, cafeId)));
    }
}
