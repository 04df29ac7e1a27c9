package com.studyspots.service;

import com.studyspots.dto.BookmarkWithCafe;
import com.studyspots.exception.ResourceNotFoundException;
import com.studyspots.model.Bookmark;
import com.studyspots.model.Cafe;
import com.studyspots.repository.BookmarkRepository;
import com.studyspots.repository.CafeRepository;
import com.studyspots.repository.UserRepository;
import com.studyspots.util.ObjectIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Joins a user's bookmarks with their cafes. Bookmarks whose cafe has been
 * deleted are left out of the listing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BookmarkEnrichmentService {

    private final BookmarkRepository bookmarkRepository;
    private final UserRepository userRepository;
    private final CafeRepository cafeRepository;

    public List<BookmarkWithCafe> listUserBookmarks(String userId) {
        ObjectIds.requireValid(userId, "user_id");
        if (!userRepository.existsById(userId)) {
            throw new ResourceNotFoundException("User not found");
        }

        List<Bookmark> bookmarks = bookmarkRepository.findByUserIdOrderByBookmarkedAtAscIdAsc(userId);
        if (bookmarks.isEmpty()) {
            return List.of();
        }

        Set<String> cafeIds = bookmarks.stream()
            .map(Bookmark::getCafeId)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<String, Cafe> cafesById = new HashMap<>();
        cafeRepository.findAllById(cafeIds).forEach(cafe -> cafesById.put(cafe.getId(), cafe));

        List<BookmarkWithCafe> result = new ArrayList<>(bookmarks.size());
        for (Bookmark bookmark : bookmarks) {
            Cafe cafe = cafesById.get(bookmark.getCafeId());
            if (cafe == null) {
                log.warn("Skipping bookmark {}: cafe {} no longer exists", bookmark.getId(), bookmark.getCafeId());
                continue;
            }
            result.add(BookmarkWithCafe.of(bookmark, cafe));
        }

        log.info("Found {} bookmarks for user {}", result.size(), userId);
        return result;
    }
}
