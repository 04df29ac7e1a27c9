package com.studyspots.service;

import com.studyspots.exception.ConflictException;
import com.studyspots.exception.ResourceNotFoundException;
import com.studyspots.model.Bookmark;
import com.studyspots.repository.BookmarkRepository;
import com.studyspots.repository.CafeRepository;
import com.studyspots.repository.UserRepository;
import com.studyspots.util.ObjectIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Bookmark rules. At most one bookmark exists per (user, cafe) pair: creation
 * and pair deletion run under the pair's lock, and the unique index on
 * {@code bookmarks} catches writers outside this process.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BookmarkService {

    private final BookmarkRepository bookmarkRepository;
    private final UserRepository userRepository;
    private final CafeRepository cafeRepository;
    private final BookmarkPairLocks pairLocks;

    public Bookmark createBookmark(String userId, String cafeId) {
        log.info("Creating bookmark for user {} and cafe {}", userId, cafeId);

        // A malformed id cannot name an existing record
        if (!ObjectIds.isValid(userId) || !userRepository.existsById(userId)) {
            throw new ResourceNotFoundException("User not found");
        }
        if (!ObjectIds.isValid(cafeId) || !cafeRepository.existsById(cafeId)) {
            throw new ResourceNotFoundException("Cafe not found");
        }

        return pairLocks.withLock(userId, cafeId, () -> {
            if (bookmarkRepository.existsByUserIdAndCafeId(userId, cafeId)) {
                throw new ConflictException("Bookmark already exists");
            }

            Bookmark bookmark = Bookmark.builder()
                .userId(userId)
                .cafeId(cafeId)
                .bookmarkedAt(Instant.now().truncatedTo(ChronoUnit.MILLIS))
                .build();

            try {
                Bookmark saved = bookmarkRepository.save(bookmark);
                log.info("Created bookmark {} for user {} and cafe {}", saved.getId(), userId, cafeId);
                return saved;
            } catch (DuplicateKeyException e) {
                throw new ConflictException("Bookmark already exists", e);
            }
        });
    }

    public Bookmark getBookmark(String bookmarkId) {
        ObjectIds.requireValid(bookmarkId, "bookmark_id");
        return bookmarkRepository.findById(bookmarkId)
            .orElseThrow(() -> new ResourceNotFoundException("Bookmark not found"));
    }

    public void deleteBookmarkById(String bookmarkId) {
        Bookmark bookmark = getBookmark(bookmarkId);

        pairLocks.withLock(bookmark.getUserId(), bookmark.getCafeId(), () -> {
            if (!bookmarkRepository.existsById(bookmarkId)) {
                throw new ResourceNotFoundException("Bookmark not found");
            }
            bookmarkRepository.deleteById(bookmarkId);
        });
        log.info("Deleted bookmark {}", bookmarkId);
    }

    public void deleteBookmarkByPair(String userId, String cafeId) {
        ObjectIds.requireValid(userId, "user_id");
        ObjectIds.requireValid(cafeId, "cafe_id");

        pairLocks.withLock(userId, cafeId, () -> {
            Bookmark bookmark = bookmarkRepository.findByUserIdAndCafeId(userId, cafeId)
                .orElseThrow(() -> new ResourceNotFoundException("Bookmark not found"));
            bookmarkRepository.delete(bookmark);
        });
        log.info("Deleted bookmark for user {} and cafe {}", userId, cafeId);
    }

    public boolean existsForPair(String userId, String cafeId) {
        if (!ObjectIds.isValid(userId) || !ObjectIds.isValid(cafeId)) {
            return false;
        }
        return bookmarkRepository.existsByUserIdAndCafeId(userId, cafeId);
    }
}
