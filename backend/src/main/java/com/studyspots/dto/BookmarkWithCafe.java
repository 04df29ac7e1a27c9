package com.studyspots.dto;

import com.studyspots.model.Bookmark;
import com.studyspots.model.Cafe;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

// ========== Bookmark With Cafe DTO ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookmarkWithCafe {
    private String id;
    private String userId;
    private String cafeId;
    private Instant bookmarkedAt;
    private Cafe cafe;

    public static BookmarkWithCafe of(Bookmark bookmark, Cafe cafe) {
        return BookmarkWithCafe.builder()
            .id(bookmark.getId())
            .userId(bookmark.getUserId())
            .cafeId(bookmark.getCafeId())
            .bookmarkedAt(bookmark.getBookmarkedAt())
            .cafe(cafe)
            .build();
    }
}
