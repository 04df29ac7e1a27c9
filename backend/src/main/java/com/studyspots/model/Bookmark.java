package com.studyspots.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

import java.time.Instant;

/**
 * A user's saved reference to a cafe. Both references are non-owning and may
 * dangle once the user or cafe is deleted. Bookmarks are never updated.
 */
@Document(collection = "bookmarks")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@CompoundIndexes({
    @CompoundIndex(name = "user_cafe_unique_idx", def = "{'userId': 1, 'cafeId': 1}", unique = true),
    @CompoundIndex(name = "user_bookmarked_at_idx", def = "{'userId': 1, 'bookmarkedAt': 1}")
})
public class Bookmark {
    @Id
    private String id;

    @Field(targetType = FieldType.OBJECT_ID)
    private String userId;

    @Field(targetType = FieldType.OBJECT_ID)
    private String cafeId;

    private Instant bookmarkedAt; // UTC, set once on creation
}
