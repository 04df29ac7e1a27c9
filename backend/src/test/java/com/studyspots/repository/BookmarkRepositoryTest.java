package com.studyspots.repository;

import com.studyspots.model.Bookmark;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.index.MongoPersistentEntityIndexResolver;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataMongoTest
@Testcontainers(disabledWithoutDocker = true)
class BookmarkRepositoryTest {

    @Container
    @ServiceConnection
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7.0"));

    private static final String USER_ID = new ObjectId().toHexString();
    private static final String OTHER_USER_ID = new ObjectId().toHexString();
    private static final String CAFE_A = new ObjectId().toHexString();
    private static final String CAFE_B = new ObjectId().toHexString();
    private static final String CAFE_C = new ObjectId().toHexString();

    private static final Instant EARLY = Instant.parse("2024-01-15T10:30:00.123Z");
    private static final Instant LATE = Instant.parse("2024-01-16T08:00:00Z");

    @Autowired
    private BookmarkRepository bookmarkRepository;

    @Autowired
    private MongoTemplate mongoTemplate;

    @BeforeEach
    void setUp() {
        bookmarkRepository.deleteAll();
        IndexOperations indexOps = mongoTemplate.indexOps(Bookmark.class);
        new MongoPersistentEntityIndexResolver(mongoTemplate.getConverter().getMappingContext())
            .resolveIndexFor(Bookmark.class)
            .forEach(indexOps::ensureIndex);
    }

    @Test
    void listsByTimeThenInsertionOrder() {
        Bookmark late = bookmarkRepository.save(bookmark(USER_ID, CAFE_A, LATE));
        Bookmark firstTie = bookmarkRepository.save(bookmark(USER_ID, CAFE_B, EARLY));
        Bookmark secondTie = bookmarkRepository.save(bookmark(USER_ID, CAFE_C, EARLY));
        bookmarkRepository.save(bookmark(OTHER_USER_ID, CAFE_A, EARLY));

        assertThat(bookmarkRepository.findByUserIdOrderByBookmarkedAtAscIdAsc(USER_ID))
            .extracting(Bookmark::getId)
            .containsExactly(firstTie.getId(), secondTie.getId(), late.getId());
    }

    @Test
    void storesReferencesAsObjectIdsAndMatchesPairs() {
        Bookmark saved = bookmarkRepository.save(bookmark(USER_ID, CAFE_A, EARLY));

        Document raw = mongoTemplate.getCollection("bookmarks")
            .find(new Document("_id", new ObjectId(saved.getId())))
            .first();
        assertThat(raw).isNotNull();
        assertThat(raw.get("userId")).isEqualTo(new ObjectId(USER_ID));
        assertThat(raw.get("cafeId")).isEqualTo(new ObjectId(CAFE_A));

        assertThat(bookmarkRepository.existsByUserIdAndCafeId(USER_ID, CAFE_A)).isTrue();
        assertThat(bookmarkRepository.existsByUserIdAndCafeId(USER_ID, CAFE_B)).isFalse();
        assertThat(bookmarkRepository.existsByUserIdAndCafeId(OTHER_USER_ID, CAFE_A)).isFalse();
        assertThat(bookmarkRepository.findByUserIdAndCafeId(USER_ID, CAFE_A))
            .hasValueSatisfying(found -> {
                assertThat(found.getId()).isEqualTo(saved.getId());
                assertThat(found.getUserId()).isEqualTo(USER_ID);
                assertThat(found.getBookmarkedAt()).isEqualTo(EARLY);
            });
    }

    @Test
    void uniqueIndexRejectsSecondBookmarkForPair() {
        bookmarkRepository.save(bookmark(USER_ID, CAFE_A, EARLY));

        assertThatThrownBy(() -> bookmarkRepository.save(bookmark(USER_ID, CAFE_A, LATE)))
            .isInstanceOf(DuplicateKeyException.class);
        assertThat(bookmarkRepository.count()).isEqualTo(1);
    }

    private static Bookmark bookmark(String userId, String cafeId, Instant at) {
        return Bookmark.builder()
            .userId(userId)
            .cafeId(cafeId)
            .bookmarkedAt(at)
            .build();
    }
}
