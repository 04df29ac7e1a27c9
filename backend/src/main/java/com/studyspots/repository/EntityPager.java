package com.studyspots.repository;

import com.studyspots.config.StudySpotsProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Offset/limit listing for any collection, in insertion (ObjectId) order.
 * Out-of-range arguments are clamped rather than rejected.
 */
@Component
@RequiredArgsConstructor
public class EntityPager {

    private final MongoTemplate mongoTemplate;
    private final StudySpotsProperties properties;

    public <T> List<T> list(Class<T> type, int offset, int limit) {
        int safeOffset = Math.max(0, offset);
        int safeLimit = Math.min(Math.max(0, limit), properties.getPagination().getMaxLimit());

        // Mongo treats limit 0 as "no limit"
        if (safeLimit == 0) {
            return List.of();
        }

        Query query = new Query()
            .with(Sort.by(Sort.Direction.ASC, "_id"))
            .skip(safeOffset)
            .limit(safeLimit);
        return mongoTemplate.find(query, type);
    }
}
