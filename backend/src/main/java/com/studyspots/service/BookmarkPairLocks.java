package com.studyspots.service;

import com.studyspots.config.StudySpotsProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped locks keyed by a (user, cafe) pair. Two calls for the same pair
 * always contend on the same lock; unrelated pairs rarely do.
 */
@Component
public class BookmarkPairLocks {

    private final ReentrantLock[] stripes;

    public BookmarkPairLocks(StudySpotsProperties properties) {
        this(properties.getBookmarks().getLockStripes());
    }

    BookmarkPairLocks(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("lock-stripes must be positive: " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String userId, String cafeId, Supplier<T> action) {
        ReentrantLock lock = stripeFor(userId, cafeId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String userId, String cafeId, Runnable action) {
        withLock(userId, cafeId, () -> {
            action.run();
            return null;
        });
    }

    ReentrantLock stripeFor(String userId, String cafeId) {
        // ObjectId hex is case-insensitive
        String key = userId.toLowerCase() + ':' + cafeId.toLowerCase();
        return stripes[Math.floorMod(key.hashCode(), stripes.length)];
    }
}
