package com.studyspots.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BookmarkPairLocksTest {

    @Test
    void samePairAlwaysMapsToSameStripe() {
        BookmarkPairLocks locks = new BookmarkPairLocks(32);

        assertThat(locks.stripeFor("60d5ec49e9af8b2c24e8a1b2", "60d5ec49e9af8b2c24e8a1b3"))
            .isSameAs(locks.stripeFor("60D5EC49E9AF8B2C24E8A1B2", "60d5ec49e9af8b2c24e8a1b3"));
    }

    @Test
    void lockIsReleasedWhenActionThrows() {
        BookmarkPairLocks locks = new BookmarkPairLocks(4);

        Runnable failing = () -> {
            throw new IllegalStateException("boom");
        };

        assertThatThrownBy(() -> locks.withLock("u", "c", failing))
            .isInstanceOf(IllegalStateException.class);

        assertThat(locks.stripeFor("u", "c").isLocked()).isFalse();
    }

    @Test
    void rejectsNonPositiveStripeCount() {
        assertThatThrownBy(() -> new BookmarkPairLocks(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
