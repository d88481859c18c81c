package com.ecoWasteEngine.store.memory;

import static org.assertj.core.api.Assertions.assertThat;

import com.ecoWasteEngine.store.FingerprintCache;
import com.ecoWasteEngine.support.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryFingerprintCacheTest {

    private static final Duration TTL = Duration.ofSeconds(60);

    private MutableClock clock;
    private InMemoryFingerprintCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-10T10:00:00Z");
        cache = new InMemoryFingerprintCache(clock);
    }

    @Test
    void firstClaimWinsAndLaterClaimsSeeTheHolder() {
        FingerprintCache.Claim first = cache.claim("k", "e1", TTL);
        FingerprintCache.Claim second = cache.claim("k", "e2", TTL);

        assertThat(first.isOwner()).isTrue();
        assertThat(second.isOwner()).isFalse();
        assertThat(second.getEntryId()).isEqualTo("e1");
    }

    @Test
    void claimExpiresAfterTheTtl() {
        cache.claim("k", "e1", TTL);
        clock.advance(TTL);

        assertThat(cache.lookup("k")).isEmpty();
        assertThat(cache.claim("k", "e2", TTL).isOwner()).isTrue();
    }

    @Test
    void releaseOnlyDropsTheCallersOwnClaim() {
        cache.claim("k", "e1", TTL);

        cache.release("k", "e2");
        assertThat(cache.lookup("k")).contains("e1");

        cache.release("k", "e1");
        assertThat(cache.lookup("k")).isEmpty();
    }

    @Test
    void expiredSlotsOfOtherKeysAreEvicted() {
        for (int i = 0; i < 100; i++) {
            cache.claim("upload-" + i, "e" + i, TTL);
        }
        assertThat(cache.size()).isEqualTo(100);

        clock.advance(TTL.plusSeconds(1));
        cache.claim("fresh", "e-fresh", TTL);

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.lookup("fresh")).contains("e-fresh");
    }

    @Test
    void liveSlotsSurviveTheSweep() {
        cache.claim("old", "e1", TTL);
        clock.advance(Duration.ofSeconds(40));
        cache.claim("recent", "e2", TTL);

        clock.advance(Duration.ofSeconds(30));
        cache.claim("newest", "e3", TTL);

        assertThat(cache.lookup("old")).isEmpty();
        assertThat(cache.lookup("recent")).contains("e2");
        assertThat(cache.size()).isEqualTo(2);
    }
}
