package com.ecoWasteEngine.store.memory;

import com.ecoWasteEngine.store.FingerprintCache;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

@Component
@ConditionalOnProperty(name = "waste-engine.store", havingValue = "memory")
@RequiredArgsConstructor
public class InMemoryFingerprintCache implements FingerprintCache {

    /** How often claim() drops expired slots */
    private static final Duration SWEEP_INTERVAL = Duration.ofSeconds(30);

    private final ConcurrentMap<String, Slot> slots = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> nextSweep = new AtomicReference<>(Instant.MIN);
    private final Clock clock;

    @Override
    public Claim claim(String key, String entryId, Duration ttl) {
        Instant now = clock.instant();
        sweepExpired(now);
        Slot winner = slots.compute(key, (k, current) -> {
            if (current != null && current.expiresAt.isAfter(now)) {
                return current;
            }
            return new Slot(entryId, now.plus(ttl));
        });
        return winner.entryId.equals(entryId) ? Claim.won(entryId) : Claim.heldBy(winner.entryId);
    }

    @Override
    public Optional<String> lookup(String key) {
        Slot slot = slots.get(key);
        if (slot == null || !slot.expiresAt.isAfter(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(slot.entryId);
    }

    @Override
    public void release(String key, String entryId) {
        slots.computeIfPresent(key, (k, current) -> current.entryId.equals(entryId) ? null : current);
    }

    int size() {
        return slots.size();
    }

    private void sweepExpired(Instant now) {
        Instant due = nextSweep.get();
        if (now.isBefore(due) || !nextSweep.compareAndSet(due, now.plus(SWEEP_INTERVAL))) {
            return;
        }
        // entrySet().removeIf removes each entry only if it is still mapped to the expired slot
        slots.entrySet().removeIf(e -> !e.getValue().expiresAt.isAfter(now));
    }

    private static final class Slot {
        private final String entryId;
        private final Instant expiresAt;

        private Slot(String entryId, Instant expiresAt) {
            this.entryId = entryId;
            this.expiresAt = expiresAt;
        }
    }
}
