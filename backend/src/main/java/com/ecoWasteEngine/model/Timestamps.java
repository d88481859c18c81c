package com.ecoWasteEngine.model;

import com.google.cloud.Timestamp;

import java.time.Clock;
import java.time.Instant;

public final class Timestamps {

    private Timestamps() {
    }

    public static Timestamp now(Clock clock) {
        return of(clock.instant());
    }

    public static Timestamp of(Instant instant) {
        return Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
    }

    public static Instant toInstant(Timestamp timestamp) {
        return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
    }
}
