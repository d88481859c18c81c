package com.ecoWasteEngine.dto;

import com.google.cloud.Timestamp;

/** Timestamps go over the wire as RFC 3339 strings */
final class DtoTimes {

    private DtoTimes() {
    }

    static String format(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toString();
    }
}
