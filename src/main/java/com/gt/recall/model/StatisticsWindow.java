package com.gt.recall.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

public enum StatisticsWindow {
    TODAY,
    WEEK,
    MONTH,
    ALL_TIME;

    // Days are UTC days
    public Instant startFrom(Instant now) {
        return switch (this) {
            case TODAY -> now.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS).toInstant();
            case WEEK -> now.minus(7, ChronoUnit.DAYS);
            case MONTH -> now.minus(30, ChronoUnit.DAYS);
            case ALL_TIME -> Instant.EPOCH;
        };
    }
}
