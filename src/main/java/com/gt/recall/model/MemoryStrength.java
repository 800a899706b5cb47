package com.gt.recall.model;

import com.gt.recall.exception.InvalidStateException;

import java.time.Instant;

/**
 * Memorization state of one item for one user. Values are validated on construction: negative, NaN or infinite
 * numbers are rejected, while an ease factor below {@link #MINIMUM_EASE_FACTOR} or an interval below one day is
 * raised to the floor.
 *
 * @param learningStep index into the learning steps of the Anki schedule, only meaningful while repetitions is 0
 * @param leitnerBox   1-based Leitner box
 * @param lapseStreak  consecutive AGAIN reviews since the last GOOD or EASY review
 */
public record MemoryStrength(double easeFactor,
                             int intervalDays,
                             int repetitions,
                             double retentionRate,
                             double stability,
                             Instant lastReview,
                             int learningStep,
                             int leitnerBox,
                             int lapseStreak) {

    public static final double DEFAULT_EASE_FACTOR = 2.5;
    public static final double MINIMUM_EASE_FACTOR = 1.3;
    public static final double DEFAULT_RETENTION_RATE = 0.9;
    public static final double DEFAULT_STABILITY = 1.0;
    public static final int MINIMUM_INTERVAL_DAYS = 1;

    public MemoryStrength {
        requireFinite("easeFactor", easeFactor);
        requireFinite("retentionRate", retentionRate);
        requireFinite("stability", stability);
        requireNotNegative("intervalDays", intervalDays);
        requireNotNegative("repetitions", repetitions);
        requireNotNegative("learningStep", learningStep);
        requireNotNegative("leitnerBox", leitnerBox);
        requireNotNegative("lapseStreak", lapseStreak);

        if (retentionRate > 1) {
            throw new InvalidStateException("retentionRate must be within [0, 1], was " + retentionRate);
        }
        if (stability == 0) {
            throw new InvalidStateException("stability must be greater than 0");
        }

        easeFactor = Math.max(MINIMUM_EASE_FACTOR, easeFactor);
        intervalDays = Math.max(MINIMUM_INTERVAL_DAYS, intervalDays);
        leitnerBox = Math.max(1, leitnerBox);
    }

    public static MemoryStrength initial() {
        return new MemoryStrength(DEFAULT_EASE_FACTOR, MINIMUM_INTERVAL_DAYS, 0, DEFAULT_RETENTION_RATE, DEFAULT_STABILITY,
                null, 0, 1, 0);
    }

    public boolean isNew() {
        return lastReview == null;
    }

    private static void requireFinite(String field, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new InvalidStateException(field + " must be a finite, non-negative number, was " + value);
        }
    }

    private static void requireNotNegative(String field, int value) {
        if (value < 0) {
            throw new InvalidStateException(field + " must not be negative, was " + value);
        }
    }
}
