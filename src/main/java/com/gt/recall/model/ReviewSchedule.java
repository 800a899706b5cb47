package com.gt.recall.model;

import java.time.Duration;
import java.time.Instant;

public record ReviewSchedule(String itemId,
                             String userId,
                             Instant scheduledDate,
                             RepetitionAlgorithm algorithm,
                             ScheduleStatus status,
                             MemoryStrength strength,
                             boolean leech) {

    static final double REVIEW_WINDOW_FRACTION = 0.1;

    // Half-width of the on-time window around the due date: a tenth of the interval, never less than a day
    public int reviewWindowDays() {
        return Math.max(1, (int) (strength.intervalDays() * REVIEW_WINDOW_FRACTION));
    }

    public Instant earliestDate() {
        return scheduledDate.minus(Duration.ofDays(reviewWindowDays()));
    }

    public Instant latestDate() {
        return scheduledDate.plus(Duration.ofDays(reviewWindowDays()));
    }

    public boolean isPastWindow(Instant asOf) {
        return asOf.isAfter(latestDate());
    }

    public int overdueDays(Instant asOf) {
        if (scheduledDate == null || !asOf.isAfter(scheduledDate)) {
            return 0;
        }

        return (int) Math.min(Integer.MAX_VALUE, Duration.between(scheduledDate, asOf).toDays());
    }

    public boolean isDue(Instant asOf) {
        return status == ScheduleStatus.ACTIVE && !scheduledDate.isAfter(asOf);
    }

    public ReviewSchedule withAlgorithm(RepetitionAlgorithm newAlgorithm) {
        return new ReviewSchedule(itemId, userId, scheduledDate, newAlgorithm, status, strength, leech);
    }

    public ReviewSchedule withStatus(ScheduleStatus newStatus) {
        return new ReviewSchedule(itemId, userId, scheduledDate, algorithm, newStatus, strength, leech);
    }
}
