package com.gt.recall.schedule;

import com.gt.recall.model.DueReview;
import com.gt.recall.model.ReviewSchedule;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;

@Component
public class ReviewPriorityCalculator {

    static final double OVERDUE_DAY_WEIGHT = 1.0;
    static final double RETENTION_LOSS_WEIGHT = 10.0;

    // Highest priority first, then the longest waiting, then item id so equal schedules still sort the same way
    public static final Comparator<DueReview> DUE_ORDER = Comparator
            .comparingDouble(DueReview::priorityScore).reversed()
            .thenComparing(dueReview -> dueReview.schedule().scheduledDate())
            .thenComparing(dueReview -> dueReview.schedule().itemId());

    public double compute(ReviewSchedule schedule, Instant asOf) {
        return schedule.overdueDays(asOf) * OVERDUE_DAY_WEIGHT
                + (1 - schedule.strength().retentionRate()) * RETENTION_LOSS_WEIGHT;
    }

    public DueReview toDueReview(ReviewSchedule schedule, Instant asOf) {
        return new DueReview(schedule, schedule.overdueDays(asOf), compute(schedule, asOf), schedule.isPastWindow(asOf));
    }
}
