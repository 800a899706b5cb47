package com.gt.recall.model;

/**
 * @param pastWindow whether the review is already later than the schedule's on-time window
 */
public record DueReview(ReviewSchedule schedule,
                        int overdueDays,
                        double priorityScore,
                        boolean pastWindow) { }
