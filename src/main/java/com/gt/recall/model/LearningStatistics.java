package com.gt.recall.model;

import java.util.Map;

/**
 * @param matureRetentionRate retention over reviews of items whose current interval is above 21 days
 * @param youngRetentionRate  retention over reviews of the remaining items
 * @param bestReviewHour      UTC hour with the most reviews, the earliest on a tie; null without reviews
 */
public record LearningStatistics(String userId,
                                 StatisticsWindow window,
                                 long reviewedCount,
                                 double retentionRateAvg,
                                 double matureRetentionRate,
                                 double youngRetentionRate,
                                 Map<RepetitionAlgorithm, Long> algorithmDistribution,
                                 Map<Difficulty, Long> difficultyDistribution,
                                 int streakDays,
                                 int bestStreakDays,
                                 long totalTimeSeconds,
                                 double averageTimeSeconds,
                                 double averageConfidence,
                                 double averageDailyReviews,
                                 Map<Integer, Long> reviewsByHour,
                                 Integer bestReviewHour,
                                 long dueToday,
                                 long dueThisWeek) {

    public static final int MATURE_INTERVAL_DAYS = 21;

    public static LearningStatistics empty(String userId, StatisticsWindow window) {
        return new LearningStatistics(userId, window, 0, 0, 0, 0, Map.of(), Map.of(), 0, 0, 0, 0, 0, 0, Map.of(), null, 0, 0);
    }
}
