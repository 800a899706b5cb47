package com.gt.recall.model;

public record SessionStatistics(int totalReviewed,
                                int correctCount,
                                int againCount,
                                int hardCount,
                                int goodCount,
                                int easyCount,
                                double confidenceSum,
                                int confidenceCount,
                                long totalTimeSeconds,
                                int timedCount,
                                int currentStreak,
                                int bestStreak) {

    public static final SessionStatistics EMPTY = new SessionStatistics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    public SessionStatistics withReview(Difficulty difficulty, Integer timeTakenSeconds, Double confidence) {
        boolean recalled = difficulty.isRecalled();
        int newStreak = recalled ? currentStreak + 1 : 0;

        return new SessionStatistics(
                totalReviewed + 1,
                recalled ? correctCount + 1 : correctCount,
                difficulty == Difficulty.AGAIN ? againCount + 1 : againCount,
                difficulty == Difficulty.HARD ? hardCount + 1 : hardCount,
                difficulty == Difficulty.GOOD ? goodCount + 1 : goodCount,
                difficulty == Difficulty.EASY ? easyCount + 1 : easyCount,
                confidence == null ? confidenceSum : confidenceSum + confidence,
                confidence == null ? confidenceCount : confidenceCount + 1,
                timeTakenSeconds == null ? totalTimeSeconds : totalTimeSeconds + timeTakenSeconds,
                timeTakenSeconds == null ? timedCount : timedCount + 1,
                newStreak,
                Math.max(bestStreak, newStreak));
    }

    public double averageConfidence() {
        return confidenceCount == 0 ? 0 : confidenceSum / confidenceCount;
    }

    public double averageTimeSeconds() {
        return timedCount == 0 ? 0 : (double) totalTimeSeconds / timedCount;
    }

    public double accuracyRate() {
        return totalReviewed == 0 ? 0 : (double) correctCount / totalReviewed;
    }
}
