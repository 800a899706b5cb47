package com.gt.recall.algorithm;

import com.gt.recall.model.Difficulty;

// Exponential forgetting curve, R = e^(-t/S) with t in days and S the memory stability
public final class ForgettingCurve {

    public static final double MINIMUM_STABILITY = 0.1;
    public static final double MAXIMUM_STABILITY = 36500;

    static final double LAPSE_MULTIPLIER = 0.5;
    static final double HARD_MULTIPLIER = 1.2;
    static final double EASY_MULTIPLIER = 1.3;

    private ForgettingCurve() { }

    public static double retention(double elapsedDays, double stability) {
        if (elapsedDays <= 0) {
            return 1.0;
        }

        return Math.exp(-elapsedDays / Math.max(MINIMUM_STABILITY, stability));
    }

    public static double nextStability(double stability, Difficulty difficulty, double easeFactor) {
        double next = switch (difficulty) {
            case AGAIN -> stability * LAPSE_MULTIPLIER;
            case HARD -> stability * HARD_MULTIPLIER;
            case GOOD -> stability * easeFactor;
            case EASY -> stability * easeFactor * EASY_MULTIPLIER;
        };

        return Math.min(MAXIMUM_STABILITY, Math.max(MINIMUM_STABILITY, next));
    }
}
