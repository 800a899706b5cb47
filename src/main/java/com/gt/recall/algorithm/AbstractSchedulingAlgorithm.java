package com.gt.recall.algorithm;

import com.gt.recall.exception.InvalidStateException;
import com.gt.recall.model.Difficulty;
import com.gt.recall.model.MemoryStrength;

import java.time.Duration;
import java.time.Instant;

/**
 * Shared bookkeeping for the concrete schedules. Subclasses only decide ease, interval, repetitions and their own
 * phase fields; the forgetting curve, lapse streak and due date are derived here so every algorithm reports them
 * the same way.
 */
public abstract class AbstractSchedulingAlgorithm implements SchedulingAlgorithm {

    private static final double MINUTES_PER_DAY = 1440;

    protected final int maximumIntervalDays;

    protected AbstractSchedulingAlgorithm(int maximumIntervalDays) {
        if (maximumIntervalDays < MemoryStrength.MINIMUM_INTERVAL_DAYS) {
            throw new IllegalArgumentException("maximumIntervalDays must be at least 1, was " + maximumIntervalDays);
        }
        this.maximumIntervalDays = maximumIntervalDays;
    }

    @Override
    public final AlgorithmResult apply(MemoryStrength current, Difficulty difficulty, Instant reviewedAt) {
        if (current == null) {
            throw new InvalidStateException("Current memory strength is required");
        }
        Difficulty.require(difficulty);
        if (reviewedAt == null) {
            throw new IllegalArgumentException("reviewedAt is required");
        }

        Transition transition = transition(current, difficulty);

        int lapseStreak = switch (difficulty) {
            case AGAIN -> current.lapseStreak() + 1;
            case HARD -> current.lapseStreak();
            case GOOD, EASY -> 0;
        };

        Duration dueAfter = transition.dueAfter() != null
                ? transition.dueAfter()
                : Duration.ofDays(transition.intervalDays());

        double stability = ForgettingCurve.nextStability(current.stability(), difficulty, transition.easeFactor());
        double retention = ForgettingCurve.retention(dueAfter.toMinutes() / MINUTES_PER_DAY, stability);

        MemoryStrength next = new MemoryStrength(
                transition.easeFactor(),
                transition.intervalDays(),
                transition.repetitions(),
                retention,
                stability,
                reviewedAt,
                transition.learningStep(),
                transition.leitnerBox(),
                lapseStreak);

        return new AlgorithmResult(next, reviewedAt.plus(dueAfter), isLeech(next));
    }

    protected abstract Transition transition(MemoryStrength current, Difficulty difficulty);

    protected boolean isLeech(MemoryStrength next) {
        return false;
    }

    // Floors a computed interval and keeps it within [1, maximumIntervalDays]
    protected int clampInterval(double days) {
        if (Double.isNaN(days) || days < MemoryStrength.MINIMUM_INTERVAL_DAYS) {
            return MemoryStrength.MINIMUM_INTERVAL_DAYS;
        }
        if (days >= maximumIntervalDays) {
            return maximumIntervalDays;
        }
        return (int) Math.floor(days);
    }

    protected static double decreaseEase(double easeFactor, double amount) {
        return Math.max(MemoryStrength.MINIMUM_EASE_FACTOR, easeFactor - amount);
    }

    /**
     * @param dueAfter delay until the next review when it is shorter than a day (learning steps), otherwise null and
     *                 the item is due {@code intervalDays} after the review
     */
    public record Transition(double easeFactor,
                             int intervalDays,
                             int repetitions,
                             int learningStep,
                             int leitnerBox,
                             Duration dueAfter) {

        public static Transition days(MemoryStrength current, double easeFactor, int intervalDays, int repetitions) {
            return new Transition(easeFactor, intervalDays, repetitions, current.learningStep(), current.leitnerBox(), null);
        }
    }
}
