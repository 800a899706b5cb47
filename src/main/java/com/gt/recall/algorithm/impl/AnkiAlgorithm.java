package com.gt.recall.algorithm.impl;

import com.gt.recall.algorithm.AbstractSchedulingAlgorithm;
import com.gt.recall.model.Difficulty;
import com.gt.recall.model.MemoryStrength;
import com.gt.recall.model.RepetitionAlgorithm;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Anki style schedule. A new or lapsed item walks through the configured learning steps (minutes) before it
 * graduates into day based review intervals. An item whose consecutive lapses exceed the leech threshold is flagged.
 */
@Component
public class AnkiAlgorithm extends AbstractSchedulingAlgorithm {

    static final double HARD_EASE_PENALTY = 0.15;
    static final double EASY_EASE_BONUS = 0.15;
    static final double EASY_INTERVAL_FACTOR = 1.3;

    private final List<Integer> learningStepsMinutes;
    private final int graduatingIntervalDays;
    private final int easyIntervalDays;
    private final double againPenalty;
    private final double hardIntervalFactor;
    private final double easyBonus;
    private final int leechThreshold;

    public AnkiAlgorithm(@Value("${recall.algorithm.anki.learningStepsMinutes:1,10}") List<Integer> learningStepsMinutes,
                         @Value("${recall.algorithm.anki.graduatingIntervalDays:1}") int graduatingIntervalDays,
                         @Value("${recall.algorithm.anki.easyIntervalDays:4}") int easyIntervalDays,
                         @Value("${recall.algorithm.anki.againPenalty:0.2}") double againPenalty,
                         @Value("${recall.algorithm.anki.hardIntervalFactor:1.2}") double hardIntervalFactor,
                         @Value("${recall.algorithm.anki.easyBonus:1.3}") double easyBonus,
                         @Value("${recall.algorithm.anki.leechThreshold:8}") int leechThreshold,
                         @Value("${recall.algorithm.maximumIntervalDays:3650}") int maximumIntervalDays) {
        super(maximumIntervalDays);

        if (learningStepsMinutes != null) {
            for (Integer step : learningStepsMinutes) {
                if (step == null || step < 1) {
                    throw new IllegalArgumentException("Learning steps must be at least one minute: " + learningStepsMinutes);
                }
            }
        }
        if (graduatingIntervalDays < 1 || easyIntervalDays < 1) {
            throw new IllegalArgumentException("Graduating and easy intervals must be at least one day");
        }
        if (againPenalty < 0 || hardIntervalFactor < 1 || easyBonus < 1 || leechThreshold < 1) {
            throw new IllegalArgumentException("Invalid Anki configuration");
        }

        this.learningStepsMinutes = learningStepsMinutes == null ? List.of() : List.copyOf(learningStepsMinutes);
        this.graduatingIntervalDays = graduatingIntervalDays;
        this.easyIntervalDays = easyIntervalDays;
        this.againPenalty = againPenalty;
        this.hardIntervalFactor = hardIntervalFactor;
        this.easyBonus = easyBonus;
        this.leechThreshold = leechThreshold;
    }

    @Override
    public RepetitionAlgorithm id() {
        return RepetitionAlgorithm.ANKI;
    }

    @Override
    protected Transition transition(MemoryStrength current, Difficulty difficulty) {
        if (difficulty == Difficulty.AGAIN) {
            return relearn(current);
        }

        return current.repetitions() == 0
                ? learning(current, difficulty)
                : review(current, difficulty);
    }

    @Override
    protected boolean isLeech(MemoryStrength next) {
        return next.lapseStreak() > leechThreshold;
    }

    private Transition relearn(MemoryStrength current) {
        double ease = decreaseEase(current.easeFactor(), againPenalty);
        return new Transition(ease, 1, 0, 0, current.leitnerBox(), stepDelay(0));
    }

    private Transition learning(MemoryStrength current, Difficulty difficulty) {
        double ease = current.easeFactor();
        int step = Math.min(current.learningStep(), Math.max(0, learningStepsMinutes.size() - 1));

        switch (difficulty) {
            case HARD:
                return new Transition(ease, 1, 0, step, current.leitnerBox(), stepDelay(step));
            case GOOD:
                int nextStep = step + 1;
                if (nextStep < learningStepsMinutes.size()) {
                    return new Transition(ease, 1, 0, nextStep, current.leitnerBox(), stepDelay(nextStep));
                }
                return graduate(current, clampInterval(graduatingIntervalDays));
            default:
                return graduate(current, clampInterval(easyIntervalDays));
        }
    }

    private Transition review(MemoryStrength current, Difficulty difficulty) {
        double ease = current.easeFactor();
        int interval = current.intervalDays();
        int reps = current.repetitions() + 1;

        return switch (difficulty) {
            case HARD -> Transition.days(current, decreaseEase(ease, HARD_EASE_PENALTY),
                    clampInterval(interval * hardIntervalFactor), reps);
            case EASY -> Transition.days(current, ease + EASY_EASE_BONUS,
                    clampInterval(interval * ease * EASY_INTERVAL_FACTOR * easyBonus), reps);
            default -> Transition.days(current, ease,
                    clampInterval(Math.max(interval + 1, Math.floor(interval * ease))), reps);
        };
    }

    private Transition graduate(MemoryStrength current, int intervalDays) {
        return new Transition(current.easeFactor(), intervalDays, 1, 0, current.leitnerBox(), null);
    }

    private Duration stepDelay(int step) {
        if (learningStepsMinutes.isEmpty()) {
            return Duration.ofDays(1);
        }
        return Duration.ofMinutes(learningStepsMinutes.get(step));
    }
}
