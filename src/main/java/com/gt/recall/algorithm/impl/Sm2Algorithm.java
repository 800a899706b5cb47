package com.gt.recall.algorithm.impl;

import com.gt.recall.algorithm.AbstractSchedulingAlgorithm;
import com.gt.recall.model.Difficulty;
import com.gt.recall.model.MemoryStrength;
import com.gt.recall.model.RepetitionAlgorithm;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class Sm2Algorithm extends AbstractSchedulingAlgorithm {

    static final double AGAIN_EASE_PENALTY = 0.2;
    static final double HARD_EASE_PENALTY = 0.15;
    static final double EASY_EASE_BONUS = 0.15;
    static final double HARD_INTERVAL_FACTOR = 0.6;
    static final double EASY_INTERVAL_FACTOR = 1.3;
    static final int SECOND_INTERVAL_DAYS = 6;

    public Sm2Algorithm(@Value("${recall.algorithm.maximumIntervalDays:3650}") int maximumIntervalDays) {
        super(maximumIntervalDays);
    }

    @Override
    public RepetitionAlgorithm id() {
        return RepetitionAlgorithm.SM2;
    }

    @Override
    protected Transition transition(MemoryStrength current, Difficulty difficulty) {
        double ease = current.easeFactor();
        int interval = current.intervalDays();
        int reps = current.repetitions();

        return switch (difficulty) {
            case AGAIN -> Transition.days(current, decreaseEase(ease, AGAIN_EASE_PENALTY), 1, 0);
            case HARD -> Transition.days(current, decreaseEase(ease, HARD_EASE_PENALTY), clampInterval(interval * HARD_INTERVAL_FACTOR), reps);
            case GOOD -> Transition.days(current, ease, goodInterval(interval, ease, reps), reps + 1);
            case EASY -> Transition.days(current, ease + EASY_EASE_BONUS, clampInterval(interval * ease * EASY_INTERVAL_FACTOR), reps + 1);
        };
    }

    private int goodInterval(int interval, double ease, int reps) {
        if (reps == 0) {
            return 1;
        } else if (reps == 1) {
            return Math.min(SECOND_INTERVAL_DAYS, maximumIntervalDays);
        } else {
            return clampInterval(interval * ease);
        }
    }
}
