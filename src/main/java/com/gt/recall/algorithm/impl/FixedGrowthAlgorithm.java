package com.gt.recall.algorithm.impl;

import com.gt.recall.algorithm.AbstractSchedulingAlgorithm;
import com.gt.recall.model.Difficulty;
import com.gt.recall.model.MemoryStrength;
import com.gt.recall.model.RepetitionAlgorithm;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

// Backs RepetitionAlgorithm.CUSTOM: intervals grow by a fixed factor and the ease factor is left untouched
@Component
public class FixedGrowthAlgorithm extends AbstractSchedulingAlgorithm {

    static final double EASY_MULTIPLIER = 1.3;

    private final double growthFactor;

    public FixedGrowthAlgorithm(@Value("${recall.algorithm.custom.growthFactor:2.0}") double growthFactor,
                                @Value("${recall.algorithm.maximumIntervalDays:3650}") int maximumIntervalDays) {
        super(maximumIntervalDays);

        if (Double.isNaN(growthFactor) || growthFactor < 1) {
            throw new IllegalArgumentException("growthFactor must be at least 1, was " + growthFactor);
        }
        this.growthFactor = growthFactor;
    }

    @Override
    public RepetitionAlgorithm id() {
        return RepetitionAlgorithm.CUSTOM;
    }

    @Override
    protected Transition transition(MemoryStrength current, Difficulty difficulty) {
        double ease = current.easeFactor();
        int interval = current.intervalDays();
        int reps = current.repetitions();

        return switch (difficulty) {
            case AGAIN -> Transition.days(current, ease, 1, 0);
            case HARD -> Transition.days(current, ease, interval, reps);
            case GOOD -> Transition.days(current, ease, clampInterval(interval * growthFactor), reps + 1);
            case EASY -> Transition.days(current, ease, clampInterval(interval * growthFactor * EASY_MULTIPLIER), reps + 1);
        };
    }
}
