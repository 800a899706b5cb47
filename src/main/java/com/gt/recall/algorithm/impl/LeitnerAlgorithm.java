package com.gt.recall.algorithm.impl;

import com.gt.recall.algorithm.AbstractSchedulingAlgorithm;
import com.gt.recall.model.Difficulty;
import com.gt.recall.model.MemoryStrength;
import com.gt.recall.model.RepetitionAlgorithm;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

// Box system: a pass moves the item up one box, a fail sends it back to the first box. Ease is not used.
@Component
public class LeitnerAlgorithm extends AbstractSchedulingAlgorithm {

    private final List<Integer> boxIntervalsDays;

    public LeitnerAlgorithm(@Value("${recall.algorithm.leitner.boxIntervalsDays:1,2,4,8,16}") List<Integer> boxIntervalsDays,
                            @Value("${recall.algorithm.maximumIntervalDays:3650}") int maximumIntervalDays) {
        super(maximumIntervalDays);

        if (boxIntervalsDays == null || boxIntervalsDays.isEmpty()) {
            throw new IllegalArgumentException("At least one Leitner box interval is required");
        }
        for (Integer days : boxIntervalsDays) {
            if (days == null || days < 1) {
                throw new IllegalArgumentException("Leitner box intervals must be at least one day: " + boxIntervalsDays);
            }
        }
        this.boxIntervalsDays = List.copyOf(boxIntervalsDays);
    }

    @Override
    public RepetitionAlgorithm id() {
        return RepetitionAlgorithm.LEITNER;
    }

    public int boxCount() {
        return boxIntervalsDays.size();
    }

    @Override
    protected Transition transition(MemoryStrength current, Difficulty difficulty) {
        int box = Math.min(current.leitnerBox(), boxCount());
        int reps = current.repetitions();

        if (difficulty == Difficulty.GOOD || difficulty == Difficulty.EASY) {
            box = Math.min(box + 1, boxCount());
            reps++;
        } else {
            box = 1;
            reps = 0;
        }

        return new Transition(MemoryStrength.DEFAULT_EASE_FACTOR, clampInterval(boxIntervalsDays.get(box - 1)), reps,
                current.learningStep(), box, null);
    }
}
