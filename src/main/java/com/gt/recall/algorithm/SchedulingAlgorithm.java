package com.gt.recall.algorithm;

import com.gt.recall.model.Difficulty;
import com.gt.recall.model.MemoryStrength;
import com.gt.recall.model.RepetitionAlgorithm;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * A spaced repetition schedule. Implementations are pure: no I/O and no mutable state, so a single instance can be
 * applied concurrently to different items.
 */
public interface SchedulingAlgorithm {

    RepetitionAlgorithm id();

    /**
     * Computes the state that follows a review.
     *
     * @param current    state before the review
     * @param difficulty the user's rating, never defaulted when missing
     * @param reviewedAt when the review happened; becomes the new last review time
     */
    AlgorithmResult apply(MemoryStrength current, Difficulty difficulty, Instant reviewedAt);

    default Map<Difficulty, Instant> previewNextDue(MemoryStrength current, Instant now) {
        Map<Difficulty, Instant> out = new EnumMap<>(Difficulty.class);
        for (Difficulty difficulty : Difficulty.values()) {
            out.put(difficulty, apply(current, difficulty, now).nextDue());
        }
        return out;
    }

    record AlgorithmResult(MemoryStrength strength,
                           Instant nextDue,
                           boolean leech) { }
}
