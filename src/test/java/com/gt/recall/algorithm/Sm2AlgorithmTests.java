package com.gt.recall.algorithm;

import com.gt.recall.algorithm.SchedulingAlgorithm.AlgorithmResult;
import com.gt.recall.algorithm.impl.Sm2Algorithm;
import com.gt.recall.exception.InvalidDifficultyException;
import com.gt.recall.model.Difficulty;
import com.gt.recall.model.MemoryStrength;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(SpringExtension.class)
public class Sm2AlgorithmTests {

    private static final Instant REVIEW_INSTANT = Instant.parse("2024-03-01T09:00:00Z");

    private final Sm2Algorithm algorithm = new Sm2Algorithm(3650);

    @Test
    public void testGoodReviewSequence() {
        AlgorithmResult first = algorithm.apply(MemoryStrength.initial(), Difficulty.GOOD, REVIEW_INSTANT);
        assertEquals(1, first.strength().intervalDays());
        assertEquals(1, first.strength().repetitions());
        assertEquals(REVIEW_INSTANT.plus(Duration.ofDays(1)), first.nextDue());

        Instant secondReview = first.nextDue();
        AlgorithmResult second = algorithm.apply(first.strength(), Difficulty.GOOD, secondReview);
        assertEquals(6, second.strength().intervalDays());
        assertEquals(2, second.strength().repetitions());
        assertEquals(secondReview.plus(Duration.ofDays(6)), second.nextDue());

        AlgorithmResult third = algorithm.apply(second.strength(), Difficulty.GOOD, second.nextDue());
        assertEquals(15, third.strength().intervalDays());
        assertEquals(3, third.strength().repetitions());
        assertEquals(2.5, third.strength().easeFactor(), 1e-9);
        assertEquals(second.nextDue(), third.strength().lastReview());
    }

    @Test
    public void testAgainNeverDropsEaseBelowFloor() {
        MemoryStrength strength = MemoryStrength.initial();

        for (int i = 0; i < 20; i++) {
            strength = algorithm.apply(strength, Difficulty.AGAIN, REVIEW_INSTANT).strength();

            assertTrue(strength.easeFactor() >= MemoryStrength.MINIMUM_EASE_FACTOR);
            assertEquals(1, strength.intervalDays());
            assertEquals(0, strength.repetitions());
        }

        assertEquals(MemoryStrength.MINIMUM_EASE_FACTOR, strength.easeFactor(), 1e-9);
        assertEquals(20, strength.lapseStreak());
    }

    @Test
    public void testHard() {
        MemoryStrength strength = new MemoryStrength(2.5, 10, 3, 0.9, 1.0, null, 0, 1, 0);

        AlgorithmResult result = algorithm.apply(strength, Difficulty.HARD, REVIEW_INSTANT);

        assertEquals(6, result.strength().intervalDays());
        assertEquals(2.35, result.strength().easeFactor(), 1e-9);
        assertEquals(3, result.strength().repetitions());
    }

    @Test
    public void testHardOnShortIntervalKeepsOneDay() {
        AlgorithmResult result = algorithm.apply(MemoryStrength.initial(), Difficulty.HARD, REVIEW_INSTANT);

        assertEquals(1, result.strength().intervalDays());
    }

    @Test
    public void testEasy() {
        MemoryStrength strength = new MemoryStrength(2.5, 10, 3, 0.9, 1.0, null, 0, 1, 0);

        AlgorithmResult result = algorithm.apply(strength, Difficulty.EASY, REVIEW_INSTANT);

        assertEquals(32, result.strength().intervalDays());
        assertEquals(2.65, result.strength().easeFactor(), 1e-9);
        assertEquals(4, result.strength().repetitions());
        assertFalse(result.leech());
    }

    @Test
    public void testIntervalClampedToMaximum() {
        MemoryStrength strength = new MemoryStrength(2.5, 3000, 5, 0.9, 1.0, null, 0, 1, 0);

        assertEquals(3650, algorithm.apply(strength, Difficulty.GOOD, REVIEW_INSTANT).strength().intervalDays());
        assertEquals(3650, algorithm.apply(strength, Difficulty.EASY, REVIEW_INSTANT).strength().intervalDays());
    }

    @Test
    public void testSmallerMaximumInterval() {
        Sm2Algorithm shortCeiling = new Sm2Algorithm(5);

        MemoryStrength strength = new MemoryStrength(2.5, 1, 1, 0.9, 1.0, null, 0, 1, 0);

        assertEquals(5, shortCeiling.apply(strength, Difficulty.GOOD, REVIEW_INSTANT).strength().intervalDays());
    }

    @Test
    public void testForgettingCurveUpdated() {
        AlgorithmResult result = algorithm.apply(MemoryStrength.initial(), Difficulty.GOOD, REVIEW_INSTANT);

        assertEquals(2.5, result.strength().stability(), 1e-9);
        assertEquals(Math.exp(-1 / 2.5), result.strength().retentionRate(), 1e-9);
    }

    @Test
    public void testMissingDifficulty() {
        assertThrows(InvalidDifficultyException.class, () -> algorithm.apply(MemoryStrength.initial(), null, REVIEW_INSTANT));
    }

    @Test
    public void testPreviewNextDue() {
        Map<Difficulty, Instant> preview = algorithm.previewNextDue(MemoryStrength.initial(), REVIEW_INSTANT);

        assertEquals(REVIEW_INSTANT.plus(Duration.ofDays(1)), preview.get(Difficulty.AGAIN));
        assertEquals(REVIEW_INSTANT.plus(Duration.ofDays(1)), preview.get(Difficulty.HARD));
        assertEquals(REVIEW_INSTANT.plus(Duration.ofDays(1)), preview.get(Difficulty.GOOD));
        assertEquals(REVIEW_INSTANT.plus(Duration.ofDays(3)), preview.get(Difficulty.EASY));
    }
}
