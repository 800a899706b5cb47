package com.gt.recall.algorithm;

import com.gt.recall.model.Difficulty;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;

@ExtendWith(SpringExtension.class)
public class ForgettingCurveTests {

    @Test
    public void testRetention() {
        assertEquals(1.0, ForgettingCurve.retention(0, 2.0), 1e-9);
        assertEquals(Math.exp(-1), ForgettingCurve.retention(1, 1.0), 1e-9);
        assertEquals(Math.exp(-0.5), ForgettingCurve.retention(5, 10.0), 1e-9);
    }

    @Test
    public void testNextStability() {
        assertEquals(0.5, ForgettingCurve.nextStability(1.0, Difficulty.AGAIN, 2.5), 1e-9);
        assertEquals(1.2, ForgettingCurve.nextStability(1.0, Difficulty.HARD, 2.5), 1e-9);
        assertEquals(2.5, ForgettingCurve.nextStability(1.0, Difficulty.GOOD, 2.5), 1e-9);
        assertEquals(3.25, ForgettingCurve.nextStability(1.0, Difficulty.EASY, 2.5), 1e-9);
    }

    @Test
    public void testStabilityBounds() {
        assertEquals(ForgettingCurve.MINIMUM_STABILITY, ForgettingCurve.nextStability(0.15, Difficulty.AGAIN, 2.5), 1e-9);
        assertEquals(ForgettingCurve.MAXIMUM_STABILITY, ForgettingCurve.nextStability(30000, Difficulty.EASY, 2.5), 1e-9);
    }
}
