package com.gt.recall.model;

import com.gt.recall.exception.InvalidStateException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(SpringExtension.class)
public class MemoryStrengthTests {

    @Test
    public void testInitial() {
        MemoryStrength initial = MemoryStrength.initial();

        assertEquals(2.5, initial.easeFactor(), 1e-9);
        assertEquals(1, initial.intervalDays());
        assertEquals(0, initial.repetitions());
        assertEquals(1, initial.leitnerBox());
        assertTrue(initial.isNew());
    }

    @Test
    public void testValuesRaisedToFloor() {
        MemoryStrength strength = new MemoryStrength(1.0, 0, 0, 0.9, 1.0, null, 0, 0, 0);

        assertEquals(MemoryStrength.MINIMUM_EASE_FACTOR, strength.easeFactor(), 1e-9);
        assertEquals(1, strength.intervalDays());
        assertEquals(1, strength.leitnerBox());
    }

    @Test
    public void testEaseUnboundedAbove() {
        assertEquals(4.2, new MemoryStrength(4.2, 1, 0, 0.9, 1.0, null, 0, 1, 0).easeFactor(), 1e-9);
    }

    @Test
    public void testInvalidValues() {
        assertThrows(InvalidStateException.class, () -> new MemoryStrength(Double.NaN, 1, 0, 0.9, 1.0, null, 0, 1, 0));
        assertThrows(InvalidStateException.class, () -> new MemoryStrength(-2.5, 1, 0, 0.9, 1.0, null, 0, 1, 0));
        assertThrows(InvalidStateException.class, () -> new MemoryStrength(2.5, -1, 0, 0.9, 1.0, null, 0, 1, 0));
        assertThrows(InvalidStateException.class, () -> new MemoryStrength(2.5, 1, -1, 0.9, 1.0, null, 0, 1, 0));
        assertThrows(InvalidStateException.class, () -> new MemoryStrength(2.5, 1, 0, 1.5, 1.0, null, 0, 1, 0));
        assertThrows(InvalidStateException.class, () -> new MemoryStrength(2.5, 1, 0, 0.9, Double.POSITIVE_INFINITY, null, 0, 1, 0));
        assertThrows(InvalidStateException.class, () -> new MemoryStrength(2.5, 1, 0, 0.9, 0, null, 0, 1, 0));
    }
}
