package com.gt.recall.model;

import com.gt.recall.exception.InvalidStateException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

@ExtendWith(SpringExtension.class)
public class ReviewOutcomeTests {

    @Test
    public void testValidOutcome() {
        assertDoesNotThrow(() -> new ReviewOutcome("session-1", 0, 0.0));
        assertDoesNotThrow(() -> new ReviewOutcome(null, 30, 1.0));
    }

    @Test
    public void testMalformedOutcome() {
        assertThrows(InvalidStateException.class, () -> new ReviewOutcome(null, -1, null));
        assertThrows(InvalidStateException.class, () -> new ReviewOutcome(null, null, 1.5));
        assertThrows(InvalidStateException.class, () -> new ReviewOutcome(null, null, -0.1));
        assertThrows(InvalidStateException.class, () -> new ReviewOutcome(null, null, Double.NaN));
    }
}
