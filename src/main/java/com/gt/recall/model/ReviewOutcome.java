package com.gt.recall.model;

import com.gt.recall.exception.InvalidStateException;

// Caller supplied metadata recorded alongside a review. Every field is optional.
public record ReviewOutcome(String sessionId,
                            Integer timeTakenSeconds,
                            Double confidence) {

    public static final ReviewOutcome NONE = new ReviewOutcome(null, null, null);

    public ReviewOutcome {
        if (timeTakenSeconds != null && timeTakenSeconds < 0) {
            throw new InvalidStateException("timeTakenSeconds must not be negative: " + timeTakenSeconds);
        }
        if (confidence != null && (confidence.isNaN() || confidence < 0 || confidence > 1)) {
            throw new InvalidStateException("confidence must be within [0, 1]: " + confidence);
        }
    }
}
