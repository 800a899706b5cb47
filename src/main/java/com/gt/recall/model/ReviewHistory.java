package com.gt.recall.model;

import java.time.Instant;

public record ReviewHistory(String itemId,
                            String userId,
                            String sessionId,
                            RepetitionAlgorithm algorithm,
                            Difficulty difficulty,
                            Integer timeTakenSeconds,
                            Double confidence,
                            Instant reviewedAt) { }
