package com.gt.recall.model;

import com.gt.recall.exception.InvalidDifficultyException;

public enum Difficulty {
    AGAIN,
    HARD,
    GOOD,
    EASY;

    // Anything but a complete failure counts as recalled
    public boolean isRecalled() {
        return this != AGAIN;
    }

    // Only GOOD and EASY count towards retention
    public boolean isRetained() {
        return this == GOOD || this == EASY;
    }

    public static Difficulty require(Difficulty difficulty) {
        if (difficulty == null) {
            throw new InvalidDifficultyException("A review difficulty is required");
        }

        return difficulty;
    }
}
