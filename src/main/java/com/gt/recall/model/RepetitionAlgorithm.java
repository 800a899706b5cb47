package com.gt.recall.model;

public enum RepetitionAlgorithm {
    SM2,
    ANKI,
    LEITNER,
    CUSTOM
}
