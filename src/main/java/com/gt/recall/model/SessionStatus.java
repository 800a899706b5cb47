package com.gt.recall.model;

public enum SessionStatus {
    NOT_STARTED,
    ACTIVE,
    ENDED
}
