package com.gt.recall.notification;

public enum ReviewEventType {
    REVIEW_SCHEDULED,
    REVIEW_COMPLETED,
    LEECH_DETECTED,
    SESSION_ENDED
}
