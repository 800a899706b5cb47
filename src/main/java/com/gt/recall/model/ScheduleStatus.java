package com.gt.recall.model;

public enum ScheduleStatus {
    ACTIVE,
    SUSPENDED,
    ARCHIVED   // owning item was deleted
}
