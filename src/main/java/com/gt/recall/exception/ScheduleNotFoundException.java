package com.gt.recall.exception;

public class ScheduleNotFoundException extends RuntimeException {

    public ScheduleNotFoundException(String errMsg)  {
        super(errMsg);
    }

    public ScheduleNotFoundException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
