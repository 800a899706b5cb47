package com.gt.recall.exception;

// Thrown once retries against the schedule, history or session store are exhausted
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String errMsg)  {
        super(errMsg);
    }

    public StoreUnavailableException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
