package com.gt.recall.exception;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String errMsg)  {
        super(errMsg);
    }

    public SessionNotFoundException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
