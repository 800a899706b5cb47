package com.gt.recall.exception;

// Thrown when a review is recorded against a session that has already ended
public class SessionClosedException extends RuntimeException {

    public SessionClosedException(String errMsg)  {
        super(errMsg);
    }

    public SessionClosedException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
