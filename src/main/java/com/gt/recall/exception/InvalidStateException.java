package com.gt.recall.exception;

// Thrown when strength values or review metadata are negative, NaN or otherwise outside their valid range
public class InvalidStateException extends RuntimeException {

    public InvalidStateException(String errMsg)  {
        super(errMsg);
    }

    public InvalidStateException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
