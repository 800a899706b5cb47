package com.gt.recall.exception;

// Thrown when a stored row cannot be mapped back into a model object
public class DaoException extends RuntimeException {

    public DaoException(String errMsg)  {
        super(errMsg);
    }

    public DaoException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
