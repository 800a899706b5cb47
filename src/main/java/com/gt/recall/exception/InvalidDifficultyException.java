package com.gt.recall.exception;

// Thrown when a review is submitted without a recognized difficulty rating
public class InvalidDifficultyException extends RuntimeException {

    public InvalidDifficultyException(String errMsg)  {
        super(errMsg);
    }

    public InvalidDifficultyException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
