package com.gt.recall.exception;

// Thrown when the content store does not know the item being scheduled
public class ItemNotFoundException extends RuntimeException {

    public ItemNotFoundException(String errMsg)  {
        super(errMsg);
    }

    public ItemNotFoundException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
