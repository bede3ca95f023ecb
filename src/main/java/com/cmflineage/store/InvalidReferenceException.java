package com.cmflineage.store;

public class InvalidReferenceException extends LineageException {
    public InvalidReferenceException(String message) {
        super(message);
    }
}
