package com.cmflineage.store;

public class LineageException extends RuntimeException {
    public LineageException(String message) {
        super(message);
    }

    public LineageException(String message, Throwable cause) {
        super(message, cause);
    }
}
