package com.cmflineage.store;

public class LineageCycleException extends LineageException {
    public LineageCycleException(String message) {
        super(message);
    }
}
