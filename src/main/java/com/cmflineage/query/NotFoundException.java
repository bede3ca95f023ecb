package com.cmflineage.query;

import com.cmflineage.store.LineageException;

public class NotFoundException extends LineageException {
    public NotFoundException(String message) {
        super(message);
    }
}
