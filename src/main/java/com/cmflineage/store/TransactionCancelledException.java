package com.cmflineage.store;

public class TransactionCancelledException extends LineageException {
    public TransactionCancelledException(String message) {
        super(message);
    }
}
