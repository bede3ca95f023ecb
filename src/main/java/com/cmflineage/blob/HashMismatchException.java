package com.cmflineage.blob;

import com.cmflineage.store.LineageException;

public class HashMismatchException extends LineageException {
    private final String expectedHash;
    private final String actualHash;

    public HashMismatchException(String expectedHash, String actualHash) {
        super("Content hash mismatch: expected " + expectedHash + " but content hashes to " + actualHash);
        this.expectedHash = expectedHash;
        this.actualHash = actualHash;
    }

    public String expectedHash() {
        return expectedHash;
    }

    public String actualHash() {
        return actualHash;
    }
}
