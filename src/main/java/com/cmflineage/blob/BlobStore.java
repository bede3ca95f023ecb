package com.cmflineage.blob;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

public interface BlobStore {
    void put(String hash, byte[] bytes) throws IOException;

    default void put(String hash, Path file) throws IOException {
        put(hash, Files.readAllBytes(file));
    }

    Optional<byte[]> get(String hash) throws IOException;

    boolean contains(String hash) throws IOException;
}
