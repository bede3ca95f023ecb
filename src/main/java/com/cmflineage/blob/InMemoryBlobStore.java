package com.cmflineage.blob;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.cmflineage.identity.ContentHasher;

public class InMemoryBlobStore implements BlobStore {
    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public void put(String hash, byte[] bytes) {
        String actual = ContentHasher.fingerprint(bytes);
        if (!actual.equals(hash)) {
            throw new HashMismatchException(hash, actual);
        }
        blobs.putIfAbsent(hash, Arrays.copyOf(bytes, bytes.length));
    }

    @Override
    public Optional<byte[]> get(String hash) {
        byte[] bytes = blobs.get(hash);
        return bytes == null ? Optional.empty() : Optional.of(Arrays.copyOf(bytes, bytes.length));
    }

    @Override
    public boolean contains(String hash) {
        return blobs.containsKey(hash);
    }

    public int size() {
        return blobs.size();
    }
}
