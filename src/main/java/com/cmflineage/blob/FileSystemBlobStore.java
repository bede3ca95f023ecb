package com.cmflineage.blob;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cmflineage.identity.ContentHasher;

public class FileSystemBlobStore implements BlobStore {
    private static final Logger log = LoggerFactory.getLogger(FileSystemBlobStore.class);

    private final Path root;

    public FileSystemBlobStore(Path root) {
        this.root = root;
    }

    @Override
    public void put(String hash, byte[] bytes) throws IOException {
        String actual = ContentHasher.fingerprint(bytes);
        if (!actual.equals(hash)) {
            throw new HashMismatchException(hash, actual);
        }
        Path target = pathFor(hash);
        if (Files.exists(target)) {
            return;
        }
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), hash, ".part");
        try {
            Files.write(temp, bytes);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (FileAlreadyExistsException e) {
            log.debug("blob.put.raced hash={}", hash);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public void put(String hash, Path file) throws IOException {
        Path target = pathFor(hash);
        if (Files.exists(target)) {
            return;
        }
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), hash, ".part");
        try {
            Files.copy(file, temp, StandardCopyOption.REPLACE_EXISTING);
            String actual = ContentHasher.fingerprint(temp);
            if (!actual.equals(hash)) {
                throw new HashMismatchException(hash, actual);
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public Optional<byte[]> get(String hash) throws IOException {
        Path path = pathFor(hash);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(Files.readAllBytes(path));
    }

    @Override
    public boolean contains(String hash) {
        return Files.exists(pathFor(hash));
    }

    private Path pathFor(String hash) {
        if (!ContentHasher.isFingerprint(hash)) {
            throw new IllegalArgumentException("Not a SHA-256 content hash: " + hash);
        }
        return root.resolve(hash.substring(0, 2)).resolve(hash);
    }
}
