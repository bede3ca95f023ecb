package com.cmflineage.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * JSON snapshot of a store on disk. Writes go to a sibling temp file that is moved over the target, so a
 * crash mid-write leaves the previous snapshot intact.
 */
public class GraphSnapshotFile {
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .build();
    private final Path path;

    public GraphSnapshotFile(Path path) {
        this.path = path;
    }

    public Optional<GraphSnapshot> load() throws IOException {
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(path.toFile(), GraphSnapshot.class));
    }

    public void save(GraphSnapshot snapshot) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (java.nio.file.AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public Path path() {
        return path;
    }
}
