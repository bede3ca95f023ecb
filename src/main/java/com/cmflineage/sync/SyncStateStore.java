package com.cmflineage.sync;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;

public class SyncStateStore {
    private final ObjectMapper mapper = new ObjectMapper();
    private final Path path;

    public SyncStateStore(Path path) {
        this.path = path;
    }

    public SyncState load(String storeId) throws IOException {
        if (path == null || !Files.exists(path)) {
            SyncState state = new SyncState();
            state.storeId = storeId;
            return state;
        }
        SyncState state = mapper.readValue(path.toFile(), SyncState.class);
        if (state.storeId != null && !state.storeId.equals(storeId)) {
            throw new IllegalStateException("Sync state at " + path + " belongs to store " + state.storeId
                    + ", not " + storeId);
        }
        state.storeId = storeId;
        return state;
    }

    public void save(SyncState state) throws IOException {
        if (path == null) {
            return;
        }
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), state);
    }
}
