package com.cmflineage.runtime;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigDefaultsTest {

    @Test
    void shouldDefaultToLocalSnapshotAndBoundedRetries() {
        AppConfig config = new AppConfig();

        assertEquals("", config.getStore().getId());
        assertEquals(".cmf/graph.json", config.getStore().getSnapshotPath());
        assertEquals(500, config.getSync().getChunkSize());
        assertEquals(3, config.getSync().getMaxRetries());
        assertEquals(600000L, config.getSync().getSessionTtlMs());
        assertTrue(config.getSync().getPipelines().isEmpty());
        assertEquals(8080, config.getServer().getPort());
        assertEquals("", config.getBlob().getPath());
    }

    @Test
    void shouldReplaceMissingSectionsWithDefaults() {
        AppConfig config = new AppConfig();
        config.setSync(null);
        config.setStore(null);
        config.getSync().setPipelines(null);

        assertNotNull(config.getStore());
        assertEquals("http://localhost:8080", config.getSync().getCentralUrl());
        assertTrue(config.getSync().getPipelines().isEmpty());
    }
}
