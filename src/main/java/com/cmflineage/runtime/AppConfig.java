package com.cmflineage.runtime;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private StoreConfig store = new StoreConfig();
    private SyncConfig sync = new SyncConfig();
    private ServerConfig server = new ServerConfig();
    private BlobConfig blob = new BlobConfig();

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    public SyncConfig getSync() {
        return sync;
    }

    public void setSync(SyncConfig sync) {
        this.sync = sync == null ? new SyncConfig() : sync;
    }

    public ServerConfig getServer() {
        return server;
    }

    public void setServer(ServerConfig server) {
        this.server = server == null ? new ServerConfig() : server;
    }

    public BlobConfig getBlob() {
        return blob;
    }

    public void setBlob(BlobConfig blob) {
        this.blob = blob == null ? new BlobConfig() : blob;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String id = "";
        private String snapshotPath = ".cmf/graph.json";

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getSnapshotPath() {
            return snapshotPath;
        }

        public void setSnapshotPath(String snapshotPath) {
            this.snapshotPath = snapshotPath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SyncConfig {
        private String centralUrl = "http://localhost:8080";
        private String statePath = ".cmf/sync-state.json";
        private int chunkSize = 500;
        private int maxRetries = 3;
        private long retryBackoffMs = 1000;
        private long timeoutMs = 30000;
        private long sessionTtlMs = 600000;
        private List<String> pipelines = new ArrayList<>();

        public String getCentralUrl() {
            return centralUrl;
        }

        public void setCentralUrl(String centralUrl) {
            this.centralUrl = centralUrl;
        }

        public String getStatePath() {
            return statePath;
        }

        public void setStatePath(String statePath) {
            this.statePath = statePath;
        }

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public long getSessionTtlMs() {
            return sessionTtlMs;
        }

        public void setSessionTtlMs(long sessionTtlMs) {
            this.sessionTtlMs = sessionTtlMs;
        }

        public List<String> getPipelines() {
            return pipelines;
        }

        public void setPipelines(List<String> pipelines) {
            this.pipelines = pipelines == null ? new ArrayList<>() : pipelines;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ServerConfig {
        private String host = "0.0.0.0";
        private int port = 8080;
        private int threads = 4;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BlobConfig {
        private String path = "";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }
}
