package com.cmflineage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cmflineage.blob.BlobStore;
import com.cmflineage.blob.FileSystemBlobStore;
import com.cmflineage.blob.InMemoryBlobStore;
import com.cmflineage.model.ArtifactKind;
import com.cmflineage.model.EventDirection;
import com.cmflineage.model.Execution;
import com.cmflineage.query.QueryEngine;
import com.cmflineage.runtime.AppConfig;
import com.cmflineage.server.CentralHttpServer;
import com.cmflineage.store.GraphStore;
import com.cmflineage.store.LineageException;
import com.cmflineage.sync.CentralSyncService;
import com.cmflineage.sync.HttpSyncTransport;
import com.cmflineage.sync.PipelineSyncStatus;
import com.cmflineage.sync.PullRequest;
import com.cmflineage.sync.PushReceipt;
import com.cmflineage.sync.SiteSynchronizer;
import com.cmflineage.sync.SyncBatch;
import com.cmflineage.sync.SyncRetrier;
import com.cmflineage.sync.SyncStateStore;
import com.cmflineage.sync.SyncTransport;
import com.cmflineage.writer.LineageWarning;
import com.cmflineage.writer.LineageWriter;
import com.cmflineage.writer.LoggedArtifact;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "cmf-lineage",
        mixinStandardHelpOptions = true,
        version = "cmf-lineage 0.1.0",
        description = "Metadata lineage store with push/pull synchronization to a central store.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "status")
    Mode mode;

    @Option(names = { "-p", "--pipeline" }, description = "Pipeline to sync or log into; repeatable. Defaults to sync.pipelines from config")
    List<String> pipelines;

    @Option(names = { "-e", "--execution" }, description = "Push or pull only the execution with this uuid; needs exactly one --pipeline")
    String execution;

    @Option(names = "--stage", description = "Stage name for artifact mode")
    String stage;

    @Option(names = "--tool", description = "Tool name of the execution recorded in artifact mode", defaultValue = "cmf-lineage")
    String tool;

    @Option(names = "--file", description = "File to record in artifact mode")
    Path file;

    @Option(names = "--direction", description = "Event direction for artifact mode: ${COMPLETION-CANDIDATES}", defaultValue = "OUTPUT")
    EventDirection direction;

    @Option(names = "--kind", description = "Artifact kind for artifact mode: ${COMPLETION-CANDIDATES}", defaultValue = "DATASET")
    ArtifactKind kind;

    @Option(names = "--port", description = "Overrides server.port in serve mode")
    Integer port;

    private final Clock clock;

    enum Mode {
        serve,
        push,
        pull,
        status,
        pipelines,
        artifact
    }

    public Main() {
        this(Clock.systemUTC());
    }

    Main(Clock clock) {
        this.clock = clock;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        log.info("Starting cmf-lineage in {} mode", mode);
        log.info("Using config file: {}", configPath);

        try {
            return switch (mode) {
                case serve -> serve(config);
                case push -> push(config);
                case pull -> pull(config);
                case status -> status(config);
                case pipelines -> pipelines(config);
                case artifact -> logArtifact(config);
            };
        } catch (LineageException e) {
            log.error("{} failed: {}", mode, e.getMessage());
            return 1;
        }
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }

    private int serve(AppConfig config) throws IOException, InterruptedException {
        GraphStore store = openStore(config);
        AppConfig.SyncConfig sync = config.getSync();
        CentralSyncService central = new CentralSyncService(store,
                Duration.ofMillis(sync.getSessionTtlMs()), Duration.ofMillis(sync.getTimeoutMs()));
        AppConfig.ServerConfig serverConfig = config.getServer();
        CountDownLatch stopped = new CountDownLatch(1);
        try (CentralHttpServer server = new CentralHttpServer(central, serverConfig.getHost(),
                port == null ? serverConfig.getPort() : port, serverConfig.getThreads())) {
            Runtime.getRuntime().addShutdownHook(new Thread(stopped::countDown, "cmf-lineage-shutdown"));
            server.start();
            stopped.await();
        }
        return 0;
    }

    private int push(AppConfig config) throws IOException, InterruptedException {
        List<String> selected = selectedPipelines(config);
        if (execution != null && selected.size() != 1) {
            log.error("--execution requires exactly one --pipeline");
            return 2;
        }
        SiteSynchronizer synchronizer = synchronizer(config);
        SiteSynchronizer.PushOutcome outcome = execution == null
                ? synchronizer.push(selected)
                : synchronizer.pushExecution(selected.get(0), execution);
        log.info("Pushed pipelines={} entries={} centralRevision={}",
                outcome.pipelines(),
                outcome.entriesSent(),
                outcome.sent() ? outcome.receipt().centralRevision() : "unchanged");
        return 0;
    }

    private int pull(AppConfig config) throws IOException, InterruptedException {
        List<String> selected = selectedPipelines(config);
        if (execution != null && selected.size() != 1) {
            log.error("--execution requires exactly one --pipeline");
            return 2;
        }
        SiteSynchronizer synchronizer = synchronizer(config);
        SiteSynchronizer.PullOutcome outcome = execution == null
                ? synchronizer.pull(selected)
                : synchronizer.pullExecution(selected.get(0), execution);
        log.info("Pulled pipelines={} entries={}", outcome.pipelines(), outcome.entriesReceived());
        return 0;
    }

    private int status(AppConfig config) throws IOException {
        GraphStore store = openStore(config);
        SiteSynchronizer synchronizer = new SiteSynchronizer(store, unavailableTransport(),
                stateStore(config), SyncRetrier.none());
        Map<String, PipelineSyncStatus> statuses = synchronizer.statuses();
        if (statuses.isEmpty()) {
            log.info("No pipelines in store {}", store.storeId());
        }
        statuses.forEach((pipeline, status) -> log.info("Pipeline {} status={} pushedRevision={} pulledRevision={}",
                pipeline,
                status,
                synchronizer.pushedRevision(pipeline),
                synchronizer.pulledRevision(pipeline)));
        return 0;
    }

    private int pipelines(AppConfig config) throws IOException {
        GraphStore store = openStore(config);
        QueryEngine queries = new QueryEngine(store);
        List<String> names = queries.listPipelines().toList();
        names.forEach(name -> log.info("Pipeline {}", name));
        log.info("Store {} holds {} pipelines at revision {}", store.storeId(), names.size(), store.revision());
        return 0;
    }

    private int logArtifact(AppConfig config) throws IOException {
        List<String> selected = selectedPipelines(config);
        if (selected.size() != 1 || stage == null || stage.isBlank() || file == null) {
            log.error("--pipeline (exactly one), --stage and --file are required in artifact mode");
            return 2;
        }
        if (!Files.isRegularFile(file)) {
            log.error("Invalid --file: {}", file.toAbsolutePath().normalize());
            return 2;
        }
        LineageWriter writer = new LineageWriter(openStore(config), openBlobStore(config));
        writer.createContext(selected.get(0), stage, stage, Map.of());
        Execution recorded = writer.createExecution(tool, Map.of());
        LoggedArtifact logged = writer.logArtifact(file, direction, kind, Map.of());
        for (LineageWarning warning : logged.warnings()) {
            log.warn("{}: {}", warning.kind(), warning.message());
        }
        log.info("Recorded artifact hash={} path={} direction={} execution={} deduplicated={}",
                logged.artifact().hash(),
                logged.artifact().logicalPath(),
                direction,
                recorded.uuid(),
                logged.deduplicated());
        return 0;
    }

    private List<String> selectedPipelines(AppConfig config) {
        if (pipelines != null && !pipelines.isEmpty()) {
            return pipelines;
        }
        return config.getSync().getPipelines();
    }

    private GraphStore openStore(AppConfig config) throws IOException {
        AppConfig.StoreConfig storeConfig = config.getStore();
        String snapshotPath = storeConfig.getSnapshotPath();
        boolean generatedId = storeConfig.getId() == null || storeConfig.getId().isBlank();
        if (snapshotPath == null || snapshotPath.isBlank()) {
            return GraphStore.inMemory(generatedId ? GraphStore.newStoreId() : storeConfig.getId(), clock);
        }
        if (generatedId) {
            return GraphStore.open(Path.of(snapshotPath), clock);
        }
        return GraphStore.open(storeConfig.getId(), Path.of(snapshotPath), clock);
    }

    private BlobStore openBlobStore(AppConfig config) {
        String path = config.getBlob().getPath();
        if (path == null || path.isBlank()) {
            return new InMemoryBlobStore();
        }
        return new FileSystemBlobStore(Path.of(path));
    }

    private SyncStateStore stateStore(AppConfig config) {
        String statePath = config.getSync().getStatePath();
        return new SyncStateStore(statePath == null || statePath.isBlank() ? null : Path.of(statePath));
    }

    private SiteSynchronizer synchronizer(AppConfig config) throws IOException {
        AppConfig.SyncConfig sync = config.getSync();
        SyncTransport transport = HttpSyncTransport.create(sync.getCentralUrl(), Duration.ofMillis(sync.getTimeoutMs()),
                sync.getChunkSize());
        SyncRetrier retrier = new SyncRetrier(sync.getMaxRetries(), Duration.ofMillis(sync.getRetryBackoffMs()));
        return new SiteSynchronizer(openStore(config), transport, stateStore(config), retrier);
    }

    private static SyncTransport unavailableTransport() {
        return new SyncTransport() {
            @Override
            public PushReceipt push(SyncBatch batch) {
                throw new UnsupportedOperationException("status mode does not transmit");
            }

            @Override
            public SyncBatch pull(PullRequest request) {
                throw new UnsupportedOperationException("status mode does not transmit");
            }
        };
    }
}
