package com.cmflineage.writer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cmflineage.blob.BlobStore;
import com.cmflineage.identity.ContentHasher;
import com.cmflineage.model.ArtifactKind;
import com.cmflineage.model.Context;
import com.cmflineage.model.EventDirection;
import com.cmflineage.model.Event;
import com.cmflineage.model.Execution;
import com.cmflineage.model.Pipeline;
import com.cmflineage.model.PropertyMaps;
import com.cmflineage.store.ArtifactResolution;
import com.cmflineage.store.GraphStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Mutation surface for one running pipeline process. A context must be created before an execution,
 * and an execution before artifacts are logged against it. Not thread-safe: one writer per process.
 */
public class LineageWriter {
    private static final Logger log = LoggerFactory.getLogger(LineageWriter.class);

    private final GraphStore store;
    private final BlobStore blobStore;
    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .build();

    private Context currentContext;
    private Execution currentExecution;

    public LineageWriter(GraphStore store) {
        this(store, null);
    }

    public LineageWriter(GraphStore store, BlobStore blobStore) {
        this.store = Objects.requireNonNull(store, "store");
        this.blobStore = blobStore;
    }

    public Context createContext(String pipelineName, String stageName, String type, Map<String, ?> properties) {
        Context context = store.transact(tx -> {
            Pipeline pipeline = tx.createPipeline(pipelineName);
            return tx.importContext(pipeline, stageName, type, PropertyMaps.stamp(properties, tx.now()), null, null,
                    conflict -> log.debug("context.property.overwritten stage={} key={}", stageName, conflict.key()));
        });
        currentContext = context;
        currentExecution = null;
        log.info("context.ready pipeline={} stage={} id={}", pipelineName, stageName, context.id());
        return context;
    }

    public Execution createExecution(String toolName, Map<String, ?> properties) {
        Context context = requireContext();
        Execution execution = store.createExecution(context, toolName, properties);
        currentExecution = execution;
        log.info("execution.created stage={} tool={} id={} uuid={}", context.stageName(), toolName, execution.id(), execution.uuid());
        return execution;
    }

    public Execution updateExecutionProperties(Map<String, ?> properties) {
        currentExecution = store.updateExecutionProperties(requireExecution(), properties);
        return currentExecution;
    }

    public LoggedArtifact logArtifact(Path path, EventDirection direction, ArtifactKind kind, Map<String, ?> properties) throws IOException {
        requireExecution();
        String hash = ContentHasher.fingerprint(path);
        if (blobStore != null) {
            blobStore.put(hash, path);
        }
        return record(hash, path.toString().replace('\\', '/'), direction, kind, properties);
    }

    public LoggedArtifact logArtifact(String logicalPath, byte[] content, EventDirection direction, ArtifactKind kind, Map<String, ?> properties) throws IOException {
        requireExecution();
        String hash = ContentHasher.fingerprint(content);
        if (blobStore != null) {
            blobStore.put(hash, content);
        }
        return record(hash, logicalPath, direction, kind, properties);
    }

    /**
     * Logs a metrics map as a METRIC artifact produced by the current execution. The content is the
     * key-sorted JSON form of the map, so equal metrics deduplicate like any other artifact.
     */
    public LoggedArtifact logMetrics(String name, Map<String, ?> metrics) throws IOException {
        Objects.requireNonNull(metrics, "metrics");
        byte[] content = canonicalMapper.writeValueAsBytes(new TreeMap<>(metrics));
        return logArtifact("metrics/" + name, content, EventDirection.OUTPUT, ArtifactKind.METRIC, metrics);
    }

    public Optional<Context> currentContext() {
        return Optional.ofNullable(currentContext);
    }

    public Optional<Execution> currentExecution() {
        return Optional.ofNullable(currentExecution);
    }

    private LoggedArtifact record(String hash, String logicalPath, EventDirection direction, ArtifactKind kind, Map<String, ?> properties) {
        Execution execution = requireExecution();
        LoggedArtifact logged = store.transact(tx -> {
            ArtifactResolution resolution = tx.getOrCreateArtifact(hash, logicalPath, kind, properties);
            Event event = tx.recordEvent(execution, resolution.artifact(), direction);
            List<LineageWarning> warnings = new ArrayList<>();
            if (resolution.pathContentChanged()) {
                warnings.add(new LineageWarning(LineageWarning.Kind.HASH_MISMATCH,
                        "Path " + logicalPath + " was recorded with hash " + resolution.previousPathHash()
                                + " and is now logged with hash " + hash));
            }
            return new LoggedArtifact(resolution.artifact(), event, resolution.created(), warnings);
        });
        for (LineageWarning warning : logged.warnings()) {
            log.warn("artifact.hash.mismatch path={} detail={}", logicalPath, warning.message());
        }
        log.info("artifact.logged path={} hash={} direction={} created={}", logicalPath, hash, direction, logged.created());
        return logged;
    }

    private Context requireContext() {
        if (currentContext == null) {
            throw new IllegalStateException("createContext must be called before creating an execution");
        }
        return currentContext;
    }

    private Execution requireExecution() {
        if (currentExecution == null) {
            throw new IllegalStateException("createExecution must be called before logging artifacts");
        }
        return currentExecution;
    }
}
