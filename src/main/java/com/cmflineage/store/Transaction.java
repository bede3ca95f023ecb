package com.cmflineage.store;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Stream;

import com.cmflineage.identity.ContentHasher;
import com.cmflineage.identity.NodeId;
import com.cmflineage.model.Artifact;
import com.cmflineage.model.ArtifactKind;
import com.cmflineage.model.Context;
import com.cmflineage.model.Event;
import com.cmflineage.model.EventDirection;
import com.cmflineage.model.Execution;
import com.cmflineage.model.Pipeline;
import com.cmflineage.model.PropertyConflict;
import com.cmflineage.model.PropertyMaps;
import com.cmflineage.model.PropertyValue;

/**
 * A write transaction. Writes are staged in a private overlay and become visible to readers only when
 * {@link GraphStore} publishes the transaction; reads through this object see committed state plus the
 * staged writes.
 */
public final class Transaction implements GraphView {
    private final GraphState base;
    private final GraphState delta;
    private final Clock clock;
    private final CancellationToken token;
    private long sequence;
    private boolean open = true;

    Transaction(GraphState base, Clock clock, CancellationToken token) {
        this.base = base;
        this.delta = new GraphState(base.storeId(), base.revision());
        this.clock = clock;
        this.token = token;
        this.sequence = base.revision();
    }

    public Pipeline createPipeline(String name) {
        return importPipeline(name, null, null);
    }

    public Pipeline importPipeline(String name, Instant createdAt, NodeId origin) {
        requireText(name, "pipeline name");
        checkpoint();
        Optional<Pipeline> existing = pipelineByName(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        NodeId id = nextId();
        Pipeline pipeline = new Pipeline(id, name, orNow(createdAt), origin == null ? id : origin, id.sequence());
        delta.addPipeline(pipeline);
        return pipeline;
    }

    public Context getOrCreateContext(Pipeline pipeline, String stageName, String type) {
        return importContext(pipeline, stageName, type, Map.of(), null, null, conflict -> {
        });
    }

    public Context importContext(
            Pipeline pipeline,
            String stageName,
            String type,
            Map<String, PropertyValue> properties,
            Instant createdAt,
            NodeId origin,
            Consumer<PropertyConflict> conflicts) {
        Objects.requireNonNull(pipeline, "pipeline");
        requireText(stageName, "stage name");
        checkpoint();
        if (pipeline(pipeline.id()).isEmpty()) {
            throw new InvalidReferenceException("Unknown pipeline " + pipeline.id() + " (" + pipeline.name() + ")");
        }
        Optional<Context> existing = contextByStage(pipeline.id(), stageName);
        if (existing.isPresent()) {
            Context context = existing.get();
            Map<String, PropertyValue> merged = PropertyMaps.reconcile(context.properties(), properties,
                    pipeline.name() + "/" + stageName, conflicts);
            if (merged == context.properties()) {
                return context;
            }
            Context updated = context.withProperties(merged, nextSequence());
            delta.replaceContext(updated);
            return updated;
        }
        NodeId id = nextId();
        Context context = new Context(id, pipeline.id(), stageName, type == null || type.isBlank() ? stageName : type,
                properties, orNow(createdAt), origin == null ? id : origin, id.sequence());
        delta.addContext(context);
        return context;
    }

    public Execution createExecution(Context context, String toolName, Map<String, ?> properties) {
        Objects.requireNonNull(context, "context");
        return importExecution(context, toolName, UUID.randomUUID().toString(), null,
                PropertyMaps.stamp(properties, clock.instant()), null);
    }

    /**
     * Appends an execution node. Never merges with an existing execution; callers that receive
     * executions from another store look them up by origin first.
     */
    public Execution importExecution(
            Context context,
            String toolName,
            String uuid,
            Instant startedAt,
            Map<String, PropertyValue> properties,
            NodeId origin) {
        Objects.requireNonNull(context, "context");
        requireText(toolName, "tool name");
        requireText(uuid, "execution uuid");
        checkpoint();
        if (context(context.id()).isEmpty()) {
            throw new InvalidReferenceException("Unknown context " + context.id() + " (" + context.stageName() + ")");
        }
        if (origin != null && executionByOrigin(origin).isPresent()) {
            throw new IllegalStateException("Execution with origin " + origin + " already exists");
        }
        NodeId id = nextId();
        Execution execution = new Execution(id, context.id(), toolName, uuid, orNow(startedAt), properties,
                origin == null ? id : origin, id.sequence());
        delta.addExecution(execution);
        return execution;
    }

    public Execution updateExecutionProperties(NodeId executionId, Map<String, ?> properties) {
        checkpoint();
        Execution execution = execution(executionId)
                .orElseThrow(() -> new InvalidReferenceException("Unknown execution " + executionId));
        Map<String, PropertyValue> merged = PropertyMaps.overwrite(execution.properties(), PropertyMaps.stamp(properties, clock.instant()));
        if (merged == execution.properties()) {
            return execution;
        }
        Execution updated = execution.withProperties(merged, nextSequence());
        delta.replaceExecution(updated);
        return updated;
    }

    public Execution mergeExecutionProperties(NodeId executionId, Map<String, PropertyValue> properties, Consumer<PropertyConflict> conflicts) {
        checkpoint();
        Execution execution = execution(executionId)
                .orElseThrow(() -> new InvalidReferenceException("Unknown execution " + executionId));
        Map<String, PropertyValue> merged = PropertyMaps.reconcile(execution.properties(), properties,
                execution.origin().toString(), conflicts);
        if (merged == execution.properties()) {
            return execution;
        }
        Execution updated = execution.withProperties(merged, nextSequence());
        delta.replaceExecution(updated);
        return updated;
    }

    public ArtifactResolution getOrCreateArtifact(String hash, String logicalPath, ArtifactKind kind, Map<String, ?> properties) {
        Map<String, PropertyValue> stamped = PropertyMaps.stamp(properties, clock.instant());
        return resolveArtifact(hash, logicalPath, kind, stamped, null, (existing, incoming) -> PropertyMaps.addMissing(existing, incoming));
    }

    public ArtifactResolution mergeArtifact(
            String hash,
            String logicalPath,
            ArtifactKind kind,
            Map<String, PropertyValue> properties,
            Instant createdAt,
            Consumer<PropertyConflict> conflicts) {
        return resolveArtifact(hash, logicalPath, kind, properties, createdAt,
                (existing, incoming) -> PropertyMaps.reconcile(existing, incoming, hash, conflicts));
    }

    public Artifact updateArtifactProperties(NodeId artifactId, Map<String, ?> properties) {
        checkpoint();
        Artifact artifact = artifact(artifactId)
                .orElseThrow(() -> new InvalidReferenceException("Unknown artifact " + artifactId));
        Map<String, PropertyValue> merged = PropertyMaps.overwrite(artifact.properties(), PropertyMaps.stamp(properties, clock.instant()));
        if (merged == artifact.properties()) {
            return artifact;
        }
        Artifact updated = artifact.withProperties(merged, nextSequence());
        delta.replaceArtifact(updated);
        return updated;
    }

    /**
     * Records an edge. Recording an identical (execution, artifact, direction) edge again is a no-op
     * that returns the existing event. An edge that would close a cycle is rejected.
     */
    public Event recordEvent(Execution execution, Artifact artifact, EventDirection direction) {
        Objects.requireNonNull(execution, "execution");
        Objects.requireNonNull(artifact, "artifact");
        Objects.requireNonNull(direction, "direction");
        checkpoint();
        if (event(execution.id(), artifact.id(), direction).isEmpty() && closesCycle(execution.id(), artifact.id(), direction)) {
            throw new LineageCycleException("Recording " + artifact.logicalPath() + " as " + direction + " of execution "
                    + execution.id() + " would make the artifact its own ancestor");
        }
        return importEvent(execution.id(), artifact.id(), direction, null);
    }

    /**
     * Records an edge received from another store. Same idempotency as
     * {@link #recordEvent(Execution, Artifact, EventDirection)} without the cycle check; readers walk the
     * graph with a visited set.
     */
    public Event importEvent(NodeId executionId, NodeId artifactId, EventDirection direction, Instant timestamp) {
        Objects.requireNonNull(direction, "direction");
        checkpoint();
        if (execution(executionId).isEmpty()) {
            throw new InvalidReferenceException("Unknown execution " + executionId);
        }
        if (artifact(artifactId).isEmpty()) {
            throw new InvalidReferenceException("Unknown artifact " + artifactId);
        }
        Optional<Event> existing = event(executionId, artifactId, direction);
        if (existing.isPresent()) {
            return existing.get();
        }
        NodeId id = nextId();
        Event event = new Event(id, executionId, artifactId, direction, orNow(timestamp), id.sequence());
        delta.addEvent(event);
        return event;
    }

    public Instant now() {
        return clock.instant();
    }

    public void checkpoint() {
        if (!open) {
            throw new IllegalStateException("transaction is closed");
        }
        token.throwIfCancelled();
    }

    private ArtifactResolution resolveArtifact(
            String hash,
            String logicalPath,
            ArtifactKind kind,
            Map<String, PropertyValue> properties,
            Instant createdAt,
            PropertyMerge merge) {
        if (!ContentHasher.isFingerprint(hash)) {
            throw new IllegalArgumentException("Not a SHA-256 content hash: " + hash);
        }
        requireText(logicalPath, "logical path");
        Objects.requireNonNull(kind, "kind");
        checkpoint();
        String previousPathHash = latestHashForPath(logicalPath).orElse(null);
        Optional<Artifact> existing = artifactByHash(hash);
        if (existing.isPresent()) {
            Artifact artifact = existing.get();
            Map<String, PropertyValue> merged = merge.apply(artifact.properties(), properties);
            if (merged != artifact.properties()) {
                artifact = artifact.withProperties(merged, nextSequence());
                delta.replaceArtifact(artifact);
            }
            return new ArtifactResolution(artifact, false, previousPathHash);
        }
        NodeId id = nextId();
        Artifact artifact = new Artifact(id, hash, logicalPath, kind, properties, orNow(createdAt), id.sequence());
        delta.addArtifact(artifact);
        return new ArtifactResolution(artifact, true, previousPathHash);
    }

    public boolean closesCycle(NodeId executionId, NodeId artifactId, EventDirection direction) {
        // OUTPUT closes a cycle when the artifact is already upstream of the execution, INPUT when downstream.
        EventDirection walk = direction == EventDirection.OUTPUT ? EventDirection.INPUT : EventDirection.OUTPUT;
        EventDirection back = walk == EventDirection.INPUT ? EventDirection.OUTPUT : EventDirection.INPUT;
        Set<NodeId> seen = new HashSet<>();
        Deque<NodeId> pending = new ArrayDeque<>();
        pending.add(executionId);
        seen.add(executionId);
        while (!pending.isEmpty()) {
            NodeId current = pending.poll();
            for (Event edge : eventsOfExecution(current)) {
                if (edge.direction() != walk) {
                    continue;
                }
                if (edge.artifactId().equals(artifactId)) {
                    return true;
                }
                if (!seen.add(edge.artifactId())) {
                    continue;
                }
                for (Event next : eventsOfArtifact(edge.artifactId())) {
                    if (next.direction() == back && seen.add(next.executionId())) {
                        pending.add(next.executionId());
                    }
                }
            }
        }
        return false;
    }

    boolean hasChanges() {
        return !delta.isEmpty();
    }

    GraphState delta() {
        return delta;
    }

    long sequence() {
        return sequence;
    }

    void close() {
        open = false;
    }

    private NodeId nextId() {
        return NodeId.of(base.storeId(), nextSequence());
    }

    private long nextSequence() {
        sequence++;
        delta.advanceRevision(sequence);
        return sequence;
    }

    private Instant orNow(Instant instant) {
        return instant == null ? clock.instant() : instant;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    @FunctionalInterface
    private interface PropertyMerge {
        Map<String, PropertyValue> apply(Map<String, PropertyValue> existing, Map<String, PropertyValue> incoming);
    }

    @Override
    public String storeId() {
        return base.storeId();
    }

    @Override
    public long revision() {
        return sequence;
    }

    @Override
    public Optional<Pipeline> pipeline(NodeId id) {
        return delta.pipeline(id).or(() -> base.pipeline(id));
    }

    @Override
    public Optional<Pipeline> pipelineByName(String name) {
        return delta.pipelineByName(name).or(() -> base.pipelineByName(name));
    }

    @Override
    public List<Pipeline> pipelines() {
        return Stream.concat(base.pipelines().stream(), delta.pipelines().stream()).toList();
    }

    @Override
    public Optional<Context> context(NodeId id) {
        return delta.context(id).or(() -> base.context(id));
    }

    @Override
    public Optional<Context> contextByStage(NodeId pipelineId, String stageName) {
        return delta.contextByStage(pipelineId, stageName)
                .or(() -> base.contextByStage(pipelineId, stageName))
                .flatMap(context -> context(context.id()));
    }

    @Override
    public List<Context> contextsOf(NodeId pipelineId) {
        return concatIds(base.contextIdsOf(pipelineId), delta.contextIdsOf(pipelineId)).stream()
                .map(id -> context(id).orElseThrow())
                .toList();
    }

    @Override
    public Optional<Execution> execution(NodeId id) {
        return delta.execution(id).or(() -> base.execution(id));
    }

    @Override
    public Optional<Execution> executionByOrigin(NodeId origin) {
        return delta.executionByOrigin(origin)
                .or(() -> base.executionByOrigin(origin))
                .flatMap(execution -> execution(execution.id()));
    }

    @Override
    public List<Execution> executionsOf(NodeId contextId) {
        return concatIds(base.executionIdsOf(contextId), delta.executionIdsOf(contextId)).stream()
                .map(id -> execution(id).orElseThrow())
                .toList();
    }

    @Override
    public Optional<Artifact> artifact(NodeId id) {
        return delta.artifact(id).or(() -> base.artifact(id));
    }

    @Override
    public Optional<Artifact> artifactByHash(String hash) {
        return delta.artifactByHash(hash)
                .or(() -> base.artifactByHash(hash))
                .flatMap(artifact -> artifact(artifact.id()));
    }

    @Override
    public Optional<String> latestHashForPath(String logicalPath) {
        return delta.latestHashForPath(logicalPath).or(() -> base.latestHashForPath(logicalPath));
    }

    @Override
    public List<Artifact> artifacts() {
        Map<NodeId, Artifact> merged = new LinkedHashMap<>();
        base.artifacts().forEach(artifact -> merged.put(artifact.id(), artifact));
        delta.artifacts().forEach(artifact -> merged.put(artifact.id(), artifact));
        return List.copyOf(merged.values());
    }

    @Override
    public Optional<Event> event(NodeId executionId, NodeId artifactId, EventDirection direction) {
        return delta.event(executionId, artifactId, direction).or(() -> base.event(executionId, artifactId, direction));
    }

    @Override
    public List<Event> eventsOfExecution(NodeId executionId) {
        return Stream.concat(base.eventsOfExecution(executionId).stream(), delta.eventsOfExecution(executionId).stream()).toList();
    }

    @Override
    public List<Event> eventsOfArtifact(NodeId artifactId) {
        return Stream.concat(base.eventsOfArtifact(artifactId).stream(), delta.eventsOfArtifact(artifactId).stream()).toList();
    }

    @Override
    public List<Event> events() {
        return Stream.concat(base.events().stream(), delta.events().stream()).toList();
    }

    private static List<NodeId> concatIds(List<NodeId> first, List<NodeId> second) {
        if (second.isEmpty()) {
            return first;
        }
        List<NodeId> all = new ArrayList<>(first.size() + second.size());
        all.addAll(first);
        all.addAll(second);
        return all;
    }
}
