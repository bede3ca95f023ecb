package com.cmflineage.store;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.cmflineage.identity.NodeId;
import com.cmflineage.model.Artifact;
import com.cmflineage.model.Context;
import com.cmflineage.model.Event;
import com.cmflineage.model.EventDirection;
import com.cmflineage.model.Execution;
import com.cmflineage.model.Pipeline;

/**
 * Entity tables and their indexes. Used both for committed state and for the private overlay of an
 * open transaction; not thread-safe on its own.
 */
final class GraphState implements GraphView {
    private final String storeId;
    private long revision;

    private final Map<NodeId, Pipeline> pipelines = new LinkedHashMap<>();
    private final Map<String, NodeId> pipelineByName = new HashMap<>();

    private final Map<NodeId, Context> contexts = new LinkedHashMap<>();
    private final Map<StageKey, NodeId> contextByStage = new HashMap<>();
    private final Map<NodeId, List<NodeId>> contextsByPipeline = new HashMap<>();

    private final Map<NodeId, Execution> executions = new LinkedHashMap<>();
    private final Map<NodeId, NodeId> executionByOrigin = new HashMap<>();
    private final Map<NodeId, List<NodeId>> executionsByContext = new HashMap<>();

    private final Map<NodeId, Artifact> artifacts = new LinkedHashMap<>();
    private final Map<String, NodeId> artifactByHash = new HashMap<>();
    private final Map<String, String> latestHashByPath = new HashMap<>();

    private final Map<NodeId, Event> events = new LinkedHashMap<>();
    private final Map<EventKey, NodeId> eventByKey = new HashMap<>();
    private final Map<NodeId, List<NodeId>> eventsByExecution = new HashMap<>();
    private final Map<NodeId, List<NodeId>> eventsByArtifact = new HashMap<>();

    GraphState(String storeId, long revision) {
        NodeId.validateStoreId(storeId);
        this.storeId = storeId;
        this.revision = revision;
    }

    void addPipeline(Pipeline pipeline) {
        pipelines.put(pipeline.id(), pipeline);
        pipelineByName.put(pipeline.name(), pipeline.id());
    }

    void addContext(Context context) {
        contexts.put(context.id(), context);
        contextByStage.put(new StageKey(context.pipelineId(), context.stageName()), context.id());
        contextsByPipeline.computeIfAbsent(context.pipelineId(), unused -> new ArrayList<>()).add(context.id());
    }

    void replaceContext(Context context) {
        contexts.put(context.id(), context);
    }

    void addExecution(Execution execution) {
        executions.put(execution.id(), execution);
        executionByOrigin.put(execution.origin(), execution.id());
        executionsByContext.computeIfAbsent(execution.contextId(), unused -> new ArrayList<>()).add(execution.id());
    }

    void replaceExecution(Execution execution) {
        executions.put(execution.id(), execution);
    }

    void addArtifact(Artifact artifact) {
        artifacts.put(artifact.id(), artifact);
        artifactByHash.put(artifact.hash(), artifact.id());
        latestHashByPath.put(artifact.logicalPath(), artifact.hash());
    }

    void replaceArtifact(Artifact artifact) {
        artifacts.put(artifact.id(), artifact);
    }

    void addEvent(Event event) {
        events.put(event.id(), event);
        eventByKey.put(new EventKey(event.executionId(), event.artifactId(), event.direction()), event.id());
        eventsByExecution.computeIfAbsent(event.executionId(), unused -> new ArrayList<>()).add(event.id());
        eventsByArtifact.computeIfAbsent(event.artifactId(), unused -> new ArrayList<>()).add(event.id());
    }

    void absorb(GraphState delta) {
        pipelines.putAll(delta.pipelines);
        pipelineByName.putAll(delta.pipelineByName);
        contexts.putAll(delta.contexts);
        contextByStage.putAll(delta.contextByStage);
        appendAll(contextsByPipeline, delta.contextsByPipeline);
        executions.putAll(delta.executions);
        executionByOrigin.putAll(delta.executionByOrigin);
        appendAll(executionsByContext, delta.executionsByContext);
        artifacts.putAll(delta.artifacts);
        artifactByHash.putAll(delta.artifactByHash);
        latestHashByPath.putAll(delta.latestHashByPath);
        events.putAll(delta.events);
        eventByKey.putAll(delta.eventByKey);
        appendAll(eventsByExecution, delta.eventsByExecution);
        appendAll(eventsByArtifact, delta.eventsByArtifact);
        revision = Math.max(revision, delta.revision);
    }

    boolean isEmpty() {
        return pipelines.isEmpty() && contexts.isEmpty() && executions.isEmpty() && artifacts.isEmpty() && events.isEmpty();
    }

    void advanceRevision(long value) {
        revision = Math.max(revision, value);
    }

    private static void appendAll(Map<NodeId, List<NodeId>> target, Map<NodeId, List<NodeId>> source) {
        source.forEach((key, ids) -> target.computeIfAbsent(key, unused -> new ArrayList<>()).addAll(ids));
    }

    List<NodeId> contextIdsOf(NodeId pipelineId) {
        return contextsByPipeline.getOrDefault(pipelineId, List.of());
    }

    List<NodeId> executionIdsOf(NodeId contextId) {
        return executionsByContext.getOrDefault(contextId, List.of());
    }

    List<NodeId> eventIdsOfExecution(NodeId executionId) {
        return eventsByExecution.getOrDefault(executionId, List.of());
    }

    List<NodeId> eventIdsOfArtifact(NodeId artifactId) {
        return eventsByArtifact.getOrDefault(artifactId, List.of());
    }

    Optional<Event> eventById(NodeId id) {
        return Optional.ofNullable(events.get(id));
    }

    @Override
    public String storeId() {
        return storeId;
    }

    @Override
    public long revision() {
        return revision;
    }

    @Override
    public Optional<Pipeline> pipeline(NodeId id) {
        return Optional.ofNullable(pipelines.get(id));
    }

    @Override
    public Optional<Pipeline> pipelineByName(String name) {
        return Optional.ofNullable(pipelineByName.get(name)).map(pipelines::get);
    }

    @Override
    public List<Pipeline> pipelines() {
        return List.copyOf(pipelines.values());
    }

    @Override
    public Optional<Context> context(NodeId id) {
        return Optional.ofNullable(contexts.get(id));
    }

    @Override
    public Optional<Context> contextByStage(NodeId pipelineId, String stageName) {
        return Optional.ofNullable(contextByStage.get(new StageKey(pipelineId, stageName))).map(contexts::get);
    }

    @Override
    public List<Context> contextsOf(NodeId pipelineId) {
        return contextIdsOf(pipelineId).stream().map(contexts::get).toList();
    }

    @Override
    public Optional<Execution> execution(NodeId id) {
        return Optional.ofNullable(executions.get(id));
    }

    @Override
    public Optional<Execution> executionByOrigin(NodeId origin) {
        return Optional.ofNullable(executionByOrigin.get(origin)).map(executions::get);
    }

    @Override
    public List<Execution> executionsOf(NodeId contextId) {
        return executionIdsOf(contextId).stream().map(executions::get).toList();
    }

    @Override
    public Optional<Artifact> artifact(NodeId id) {
        return Optional.ofNullable(artifacts.get(id));
    }

    @Override
    public Optional<Artifact> artifactByHash(String hash) {
        return Optional.ofNullable(artifactByHash.get(hash)).map(artifacts::get);
    }

    @Override
    public Optional<String> latestHashForPath(String logicalPath) {
        return Optional.ofNullable(latestHashByPath.get(logicalPath));
    }

    @Override
    public List<Artifact> artifacts() {
        return List.copyOf(artifacts.values());
    }

    @Override
    public Optional<Event> event(NodeId executionId, NodeId artifactId, EventDirection direction) {
        return Optional.ofNullable(eventByKey.get(new EventKey(executionId, artifactId, direction))).map(events::get);
    }

    @Override
    public List<Event> eventsOfExecution(NodeId executionId) {
        return eventIdsOfExecution(executionId).stream().map(events::get).toList();
    }

    @Override
    public List<Event> eventsOfArtifact(NodeId artifactId) {
        return eventIdsOfArtifact(artifactId).stream().map(events::get).toList();
    }

    @Override
    public List<Event> events() {
        return List.copyOf(events.values());
    }
}
