package com.cmflineage.query;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

import com.cmflineage.identity.NodeId;
import com.cmflineage.model.Artifact;
import com.cmflineage.model.Context;
import com.cmflineage.model.Event;
import com.cmflineage.model.EventDirection;
import com.cmflineage.model.Execution;
import com.cmflineage.model.Pipeline;
import com.cmflineage.model.PropertyMaps;
import com.cmflineage.store.GraphStore;
import com.cmflineage.store.GraphView;

public class QueryEngine {
    private final GraphStore store;

    public QueryEngine(GraphStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public Stream<String> listPipelines() {
        List<String> names = store.read(view -> view.pipelines().stream().map(Pipeline::name).sorted().toList());
        return names.stream();
    }

    public ExecutionPage listExecutions(String pipelineName, ExecutionQuery query) {
        List<ExecutionRow> rows = filteredSortedRows(pipelineName, query);
        int from = (int) Math.min((long) (query.page() - 1) * query.pageSize(), rows.size());
        int to = Math.min(from + query.pageSize(), rows.size());
        return new ExecutionPage(rows.subList(from, to), rows.size());
    }

    /**
     * Keyset variant of {@link #listExecutions}: returns up to one page of rows ordered strictly after
     * {@code after} (the last row of the previous page, or null for the first page). Rows inserted between
     * calls never cause another row to repeat or go missing. The page number of the query is ignored.
     */
    public ExecutionPage listExecutionsAfter(String pipelineName, ExecutionQuery query, ExecutionRow after) {
        List<ExecutionRow> rows = filteredSortedRows(pipelineName, query);
        Comparator<ExecutionRow> order = ordering(query);
        List<ExecutionRow> page = rows.stream()
                .filter(row -> after == null || order.compare(row, after) > 0)
                .limit(query.pageSize())
                .toList();
        return new ExecutionPage(page, rows.size());
    }

    public List<ArtifactRow> listArtifacts(String pipelineName) {
        return store.read(view -> {
            Pipeline pipeline = requirePipeline(view, pipelineName);
            Map<NodeId, Artifact> artifacts = new LinkedHashMap<>();
            for (Execution execution : view.executionsOfPipeline(pipeline.id())) {
                for (Event event : view.eventsOfExecution(execution.id())) {
                    artifacts.computeIfAbsent(event.artifactId(), id -> view.artifact(id).orElseThrow());
                }
            }
            Set<NodeId> pipelineExecutions = executionIds(view, pipeline);
            return artifacts.values().stream()
                    .sorted(Comparator.comparingLong(artifact -> artifact.id().sequence()))
                    .map(artifact -> toArtifactRow(view, artifact, pipelineExecutions))
                    .toList();
        });
    }

    public List<ArtifactRow> findArtifactsByPath(String pipelineName, String logicalPath) {
        return listArtifacts(pipelineName).stream()
                .filter(row -> row.logicalPath().equals(logicalPath))
                .toList();
    }

    public LineageGraph getArtifactLineage(String pipelineName) {
        return store.read(view -> {
            Pipeline pipeline = requirePipeline(view, pipelineName);
            GraphBuilder graph = new GraphBuilder(view);
            for (Execution execution : view.executionsOfPipeline(pipeline.id())) {
                graph.addExecution(execution);
                for (Event event : view.eventsOfExecution(execution.id())) {
                    graph.addEvent(event);
                }
            }
            return graph.build();
        });
    }

    public List<String> getExecutionTypes(String pipelineName) {
        return store.read(view -> {
            Pipeline pipeline = requirePipeline(view, pipelineName);
            List<String> identifiers = new ArrayList<>();
            for (Context context : view.contextsOf(pipeline.id())) {
                for (Execution execution : view.executionsOf(context.id())) {
                    identifiers.add(new ExecutionTypeId(context.type(), execution.toolName(), execution.uuid()).toString());
                }
            }
            return identifiers;
        });
    }

    public LineageGraph getExecutionLineage(String pipelineName, String executionType, String executionUuid) {
        return store.read(view -> {
            Pipeline pipeline = requirePipeline(view, pipelineName);
            Execution seed = findExecution(view, pipeline, executionType, executionUuid);
            Set<NodeId> inPipeline = executionIds(view, pipeline);
            GraphBuilder graph = new GraphBuilder(view);
            graph.addExecution(seed);

            Deque<Step> pending = new ArrayDeque<>();
            Set<NodeId> expanded = new HashSet<>();
            pending.add(new Step(seed.id(), true, Walk.BOTH));
            while (!pending.isEmpty()) {
                Step step = pending.poll();
                if (!expanded.add(step.node())) {
                    continue;
                }
                if (step.execution()) {
                    for (Event event : view.eventsOfExecution(step.node())) {
                        boolean upstream = event.direction() == EventDirection.INPUT;
                        if (!step.walk().allows(upstream)) {
                            continue;
                        }
                        graph.addEvent(event);
                        pending.add(new Step(event.artifactId(), false, upstream ? Walk.UPSTREAM : Walk.DOWNSTREAM));
                    }
                } else {
                    EventDirection follow = step.walk() == Walk.UPSTREAM ? EventDirection.OUTPUT : EventDirection.INPUT;
                    for (Event event : view.eventsOfArtifact(step.node())) {
                        if (event.direction() != follow || !inPipeline.contains(event.executionId())) {
                            continue;
                        }
                        graph.addExecution(view.execution(event.executionId()).orElseThrow());
                        graph.addEvent(event);
                        pending.add(new Step(event.executionId(), true, step.walk()));
                    }
                }
            }
            return graph.build();
        });
    }

    public List<ArtifactRow> ancestors(String pipelineName, String artifactHash) {
        return walkArtifacts(pipelineName, artifactHash, Walk.UPSTREAM);
    }

    public List<ArtifactRow> descendants(String pipelineName, String artifactHash) {
        return walkArtifacts(pipelineName, artifactHash, Walk.DOWNSTREAM);
    }

    private List<ArtifactRow> walkArtifacts(String pipelineName, String artifactHash, Walk walk) {
        return store.read(view -> {
            Pipeline pipeline = requirePipeline(view, pipelineName);
            Artifact root = view.artifactByHash(artifactHash)
                    .orElseThrow(() -> new NotFoundException("Artifact " + artifactHash + " not found"));
            Set<NodeId> inPipeline = executionIds(view, pipeline);
            EventDirection fromArtifact = walk == Walk.UPSTREAM ? EventDirection.OUTPUT : EventDirection.INPUT;
            EventDirection fromExecution = walk == Walk.UPSTREAM ? EventDirection.INPUT : EventDirection.OUTPUT;

            Set<NodeId> seen = new LinkedHashSet<>();
            Deque<NodeId> pending = new ArrayDeque<>();
            seen.add(root.id());
            pending.add(root.id());
            List<Artifact> found = new ArrayList<>();
            while (!pending.isEmpty()) {
                NodeId artifactId = pending.poll();
                for (Event toExecution : view.eventsOfArtifact(artifactId)) {
                    if (toExecution.direction() != fromArtifact || !inPipeline.contains(toExecution.executionId())
                            || !seen.add(toExecution.executionId())) {
                        continue;
                    }
                    for (Event toArtifact : view.eventsOfExecution(toExecution.executionId())) {
                        if (toArtifact.direction() == fromExecution && seen.add(toArtifact.artifactId())) {
                            found.add(view.artifact(toArtifact.artifactId()).orElseThrow());
                            pending.add(toArtifact.artifactId());
                        }
                    }
                }
            }
            return found.stream().map(artifact -> toArtifactRow(view, artifact, inPipeline)).toList();
        });
    }

    private List<ExecutionRow> filteredSortedRows(String pipelineName, ExecutionQuery query) {
        List<ExecutionRow> rows = store.read(view -> {
            Pipeline pipeline = requirePipeline(view, pipelineName);
            List<ExecutionRow> all = new ArrayList<>();
            for (Context context : view.contextsOf(pipeline.id())) {
                for (Execution execution : view.executionsOf(context.id())) {
                    all.add(toExecutionRow(pipeline, context, execution));
                }
            }
            return all;
        });
        return rows.stream()
                .filter(row -> query.filterField() == null || query.filterValue().equals(query.filterField().textValue(row)))
                .sorted(ordering(query))
                .toList();
    }

    private static Comparator<ExecutionRow> ordering(ExecutionQuery query) {
        Comparator<ExecutionRow> primary = query.sortField().comparator();
        Comparator<ExecutionRow> byId = ExecutionField.EXECUTION_ID.comparator();
        Comparator<ExecutionRow> combined = primary.thenComparing(byId);
        return query.sortOrder() == SortOrder.DESC ? combined.reversed() : combined;
    }

    private static Execution findExecution(GraphView view, Pipeline pipeline, String executionType, String executionUuid) {
        for (Context context : view.contextsOf(pipeline.id())) {
            for (Execution execution : view.executionsOf(context.id())) {
                if (!execution.uuid().equals(executionUuid)) {
                    continue;
                }
                if (executionType == null || executionType.isBlank()
                        || executionType.equals(execution.toolName()) || executionType.equals(context.type())) {
                    return execution;
                }
            }
        }
        throw new NotFoundException("Execution " + executionType + "_" + executionUuid + " not found in pipeline " + pipeline.name());
    }

    private static Pipeline requirePipeline(GraphView view, String pipelineName) {
        return view.pipelineByName(pipelineName)
                .orElseThrow(() -> new NotFoundException("Pipeline " + pipelineName + " not found"));
    }

    private static Set<NodeId> executionIds(GraphView view, Pipeline pipeline) {
        Set<NodeId> ids = new HashSet<>();
        view.executionsOfPipeline(pipeline.id()).forEach(execution -> ids.add(execution.id()));
        return ids;
    }

    private static ExecutionRow toExecutionRow(Pipeline pipeline, Context context, Execution execution) {
        return new ExecutionRow(
                execution.id(),
                execution.uuid(),
                pipeline.name(),
                context.stageName(),
                context.type(),
                execution.toolName(),
                execution.startedAt(),
                PropertyMaps.values(execution.properties()),
                execution.origin());
    }

    private static ArtifactRow toArtifactRow(GraphView view, Artifact artifact, Set<NodeId> pipelineExecutions) {
        int inputs = 0;
        int outputs = 0;
        for (Event event : view.eventsOfArtifact(artifact.id())) {
            if (!pipelineExecutions.contains(event.executionId())) {
                continue;
            }
            if (event.direction() == EventDirection.INPUT) {
                inputs++;
            } else {
                outputs++;
            }
        }
        return new ArtifactRow(artifact.id(), artifact.hash(), artifact.logicalPath(), artifact.kind(), artifact.createdAt(),
                PropertyMaps.values(artifact.properties()), inputs, outputs);
    }

    private enum Walk {
        UPSTREAM,
        DOWNSTREAM,
        BOTH;

        boolean allows(boolean upstream) {
            return this == BOTH || (this == UPSTREAM) == upstream;
        }
    }

    private record Step(NodeId node, boolean execution, Walk walk) {
    }

    private static final class GraphBuilder {
        private final GraphView view;
        private final Map<String, LineageGraph.Node> nodes = new LinkedHashMap<>();
        private final Set<LineageGraph.Edge> edges = new LinkedHashSet<>();

        private GraphBuilder(GraphView view) {
            this.view = view;
        }

        void addExecution(Execution execution) {
            nodes.computeIfAbsent(execution.id().toString(), id -> {
                Context context = view.context(execution.contextId()).orElseThrow();
                Map<String, Object> attributes = new LinkedHashMap<>(PropertyMaps.values(execution.properties()));
                attributes.put("uuid", execution.uuid());
                attributes.put("stage", context.stageName());
                return new LineageGraph.Node(id, LineageGraph.NodeType.EXECUTION, context.type() + "/" + execution.toolName(), attributes);
            });
        }

        void addEvent(Event event) {
            Artifact artifact = view.artifact(event.artifactId()).orElseThrow();
            nodes.computeIfAbsent(artifact.id().toString(), id -> {
                Map<String, Object> attributes = new LinkedHashMap<>(PropertyMaps.values(artifact.properties()));
                attributes.put("hash", artifact.hash());
                attributes.put("kind", artifact.kind().name());
                return new LineageGraph.Node(id, LineageGraph.NodeType.ARTIFACT, artifact.logicalPath(), attributes);
            });
            String executionId = event.executionId().toString();
            String artifactId = artifact.id().toString();
            edges.add(event.direction() == EventDirection.INPUT
                    ? new LineageGraph.Edge(artifactId, executionId, EventDirection.INPUT)
                    : new LineageGraph.Edge(executionId, artifactId, EventDirection.OUTPUT));
        }

        LineageGraph build() {
            return new LineageGraph(new ArrayList<>(nodes.values()), new ArrayList<>(edges));
        }
    }
}
