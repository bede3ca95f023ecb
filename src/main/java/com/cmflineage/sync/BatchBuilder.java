package com.cmflineage.sync;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.ToLongFunction;

import com.cmflineage.identity.NodeId;
import com.cmflineage.model.Artifact;
import com.cmflineage.model.Context;
import com.cmflineage.model.Event;
import com.cmflineage.model.Execution;
import com.cmflineage.model.Pipeline;
import com.cmflineage.query.NotFoundException;
import com.cmflineage.store.GraphView;

public final class BatchBuilder {
    private BatchBuilder() {
    }

    public static SyncBatch forPush(GraphView view, Map<String, Long> sinceByPipeline) {
        return forPush(view, sinceByPipeline, null);
    }

    public static SyncBatch forPush(GraphView view, Map<String, Long> sinceByPipeline, String executionUuid) {
        String localStore = view.storeId();
        return build(view, sinceByPipeline, origin -> origin.storeId().equals(localStore), executionUuid);
    }

    public static SyncBatch forPull(GraphView view, Collection<String> pipelineNames, long sinceRevision) {
        return forPull(view, pipelineNames, sinceRevision, null);
    }

    public static SyncBatch forPull(GraphView view, Collection<String> pipelineNames, long sinceRevision, String executionUuid) {
        Map<String, Long> since = new LinkedHashMap<>();
        pipelineNames.forEach(name -> since.put(name, sinceRevision));
        return build(view, since, origin -> true, executionUuid);
    }

    private static SyncBatch build(GraphView view, Map<String, Long> sinceByPipeline, Predicate<NodeId> eligible,
            String executionUuid) {
        Collector collector = new Collector(view, executionUuid);
        sinceByPipeline.forEach((name, since) -> view.pipelineByName(name)
                .ifPresent(pipeline -> collector.collect(pipeline, since, eligible)));
        if (executionUuid != null && !collector.matched) {
            throw new NotFoundException("Execution " + executionUuid + " not found in pipelines " + sinceByPipeline.keySet());
        }
        return new SyncBatch(view.storeId(), view.revision(), collector.entries());
    }

    private static final class Collector {
        private final GraphView view;
        private final String executionUuid;
        private boolean matched;
        private final Map<Object, Pipeline> pipelines = new LinkedHashMap<>();
        private final Map<Object, Context> contexts = new LinkedHashMap<>();
        private final Map<Object, Execution> executions = new LinkedHashMap<>();
        private final Map<Object, Artifact> artifacts = new LinkedHashMap<>();
        private final Map<Object, Event> events = new LinkedHashMap<>();

        Collector(GraphView view, String executionUuid) {
            this.view = view;
            this.executionUuid = executionUuid;
        }

        void collect(Pipeline pipeline, long since, Predicate<NodeId> eligible) {
            boolean scoped = executionUuid != null;
            if (!scoped && pipeline.revision() > since && eligible.test(pipeline.origin())) {
                pipelines.put(pipeline.id(), pipeline);
            }
            for (Context context : view.contextsOf(pipeline.id())) {
                if (!scoped && context.revision() > since && eligible.test(context.origin())) {
                    include(pipeline, context);
                }
                for (Execution execution : view.executionsOf(context.id())) {
                    if (!eligible.test(execution.origin())) {
                        continue;
                    }
                    if (scoped) {
                        if (!execution.uuid().equals(executionUuid)) {
                            continue;
                        }
                        matched = true;
                    }
                    if (execution.revision() > since) {
                        include(pipeline, context, execution);
                    }
                    for (Event event : view.eventsOfExecution(execution.id())) {
                        Optional<Artifact> artifact = view.artifact(event.artifactId());
                        if (artifact.isEmpty()) {
                            continue;
                        }
                        if (event.revision() > since) {
                            include(pipeline, context, execution);
                            artifacts.put(artifact.get().id(), artifact.get());
                            events.put(event.id(), event);
                        } else if (artifact.get().revision() > since) {
                            artifacts.put(artifact.get().id(), artifact.get());
                        }
                    }
                }
            }
        }

        private void include(Pipeline pipeline, Context context) {
            pipelines.put(pipeline.id(), pipeline);
            contexts.put(context.id(), context);
        }

        private void include(Pipeline pipeline, Context context, Execution execution) {
            include(pipeline, context);
            executions.put(execution.id(), execution);
        }

        List<BatchEntry> entries() {
            List<BatchEntry> entries = new ArrayList<>();
            sorted(pipelines.values(), Pipeline::revision).forEach(pipeline -> entries.add(
                    new BatchEntry.PipelineEntry(pipeline.id(), pipeline.name(), pipeline.createdAt(), pipeline.origin())));
            sorted(contexts.values(), Context::revision).forEach(context -> entries.add(new BatchEntry.ContextEntry(
                    context.id(), pipelineName(context), context.stageName(), context.type(),
                    context.properties(), context.createdAt(), context.origin())));
            sorted(executions.values(), Execution::revision).forEach(execution -> {
                Context context = view.context(execution.contextId()).orElseThrow();
                entries.add(new BatchEntry.ExecutionEntry(execution.id(), pipelineName(context), context.stageName(),
                        execution.toolName(), execution.uuid(), execution.startedAt(), execution.properties(),
                        execution.origin()));
            });
            sorted(artifacts.values(), Artifact::revision).forEach(artifact -> entries.add(new BatchEntry.ArtifactEntry(
                    artifact.id(), artifact.hash(), artifact.logicalPath(), artifact.kind(), artifact.properties(),
                    artifact.createdAt())));
            sorted(events.values(), Event::revision).forEach(event -> entries.add(new BatchEntry.EventEntry(
                    event.id(),
                    executions.get(event.executionId()).origin(),
                    artifacts.get(event.artifactId()).hash(),
                    event.direction(),
                    event.timestamp())));
            return entries;
        }

        private String pipelineName(Context context) {
            return view.pipeline(context.pipelineId()).map(Pipeline::name).orElseThrow();
        }

        private static <T> List<T> sorted(Collection<T> values, ToLongFunction<T> revision) {
            return values.stream().sorted(Comparator.comparingLong(revision)).toList();
        }
    }
}
