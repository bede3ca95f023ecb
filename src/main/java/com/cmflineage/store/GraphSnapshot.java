package com.cmflineage.store;

import java.util.Comparator;
import java.util.List;

import com.cmflineage.model.Artifact;
import com.cmflineage.model.Context;
import com.cmflineage.model.Event;
import com.cmflineage.model.Execution;
import com.cmflineage.model.Pipeline;

public record GraphSnapshot(
        String storeId,
        long revision,
        List<Pipeline> pipelines,
        List<Context> contexts,
        List<Execution> executions,
        List<Artifact> artifacts,
        List<Event> events) {
    public GraphSnapshot {
        pipelines = pipelines == null ? List.of() : List.copyOf(pipelines);
        contexts = contexts == null ? List.of() : List.copyOf(contexts);
        executions = executions == null ? List.of() : List.copyOf(executions);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        events = events == null ? List.of() : List.copyOf(events);
    }

    static GraphSnapshot capture(GraphView view) {
        List<Pipeline> pipelines = view.pipelines();
        List<Context> contexts = pipelines.stream()
                .flatMap(pipeline -> view.contextsOf(pipeline.id()).stream())
                .toList();
        List<Execution> executions = contexts.stream()
                .flatMap(context -> view.executionsOf(context.id()).stream())
                .toList();
        return new GraphSnapshot(view.storeId(), view.revision(), pipelines, contexts, executions, view.artifacts(), view.events());
    }

    GraphState restore() {
        GraphState state = new GraphState(storeId, revision);
        pipelines.stream().sorted(Comparator.comparingLong(pipeline -> pipeline.id().sequence())).forEach(state::addPipeline);
        contexts.stream().sorted(Comparator.comparingLong(context -> context.id().sequence())).forEach(state::addContext);
        executions.stream().sorted(Comparator.comparingLong(execution -> execution.id().sequence())).forEach(state::addExecution);
        artifacts.stream().sorted(Comparator.comparingLong(artifact -> artifact.id().sequence())).forEach(state::addArtifact);
        events.stream().sorted(Comparator.comparingLong(event -> event.id().sequence())).forEach(state::addEvent);
        return state;
    }
}
