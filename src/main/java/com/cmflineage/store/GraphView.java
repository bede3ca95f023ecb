package com.cmflineage.store;

import java.util.List;
import java.util.Optional;

import com.cmflineage.identity.NodeId;
import com.cmflineage.model.Artifact;
import com.cmflineage.model.Context;
import com.cmflineage.model.Event;
import com.cmflineage.model.EventDirection;
import com.cmflineage.model.Execution;
import com.cmflineage.model.Pipeline;

public interface GraphView {
    String storeId();

    long revision();

    Optional<Pipeline> pipeline(NodeId id);

    Optional<Pipeline> pipelineByName(String name);

    List<Pipeline> pipelines();

    Optional<Context> context(NodeId id);

    Optional<Context> contextByStage(NodeId pipelineId, String stageName);

    List<Context> contextsOf(NodeId pipelineId);

    Optional<Execution> execution(NodeId id);

    Optional<Execution> executionByOrigin(NodeId origin);

    List<Execution> executionsOf(NodeId contextId);

    Optional<Artifact> artifact(NodeId id);

    Optional<Artifact> artifactByHash(String hash);

    Optional<String> latestHashForPath(String logicalPath);

    List<Artifact> artifacts();

    Optional<Event> event(NodeId executionId, NodeId artifactId, EventDirection direction);

    List<Event> eventsOfExecution(NodeId executionId);

    List<Event> eventsOfArtifact(NodeId artifactId);

    List<Event> events();

    default List<Execution> executionsOfPipeline(NodeId pipelineId) {
        return contextsOf(pipelineId).stream()
                .flatMap(context -> executionsOf(context.id()).stream())
                .toList();
    }
}
