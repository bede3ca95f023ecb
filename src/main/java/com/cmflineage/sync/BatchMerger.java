package com.cmflineage.sync;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cmflineage.identity.NodeId;
import com.cmflineage.model.Artifact;
import com.cmflineage.model.Context;
import com.cmflineage.model.Event;
import com.cmflineage.model.Execution;
import com.cmflineage.model.Pipeline;
import com.cmflineage.model.PropertyConflict;
import com.cmflineage.store.ArtifactResolution;
import com.cmflineage.store.InvalidReferenceException;
import com.cmflineage.store.Transaction;

/**
 * Applies a batch inside one transaction. Merging the same batch twice leaves the store unchanged:
 * pipelines, contexts and artifacts resolve by natural key, executions by origin and events by their
 * (execution, artifact, direction) triple.
 */
public final class BatchMerger {
    private static final Logger log = LoggerFactory.getLogger(BatchMerger.class);

    private BatchMerger() {
    }

    public static MergeResult apply(Transaction tx, SyncBatch batch) {
        List<BatchEntry> ordered = batch.entries().stream()
                .sorted(Comparator.comparingInt(BatchEntry::dependencyRank))
                .toList();
        Merge merge = new Merge(tx);
        for (BatchEntry entry : ordered) {
            tx.checkpoint();
            merge.apply(entry);
        }
        if (!merge.conflicts.isEmpty()) {
            log.info("sync.merge.conflicts source={} count={}", batch.sourceStoreId(), merge.conflicts.size());
        }
        for (CycleWarning cycle : merge.cycles) {
            log.warn("sync.merge.cycle source={} execution={} artifact={} direction={}", batch.sourceStoreId(),
                    cycle.executionOrigin(), cycle.artifactHash(), cycle.direction());
        }
        return new MergeResult(IdMapping.of(merge.mapping), merge.stats(), merge.conflicts, merge.cycles, tx.revision());
    }

    private static final class Merge {
        private final Transaction tx;
        private final Map<NodeId, NodeId> mapping = new LinkedHashMap<>();
        private final List<PropertyConflict> conflicts = new ArrayList<>();
        private final List<CycleWarning> cycles = new ArrayList<>();
        private int pipelinesCreated;
        private int contextsCreated;
        private int executionsCreated;
        private int executionsSkipped;
        private int artifactsCreated;
        private int artifactsDeduplicated;
        private int eventsCreated;
        private int eventsCollapsed;

        Merge(Transaction tx) {
            this.tx = tx;
        }

        void apply(BatchEntry entry) {
            NodeId target;
            if (entry instanceof BatchEntry.PipelineEntry pipeline) {
                target = pipeline(pipeline);
            } else if (entry instanceof BatchEntry.ContextEntry context) {
                target = context(context);
            } else if (entry instanceof BatchEntry.ExecutionEntry execution) {
                target = execution(execution);
            } else if (entry instanceof BatchEntry.ArtifactEntry artifact) {
                target = artifact(artifact);
            } else if (entry instanceof BatchEntry.EventEntry event) {
                target = event(event);
            } else {
                throw new IllegalArgumentException("Unsupported batch entry " + entry.getClass().getName());
            }
            if (entry.sourceId() != null) {
                mapping.put(entry.sourceId(), target);
            }
        }

        private NodeId pipeline(BatchEntry.PipelineEntry entry) {
            boolean known = tx.pipelineByName(entry.name()).isPresent();
            Pipeline pipeline = tx.importPipeline(entry.name(), entry.createdAt(), entry.origin());
            if (!known) {
                pipelinesCreated++;
            }
            return pipeline.id();
        }

        private NodeId context(BatchEntry.ContextEntry entry) {
            Pipeline pipeline = requirePipeline(entry.pipelineName());
            boolean known = tx.contextByStage(pipeline.id(), entry.stageName()).isPresent();
            Context context = tx.importContext(pipeline, entry.stageName(), entry.type(), entry.properties(),
                    entry.createdAt(), entry.origin(), conflicts::add);
            if (!known) {
                contextsCreated++;
            }
            return context.id();
        }

        private NodeId execution(BatchEntry.ExecutionEntry entry) {
            Optional<Execution> existing = tx.executionByOrigin(entry.origin());
            if (existing.isPresent()) {
                if (!existing.get().uuid().equals(entry.uuid())) {
                    throw new OriginCollisionException(entry.origin(), existing.get().uuid(), entry.uuid());
                }
                executionsSkipped++;
                return tx.mergeExecutionProperties(existing.get().id(), entry.properties(), conflicts::add).id();
            }
            Pipeline pipeline = requirePipeline(entry.pipelineName());
            Context context = tx.contextByStage(pipeline.id(), entry.stageName())
                    .orElseThrow(() -> new InvalidReferenceException("Batch references unknown stage "
                            + entry.pipelineName() + "/" + entry.stageName()));
            executionsCreated++;
            return tx.importExecution(context, entry.toolName(), entry.uuid(), entry.startedAt(),
                    entry.properties(), entry.origin()).id();
        }

        private NodeId artifact(BatchEntry.ArtifactEntry entry) {
            ArtifactResolution resolution = tx.mergeArtifact(entry.hash(), entry.logicalPath(), entry.kind(),
                    entry.properties(), entry.createdAt(), conflicts::add);
            if (resolution.created()) {
                artifactsCreated++;
            } else {
                artifactsDeduplicated++;
            }
            return resolution.artifact().id();
        }

        private NodeId event(BatchEntry.EventEntry entry) {
            Execution execution = tx.executionByOrigin(entry.executionOrigin())
                    .orElseThrow(() -> new InvalidReferenceException("Batch event references unknown execution "
                            + entry.executionOrigin()));
            Artifact artifact = tx.artifactByHash(entry.artifactHash())
                    .orElseThrow(() -> new InvalidReferenceException("Batch event references unknown artifact "
                            + entry.artifactHash()));
            boolean known = tx.event(execution.id(), artifact.id(), entry.direction()).isPresent();
            if (!known && tx.closesCycle(execution.id(), artifact.id(), entry.direction())) {
                cycles.add(new CycleWarning(entry.executionOrigin(), entry.artifactHash(), entry.direction()));
            }
            Event event = tx.importEvent(execution.id(), artifact.id(), entry.direction(), entry.timestamp());
            if (known) {
                eventsCollapsed++;
            } else {
                eventsCreated++;
            }
            return event.id();
        }

        private Pipeline requirePipeline(String name) {
            return tx.pipelineByName(name)
                    .orElseThrow(() -> new InvalidReferenceException("Batch references unknown pipeline " + name));
        }

        MergeStats stats() {
            return new MergeStats(pipelinesCreated, contextsCreated, executionsCreated, executionsSkipped,
                    artifactsCreated, artifactsDeduplicated, eventsCreated, eventsCollapsed);
        }
    }
}
