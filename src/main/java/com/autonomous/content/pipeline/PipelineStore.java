package com.autonomous.content.pipeline;

import com.autonomous.content.exception.ResourceNotFoundException;
import com.autonomous.content.model.Pipeline;
import com.autonomous.content.model.PipelineSnapshot;
import com.autonomous.content.model.PipelineStatus;
import com.autonomous.content.storage.JsonDocumentStore;
import com.autonomous.content.storage.JsonMappers;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Pipeline records, one JSON document each. Every change goes through {@link #update}, which
 * holds the pipeline's lock and writes the document back.
 */
@Component
public class PipelineStore {

    private static final Logger log = LoggerFactory.getLogger(PipelineStore.class);

    @Value("${pipeline.data.path:data}")
    private String dataPath;

    private final Map<String, Pipeline> pipelines = new ConcurrentHashMap<>();
    private JsonDocumentStore<Pipeline> documents = JsonDocumentStore.inMemory(Pipeline.class);

    public void setDataPath(String path) {
        this.dataPath = path;
    }

    @PostConstruct
    public void init() {
        if (dataPath == null || dataPath.isBlank()) {
            return;
        }
        documents = new JsonDocumentStore<>(Paths.get(dataPath, "pipelines"), Pipeline.class, JsonMappers.json());
        try {
            documents.loadAll().forEach(pipeline -> pipelines.put(pipeline.getId(), pipeline));
            log.info("Loaded {} pipelines from {}", pipelines.size(), dataPath);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load pipelines from " + dataPath, e);
        }
    }

    public PipelineSnapshot insert(Pipeline pipeline) {
        if (pipelines.putIfAbsent(pipeline.getId(), pipeline) != null) {
            throw new IllegalStateException("Pipeline " + pipeline.getId() + " already exists");
        }
        synchronized (pipeline) {
            save(pipeline);
            return PipelineSnapshot.of(pipeline);
        }
    }

    public <T> T update(String pipelineId, Function<Pipeline, T> change) {
        Pipeline pipeline = pipelines.get(pipelineId);
        if (pipeline == null || pipeline.isDeleted()) {
            throw new ResourceNotFoundException("Pipeline", pipelineId);
        }
        synchronized (pipeline) {
            try {
                return change.apply(pipeline);
            } finally {
                save(pipeline);
            }
        }
    }

    public Optional<PipelineSnapshot> find(String pipelineId) {
        Pipeline pipeline = pipelines.get(pipelineId);
        if (pipeline == null) {
            return Optional.empty();
        }
        synchronized (pipeline) {
            return pipeline.isDeleted() ? Optional.empty() : Optional.of(PipelineSnapshot.of(pipeline));
        }
    }

    public PipelineSnapshot get(String pipelineId) {
        return find(pipelineId).orElseThrow(() -> new ResourceNotFoundException("Pipeline", pipelineId));
    }

    public List<PipelineSnapshot> findByOrganization(String organizationId) {
        return pipelines.values().stream()
            .filter(pipeline -> organizationId.equals(pipeline.getOrganizationId()))
            .map(pipeline -> find(pipeline.getId()))
            .flatMap(Optional::stream)
            .sorted(Comparator.comparing(PipelineSnapshot::createdAt))
            .toList();
    }

    public List<String> idsWithStatus(PipelineStatus status) {
        return pipelines.values().stream()
            .map(pipeline -> find(pipeline.getId()))
            .flatMap(Optional::stream)
            .filter(snapshot -> snapshot.status() == status)
            .sorted(Comparator.comparing(PipelineSnapshot::createdAt))
            .map(PipelineSnapshot::id)
            .toList();
    }

    private void save(Pipeline pipeline) {
        try {
            documents.save(pipeline.getId(), pipeline);
        } catch (IOException e) {
            log.error("Failed to persist pipeline {}", pipeline.getId(), e);
        }
    }
}
