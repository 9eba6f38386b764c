package com.whereq.forge.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves the pipeline for a job type
 */
@Slf4j
@Component
public class PipelineRegistry {

    public static final String DEFAULT_JOB_TYPE = AdCreativePipeline.JOB_TYPE;

    private final Map<String, PipelineDefinition> pipelines;

    public PipelineRegistry(List<PipelineDefinition> definitions) {
        this.pipelines = definitions.stream()
            .collect(Collectors.toMap(PipelineDefinition::getJobType, Function.identity()));
        log.info("Registered pipelines: {}", pipelines.keySet());
    }

    /**
     * Jobs without a type run the default pipeline
     */
    public String normalize(String jobType) {
        return jobType == null || jobType.isBlank() ? DEFAULT_JOB_TYPE : jobType.trim().toLowerCase();
    }

    public Optional<PipelineDefinition> find(String jobType) {
        return Optional.ofNullable(pipelines.get(normalize(jobType)));
    }
}
