package com.whereq.forge.executor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a successful stage attempt
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageResult {
    /**
     * Opaque data persisted on the stage and handed to later stages
     */
    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();

    /**
     * Artifact locator; the last one reported becomes the job's output
     */
    private String outputRef;

    public static StageResult of(Map<String, Object> data) {
        return StageResult.builder().data(data).build();
    }
}
