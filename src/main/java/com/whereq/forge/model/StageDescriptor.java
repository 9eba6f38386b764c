package com.whereq.forge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.Map;

/**
 * One planned step of a pipeline
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageDescriptor {
    /**
     * Stage name, unique within the job (e.g. video_clip_2)
     */
    private String name;

    /**
     * Executor key used to look up the stage executor (e.g. video_clip)
     */
    private String executor;

    /**
     * Static parameters fixed at planning time (e.g. the scene number)
     */
    @Builder.Default
    private Map<String, Object> params = Collections.emptyMap();

    public static StageDescriptor of(String name) {
        return StageDescriptor.builder().name(name).executor(name).build();
    }
}
