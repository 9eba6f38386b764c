package com.whereq.forge.pipeline;

import com.whereq.forge.model.StageDescriptor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Ad creative: script, voice-over, scene videos, final composite.
 * <p>
 * The scene count is passed to every stage; the video stage renders all scenes itself.
 */
@Component
public class AdCreativePipeline implements PipelineDefinition {

    public static final String JOB_TYPE = "ad_creative";

    static final String SCENE_COUNT = "scene_count";
    static final int DEFAULT_SCENES = 4;
    static final int MAX_SCENES = 4;

    @Override
    public String getJobType() {
        return JOB_TYPE;
    }

    @Override
    public List<StageDescriptor> plan(Map<String, Object> input) {
        int scenes = PipelineInputs.intValue(input, SCENE_COUNT, DEFAULT_SCENES);
        if (scenes < 1 || scenes > MAX_SCENES) {
            throw new IllegalArgumentException(SCENE_COUNT + " must be between 1 and " + MAX_SCENES + ", got " + scenes);
        }

        Map<String, Object> params = Map.of(SCENE_COUNT, scenes);
        return List.of(
            stage("script_gen", params),
            stage("voice_gen", params),
            stage("video_gen", params),
            stage("compositing", params)
        );
    }

    private static StageDescriptor stage(String name, Map<String, Object> params) {
        return StageDescriptor.builder().name(name).executor(name).params(params).build();
    }
}
