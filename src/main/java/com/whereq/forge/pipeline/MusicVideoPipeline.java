package com.whereq.forge.pipeline;

import com.whereq.forge.model.StageDescriptor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Music video: scene breakdown, reference image, one clip per scene,
 * optional lip-sync, then stitching of the clips over the track.
 */
@Component
public class MusicVideoPipeline implements PipelineDefinition {

    public static final String JOB_TYPE = "music_video";

    static final String SCENE_COUNT = "scene_count";
    static final String LIPSYNC = "lipsync";
    static final int DEFAULT_SCENES = 4;
    static final int MAX_SCENES = 8;

    static final String VIDEO_CLIP_EXECUTOR = "video_clip";

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

        List<StageDescriptor> stages = new ArrayList<>();
        stages.add(StageDescriptor.builder()
            .name("scene_gen").executor("scene_gen").params(Map.of(SCENE_COUNT, scenes)).build());
        stages.add(StageDescriptor.of("image_gen"));
        for (int scene = 1; scene <= scenes; scene++) {
            stages.add(StageDescriptor.builder()
                .name(VIDEO_CLIP_EXECUTOR + "_" + scene)
                .executor(VIDEO_CLIP_EXECUTOR)
                .params(Map.of("scene", scene))
                .build());
        }
        if (PipelineInputs.booleanValue(input, LIPSYNC, false)) {
            stages.add(StageDescriptor.of("lipsync"));
        }
        stages.add(StageDescriptor.builder()
            .name("stitch").executor("stitch").params(Map.of(SCENE_COUNT, scenes)).build());
        return stages;
    }
}
