package com.whereq.forge.worker;

import com.whereq.forge.model.StageDescriptor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressTrackerTest {

    private final ProgressTracker tracker = new ProgressTracker(List.of(
        StageDescriptor.of("script_gen"),
        StageDescriptor.of("voice_gen"),
        StageDescriptor.of("video_gen")));

    @Test
    void testOverallIsFlooredMeanOverPlannedStages() {
        tracker.update("script_gen", 100);

        assertThat(tracker.overall()).isEqualTo(33);

        tracker.update("voice_gen", 50);
        assertThat(tracker.overall()).isEqualTo(50);
    }

    @Test
    void testLowerValuesAreIgnored() {
        assertThat(tracker.update("voice_gen", 70)).isTrue();
        assertThat(tracker.update("voice_gen", 30)).isFalse();
        assertThat(tracker.update("voice_gen", 70)).isFalse();

        assertThat(tracker.stageProgress("voice_gen")).isEqualTo(70);
    }

    @Test
    void testValuesAreClampedAndUnknownStagesIgnored() {
        tracker.update("video_gen", 250);
        tracker.update("lipsync", 80);

        assertThat(tracker.stageProgress("video_gen")).isEqualTo(100);
        assertThat(tracker.stageProgress("lipsync")).isZero();
        assertThat(tracker.overall()).isEqualTo(33);
    }

    @Test
    void testNoStagesMeansNoProgress() {
        assertThat(new ProgressTracker(List.of()).overall()).isZero();
    }
}
