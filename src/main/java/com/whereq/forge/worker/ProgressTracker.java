package com.whereq.forge.worker;

import com.whereq.forge.model.StageDescriptor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-job stage progress. Overall progress is the floor of the mean over all planned
 * stages, so N stages split 0-100 evenly. Stage progress only ever rises.
 */
public class ProgressTracker {

    private final Map<String, Integer> stageProgress = new LinkedHashMap<>();

    public ProgressTracker(List<StageDescriptor> stages) {
        stages.forEach(stage -> stageProgress.put(stage.getName(), 0));
    }

    /**
     * @return true when the stored value rose
     */
    public synchronized boolean update(String stage, int percent) {
        if (!stageProgress.containsKey(stage)) {
            return false;
        }
        int clamped = Math.max(0, Math.min(100, percent));
        if (clamped <= stageProgress.get(stage)) {
            return false;
        }
        stageProgress.put(stage, clamped);
        return true;
    }

    public synchronized int stageProgress(String stage) {
        return stageProgress.getOrDefault(stage, 0);
    }

    public synchronized int overall() {
        if (stageProgress.isEmpty()) {
            return 0;
        }
        int sum = stageProgress.values().stream().mapToInt(Integer::intValue).sum();
        return sum / stageProgress.size();
    }
}
