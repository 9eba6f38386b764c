package com.whereq.forge.executor;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of stage executors by executor key (script_gen, video_clip, ...)
 */
@Slf4j
public class StageExecutorRegistry {

    private final Map<String, StageExecutor> executors = new ConcurrentHashMap<>();

    public StageExecutorRegistry register(String key, StageExecutor executor) {
        StageExecutor previous = executors.put(key, executor);
        if (previous != null) {
            log.warn("Stage executor {} replaced", key);
        }
        return this;
    }

    public Optional<StageExecutor> find(String key) {
        return Optional.ofNullable(key).map(executors::get);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(executors.keySet());
    }
}
