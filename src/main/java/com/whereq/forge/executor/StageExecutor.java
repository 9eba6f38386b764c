package com.whereq.forge.executor;

/**
 * Performs the work of one pipeline stage, usually by calling an external generation service
 */
public interface StageExecutor {
    /**
     * Execute a stage attempt synchronously (blocking)
     *
     * @param context job input, prior stage data and a progress reporter
     * @return stage data for later stages and an optional output reference
     * @throws Exception if the attempt fails; the caller classifies it
     */
    StageResult execute(StageContext context) throws Exception;
}
