package com.whereq.forge.progress;

import com.whereq.forge.model.ProgressEvent;
import com.whereq.forge.model.StatusEvent;

/**
 * Live progress and status notifications for observers.
 * <p>
 * Delivery is at-most-once and implementations never throw: a lost event must not
 * affect job processing.
 */
public interface ProgressPublisher {

    /**
     * Publish a stage progress update
     */
    void publishProgress(ProgressEvent event);

    /**
     * Publish a job-level status change
     */
    void publishStatus(StatusEvent event);
}
