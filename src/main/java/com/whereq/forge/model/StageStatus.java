package com.whereq.forge.model;

/**
 * Stage lifecycle states. A FAILED stage may re-enter PROCESSING for another attempt.
 */
public enum StageStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public String wireName() {
        return name().toLowerCase();
    }
}
