package com.whereq.forge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured, caller-safe error persisted on a failed job or stage
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ErrorRecord {
    private static final int MAX_MESSAGE_LENGTH = 1000;

    private ErrorKind kind;

    /**
     * Message for callers. Never a stack trace.
     */
    private String message;

    private boolean retryable;

    /**
     * Attempts made when this error was recorded
     */
    private int attempts;

    /**
     * True when the error was retryable but no attempts remained
     */
    private boolean exhausted;

    public static ErrorRecord of(ErrorKind kind, String message) {
        return ErrorRecord.builder()
            .kind(kind)
            .message(truncate(message != null ? message : kind.getUserMessage()))
            .retryable(kind.isRetryable())
            .build();
    }

    private static String truncate(String message) {
        return message.length() > MAX_MESSAGE_LENGTH ? message.substring(0, MAX_MESSAGE_LENGTH) : message;
    }
}
