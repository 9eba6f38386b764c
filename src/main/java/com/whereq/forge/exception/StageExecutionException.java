package com.whereq.forge.exception;

import com.whereq.forge.model.ErrorKind;
import lombok.Getter;

/**
 * Thrown by a stage executor that knows how its failure should be classified.
 * <p>
 * The message is shown to callers as is, so it must not carry internal details.
 */
@Getter
public class StageExecutionException extends RuntimeException {

    private final ErrorKind kind;

    private final boolean retryable;

    public StageExecutionException(ErrorKind kind, String message) {
        this(kind, message, kind.isRetryable(), null);
    }

    public StageExecutionException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, kind.isRetryable(), cause);
    }

    public StageExecutionException(ErrorKind kind, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryable = retryable;
    }

    /**
     * A failure that must not be retried regardless of its kind
     */
    public static StageExecutionException fatal(ErrorKind kind, String message) {
        return new StageExecutionException(kind, message, false, null);
    }
}
