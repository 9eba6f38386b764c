package com.whereq.forge.exception;

import com.whereq.forge.model.ErrorKind;
import com.whereq.forge.model.ErrorRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.RedisSystemException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * Maps stage failures onto the {@link ErrorKind} taxonomy.
 * <p>
 * The cause chain is walked until a recognised exception is found. Anything
 * unrecognised is {@link ErrorKind#UNKNOWN}, which is retried.
 */
@Slf4j
@Component
public class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 10;

    public ErrorRecord classify(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof StageExecutionException stageError) {
                return ErrorRecord.of(stageError.getKind(), stageError.getMessage()).toBuilder()
                    .retryable(stageError.isRetryable())
                    .build();
            }

            ErrorKind kind = kindOf(current);
            if (kind != null) {
                return ErrorRecord.of(kind, null);
            }

            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }

        log.debug("Unclassified stage error {}: {}", error.getClass().getName(), error.getMessage());
        return ErrorRecord.of(ErrorKind.UNKNOWN, null);
    }

    private ErrorKind kindOf(Throwable error) {
        if (error instanceof WebClientResponseException responseError) {
            return kindOfStatus(responseError.getStatusCode().value());
        }
        if (error instanceof TimeoutException || error instanceof SocketTimeoutException) {
            return ErrorKind.UPSTREAM_TIMEOUT;
        }
        if (error instanceof RedisConnectionFailureException
            || error instanceof RedisSystemException
            || error instanceof DataAccessResourceFailureException
            || error instanceof TransientDataAccessException) {
            return ErrorKind.STORE_UNAVAILABLE;
        }
        if (error instanceof WebClientRequestException) {
            // the cause may still be a timeout, which is more specific
            return error.getCause() instanceof TimeoutException || error.getCause() instanceof SocketTimeoutException
                ? ErrorKind.UPSTREAM_TIMEOUT
                : ErrorKind.NETWORK_ERROR;
        }
        if (error instanceof IOException) {
            return ErrorKind.NETWORK_ERROR;
        }
        if (error instanceof IllegalArgumentException) {
            return ErrorKind.INVALID_INPUT;
        }
        return null;
    }

    /**
     * Classify an HTTP status returned by a generation service
     */
    public ErrorKind kindOfStatus(int status) {
        if (status == 429) {
            return ErrorKind.RATE_LIMITED;
        }
        if (status >= 500) {
            return ErrorKind.UPSTREAM_UNAVAILABLE;
        }
        return switch (status) {
            case 400, 422 -> ErrorKind.INVALID_INPUT;
            case 413 -> ErrorKind.PAYLOAD_TOO_LARGE;
            case 415 -> ErrorKind.UNSUPPORTED_FORMAT;
            case 451 -> ErrorKind.CONTENT_REJECTED;
            default -> ErrorKind.UPSTREAM_REJECTED;
        };
    }
}
