package com.whereq.forge.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error taxonomy for stage and job failures.
 * Each kind carries its retry classification and the message shown to callers.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {

    // Caller input (fatal)
    INVALID_INPUT(false, "Please check your input and try again."),
    UNSUPPORTED_FORMAT(false, "File format not supported. Please use PNG, JPG, or WebP."),
    PAYLOAD_TOO_LARGE(false, "Input file is too large. Please use a file under 10MB."),

    // Upstream permanent rejections (fatal)
    CONTENT_REJECTED(false, "The request was rejected by the content policy. Please adjust your prompt."),
    UPSTREAM_REJECTED(false, "The generation service rejected the request. Please contact support."),
    UNSUPPORTED_PIPELINE(false, "This job type is not supported. Please contact support."),

    // Transient (retryable)
    UPSTREAM_TIMEOUT(true, "Request timed out. Please try again."),
    NETWORK_ERROR(true, "Generation service temporarily unreachable. Please try again."),
    RATE_LIMITED(true, "Too many requests. Please wait a moment and try again."),
    UPSTREAM_UNAVAILABLE(true, "Generation service temporarily unavailable. Please try again."),
    STORE_UNAVAILABLE(true, "System temporarily unavailable. Please try again."),
    UNKNOWN(true, "An error occurred. Please try again or contact support.");

    private final boolean retryable;

    private final String userMessage;
}
