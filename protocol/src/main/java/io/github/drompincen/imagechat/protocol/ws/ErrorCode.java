package io.github.drompincen.imagechat.protocol.ws;

/**
 * Typed reason carried in {@code data.code} of every error frame.
 */
public enum ErrorCode {
    MALFORMED_FRAME(ErrorCategory.VALIDATION),
    UNKNOWN_TYPE(ErrorCategory.VALIDATION),
    MISSING_FIELD(ErrorCategory.VALIDATION),
    INVALID_FIELD(ErrorCategory.VALIDATION),
    NO_PRIOR_IMAGE(ErrorCategory.VALIDATION),
    UNKNOWN_IMAGE(ErrorCategory.VALIDATION),
    SESSION_NOT_FOUND(ErrorCategory.VALIDATION),

    RATE_LIMITED(ErrorCategory.UPSTREAM),
    INVALID_INPUT(ErrorCategory.UPSTREAM),
    UPSTREAM_UNAVAILABLE(ErrorCategory.UPSTREAM),
    TIMEOUT(ErrorCategory.UPSTREAM),
    UNKNOWN(ErrorCategory.UPSTREAM),

    PERSISTENCE_FAILURE(ErrorCategory.PERSISTENCE);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() { return category; }
}
