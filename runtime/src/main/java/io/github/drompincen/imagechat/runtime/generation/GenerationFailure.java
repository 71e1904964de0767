package io.github.drompincen.imagechat.runtime.generation;

import io.github.drompincen.imagechat.protocol.ws.ErrorCode;

public enum GenerationFailure {
    RATE_LIMITED(ErrorCode.RATE_LIMITED),
    INVALID_INPUT(ErrorCode.INVALID_INPUT),
    UPSTREAM_UNAVAILABLE(ErrorCode.UPSTREAM_UNAVAILABLE),
    TIMEOUT(ErrorCode.TIMEOUT),
    UNKNOWN(ErrorCode.UNKNOWN);

    private final ErrorCode errorCode;

    GenerationFailure(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() { return errorCode; }
}
