package io.github.drompincen.imagechat.protocol.ws;

public enum ErrorCategory {
    VALIDATION,
    UPSTREAM,
    PERSISTENCE
}
