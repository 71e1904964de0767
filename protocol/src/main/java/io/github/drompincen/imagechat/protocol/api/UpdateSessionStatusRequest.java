package io.github.drompincen.imagechat.protocol.api;

public record UpdateSessionStatusRequest(SessionStatus status) {}
