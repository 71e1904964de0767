package io.github.drompincen.imagechat.protocol.client;

public enum ConnectionState {
    IDLE,
    CONNECTING,
    CONNECTED,
    DISCONNECTED_PENDING_RETRY,
    RETRYING,
    CLOSED
}
