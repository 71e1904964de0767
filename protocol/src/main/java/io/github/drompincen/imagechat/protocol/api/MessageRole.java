package io.github.drompincen.imagechat.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageRole {
    USER,
    ASSISTANT;

    @JsonValue
    public String id() { return name().toLowerCase(Locale.ROOT); }
}
