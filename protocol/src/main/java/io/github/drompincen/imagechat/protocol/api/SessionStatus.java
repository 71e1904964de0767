package io.github.drompincen.imagechat.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SessionStatus {
    ACTIVE,
    COMPLETED,
    ARCHIVED;

    @JsonValue
    public String id() { return name().toLowerCase(Locale.ROOT); }

    @JsonCreator
    public static SessionStatus fromId(String id) {
        return valueOf(id.toUpperCase(Locale.ROOT));
    }
}
