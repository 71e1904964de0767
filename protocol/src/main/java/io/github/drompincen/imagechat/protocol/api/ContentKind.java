package io.github.drompincen.imagechat.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ContentKind {
    TEXT,
    IMAGE,
    MIXED;

    @JsonValue
    public String id() { return name().toLowerCase(Locale.ROOT); }

    public static ContentKind of(boolean hasText, boolean hasImage) {
        if (hasImage) return hasText ? MIXED : IMAGE;
        return TEXT;
    }
}
