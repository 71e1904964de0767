package io.github.drompincen.imagechat.protocol.ws;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Server to client frame types. Everything except {@link #STATUS} is terminal. */
public enum FrameType {
    STATUS,
    MESSAGE,
    IMAGE,
    MIXED,
    ERROR;

    @JsonValue
    public String id() { return name().toLowerCase(Locale.ROOT); }

    public boolean isTerminal() { return this != STATUS; }
}
