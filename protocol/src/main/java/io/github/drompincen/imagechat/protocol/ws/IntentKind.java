package io.github.drompincen.imagechat.protocol.ws;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Client to server request kinds. */
public enum IntentKind {
    CHAT,
    GENERATE,
    REFINE,
    CONVERSE;

    public String id() { return name().toLowerCase(Locale.ROOT); }

    public static Optional<IntentKind> fromId(String id) {
        if (id == null) return Optional.empty();
        return Arrays.stream(values()).filter(k -> k.id().equals(id)).findFirst();
    }
}
