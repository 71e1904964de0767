package io.github.drompincen.imagechat.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum StylePreset {

    MODERN("modern aesthetic, clean lines, contemporary design"),
    MINIMAL("minimalist style, white space, simple elements"),
    VIBRANT("vibrant colors, energetic mood, bold visual"),
    LUXURY("luxury feel, premium quality, sophisticated elegance"),
    PLAYFUL("playful, fun, colorful, friendly vibe"),
    PROFESSIONAL("professional, corporate, trustworthy appearance"),
    NATURAL("natural tones, organic feel, earthy colors"),
    TECH("tech-focused, futuristic, digital aesthetic");

    private final String promptHint;

    StylePreset(String promptHint) {
        this.promptHint = promptHint;
    }

    @JsonValue
    public String id() { return name().toLowerCase(Locale.ROOT); }

    public String promptHint() { return promptHint; }

    public static Optional<StylePreset> fromId(String id) {
        if (id == null) return Optional.empty();
        return Arrays.stream(values()).filter(s -> s.id().equals(id)).findFirst();
    }

    @JsonCreator
    static StylePreset fromJson(String id) {
        return fromId(id).orElseThrow(() -> new IllegalArgumentException("Unknown style preset: " + id));
    }
}
