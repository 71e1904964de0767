package io.github.drompincen.imagechat.protocol.ws;

import io.github.drompincen.imagechat.protocol.api.ImagePurpose;
import io.github.drompincen.imagechat.protocol.api.StylePreset;

import java.util.Optional;

/**
 * A validated client request. The set of request kinds is closed: every variant maps to exactly
 * one {@link IntentKind}, so a {@code switch} over {@link #kind()} is checked for exhaustiveness.
 */
public sealed interface ClientIntent {

    IntentKind kind();

    /** The user's text for this turn: chat text, prompt, feedback or free text. */
    String text();

    default Optional<ImagePurpose> purposeSelection() { return Optional.empty(); }

    default Optional<StylePreset> styleSelection() { return Optional.empty(); }

    record Chat(String text, ImagePurpose purpose, StylePreset style) implements ClientIntent {
        @Override public IntentKind kind() { return IntentKind.CHAT; }
        @Override public Optional<ImagePurpose> purposeSelection() { return Optional.ofNullable(purpose); }
        @Override public Optional<StylePreset> styleSelection() { return Optional.ofNullable(style); }
    }

    record Generate(String text, ImagePurpose purpose, StylePreset style, String referenceImageId)
            implements ClientIntent {
        @Override public IntentKind kind() { return IntentKind.GENERATE; }
        @Override public Optional<ImagePurpose> purposeSelection() { return Optional.ofNullable(purpose); }
        @Override public Optional<StylePreset> styleSelection() { return Optional.ofNullable(style); }
        public Optional<String> referenceImage() { return Optional.ofNullable(referenceImageId); }
    }

    record Refine(String text, String imageId) implements ClientIntent {
        @Override public IntentKind kind() { return IntentKind.REFINE; }
    }

    record Converse(String text, ImagePurpose purpose, StylePreset style) implements ClientIntent {
        @Override public IntentKind kind() { return IntentKind.CONVERSE; }
        @Override public Optional<ImagePurpose> purposeSelection() { return Optional.ofNullable(purpose); }
        @Override public Optional<StylePreset> styleSelection() { return Optional.ofNullable(style); }
    }
}
