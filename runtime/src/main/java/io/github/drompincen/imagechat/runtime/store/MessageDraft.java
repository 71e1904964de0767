package io.github.drompincen.imagechat.runtime.store;

import io.github.drompincen.imagechat.protocol.api.ContentKind;
import io.github.drompincen.imagechat.protocol.api.MessageRole;

import java.util.Map;

public record MessageDraft(
        MessageRole role,
        String text,
        ImageDraft image,
        int tokensUsed,
        Long generationTimeMs,
        Map<String, Object> metadata
) {
    public static MessageDraft user(String text, Map<String, Object> metadata) {
        return new MessageDraft(MessageRole.USER, text, null, 0, null, metadata);
    }

    public static MessageDraft assistant(String text, ImageDraft image, int tokensUsed, long generationTimeMs) {
        return new MessageDraft(MessageRole.ASSISTANT, text, image, tokensUsed, generationTimeMs, null);
    }

    public ContentKind contentKind() {
        return ContentKind.of(text != null && !text.isBlank(), image != null);
    }
}
