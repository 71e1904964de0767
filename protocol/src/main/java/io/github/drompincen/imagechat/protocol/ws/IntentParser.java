package io.github.drompincen.imagechat.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.imagechat.protocol.api.ImagePurpose;
import io.github.drompincen.imagechat.protocol.api.StylePreset;

/**
 * Turns a raw {@link InboundFrame} into a {@link ClientIntent}, rejecting unknown kinds,
 * missing required fields and values outside the fixed enumerations.
 */
public class IntentParser {

    static final int MAX_CHAT_LENGTH = 2000;
    static final int MAX_PROMPT_LENGTH = 1000;
    static final int MAX_FEEDBACK_LENGTH = 500;

    public ClientIntent parse(InboundFrame frame) {
        if (frame.type() == null || frame.type().isBlank()) {
            throw new FrameValidationException(ErrorCode.MISSING_FIELD, "Missing required field: type");
        }
        IntentKind kind = IntentKind.fromId(frame.type())
                .orElseThrow(() -> new FrameValidationException(ErrorCode.UNKNOWN_TYPE,
                        "Unknown message type: " + frame.type()));

        JsonNode data = frame.data();
        if (data != null && !data.isNull() && !data.isObject()) {
            throw new FrameValidationException(ErrorCode.INVALID_FIELD, "Field data must be an object");
        }

        return switch (kind) {
            case CHAT -> new ClientIntent.Chat(
                    requiredText(frame, MAX_CHAT_LENGTH), purpose(data), style(data));
            case GENERATE -> new ClientIntent.Generate(
                    requiredText(frame, MAX_PROMPT_LENGTH), purpose(data), style(data), optionalString(data, "image_id"));
            case REFINE -> {
                String feedback = requiredText(frame, MAX_FEEDBACK_LENGTH);
                String imageId = optionalString(data, "image_id");
                if (imageId == null) {
                    throw new FrameValidationException(ErrorCode.MISSING_FIELD,
                            "Missing required field: data.image_id");
                }
                yield new ClientIntent.Refine(feedback, imageId);
            }
            case CONVERSE -> new ClientIntent.Converse(
                    requiredText(frame, MAX_CHAT_LENGTH), purpose(data), style(data));
        };
    }

    /** Builds a chat turn from already-typed fields, as the HTTP endpoints receive them. */
    public ClientIntent.Chat chat(String content, ImagePurpose purpose, StylePreset style) {
        return new ClientIntent.Chat(requiredText(content, "content", MAX_CHAT_LENGTH), purpose, style);
    }

    public ClientIntent.Generate generate(String prompt, ImagePurpose purpose, StylePreset style,
                                          String referenceImageId) {
        return new ClientIntent.Generate(requiredText(prompt, "prompt", MAX_PROMPT_LENGTH), purpose, style,
                blankToNull(referenceImageId));
    }

    public ClientIntent.Refine refine(String feedback, String imageId) {
        String text = requiredText(feedback, "feedback", MAX_FEEDBACK_LENGTH);
        String target = blankToNull(imageId);
        if (target == null) {
            throw new FrameValidationException(ErrorCode.MISSING_FIELD, "Missing required field: image_id");
        }
        return new ClientIntent.Refine(text, target);
    }

    private String requiredText(InboundFrame frame, int maxLength) {
        JsonNode content = frame.content();
        if (content != null && !content.isNull() && !content.isTextual()) {
            throw new FrameValidationException(ErrorCode.INVALID_FIELD, "Field content must be a string");
        }
        return requiredText(content == null || content.isNull() ? null : content.asText(), "content", maxLength);
    }

    private String requiredText(String raw, String field, int maxLength) {
        String text = raw == null ? "" : raw.strip();
        if (text.isEmpty()) {
            throw new FrameValidationException(ErrorCode.MISSING_FIELD, "Missing required field: " + field);
        }
        if (text.length() > maxLength) {
            throw new FrameValidationException(ErrorCode.INVALID_FIELD,
                    "Field " + field + " exceeds " + maxLength + " characters");
        }
        return text;
    }

    private ImagePurpose purpose(JsonNode data) {
        String id = optionalString(data, "purpose");
        if (id == null) return null;
        return ImagePurpose.fromId(id).orElseThrow(() ->
                new FrameValidationException(ErrorCode.INVALID_FIELD, "Unknown purpose: " + id));
    }

    private StylePreset style(JsonNode data) {
        String id = optionalString(data, "style");
        if (id == null) return null;
        return StylePreset.fromId(id).orElseThrow(() ->
                new FrameValidationException(ErrorCode.INVALID_FIELD, "Unknown style: " + id));
    }

    private String optionalString(JsonNode data, String field) {
        if (data == null || !data.hasNonNull(field)) return null;
        JsonNode value = data.get(field);
        if (!value.isTextual()) {
            throw new FrameValidationException(ErrorCode.INVALID_FIELD, "Field data." + field + " must be a string");
        }
        return blankToNull(value.asText());
    }

    private static String blankToNull(String value) {
        if (value == null) return null;
        String text = value.strip();
        return text.isEmpty() ? null : text;
    }
}
