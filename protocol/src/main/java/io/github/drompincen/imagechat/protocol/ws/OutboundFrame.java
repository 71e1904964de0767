package io.github.drompincen.imagechat.protocol.ws;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutboundFrame(
        @JsonProperty("type") FrameType type,
        @JsonProperty("content") String content,
        @JsonProperty("image_url") String imageUrl,
        @JsonProperty("data") Map<String, Object> data,
        @JsonProperty("timestamp") Instant timestamp
) {
    public static OutboundFrame status(String content) {
        return status(content, null);
    }

    public static OutboundFrame status(String content, Map<String, Object> data) {
        return new OutboundFrame(FrameType.STATUS, content, null, data, Instant.now());
    }

    public static OutboundFrame message(String content, Map<String, Object> data) {
        return new OutboundFrame(FrameType.MESSAGE, content, null, data, Instant.now());
    }

    public static OutboundFrame image(String content, String imageUrl, Map<String, Object> data) {
        return new OutboundFrame(FrameType.IMAGE, content, imageUrl, data, Instant.now());
    }

    public static OutboundFrame mixed(String content, String imageUrl, Map<String, Object> data) {
        return new OutboundFrame(FrameType.MIXED, content, imageUrl, data, Instant.now());
    }

    public static OutboundFrame error(ErrorCode code, String content) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("code", code.name());
        data.put("category", code.category().name());
        return new OutboundFrame(FrameType.ERROR, content, null, data, Instant.now());
    }

    @JsonIgnore
    public boolean isTerminal() { return type.isTerminal(); }

    /** The typed reason of an error frame; empty for every other frame type. */
    @JsonIgnore
    public Optional<ErrorCode> errorCode() {
        if (type != FrameType.ERROR || data == null || !(data.get("code") instanceof String code)) {
            return Optional.empty();
        }
        return Optional.of(ErrorCode.valueOf(code));
    }
}
