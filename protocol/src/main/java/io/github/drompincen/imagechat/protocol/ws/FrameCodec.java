package io.github.drompincen.imagechat.protocol.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON text codec for socket frames.
 */
public class FrameCodec {

    private final ObjectMapper objectMapper;

    public FrameCodec() {
        this(new ObjectMapper());
    }

    public FrameCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .findAndRegisterModules()
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    public InboundFrame decode(String text) {
        if (text == null || text.isBlank()) {
            throw new FrameValidationException(ErrorCode.MALFORMED_FRAME, "Empty frame");
        }
        try {
            var node = objectMapper.readTree(text);
            if (node == null || !node.isObject()) {
                throw new FrameValidationException(ErrorCode.MALFORMED_FRAME, "Frame must be a JSON object");
            }
            return objectMapper.treeToValue(node, InboundFrame.class);
        } catch (JsonProcessingException e) {
            throw new FrameValidationException(ErrorCode.MALFORMED_FRAME,
                    "Frame is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String encode(OutboundFrame frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + frame.type() + " frame", e);
        }
    }
}
