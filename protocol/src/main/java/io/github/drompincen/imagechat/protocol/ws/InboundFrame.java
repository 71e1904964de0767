package io.github.drompincen.imagechat.protocol.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw client frame as it arrives on the socket, before the intent is validated.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InboundFrame(
        String type,
        JsonNode content,
        JsonNode data
) {}
