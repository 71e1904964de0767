package io.github.drompincen.imagechat.runtime.generation;

import java.util.Base64;

public record ImagePayload(byte[] data, String mimeType) {

    public String dataUrl() {
        return "data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(data);
    }
}
