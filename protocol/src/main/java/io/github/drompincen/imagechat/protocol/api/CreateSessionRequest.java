package io.github.drompincen.imagechat.protocol.api;

import java.util.Map;

public record CreateSessionRequest(
        String title,
        ImagePurpose imagePurpose,
        StylePreset stylePreset,
        Map<String, Object> brandGuidelines
) {
    public CreateSessionRequest {
        if (imagePurpose == null) imagePurpose = ImagePurpose.DEFAULT;
    }

    public CreateSessionRequest(String title, ImagePurpose imagePurpose, StylePreset stylePreset) {
        this(title, imagePurpose, stylePreset, null);
    }
}
