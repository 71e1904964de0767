package io.github.drompincen.imagechat.protocol.api;

public record SendMessageRequest(
        String content,
        ImagePurpose imagePurpose,
        StylePreset stylePreset
) {}
