package io.github.drompincen.imagechat.protocol.api;

public record RefineImageRequest(
        String feedback,
        String imageId
) {}
