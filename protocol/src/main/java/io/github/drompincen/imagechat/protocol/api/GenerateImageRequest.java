package io.github.drompincen.imagechat.protocol.api;

/** Body of {@code POST /sessions/{id}/generate}. {@code referenceImageId} must name an image of the same session. */
public record GenerateImageRequest(
        String prompt,
        ImagePurpose imagePurpose,
        StylePreset stylePreset,
        String referenceImageId
) {}
