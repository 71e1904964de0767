package io.github.drompincen.imagechat.protocol.api;

public record PurposePresetDto(
        String id,
        String name,
        String ratio,
        Integer width,
        Integer height,
        String description
) {
    public static PurposePresetDto of(ImagePurpose purpose) {
        return new PurposePresetDto(purpose.id(), purpose.displayName(), purpose.ratio(),
                purpose.width(), purpose.height(), purpose.description());
    }
}
