package io.github.drompincen.imagechat.protocol.api;

public record StylePresetDto(String id, String description) {

    public static StylePresetDto of(StylePreset style) {
        return new StylePresetDto(style.id(), style.promptHint());
    }
}
