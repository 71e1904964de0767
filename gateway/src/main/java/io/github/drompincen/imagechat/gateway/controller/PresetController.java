package io.github.drompincen.imagechat.gateway.controller;

import io.github.drompincen.imagechat.protocol.api.ImagePurpose;
import io.github.drompincen.imagechat.protocol.api.PurposePresetDto;
import io.github.drompincen.imagechat.protocol.api.StylePreset;
import io.github.drompincen.imagechat.protocol.api.StylePresetDto;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/api/image-chat")
public class PresetController {

    @GetMapping("/purposes")
    public List<PurposePresetDto> purposes() {
        return Arrays.stream(ImagePurpose.values()).map(PurposePresetDto::of).toList();
    }

    @GetMapping("/styles")
    public List<StylePresetDto> styles() {
        return Arrays.stream(StylePreset.values()).map(StylePresetDto::of).toList();
    }
}
