package io.github.drompincen.imagechat.runtime.generation;

import io.github.drompincen.imagechat.protocol.api.ImagePurpose;
import io.github.drompincen.imagechat.protocol.api.StylePreset;

import java.util.List;

/**
 * @param sourceImage the image being refined in {@link GenerationMode#REFINE}, or an optional
 *                    reference image for {@link GenerationMode#GENERATE}; null otherwise
 * @param context     recent turns, oldest first, not including this one
 */
public record GenerationRequest(
        GenerationMode mode,
        String prompt,
        ImagePurpose purpose,
        StylePreset style,
        ImagePayload sourceImage,
        List<ContextTurn> context
) {
    public GenerationRequest {
        if (purpose == null) purpose = ImagePurpose.DEFAULT;
        context = context == null ? List.of() : List.copyOf(context);
    }
}
