package io.github.drompincen.imagechat.runtime.generation;

import io.github.drompincen.imagechat.protocol.api.ImagePurpose;
import io.github.drompincen.imagechat.protocol.api.StylePreset;
import org.springframework.stereotype.Component;

/**
 * Builds the backend prompt from the user's text and the session's purpose and style.
 */
@Component
public class PromptComposer {

    static final String REFINE_PREFIX = "Please modify the previous image based on this feedback: ";

    static final String CONSULTANT_INSTRUCTION = """
            You are a creative marketing image consultant.
            Help users create effective marketing images by:
            1. Understanding their goals and target audience
            2. Suggesting visual concepts and compositions
            3. Recommending colors, styles, and layouts
            4. Providing feedback on their ideas

            When the user is ready to generate an image, ask them to confirm and it will be created.
            Respond in the language the user writes in.""";

    static final String DESIGNER_INSTRUCTION = """
            You are a marketing image designer. Produce exactly one finished image for the request,
            respecting the requested dimensions, aspect ratio and style. Keep any text in the image short.""";

    public String compose(GenerationRequest request) {
        return switch (request.mode()) {
            case CHAT -> request.prompt();
            case GENERATE -> {
                String prompt = withStyle(withPurpose(request.purpose(), request.prompt()), request.style());
                if (request.sourceImage() != null) {
                    prompt = "Use the attached image as a visual reference. " + prompt;
                }
                yield prompt + aspectRatioHint(request.purpose());
            }
            case REFINE -> REFINE_PREFIX + request.prompt() + aspectRatioHint(request.purpose());
        };
    }

    public String systemInstruction(GenerationMode mode) {
        return mode == GenerationMode.CHAT ? CONSULTANT_INSTRUCTION : DESIGNER_INSTRUCTION;
    }

    String withPurpose(ImagePurpose purpose, String base) {
        String sizeHint = purpose.width() != null && purpose.height() != null
                ? "Image dimensions: " + purpose.width() + "x" + purpose.height() + "px. "
                : "";
        String hint = purpose.promptHint();
        return hint.isEmpty() ? sizeHint + base : sizeHint + hint + ". " + base;
    }

    String withStyle(String base, StylePreset style) {
        if (style == null) return base;
        return base + ". Style: " + style.promptHint();
    }

    private String aspectRatioHint(ImagePurpose purpose) {
        return " Aspect ratio: " + purpose.aspectRatio() + ".";
    }
}
