package io.github.drompincen.imagechat.runtime.generation;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Decides what a free-form {@code converse} turn should do: answer in text, create a new image,
 * or revise the last one. Revision is only chosen when the session already has an image.
 */
@Component
public class ConverseHeuristics {

    private static final List<String> REVISE_CUES = List.of(
            "make it", "make the", "change", "modify", "adjust", "revise", "refine", "tweak", "edit",
            "replace", "instead", "brighter", "darker", "bigger", "smaller", "remove", "add a", "add an",
            "more ", "less ");

    private static final List<String> GENERATE_CUES = List.of(
            "generate", "create", "draw", "render", "design", "make an image", "make a picture",
            "make a banner", "image of", "picture of", "photo of", "illustration", "poster", "show me");

    public GenerationMode decide(String text, boolean hasPriorImage) {
        String lower = text.toLowerCase(Locale.ROOT);
        boolean generateCue = containsAny(lower, GENERATE_CUES);
        if (hasPriorImage && !generateCue && containsAny(lower, REVISE_CUES)) {
            return GenerationMode.REFINE;
        }
        if (generateCue && !isQuestion(lower)) {
            return GenerationMode.GENERATE;
        }
        return GenerationMode.CHAT;
    }

    private static boolean isQuestion(String lower) {
        return lower.stripTrailing().endsWith("?")
                && (lower.startsWith("how") || lower.startsWith("what") || lower.startsWith("why")
                || lower.startsWith("which") || lower.startsWith("should"));
    }

    private static boolean containsAny(String text, List<String> cues) {
        for (String cue : cues) {
            if (text.contains(cue)) return true;
        }
        return false;
    }
}
