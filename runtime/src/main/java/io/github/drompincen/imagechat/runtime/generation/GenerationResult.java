package io.github.drompincen.imagechat.runtime.generation;

public record GenerationResult(
        String text,
        ImagePayload image,
        long elapsedMs,
        int tokensUsed,
        String promptUsed,
        String modelUsed
) {
    public boolean hasText() { return text != null && !text.isBlank(); }

    public boolean hasImage() { return image != null; }

    GenerationResult withElapsed(long elapsedMs) {
        return new GenerationResult(text, image, elapsedMs, tokensUsed, promptUsed, modelUsed);
    }
}
