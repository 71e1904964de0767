package io.github.drompincen.imagechat.runtime.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Base64;

/**
 * Offline backend for local runs and demos. Returns a 1x1 PNG for image requests and a canned
 * consultant reply for chat.
 *
 * Activate with: IMAGECHAT_GENERATION_PROVIDER=fake
 */
@Service
@ConditionalOnProperty(name = "imagechat.generation.provider", havingValue = "fake")
public class FakeGenerationGateway extends BoundedGenerationGateway {

    private static final Logger log = LoggerFactory.getLogger(FakeGenerationGateway.class);

    static final String MODEL = "fake-image-model";
    static final byte[] PIXEL_PNG = Base64.getDecoder().decode(
            "iVBORw0KGgoAAAANSUhEUgAAAAEAAAABCAYAAAAfFcSJAAAADUlEQVR42mP8z8BQDwAEhQGAhKmMIQAAAABJRU5ErkJggg==");

    private final PromptComposer promptComposer;
    private final long latencyMs;

    public FakeGenerationGateway(GenerationProperties properties,
                                 PromptComposer promptComposer,
                                 @Value("${imagechat.generation.fake-latency-ms:0}") long latencyMs) {
        super(properties.timeout());
        this.promptComposer = promptComposer;
        this.latencyMs = latencyMs;
    }

    @Override
    public boolean isAvailable() { return true; }

    @Override
    public String modelName() { return MODEL; }

    @Override
    protected GenerationResult invoke(GenerationRequest request) throws InterruptedException {
        if (latencyMs > 0) {
            Thread.sleep(latencyMs);
        }
        String prompt = promptComposer.compose(request);
        int tokens = Math.max(1, prompt.length() / 4);
        log.debug("[FAKE GEN] mode={} purpose={} prompt length={}", request.mode(), request.purpose().id(), prompt.length());
        if (!request.mode().producesImage()) {
            return new GenerationResult(chatReply(request.prompt()), null, 0, tokens, prompt, MODEL);
        }
        return new GenerationResult(null, new ImagePayload(PIXEL_PNG.clone(), "image/png"), 0, tokens, prompt, MODEL);
    }

    private String chatReply(String message) {
        return """
                Here are a few directions for "%s":
                1. Lead with one strong visual and keep the background quiet.
                2. Pick a palette of two or three brand colors.
                3. Leave space for a short headline.

                When you are happy with the direction, send it as a generate request and I will create the image."""
                .formatted(message.length() > 80 ? message.substring(0, 80) + "..." : message);
    }
}
