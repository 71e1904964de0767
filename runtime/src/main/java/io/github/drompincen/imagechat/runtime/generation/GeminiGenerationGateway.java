package io.github.drompincen.imagechat.runtime.generation;

import com.google.genai.Client;
import com.google.genai.errors.ApiException;
import com.google.genai.types.Blob;
import com.google.genai.types.Candidate;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.HttpOptions;
import com.google.genai.types.Part;
import io.github.drompincen.imagechat.protocol.api.MessageRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Gemini image model backend. Without {@code GEMINI_API_KEY} the bean still starts but reports
 * itself unavailable, so requests fail fast with {@code UPSTREAM_UNAVAILABLE}.
 */
@Service
@ConditionalOnProperty(name = "imagechat.generation.provider", havingValue = "gemini", matchIfMissing = true)
public class GeminiGenerationGateway extends BoundedGenerationGateway {

    private static final Logger log = LoggerFactory.getLogger(GeminiGenerationGateway.class);

    private final GenerationProperties properties;
    private final PromptComposer promptComposer;
    private final Client client;

    public GeminiGenerationGateway(GenerationProperties properties, PromptComposer promptComposer) {
        super(properties.timeout());
        this.properties = properties;
        this.promptComposer = promptComposer;
        if (properties.hasApiKey()) {
            this.client = Client.builder()
                    .apiKey(properties.apiKey())
                    .httpOptions(HttpOptions.builder().timeout((int) properties.timeout().toMillis()).build())
                    .build();
            log.info("Gemini backend ready, model={} timeout={}s", properties.model(), properties.timeout().toSeconds());
        } else {
            this.client = null;
            log.warn("GEMINI_API_KEY is not set; generation requests will be rejected");
        }
    }

    @Override
    public boolean isAvailable() { return client != null; }

    @Override
    public String modelName() { return properties.model(); }

    @Override
    protected GenerationResult invoke(GenerationRequest request) {
        String prompt = promptComposer.compose(request);

        List<Content> contents = new ArrayList<>();
        for (ContextTurn turn : request.context()) {
            String text = turn.text() != null ? turn.text() : (turn.hadImage() ? "[generated image]" : null);
            if (text == null) continue;
            contents.add(Content.builder()
                    .role(turn.role() == MessageRole.USER ? "user" : "model")
                    .parts(List.of(Part.fromText(text)))
                    .build());
        }
        List<Part> parts = new ArrayList<>();
        if (request.sourceImage() != null) {
            parts.add(Part.fromBytes(request.sourceImage().data(), request.sourceImage().mimeType()));
        }
        parts.add(Part.fromText(prompt));
        contents.add(Content.builder().role("user").parts(parts).build());

        GenerateContentConfig.Builder config = GenerateContentConfig.builder()
                .systemInstruction(Content.fromParts(Part.fromText(promptComposer.systemInstruction(request.mode()))));
        if (request.mode().producesImage()) {
            config.responseModalities("TEXT", "IMAGE");
        } else {
            config.responseModalities("TEXT");
        }

        GenerateContentResponse response = client.models.generateContent(properties.model(), contents, config.build());
        return toResult(request, prompt, response);
    }

    private GenerationResult toResult(GenerationRequest request, String prompt, GenerateContentResponse response) {
        StringBuilder text = new StringBuilder();
        ImagePayload image = null;
        List<Candidate> candidates = response.candidates().orElse(List.of());
        if (!candidates.isEmpty() && candidates.get(0).content().isPresent()) {
            for (Part part : candidates.get(0).content().get().parts().orElse(List.of())) {
                part.text().ifPresent(text::append);
                if (image == null && part.inlineData().isPresent()) {
                    Blob blob = part.inlineData().get();
                    if (blob.data().isPresent()) {
                        image = new ImagePayload(blob.data().get(), blob.mimeType().orElse("image/png"));
                    }
                }
            }
        }
        if (request.mode().producesImage() && image == null) {
            throw new GenerationException(GenerationFailure.UNKNOWN, "The model response contained no image");
        }
        if (!request.mode().producesImage() && text.length() == 0) {
            throw new GenerationException(GenerationFailure.UNKNOWN, "The model response contained no text");
        }
        int tokens = response.usageMetadata().flatMap(u -> u.totalTokenCount()).orElse(0);
        return new GenerationResult(text.length() > 0 ? text.toString() : null, image, 0, tokens,
                prompt, properties.model());
    }

    @Override
    protected GenerationException translate(Throwable cause) {
        if (cause instanceof ApiException apiException) {
            GenerationFailure failure = failureForStatus(apiException.code());
            return new GenerationException(failure,
                    "Gemini returned HTTP " + apiException.code() + ": " + apiException.getMessage(), apiException);
        }
        return super.translate(cause);
    }

    static GenerationFailure failureForStatus(int status) {
        if (status == 429) return GenerationFailure.RATE_LIMITED;
        if (status == 408) return GenerationFailure.TIMEOUT;
        if (status >= 500) return GenerationFailure.UPSTREAM_UNAVAILABLE;
        if (status == 400 || status == 413 || status == 422) return GenerationFailure.INVALID_INPUT;
        return GenerationFailure.UNKNOWN;
    }
}
