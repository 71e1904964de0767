package io.github.drompincen.imagechat.runtime.generation;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "imagechat.generation")
public record GenerationProperties(
        @DefaultValue("gemini") String provider,
        String apiKey,
        @DefaultValue("gemini-3-pro-image-preview") String model,
        @DefaultValue("120s") Duration timeout
) {
    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
