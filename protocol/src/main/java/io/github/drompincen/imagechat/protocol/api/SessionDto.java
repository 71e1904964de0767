package io.github.drompincen.imagechat.protocol.api;

import java.time.Instant;
import java.util.Map;

public record SessionDto(
        String id,
        String title,
        ImagePurpose imagePurpose,
        SessionStatus status,
        StylePreset stylePreset,
        Map<String, Object> brandGuidelines,
        String lastImageId,
        String lastImageUrl,
        long messagesCount,
        int imagesGenerated,
        long totalTokensUsed,
        Instant createdAt,
        Instant updatedAt
) {}
