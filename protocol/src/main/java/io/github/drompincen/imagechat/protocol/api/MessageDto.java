package io.github.drompincen.imagechat.protocol.api;

import java.time.Instant;

public record MessageDto(
        String id,
        String sessionId,
        long seq,
        MessageRole role,
        ContentKind contentKind,
        String textContent,
        String imageId,
        String imageUrl,
        int tokensUsed,
        Long generationTimeMs,
        Instant createdAt
) {}
