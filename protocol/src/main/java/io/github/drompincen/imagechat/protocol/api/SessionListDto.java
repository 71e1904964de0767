package io.github.drompincen.imagechat.protocol.api;

import java.util.List;

public record SessionListDto(
        List<SessionDto> sessions,
        long total,
        int limit,
        int offset
) {}
