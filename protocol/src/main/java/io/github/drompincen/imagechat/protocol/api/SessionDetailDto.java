package io.github.drompincen.imagechat.protocol.api;

import java.util.List;

public record SessionDetailDto(
        SessionDto session,
        List<MessageDto> messages
) {}
