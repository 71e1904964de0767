package io.github.drompincen.imagechat.runtime.store;

import io.github.drompincen.imagechat.protocol.api.ImagePurpose;

/** Image bytes plus generation provenance, stored alongside the assistant turn that produced them. */
public record ImageDraft(
        byte[] data,
        String mimeType,
        Integer width,
        Integer height,
        String promptUsed,
        String modelUsed,
        ImagePurpose purpose,
        String refinedFrom
) {}
