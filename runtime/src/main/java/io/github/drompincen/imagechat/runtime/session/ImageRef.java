package io.github.drompincen.imagechat.runtime.session;

/** Pointer to the last successfully generated image of a session. */
public record ImageRef(String imageId, String messageId) {}
