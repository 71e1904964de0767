package io.github.drompincen.imagechat.runtime.generation;

import io.github.drompincen.imagechat.protocol.api.MessageRole;

/** One remembered turn of the conversation, sent to the backend as short-term context. */
public record ContextTurn(MessageRole role, String text, boolean hadImage) {}
