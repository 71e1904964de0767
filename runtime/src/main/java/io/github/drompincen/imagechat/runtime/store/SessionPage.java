package io.github.drompincen.imagechat.runtime.store;

import io.github.drompincen.imagechat.persistence.document.SessionDocument;

import java.util.List;

public record SessionPage(List<SessionDocument> sessions, long total, int limit, int offset) {}
