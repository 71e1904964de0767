package io.github.drompincen.imagechat.runtime.store;

import io.github.drompincen.imagechat.persistence.document.MessageDocument;
import io.github.drompincen.imagechat.persistence.document.SessionDocument;

import java.util.List;

public record SessionDetail(SessionDocument session, List<MessageDocument> messages) {}
