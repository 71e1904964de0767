package io.github.drompincen.imagechat.runtime.store;

import io.github.drompincen.imagechat.persistence.document.GeneratedImageDocument;
import io.github.drompincen.imagechat.persistence.document.MessageDocument;
import io.github.drompincen.imagechat.persistence.document.SessionDocument;
import io.github.drompincen.imagechat.protocol.api.CreateSessionRequest;
import io.github.drompincen.imagechat.protocol.api.ImagePurpose;
import io.github.drompincen.imagechat.protocol.api.SessionStatus;
import io.github.drompincen.imagechat.protocol.api.StylePreset;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/** Map-backed store for engine tests. {@link #setAvailable(boolean)} simulates a store outage. */
public class InMemorySessionStore implements SessionStore {

    private final Map<String, SessionDocument> sessions = new LinkedHashMap<>();
    private final Map<String, List<MessageDocument>> messages = new LinkedHashMap<>();
    private final Map<String, GeneratedImageDocument> images = new LinkedHashMap<>();
    private volatile boolean available = true;

    public void setAvailable(boolean available) { this.available = available; }

    public synchronized SessionDocument createSession(String sessionId, ImagePurpose purpose) {
        SessionDocument doc = new SessionDocument();
        doc.setSessionId(sessionId);
        doc.setTitle("Test session");
        doc.setImagePurpose(purpose);
        doc.setStatus(SessionStatus.ACTIVE);
        doc.setCreatedAt(Instant.now());
        doc.setUpdatedAt(Instant.now());
        sessions.put(sessionId, doc);
        messages.put(sessionId, new ArrayList<>());
        return doc;
    }

    @Override
    public synchronized SessionDocument createSession(CreateSessionRequest request) {
        checkAvailable();
        SessionDocument doc = createSession(UUID.randomUUID().toString(), request.imagePurpose());
        doc.setTitle(request.title());
        doc.setStylePreset(request.stylePreset());
        doc.setBrandGuidelines(request.brandGuidelines());
        return doc;
    }

    @Override
    public synchronized Optional<SessionDocument> findSession(String sessionId) {
        checkAvailable();
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public synchronized Optional<SessionDetail> getSession(String sessionId) {
        checkAvailable();
        return findSession(sessionId).map(s -> new SessionDetail(s, List.copyOf(messages.get(sessionId))));
    }

    @Override
    public synchronized SessionPage listSessions(int limit, int offset, SessionStatus status) {
        checkAvailable();
        List<SessionDocument> matching = sessions.values().stream()
                .filter(s -> status == null || s.getStatus() == status)
                .sorted(Comparator.comparing(SessionDocument::getCreatedAt).reversed())
                .toList();
        List<SessionDocument> page = matching.stream().skip(offset).limit(limit).toList();
        return new SessionPage(page, matching.size(), limit, offset);
    }

    @Override
    public synchronized boolean deleteSession(String sessionId) {
        checkAvailable();
        images.values().removeIf(i -> i.getSessionId().equals(sessionId));
        messages.remove(sessionId);
        return sessions.remove(sessionId) != null;
    }

    @Override
    public synchronized MessageDocument appendMessage(String sessionId, MessageDraft draft) {
        checkAvailable();
        SessionDocument session = sessions.get(sessionId);
        if (session == null) throw new SessionNotFoundException(sessionId);
        session.setMessagesCount(session.getMessagesCount() + 1);
        session.setTotalTokensUsed(session.getTotalTokensUsed() + draft.tokensUsed());

        MessageDocument message = new MessageDocument();
        message.setMessageId(UUID.randomUUID().toString());
        message.setSessionId(sessionId);
        message.setSeq(session.getMessagesCount());
        message.setRole(draft.role());
        message.setContentKind(draft.contentKind());
        message.setText(draft.text());
        message.setTokensUsed(draft.tokensUsed());
        message.setGenerationTimeMs(draft.generationTimeMs());
        message.setMetadata(draft.metadata());
        message.setTimestamp(Instant.now());
        if (draft.image() != null) {
            GeneratedImageDocument image = new GeneratedImageDocument();
            image.setImageId(UUID.randomUUID().toString());
            image.setSessionId(sessionId);
            image.setMessageId(message.getMessageId());
            image.setData(draft.image().data());
            image.setMimeType(draft.image().mimeType());
            image.setRefinedFrom(draft.image().refinedFrom());
            image.setPromptUsed(draft.image().promptUsed());
            images.put(image.getImageId(), image);
            message.setImageId(image.getImageId());
            session.setImagesGenerated(session.getImagesGenerated() + 1);
            session.setLastImageId(image.getImageId());
        }
        messages.get(sessionId).add(message);
        return message;
    }

    @Override
    public synchronized List<MessageDocument> recentMessages(String sessionId, int limit) {
        checkAvailable();
        List<MessageDocument> all = messages.getOrDefault(sessionId, List.of());
        return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    @Override
    public synchronized Optional<GeneratedImageDocument> findImage(String sessionId, String imageId) {
        checkAvailable();
        return Optional.ofNullable(images.get(imageId)).filter(i -> i.getSessionId().equals(sessionId));
    }

    @Override
    public synchronized Optional<GeneratedImageDocument> findImage(String imageId) {
        checkAvailable();
        return Optional.ofNullable(images.get(imageId));
    }

    @Override
    public synchronized void updateSelection(String sessionId, ImagePurpose purpose, StylePreset style) {
        checkAvailable();
        SessionDocument session = sessions.get(sessionId);
        if (session == null) return;
        if (purpose != null) session.setImagePurpose(purpose);
        if (style != null) session.setStylePreset(style);
    }

    @Override
    public synchronized Optional<SessionDocument> updateStatus(String sessionId, SessionStatus status) {
        checkAvailable();
        SessionDocument session = sessions.get(sessionId);
        if (session != null) session.setStatus(status);
        return Optional.ofNullable(session);
    }

    public synchronized List<MessageDocument> messages(String sessionId) {
        return List.copyOf(messages.getOrDefault(sessionId, List.of()));
    }

    private void checkAvailable() {
        if (!available) throw new DataAccessResourceFailureException("store is down");
    }
}
