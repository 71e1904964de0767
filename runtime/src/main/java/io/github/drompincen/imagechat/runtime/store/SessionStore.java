package io.github.drompincen.imagechat.runtime.store;

import io.github.drompincen.imagechat.persistence.document.GeneratedImageDocument;
import io.github.drompincen.imagechat.persistence.document.MessageDocument;
import io.github.drompincen.imagechat.persistence.document.SessionDocument;
import io.github.drompincen.imagechat.protocol.api.CreateSessionRequest;
import io.github.drompincen.imagechat.protocol.api.ImagePurpose;
import io.github.drompincen.imagechat.protocol.api.SessionStatus;
import io.github.drompincen.imagechat.protocol.api.StylePreset;

import java.util.List;
import java.util.Optional;

/**
 * Durable home of sessions, their ordered message log and generated images.
 * Implementations surface storage outages as {@link org.springframework.dao.DataAccessException}.
 */
public interface SessionStore {

    SessionDocument createSession(CreateSessionRequest request);

    Optional<SessionDocument> findSession(String sessionId);

    /** The session with all of its messages in log order. */
    Optional<SessionDetail> getSession(String sessionId);

    /** Newest sessions first; {@code status} may be null to list every session. */
    SessionPage listSessions(int limit, int offset, SessionStatus status);

    /** Removes the session together with its messages and images. */
    boolean deleteSession(String sessionId);

    /**
     * Appends one message to the end of the session's log. The sequence number is taken from the
     * session's message counter in the same atomic update that bumps it, so concurrent appends for
     * one session never share or reorder a {@code seq}.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    MessageDocument appendMessage(String sessionId, MessageDraft draft);

    /** The most recent {@code limit} messages, oldest first. */
    List<MessageDocument> recentMessages(String sessionId, int limit);

    Optional<GeneratedImageDocument> findImage(String sessionId, String imageId);

    Optional<GeneratedImageDocument> findImage(String imageId);

    void updateSelection(String sessionId, ImagePurpose purpose, StylePreset style);

    Optional<SessionDocument> updateStatus(String sessionId, SessionStatus status);
}
