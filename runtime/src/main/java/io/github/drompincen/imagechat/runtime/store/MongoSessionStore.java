package io.github.drompincen.imagechat.runtime.store;

import io.github.drompincen.imagechat.persistence.document.GeneratedImageDocument;
import io.github.drompincen.imagechat.persistence.document.MessageDocument;
import io.github.drompincen.imagechat.persistence.document.SessionDocument;
import io.github.drompincen.imagechat.persistence.repository.GeneratedImageRepository;
import io.github.drompincen.imagechat.persistence.repository.MessageRepository;
import io.github.drompincen.imagechat.persistence.repository.SessionRepository;
import io.github.drompincen.imagechat.protocol.api.CreateSessionRequest;
import io.github.drompincen.imagechat.protocol.api.ImagePurpose;
import io.github.drompincen.imagechat.protocol.api.SessionStatus;
import io.github.drompincen.imagechat.protocol.api.StylePreset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class MongoSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(MongoSessionStore.class);

    static final String DEFAULT_TITLE = "New image session";

    private final SessionRepository sessionRepository;
    private final MessageRepository messageRepository;
    private final GeneratedImageRepository imageRepository;
    private final MongoTemplate mongoTemplate;

    public MongoSessionStore(SessionRepository sessionRepository,
                             MessageRepository messageRepository,
                             GeneratedImageRepository imageRepository,
                             MongoTemplate mongoTemplate) {
        this.sessionRepository = sessionRepository;
        this.messageRepository = messageRepository;
        this.imageRepository = imageRepository;
        this.mongoTemplate = mongoTemplate;
    }

    // ---- Sessions ----

    @Override
    public SessionDocument createSession(CreateSessionRequest request) {
        Instant now = Instant.now();
        SessionDocument doc = new SessionDocument();
        doc.setSessionId(UUID.randomUUID().toString());
        doc.setTitle(request.title() != null && !request.title().isBlank() ? request.title().strip() : DEFAULT_TITLE);
        doc.setImagePurpose(request.imagePurpose());
        doc.setStylePreset(request.stylePreset());
        doc.setBrandGuidelines(request.brandGuidelines());
        doc.setStatus(SessionStatus.ACTIVE);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        SessionDocument saved = sessionRepository.save(doc);
        log.info("Created session {} purpose={}", saved.getSessionId(), saved.getImagePurpose().id());
        return saved;
    }

    @Override
    public Optional<SessionDocument> findSession(String sessionId) {
        return sessionRepository.findById(sessionId);
    }

    @Override
    public Optional<SessionDetail> getSession(String sessionId) {
        return sessionRepository.findById(sessionId)
                .map(session -> new SessionDetail(session,
                        messageRepository.findBySessionIdOrderBySeqAsc(sessionId)));
    }

    @Override
    public SessionPage listSessions(int limit, int offset, SessionStatus status) {
        Query query = new Query();
        if (status != null) {
            query.addCriteria(Criteria.where("status").is(status));
        }
        long total = mongoTemplate.count(query, SessionDocument.class);
        query.with(Sort.by(Sort.Direction.DESC, "createdAt")).skip(offset).limit(limit);
        return new SessionPage(mongoTemplate.find(query, SessionDocument.class), total, limit, offset);
    }

    @Override
    public boolean deleteSession(String sessionId) {
        if (!sessionRepository.existsById(sessionId)) {
            return false;
        }
        imageRepository.deleteBySessionId(sessionId);
        messageRepository.deleteBySessionId(sessionId);
        sessionRepository.deleteById(sessionId);
        log.info("Deleted session {} with its messages and images", sessionId);
        return true;
    }

    @Override
    public void updateSelection(String sessionId, ImagePurpose purpose, StylePreset style) {
        Update update = new Update().set("updatedAt", Instant.now());
        if (purpose != null) update.set("imagePurpose", purpose);
        if (style != null) update.set("stylePreset", style);
        mongoTemplate.updateFirst(byId(sessionId), update, SessionDocument.class);
    }

    @Override
    public Optional<SessionDocument> updateStatus(String sessionId, SessionStatus status) {
        Update update = new Update().set("status", status).set("updatedAt", Instant.now());
        return Optional.ofNullable(mongoTemplate.findAndModify(byId(sessionId), update,
                FindAndModifyOptions.options().returnNew(true), SessionDocument.class));
    }

    // ---- Message log ----

    @Override
    public MessageDocument appendMessage(String sessionId, MessageDraft draft) {
        Instant now = Instant.now();
        String messageId = UUID.randomUUID().toString();
        String imageId = draft.image() != null ? UUID.randomUUID().toString() : null;

        // Allocates the seq only. A failed write below leaves a gap in seq, never a dangling pointer.
        SessionDocument session = mongoTemplate.findAndModify(byId(sessionId),
                new Update().inc("messagesCount", 1).set("updatedAt", now),
                FindAndModifyOptions.options().returnNew(true), SessionDocument.class);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }

        MessageDocument message = new MessageDocument();
        message.setMessageId(messageId);
        message.setSessionId(sessionId);
        message.setSeq(session.getMessagesCount());
        message.setRole(draft.role());
        message.setContentKind(draft.contentKind());
        message.setText(draft.text());
        message.setImageId(imageId);
        message.setTokensUsed(draft.tokensUsed());
        message.setGenerationTimeMs(draft.generationTimeMs());
        message.setMetadata(draft.metadata());
        message.setTimestamp(now);

        MessageDocument saved;
        if (imageId != null) {
            imageRepository.save(toImageDocument(sessionId, messageId, imageId, draft.image(), now));
            try {
                saved = messageRepository.save(message);
            } catch (DataAccessException e) {
                discardOrphanImage(imageId, e);
                throw e;
            }
        } else {
            saved = messageRepository.save(message);
        }

        // Counters and lastImageId move only once the message and its image are both stored.
        if (imageId != null || draft.tokensUsed() != 0) {
            Update totals = new Update().inc("totalTokensUsed", draft.tokensUsed());
            if (imageId != null) {
                totals.inc("imagesGenerated", 1).set("lastImageId", imageId);
            }
            mongoTemplate.updateFirst(byId(sessionId), totals, SessionDocument.class);
        }
        log.debug("Appended {} message seq={} to session {}", draft.role().id(), saved.getSeq(), sessionId);
        return saved;
    }

    private void discardOrphanImage(String imageId, DataAccessException cause) {
        try {
            imageRepository.deleteById(imageId);
        } catch (DataAccessException e) {
            cause.addSuppressed(e);
            log.warn("Could not remove image {} after its message failed to save: {}", imageId, e.getMessage());
        }
    }

    @Override
    public List<MessageDocument> recentMessages(String sessionId, int limit) {
        if (limit <= 0) return List.of();
        List<MessageDocument> latest = new ArrayList<>(
                messageRepository.findBySessionIdOrderBySeqDesc(sessionId, PageRequest.of(0, limit)));
        Collections.reverse(latest);
        return latest;
    }

    // ---- Images ----

    @Override
    public Optional<GeneratedImageDocument> findImage(String sessionId, String imageId) {
        return imageRepository.findByImageIdAndSessionId(imageId, sessionId);
    }

    @Override
    public Optional<GeneratedImageDocument> findImage(String imageId) {
        return imageRepository.findById(imageId);
    }

    private static Query byId(String sessionId) {
        return new Query().addCriteria(Criteria.where("_id").is(sessionId));
    }

    private static GeneratedImageDocument toImageDocument(String sessionId, String messageId, String imageId,
                                                          ImageDraft draft, Instant createdAt) {
        GeneratedImageDocument doc = new GeneratedImageDocument();
        doc.setImageId(imageId);
        doc.setSessionId(sessionId);
        doc.setMessageId(messageId);
        doc.setMimeType(draft.mimeType());
        doc.setData(draft.data());
        doc.setWidth(draft.width());
        doc.setHeight(draft.height());
        doc.setPromptUsed(draft.promptUsed());
        doc.setModelUsed(draft.modelUsed());
        doc.setImagePurpose(draft.purpose());
        doc.setRefinedFrom(draft.refinedFrom());
        doc.setCreatedAt(createdAt);
        return doc;
    }
}
