package io.github.drompincen.imagechat.gateway.controller;

import io.github.drompincen.imagechat.gateway.websocket.ImageChatWebSocketHandler;
import io.github.drompincen.imagechat.persistence.document.MessageDocument;
import io.github.drompincen.imagechat.persistence.document.SessionDocument;
import io.github.drompincen.imagechat.protocol.api.CreateSessionRequest;
import io.github.drompincen.imagechat.protocol.api.MessageDto;
import io.github.drompincen.imagechat.protocol.api.SessionDetailDto;
import io.github.drompincen.imagechat.protocol.api.SessionDto;
import io.github.drompincen.imagechat.protocol.api.SessionListDto;
import io.github.drompincen.imagechat.protocol.api.SessionStatus;
import io.github.drompincen.imagechat.protocol.api.UpdateSessionStatusRequest;
import io.github.drompincen.imagechat.runtime.session.SessionRegistry;
import io.github.drompincen.imagechat.runtime.store.SessionPage;
import io.github.drompincen.imagechat.runtime.store.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/image-chat/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    static final int MAX_PAGE_SIZE = 100;

    private final SessionStore store;
    private final SessionRegistry registry;

    public SessionController(SessionStore store, SessionRegistry registry) {
        this.store = store;
        this.registry = registry;
    }

    @PostMapping
    public ResponseEntity<SessionDto> create(@RequestBody(required = false) CreateSessionRequest req) {
        if (req == null) req = new CreateSessionRequest(null, null, null);
        return ResponseEntity.ok(toDto(store.createSession(req)));
    }

    @GetMapping
    public ResponseEntity<SessionListDto> list(@RequestParam(defaultValue = "20") int limit,
                                               @RequestParam(defaultValue = "0") int offset,
                                               @RequestParam(required = false) String status) {
        if (limit < 1 || limit > MAX_PAGE_SIZE || offset < 0) {
            return ResponseEntity.badRequest().build();
        }
        SessionStatus filter;
        try {
            filter = status != null ? SessionStatus.fromId(status) : null;
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
        SessionPage page = store.listSessions(limit, offset, filter);
        return ResponseEntity.ok(new SessionListDto(
                page.sessions().stream().map(SessionController::toDto).toList(),
                page.total(), page.limit(), page.offset()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<SessionDetailDto> get(@PathVariable String id) {
        return store.getSession(id)
                .map(detail -> ResponseEntity.ok(new SessionDetailDto(toDto(detail.session()),
                        detail.messages().stream().map(SessionController::toDto).toList())))
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{id}/status")
    public ResponseEntity<SessionDto> updateStatus(@PathVariable String id,
                                                   @RequestBody(required = false) UpdateSessionStatusRequest req) {
        if (req == null || req.status() == null) return ResponseEntity.badRequest().build();
        return store.updateStatus(id, req.status())
                .map(doc -> ResponseEntity.ok(toDto(doc)))
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        if (!store.deleteSession(id)) return ResponseEntity.notFound().build();
        registry.evict(id).flatMap(state -> state.boundSink()).ifPresent(sink -> {
            log.info("Closing connection {} of deleted session {}", sink.id(), id);
            sink.close(ImageChatWebSocketHandler.SESSION_DELETED, "session deleted");
        });
        return ResponseEntity.noContent().build();
    }

    static SessionDto toDto(SessionDocument doc) {
        return new SessionDto(doc.getSessionId(), doc.getTitle(), doc.getImagePurpose(), doc.getStatus(),
                doc.getStylePreset(), doc.getBrandGuidelines(), doc.getLastImageId(),
                ImageController.urlFor(doc.getLastImageId()),
                doc.getMessagesCount(), doc.getImagesGenerated(), doc.getTotalTokensUsed(),
                doc.getCreatedAt(), doc.getUpdatedAt());
    }

    static MessageDto toDto(MessageDocument doc) {
        return new MessageDto(doc.getMessageId(), doc.getSessionId(), doc.getSeq(), doc.getRole(),
                doc.getContentKind(), doc.getText(), doc.getImageId(), ImageController.urlFor(doc.getImageId()),
                doc.getTokensUsed(), doc.getGenerationTimeMs(), doc.getTimestamp());
    }
}
