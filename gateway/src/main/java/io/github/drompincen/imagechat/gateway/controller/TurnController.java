package io.github.drompincen.imagechat.gateway.controller;

import io.github.drompincen.imagechat.protocol.api.GenerateImageRequest;
import io.github.drompincen.imagechat.protocol.api.RefineImageRequest;
import io.github.drompincen.imagechat.protocol.api.SendMessageRequest;
import io.github.drompincen.imagechat.protocol.ws.ClientIntent;
import io.github.drompincen.imagechat.protocol.ws.ErrorCode;
import io.github.drompincen.imagechat.protocol.ws.FrameValidationException;
import io.github.drompincen.imagechat.protocol.ws.IntentParser;
import io.github.drompincen.imagechat.protocol.ws.OutboundFrame;
import io.github.drompincen.imagechat.runtime.engine.ProtocolEngine;
import io.github.drompincen.imagechat.runtime.engine.TurnRejectedException;
import io.github.drompincen.imagechat.runtime.session.SessionRegistry;
import io.github.drompincen.imagechat.runtime.session.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Request/response form of the chat, generate and refine turns. Each call takes the same
 * per-session lane as socket frames and answers with the turn's terminal frame; a connection
 * bound to the session still receives the status and terminal frames as they happen.
 */
@RestController
@RequestMapping("/api/image-chat/sessions/{id}")
public class TurnController {

    private static final Logger log = LoggerFactory.getLogger(TurnController.class);

    private final SessionRegistry registry;
    private final ProtocolEngine engine;
    private final IntentParser parser = new IntentParser();

    public TurnController(SessionRegistry registry, ProtocolEngine engine) {
        this.registry = registry;
        this.engine = engine;
    }

    @PostMapping("/message")
    public CompletableFuture<ResponseEntity<OutboundFrame>> message(
            @PathVariable String id, @RequestBody(required = false) SendMessageRequest req) {
        return run(id, () -> {
            SendMessageRequest body = req != null ? req : new SendMessageRequest(null, null, null);
            return parser.chat(body.content(), body.imagePurpose(), body.stylePreset());
        });
    }

    @PostMapping("/generate")
    public CompletableFuture<ResponseEntity<OutboundFrame>> generate(
            @PathVariable String id, @RequestBody(required = false) GenerateImageRequest req) {
        return run(id, () -> {
            GenerateImageRequest body = req != null ? req : new GenerateImageRequest(null, null, null, null);
            return parser.generate(body.prompt(), body.imagePurpose(), body.stylePreset(), body.referenceImageId());
        });
    }

    @PostMapping("/refine")
    public CompletableFuture<ResponseEntity<OutboundFrame>> refine(
            @PathVariable String id, @RequestBody(required = false) RefineImageRequest req) {
        return run(id, () -> {
            RefineImageRequest body = req != null ? req : new RefineImageRequest(null, null);
            return parser.refine(body.feedback(), body.imageId());
        });
    }

    private CompletableFuture<ResponseEntity<OutboundFrame>> run(String sessionId, Supplier<ClientIntent> intent) {
        try {
            ClientIntent parsed = intent.get();
            Optional<SessionState> state = registry.loadOrCreate(sessionId);
            if (state.isEmpty()) {
                return done(OutboundFrame.error(ErrorCode.SESSION_NOT_FOUND, "Unknown session: " + sessionId));
            }
            return engine.submit(state.get(), parsed).thenApply(TurnController::respond);
        } catch (FrameValidationException e) {
            log.debug("Rejected HTTP turn for session {}: {} {}", sessionId, e.getCode(), e.getMessage());
            return done(OutboundFrame.error(e.getCode(), e.getMessage()));
        } catch (TurnRejectedException e) {
            return done(e.toFrame());
        } catch (DataAccessException e) {
            log.error("Store unavailable while loading session {}", sessionId, e);
            return done(OutboundFrame.error(ErrorCode.PERSISTENCE_FAILURE, "The session store is unavailable"));
        }
    }

    private static CompletableFuture<ResponseEntity<OutboundFrame>> done(OutboundFrame frame) {
        return CompletableFuture.completedFuture(respond(frame));
    }

    static ResponseEntity<OutboundFrame> respond(OutboundFrame frame) {
        HttpStatus status = frame.errorCode().map(TurnController::statusFor).orElse(HttpStatus.OK);
        return ResponseEntity.status(status).body(frame);
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case SESSION_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case MALFORMED_FRAME, UNKNOWN_TYPE, MISSING_FIELD, INVALID_FIELD, NO_PRIOR_IMAGE, UNKNOWN_IMAGE,
                    INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case UPSTREAM_UNAVAILABLE, PERSISTENCE_FAILURE -> HttpStatus.SERVICE_UNAVAILABLE;
            case UNKNOWN -> HttpStatus.BAD_GATEWAY;
        };
    }
}
