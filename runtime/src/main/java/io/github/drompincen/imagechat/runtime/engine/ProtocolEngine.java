package io.github.drompincen.imagechat.runtime.engine;

import io.github.drompincen.imagechat.persistence.document.GeneratedImageDocument;
import io.github.drompincen.imagechat.persistence.document.MessageDocument;
import io.github.drompincen.imagechat.protocol.api.ImagePurpose;
import io.github.drompincen.imagechat.protocol.api.MessageRole;
import io.github.drompincen.imagechat.protocol.api.StylePreset;
import io.github.drompincen.imagechat.protocol.ws.ClientIntent;
import io.github.drompincen.imagechat.protocol.ws.ErrorCode;
import io.github.drompincen.imagechat.protocol.ws.FrameCodec;
import io.github.drompincen.imagechat.protocol.ws.FrameValidationException;
import io.github.drompincen.imagechat.protocol.ws.IntentParser;
import io.github.drompincen.imagechat.protocol.ws.OutboundFrame;
import io.github.drompincen.imagechat.runtime.generation.ContextTurn;
import io.github.drompincen.imagechat.runtime.generation.ConverseHeuristics;
import io.github.drompincen.imagechat.runtime.generation.GenerationException;
import io.github.drompincen.imagechat.runtime.generation.GenerationGateway;
import io.github.drompincen.imagechat.runtime.generation.GenerationMode;
import io.github.drompincen.imagechat.runtime.generation.GenerationRequest;
import io.github.drompincen.imagechat.runtime.generation.GenerationResult;
import io.github.drompincen.imagechat.runtime.generation.ImagePayload;
import io.github.drompincen.imagechat.runtime.session.GenerationScope;
import io.github.drompincen.imagechat.runtime.session.ImageRef;
import io.github.drompincen.imagechat.runtime.session.SessionState;
import io.github.drompincen.imagechat.runtime.store.ImageDraft;
import io.github.drompincen.imagechat.runtime.store.MessageDraft;
import io.github.drompincen.imagechat.runtime.store.SessionNotFoundException;
import io.github.drompincen.imagechat.runtime.store.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Turns inbound socket frames into session mutations and outbound frames.
 *
 * <p>Per accepted request: validate, persist the user turn, apply any purpose or style selection,
 * queue behind the session's generation lock, announce the step with a status frame, call the
 * backend, persist the assistant turn, then send exactly one terminal frame. Rejected frames
 * produce one error frame and change nothing. Socket frames and HTTP turns share this path.
 */
@Service
public class ProtocolEngine {

    private static final Logger log = LoggerFactory.getLogger(ProtocolEngine.class);

    private final SessionStore store;
    private final GenerationGateway gateway;
    private final ConverseHeuristics heuristics;
    private final FrameCodec codec = new FrameCodec();
    private final IntentParser parser = new IntentParser();

    public ProtocolEngine(SessionStore store, GenerationGateway gateway, ConverseHeuristics heuristics) {
        this.store = store;
        this.gateway = gateway;
        this.heuristics = heuristics;
    }

    /**
     * Handles one raw text frame. The returned future completes after the terminal frame for this
     * request has been sent (or dropped, if no connection is bound).
     */
    public CompletableFuture<Void> handle(SessionState state, String raw) {
        ClientIntent intent;
        try {
            intent = parser.parse(codec.decode(raw));
        } catch (FrameValidationException e) {
            log.debug("Rejected frame for session {}: {} {}", state.sessionId(), e.getCode(), e.getMessage());
            state.send(OutboundFrame.error(e.getCode(), e.getMessage()));
            return CompletableFuture.completedFuture(null);
        }
        try {
            return submit(state, intent).thenAccept(terminal -> { });
        } catch (TurnRejectedException e) {
            state.send(e.toFrame());
            return CompletableFuture.completedFuture(null);
        }
    }

    /**
     * Accepts one validated turn. Rejections throw before anything is stored; once accepted, the
     * returned future yields the turn's terminal frame, which is also sent to any bound connection.
     *
     * @throws TurnRejectedException if the turn is refused
     */
    public CompletableFuture<OutboundFrame> submit(SessionState state, ClientIntent intent) {
        String sessionId = state.sessionId();
        GeneratedImageDocument sourceImage;
        try {
            sourceImage = checkAgainstSession(state, intent);
        } catch (FrameValidationException e) {
            log.debug("Rejected {} for session {}: {} {}", intent.kind().id(), sessionId, e.getCode(), e.getMessage());
            throw new TurnRejectedException(e.getCode(), e.getMessage(), e);
        } catch (DataAccessException e) {
            throw storeUnavailable(sessionId, e);
        }

        if (!gateway.isAvailable()) {
            throw new TurnRejectedException(ErrorCode.UPSTREAM_UNAVAILABLE,
                    "Image generation is not available right now");
        }

        try {
            store.appendMessage(sessionId, MessageDraft.user(intent.text(), userMetadata(intent)));
        } catch (SessionNotFoundException e) {
            throw new TurnRejectedException(ErrorCode.SESSION_NOT_FOUND, e.getMessage(), e);
        } catch (DataAccessException e) {
            throw storeUnavailable(sessionId, e);
        }
        applySelection(state, intent);
        log.info("Session {} accepted {} request", sessionId, intent.kind().id());

        if (state.isBusy()) {
            state.send(OutboundFrame.status("queued", Map.of("request", intent.kind().id())));
        }
        ImagePurpose purpose = state.currentPurpose();
        StylePreset style = state.currentStyle().orElse(null);

        return state.withGenerationLock(scope -> {
            OutboundFrame terminal = process(state, scope, intent, purpose, style, sourceImage);
            state.send(terminal);
            return terminal;
        }).exceptionally(e -> {
            log.error("Unexpected failure handling {} for session {}", intent.kind().id(), sessionId, e);
            OutboundFrame error = OutboundFrame.error(ErrorCode.UNKNOWN, "Unexpected server error");
            state.send(error);
            return error;
        });
    }

    /** Checks that hold before anything is persisted. Returns the image the request refers to, if any. */
    private GeneratedImageDocument checkAgainstSession(SessionState state, ClientIntent intent) {
        if (intent instanceof ClientIntent.Refine refine) {
            if (state.lastImage().isEmpty()) {
                throw new FrameValidationException(ErrorCode.NO_PRIOR_IMAGE,
                        "There is no generated image in this session to refine yet");
            }
            return requireImage(state, refine.imageId());
        }
        if (intent instanceof ClientIntent.Generate generate && generate.referenceImage().isPresent()) {
            return requireImage(state, generate.referenceImage().get());
        }
        return null;
    }

    private GeneratedImageDocument requireImage(SessionState state, String imageId) {
        return store.findImage(state.sessionId(), imageId).orElseThrow(() ->
                new FrameValidationException(ErrorCode.UNKNOWN_IMAGE,
                        "Image " + imageId + " does not belong to this session"));
    }

    // Runs only after the user turn is stored, so a refused turn never moves the selection.
    private void applySelection(SessionState state, ClientIntent intent) {
        ImagePurpose purpose = intent.purposeSelection().orElse(null);
        StylePreset style = intent.styleSelection().orElse(null);
        if (purpose == null && style == null) return;
        state.select(purpose, style);
        try {
            store.updateSelection(state.sessionId(), purpose, style);
        } catch (DataAccessException e) {
            log.warn("Selection for session {} kept in memory only: {}", state.sessionId(), e.getMessage());
        }
    }

    // Runs under the session's generation lock.
    private OutboundFrame process(SessionState state, GenerationScope scope, ClientIntent intent,
                                  ImagePurpose purpose, StylePreset style, GeneratedImageDocument sourceImage) {
        try {
            GenerationMode mode = resolveMode(intent, scope);
            if (sourceImage == null && mode == GenerationMode.REFINE && intent instanceof ClientIntent.Converse) {
                String lastImageId = scope.lastImage().map(ImageRef::imageId).orElseThrow();
                sourceImage = store.findImage(scope.sessionId(), lastImageId).orElseThrow(() ->
                        new FrameValidationException(ErrorCode.UNKNOWN_IMAGE, "The last image is no longer stored"));
            }

            state.send(OutboundFrame.status(progressLabel(mode), Map.of("mode", mode.name().toLowerCase(Locale.ROOT))));

            var context = scope.context();
            scope.remember(new ContextTurn(MessageRole.USER, intent.text(), false));
            ImagePayload source = sourceImage != null
                    ? new ImagePayload(sourceImage.getData(), sourceImage.getMimeType())
                    : null;
            GenerationResult result = gateway.generate(
                    new GenerationRequest(mode, intent.text(), purpose, style, source, context));

            ImageDraft imageDraft = result.hasImage()
                    ? new ImageDraft(result.image().data(), result.image().mimeType(), purpose.width(),
                    purpose.height(), result.promptUsed(), result.modelUsed(), purpose,
                    sourceImage != null && mode == GenerationMode.REFINE ? sourceImage.getImageId() : null)
                    : null;
            MessageDocument saved = store.appendMessage(scope.sessionId(),
                    MessageDraft.assistant(result.text(), imageDraft, result.tokensUsed(), result.elapsedMs()));
            if (saved.getImageId() != null) {
                scope.updateLastImage(new ImageRef(saved.getImageId(), saved.getMessageId()));
            }
            scope.remember(new ContextTurn(MessageRole.ASSISTANT, result.text(), result.hasImage()));
            log.info("Session {} {} completed in {}ms", scope.sessionId(), mode, result.elapsedMs());
            return terminalFrame(mode, purpose, saved, result);
        } catch (FrameValidationException e) {
            return OutboundFrame.error(e.getCode(), e.getMessage());
        } catch (GenerationException e) {
            log.warn("Generation failed for session {}: {}", scope.sessionId(), e.getFailure());
            return OutboundFrame.error(e.getFailure().errorCode(), e.getMessage());
        } catch (SessionNotFoundException e) {
            return OutboundFrame.error(ErrorCode.SESSION_NOT_FOUND, e.getMessage());
        } catch (DataAccessException e) {
            log.error("Could not store result for session {}", scope.sessionId(), e);
            return OutboundFrame.error(ErrorCode.PERSISTENCE_FAILURE, "The result could not be saved");
        }
    }

    private GenerationMode resolveMode(ClientIntent intent, GenerationScope scope) {
        return switch (intent.kind()) {
            case CHAT -> GenerationMode.CHAT;
            case GENERATE -> GenerationMode.GENERATE;
            case REFINE -> GenerationMode.REFINE;
            case CONVERSE -> heuristics.decide(intent.text(), scope.lastImage().isPresent());
        };
    }

    private static String progressLabel(GenerationMode mode) {
        return switch (mode) {
            case CHAT -> "thinking";
            case GENERATE -> "generating";
            case REFINE -> "refining";
        };
    }

    private OutboundFrame terminalFrame(GenerationMode mode, ImagePurpose purpose,
                                        MessageDocument saved, GenerationResult result) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message_id", saved.getMessageId());
        data.put("generation_time_ms", result.elapsedMs());
        data.put("tokens_used", result.tokensUsed());
        data.put("model_used", result.modelUsed());
        if (!result.hasImage()) {
            return OutboundFrame.message(result.text(), data);
        }
        data.put("image_id", saved.getImageId());
        data.put("prompt_used", result.promptUsed());
        data.put("purpose", purpose.id());
        if (purpose.width() != null) data.put("width", purpose.width());
        if (purpose.height() != null) data.put("height", purpose.height());
        String imageUrl = result.image().dataUrl();
        if (result.hasText()) {
            return OutboundFrame.mixed(result.text(), imageUrl, data);
        }
        String caption = mode == GenerationMode.REFINE ? "Image refined" : "Image generated";
        return OutboundFrame.image(caption, imageUrl, data);
    }

    private static Map<String, Object> userMetadata(ClientIntent intent) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("intent", intent.kind().id());
        if (intent instanceof ClientIntent.Refine refine) {
            metadata.put("image_id", refine.imageId());
        } else if (intent instanceof ClientIntent.Generate generate) {
            generate.referenceImage().ifPresent(id -> metadata.put("image_id", id));
        }
        return metadata;
    }

    private static TurnRejectedException storeUnavailable(String sessionId, DataAccessException e) {
        log.error("Store unavailable while accepting a turn for session {}", sessionId, e);
        return new TurnRejectedException(ErrorCode.PERSISTENCE_FAILURE, "The session store is unavailable", e);
    }
}
