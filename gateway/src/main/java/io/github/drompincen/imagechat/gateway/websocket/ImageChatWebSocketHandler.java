package io.github.drompincen.imagechat.gateway.websocket;

import io.github.drompincen.imagechat.protocol.ws.ErrorCode;
import io.github.drompincen.imagechat.protocol.ws.FrameCodec;
import io.github.drompincen.imagechat.protocol.ws.OutboundFrame;
import io.github.drompincen.imagechat.runtime.engine.ProtocolEngine;
import io.github.drompincen.imagechat.runtime.session.SessionRegistry;
import io.github.drompincen.imagechat.runtime.session.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connection supervisor for {@code /ws/image-chat/{sessionId}}. Binds each accepted socket to the
 * session's state, routes inbound text to the protocol engine and unbinds on close. The session
 * state, its lock and any in-flight generation survive the connection.
 */
@Component
public class ImageChatWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ImageChatWebSocketHandler.class);

    public static final int SUPERSEDED = 4000;
    public static final int SESSION_DELETED = 4004;

    private final SessionRegistry registry;
    private final ProtocolEngine engine;
    private final FrameCodec codec;
    private final Map<String, Binding> connections = new ConcurrentHashMap<>();

    private record Binding(SessionState state, WebSocketFrameSink sink) {}

    public ImageChatWebSocketHandler(SessionRegistry registry, ProtocolEngine engine, FrameCodec codec) {
        this.registry = registry;
        this.engine = engine;
        this.codec = codec;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketFrameSink sink = new WebSocketFrameSink(session, codec);
        String sessionId = sessionIdOf(session.getUri());

        Optional<SessionRegistry.Attachment> attached;
        try {
            attached = sessionId != null ? registry.attach(sessionId, sink) : Optional.empty();
        } catch (DataAccessException e) {
            log.error("Store unavailable while accepting connection for session {}", sessionId, e);
            reject(sink, OutboundFrame.error(ErrorCode.PERSISTENCE_FAILURE, "The session store is unavailable"),
                    CloseStatus.SERVER_ERROR.withReason("store unavailable"));
            return;
        }
        if (attached.isEmpty()) {
            log.info("Rejected connection {} for unknown session {}", session.getId(), sessionId);
            reject(sink, OutboundFrame.error(ErrorCode.SESSION_NOT_FOUND, "Unknown session: " + sessionId),
                    CloseStatus.POLICY_VIOLATION.withReason("unknown session"));
            return;
        }

        SessionState state = attached.get().state();
        boolean resumed = attached.get().resumed();
        connections.put(session.getId(), new Binding(state, sink));
        attached.get().superseded().ifPresent(previous -> {
            log.info("Connection {} supersedes {} for session {}", sink.id(), previous.id(), sessionId);
            previous.close(SUPERSEDED, "superseded");
        });
        log.info("Connection {} bound to session {} (resumed={})", session.getId(), sessionId, resumed);

        Map<String, Object> greeting = new LinkedHashMap<>();
        greeting.put("session_id", sessionId);
        greeting.put("resumed", resumed);
        greeting.put("generating", state.isGenerating());
        state.send(OutboundFrame.status("connected", greeting));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Binding binding = connections.get(session.getId());
        if (binding == null) {
            log.debug("Ignoring frame on unbound connection {}", session.getId());
            return;
        }
        engine.handle(binding.state(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on connection {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Binding binding = connections.remove(session.getId());
        if (binding == null) return;
        boolean unbound = binding.state().unbind(binding.sink());
        log.info("Connection {} for session {} closed with {} (unbound={}, generating={})",
                session.getId(), binding.state().sessionId(), status.getCode(), unbound,
                binding.state().isGenerating());
    }

    /** Sends a ping on every open connection so idle proxies keep the socket alive. */
    @Scheduled(fixedDelayString = "${imagechat.websocket.ping-interval-ms:25000}",
            initialDelayString = "${imagechat.websocket.ping-interval-ms:25000}")
    public void pingConnections() {
        for (Binding binding : connections.values()) {
            WebSocketFrameSink sink = binding.sink();
            if (!sink.isOpen()) continue;
            try {
                sink.ping();
            } catch (IOException e) {
                log.info("Ping failed on connection {}, closing: {}", sink.id(), e.getMessage());
                sink.close(CloseStatus.GOING_AWAY.getCode(), "ping failed");
            }
        }
    }

    public int connectionCount() {
        return connections.size();
    }

    private static void reject(WebSocketFrameSink sink, OutboundFrame error, CloseStatus status) {
        try {
            sink.send(error);
        } catch (IOException e) {
            log.debug("Could not deliver rejection to {}: {}", sink.id(), e.getMessage());
        }
        sink.close(status.getCode(), status.getReason());
    }

    static String sessionIdOf(URI uri) {
        if (uri == null || uri.getPath() == null) return null;
        String path = uri.getPath();
        String id = path.substring(path.lastIndexOf('/') + 1);
        return id.isBlank() ? null : id;
    }
}
