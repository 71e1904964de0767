package io.github.drompincen.imagechat.gateway.websocket;

import io.github.drompincen.imagechat.protocol.ws.FrameCodec;
import io.github.drompincen.imagechat.protocol.ws.OutboundFrame;
import io.github.drompincen.imagechat.runtime.session.FrameSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * A socket connection as seen by session state. Writes go through a
 * {@link ConcurrentWebSocketSessionDecorator} because terminal frames, queued notices and pings
 * are sent from different threads.
 */
public class WebSocketFrameSink implements FrameSink {

    private static final Logger log = LoggerFactory.getLogger(WebSocketFrameSink.class);

    static final int SEND_TIME_LIMIT_MS = 10_000;
    // Image frames carry the picture inline as a data URL.
    static final int BUFFER_SIZE_LIMIT = 32 * 1024 * 1024;

    private final WebSocketSession session;
    private final FrameCodec codec;

    public WebSocketFrameSink(WebSocketSession session, FrameCodec codec) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        this.codec = codec;
    }

    @Override
    public String id() { return session.getId(); }

    @Override
    public boolean isOpen() { return session.isOpen(); }

    @Override
    public void send(OutboundFrame frame) throws IOException {
        session.sendMessage(new TextMessage(codec.encode(frame)));
    }

    @Override
    public void ping() throws IOException {
        session.sendMessage(new PingMessage());
    }

    @Override
    public void close(int code, String reason) {
        if (!session.isOpen()) return;
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            log.debug("Closing connection {} failed: {}", id(), e.getMessage());
        }
    }
}
