package io.github.drompincen.imagechat.runtime.session;

import io.github.drompincen.imagechat.protocol.ws.OutboundFrame;

import java.io.IOException;

/** The live connection a session's frames are routed to. */
public interface FrameSink {

    String id();

    boolean isOpen();

    void send(OutboundFrame frame) throws IOException;

    void ping() throws IOException;

    void close(int code, String reason);
}
