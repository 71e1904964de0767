package io.github.drompincen.imagechat.runtime.support;

import io.github.drompincen.imagechat.protocol.ws.FrameType;
import io.github.drompincen.imagechat.protocol.ws.OutboundFrame;
import io.github.drompincen.imagechat.runtime.session.FrameSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Captures frames instead of writing them to a socket. */
public class RecordingSink implements FrameSink {

    private final String id;
    private final List<OutboundFrame> frames = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile Integer closeCode;

    public RecordingSink(String id) {
        this.id = id;
    }

    @Override public String id() { return id; }
    @Override public boolean isOpen() { return open; }
    @Override public void send(OutboundFrame frame) { frames.add(frame); }
    @Override public void ping() {}

    @Override
    public void close(int code, String reason) {
        open = false;
        closeCode = code;
    }

    public void drop() { open = false; }

    public List<OutboundFrame> frames() { return List.copyOf(frames); }

    public List<OutboundFrame> framesOfType(FrameType type) {
        return frames.stream().filter(f -> f.type() == type).toList();
    }

    public List<OutboundFrame> terminalFrames() {
        return frames.stream().filter(OutboundFrame::isTerminal).toList();
    }

    public Integer closeCode() { return closeCode; }
}
