package io.github.drompincen.imagechat.runtime.engine;

import io.github.drompincen.imagechat.protocol.ws.ErrorCode;
import io.github.drompincen.imagechat.protocol.ws.OutboundFrame;

/**
 * A turn was refused before the user message was stored. Nothing about the session changed.
 */
public class TurnRejectedException extends RuntimeException {

    private final ErrorCode code;

    public TurnRejectedException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public TurnRejectedException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() { return code; }

    public OutboundFrame toFrame() {
        return OutboundFrame.error(code, getMessage());
    }
}
