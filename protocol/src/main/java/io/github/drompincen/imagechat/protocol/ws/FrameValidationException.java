package io.github.drompincen.imagechat.protocol.ws;

/**
 * An inbound frame was rejected before it touched session state or the message log.
 */
public class FrameValidationException extends RuntimeException {

    private final ErrorCode code;

    public FrameValidationException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public FrameValidationException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() { return code; }
}
