package io.github.drompincen.imagechat.runtime.generation;

public class GenerationException extends RuntimeException {

    private final GenerationFailure failure;

    public GenerationException(GenerationFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public GenerationException(GenerationFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public GenerationFailure getFailure() { return failure; }
}
