package io.github.drompincen.imagechat.runtime.generation;

/**
 * Adapter over the external image generation backend. Every call is bounded by a timeout and is
 * never retried here; the backend call is billable and not safe to repeat blindly.
 */
public interface GenerationGateway {

    /**
     * @throws GenerationException with a typed {@link GenerationFailure} when the call does not succeed
     */
    GenerationResult generate(GenerationRequest request);

    /** False when the backend cannot be called at all, e.g. no credential is configured. */
    boolean isAvailable();

    String modelName();
}
