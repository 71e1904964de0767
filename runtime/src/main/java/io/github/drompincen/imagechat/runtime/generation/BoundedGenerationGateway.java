package io.github.drompincen.imagechat.runtime.generation;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs each backend call on its own thread and waits at most {@code timeout} for it. Subclasses
 * implement {@link #invoke} and map backend-specific errors in {@link #translate}.
 */
public abstract class BoundedGenerationGateway implements GenerationGateway {

    private static final Logger log = LoggerFactory.getLogger(BoundedGenerationGateway.class);

    private final Duration timeout;
    private final ExecutorService callExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "generation-call");
        t.setDaemon(true);
        return t;
    });

    protected BoundedGenerationGateway(Duration timeout) {
        this.timeout = timeout;
    }

    public Duration timeout() { return timeout; }

    @Override
    public final GenerationResult generate(GenerationRequest request) {
        if (!isAvailable()) {
            throw new GenerationException(GenerationFailure.UPSTREAM_UNAVAILABLE,
                    "Image generation backend is not configured");
        }
        long start = System.nanoTime();
        Future<GenerationResult> call;
        try {
            call = callExecutor.submit(() -> invoke(request));
        } catch (RejectedExecutionException e) {
            throw new GenerationException(GenerationFailure.UPSTREAM_UNAVAILABLE,
                    "Image generation is shutting down", e);
        }
        try {
            GenerationResult result = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            log.debug("{} call mode={} finished in {}ms", modelName(), request.mode(), elapsedMs);
            return result.withElapsed(elapsedMs);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("{} call mode={} timed out after {}ms", modelName(), request.mode(), timeout.toMillis());
            throw new GenerationException(GenerationFailure.TIMEOUT,
                    "Image generation did not finish within " + timeout.toSeconds() + " seconds", e);
        } catch (ExecutionException e) {
            GenerationException failure = translate(e.getCause());
            log.warn("{} call mode={} failed: {} {}", modelName(), request.mode(),
                    failure.getFailure(), failure.getMessage());
            throw failure;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new GenerationException(GenerationFailure.UNKNOWN, "Interrupted while waiting for generation", e);
        }
    }

    /** Interrupts calls still in flight; later requests fail as unavailable. */
    @PreDestroy
    public void shutdown() {
        int dropped = callExecutor.shutdownNow().size();
        log.info("{} call pool shut down ({} queued calls dropped)", modelName(), dropped);
    }

    protected abstract GenerationResult invoke(GenerationRequest request) throws Exception;

    protected GenerationException translate(Throwable cause) {
        if (cause instanceof GenerationException generationException) {
            return generationException;
        }
        return new GenerationException(GenerationFailure.UNKNOWN,
                "Image generation failed: " + cause.getMessage(), cause);
    }
}
