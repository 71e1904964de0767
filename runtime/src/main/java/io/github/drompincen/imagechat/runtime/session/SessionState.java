package io.github.drompincen.imagechat.runtime.session;

import io.github.drompincen.imagechat.protocol.api.ImagePurpose;
import io.github.drompincen.imagechat.protocol.api.StylePreset;
import io.github.drompincen.imagechat.protocol.ws.OutboundFrame;
import io.github.drompincen.imagechat.runtime.generation.ContextTurn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * In-memory state of one logical conversation, keyed by session id and shared by every
 * connection that has been bound to it.
 *
 * <p>Generation work is chained on a per-session lane: each {@link #withGenerationLock} call runs
 * after the previous one has finished, in submission order, so at most one generation is in
 * flight per session. Different sessions share the executor but nothing else.
 */
public class SessionState {

    private static final Logger log = LoggerFactory.getLogger(SessionState.class);

    private final String sessionId;
    private final Executor executor;
    private final ContextWindow context;
    private final AtomicReference<FrameSink> sink = new AtomicReference<>();
    private final AtomicBoolean generating = new AtomicBoolean();
    private final AtomicInteger pending = new AtomicInteger();
    private final Object laneMonitor = new Object();

    private volatile ImagePurpose purpose;
    private volatile StylePreset style;
    private volatile ImageRef lastImage;
    private volatile long lastActiveNanos = System.nanoTime();
    private CompletableFuture<?> tail = CompletableFuture.completedFuture(null);

    public SessionState(String sessionId, ImagePurpose purpose, StylePreset style,
                        int contextTurns, Executor executor) {
        this.sessionId = sessionId;
        this.purpose = purpose != null ? purpose : ImagePurpose.DEFAULT;
        this.style = style;
        this.context = new ContextWindow(contextTurns);
        this.executor = executor;
    }

    public String sessionId() { return sessionId; }

    public ImagePurpose currentPurpose() { return purpose; }

    public Optional<StylePreset> currentStyle() { return Optional.ofNullable(style); }

    public Optional<ImageRef> lastImage() { return Optional.ofNullable(lastImage); }

    public List<ContextTurn> contextSnapshot() { return context.snapshot(); }

    void touch() { lastActiveNanos = System.nanoTime(); }

    /** True when no connection is bound, nothing is queued or running, and nothing happened for {@code idle}. */
    public boolean isIdleFor(Duration idle) {
        if (isBusy() || boundSink().filter(FrameSink::isOpen).isPresent()) return false;
        return System.nanoTime() - lastActiveNanos >= idle.toNanos();
    }

    /** Applies a purpose or style picked by the client; null leaves the current value. */
    public void select(ImagePurpose newPurpose, StylePreset newStyle) {
        if (newPurpose != null) this.purpose = newPurpose;
        if (newStyle != null) this.style = newStyle;
    }

    // Only used while rebuilding state from the store, before the state is published.
    void restore(ImageRef image, List<ContextTurn> turns) {
        this.lastImage = image;
        turns.forEach(context::add);
    }

    // ---- Connection binding ----

    /** Routes future frames to {@code newSink}; returns the sink it replaced, if any. */
    public Optional<FrameSink> bind(FrameSink newSink) {
        FrameSink previous = sink.getAndSet(newSink);
        touch();
        log.debug("Session {} bound to connection {}", sessionId, newSink.id());
        return Optional.ofNullable(previous).filter(p -> p != newSink);
    }

    /** Unbinds {@code oldSink} unless a newer connection has already taken over. */
    public boolean unbind(FrameSink oldSink) {
        boolean unbound = sink.compareAndSet(oldSink, null);
        if (unbound) {
            touch();
            log.debug("Session {} unbound from connection {}", sessionId, oldSink.id());
        }
        return unbound;
    }

    public Optional<FrameSink> boundSink() { return Optional.ofNullable(sink.get()); }

    /**
     * Sends to whichever connection is bound right now. With no live connection the frame is
     * dropped; the result it describes is already in the message log.
     */
    public boolean send(OutboundFrame frame) {
        FrameSink current = sink.get();
        if (current == null || !current.isOpen()) {
            log.debug("Session {} has no live connection, dropping {} frame", sessionId, frame.type().id());
            return false;
        }
        try {
            current.send(frame);
            return true;
        } catch (IOException e) {
            log.warn("Failed to send {} frame to session {} on {}: {}",
                    frame.type().id(), sessionId, current.id(), e.getMessage());
            return false;
        }
    }

    // ---- Generation lock ----

    public boolean isGenerating() { return generating.get(); }

    /** True while a generation is running or waiting for the lock. */
    public boolean isBusy() { return pending.get() > 0; }

    /**
     * Runs {@code work} once every earlier generation for this session has finished. The lock is
     * released when {@code work} returns or throws; cancelling the returned future does not stop
     * the work or let the next request in early.
     */
    public <T> CompletableFuture<T> withGenerationLock(Function<GenerationScope, T> work) {
        pending.incrementAndGet();
        touch();
        CompletableFuture<T> run;
        synchronized (laneMonitor) {
            run = tail.handle((ignored, error) -> null)
                    .thenApplyAsync(ignored -> runLocked(work), this::execute);
            tail = run;
        }
        return run.copy();
    }

    // A rejected task never reaches runLocked, so it releases its pending slot here.
    private void execute(Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            pending.decrementAndGet();
            throw e;
        }
    }

    private <T> T runLocked(Function<GenerationScope, T> work) {
        if (!generating.compareAndSet(false, true)) {
            pending.decrementAndGet();
            throw new IllegalStateException("Generation lock already held for session " + sessionId);
        }
        LockedScope scope = new LockedScope();
        try {
            return work.apply(scope);
        } finally {
            scope.active = false;
            touch();
            generating.set(false);
            pending.decrementAndGet();
        }
    }

    private final class LockedScope implements GenerationScope {

        private volatile boolean active = true;

        @Override
        public String sessionId() { return sessionId; }

        @Override
        public Optional<ImageRef> lastImage() { return SessionState.this.lastImage(); }

        @Override
        public List<ContextTurn> context() { return context.snapshot(); }

        @Override
        public void updateLastImage(ImageRef image) {
            checkActive();
            lastImage = image;
        }

        @Override
        public void remember(ContextTurn turn) {
            checkActive();
            context.add(turn);
        }

        private void checkActive() {
            if (!active) {
                throw new IllegalStateException("Generation lock for session " + sessionId + " was already released");
            }
        }
    }
}
