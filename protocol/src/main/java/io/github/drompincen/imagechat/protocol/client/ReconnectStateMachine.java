package io.github.drompincen.imagechat.protocol.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Client-side reconnection policy for one session endpoint: after every unexpected disconnect wait
 * a fixed delay and dial again, forever. There is no backoff and no retry limit; only
 * {@link #close()} stops it.
 */
public class ReconnectStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ReconnectStateMachine.class);

    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(3);

    /** Dials the endpoint; the outcome is reported back through {@link #onOpen()} / {@link #onClose()}. */
    @FunctionalInterface
    public interface Connector {
        void connect();
    }

    private final Connector connector;
    private final ScheduledExecutorService scheduler;
    private final Duration retryDelay;
    private Consumer<ConnectionState> listener = state -> {};

    private ConnectionState state = ConnectionState.IDLE;
    private ScheduledFuture<?> pendingRetry;
    private long attempts;

    public ReconnectStateMachine(Connector connector, ScheduledExecutorService scheduler) {
        this(connector, scheduler, DEFAULT_RETRY_DELAY);
    }

    public ReconnectStateMachine(Connector connector, ScheduledExecutorService scheduler, Duration retryDelay) {
        this.connector = connector;
        this.scheduler = scheduler;
        this.retryDelay = retryDelay;
    }

    public synchronized void onStateChange(Consumer<ConnectionState> listener) {
        this.listener = listener;
    }

    public synchronized ConnectionState state() { return state; }

    /** Number of dials performed after the initial connect. */
    public synchronized long retryAttempts() { return attempts; }

    public void start() {
        synchronized (this) {
            if (state != ConnectionState.IDLE) return;
            transition(ConnectionState.CONNECTING);
        }
        dial();
    }

    public synchronized void onOpen() {
        if (state == ConnectionState.CLOSED) return;
        transition(ConnectionState.CONNECTED);
    }

    public synchronized void onClose() {
        if (state == ConnectionState.CLOSED || state == ConnectionState.DISCONNECTED_PENDING_RETRY) return;
        transition(ConnectionState.DISCONNECTED_PENDING_RETRY);
        pendingRetry = scheduler.schedule(this::retry, retryDelay.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void close() {
        if (pendingRetry != null) {
            pendingRetry.cancel(false);
            pendingRetry = null;
        }
        transition(ConnectionState.CLOSED);
    }

    private void retry() {
        long attempt;
        synchronized (this) {
            if (state != ConnectionState.DISCONNECTED_PENDING_RETRY) return;
            pendingRetry = null;
            attempt = ++attempts;
            transition(ConnectionState.RETRYING);
        }
        log.debug("Reconnect attempt {}", attempt);
        dial();
    }

    private void dial() {
        try {
            connector.connect();
        } catch (RuntimeException e) {
            log.warn("Connect failed: {}", e.getMessage());
            onClose();
        }
    }

    private void transition(ConnectionState next) {
        if (state == next) return;
        state = next;
        listener.accept(next);
    }
}
