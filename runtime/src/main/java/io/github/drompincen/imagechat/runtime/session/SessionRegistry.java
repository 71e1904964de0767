package io.github.drompincen.imagechat.runtime.session;

import io.github.drompincen.imagechat.persistence.document.MessageDocument;
import io.github.drompincen.imagechat.persistence.document.SessionDocument;
import io.github.drompincen.imagechat.runtime.generation.ContextTurn;
import io.github.drompincen.imagechat.runtime.store.SessionStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps one {@link SessionState} per session id. States outlive connections, so a reconnect finds
 * the same state, lock and context window; a state left unbound and quiet for the idle timeout is
 * dropped by {@link #evictIdle()} and rebuilt from the store on next use.
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final SessionStore store;
    private final int contextTurns;
    private final Duration idleTimeout;
    private final Executor laneExecutor;
    private final ExecutorService ownedExecutor;
    private final ConcurrentHashMap<String, SessionState> states = new ConcurrentHashMap<>();

    /** A connection bound to a session: the state, whether it was already live, and the connection it displaced. */
    public record Attachment(SessionState state, boolean resumed, Optional<FrameSink> superseded) {}

    @Autowired
    public SessionRegistry(SessionStore store,
                           @Value("${imagechat.session.context-turns:10}") int contextTurns,
                           @Value("${imagechat.session.idle-eviction:10m}") Duration idleTimeout) {
        this(store, contextTurns, idleTimeout, Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "session-lane");
            t.setDaemon(true);
            return t;
        }));
    }

    SessionRegistry(SessionStore store, int contextTurns, Duration idleTimeout, Executor laneExecutor) {
        this.store = store;
        this.contextTurns = contextTurns;
        this.idleTimeout = idleTimeout;
        this.laneExecutor = laneExecutor;
        this.ownedExecutor = laneExecutor instanceof ExecutorService service ? service : null;
    }

    /** Returns the live state for {@code sessionId}, rebuilding it from the store on first use. */
    public Optional<SessionState> loadOrCreate(String sessionId) {
        SessionState existing = states.get(sessionId);
        if (existing != null) {
            existing.touch();
            return Optional.of(existing);
        }
        Optional<SessionDocument> doc = store.findSession(sessionId);
        if (doc.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(states.computeIfAbsent(sessionId, id -> restore(doc.get())));
    }

    /**
     * Loads the session and binds {@code sink} to it in one step, so a concurrent sweep cannot
     * drop the state between lookup and bind. Empty when the session does not exist.
     */
    public Optional<Attachment> attach(String sessionId, FrameSink sink) {
        boolean[] resumed = new boolean[1];
        FrameSink[] superseded = new FrameSink[1];
        SessionState state = states.compute(sessionId, (id, current) -> {
            SessionState target = current;
            if (target == null) {
                Optional<SessionDocument> doc = store.findSession(id);
                if (doc.isEmpty()) return null;
                target = restore(doc.get());
            } else {
                resumed[0] = true;
            }
            superseded[0] = target.bind(sink).orElse(null);
            return target;
        });
        if (state == null) {
            return Optional.empty();
        }
        return Optional.of(new Attachment(state, resumed[0], Optional.ofNullable(superseded[0])));
    }

    public Optional<SessionState> find(String sessionId) {
        return Optional.ofNullable(states.get(sessionId));
    }

    public Optional<SessionState> evict(String sessionId) {
        return Optional.ofNullable(states.remove(sessionId));
    }

    public Collection<SessionState> states() {
        return states.values();
    }

    /** Drops states with no bound connection and no queued work that have been quiet for the idle timeout. */
    @Scheduled(fixedDelayString = "${imagechat.session.sweep-interval-ms:60000}",
            initialDelayString = "${imagechat.session.sweep-interval-ms:60000}")
    public int evictIdle() {
        AtomicInteger evicted = new AtomicInteger();
        for (String sessionId : states.keySet()) {
            states.computeIfPresent(sessionId, (id, state) -> {
                if (!state.isIdleFor(idleTimeout)) return state;
                evicted.incrementAndGet();
                return null;
            });
        }
        if (evicted.get() > 0) {
            log.info("Evicted {} idle session states, {} still live", evicted.get(), states.size());
        }
        return evicted.get();
    }

    @PreDestroy
    public void shutdown() {
        if (ownedExecutor == null) return;
        ownedExecutor.shutdown();
        log.info("Session lanes shut down with {} live session states", states.size());
    }

    private SessionState restore(SessionDocument doc) {
        SessionState state = new SessionState(doc.getSessionId(), doc.getImagePurpose(), doc.getStylePreset(),
                contextTurns, laneExecutor);
        List<MessageDocument> recent = store.recentMessages(doc.getSessionId(), contextTurns);
        ImageRef lastImage = null;
        if (doc.getLastImageId() != null) {
            String messageId = store.findImage(doc.getSessionId(), doc.getLastImageId())
                    .map(image -> image.getMessageId())
                    .orElse(null);
            lastImage = new ImageRef(doc.getLastImageId(), messageId);
        }
        state.restore(lastImage, recent.stream()
                .map(m -> new ContextTurn(m.getRole(), m.getText(), m.getImageId() != null))
                .toList());
        log.info("Loaded session {} with {} context turns, lastImage={}",
                doc.getSessionId(), recent.size(), doc.getLastImageId());
        return state;
    }
}
