package io.github.drompincen.imagechat.runtime.support;

import io.github.drompincen.imagechat.runtime.generation.GenerationException;
import io.github.drompincen.imagechat.runtime.generation.GenerationFailure;
import io.github.drompincen.imagechat.runtime.generation.GenerationGateway;
import io.github.drompincen.imagechat.runtime.generation.GenerationMode;
import io.github.drompincen.imagechat.runtime.generation.GenerationRequest;
import io.github.drompincen.imagechat.runtime.generation.GenerationResult;
import io.github.drompincen.imagechat.runtime.generation.ImagePayload;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Test backend: records every request, tracks in-flight calls per prompt prefix and answers with
 * a small image for image modes and an echo for chat, unless a custom behaviour is set.
 */
public class ScriptedGateway implements GenerationGateway {

    public static final byte[] IMAGE = {(byte) 0x89, 'P', 'N', 'G'};

    private final List<GenerationRequest> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final ConcurrentHashMap<String, Long> delays = new ConcurrentHashMap<>();
    private volatile Function<GenerationRequest, GenerationResult> behaviour = ScriptedGateway::defaultResult;
    private volatile boolean available = true;

    public static GenerationResult defaultResult(GenerationRequest request) {
        if (request.mode() == GenerationMode.CHAT) {
            return new GenerationResult("echo: " + request.prompt(), null, 12, 3, request.prompt(), "scripted");
        }
        return new GenerationResult(null, new ImagePayload(IMAGE, "image/png"), 34, 7, request.prompt(), "scripted");
    }

    public void respondWith(Function<GenerationRequest, GenerationResult> behaviour) { this.behaviour = behaviour; }

    public void failWith(GenerationFailure failure) {
        this.behaviour = request -> {
            throw new GenerationException(failure, "scripted " + failure);
        };
    }

    /** Requests whose prompt starts with {@code prefix} take {@code ms} to answer. */
    public void delay(String prefix, long ms) { delays.put(prefix, ms); }

    public void setAvailable(boolean available) { this.available = available; }

    @Override
    public GenerationResult generate(GenerationRequest request) {
        requests.add(request);
        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
        try {
            delays.forEach((prefix, ms) -> {
                if (request.prompt().startsWith(prefix)) sleep(ms);
            });
            return behaviour.apply(request);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override public boolean isAvailable() { return available; }
    @Override public String modelName() { return "scripted"; }

    public List<GenerationRequest> requests() { return List.copyOf(requests); }

    public int maxInFlight() { return maxInFlight.get(); }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
