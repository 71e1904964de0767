package io.github.drompincen.imagechat.runtime.engine;

import io.github.drompincen.imagechat.persistence.document.MessageDocument;
import io.github.drompincen.imagechat.protocol.api.ContentKind;
import io.github.drompincen.imagechat.protocol.api.ImagePurpose;
import io.github.drompincen.imagechat.protocol.api.MessageRole;
import io.github.drompincen.imagechat.protocol.api.StylePreset;
import io.github.drompincen.imagechat.protocol.ws.ErrorCode;
import io.github.drompincen.imagechat.protocol.ws.FrameType;
import io.github.drompincen.imagechat.protocol.ws.IntentParser;
import io.github.drompincen.imagechat.protocol.ws.OutboundFrame;
import io.github.drompincen.imagechat.runtime.generation.ConverseHeuristics;
import io.github.drompincen.imagechat.runtime.generation.GenerationFailure;
import io.github.drompincen.imagechat.runtime.generation.GenerationMode;
import io.github.drompincen.imagechat.runtime.generation.GenerationRequest;
import io.github.drompincen.imagechat.runtime.generation.GenerationResult;
import io.github.drompincen.imagechat.runtime.generation.ImagePayload;
import io.github.drompincen.imagechat.runtime.session.SessionState;
import io.github.drompincen.imagechat.runtime.store.InMemorySessionStore;
import io.github.drompincen.imagechat.runtime.support.RecordingSink;
import io.github.drompincen.imagechat.runtime.support.ScriptedGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProtocolEngineTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private InMemorySessionStore store;
    private ScriptedGateway gateway;
    private ProtocolEngine engine;
    private SessionState state;
    private RecordingSink sink;

    @BeforeEach
    void setUp() {
        store = new InMemorySessionStore();
        gateway = new ScriptedGateway();
        engine = new ProtocolEngine(store, gateway, new ConverseHeuristics());
        store.createSession("S1", ImagePurpose.PRODUCT_SHOWCASE);
        state = new SessionState("S1", ImagePurpose.PRODUCT_SHOWCASE, null, 10, executor);
        sink = new RecordingSink("conn-1");
        state.bind(sink);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void send(String json) {
        engine.handle(state, json).join();
    }

    private String generateAndReturnImageId() {
        send("{\"type\":\"generate\",\"content\":\"red sneaker on white background\"}");
        return (String) sink.terminalFrames().get(sink.terminalFrames().size() - 1).data().get("image_id");
    }

    @Test
    void generateSendsOneStatusThenImageAndLogsTwoTurns() {
        send("{\"type\":\"generate\",\"content\":\"red sneaker on white background\"}");

        List<OutboundFrame> frames = sink.frames();
        assertThat(frames).extracting(OutboundFrame::type).containsExactly(FrameType.STATUS, FrameType.IMAGE);
        assertThat(frames.get(0).content()).isEqualTo("generating");
        OutboundFrame image = frames.get(1);
        assertThat(image.imageUrl()).startsWith("data:image/png;base64,");
        assertThat(image.data()).containsKeys("image_id", "message_id", "generation_time_ms", "prompt_used")
                .containsEntry("width", 1000)
                .containsEntry("model_used", "scripted");

        List<MessageDocument> log = store.messages("S1");
        assertThat(log).extracting(MessageDocument::getRole).containsExactly(MessageRole.USER, MessageRole.ASSISTANT);
        assertThat(log.get(0).getText()).isEqualTo("red sneaker on white background");
        assertThat(log.get(1).getContentKind()).isEqualTo(ContentKind.IMAGE);
        assertThat(state.lastImage().orElseThrow().imageId()).isEqualTo(image.data().get("image_id"));
        assertThat(gateway.requests().get(0).purpose()).isEqualTo(ImagePurpose.PRODUCT_SHOWCASE);
    }

    @Test
    void refineUsesPriorImageAndMovesLastImagePointer() {
        String firstImageId = generateAndReturnImageId();

        send("{\"type\":\"refine\",\"content\":\"make the background light gray\",\"data\":{\"image_id\":\"" + firstImageId + "\"}}");

        GenerationRequest refine = gateway.requests().get(1);
        assertThat(refine.mode()).isEqualTo(GenerationMode.REFINE);
        assertThat(refine.sourceImage()).isNotNull();
        assertThat(refine.sourceImage().data()).isEqualTo(ScriptedGateway.IMAGE);
        assertThat(refine.context()).hasSize(2);
        assertThat(store.messages("S1")).hasSize(4);

        OutboundFrame terminal = sink.terminalFrames().get(1);
        assertThat(terminal.type()).isEqualTo(FrameType.IMAGE);
        assertThat(sink.framesOfType(FrameType.STATUS).get(1).content()).isEqualTo("refining");
        String newImageId = (String) terminal.data().get("image_id");
        assertThat(newImageId).isNotEqualTo(firstImageId);
        assertThat(state.lastImage().orElseThrow().imageId()).isEqualTo(newImageId);
        assertThat(store.findImage(newImageId).orElseThrow().getRefinedFrom()).isEqualTo(firstImageId);
    }

    @Test
    void refineWithoutPriorImageIsRejectedWithoutSideEffects() {
        send("{\"type\":\"refine\",\"content\":\"brighter\",\"data\":{\"image_id\":\"img-x\"}}");

        assertThat(sink.frames()).hasSize(1);
        OutboundFrame error = sink.frames().get(0);
        assertThat(error.type()).isEqualTo(FrameType.ERROR);
        assertThat(error.data()).containsEntry("code", "NO_PRIOR_IMAGE").containsEntry("category", "VALIDATION");
        assertThat(store.messages("S1")).isEmpty();
        assertThat(gateway.requests()).isEmpty();
    }

    @Test
    void refineOfForeignImageIsRejected() {
        generateAndReturnImageId();

        send("{\"type\":\"refine\",\"content\":\"brighter\",\"data\":{\"image_id\":\"someone-elses\"}}");

        assertThat(sink.frames().get(sink.frames().size() - 1).data()).containsEntry("code", "UNKNOWN_IMAGE");
        assertThat(store.messages("S1")).hasSize(2);
    }

    @Test
    void malformedFramesProduceOneErrorAndChangeNothing() {
        send("not json at all");
        send("{\"type\":\"paint\",\"content\":\"x\"}");
        send("{\"type\":\"chat\"}");

        assertThat(sink.frames()).extracting(f -> f.data().get("code"))
                .containsExactly("MALFORMED_FRAME", "UNKNOWN_TYPE", "MISSING_FIELD");
        assertThat(store.messages("S1")).isEmpty();
        assertThat(state.lastImage()).isEmpty();
        assertThat(state.contextSnapshot()).isEmpty();
    }

    @Test
    void invalidPurposeDoesNotChangeSelection() {
        send("{\"type\":\"generate\",\"content\":\"x\",\"data\":{\"purpose\":\"billboard\",\"style\":\"luxury\"}}");

        assertThat(sink.frames().get(0).data()).containsEntry("code", "INVALID_FIELD");
        assertThat(state.currentStyle()).isEmpty();
    }

    @Test
    void chatRepliesWithTextMessageAndSelectionSticks() {
        send("{\"type\":\"chat\",\"content\":\"ideas for a summer sale\",\"data\":{\"purpose\":\"banner_web\",\"style\":\"vibrant\"}}");

        OutboundFrame reply = sink.terminalFrames().get(0);
        assertThat(reply.type()).isEqualTo(FrameType.MESSAGE);
        assertThat(reply.content()).isEqualTo("echo: ideas for a summer sale");
        assertThat(sink.frames().get(0).content()).isEqualTo("thinking");
        assertThat(state.currentPurpose()).isEqualTo(ImagePurpose.BANNER_WIDE);
        assertThat(store.findSession("S1").orElseThrow().getStylePreset()).isEqualTo(StylePreset.VIBRANT);
        assertThat(gateway.requests().get(0).mode()).isEqualTo(GenerationMode.CHAT);
    }

    @Test
    void textAndImageTogetherProduceMixedFrame() {
        gateway.respondWith(request -> new GenerationResult("Here is a softer version.",
                new ImagePayload(ScriptedGateway.IMAGE, "image/png"), 50, 9, request.prompt(), "scripted"));

        send("{\"type\":\"converse\",\"content\":\"draw a cozy reading nook\"}");

        OutboundFrame terminal = sink.terminalFrames().get(0);
        assertThat(terminal.type()).isEqualTo(FrameType.MIXED);
        assertThat(terminal.content()).isEqualTo("Here is a softer version.");
        assertThat(store.messages("S1").get(1).getContentKind()).isEqualTo(ContentKind.MIXED);
    }

    @Test
    void converseRevisesLastImageWhenAsked() {
        generateAndReturnImageId();

        send("{\"type\":\"converse\",\"content\":\"make it brighter\"}");

        GenerationRequest revise = gateway.requests().get(1);
        assertThat(revise.mode()).isEqualTo(GenerationMode.REFINE);
        assertThat(revise.sourceImage()).isNotNull();
    }

    @Test
    void upstreamFailureKeepsUserTurnAndSessionUsable() {
        gateway.failWith(GenerationFailure.RATE_LIMITED);
        send("{\"type\":\"generate\",\"content\":\"a lamp\"}");

        OutboundFrame error = sink.terminalFrames().get(0);
        assertThat(error.type()).isEqualTo(FrameType.ERROR);
        assertThat(error.data()).containsEntry("code", "RATE_LIMITED").containsEntry("category", "UPSTREAM");
        assertThat(store.messages("S1")).extracting(MessageDocument::getRole).containsExactly(MessageRole.USER);
        assertThat(state.isBusy()).isFalse();

        gateway.respondWith(ScriptedGateway::defaultResult);
        send("{\"type\":\"generate\",\"content\":\"a lamp, again\"}");
        assertThat(sink.terminalFrames().get(1).type()).isEqualTo(FrameType.IMAGE);
        assertThat(store.messages("S1")).hasSize(3);
    }

    @Test
    void unavailableBackendRejectsBeforePersisting() {
        gateway.setAvailable(false);

        send("{\"type\":\"generate\",\"content\":\"a lamp\"}");

        assertThat(sink.frames()).singleElement()
                .satisfies(f -> assertThat(f.data()).containsEntry("code", "UPSTREAM_UNAVAILABLE"));
        assertThat(store.messages("S1")).isEmpty();
    }

    @Test
    void storeOutageIsReportedAndConnectionStaysUsable() {
        store.setAvailable(false);
        send("{\"type\":\"chat\",\"content\":\"hello\"}");

        assertThat(sink.frames()).singleElement()
                .satisfies(f -> assertThat(f.data()).containsEntry("code", "PERSISTENCE_FAILURE"));
        assertThat(sink.isOpen()).isTrue();

        store.setAvailable(true);
        send("{\"type\":\"chat\",\"content\":\"hello again\"}");
        assertThat(sink.terminalFrames().get(1).type()).isEqualTo(FrameType.MESSAGE);
    }

    @Test
    void deletedSessionIsReported() {
        store.deleteSession("S1");

        send("{\"type\":\"chat\",\"content\":\"anyone there?\"}");

        assertThat(sink.frames()).singleElement()
                .satisfies(f -> assertThat(f.data()).containsEntry("code", ErrorCode.SESSION_NOT_FOUND.name()));
    }

    @Test
    void refusedTurnLeavesSelectionUntouched() {
        store.setAvailable(false);

        send("{\"type\":\"generate\",\"content\":\"a lamp\",\"data\":{\"purpose\":\"banner_web\",\"style\":\"luxury\"}}");

        assertThat(sink.frames()).singleElement()
                .satisfies(f -> assertThat(f.data()).containsEntry("code", "PERSISTENCE_FAILURE"));
        assertThat(state.currentPurpose()).isEqualTo(ImagePurpose.PRODUCT_SHOWCASE);
        assertThat(state.currentStyle()).isEmpty();
    }

    @Test
    void submitYieldsTerminalFrameAndMirrorsItToBoundConnection() {
        IntentParser parser = new IntentParser();

        OutboundFrame terminal = engine.submit(state,
                parser.generate("red sneaker", ImagePurpose.BANNER_WIDE, StylePreset.MINIMAL, null)).join();

        assertThat(terminal.type()).isEqualTo(FrameType.IMAGE);
        assertThat(terminal.data()).containsEntry("purpose", "banner_web");
        assertThat(sink.terminalFrames()).containsExactly(terminal);
        assertThat(state.currentStyle()).contains(StylePreset.MINIMAL);
    }

    @Test
    void submitRefusesForeignReferenceImageWithoutStoringAnything() {
        IntentParser parser = new IntentParser();

        assertThatThrownBy(() -> engine.submit(state, parser.generate("same, in blue", null, null, "not-mine")))
                .isInstanceOf(TurnRejectedException.class)
                .satisfies(e -> assertThat(((TurnRejectedException) e).getCode()).isEqualTo(ErrorCode.UNKNOWN_IMAGE));
        assertThat(store.messages("S1")).isEmpty();
        assertThat(sink.frames()).isEmpty();
    }
}
