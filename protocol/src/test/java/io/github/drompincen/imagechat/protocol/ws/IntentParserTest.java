package io.github.drompincen.imagechat.protocol.ws;

import io.github.drompincen.imagechat.protocol.api.ImagePurpose;
import io.github.drompincen.imagechat.protocol.api.StylePreset;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntentParserTest {

    private final FrameCodec codec = new FrameCodec();
    private final IntentParser parser = new IntentParser();

    private ClientIntent parse(String json) {
        return parser.parse(codec.decode(json));
    }

    private void assertRejected(String json, ErrorCode expected) {
        assertThatThrownBy(() -> parse(json))
                .isInstanceOf(FrameValidationException.class)
                .satisfies(e -> assertThat(((FrameValidationException) e).getCode()).isEqualTo(expected));
    }

    @Test
    void parsesGenerateWithSelections() {
        ClientIntent intent = parse("""
                {"type":"generate","content":"  red sneaker on white  ",
                 "data":{"purpose":"product_showcase","style":"minimal"}}
                """);

        assertThat(intent).isInstanceOf(ClientIntent.Generate.class);
        ClientIntent.Generate generate = (ClientIntent.Generate) intent;
        assertThat(generate.text()).isEqualTo("red sneaker on white");
        assertThat(generate.purposeSelection()).contains(ImagePurpose.PRODUCT_SHOWCASE);
        assertThat(generate.styleSelection()).contains(StylePreset.MINIMAL);
        assertThat(generate.referenceImage()).isEmpty();
    }

    @Test
    void parsesGenerateWithReferenceImage() {
        ClientIntent.Generate generate = (ClientIntent.Generate) parse(
                "{\"type\":\"generate\",\"content\":\"same shoe, blue\",\"data\":{\"image_id\":\"img-7\"}}");

        assertThat(generate.referenceImage()).contains("img-7");
    }

    @Test
    void parsesChatWithoutData() {
        ClientIntent intent = parse("{\"type\":\"chat\",\"content\":\"what works for a summer sale?\"}");

        assertThat(intent.kind()).isEqualTo(IntentKind.CHAT);
        assertThat(intent.purposeSelection()).isEmpty();
    }

    @Test
    void parsesRefineWithImageId() {
        ClientIntent intent = parse(
                "{\"type\":\"refine\",\"content\":\"make the background blue\",\"data\":{\"image_id\":\"img-1\"}}");

        assertThat(intent).isEqualTo(new ClientIntent.Refine("make the background blue", "img-1"));
    }

    @Test
    void parsesConverse() {
        assertThat(parse("{\"type\":\"converse\",\"content\":\"draw a cat\"}").kind())
                .isEqualTo(IntentKind.CONVERSE);
    }

    @Test
    void rejectsRefineWithoutImageId() {
        assertRejected("{\"type\":\"refine\",\"content\":\"brighter\"}", ErrorCode.MISSING_FIELD);
    }

    @Test
    void rejectsMissingOrUnknownType() {
        assertRejected("{\"content\":\"hi\"}", ErrorCode.MISSING_FIELD);
        assertRejected("{\"type\":\"paint\",\"content\":\"hi\"}", ErrorCode.UNKNOWN_TYPE);
    }

    @Test
    void rejectsMissingBlankOrNonTextContent() {
        assertRejected("{\"type\":\"chat\"}", ErrorCode.MISSING_FIELD);
        assertRejected("{\"type\":\"chat\",\"content\":\"   \"}", ErrorCode.MISSING_FIELD);
        assertRejected("{\"type\":\"chat\",\"content\":42}", ErrorCode.INVALID_FIELD);
    }

    @Test
    void rejectsContentOverLimit() {
        String longPrompt = "x".repeat(IntentParser.MAX_PROMPT_LENGTH + 1);
        assertRejected("{\"type\":\"generate\",\"content\":\"" + longPrompt + "\"}", ErrorCode.INVALID_FIELD);

        String longFeedback = "y".repeat(IntentParser.MAX_FEEDBACK_LENGTH + 1);
        assertRejected("{\"type\":\"refine\",\"content\":\"" + longFeedback + "\",\"data\":{\"image_id\":\"i\"}}",
                ErrorCode.INVALID_FIELD);
    }

    @Test
    void chatAllowsLongerTextThanPrompts() {
        String text = "z".repeat(IntentParser.MAX_CHAT_LENGTH);

        assertThat(parse("{\"type\":\"chat\",\"content\":\"" + text + "\"}").text()).hasSize(2000);
    }

    @Test
    void rejectsUnknownPurposeOrStyle() {
        assertRejected("{\"type\":\"generate\",\"content\":\"x\",\"data\":{\"purpose\":\"billboard\"}}",
                ErrorCode.INVALID_FIELD);
        assertRejected("{\"type\":\"chat\",\"content\":\"x\",\"data\":{\"style\":\"gothic\"}}",
                ErrorCode.INVALID_FIELD);
    }

    @Test
    void rejectsNonObjectData() {
        assertRejected("{\"type\":\"chat\",\"content\":\"x\",\"data\":[1]}", ErrorCode.INVALID_FIELD);
    }

    @Test
    void typedFactoriesApplyTheSameLimitsAsFrames() {
        ClientIntent.Chat chat = parser.chat("  hello  ", ImagePurpose.EMAIL_HEADER, null);
        ClientIntent.Generate generate = parser.generate("a lamp", null, StylePreset.MINIMAL, "  ");
        ClientIntent.Refine refine = parser.refine("brighter", " img-3 ");

        assertThat(chat.text()).isEqualTo("hello");
        assertThat(chat.purposeSelection()).contains(ImagePurpose.EMAIL_HEADER);
        assertThat(generate.referenceImage()).isEmpty();
        assertThat(refine.imageId()).isEqualTo("img-3");

        assertThatThrownBy(() -> parser.generate("x".repeat(IntentParser.MAX_PROMPT_LENGTH + 1), null, null, null))
                .isInstanceOf(FrameValidationException.class)
                .satisfies(e -> assertThat(((FrameValidationException) e).getCode()).isEqualTo(ErrorCode.INVALID_FIELD));
        assertThatThrownBy(() -> parser.refine("   ", "img-3"))
                .satisfies(e -> assertThat(((FrameValidationException) e).getCode()).isEqualTo(ErrorCode.MISSING_FIELD));
        assertThatThrownBy(() -> parser.refine("brighter", null))
                .hasMessageContaining("image_id");
    }
}
