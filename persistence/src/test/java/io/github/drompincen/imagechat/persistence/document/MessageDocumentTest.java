package io.github.drompincen.imagechat.persistence.document;

import io.github.drompincen.imagechat.protocol.api.ContentKind;
import io.github.drompincen.imagechat.protocol.api.MessageRole;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class MessageDocumentTest {

    @Test
    void messageFieldsPreserved() {
        MessageDocument doc = new MessageDocument();
        doc.setMessageId("m1");
        doc.setSessionId("s1");
        doc.setSeq(1);
        doc.setRole(MessageRole.ASSISTANT);
        doc.setContentKind(ContentKind.IMAGE);
        doc.setImageId("img-1");
        doc.setGenerationTimeMs(1200L);
        doc.setTimestamp(Instant.now());

        assertThat(doc.getMessageId()).isEqualTo("m1");
        assertThat(doc.getRole()).isEqualTo(MessageRole.ASSISTANT);
        assertThat(doc.getContentKind()).isEqualTo(ContentKind.IMAGE);
        assertThat(doc.getImageId()).isEqualTo("img-1");
        assertThat(doc.getText()).isNull();
        assertThat(doc.getSeq()).isEqualTo(1);
    }

    @Test
    void imageDataUrlEncodesBytes() {
        GeneratedImageDocument image = new GeneratedImageDocument();
        image.setMimeType("image/png");
        image.setData(new byte[]{1, 2, 3});

        assertThat(image.toDataUrl()).isEqualTo("data:image/png;base64,AQID");
    }
}
