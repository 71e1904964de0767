package io.github.drompincen.imagechat.persistence.document;

import io.github.drompincen.imagechat.protocol.api.ContentKind;
import io.github.drompincen.imagechat.protocol.api.MessageRole;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable once written. The image bytes live in {@link GeneratedImageDocument}; a message only
 * holds the id.
 */
@Document(collection = "messages")
@CompoundIndex(name = "session_seq", def = "{'sessionId': 1, 'seq': 1}", unique = true)
public class MessageDocument {

    @Id
    private String messageId;
    private String sessionId;
    private long seq;
    private MessageRole role;
    private ContentKind contentKind;
    private String text;
    private String imageId;
    private int tokensUsed;
    private Long generationTimeMs;
    private Map<String, Object> metadata;
    private Instant timestamp;

    public MessageDocument() {}

    public String getMessageId() { return messageId; }
    public void setMessageId(String messageId) { this.messageId = messageId; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public long getSeq() { return seq; }
    public void setSeq(long seq) { this.seq = seq; }

    public MessageRole getRole() { return role; }
    public void setRole(MessageRole role) { this.role = role; }

    public ContentKind getContentKind() { return contentKind; }
    public void setContentKind(ContentKind contentKind) { this.contentKind = contentKind; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public String getImageId() { return imageId; }
    public void setImageId(String imageId) { this.imageId = imageId; }

    public int getTokensUsed() { return tokensUsed; }
    public void setTokensUsed(int tokensUsed) { this.tokensUsed = tokensUsed; }

    public Long getGenerationTimeMs() { return generationTimeMs; }
    public void setGenerationTimeMs(Long generationTimeMs) { this.generationTimeMs = generationTimeMs; }

    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
}
