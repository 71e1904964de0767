package io.github.drompincen.imagechat.persistence.document;

import io.github.drompincen.imagechat.protocol.api.ImagePurpose;
import io.github.drompincen.imagechat.protocol.api.SessionStatus;
import io.github.drompincen.imagechat.protocol.api.StylePreset;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.IndexDirection;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * One image chat session. {@code messagesCount} is also the sequence source for the session's
 * message log: appending a message increments it atomically and uses the new value as {@code seq}.
 */
@Document(collection = "sessions")
public class SessionDocument {

    @Id
    private String sessionId;

    private String title;
    private ImagePurpose imagePurpose;
    private StylePreset stylePreset;
    private Map<String, Object> brandGuidelines;

    @Indexed
    private SessionStatus status;

    private String lastImageId;
    private long messagesCount;
    private int imagesGenerated;
    private long totalTokensUsed;

    @Indexed(direction = IndexDirection.DESCENDING)
    private Instant createdAt;

    private Instant updatedAt;

    public SessionDocument() {}

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public ImagePurpose getImagePurpose() { return imagePurpose; }
    public void setImagePurpose(ImagePurpose imagePurpose) { this.imagePurpose = imagePurpose; }

    public StylePreset getStylePreset() { return stylePreset; }
    public void setStylePreset(StylePreset stylePreset) { this.stylePreset = stylePreset; }

    public Map<String, Object> getBrandGuidelines() { return brandGuidelines; }
    public void setBrandGuidelines(Map<String, Object> brandGuidelines) { this.brandGuidelines = brandGuidelines; }

    public SessionStatus getStatus() { return status; }
    public void setStatus(SessionStatus status) { this.status = status; }

    public String getLastImageId() { return lastImageId; }
    public void setLastImageId(String lastImageId) { this.lastImageId = lastImageId; }

    public long getMessagesCount() { return messagesCount; }
    public void setMessagesCount(long messagesCount) { this.messagesCount = messagesCount; }

    public int getImagesGenerated() { return imagesGenerated; }
    public void setImagesGenerated(int imagesGenerated) { this.imagesGenerated = imagesGenerated; }

    public long getTotalTokensUsed() { return totalTokensUsed; }
    public void setTotalTokensUsed(long totalTokensUsed) { this.totalTokensUsed = totalTokensUsed; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
