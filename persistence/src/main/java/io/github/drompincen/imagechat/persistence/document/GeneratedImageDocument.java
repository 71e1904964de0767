package io.github.drompincen.imagechat.persistence.document;

import io.github.drompincen.imagechat.protocol.api.ImagePurpose;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Base64;

@Document(collection = "generated_images")
public class GeneratedImageDocument {

    @Id
    private String imageId;

    @Indexed
    private String sessionId;

    private String messageId;
    private String mimeType;
    private byte[] data;
    private Integer width;
    private Integer height;
    private String promptUsed;
    private String modelUsed;
    private ImagePurpose imagePurpose;
    private String refinedFrom;
    private Instant createdAt;

    public GeneratedImageDocument() {}

    public String getImageId() { return imageId; }
    public void setImageId(String imageId) { this.imageId = imageId; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getMessageId() { return messageId; }
    public void setMessageId(String messageId) { this.messageId = messageId; }

    public String getMimeType() { return mimeType; }
    public void setMimeType(String mimeType) { this.mimeType = mimeType; }

    public byte[] getData() { return data; }
    public void setData(byte[] data) { this.data = data; }

    public Integer getWidth() { return width; }
    public void setWidth(Integer width) { this.width = width; }

    public Integer getHeight() { return height; }
    public void setHeight(Integer height) { this.height = height; }

    public String getPromptUsed() { return promptUsed; }
    public void setPromptUsed(String promptUsed) { this.promptUsed = promptUsed; }

    public String getModelUsed() { return modelUsed; }
    public void setModelUsed(String modelUsed) { this.modelUsed = modelUsed; }

    public ImagePurpose getImagePurpose() { return imagePurpose; }
    public void setImagePurpose(ImagePurpose imagePurpose) { this.imagePurpose = imagePurpose; }

    public String getRefinedFrom() { return refinedFrom; }
    public void setRefinedFrom(String refinedFrom) { this.refinedFrom = refinedFrom; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    /** {@code data:<mime>;base64,<payload>} form used in socket frames and REST responses. */
    public String toDataUrl() {
        return "data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(data);
    }
}
