package io.github.drompincen.imagechat.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Target format a generated image is optimized for. The wire id is what clients send in
 * {@code data.purpose}; the aspect ratio is what the image backend is asked for.
 */
public enum ImagePurpose {

    SOCIAL_SQUARE("sns_instagram_square", "Instagram square", "1:1", 1080, 1080, "1:1",
            "Square image for an Instagram feed",
            "eye-catching social media post, vibrant colors, engaging composition"),
    SOCIAL_PORTRAIT("sns_instagram_portrait", "Instagram portrait", "4:5", 1080, 1350, "9:16",
            "Vertical image for an Instagram feed",
            "vertical composition, mobile-optimized, scroll-stopping visual"),
    SOCIAL_PLATFORM_POST("sns_facebook", "Facebook share", "1.91:1", 1200, 630, "16:9",
            "Facebook share and ad image",
            "shareable content, clear message, professional look"),
    BANNER_WIDE("banner_web", "Web banner", "3:1", 1920, 640, "16:9",
            "Main banner for a website",
            "wide banner format, clean layout, brand-focused, text space on sides"),
    BANNER_MOBILE("banner_mobile", "Mobile banner", "2:1", 800, 400, "16:9",
            "Banner for mobile web and apps",
            "mobile-friendly, simple composition, high contrast"),
    PRODUCT_SHOWCASE("product_showcase", "Product showcase", "1:1", 1000, 1000, "1:1",
            "Image for a product detail page",
            "product-focused, clean background, professional lighting"),
    EMAIL_HEADER("email_header", "Email header", "3:1", 600, 200, "16:9",
            "Header image for email marketing",
            "simple, brand-aligned, minimal text space"),
    CUSTOM("custom", "Custom", "custom", null, null, "1:1",
            "Size chosen by the user", "");

    private final String id;
    private final String displayName;
    private final String ratio;
    private final Integer width;
    private final Integer height;
    private final String aspectRatio;
    private final String description;
    private final String promptHint;

    ImagePurpose(String id, String displayName, String ratio, Integer width, Integer height,
                 String aspectRatio, String description, String promptHint) {
        this.id = id;
        this.displayName = displayName;
        this.ratio = ratio;
        this.width = width;
        this.height = height;
        this.aspectRatio = aspectRatio;
        this.description = description;
        this.promptHint = promptHint;
    }

    public static final ImagePurpose DEFAULT = SOCIAL_SQUARE;

    @JsonValue
    public String id() { return id; }

    public String displayName() { return displayName; }
    public String ratio() { return ratio; }
    public Integer width() { return width; }
    public Integer height() { return height; }
    public String aspectRatio() { return aspectRatio; }
    public String description() { return description; }
    public String promptHint() { return promptHint; }

    public static Optional<ImagePurpose> fromId(String id) {
        if (id == null) return Optional.empty();
        return Arrays.stream(values()).filter(p -> p.id.equals(id)).findFirst();
    }

    @JsonCreator
    static ImagePurpose fromJson(String id) {
        return fromId(id).orElseThrow(() -> new IllegalArgumentException("Unknown image purpose: " + id));
    }
}
