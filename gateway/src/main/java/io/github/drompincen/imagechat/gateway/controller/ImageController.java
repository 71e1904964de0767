package io.github.drompincen.imagechat.gateway.controller;

import io.github.drompincen.imagechat.runtime.store.SessionStore;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/** Serves stored image bytes so history views need not inline every picture. */
@RestController
@RequestMapping("/api/image-chat/images")
public class ImageController {

    static final String PATH = "/api/image-chat/images/";

    private final SessionStore store;

    public ImageController(SessionStore store) {
        this.store = store;
    }

    @GetMapping("/{id}")
    public ResponseEntity<byte[]> get(@PathVariable String id) {
        return store.findImage(id)
                .map(image -> ResponseEntity.ok()
                        .contentType(MediaType.parseMediaType(image.getMimeType()))
                        // Image ids are never reused.
                        .cacheControl(CacheControl.maxAge(Duration.ofDays(7)).cachePrivate())
                        .body(image.getData()))
                .orElse(ResponseEntity.notFound().build());
    }

    static String urlFor(String imageId) {
        return imageId != null ? PATH + imageId : null;
    }
}
