package io.github.drompincen.imagechat.runtime.session;

import io.github.drompincen.imagechat.runtime.generation.ContextTurn;

import java.util.List;
import java.util.Optional;

/**
 * Handle passed to work running under a session's generation lock. The last-image pointer and the
 * context window can only be changed through it, and only while the lock is held.
 */
public interface GenerationScope {

    String sessionId();

    Optional<ImageRef> lastImage();

    List<ContextTurn> context();

    void updateLastImage(ImageRef image);

    void remember(ContextTurn turn);
}
