package io.github.drompincen.imagechat.runtime.generation;

public enum GenerationMode {
    /** Text reply only, no image expected. */
    CHAT,
    /** New image from a prompt, optionally guided by a reference image. */
    GENERATE,
    /** Revision of an existing image driven by feedback. */
    REFINE;

    public boolean producesImage() { return this != CHAT; }
}
