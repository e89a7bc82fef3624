package com.phillippitts.providerrouter.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * A category of generation request satisfiable by a set of interchangeable providers.
 *
 * <p>Names are normalized (trimmed, lower-case) so that configuration keys and caller
 * supplied values compare equal regardless of case.
 *
 * @param name normalized capability name (e.g. "fast-text", "embeddings")
 */
public record Capability(String name) {

    public static final Capability FAST_TEXT = new Capability("fast-text");
    public static final Capability QUALITY_TEXT = new Capability("quality-text");
    public static final Capability IMAGE_GENERATION = new Capability("image-generation");
    public static final Capability IMAGE_EDITING = new Capability("image-editing");
    public static final Capability EMBEDDINGS = new Capability("embeddings");
    public static final Capability VIDEO_GENERATION = new Capability("video-generation");

    public Capability {
        Objects.requireNonNull(name, "Capability name must not be null");
        name = name.trim().toLowerCase(Locale.ROOT);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Capability name must not be blank");
        }
    }

    public static Capability of(String name) {
        return new Capability(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
