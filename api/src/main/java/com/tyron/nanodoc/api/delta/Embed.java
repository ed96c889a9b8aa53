package com.tyron.nanodoc.api.delta;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Non-text content inserted into a document, e.g. {@code image -> url}.
 *
 * An embed always occupies exactly one unit of document length.
 */
public record Embed(@NotNull String type, Object data) {

    /**
     * Character used for an embed in the plain-text view of a document.
     */
    public static final char OBJECT_REPLACEMENT_CHARACTER = '\uFFFC';

    public Embed {
        Objects.requireNonNull(type, "type");
        if (type.isEmpty()) {
            throw new IllegalArgumentException("Embed type must not be empty");
        }
    }

    public static Embed image(String url) {
        return new Embed("image", url);
    }

    public static Embed video(String url) {
        return new Embed("video", url);
    }
}
