package com.tyron.nanodoc.api.document;

import com.tyron.nanodoc.api.attributes.Attribute;
import com.tyron.nanodoc.api.delta.Delta;
import com.tyron.nanodoc.api.delta.Embed;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Abstract view of a rich-text document.
 *
 * The content is a {@link Delta} of inserts that always ends with a newline. Offsets are in
 * document units: one per UTF-16 char of text, one per embed.
 */
public interface RichDocument {

    /**
     * @return a copy of the current content
     */
    Delta toDelta();

    int length();

    String toPlainText();

    /**
     * Applies {@code attribute} to the range [index, index + length).
     *
     * @return the change that was composed into the document
     */
    Delta format(int index, int length, Attribute attribute);

    Delta format(int index, int length, Attribute attribute, @Nullable Object data);

    Delta insert(int index, String text, @Nullable Map<String, ?> attributes);

    Delta insert(int index, Embed embed, @Nullable Map<String, ?> attributes);

    /**
     * Deletes the range [index, index + length). The final newline cannot be deleted.
     */
    Delta delete(int index, int length);

    /**
     * Composes an arbitrary change into the document.
     *
     * @throws IllegalStateException if the result would not be a valid document
     */
    void compose(Delta change, ChangeSource source);
}
