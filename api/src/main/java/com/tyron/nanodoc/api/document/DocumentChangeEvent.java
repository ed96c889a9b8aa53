package com.tyron.nanodoc.api.document;

import com.tyron.nanodoc.api.delta.Delta;

/**
 * Represents a single change composed into a {@link RichDocument}.
 *
 * {@code before} is the content prior to the change; composing {@code change} into it
 * yields the current content.
 */
public final class DocumentChangeEvent {

    private final RichDocument document;
    private final Delta before;
    private final Delta change;
    private final ChangeSource source;

    public DocumentChangeEvent(RichDocument document, Delta before, Delta change, ChangeSource source) {
        this.document = document;
        this.before = before;
        this.change = change;
        this.source = source;
    }

    public RichDocument getDocument() {
        return document;
    }

    public Delta getBefore() {
        return before;
    }

    public Delta getChange() {
        return change;
    }

    public ChangeSource getSource() {
        return source;
    }
}
