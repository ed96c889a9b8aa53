package com.tyron.nanodoc.api.document;

/**
 * Listener for {@link RichDocument} changes.
 */
public interface DocumentChangeListener {

    /**
     * Fired after the change has been composed into the document.
     */
    void documentChanged(DocumentChangeEvent event);
}
