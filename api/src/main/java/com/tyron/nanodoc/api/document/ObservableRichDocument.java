package com.tyron.nanodoc.api.document;

/**
 * Optional extension of {@link RichDocument} for implementations that can publish change events.
 */
public interface ObservableRichDocument extends RichDocument {

    void addDocumentChangeListener(DocumentChangeListener listener);

    void removeDocumentChangeListener(DocumentChangeListener listener);

    /**
     * Monotonically increasing stamp; increments on every change.
     */
    long getModificationStamp();
}
