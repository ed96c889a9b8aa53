package com.tyron.nanodoc.api.attributes;

/**
 * Where an attribute applies within a document.
 */
public enum AttributeScope {
    /**
     * Line-level formatting, stored on the newline that terminates the line.
     */
    BLOCK,
    /**
     * Character-level formatting, never stored on newlines.
     */
    INLINE,
    /**
     * Styling of embedded (non-text) content.
     */
    EMBED
}
