package com.tyron.nanodoc.api.document;

/**
 * Origin of a document change.
 */
public enum ChangeSource {
    LOCAL,
    REMOTE
}
