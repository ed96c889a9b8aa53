package com.tyron.nanodoc.api.rules;

import com.tyron.nanodoc.api.attributes.Attribute;
import com.tyron.nanodoc.api.attributes.AttributeRegistry;
import com.tyron.nanodoc.api.delta.Delta;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Context passed to rules: apply {@code attribute} to {@code [index, index + length)} of {@code document}.
 *
 * @param document the current document, a delta of inserts only. Rules must not modify it.
 * @param data     optional payload accompanying the request, e.g. embed data
 * @param registry the attribute catalog used to resolve exclusive groups
 */
public record FormatRequest(Delta document,
                            int index,
                            int length,
                            Attribute attribute,
                            @Nullable Object data,
                            AttributeRegistry registry) {

    public FormatRequest {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(registry, "registry");
    }

    public FormatRequest(Delta document, int index, int length, Attribute attribute) {
        this(document, index, length, attribute, null, AttributeRegistry.defaults());
    }

    public int end() {
        return index + length;
    }
}
