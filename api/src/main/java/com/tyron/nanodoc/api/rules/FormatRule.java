package com.tyron.nanodoc.api.rules;

import com.tyron.nanodoc.api.delta.Delta;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Extension Point. A strategy that turns a format request into a change to the document.
 *
 * Rules are consulted in order; the first rule that returns a delta handles the request.
 */
public interface FormatRule {

    /**
     * @param request the document snapshot, target range and attribute
     * @return the change implementing the request, or {@code null} if this rule does not apply
     */
    @Nullable Delta apply(@NotNull FormatRequest request);
}
