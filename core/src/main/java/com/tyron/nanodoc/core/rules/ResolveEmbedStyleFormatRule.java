package com.tyron.nanodoc.core.rules;

import com.google.common.base.Preconditions;
import com.tyron.nanodoc.api.attributes.Attribute;
import com.tyron.nanodoc.api.delta.Delta;
import com.tyron.nanodoc.api.rules.FormatRequest;
import com.tyron.nanodoc.api.rules.FormatRule;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Applies the style attribute to a single embed.
 */
public final class ResolveEmbedStyleFormatRule implements FormatRule {

    @Override
    public @Nullable Delta apply(@NotNull FormatRequest request) {
        if (!Attribute.STYLE_KEY.equals(request.attribute().getKey())) {
            return null;
        }

        Preconditions.checkArgument(request.length() == 1,
                "Embed style must target exactly one unit, got length %s", request.length());
        Preconditions.checkArgument(request.data() == null,
                "Embed style does not accept a payload, got %s", request.data());

        return new Delta()
                .retain(request.index())
                .retain(1, request.attribute().toMap());
    }
}
