package com.tyron.nanodoc.core.rules;

import com.tyron.nanodoc.api.attributes.Attribute;
import com.tyron.nanodoc.api.delta.Delta;
import com.tyron.nanodoc.api.delta.DeltaIterator;
import com.tyron.nanodoc.api.delta.Operation;
import com.tyron.nanodoc.api.rules.FormatRequest;
import com.tyron.nanodoc.api.rules.FormatRule;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Updates a link from a collapsed selection: the link runs touching the caret on either side
 * receive the new value.
 */
public final class FormatLinkAtCaretRule implements FormatRule {

    @Override
    public @Nullable Delta apply(@NotNull FormatRequest request) {
        Attribute attribute = request.attribute();
        if (!Attribute.LINK_KEY.equals(attribute.getKey()) || request.length() > 0) {
            return null;
        }

        DeltaIterator itr = new DeltaIterator(request.document());
        Operation before = itr.skip(request.index());
        Operation after = itr.hasNext() ? itr.next() : null;

        int begin = request.index();
        int retain = 0;
        if (before != null && before.hasAttribute(attribute.getKey())) {
            begin -= before.getLength();
            retain = before.getLength();
        }
        if (after != null && after.hasAttribute(attribute.getKey())) {
            retain += after.getLength();
        }

        if (retain == 0) {
            return null;
        }

        return new Delta()
                .retain(begin)
                .retain(retain, attribute.toMap());
    }
}
