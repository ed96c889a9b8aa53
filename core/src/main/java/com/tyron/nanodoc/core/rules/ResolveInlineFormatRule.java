package com.tyron.nanodoc.core.rules;

import com.tyron.nanodoc.api.attributes.AttributeScope;
import com.tyron.nanodoc.api.delta.Delta;
import com.tyron.nanodoc.api.delta.DeltaIterator;
import com.tyron.nanodoc.api.delta.Operation;
import com.tyron.nanodoc.api.rules.FormatRequest;
import com.tyron.nanodoc.api.rules.FormatRule;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Applies character-level attributes to every unit of the range except newlines.
 */
public final class ResolveInlineFormatRule implements FormatRule {

    @Override
    public @Nullable Delta apply(@NotNull FormatRequest request) {
        if (request.attribute().getScope() != AttributeScope.INLINE) {
            return null;
        }

        Map<String, Object> style = request.attribute().toMap();
        Delta delta = new Delta().retain(request.index());
        DeltaIterator itr = new DeltaIterator(request.document());
        itr.skip(request.index());

        int length = request.length();
        int cur = 0;
        while (cur < length && itr.hasNext()) {
            Operation op = itr.next(length - cur);
            cur += op.getLength();

            String text = op.getText();
            int lineBreak = text.indexOf('\n');
            if (lineBreak < 0) {
                delta.retain(op.getLength(), style);
                continue;
            }

            int pos = 0;
            while (lineBreak >= 0) {
                delta.retain(lineBreak - pos, style).retain(1);
                pos = lineBreak + 1;
                lineBreak = text.indexOf('\n', pos);
            }
            if (pos < op.getLength()) {
                delta.retain(op.getLength() - pos, style);
            }
        }

        return delta;
    }
}
