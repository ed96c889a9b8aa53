package com.tyron.nanodoc.core.rules;

import com.tyron.nanodoc.api.attributes.Attribute;
import com.tyron.nanodoc.api.attributes.AttributeScope;
import com.tyron.nanodoc.api.delta.Delta;
import com.tyron.nanodoc.api.delta.DeltaIterator;
import com.tyron.nanodoc.api.delta.Operation;
import com.tyron.nanodoc.api.rules.FormatRequest;
import com.tyron.nanodoc.api.rules.FormatRule;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Set;

/**
 * Applies line-level attributes. Block attributes live on the newline that terminates a line,
 * so only newline characters receive the attribute.
 *
 * <p>Besides every newline inside the range, the first newline after the range is formatted too:
 * it terminates the last line the range touches, even when the range stops short of it.</p>
 *
 * <p>If the attribute belongs to an exclusive group, other members of that group found on a
 * newline are cleared in the same change.</p>
 */
public final class ResolveLineFormatRule implements FormatRule {

    @Override
    public @Nullable Delta apply(@NotNull FormatRequest request) {
        Attribute attribute = request.attribute();
        if (attribute.getScope() != AttributeScope.BLOCK) {
            return null;
        }

        Delta result = new Delta().retain(request.index());
        DeltaIterator itr = new DeltaIterator(request.document());
        itr.skip(request.index());

        int length = request.length();
        int cur = 0;
        while (cur < length && itr.hasNext()) {
            Operation op = itr.next(length - cur);
            cur += op.getLength();

            String text = op.getText();
            if (text.indexOf('\n') < 0) {
                result.retain(op.getLength());
                continue;
            }
            result = result.concat(applyAttribute(request, op, false));
        }

        // The newline terminating the last line of the range.
        while (itr.hasNext()) {
            Operation op = itr.next();
            if (op.getText().indexOf('\n') < 0) {
                result.retain(op.getLength());
                continue;
            }
            result = result.concat(applyAttribute(request, op, true));
            break;
        }

        return result;
    }

    private static Delta applyAttribute(FormatRequest request, Operation op, boolean firstOnly) {
        Delta result = new Delta();
        String text = op.getText();
        Map<String, Object> style = mergedStyle(request, op);

        int offset = 0;
        int lf = text.indexOf('\n');
        while (lf >= 0) {
            result.retain(lf - offset).retain(1, style);
            if (firstOnly) {
                return result;
            }
            offset = lf + 1;
            lf = text.indexOf('\n', offset);
        }
        return result.retain(text.length() - offset);
    }

    /**
     * The requested attribute plus a removal marker for every other member of its exclusive group
     * set on {@code op}.
     */
    private static Map<String, Object> mergedStyle(FormatRequest request, Operation op) {
        Attribute attribute = request.attribute();
        Map<String, Object> style = attribute.toMap();

        Set<String> group = request.registry().exclusiveGroup(attribute.getKey());
        if (group.isEmpty() || attribute.isUnset() || op.getAttributes() == null) {
            return style;
        }
        for (String key : op.getAttributes().keySet()) {
            if (!key.equals(attribute.getKey()) && group.contains(key)) {
                style.put(key, null);
            }
        }
        return style;
    }
}
