package com.tyron.nanodoc.testFramework;

import com.tyron.nanodoc.api.delta.Delta;
import com.tyron.nanodoc.api.delta.Operation;
import org.junit.jupiter.api.Assertions;

/**
 * Assertions over delta structure shared by rule and document tests.
 */
public final class DeltaAssertions {

    private DeltaAssertions() {
    }

    /**
     * Fails if two adjacent operations could have been merged.
     */
    public static void assertNormalized(Delta delta) {
        for (int i = 1; i < delta.size(); i++) {
            Operation prev = delta.get(i - 1);
            Operation cur = delta.get(i);
            Assertions.assertTrue(cur.getLength() > 0, () -> "zero-length operation at " + cur + " in " + delta);
            if (prev.getKind() != cur.getKind() || !prev.hasSameAttributes(cur)) {
                continue;
            }
            boolean mergeable = !prev.isInsert() || (!prev.isEmbed() && !cur.isEmbed());
            Assertions.assertFalse(mergeable, () -> "unmerged operations " + prev + ", " + cur + " in " + delta);
        }
    }

    /**
     * Fails if any retained newline of {@code document} carries attributes in {@code change}.
     */
    public static void assertNoAttributesOnNewlines(Delta document, Delta change) {
        String text = document.toPlainText();
        int position = 0;
        for (Operation op : change) {
            if (op.isRetain() && op.getAttributes() != null) {
                String covered = text.substring(position, Math.min(text.length(), position + op.getLength()));
                Assertions.assertEquals(-1, covered.indexOf('\n'),
                        () -> op + " formats a newline in " + change);
            }
            if (!op.isInsert()) {
                position += op.getLength();
            }
        }
    }
}
