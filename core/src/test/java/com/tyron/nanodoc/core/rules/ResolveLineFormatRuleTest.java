package com.tyron.nanodoc.core.rules;

import com.tyron.nanodoc.api.attributes.Attribute;
import com.tyron.nanodoc.api.delta.Delta;
import com.tyron.nanodoc.api.rules.FormatRule;
import com.tyron.nanodoc.testFramework.BaseFormatRuleTest;
import com.tyron.nanodoc.testFramework.DeltaAssertions;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

public class ResolveLineFormatRuleTest extends BaseFormatRuleTest {

    private static final Map<String, Object> H1 = Attribute.H1.toMap();

    @Override
    protected FormatRule createRule() {
        return new ResolveLineFormatRule();
    }

    /**
     * "Hello\nWorld\n": newlines at 5 and 11.
     */
    static Stream<Arguments> boundaries() {
        return Stream.of(
                Arguments.of("range stops before the newline", 0, 5,
                        new Delta().retain(5).retain(1, H1)),
                Arguments.of("range ends right after the newline", 0, 6,
                        new Delta().retain(5).retain(1, H1).retain(5).retain(1, H1)),
                Arguments.of("collapsed inside the first line", 2, 0,
                        new Delta().retain(5).retain(1, H1)),
                Arguments.of("inside the second line", 7, 2,
                        new Delta().retain(11).retain(1, H1)),
                Arguments.of("whole document", 0, 12,
                        new Delta().retain(5).retain(1, H1).retain(5).retain(1, H1)),
                Arguments.of("spanning both lines", 3, 5,
                        new Delta().retain(5).retain(1, H1).retain(5).retain(1, H1)),
                Arguments.of("collapsed at the start of the second line", 6, 0,
                        new Delta().retain(11).retain(1, H1)),
                Arguments.of("range is the first newline only", 5, 1,
                        new Delta().retain(5).retain(1, H1).retain(5).retain(1, H1)),
                Arguments.of("collapsed on the last newline", 11, 0,
                        new Delta().retain(11).retain(1, H1)),
                Arguments.of("collapsed at the end of the document", 12, 0,
                        new Delta().retain(12))
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("boundaries")
    public void formatsNewlinesAroundRange(String name, int index, int length, Delta expected) {
        Delta result = apply(text("Hello\nWorld\n"), index, length, Attribute.H1);

        Assertions.assertEquals(expected, result);
        DeltaAssertions.assertNormalized(result);
        Assertions.assertTrue(result.length() >= index + length);
    }

    @Test
    @DisplayName("Heading over 'Hello' formats the newline terminating it")
    public void headingOverFirstWord() {
        Delta result = apply(text("Hello\nWorld\n"), 0, 5, Attribute.H1);

        Assertions.assertEquals(new Delta().retain(5).retain(1, Map.of("header", 1)), result);
    }

    @Test
    public void declinesNonBlockAttributes() {
        Assertions.assertNull(apply(text("Hello\n"), 0, 5, Attribute.BOLD));
        Assertions.assertNull(apply(text("Hello\n"), 0, 5, Attribute.style("a")));
    }

    @Test
    public void clearsOtherMembersOfTheExclusiveGroup() {
        Delta doc = new Delta()
                .insert("Quote")
                .insert("\n", Map.of("blockquote", true))
                .insert("Item")
                .insert("\n", Map.of("list", "bullet", "align", "center"));

        Delta result = apply(doc, 0, 10, Attribute.H1);

        Map<String, Object> firstLine = new LinkedHashMap<>();
        firstLine.put("header", 1);
        firstLine.put("blockquote", null);
        Map<String, Object> secondLine = new LinkedHashMap<>();
        secondLine.put("header", 1);
        secondLine.put("list", null);

        Assertions.assertEquals(new Delta()
                .retain(5)
                .retain(1, firstLine)
                .retain(4)
                .retain(1, secondLine), result);
    }

    @Test
    public void keepsSameKeyAndNonExclusiveKeys() {
        Delta doc = new Delta()
                .insert("Title")
                .insert("\n", Map.of("header", 2, "align", "right"));

        Delta result = apply(doc, 0, 0, Attribute.H1);

        Assertions.assertEquals(new Delta().retain(5).retain(1, H1), result);
    }

    @Test
    public void unsettingDoesNotClearSiblings() {
        Delta doc = new Delta()
                .insert("Item")
                .insert("\n", Map.of("list", "ordered"));

        Delta result = apply(doc, 0, 4, Attribute.HEADER.unset());

        Assertions.assertEquals(new Delta().retain(4).retain(1, Attribute.HEADER.unset().toMap()), result);
    }

    @Test
    public void nonExclusiveBlockAttributeLeavesOthersAlone() {
        Delta doc = new Delta()
                .insert("Item")
                .insert("\n", Map.of("list", "ordered"));

        Delta result = apply(doc, 0, 4, Attribute.indent(1));

        Assertions.assertEquals(new Delta().retain(4).retain(1, Map.of("indent", 1)), result);
    }

    @Test
    public void noNewlineMeansIdentityPatch() {
        Delta result = apply(text("abc"), 0, 2, Attribute.H1);

        Assertions.assertEquals(new Delta().retain(3), result);
    }

    @Test
    public void formatsEveryNewlineInsideOneOperation() {
        Delta result = apply(text("a\nb\nc\nd\n"), 0, 5, Attribute.CODE_BLOCK);

        Map<String, Object> code = Attribute.CODE_BLOCK.toMap();
        Assertions.assertEquals(new Delta()
                .retain(1).retain(1, code)
                .retain(1).retain(1, code)
                .retain(1).retain(1, code), result);
    }

    @Test
    public void applyingTwiceIsIdempotent() {
        Delta doc = new Delta()
                .insert("One\nTwo")
                .insert("\n", Map.of("list", "bullet"));

        Delta once = doc.compose(apply(doc, 1, 5, Attribute.BLOCKQUOTE));
        Delta twice = once.compose(apply(once, 1, 5, Attribute.BLOCKQUOTE));

        Assertions.assertEquals(once, twice);
        Assertions.assertEquals(new Delta()
                .insert("One")
                .insert("\n", Map.of("blockquote", true))
                .insert("Two")
                .insert("\n", Map.of("blockquote", true)), once);
    }
}
