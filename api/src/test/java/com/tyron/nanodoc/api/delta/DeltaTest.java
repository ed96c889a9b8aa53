package com.tyron.nanodoc.api.delta;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.truth.Truth.assertThat;

public class DeltaTest {

    private static final Map<String, Object> BOLD = Map.of("bold", true);
    private static final Map<String, Object> ITALIC = Map.of("italic", true);

    @Test
    public void mergesAdjacentInsertsWithSameAttributes() {
        Delta delta = new Delta()
                .insert("Hel", BOLD)
                .insert("lo", BOLD)
                .insert("\n");

        Assertions.assertEquals(2, delta.size());
        Assertions.assertEquals(Operation.insert("Hello", BOLD), delta.get(0));
        Assertions.assertEquals(6, delta.length());
    }

    @Test
    public void keepsInsertsWithDifferentAttributesApart() {
        Delta delta = new Delta()
                .insert("a", BOLD)
                .insert("b", ITALIC)
                .insert("c");

        Assertions.assertEquals(3, delta.size());
    }

    @Test
    public void neverMergesEmbeds() {
        Delta delta = new Delta()
                .insert(Embed.image("a.png"))
                .insert(Embed.image("a.png"));

        Assertions.assertEquals(2, delta.size());
        Assertions.assertEquals(2, delta.length());
    }

    @Test
    public void mergesRetainsAndDeletes() {
        Delta delta = new Delta()
                .retain(2)
                .retain(3)
                .retain(1, BOLD)
                .retain(4, BOLD)
                .delete(1)
                .delete(2);

        assertThat(delta.getOperations()).containsExactly(
                Operation.retain(5),
                Operation.retain(5, BOLD),
                Operation.delete(3)
        ).inOrder();
    }

    @Test
    public void ignoresZeroLengthOperations() {
        Delta delta = new Delta()
                .retain(0)
                .insert("")
                .delete(0)
                .retain(0, BOLD);

        Assertions.assertTrue(delta.isEmpty());
    }

    @Test
    public void rejectsNegativeLengths() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new Delta().retain(-1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new Delta().delete(-2));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Operation.retain(0));
    }

    @Test
    public void treatsEmptyAttributeMapAsPlain() {
        Delta delta = new Delta()
                .retain(2)
                .retain(3, Map.of());

        assertThat(delta.getOperations()).containsExactly(Operation.retain(5));
    }

    @Test
    public void keepsNullAttributeValues() {
        Map<String, Object> clearList = new LinkedHashMap<>();
        clearList.put("header", 1);
        clearList.put("list", null);

        Operation op = Operation.retain(1, clearList);

        Assertions.assertTrue(op.hasAttribute("list"));
        Assertions.assertNull(op.getAttributes().get("list"));
        Assertions.assertEquals(List.of("header", "list"), List.copyOf(op.getAttributes().keySet()));
    }

    @Test
    public void placesInsertBeforeTrailingDelete() {
        Delta delta = new Delta()
                .retain(2)
                .delete(3)
                .insert("ab");

        assertThat(delta.getOperations()).containsExactly(
                Operation.retain(2),
                Operation.insert("ab"),
                Operation.delete(3)
        ).inOrder();
    }

    @Test
    public void insertAfterLeadingDeleteMovesToFront() {
        Delta delta = new Delta()
                .delete(1)
                .insert("x");

        assertThat(delta.getOperations()).containsExactly(
                Operation.insert("x"),
                Operation.delete(1)
        ).inOrder();
    }

    @Test
    public void insertBeforeDeleteMergesWithPrecedingInsert() {
        Delta delta = new Delta()
                .insert("a")
                .delete(2)
                .insert("b");

        assertThat(delta.getOperations()).containsExactly(
                Operation.insert("ab"),
                Operation.delete(2)
        ).inOrder();
    }

    @Test
    public void concatMergesAtTheSeam() {
        Delta left = new Delta().retain(2).retain(1, BOLD);
        Delta right = new Delta().retain(3, BOLD).retain(1);

        Delta result = left.concat(right);

        assertThat(result.getOperations()).containsExactly(
                Operation.retain(2),
                Operation.retain(4, BOLD),
                Operation.retain(1)
        ).inOrder();
        // operands are untouched
        Assertions.assertEquals(2, left.size());
        Assertions.assertEquals(2, right.size());
    }

    @Test
    public void concatMergesDeletesAcrossTheSeam() {
        Delta left = new Delta().retain(1).delete(1);
        Delta right = new Delta().insert("x").delete(1);

        Delta result = left.concat(right);

        assertThat(result.getOperations()).containsExactly(
                Operation.retain(1),
                Operation.insert("x"),
                Operation.delete(2)
        ).inOrder();
    }

    @Test
    public void composeAppliesAttributesToInserts() {
        Delta doc = new Delta().insert("Hello\n");
        Delta change = new Delta().retain(5, BOLD);

        Delta result = doc.compose(change);

        assertThat(result.getOperations()).containsExactly(
                Operation.insert("Hello", BOLD),
                Operation.insert("\n")
        ).inOrder();
    }

    @Test
    public void composeDropsNullAttributesOnInserts() {
        Delta doc = new Delta().insert("Item").insert("\n", Map.of("list", "bullet"));
        Map<String, Object> style = new LinkedHashMap<>();
        style.put("header", 1);
        style.put("list", null);

        Delta result = doc.compose(new Delta().retain(4).retain(1, style));

        assertThat(result.getOperations()).containsExactly(
                Operation.insert("Item"),
                Operation.insert("\n", Map.of("header", 1))
        ).inOrder();
    }

    @Test
    public void composeKeepsNullAttributesOnRetains() {
        Delta first = new Delta().retain(3, BOLD);
        Map<String, Object> unbold = new LinkedHashMap<>();
        unbold.put("bold", null);

        Delta result = first.compose(new Delta().retain(3, unbold));

        assertThat(result.getOperations()).containsExactly(Operation.retain(3, unbold));
    }

    @Test
    public void composeHandlesInsertsAndDeletes() {
        Delta doc = new Delta().insert("Hello World\n");
        Delta change = new Delta()
                .retain(5)
                .delete(6)
                .insert("!");

        Delta result = doc.compose(change);

        Assertions.assertEquals("Hello!\n", result.toPlainText());
        Assertions.assertTrue(result.isDocument());
    }

    @Test
    public void composeInsertThenDeleteCancels() {
        Delta inserted = new Delta().insert("abc");

        Delta result = inserted.compose(new Delta().delete(3));

        Assertions.assertTrue(result.isEmpty());
    }

    @Test
    public void composeTrimsTrailingRetain() {
        Delta result = new Delta().retain(3, BOLD).compose(new Delta().retain(5));

        assertThat(result.getOperations()).containsExactly(Operation.retain(3, BOLD));
    }

    @Test
    public void sliceSplitsOperations() {
        Delta doc = new Delta()
                .insert("Hello", BOLD)
                .insert(" World\n");

        Delta slice = doc.slice(3, 8);

        assertThat(slice.getOperations()).containsExactly(
                Operation.insert("lo", BOLD),
                Operation.insert(" Wo")
        ).inOrder();
        Assertions.assertEquals(doc, doc.slice(0));
    }

    @Test
    public void plainTextRendersEmbeds() {
        Delta doc = new Delta()
                .insert("a")
                .insert(Embed.image("x.png"))
                .insert("b\n");

        Assertions.assertEquals("a\uFFFCb\n", doc.toPlainText());
        Assertions.assertEquals(4, doc.length());
        Assertions.assertTrue(doc.isDocument());
        Assertions.assertFalse(new Delta().retain(1).isDocument());
    }

    @Test
    public void ofNormalizesOperations() {
        Delta delta = Delta.of(List.of(Operation.insert("a"), Operation.insert("b"), Operation.retain(1)));

        assertThat(delta.getOperations()).containsExactly(Operation.insert("ab"), Operation.retain(1)).inOrder();
    }
}
