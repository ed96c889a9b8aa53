package com.tyron.nanodoc.api.delta;

import com.google.common.base.Preconditions;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An ordered, normalized list of {@link Operation}s.
 *
 * A Delta describes either a document (inserts only) or a change to a document
 * (any mix of retains, inserts and deletes). All building methods merge the appended
 * operation with the last one when both have the same kind and attributes, so a Delta
 * is always in normalized form. Inserts appended after a trailing delete are placed
 * before it.
 */
public final class Delta implements Iterable<Operation> {

    private final List<Operation> operations = new ArrayList<>();

    /**
     * Incremented on every structural change. Used by {@link DeltaIterator} to detect modification.
     */
    private int modificationCount;

    public Delta() {
    }

    public static Delta copyOf(Delta other) {
        Delta delta = new Delta();
        delta.operations.addAll(other.operations);
        return delta;
    }

    public static Delta of(List<Operation> operations) {
        Delta delta = new Delta();
        for (Operation op : operations) {
            delta.push(op);
        }
        return delta;
    }

    public Delta insert(@NotNull String text) {
        return insert(text, null);
    }

    public Delta insert(@NotNull String text, @Nullable Map<String, ?> attributes) {
        if (text.isEmpty()) {
            return this;
        }
        return push(Operation.insert(text, attributes));
    }

    public Delta insert(@NotNull Embed embed) {
        return insert(embed, null);
    }

    public Delta insert(@NotNull Embed embed, @Nullable Map<String, ?> attributes) {
        return push(Operation.insert(embed, attributes));
    }

    public Delta retain(int length) {
        return retain(length, null);
    }

    public Delta retain(int length, @Nullable Map<String, ?> attributes) {
        Preconditions.checkArgument(length >= 0, "Retain length must not be negative: %s", length);
        if (length == 0) {
            return this;
        }
        return push(Operation.retain(length, attributes));
    }

    public Delta delete(int length) {
        Preconditions.checkArgument(length >= 0, "Delete length must not be negative: %s", length);
        if (length == 0) {
            return this;
        }
        return push(Operation.delete(length));
    }

    /**
     * Appends an operation, merging it into the last operation where possible.
     */
    public Delta push(@NotNull Operation operation) {
        Objects.requireNonNull(operation, "operation");

        int index = operations.size();
        Operation last = index > 0 ? operations.get(index - 1) : null;

        if (last != null) {
            if (last.isDelete() && operation.isDelete()) {
                operations.set(index - 1, Operation.delete(last.getLength() + operation.getLength()));
                modificationCount++;
                return this;
            }

            if (last.isDelete() && operation.isInsert()) {
                // Inserts always go before a trailing delete.
                index--;
                last = index > 0 ? operations.get(index - 1) : null;
                if (last == null) {
                    operations.add(0, operation);
                    modificationCount++;
                    return this;
                }
            }

            if (last.isInsert() && operation.isInsert()
                    && !last.isEmbed() && !operation.isEmbed()
                    && last.hasSameAttributes(operation)) {
                operations.set(index - 1, Operation.insert(last.getText() + operation.getText(), last.getAttributes()));
                modificationCount++;
                return this;
            }

            if (last.isRetain() && operation.isRetain() && last.hasSameAttributes(operation)) {
                operations.set(index - 1, Operation.retain(last.getLength() + operation.getLength(), last.getAttributes()));
                modificationCount++;
                return this;
            }
        }

        operations.add(index, operation);
        modificationCount++;
        return this;
    }

    /**
     * Returns a new Delta with the operations of {@code other} appended to the operations of this delta.
     */
    public Delta concat(@NotNull Delta other) {
        Delta result = copyOf(this);
        for (Operation operation : other.operations) {
            result.push(operation);
        }
        return result;
    }

    /**
     * Returns the result of applying {@code other} after this delta.
     */
    public Delta compose(@NotNull Delta other) {
        Delta result = new Delta();
        DeltaIterator thisIter = new DeltaIterator(this);
        DeltaIterator otherIter = new DeltaIterator(other);

        while (thisIter.hasNext() || otherIter.hasNext()) {
            if (otherIter.peekKind() == Operation.Kind.INSERT) {
                result.push(otherIter.next());
                continue;
            }
            if (thisIter.peekKind() == Operation.Kind.DELETE) {
                result.push(thisIter.next());
                continue;
            }
            if (!otherIter.hasNext()) {
                result.push(thisIter.next());
                continue;
            }
            if (!thisIter.hasNext()) {
                result.push(otherIter.next());
                continue;
            }

            int length = Math.min(thisIter.peekLength(), otherIter.peekLength());
            Operation thisOp = thisIter.next(length);
            Operation otherOp = otherIter.next(length);

            if (otherOp.isRetain()) {
                Map<String, Object> attributes = composeAttributes(
                        thisOp.getAttributes(), otherOp.getAttributes(), thisOp.isRetain());
                result.push(thisOp.withAttributes(attributes));
            } else if (thisOp.isRetain()) {
                result.push(otherOp);
            }
            // insert followed by delete: both vanish
        }

        return result.trim();
    }

    /**
     * Overlays {@code b} onto {@code a}. Keys set to {@code null} are dropped unless {@code keepNull}
     * is set, in which case they stay as removal markers.
     *
     * @return the composed attributes, or {@code null} when empty
     */
    public static @Nullable Map<String, Object> composeAttributes(@Nullable Map<String, ?> a,
                                                                  @Nullable Map<String, ?> b,
                                                                  boolean keepNull) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (a != null) {
            result.putAll(a);
        }
        if (b != null) {
            result.putAll(b);
        }
        if (!keepNull) {
            result.values().removeIf(Objects::isNull);
        }
        return result.isEmpty() ? null : result;
    }

    /**
     * Returns the units {@code [start, end)} of this delta.
     */
    public Delta slice(int start, int end) {
        Preconditions.checkArgument(start >= 0 && start <= end, "Invalid slice [%s, %s)", start, end);
        Delta result = new Delta();
        DeltaIterator iterator = new DeltaIterator(this);
        iterator.skip(start);
        int remaining = end - start;
        while (remaining > 0 && iterator.hasNext()) {
            Operation op = iterator.next(remaining);
            result.push(op);
            remaining -= op.getLength();
        }
        return result;
    }

    public Delta slice(int start) {
        return slice(start, Math.max(start, length()));
    }

    /**
     * Removes a trailing retain without attributes.
     */
    public Delta trim() {
        if (!operations.isEmpty()) {
            Operation last = operations.get(operations.size() - 1);
            if (last.isRetain() && last.isPlain()) {
                operations.remove(operations.size() - 1);
                modificationCount++;
            }
        }
        return this;
    }

    public int length() {
        int length = 0;
        for (Operation op : operations) {
            length += op.getLength();
        }
        return length;
    }

    public int size() {
        return operations.size();
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public Operation get(int index) {
        return operations.get(index);
    }

    public @Nullable Operation last() {
        return operations.isEmpty() ? null : operations.get(operations.size() - 1);
    }

    public List<Operation> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    /**
     * True when every operation is an insert.
     */
    public boolean isDocument() {
        for (Operation op : operations) {
            if (!op.isInsert()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Concatenated text of all inserts, embeds rendered as {@link Embed#OBJECT_REPLACEMENT_CHARACTER}.
     */
    public String toPlainText() {
        StringBuilder sb = new StringBuilder(length());
        for (Operation op : operations) {
            if (!op.isInsert()) continue;
            if (op.isEmbed()) {
                sb.append(Embed.OBJECT_REPLACEMENT_CHARACTER);
            } else {
                sb.append(op.getText());
            }
        }
        return sb.toString();
    }

    int getModificationCount() {
        return modificationCount;
    }

    @Override
    public @NotNull Iterator<Operation> iterator() {
        return getOperations().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Delta that)) return false;
        return operations.equals(that.operations);
    }

    @Override
    public int hashCode() {
        return operations.hashCode();
    }

    @Override
    public String toString() {
        return "Delta" + operations;
    }
}
