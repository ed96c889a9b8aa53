package com.tyron.nanodoc.api.delta;

import com.google.common.base.Preconditions;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ConcurrentModificationException;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A forward cursor over the operations of a {@link Delta}.
 *
 * The cursor consumes the delta in length units rather than whole operations: {@link #next(int)}
 * and {@link #skip(int)} split the current operation when the requested length ends inside it,
 * and the remainder is returned by subsequent calls.
 *
 * Instances are cheap and meant to be created for a single traversal.
 */
public final class DeltaIterator {

    private final Delta delta;
    private final int expectedModificationCount;

    private int index;
    private int offset;

    public DeltaIterator(@NotNull Delta delta) {
        this.delta = Objects.requireNonNull(delta, "delta");
        this.expectedModificationCount = delta.getModificationCount();
    }

    public boolean hasNext() {
        return index < delta.size();
    }

    /**
     * @return the remaining length of the current operation, or {@link Integer#MAX_VALUE} when exhausted.
     */
    public int peekLength() {
        if (index < delta.size()) {
            return delta.get(index).getLength() - offset;
        }
        return Integer.MAX_VALUE;
    }

    /**
     * @return the kind of the current operation, or {@code null} when exhausted.
     */
    public @Nullable Operation.Kind peekKind() {
        return index < delta.size() ? delta.get(index).getKind() : null;
    }

    /**
     * Consumes the rest of the current operation.
     */
    public Operation next() {
        return next(Integer.MAX_VALUE);
    }

    /**
     * Consumes up to {@code maxLength} units of the current operation.
     *
     * @throws NoSuchElementException if the iterator is exhausted
     */
    public Operation next(int maxLength) {
        Preconditions.checkArgument(maxLength > 0, "maxLength must be positive: %s", maxLength);
        checkForModification();
        if (!hasNext()) {
            throw new NoSuchElementException("Delta iterator exhausted at operation " + index);
        }

        Operation op = delta.get(index);
        int start = offset;
        int remaining = op.getLength() - start;
        int length = Math.min(remaining, maxLength);

        if (length == remaining) {
            index++;
            offset = 0;
        } else {
            offset += length;
        }

        return op.slice(start, start + length);
    }

    /**
     * Advances the cursor by {@code length} units, or until the delta is exhausted.
     *
     * @return the last (possibly partial) operation consumed, or {@code null} if nothing was consumed
     */
    public @Nullable Operation skip(int length) {
        Preconditions.checkArgument(length >= 0, "length must not be negative: %s", length);
        int skipped = length;
        Operation op = null;
        while (skipped > 0 && hasNext()) {
            op = next(skipped);
            skipped -= op.getLength();
        }
        return op;
    }

    private void checkForModification() {
        if (delta.getModificationCount() != expectedModificationCount) {
            throw new ConcurrentModificationException("Delta was modified during iteration");
        }
    }
}
