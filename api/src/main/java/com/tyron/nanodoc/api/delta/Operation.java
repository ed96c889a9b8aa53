package com.tyron.nanodoc.api.delta;

import com.google.common.base.Preconditions;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single step of a {@link Delta}: insert content, retain a number of units or delete a number of units.
 *
 * Operations are immutable. Inserts and retains may carry attributes; a {@code null} attribute value
 * marks the attribute for removal. An empty attribute map is stored as {@code null}.
 */
public final class Operation {

    public enum Kind {
        INSERT("insert"),
        RETAIN("retain"),
        DELETE("delete");

        private final String key;

        Kind(String key) {
            this.key = key;
        }

        /**
         * @return the record key used by the ops-list wire format.
         */
        public String getKey() {
            return key;
        }
    }

    private final Kind kind;
    private final int length;
    private final Object data;
    private final Map<String, Object> attributes;

    private Operation(Kind kind, int length, @Nullable Object data, @Nullable Map<String, Object> attributes) {
        this.kind = kind;
        this.length = length;
        this.data = data;
        this.attributes = attributes == null || attributes.isEmpty()
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Operation insert(@NotNull String text) {
        return insert(text, null);
    }

    public static Operation insert(@NotNull String text, @Nullable Map<String, ?> attributes) {
        Objects.requireNonNull(text, "text");
        Preconditions.checkArgument(!text.isEmpty(), "Insert text must not be empty");
        return new Operation(Kind.INSERT, text.length(), text, copyOf(attributes));
    }

    public static Operation insert(@NotNull Embed embed, @Nullable Map<String, ?> attributes) {
        Objects.requireNonNull(embed, "embed");
        return new Operation(Kind.INSERT, 1, embed, copyOf(attributes));
    }

    public static Operation retain(int length) {
        return retain(length, null);
    }

    public static Operation retain(int length, @Nullable Map<String, ?> attributes) {
        Preconditions.checkArgument(length > 0, "Retain length must be positive: %s", length);
        return new Operation(Kind.RETAIN, length, null, copyOf(attributes));
    }

    public static Operation delete(int length) {
        Preconditions.checkArgument(length > 0, "Delete length must be positive: %s", length);
        return new Operation(Kind.DELETE, length, null, null);
    }

    private static Map<String, Object> copyOf(@Nullable Map<String, ?> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return null;
        }
        return new LinkedHashMap<>(attributes);
    }

    public Kind getKind() {
        return kind;
    }

    public int getLength() {
        return length;
    }

    /**
     * @return the inserted {@link String} or {@link Embed}, {@code null} for retains and deletes.
     */
    public @Nullable Object getData() {
        return data;
    }

    /**
     * @return the inserted text, or an empty string for embeds, retains and deletes.
     */
    public @NotNull String getText() {
        return data instanceof String s ? s : "";
    }

    public @Nullable Map<String, Object> getAttributes() {
        return attributes;
    }

    public boolean isInsert() {
        return kind == Kind.INSERT;
    }

    public boolean isRetain() {
        return kind == Kind.RETAIN;
    }

    public boolean isDelete() {
        return kind == Kind.DELETE;
    }

    public boolean isEmbed() {
        return data instanceof Embed;
    }

    public boolean isPlain() {
        return attributes == null;
    }

    /**
     * True when the key is present, including keys explicitly set to {@code null}.
     */
    public boolean hasAttribute(String key) {
        return attributes != null && attributes.containsKey(key);
    }

    public boolean hasSameAttributes(Operation other) {
        return Objects.equals(attributes, other.attributes);
    }

    /**
     * Returns a copy of this operation with the same kind and data but a different length.
     * Only valid for retains and deletes; text inserts are sliced through {@link #slice(int, int)}.
     */
    Operation withLength(int newLength) {
        return switch (kind) {
            case RETAIN -> retain(newLength, attributes);
            case DELETE -> delete(newLength);
            case INSERT -> throw new IllegalStateException("Inserts cannot be resized");
        };
    }

    /**
     * Returns a copy of this operation carrying different attributes. Deletes never carry attributes.
     */
    Operation withAttributes(@Nullable Map<String, ?> newAttributes) {
        Preconditions.checkState(kind != Kind.DELETE, "Deletes cannot carry attributes");
        return new Operation(kind, length, data, copyOf(newAttributes));
    }

    /**
     * Returns the units {@code [start, end)} of this operation.
     */
    Operation slice(int start, int end) {
        if (start == 0 && end == length) {
            return this;
        }
        if (kind == Kind.INSERT) {
            if (data instanceof String s) {
                return new Operation(Kind.INSERT, end - start, s.substring(start, end), attributes);
            }
            return this;
        }
        return withLength(end - start);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Operation that)) return false;
        return kind == that.kind
                && length == that.length
                && Objects.equals(data, that.data)
                && Objects.equals(attributes, that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, length, data, attributes);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.getKey()).append('(');
        if (kind == Kind.INSERT) {
            if (data instanceof String s) {
                sb.append('"').append(s.replace("\n", "\\n")).append('"');
            } else {
                sb.append(data);
            }
        } else {
            sb.append(length);
        }
        if (attributes != null) {
            sb.append(", ").append(attributes);
        }
        return sb.append(')').toString();
    }
}
