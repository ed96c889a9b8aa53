package com.tyron.nanodoc.api.attributes;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A formatting attribute: a key, the scope it applies to, and a value.
 *
 * A {@code null} value means the attribute should be removed from the affected range.
 */
public final class Attribute {

    public static final String BOLD_KEY = "bold";
    public static final String ITALIC_KEY = "italic";
    public static final String SMALL_KEY = "small";
    public static final String UNDERLINE_KEY = "underline";
    public static final String STRIKE_THROUGH_KEY = "strike";
    public static final String INLINE_CODE_KEY = "code";
    public static final String FONT_KEY = "font";
    public static final String SIZE_KEY = "size";
    public static final String LINK_KEY = "link";
    public static final String COLOR_KEY = "color";
    public static final String BACKGROUND_KEY = "background";
    public static final String PLACEHOLDER_KEY = "placeholder";

    public static final String HEADER_KEY = "header";
    public static final String ALIGN_KEY = "align";
    public static final String LIST_KEY = "list";
    public static final String CODE_BLOCK_KEY = "code-block";
    public static final String BLOCKQUOTE_KEY = "blockquote";
    public static final String INDENT_KEY = "indent";
    public static final String DIRECTION_KEY = "direction";

    public static final String WIDTH_KEY = "width";
    public static final String HEIGHT_KEY = "height";
    public static final String STYLE_KEY = "style";

    public static final Attribute BOLD = new Attribute(BOLD_KEY, AttributeScope.INLINE, true);
    public static final Attribute ITALIC = new Attribute(ITALIC_KEY, AttributeScope.INLINE, true);
    public static final Attribute SMALL = new Attribute(SMALL_KEY, AttributeScope.INLINE, true);
    public static final Attribute UNDERLINE = new Attribute(UNDERLINE_KEY, AttributeScope.INLINE, true);
    public static final Attribute STRIKE_THROUGH = new Attribute(STRIKE_THROUGH_KEY, AttributeScope.INLINE, true);
    public static final Attribute INLINE_CODE = new Attribute(INLINE_CODE_KEY, AttributeScope.INLINE, true);
    public static final Attribute FONT = new Attribute(FONT_KEY, AttributeScope.INLINE, null);
    public static final Attribute SIZE = new Attribute(SIZE_KEY, AttributeScope.INLINE, null);
    public static final Attribute LINK = new Attribute(LINK_KEY, AttributeScope.INLINE, null);
    public static final Attribute COLOR = new Attribute(COLOR_KEY, AttributeScope.INLINE, null);
    public static final Attribute BACKGROUND = new Attribute(BACKGROUND_KEY, AttributeScope.INLINE, null);
    public static final Attribute PLACEHOLDER = new Attribute(PLACEHOLDER_KEY, AttributeScope.INLINE, true);

    public static final Attribute HEADER = new Attribute(HEADER_KEY, AttributeScope.BLOCK, null);
    public static final Attribute H1 = new Attribute(HEADER_KEY, AttributeScope.BLOCK, 1);
    public static final Attribute H2 = new Attribute(HEADER_KEY, AttributeScope.BLOCK, 2);
    public static final Attribute H3 = new Attribute(HEADER_KEY, AttributeScope.BLOCK, 3);
    public static final Attribute ALIGN = new Attribute(ALIGN_KEY, AttributeScope.BLOCK, null);
    public static final Attribute LEFT_ALIGNMENT = new Attribute(ALIGN_KEY, AttributeScope.BLOCK, "left");
    public static final Attribute CENTER_ALIGNMENT = new Attribute(ALIGN_KEY, AttributeScope.BLOCK, "center");
    public static final Attribute RIGHT_ALIGNMENT = new Attribute(ALIGN_KEY, AttributeScope.BLOCK, "right");
    public static final Attribute JUSTIFY_ALIGNMENT = new Attribute(ALIGN_KEY, AttributeScope.BLOCK, "justify");
    public static final Attribute LIST = new Attribute(LIST_KEY, AttributeScope.BLOCK, null);
    public static final Attribute UL = new Attribute(LIST_KEY, AttributeScope.BLOCK, "bullet");
    public static final Attribute OL = new Attribute(LIST_KEY, AttributeScope.BLOCK, "ordered");
    public static final Attribute CHECKED = new Attribute(LIST_KEY, AttributeScope.BLOCK, "checked");
    public static final Attribute UNCHECKED = new Attribute(LIST_KEY, AttributeScope.BLOCK, "unchecked");
    public static final Attribute CODE_BLOCK = new Attribute(CODE_BLOCK_KEY, AttributeScope.BLOCK, true);
    public static final Attribute BLOCKQUOTE = new Attribute(BLOCKQUOTE_KEY, AttributeScope.BLOCK, true);
    public static final Attribute INDENT = new Attribute(INDENT_KEY, AttributeScope.BLOCK, null);
    public static final Attribute DIRECTION = new Attribute(DIRECTION_KEY, AttributeScope.BLOCK, null);
    public static final Attribute RTL = new Attribute(DIRECTION_KEY, AttributeScope.BLOCK, "rtl");

    public static final Attribute WIDTH = new Attribute(WIDTH_KEY, AttributeScope.EMBED, null);
    public static final Attribute HEIGHT = new Attribute(HEIGHT_KEY, AttributeScope.EMBED, null);
    public static final Attribute STYLE = new Attribute(STYLE_KEY, AttributeScope.EMBED, null);

    private final String key;
    private final AttributeScope scope;
    private final Object value;

    public Attribute(@NotNull String key, @NotNull AttributeScope scope, @Nullable Object value) {
        this.key = Objects.requireNonNull(key, "key");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.value = value;
    }

    public static Attribute link(@Nullable String url) {
        return LINK.withValue(url);
    }

    public static Attribute header(int level) {
        return HEADER.withValue(level);
    }

    public static Attribute indent(int level) {
        return INDENT.withValue(level == 0 ? null : level);
    }

    public static Attribute color(@Nullable String color) {
        return COLOR.withValue(color);
    }

    public static Attribute background(@Nullable String color) {
        return BACKGROUND.withValue(color);
    }

    public static Attribute style(@Nullable String css) {
        return STYLE.withValue(css);
    }

    public @NotNull String getKey() {
        return key;
    }

    public @NotNull AttributeScope getScope() {
        return scope;
    }

    public @Nullable Object getValue() {
        return value;
    }

    /**
     * True when this attribute removes its key instead of setting it.
     */
    public boolean isUnset() {
        return value == null;
    }

    public Attribute withValue(@Nullable Object newValue) {
        return new Attribute(key, scope, newValue);
    }

    public Attribute unset() {
        return withValue(null);
    }

    /**
     * @return a mutable single-entry map {@code {key: value}}; a {@code null} value is kept.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, value);
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Attribute that)) return false;
        return key.equals(that.key) && scope == that.scope && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, scope, value);
    }

    @Override
    public String toString() {
        return "Attribute{" + key + ": " + value + ", " + scope + '}';
    }
}
