package com.tyron.nanodoc.api.attributes;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable catalog of known attribute keys.
 *
 * Every key has an {@link AttributeScope}. Block keys may additionally belong to one
 * named exclusive group: at most one key of a group may be set on a given line, so
 * applying one member clears the others.
 */
public final class AttributeRegistry {

    public static final String BLOCK_STRUCTURE_GROUP = "block-structure";

    private static final AttributeRegistry DEFAULTS = createDefaults();

    private final ImmutableMap<String, AttributeScope> scopes;
    private final ImmutableMap<String, ImmutableSet<String>> groups;
    private final ImmutableMap<String, String> groupByKey;

    private AttributeRegistry(Builder builder) {
        this.scopes = ImmutableMap.copyOf(builder.scopes);

        ImmutableMap.Builder<String, ImmutableSet<String>> groupsBuilder = ImmutableMap.builder();
        ImmutableMap.Builder<String, String> byKey = ImmutableMap.builder();
        for (Map.Entry<String, Set<String>> e : builder.groups.entrySet()) {
            groupsBuilder.put(e.getKey(), ImmutableSet.copyOf(e.getValue()));
            for (String key : e.getValue()) {
                byKey.put(key, e.getKey());
            }
        }
        this.groups = groupsBuilder.build();
        this.groupByKey = byKey.buildOrThrow();
    }

    /**
     * The built-in catalog.
     */
    public static AttributeRegistry defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.scopes.putAll(scopes);
        for (Map.Entry<String, ImmutableSet<String>> e : groups.entrySet()) {
            builder.groups.put(e.getKey(), new LinkedHashSet<>(e.getValue()));
        }
        return builder;
    }

    /**
     * @return the scope of the key, or {@code null} if the key is not registered
     */
    public @Nullable AttributeScope scope(@NotNull String key) {
        return scopes.get(key);
    }

    /**
     * @return every key of the exclusive group the key belongs to (including the key itself),
     * or an empty set if it belongs to none
     */
    public @NotNull Set<String> exclusiveGroup(@NotNull String key) {
        String group = groupByKey.get(key);
        return group == null ? ImmutableSet.of() : groups.get(group);
    }

    public boolean isExclusive(@NotNull String key) {
        return groupByKey.containsKey(key);
    }

    public boolean isRegistered(@NotNull String key) {
        return scopes.containsKey(key);
    }

    public Set<String> keys() {
        return scopes.keySet();
    }

    public Set<String> groupNames() {
        return groups.keySet();
    }

    /**
     * Creates an attribute for a registered key.
     *
     * @throws IllegalArgumentException if the key is not registered
     */
    public Attribute attribute(@NotNull String key, @Nullable Object value) {
        AttributeScope scope = scopes.get(key);
        Preconditions.checkArgument(scope != null, "Unknown attribute key: %s", key);
        return new Attribute(key, scope, value);
    }

    private static AttributeRegistry createDefaults() {
        return builder()
                .register(Attribute.BOLD)
                .register(Attribute.ITALIC)
                .register(Attribute.SMALL)
                .register(Attribute.UNDERLINE)
                .register(Attribute.STRIKE_THROUGH)
                .register(Attribute.INLINE_CODE)
                .register(Attribute.FONT)
                .register(Attribute.SIZE)
                .register(Attribute.LINK)
                .register(Attribute.COLOR)
                .register(Attribute.BACKGROUND)
                .register(Attribute.PLACEHOLDER)
                .register(Attribute.HEADER)
                .register(Attribute.ALIGN)
                .register(Attribute.LIST)
                .register(Attribute.CODE_BLOCK)
                .register(Attribute.BLOCKQUOTE)
                .register(Attribute.INDENT)
                .register(Attribute.DIRECTION)
                .register(Attribute.WIDTH)
                .register(Attribute.HEIGHT)
                .register(Attribute.STYLE)
                .exclusiveGroup(BLOCK_STRUCTURE_GROUP,
                        Attribute.HEADER_KEY,
                        Attribute.LIST_KEY,
                        Attribute.CODE_BLOCK_KEY,
                        Attribute.BLOCKQUOTE_KEY)
                .build();
    }

    public static final class Builder {

        private final Map<String, AttributeScope> scopes = new LinkedHashMap<>();
        private final Map<String, Set<String>> groups = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(@NotNull Attribute attribute) {
            return register(attribute.getKey(), attribute.getScope());
        }

        public Builder register(@NotNull String key, @NotNull AttributeScope scope) {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(scope, "scope");
            Preconditions.checkArgument(!key.isBlank(), "Attribute key must not be blank");

            AttributeScope previous = scopes.get(key);
            Preconditions.checkArgument(previous == null || previous == scope,
                    "Attribute %s is already registered with scope %s", key, previous);
            scopes.put(key, scope);
            return this;
        }

        /**
         * Adds keys to a named exclusive group, creating the group if needed. Keys must be
         * registered with {@link AttributeScope#BLOCK} scope and may belong to one group only.
         */
        public Builder exclusiveGroup(@NotNull String name, String... keys) {
            Objects.requireNonNull(name, "name");
            Set<String> group = groups.computeIfAbsent(name, n -> new LinkedHashSet<>());
            for (String key : keys) {
                Preconditions.checkArgument(scopes.get(key) == AttributeScope.BLOCK,
                        "Only registered block attributes can be exclusive: %s", key);
                for (Map.Entry<String, Set<String>> e : groups.entrySet()) {
                    Preconditions.checkArgument(e.getKey().equals(name) || !e.getValue().contains(key),
                            "Attribute %s already belongs to exclusive group %s", key, e.getKey());
                }
                group.add(key);
            }
            return this;
        }

        public AttributeRegistry build() {
            return new AttributeRegistry(this);
        }
    }
}
