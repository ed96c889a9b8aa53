package com.tyron.nanodoc.core.rules;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.tyron.nanodoc.api.attributes.Attribute;
import com.tyron.nanodoc.api.attributes.AttributeRegistry;
import com.tyron.nanodoc.api.attributes.AttributeScope;
import com.tyron.nanodoc.api.delta.Delta;
import com.tyron.nanodoc.api.rules.FormatRequest;
import com.tyron.nanodoc.api.rules.FormatRule;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves format requests into document changes.
 *
 * Rules are evaluated in a fixed order and the first rule that returns a change wins:
 * custom rules first, then line, link-at-caret, inline and embed-style rules. When every
 * rule declines, the attribute is retained over the whole range as is.
 *
 * Instances are immutable and can be shared between documents and threads.
 */
public final class FormatRules {

    private static final Logger LOG = Logger.getLogger(FormatRules.class.getName());

    private static final List<FormatRule> BUILT_IN_RULES = ImmutableList.of(
            new ResolveLineFormatRule(),
            new FormatLinkAtCaretRule(),
            new ResolveInlineFormatRule(),
            new ResolveEmbedStyleFormatRule()
    );

    private static final FormatRules DEFAULT = new FormatRules(AttributeRegistry.defaults(), ImmutableList.of());

    private final AttributeRegistry registry;
    private final ImmutableList<FormatRule> customRules;
    private final ImmutableList<FormatRule> rules;

    public FormatRules(@NotNull AttributeRegistry registry, @NotNull List<? extends FormatRule> customRules) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.customRules = ImmutableList.copyOf(customRules);
        this.rules = ImmutableList.<FormatRule>builder()
                .addAll(this.customRules)
                .addAll(BUILT_IN_RULES)
                .build();
    }

    public static FormatRules getDefault() {
        return DEFAULT;
    }

    public FormatRules withRegistry(@NotNull AttributeRegistry registry) {
        return new FormatRules(registry, customRules);
    }

    /**
     * @return a copy whose custom rules run before the built-in ones, in the given order
     */
    public FormatRules withCustomRules(@NotNull List<? extends FormatRule> rules) {
        return new FormatRules(registry, rules);
    }

    public AttributeRegistry getRegistry() {
        return registry;
    }

    public List<FormatRule> getRules() {
        return rules;
    }

    public Delta apply(@NotNull Delta document, int index, int length, @NotNull Attribute attribute) {
        return apply(document, index, length, attribute, null);
    }

    /**
     * Computes the change that applies {@code attribute} to [index, index + length) of {@code document}.
     * The document is only read.
     *
     * The attribute's scope is taken from the registry, not from the attribute itself.
     *
     * @throws IndexOutOfBoundsException if the range is not within the document
     * @throws IllegalArgumentException  if the attribute key is not registered
     */
    public Delta apply(@NotNull Delta document,
                       int index,
                       int length,
                       @NotNull Attribute attribute,
                       @Nullable Object data) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(attribute, "attribute");
        Preconditions.checkArgument(length >= 0, "length must not be negative: %s", length);
        Preconditions.checkPositionIndexes(index, index + length, document.length());
        Attribute resolved = resolve(attribute);

        FormatRequest request = new FormatRequest(document, index, length, resolved, data, registry);
        for (FormatRule rule : rules) {
            Delta result = rule.apply(request);
            if (result != null) {
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine(rule.getClass().getSimpleName() + " resolved " + resolved
                            + " at [" + index + ", " + (index + length) + ")");
                }
                return result;
            }
            if (LOG.isLoggable(Level.FINER)) {
                LOG.finer(rule.getClass().getSimpleName() + " declined " + resolved.getKey());
            }
        }

        LOG.fine(() -> "No rule resolved " + resolved + ", retaining attribute over the range");
        return new Delta()
                .retain(index)
                .retain(length, resolved.toMap());
    }

    private Attribute resolve(Attribute attribute) {
        AttributeScope scope = registry.scope(attribute.getKey());
        Preconditions.checkArgument(scope != null, "Unknown attribute key: %s", attribute.getKey());
        if (scope == attribute.getScope()) {
            return attribute;
        }
        LOG.fine(() -> "Attribute " + attribute.getKey() + " is registered with scope " + scope
                + ", ignoring requested scope " + attribute.getScope());
        return registry.attribute(attribute.getKey(), attribute.getValue());
    }
}
