package com.tyron.nanodoc.core.config;

import com.tyron.nanodoc.api.attributes.AttributeRegistry;
import com.tyron.nanodoc.api.attributes.AttributeScope;
import org.jetbrains.annotations.NotNull;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Extends the default attribute catalog from a YAML file (nanodoc.yaml).
 *
 * <pre>
 * attributes:
 *   - key: mention
 *     scope: inline
 *   - key: callout
 *     scope: block
 *     group: block-structure
 * exclusiveGroups:
 *   block-structure: [header, list, code-block, blockquote, callout]
 * </pre>
 */
public final class AttributeRegistryLoader {

    public static final String DEFAULT_FILE_NAME = "nanodoc.yaml";

    private static final Logger LOG = Logger.getLogger(AttributeRegistryLoader.class.getName());

    private final AttributeRegistry base;

    public AttributeRegistryLoader() {
        this(AttributeRegistry.defaults());
    }

    public AttributeRegistryLoader(@NotNull AttributeRegistry base) {
        this.base = Objects.requireNonNull(base, "base");
    }

    /**
     * Reads the configuration from {@code path}. A missing file yields the base catalog; an
     * unreadable or invalid one is reported and also yields the base catalog.
     */
    public AttributeRegistry loadOrDefaults(@NotNull Path path) {
        if (!Files.isRegularFile(path)) {
            return base;
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException | AttributeConfigException e) {
            LOG.log(Level.WARNING, "Ignoring attribute configuration " + path, e);
            return base;
        }
    }

    /**
     * @throws AttributeConfigException if the YAML cannot be parsed or describes an invalid catalog
     */
    public AttributeRegistry load(@NotNull InputStream in) {
        Object doc;
        try {
            doc = new Yaml().load(in);
        } catch (YAMLException e) {
            throw new AttributeConfigException("Malformed attribute configuration", e);
        }
        if (doc == null) {
            return base;
        }
        if (!(doc instanceof Map<?, ?> map)) {
            throw new AttributeConfigException("Attribute configuration must be a mapping, got " + doc);
        }

        AttributeRegistry.Builder builder = base.toBuilder();
        try {
            // attributes: [{key, scope, group?}, ...]
            Object attributes = map.get("attributes");
            if (attributes != null) {
                if (!(attributes instanceof List<?> list)) {
                    throw new AttributeConfigException("'attributes' must be a list");
                }
                for (Object item : list) {
                    readAttribute(builder, item);
                }
            }

            // exclusiveGroups: {name: [key, ...]}
            Object groups = map.get("exclusiveGroups");
            if (groups != null) {
                if (!(groups instanceof Map<?, ?> groupsMap)) {
                    throw new AttributeConfigException("'exclusiveGroups' must be a mapping");
                }
                for (Map.Entry<?, ?> e : groupsMap.entrySet()) {
                    if (!(e.getValue() instanceof List<?> keys)) {
                        throw new AttributeConfigException("Exclusive group " + e.getKey() + " must list its keys");
                    }
                    builder.exclusiveGroup(String.valueOf(e.getKey()),
                            keys.stream().map(String::valueOf).toArray(String[]::new));
                }
            }
        } catch (IllegalArgumentException e) {
            throw new AttributeConfigException(e.getMessage(), e);
        }

        AttributeRegistry registry = builder.build();
        LOG.fine(() -> "Loaded attribute catalog with " + registry.keys().size() + " keys");
        return registry;
    }

    private static void readAttribute(AttributeRegistry.Builder builder, Object item) {
        if (!(item instanceof Map<?, ?> entry)) {
            throw new AttributeConfigException("Attribute entry must be a mapping, got " + item);
        }
        Object key = entry.get("key");
        if (key == null || String.valueOf(key).isBlank()) {
            throw new AttributeConfigException("Attribute entry is missing 'key': " + entry);
        }
        String name = String.valueOf(key);

        Object rawScope = entry.get("scope");
        if (rawScope == null) {
            throw new AttributeConfigException("Attribute " + name + " is missing 'scope'");
        }
        AttributeScope scope;
        try {
            scope = AttributeScope.valueOf(String.valueOf(rawScope).trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new AttributeConfigException("Attribute " + name + " has unknown scope " + rawScope, e);
        }
        builder.register(name, scope);

        Object group = entry.get("group");
        if (group != null) {
            builder.exclusiveGroup(String.valueOf(group), name);
        }
    }
}
