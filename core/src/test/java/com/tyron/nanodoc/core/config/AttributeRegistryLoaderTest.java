package com.tyron.nanodoc.core.config;

import com.tyron.nanodoc.api.attributes.Attribute;
import com.tyron.nanodoc.api.attributes.AttributeRegistry;
import com.tyron.nanodoc.api.attributes.AttributeScope;
import com.tyron.nanodoc.api.delta.Delta;
import com.tyron.nanodoc.core.document.InMemoryRichDocument;
import com.tyron.nanodoc.core.rules.FormatRules;
import com.tyron.nanodoc.testFramework.TestLogging;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Level;

import static com.google.common.truth.Truth.assertThat;

public class AttributeRegistryLoaderTest {

    @TempDir
    public Path temporaryFolder;

    private AttributeRegistryLoader loader;

    @BeforeEach
    public void setUp() {
        TestLogging.configureOnce();
        loader = new AttributeRegistryLoader();
    }

    @Test
    public void extendsDefaultCatalog() {
        AttributeRegistry registry = loader.load(yaml("""
                attributes:
                  - key: mention
                    scope: inline
                  - key: callout
                    scope: block
                    group: block-structure
                exclusiveGroups:
                  alignment-hints: [align, direction]
                """));

        Assertions.assertEquals(AttributeScope.INLINE, registry.scope("mention"));
        Assertions.assertEquals(AttributeScope.BLOCK, registry.scope("callout"));
        assertThat(registry.exclusiveGroup("header")).contains("callout");
        assertThat(registry.exclusiveGroup("align")).containsExactly("align", "direction");
        Assertions.assertEquals(AttributeScope.INLINE, registry.scope("bold"));
    }

    @Test
    public void configuredGroupsDriveTheLineRule() {
        AttributeRegistry registry = loader.load(yaml("""
                attributes:
                  - key: callout
                    scope: block
                exclusiveGroups:
                  block-structure: [callout]
                """));
        InMemoryRichDocument document = new InMemoryRichDocument(
                new Delta().insert("Note").insert("\n", Map.of("callout", "warning")),
                FormatRules.getDefault().withRegistry(registry));

        document.format(0, 4, Attribute.OL);

        Assertions.assertEquals(new Delta().insert("Note").insert("\n", Map.of("list", "ordered")), document.toDelta());
    }

    @Test
    public void emptyFileYieldsDefaults() {
        Assertions.assertSame(AttributeRegistry.defaults(), loader.load(yaml("")));
    }

    @Test
    public void rejectsInvalidEntries() {
        Assertions.assertThrows(AttributeConfigException.class, () -> loader.load(yaml("- just a list")));
        Assertions.assertThrows(AttributeConfigException.class, () -> loader.load(yaml("attributes: nope")));
        Assertions.assertThrows(AttributeConfigException.class, () -> loader.load(yaml("""
                attributes:
                  - scope: inline
                """)));
        Assertions.assertThrows(AttributeConfigException.class, () -> loader.load(yaml("""
                attributes:
                  - key: mention
                    scope: paragraph
                """)));
        Assertions.assertThrows(AttributeConfigException.class, () -> loader.load(yaml("""
                exclusiveGroups:
                  marks: [bold, italic]
                """)));
        Assertions.assertThrows(AttributeConfigException.class, () -> loader.load(yaml("""
                exclusiveGroups:
                  other: [header]
                """)));
        Assertions.assertThrows(AttributeConfigException.class, () -> loader.load(yaml("attributes: [")));
    }

    @Test
    public void missingFileYieldsDefaults() {
        Path config = temporaryFolder.resolve(AttributeRegistryLoader.DEFAULT_FILE_NAME);

        Assertions.assertSame(AttributeRegistry.defaults(), loader.loadOrDefaults(config));
    }

    @Test
    public void loadsFromFile() throws Exception {
        Path config = temporaryFolder.resolve(AttributeRegistryLoader.DEFAULT_FILE_NAME);
        Files.writeString(config, """
                attributes:
                  - key: highlight
                    scope: inline
                """, StandardCharsets.UTF_8);

        Assertions.assertTrue(loader.loadOrDefaults(config).isRegistered("highlight"));
    }

    @Test
    public void invalidFileIsReportedAndIgnored() throws Exception {
        Path config = temporaryFolder.resolve(AttributeRegistryLoader.DEFAULT_FILE_NAME);
        Files.writeString(config, "attributes: 42\n", StandardCharsets.UTF_8);

        try (TestLogging.Capture capture = TestLogging.capture(AttributeRegistryLoader.class.getName(), Level.WARNING)) {
            Assertions.assertSame(AttributeRegistry.defaults(), loader.loadOrDefaults(config));

            assertThat(capture.records()).hasSize(1);
            Assertions.assertInstanceOf(AttributeConfigException.class, capture.records().get(0).getThrown());
        }
    }

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
