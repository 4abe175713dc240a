package org.structdiff.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.structdiff.StructDiff;

class DocumentLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void jsonAndYamlDocumentsLoadToEquivalentValues() throws IOException {
        Path json = write("user.json", "{\"name\": \"ann\", \"age\": 41, \"tags\": [\"a\", \"b\"], \"score\": 1.5}");
        Path yaml = write("user.yaml", "name: ann\nage: 41\ntags:\n  - a\n  - b\nscore: 1.5\n");

        Object fromJson = DocumentLoader.load(json);
        Object fromYaml = DocumentLoader.load(yaml);

        assertTrue(fromJson instanceof Map<?, ?>);
        assertEquals(List.of(), StructDiff.diff(fromJson, fromYaml));
    }

    @Test
    void differencesInLoadedDocumentsAreLabelledByKey() throws IOException {
        Object left = DocumentLoader.load(write("a.json", "{\"items\": [{\"qty\": 1}]}"));
        Object right = DocumentLoader.load(write("b.yml", "items:\n  - qty: 2\n"));

        assertEquals(List.of("[\"items\"][0][\"qty\"]: 1 != 2"), StructDiff.diff(left, right));
    }

    @Test
    void topLevelJsonArraysAndScalarsAreAllowed() {
        assertEquals(List.of(1, 2), DocumentLoader.parse("[1, 2]", "list.json"));
        assertEquals("x", DocumentLoader.parse("\"x\"", "scalar.json"));
    }

    @Test
    void rejectsBlankJsonAndMissingFiles() {
        assertThrows(IllegalArgumentException.class, () -> DocumentLoader.parse("  ", "empty.json"));
        assertThrows(IllegalArgumentException.class, () -> DocumentLoader.load(tempDir.resolve("absent.json")));
    }

    @Test
    void recognisesSupportedExtensions() {
        assertTrue(DocumentLoader.isSupported(Path.of("a.JSON")));
        assertTrue(DocumentLoader.isSupported(Path.of("a.yml")));
        assertFalse(DocumentLoader.isSupported(Path.of("a.txt")));
    }

    @Test
    void fileSourceResolvesDocumentsByComparisonId() throws Exception {
        Path directory = Files.createDirectories(tempDir.resolve("expected"));
        Files.writeString(directory.resolve("one.json"), "{\"v\": 1}", StandardCharsets.UTF_8);
        Files.writeString(directory.resolve("two.yaml"), "v: 2\n", StandardCharsets.UTF_8);
        Files.writeString(directory.resolve("notes.txt"), "ignored", StandardCharsets.UTF_8);
        FileValueSource source = new FileValueSource(directory);

        assertEquals("expected", source.name());
        assertEquals(Set.of("one", "two"), source.comparisonIds());
        assertEquals(List.of(), StructDiff.diff(Map.of("v", 2), source.load(Comparison.of("two"))));
        assertThrows(NoSuchFileException.class, () -> source.load(Comparison.of("three")));
    }

    @Test
    void singleFileSourceServesEveryComparison() throws Exception {
        FileValueSource source = new FileValueSource(write("only.json", "[true]"));

        assertEquals(Set.of("only"), source.comparisonIds());
        assertEquals(List.of(true), source.load(Comparison.of("anything")));
    }

    private Path write(String fileName, String content) throws IOException {
        return Files.writeString(tempDir.resolve(fileName), content, StandardCharsets.UTF_8);
    }
}
