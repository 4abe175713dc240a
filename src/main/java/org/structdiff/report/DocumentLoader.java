package org.structdiff.report;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import org.bson.Document;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads JSON or YAML documents into plain maps, lists and scalars for comparison.
 */
public final class DocumentLoader {
    private static final String ROOT_KEY = "root";

    private DocumentLoader() {}

    public static boolean isSupported(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".json") || name.endsWith(".yaml") || name.endsWith(".yml");
    }

    public static Object load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        Path normalized = path.toAbsolutePath().normalize();
        if (!Files.isRegularFile(normalized)) {
            throw new IllegalArgumentException("document path must be a file: " + normalized);
        }
        String content = Files.readString(normalized, StandardCharsets.UTF_8);
        return parse(content, normalized.getFileName().toString());
    }

    static Object parse(String content, String sourceName) {
        Objects.requireNonNull(content, "content");
        String normalizedName = Objects.requireNonNull(sourceName, "sourceName").trim().toLowerCase(Locale.ROOT);
        if (normalizedName.endsWith(".yaml") || normalizedName.endsWith(".yml")) {
            return new Yaml().load(content);
        }
        if (content.isBlank()) {
            throw new IllegalArgumentException("document is empty: " + sourceName);
        }
        // wrapping lets arrays and scalars appear at the top level
        return Document.parse("{\"" + ROOT_KEY + "\": " + content + "}").get(ROOT_KEY);
    }
}
