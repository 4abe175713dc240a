package org.structdiff.report;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Value source backed by a single document file or a directory of documents.
 *
 * <p>In a directory, the comparison id is the file name without its extension; a single file
 * serves every comparison.
 */
public final class FileValueSource implements ValueSource {
    private static final List<String> EXTENSIONS = List.of(".json", ".yaml", ".yml");

    private final Path root;

    public FileValueSource(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    @Override
    public String name() {
        Path fileName = root.getFileName();
        return fileName == null ? root.toString() : fileName.toString();
    }

    @Override
    public Object load(Comparison comparison) throws IOException {
        Objects.requireNonNull(comparison, "comparison");
        if (Files.isRegularFile(root)) {
            return DocumentLoader.load(root);
        }
        for (String extension : EXTENSIONS) {
            Path candidate = root.resolve(comparison.id() + extension);
            if (Files.isRegularFile(candidate)) {
                return DocumentLoader.load(candidate);
            }
        }
        throw new NoSuchFileException(root.resolve(comparison.id()) + "{" + String.join(",", EXTENSIONS) + "}");
    }

    /**
     * Ids of the documents this source holds, sorted.
     */
    public TreeSet<String> comparisonIds() throws IOException {
        TreeSet<String> ids = new TreeSet<>();
        if (Files.isRegularFile(root)) {
            ids.add(baseName(root));
            return ids;
        }
        if (!Files.isDirectory(root)) {
            throw new NoSuchFileException(root.toString());
        }
        try (Stream<Path> files = Files.list(root)) {
            files.filter(Files::isRegularFile)
                .filter(DocumentLoader::isSupported)
                .forEach(file -> ids.add(baseName(file)));
        }
        return ids;
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }
}
