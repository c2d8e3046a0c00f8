package io.github.nicechester.bibleapi.source;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Documents stored under a local directory; ids are '/'-separated relative paths.
 */
@Slf4j
public class FileSystemDocumentSource implements DocumentSource {

    private final Path root;

    public FileSystemDocumentSource(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            throw new BibleSourceException("Bible source directory not found: " + root);
        }
        this.root = root.toAbsolutePath().normalize();
        log.info("Reading Bible documents from directory: {}", this.root);
    }

    @Override
    public List<String> listSourceIds() {
        try (Stream<Path> files = Files.walk(root)) {
            return files
                .filter(Files::isRegularFile)
                .map(path -> root.relativize(path).toString().replace('\\', '/'))
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new BibleSourceException("Failed to list Bible documents in " + root, e);
        }
    }

    @Override
    public Optional<byte[]> read(String sourceId) {
        Path path = root.resolve(sourceId).normalize();
        if (!path.startsWith(root)) {
            log.warn("Rejected document id outside of source directory: {}", sourceId);
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String describe() {
        return root.toString();
    }
}
