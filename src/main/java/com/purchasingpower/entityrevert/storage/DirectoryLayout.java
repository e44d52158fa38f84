package com.purchasingpower.entityrevert.storage;

import com.purchasingpower.entityrevert.exception.StorageException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * One file per entity: {@code <directory>/<shard>/<id>.ini}, where the shard is
 * the first two characters of the id.
 */
public class DirectoryLayout implements StorageLayout {

    static final String EXTENSION = ".ini";

    private final Path directory;

    public DirectoryLayout(String directory) {
        this.directory = Path.of(directory);
    }

    @Override
    public Path fileFor(String entityId, String parentId) {
        return directory.resolve(shard(entityId)).resolve(entityId + EXTENSION);
    }

    @Override
    public List<Path> allFiles(Path storageRoot) {
        Path absolute = storageRoot.resolve(directory);
        if (!Files.isDirectory(absolute)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(absolute, 2)) {
            return files.filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().endsWith(EXTENSION))
                    .map(storageRoot::relativize)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("Failed to list entity files", absolute, e);
        }
    }

    static String shard(String entityId) {
        return entityId.length() < 2 ? "0" : entityId.substring(0, 2).toLowerCase(Locale.ROOT);
    }
}
