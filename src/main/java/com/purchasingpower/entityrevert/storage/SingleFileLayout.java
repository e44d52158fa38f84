package com.purchasingpower.entityrevert.storage;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Every entity of the type in one file, e.g. {@code users.ini}.
 */
public class SingleFileLayout implements StorageLayout {

    private final Path file;

    public SingleFileLayout(String file) {
        this.file = Path.of(file);
    }

    @Override
    public Path fileFor(String entityId, String parentId) {
        return file;
    }

    @Override
    public List<Path> allFiles(Path storageRoot) {
        return Files.isRegularFile(storageRoot.resolve(file)) ? List.of(file) : List.of();
    }
}
