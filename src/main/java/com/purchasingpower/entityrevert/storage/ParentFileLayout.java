package com.purchasingpower.entityrevert.storage;

import java.nio.file.Path;
import java.util.List;

/**
 * Child entities stored in the file of their parent, e.g. postmeta inside the post's file.
 */
public class ParentFileLayout implements StorageLayout {

    private final StorageLayout parentLayout;

    public ParentFileLayout(StorageLayout parentLayout) {
        this.parentLayout = parentLayout;
    }

    @Override
    public Path fileFor(String entityId, String parentId) {
        if (parentId == null) {
            return null;
        }
        return parentLayout.fileFor(parentId, null);
    }

    @Override
    public List<Path> allFiles(Path storageRoot) {
        return parentLayout.allFiles(storageRoot);
    }
}
