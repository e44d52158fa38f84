package com.purchasingpower.entityrevert.storage;

import java.nio.file.Path;
import java.util.List;

/**
 * Maps entity identities to INI files under the storage root.
 */
public interface StorageLayout {

    /**
     * File that holds the given entity, relative to the storage root, or
     * {@code null} when the layout cannot tell without the missing parent id.
     */
    Path fileFor(String entityId, String parentId);

    /**
     * Every existing file that may hold entities of this layout, relative to the storage root.
     */
    List<Path> allFiles(Path storageRoot);
}
