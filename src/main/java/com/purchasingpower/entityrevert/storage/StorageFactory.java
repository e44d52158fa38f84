package com.purchasingpower.entityrevert.storage;

import com.purchasingpower.entityrevert.model.schema.EntityInfo;
import com.purchasingpower.entityrevert.model.schema.StorageDefinition;
import com.purchasingpower.entityrevert.service.schema.DbSchemaInfo;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds one {@link EntityStorage} per entity type declared in the schema.
 */
@Slf4j
public class StorageFactory {

    private final Map<String, EntityStorage> storages = new LinkedHashMap<>();

    public StorageFactory(Path storageRoot, DbSchemaInfo schemaInfo, IniSerializer serializer) {
        Map<String, StorageLayout> layouts = new LinkedHashMap<>();
        for (String entityName : schemaInfo.getAllEntityNames()) {
            StorageLayout layout = layoutFor(entityName, schemaInfo, layouts);
            storages.put(entityName, new IniEntityStorage(entityName, storageRoot, layout, serializer));
        }
        log.debug("Created storages for {} under {}", storages.keySet(), storageRoot);
    }

    /**
     * @throws IllegalArgumentException for an entity name the schema does not declare
     */
    public EntityStorage getStorage(String entityName) {
        EntityStorage storage = storages.get(entityName);
        if (storage == null) {
            throw new IllegalArgumentException("No storage for entity: " + entityName);
        }
        return storage;
    }

    private static StorageLayout layoutFor(String entityName, DbSchemaInfo schemaInfo, Map<String, StorageLayout> layouts) {
        StorageLayout cached = layouts.get(entityName);
        if (cached != null) {
            return cached;
        }

        EntityInfo info = schemaInfo.getEntityInfo(entityName);
        StorageDefinition definition = info.getStorage();
        StorageLayout layout = switch (definition.getLayoutType()) {
            case DIRECTORY -> new DirectoryLayout(definition.getPath());
            case SINGLE_FILE -> new SingleFileLayout(definition.getPath());
            case PARENT_FILE -> new ParentFileLayout(layoutFor(definition.getParent(), schemaInfo, layouts));
        };
        layouts.put(entityName, layout);
        return layout;
    }
}
