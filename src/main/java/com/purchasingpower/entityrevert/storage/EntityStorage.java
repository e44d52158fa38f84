package com.purchasingpower.entityrevert.storage;

import com.purchasingpower.entityrevert.model.storage.Entity;

import java.util.List;

/**
 * Access to the stored entities of one type.
 */
public interface EntityStorage {

    String getEntityName();

    boolean exists(String entityId, String parentId);

    /**
     * @throws com.purchasingpower.entityrevert.exception.StorageException if the entity does not exist
     */
    Entity loadEntity(String entityId, String parentId);

    List<Entity> loadAll();

    void save(Entity entity, String parentId);

    /**
     * @return whether anything was removed
     */
    boolean delete(String entityId, String parentId);
}
