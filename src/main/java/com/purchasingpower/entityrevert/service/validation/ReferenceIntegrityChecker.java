package com.purchasingpower.entityrevert.service.validation;

import com.purchasingpower.entityrevert.model.schema.EntityInfo;
import com.purchasingpower.entityrevert.model.storage.Entity;
import com.purchasingpower.entityrevert.service.schema.DbSchemaInfo;
import com.purchasingpower.entityrevert.storage.EntityStorage;
import com.purchasingpower.entityrevert.storage.StorageFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Decides whether the current state of one changed entity keeps the entity graph consistent.
 *
 * <p>Reads the store as it is right now, which during an undo is the speculatively
 * reverted work tree. Never writes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferenceIntegrityChecker {

    private final DbSchemaInfo dbSchemaInfo;
    private final StorageFactory storageFactory;
    private final IncomingReferenceFinder incomingReferenceFinder;

    /**
     * Returns true if there is no reference constraint violation for the given entity.
     *
     * <ul>
     *   <li>Entity gone: nothing anywhere may still reference its id.</li>
     *   <li>Entity present: every set one-to-many reference and every id of every set
     *       many-to-many reference must resolve under the same parent scope.</li>
     * </ul>
     * Unset reference fields are valid. Stops at the first violation.
     */
    public boolean checkEntityReferences(String entityName, String entityId, String parentId) {
        EntityInfo entityInfo = dbSchemaInfo.getEntityInfo(entityName);
        EntityStorage storage = storageFactory.getStorage(entityName);

        if (!storage.exists(entityId, parentId)) {
            boolean referenced = incomingReferenceFinder.existsSomeEntityWithReferenceTo(entityName, entityId);
            if (referenced) {
                log.info("Removed {} {} is still referenced", entityName, entityId);
            }
            return !referenced;
        }

        Entity entity = storage.loadEntity(entityId, parentId);

        for (Map.Entry<String, String> reference : entityInfo.getReferences().entrySet()) {
            Optional<String> referencedId = entity.getReference(EntityInfo.referenceField(reference.getKey()));
            if (referencedId.isEmpty()) {
                continue;
            }

            String referencedEntityName = reference.getValue();
            if (!storageFactory.getStorage(referencedEntityName).exists(referencedId.get(), parentId)) {
                log.info("{} {} references missing {} {} via {}",
                        entityName, entityId, referencedEntityName, referencedId.get(), reference.getKey());
                return false;
            }
        }

        for (String referencedEntityName : entityInfo.getMnReferences().values()) {
            String field = EntityInfo.mnReferenceField(referencedEntityName);
            if (!entity.has(field)) {
                continue;
            }

            EntityStorage referencedStorage = storageFactory.getStorage(referencedEntityName);
            for (String referencedId : entity.getReferences(field)) {
                if (!referencedStorage.exists(referencedId, parentId)) {
                    log.info("{} {} lists missing {} {}", entityName, entityId, referencedEntityName, referencedId);
                    return false;
                }
            }
        }

        log.debug("References of {} {} are consistent", entityName, entityId);
        return true;
    }
}
