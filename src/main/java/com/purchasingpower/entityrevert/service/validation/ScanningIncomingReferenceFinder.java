package com.purchasingpower.entityrevert.service.validation;

import com.purchasingpower.entityrevert.model.schema.EntityInfo;
import com.purchasingpower.entityrevert.model.storage.Entity;
import com.purchasingpower.entityrevert.service.schema.DbSchemaInfo;
import com.purchasingpower.entityrevert.storage.StorageFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Finds incoming references by loading every entity of every type that declares
 * a reference to the target type. There is no reverse index, so this is
 * O(entity types x entities per type).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScanningIncomingReferenceFinder implements IncomingReferenceFinder {

    private final DbSchemaInfo dbSchemaInfo;
    private final StorageFactory storageFactory;

    @Override
    public boolean existsSomeEntityWithReferenceTo(String entityName, String entityId) {
        for (String otherEntityName : dbSchemaInfo.getAllEntityNames()) {
            EntityInfo otherEntityInfo = dbSchemaInfo.getEntityInfo(otherEntityName);
            List<String> referenceFields = referenceFieldsTargeting(otherEntityInfo, entityName);
            if (referenceFields.isEmpty()) {
                continue;
            }

            List<Entity> possiblyReferencingEntities = storageFactory.getStorage(otherEntityName).loadAll();
            for (Entity candidate : possiblyReferencingEntities) {
                for (String field : referenceFields) {
                    if (candidate.getReferences(field).contains(entityId)) {
                        log.debug("{} {} still references {} {} via {}",
                                otherEntityName, candidate.getVpId(), entityName, entityId, field);
                        return true;
                    }
                }
            }
        }
        return false;
    }

    /**
     * Record fields of {@code info} that can hold an id of {@code targetEntityName}:
     * {@code vp_<reference>} for one-to-many and {@code vp_<target>} for many-to-many.
     */
    private static List<String> referenceFieldsTargeting(EntityInfo info, String targetEntityName) {
        List<String> fields = new ArrayList<>();
        for (Map.Entry<String, String> reference : info.getReferences().entrySet()) {
            if (reference.getValue().equals(targetEntityName)) {
                fields.add(EntityInfo.referenceField(reference.getKey()));
            }
        }
        if (info.getMnReferences().containsValue(targetEntityName)) {
            fields.add(EntityInfo.mnReferenceField(targetEntityName));
        }
        return fields;
    }
}
