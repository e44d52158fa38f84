package com.purchasingpower.entityrevert.service.validation;

/**
 * Answers whether any stored entity still points to a given entity.
 */
public interface IncomingReferenceFinder {

    /**
     * @param entityName type of the referenced entity
     * @param entityId   id of the referenced entity
     * @return true if at least one entity of any type references it
     */
    boolean existsSomeEntityWithReferenceTo(String entityName, String entityId);
}
