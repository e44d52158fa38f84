package com.purchasingpower.entityrevert.model.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Reference metadata of one entity type.
 *
 * <p>Reference fields on an entity record are named by convention:
 * a one-to-many reference {@code R} is stored as {@code vp_R}, a many-to-many
 * reference to entity type {@code T} as {@code vp_T}.
 */
@Value
@Builder
public class EntityInfo {

    public static final String REFERENCE_PREFIX = "vp_";

    String entityName;

    /** Mirror table name without the configured prefix. */
    String table;

    /** Primary key column in the mirror table. */
    String idColumn;

    /** One-to-many: reference name to referenced entity type. */
    @Singular
    Map<String, String> references;

    /** Many-to-many: reference name to referenced entity type. */
    @Singular
    Map<String, String> mnReferences;

    StorageDefinition storage;

    public static String referenceField(String referenceName) {
        return REFERENCE_PREFIX + referenceName;
    }

    public static String mnReferenceField(String referencedEntityName) {
        return REFERENCE_PREFIX + referencedEntityName;
    }
}
