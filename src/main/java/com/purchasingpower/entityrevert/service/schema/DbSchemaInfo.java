package com.purchasingpower.entityrevert.service.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.purchasingpower.entityrevert.exception.SchemaException;
import com.purchasingpower.entityrevert.model.schema.EntityInfo;
import com.purchasingpower.entityrevert.model.schema.StorageDefinition;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of entity types and their references, read once from {@code schema.yml}.
 *
 * <pre>
 * post:
 *   table: posts
 *   id: ID
 *   storage: { layout: directory, path: posts }
 *   references:
 *     post_author: user
 *   mn-references:
 *     term_relationships.term_taxonomy_id: term_taxonomy
 * </pre>
 *
 * Entity names keep their declaration order, which is also the order in which
 * the mirror is synchronized.
 */
@Slf4j
public class DbSchemaInfo {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final Map<String, EntityInfo> entities;

    public DbSchemaInfo(Map<String, EntityInfo> entities) {
        this.entities = new LinkedHashMap<>(entities);
    }

    public static DbSchemaInfo load(InputStream yaml) {
        try {
            LinkedHashMap<String, EntityDefinition> definitions =
                    YAML_MAPPER.readValue(yaml, new TypeReference<LinkedHashMap<String, EntityDefinition>>() {});
            if (definitions == null || definitions.isEmpty()) {
                throw new SchemaException("Schema defines no entities");
            }

            Map<String, EntityInfo> entities = new LinkedHashMap<>();
            definitions.forEach((name, definition) -> entities.put(name, definition.toEntityInfo(name)));
            validate(entities);

            log.info("Loaded schema with {} entity types: {}", entities.size(), entities.keySet());
            return new DbSchemaInfo(entities);
        } catch (IOException e) {
            throw new SchemaException("Failed to read entity schema", e);
        }
    }

    public EntityInfo getEntityInfo(String entityName) {
        EntityInfo info = entities.get(entityName);
        if (info == null) {
            throw new SchemaException("Unknown entity: " + entityName);
        }
        return info;
    }

    public List<String> getAllEntityNames() {
        return List.copyOf(entities.keySet());
    }

    public boolean isEntity(String entityName) {
        return entities.containsKey(entityName);
    }

    private static void validate(Map<String, EntityInfo> entities) {
        entities.values().forEach(info -> {
            info.getReferences().forEach((reference, target) -> requireKnown(entities, info, reference, target));
            info.getMnReferences().forEach((reference, target) -> requireKnown(entities, info, reference, target));

            StorageDefinition storage = info.getStorage();
            if (storage == null || storage.getLayout() == null) {
                throw new SchemaException("Entity " + info.getEntityName() + " has no storage layout");
            }
            if (storage.getLayoutType() == StorageDefinition.Layout.PARENT_FILE
                    && !entities.containsKey(storage.getParent())) {
                throw new SchemaException("Entity " + info.getEntityName() + " is stored in unknown parent "
                        + storage.getParent());
            }
        });
    }

    private static void requireKnown(Map<String, EntityInfo> entities, EntityInfo info, String reference, String target) {
        if (!entities.containsKey(target)) {
            throw new SchemaException(String.format(
                    "Reference '%s' of %s points to unknown entity '%s'",
                    reference, info.getEntityName(), target));
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class EntityDefinition {

        private String table;

        @JsonProperty("id")
        private String idColumn;

        private Map<String, String> references = new LinkedHashMap<>();

        @JsonProperty("mn-references")
        private Map<String, String> mnReferences = new LinkedHashMap<>();

        private StorageDefinition storage;

        EntityInfo toEntityInfo(String name) {
            return EntityInfo.builder()
                    .entityName(name)
                    .table(table != null ? table : name)
                    .idColumn(idColumn != null ? idColumn : "id")
                    .references(references != null ? references : Map.of())
                    .mnReferences(mnReferences != null ? mnReferences : Map.of())
                    .storage(storage)
                    .build();
        }
    }
}
