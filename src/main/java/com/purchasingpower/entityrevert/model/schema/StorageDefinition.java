package com.purchasingpower.entityrevert.model.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where an entity type lives inside the file store.
 *
 * <ul>
 *   <li>{@code directory}: one file per entity, {@code path/<shard>/<id>.ini}</li>
 *   <li>{@code single-file}: all entities of the type in {@code path}</li>
 *   <li>{@code parent-file}: inside the file of the {@code parent} entity</li>
 * </ul>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StorageDefinition {

    public enum Layout {
        DIRECTORY,
        SINGLE_FILE,
        PARENT_FILE;

        public static Layout fromName(String name) {
            return Layout.valueOf(name.trim().toUpperCase().replace('-', '_'));
        }
    }

    private String layout;
    private String path;
    private String parent;

    public Layout getLayoutType() {
        return Layout.fromName(layout);
    }
}
