package com.purchasingpower.entityrevert.model.changeinfo;

import com.google.common.base.Preconditions;

/**
 * A single entity created, edited or deleted by a commit.
 *
 * @param entityName entity type, e.g. {@code post}
 * @param action     free-form action (create, edit, delete, ...); not interpreted by validation
 * @param entityId   VersionPress id of the entity
 * @param parentId   id of the owning entity for child entities, otherwise {@code null}
 */
public record EntityChangeInfo(
        String entityName,
        String action,
        String entityId,
        String parentId
) implements TrackedChangeInfo {

    public EntityChangeInfo {
        Preconditions.checkArgument(entityName != null && !entityName.isBlank(), "Entity name cannot be blank");
        Preconditions.checkArgument(action != null && !action.isBlank(), "Action cannot be blank");
        Preconditions.checkArgument(entityId != null && !entityId.isBlank(), "Entity id cannot be blank");
        if (parentId != null && parentId.isBlank()) {
            parentId = null;
        }
    }

    public static EntityChangeInfo of(String entityName, String action, String entityId) {
        return new EntityChangeInfo(entityName, action, entityId, null);
    }

    @Override
    public String getActionTag() {
        String tag = entityName + "/" + action + "/" + entityId;
        return parentId == null ? tag : tag + "/" + parentId;
    }

    @Override
    public String getDescription() {
        String verb = switch (action) {
            case "create" -> "Created";
            case "edit" -> "Edited";
            case "delete" -> "Deleted";
            default -> Character.toUpperCase(action.charAt(0)) + action.substring(1);
        };
        return verb + " " + entityName + " " + entityId;
    }
}
