package com.purchasingpower.entityrevert.model.storage;

import com.google.common.base.Preconditions;
import com.purchasingpower.entityrevert.model.schema.EntityInfo;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One entity as stored in the file store: its id plus an ordered field map.
 *
 * <p>Values are either {@code String} or {@code List<String>}. Reference fields
 * carry the {@value EntityInfo#REFERENCE_PREFIX} prefix.
 */
@ToString
@EqualsAndHashCode
public class Entity {

    @Getter
    private final String vpId;

    private final Map<String, Object> fields = new LinkedHashMap<>();

    public Entity(String vpId) {
        Preconditions.checkArgument(vpId != null && !vpId.isBlank(), "Entity id cannot be blank");
        this.vpId = vpId;
    }

    public Entity(String vpId, Map<String, ?> fields) {
        this(vpId);
        fields.forEach((key, value) -> {
            if (value instanceof List<?> list) {
                setList(key, list.stream().map(String::valueOf).toList());
            } else if (value != null) {
                set(key, String.valueOf(value));
            }
        });
    }

    public Entity set(String field, String value) {
        Preconditions.checkNotNull(value, "Value of %s cannot be null", field);
        fields.put(field, value);
        return this;
    }

    public Entity setList(String field, List<String> values) {
        Preconditions.checkNotNull(values, "Values of %s cannot be null", field);
        fields.put(field, List.copyOf(values));
        return this;
    }

    public Entity remove(String field) {
        fields.remove(field);
        return this;
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public Optional<String> getString(String field) {
        Object value = fields.get(field);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    /**
     * Id held by a one-to-many reference field, if set.
     */
    public Optional<String> getReference(String field) {
        return getString(field).filter(id -> !id.isEmpty());
    }

    /**
     * Ids held by a many-to-many reference field; empty when not set.
     * A scalar value is read as a single-element list.
     */
    public List<String> getReferences(String field) {
        Object value = fields.get(field);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        if (value instanceof String s && !s.isEmpty()) {
            return List.of(s);
        }
        return List.of();
    }

    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Fields that map to plain mirror columns: non-reference, single-valued.
     */
    public Map<String, String> getScalarFields() {
        Map<String, String> scalars = new LinkedHashMap<>();
        fields.forEach((key, value) -> {
            if (!key.startsWith(EntityInfo.REFERENCE_PREFIX) && value instanceof String s) {
                scalars.put(key, s);
            }
        });
        return scalars;
    }
}
