package com.purchasingpower.entityrevert.storage;

import com.google.common.base.Preconditions;
import com.purchasingpower.entityrevert.exception.StorageException;
import com.purchasingpower.entityrevert.model.storage.Entity;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stores entities of one type as {@code [<entityName>:<id>]} sections in INI files.
 *
 * <p>Several entity types may share a file (users and usermeta in {@code users.ini}).
 * Writes only replace this type's sections and keep the rest of the file.
 */
@Slf4j
public class IniEntityStorage implements EntityStorage {

    private final String entityName;
    private final Path storageRoot;
    private final StorageLayout layout;
    private final IniSerializer serializer;

    public IniEntityStorage(String entityName, Path storageRoot, StorageLayout layout, IniSerializer serializer) {
        this.entityName = entityName;
        this.storageRoot = storageRoot;
        this.layout = layout;
        this.serializer = serializer;
    }

    @Override
    public String getEntityName() {
        return entityName;
    }

    @Override
    public boolean exists(String entityId, String parentId) {
        return find(entityId, parentId).isPresent();
    }

    @Override
    public Entity loadEntity(String entityId, String parentId) {
        return find(entityId, parentId)
                .orElseThrow(() -> new StorageException(
                        String.format("%s %s (parent %s) does not exist", entityName, entityId, parentId)));
    }

    @Override
    public List<Entity> loadAll() {
        String prefix = sectionPrefix();
        List<Entity> entities = new ArrayList<>();
        for (Path file : layout.allFiles(storageRoot)) {
            read(file).forEach((section, fields) -> {
                if (section.startsWith(prefix)) {
                    entities.add(new Entity(section.substring(prefix.length()), fields));
                }
            });
        }
        log.debug("Loaded {} {} entities", entities.size(), entityName);
        return entities;
    }

    @Override
    public void save(Entity entity, String parentId) {
        Path file = layout.fileFor(entity.getVpId(), parentId);
        Preconditions.checkArgument(file != null, "%s %s needs a parent id to be saved", entityName, entity.getVpId());

        Map<String, Map<String, Object>> sections = read(file);
        sections.put(sectionName(entity.getVpId()), new LinkedHashMap<>(entity.getFields()));
        write(file, sections);
    }

    @Override
    public boolean delete(String entityId, String parentId) {
        Optional<Path> file = findFile(entityId, parentId);
        if (file.isEmpty()) {
            return false;
        }

        Map<String, Map<String, Object>> sections = read(file.get());
        sections.remove(sectionName(entityId));
        if (sections.isEmpty()) {
            deleteFile(file.get());
        } else {
            write(file.get(), sections);
        }
        return true;
    }

    private Optional<Entity> find(String entityId, String parentId) {
        return findFile(entityId, parentId)
                .map(file -> new Entity(entityId, read(file).get(sectionName(entityId))));
    }

    private Optional<Path> findFile(String entityId, String parentId) {
        String section = sectionName(entityId);
        Path file = layout.fileFor(entityId, parentId);
        List<Path> candidates = file != null ? List.of(file) : layout.allFiles(storageRoot);

        for (Path candidate : candidates) {
            if (read(candidate).containsKey(section)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private Map<String, Map<String, Object>> read(Path relativeFile) {
        Path file = storageRoot.resolve(relativeFile);
        if (!Files.isRegularFile(file)) {
            return new LinkedHashMap<>();
        }
        try {
            return serializer.deserialize(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException | IllegalArgumentException e) {
            throw new StorageException("Failed to read " + relativeFile, file, e);
        }
    }

    private void write(Path relativeFile, Map<String, Map<String, Object>> sections) {
        Path file = storageRoot.resolve(relativeFile);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, serializer.serialize(sections), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Failed to write " + relativeFile, file, e);
        }
    }

    private void deleteFile(Path relativeFile) {
        Path file = storageRoot.resolve(relativeFile);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new StorageException("Failed to delete " + relativeFile, file, e);
        }
    }

    private String sectionName(String entityId) {
        return sectionPrefix() + entityId;
    }

    private String sectionPrefix() {
        return entityName + ":";
    }
}
