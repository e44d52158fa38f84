package com.purchasingpower.entityrevert.service.sync.impl;

import com.purchasingpower.entityrevert.configuration.AppProperties;
import com.purchasingpower.entityrevert.model.CallContext;
import com.purchasingpower.entityrevert.model.ServiceType;
import com.purchasingpower.entityrevert.model.schema.EntityInfo;
import com.purchasingpower.entityrevert.model.storage.Entity;
import com.purchasingpower.entityrevert.service.schema.DbSchemaInfo;
import com.purchasingpower.entityrevert.service.sync.SynchronizationProcess;
import com.purchasingpower.entityrevert.storage.StorageFactory;
import com.purchasingpower.entityrevert.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Service;

import java.sql.PreparedStatement;
import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Copies entities from the file store into the relational mirror.
 *
 * Three passes over the requested types, in schema order:
 * <ol>
 *   <li>insert or update scalar columns, registering new rows in the {@code vp_id} table</li>
 *   <li>resolve one-to-many reference fields into mirror ids</li>
 *   <li>delete mirror rows whose entity no longer exists in the store</li>
 * </ol>
 * References are resolved after every type is upserted so that rows created in the
 * same run can point to each other. Many-to-many junction tables are not mirrored.
 */
@Slf4j
@Service
public class JdbcSynchronizationProcess implements SynchronizationProcess {

    static final long UNRESOLVED_REFERENCE = 0L;

    private final JdbcTemplate jdbcTemplate;
    private final DbSchemaInfo dbSchemaInfo;
    private final StorageFactory storageFactory;
    private final String tablePrefix;

    public JdbcSynchronizationProcess(JdbcTemplate jdbcTemplate,
                                      DbSchemaInfo dbSchemaInfo,
                                      StorageFactory storageFactory,
                                      AppProperties appProperties) {
        this.jdbcTemplate = jdbcTemplate;
        this.dbSchemaInfo = dbSchemaInfo;
        this.storageFactory = storageFactory;
        this.tablePrefix = appProperties.getMirror().getTablePrefix();
    }

    @Override
    public void synchronize(List<String> entityNames) {
        Set<String> requested = new HashSet<>(entityNames);
        List<String> ordered = dbSchemaInfo.getAllEntityNames().stream()
                .filter(requested::contains)
                .collect(Collectors.toList());

        requested.removeAll(ordered);
        if (!requested.isEmpty()) {
            log.warn("Ignoring unknown entity types: {}", requested);
        }
        if (ordered.isEmpty()) {
            return;
        }

        CallContext call = ExternalCallLogger.startCall(ServiceType.MIRROR_DB, "Synchronize", log);
        call.logRequest("Synchronizing entity types", "Types", ordered);

        try {
            Map<String, List<Entity>> storedEntities = new LinkedHashMap<>();
            Map<String, Set<String>> columnsByTable = new HashMap<>();
            for (String entityName : ordered) {
                storedEntities.put(entityName, storageFactory.getStorage(entityName).loadAll());
            }

            int upserted = 0;
            for (String entityName : ordered) {
                EntityInfo info = dbSchemaInfo.getEntityInfo(entityName);
                Set<String> columns = columnsByTable.computeIfAbsent(info.getTable(), this::columnsOf);
                for (Entity entity : storedEntities.get(entityName)) {
                    upsertScalars(info, columns, entity);
                    upserted++;
                }
            }

            for (String entityName : ordered) {
                EntityInfo info = dbSchemaInfo.getEntityInfo(entityName);
                Set<String> columns = columnsByTable.get(info.getTable());
                for (Entity entity : storedEntities.get(entityName)) {
                    updateReferences(info, columns, entity);
                }
            }

            int deleted = 0;
            for (String entityName : ordered) {
                deleted += deleteRemoved(dbSchemaInfo.getEntityInfo(entityName), storedEntities.get(entityName));
            }

            call.logResponse("Synchronized", "Upserted", upserted, "Deleted", deleted);
            log.info("Synchronized {} ({} rows upserted, {} deleted)", ordered, upserted, deleted);
        } catch (DataAccessException e) {
            call.logError("Synchronization failed", e);
            throw e;
        }
    }

    private void upsertScalars(EntityInfo info, Set<String> columns, Entity entity) {
        Map<String, String> values = new LinkedHashMap<>();
        entity.getScalarFields().forEach((field, value) -> {
            if (columns.contains(normalize(field)) && !field.equalsIgnoreCase(info.getIdColumn())) {
                values.put(field, value);
            }
        });

        Optional<Long> mirrorId = findMirrorId(info.getTable(), entity.getVpId());
        if (mirrorId.isPresent()) {
            if (!values.isEmpty()) {
                String assignments = values.keySet().stream().map(column -> column + " = ?").collect(Collectors.joining(", "));
                List<Object> args = new ArrayList<>(values.values());
                args.add(mirrorId.get());
                jdbcTemplate.update("update " + table(info) + " set " + assignments + " where " + info.getIdColumn() + " = ?",
                        args.toArray());
            }
            return;
        }

        if (values.isEmpty()) {
            log.warn("{} {} has no mirrored columns, skipping", info.getEntityName(), entity.getVpId());
            return;
        }
        long id = insert(info, values);
        jdbcTemplate.update("insert into " + vpIdTable() + " (table_name, vp_id, id) values (?, ?, ?)",
                info.getTable(), entity.getVpId(), id);
        log.debug("Inserted {} {} as {} {}", info.getEntityName(), entity.getVpId(), info.getTable(), id);
    }

    private long insert(EntityInfo info, Map<String, String> values) {
        String columns = String.join(", ", values.keySet());
        String placeholders = values.keySet().stream().map(column -> "?").collect(Collectors.joining(", "));
        String sql = "insert into " + table(info) + " (" + columns + ") values (" + placeholders + ")";
        List<String> args = new ArrayList<>(values.values());

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement statement = connection.prepareStatement(sql,
                    new String[]{info.getIdColumn().toUpperCase(Locale.ROOT)});
            for (int i = 0; i < args.size(); i++) {
                statement.setString(i + 1, args.get(i));
            }
            return statement;
        }, keyHolder);

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No generated key returned for " + table(info));
        }
        return key.longValue();
    }

    private void updateReferences(EntityInfo info, Set<String> columns, Entity entity) {
        Optional<Long> mirrorId = findMirrorId(info.getTable(), entity.getVpId());
        if (mirrorId.isEmpty()) {
            return;
        }

        for (Map.Entry<String, String> reference : info.getReferences().entrySet()) {
            String column = reference.getKey();
            if (!columns.contains(normalize(column))) {
                continue;
            }
            Optional<String> referencedVpId = entity.getReference(EntityInfo.referenceField(column));
            if (referencedVpId.isEmpty()) {
                continue;
            }

            EntityInfo referencedInfo = dbSchemaInfo.getEntityInfo(reference.getValue());
            long referencedId = findMirrorId(referencedInfo.getTable(), referencedVpId.get())
                    .orElse(UNRESOLVED_REFERENCE);
            jdbcTemplate.update("update " + table(info) + " set " + column + " = ? where " + info.getIdColumn() + " = ?",
                    referencedId, mirrorId.get());
        }
    }

    private int deleteRemoved(EntityInfo info, List<Entity> storedEntities) {
        Set<String> storedIds = storedEntities.stream().map(Entity::getVpId).collect(Collectors.toSet());
        List<Map<String, Object>> mirrored = jdbcTemplate.queryForList(
                "select vp_id, id from " + vpIdTable() + " where table_name = ?", info.getTable());

        int deleted = 0;
        for (Map<String, Object> row : mirrored) {
            String vpId = String.valueOf(row.get("vp_id"));
            if (storedIds.contains(vpId)) {
                continue;
            }
            long id = ((Number) row.get("id")).longValue();
            jdbcTemplate.update("delete from " + table(info) + " where " + info.getIdColumn() + " = ?", id);
            jdbcTemplate.update("delete from " + vpIdTable() + " where table_name = ? and vp_id = ?", info.getTable(), vpId);
            deleted++;
        }
        return deleted;
    }

    private Optional<Long> findMirrorId(String table, String vpId) {
        List<Long> ids = jdbcTemplate.queryForList(
                "select id from " + vpIdTable() + " where table_name = ? and vp_id = ?", Long.class, table, vpId);
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    private Set<String> columnsOf(String table) {
        Set<String> columns = jdbcTemplate.query("select * from " + tablePrefix + table + " where 1 = 0", rs -> {
            ResultSetMetaData metaData = rs.getMetaData();
            Set<String> names = new TreeSet<>();
            for (int i = 1; i <= metaData.getColumnCount(); i++) {
                names.add(normalize(metaData.getColumnName(i)));
            }
            return names;
        });
        return columns == null ? Set.of() : columns;
    }

    private String table(EntityInfo info) {
        return tablePrefix + info.getTable();
    }

    private String vpIdTable() {
        return tablePrefix + "vp_id";
    }

    private static String normalize(String column) {
        return column.toLowerCase(Locale.ROOT);
    }
}
