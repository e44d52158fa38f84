package com.purchasingpower.entityrevert.service.sync.impl;

import com.purchasingpower.entityrevert.configuration.AppProperties;
import com.purchasingpower.entityrevert.model.CallContext;
import com.purchasingpower.entityrevert.model.ServiceType;
import com.purchasingpower.entityrevert.service.sync.PostChangeDateUpdater;
import com.purchasingpower.entityrevert.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Slf4j
@Service
public class JdbcPostChangeDateUpdater implements PostChangeDateUpdater {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final ZoneId localZone;
    private final String updateSql;

    public JdbcPostChangeDateUpdater(JdbcTemplate jdbcTemplate, AppProperties appProperties, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        this.localZone = ZoneId.of(appProperties.getMirror().getTimeZone());

        String prefix = appProperties.getMirror().getTablePrefix();
        this.updateSql = "update " + prefix + "posts set post_modified = ?, post_modified_gmt = ?"
                + " where ID = (select id from " + prefix + "vp_id where table_name = 'posts' and vp_id = ?)";
    }

    @Override
    public void updateChangeDateForPosts(List<String> vpIds) {
        if (vpIds.isEmpty()) {
            return;
        }

        LocalDateTime date = LocalDateTime.now(clock.withZone(localZone)).truncatedTo(ChronoUnit.SECONDS);
        LocalDateTime dateGmt = LocalDateTime.now(clock.withZone(ZoneOffset.UTC)).truncatedTo(ChronoUnit.SECONDS);

        CallContext call = ExternalCallLogger.startCall(ServiceType.MIRROR_DB, "UpdatePostModified", log);
        call.logRequest("Stamping posts", "Posts", ExternalCallLogger.formatCollection(vpIds), "Date", date);
        try {
            int updated = 0;
            for (String vpId : vpIds) {
                updated += jdbcTemplate.update(updateSql, date, dateGmt, vpId);
            }
            call.logResponse(updated + " rows updated");
        } catch (DataAccessException e) {
            call.logError("Failed to update modification date of posts", e);
            throw e;
        }
    }
}
