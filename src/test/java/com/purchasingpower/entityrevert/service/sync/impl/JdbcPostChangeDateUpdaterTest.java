package com.purchasingpower.entityrevert.service.sync.impl;

import com.purchasingpower.entityrevert.configuration.AppProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Post Change Date Updater Tests")
class JdbcPostChangeDateUpdaterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30.750Z");

    private EmbeddedDatabase database;
    private JdbcTemplate jdbcTemplate;
    private JdbcPostChangeDateUpdater updater;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("classpath:mirror-schema.sql")
                .build();
        jdbcTemplate = new JdbcTemplate(database);

        AppProperties appProperties = new AppProperties();
        appProperties.getMirror().setTimeZone("Europe/Prague");
        updater = new JdbcPostChangeDateUpdater(jdbcTemplate, appProperties, Clock.fixed(NOW, ZoneOffset.UTC));

        jdbcTemplate.update("insert into wp_posts (ID, post_title) values (7, 'Hello')");
        jdbcTemplate.update("insert into wp_posts (ID, post_title) values (8, 'Other')");
        jdbcTemplate.update("insert into wp_vp_id (table_name, vp_id, id) values ('posts', 'ab12cd34', 7)");
        jdbcTemplate.update("insert into wp_vp_id (table_name, vp_id, id) values ('posts', 'ff00aa11', 8)");
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    @DisplayName("Should stamp local and GMT modification time of listed posts")
    void updateChangeDate_ShouldStampListedPosts() {
        // When
        updater.updateChangeDateForPosts(List.of("ab12cd34"));

        // Then: seconds precision, local time one hour ahead of GMT in March
        assertThat(modified(7, "post_modified")).isEqualTo(LocalDateTime.of(2026, 3, 1, 11, 15, 30));
        assertThat(modified(7, "post_modified_gmt")).isEqualTo(LocalDateTime.of(2026, 3, 1, 10, 15, 30));
        assertThat(modified(8, "post_modified")).isNull();
    }

    @Test
    @DisplayName("Unknown posts are ignored")
    void updateChangeDate_UnknownPost_ShouldUpdateNothing() {
        updater.updateChangeDateForPosts(List.of("deadbeef"));

        assertThat(modified(7, "post_modified")).isNull();
        assertThat(modified(8, "post_modified")).isNull();
    }

    @Test
    @DisplayName("Empty list is a no-op")
    void updateChangeDate_EmptyList_ShouldDoNothing() {
        updater.updateChangeDateForPosts(List.of());

        assertThat(modified(7, "post_modified_gmt")).isNull();
    }

    private LocalDateTime modified(long id, String column) {
        return jdbcTemplate.queryForObject("select " + column + " from wp_posts where ID = ?", LocalDateTime.class, id);
    }
}
