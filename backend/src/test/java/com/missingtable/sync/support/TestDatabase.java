package com.missingtable.sync.support;

import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.util.Map;

/**
 * Resets the ingestion tables between Spring tests and seeds a small set of reference rows.
 * Age groups and match types come from the seed migration.
 */
public class TestDatabase {

    private final JdbcTemplate jdbc;

    public TestDatabase(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void reset() {
        jdbc.update("DELETE FROM match_conflicts");
        jdbc.update("DELETE FROM import_errors");
        jdbc.update("DELETE FROM import_runs");
        jdbc.update("DELETE FROM dead_letter_messages");
        jdbc.update("DELETE FROM admin_audit");
        jdbc.update("DELETE FROM matches");
        jdbc.update("DELETE FROM teams");
        jdbc.update("DELETE FROM seasons");
        jdbc.update("DELETE FROM divisions");
    }

    public void seedStandard() {
        team("Team A");
        team("Team B");
        team("Team C");
        jdbc.update("INSERT INTO seasons (name, start_date, end_date) VALUES ('2025-2026', DATE '2025-08-01', DATE '2026-07-31')");
        jdbc.update("INSERT INTO divisions (name) VALUES ('Northeast')");
    }

    public long team(String name) {
        jdbc.update("INSERT INTO teams (name, normalized_name) VALUES (?, ?)", name, name.trim().toLowerCase());
        return teamId(name);
    }

    public long teamId(String name) {
        return jdbc.queryForObject("SELECT id FROM teams WHERE normalized_name = ?", Long.class, name.trim().toLowerCase());
    }

    public Map<String, Object> match(long id) {
        return jdbc.queryForMap("SELECT * FROM matches WHERE id = ?", id);
    }

    public Timestamp updatedAt(long matchId) {
        return jdbc.queryForObject("SELECT updated_at FROM matches WHERE id = ?", Timestamp.class, matchId);
    }

    public int count(String table) {
        Integer n = jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return n == null ? 0 : n;
    }

    public int openConflicts(long matchId) {
        Integer n = jdbc.queryForObject("SELECT COUNT(*) FROM match_conflicts WHERE match_id = ? AND resolved = FALSE",
                Integer.class, matchId);
        return n == null ? 0 : n;
    }
}
