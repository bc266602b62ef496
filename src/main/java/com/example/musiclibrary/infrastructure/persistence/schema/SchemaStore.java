package com.example.musiclibrary.infrastructure.persistence.schema;

import com.example.musiclibrary.common.exception.SchemaMigrationException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Brings the catalog database to {@link #CURRENT_VERSION}. Version N is reached by applying the additive
 * steps 2..N on top of the version 1 tables, each step committed together with its version stamp.
 */
@Component
public class SchemaStore {

    private static final Logger log = LoggerFactory.getLogger(SchemaStore.class);

    public static final int CURRENT_VERSION = 4;

    private static final List<String> VERSION_1 = Arrays.asList(
            "CREATE TABLE IF NOT EXISTS schema_version (version INTEGER NOT NULL)",
            "CREATE TABLE IF NOT EXISTS artists ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "name TEXT NOT NULL UNIQUE, "
                    + "created_at TEXT NOT NULL DEFAULT CURRENT_TIMESTAMP, "
                    + "updated_at TEXT NOT NULL DEFAULT CURRENT_TIMESTAMP)",
            "CREATE TABLE IF NOT EXISTS albums ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "artist_id INTEGER NOT NULL REFERENCES artists(id) ON DELETE CASCADE, "
                    + "title TEXT NOT NULL, "
                    + "year INTEGER, "
                    + "genre TEXT, "
                    + "compilation BOOLEAN NOT NULL DEFAULT 0, "
                    + "path TEXT NOT NULL UNIQUE, "
                    + "dr_value TEXT, "
                    + "created_at TEXT NOT NULL DEFAULT CURRENT_TIMESTAMP, "
                    + "updated_at TEXT NOT NULL DEFAULT CURRENT_TIMESTAMP, "
                    + "UNIQUE(artist_id, title, year))",
            "CREATE TABLE IF NOT EXISTS tracks ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "album_id INTEGER NOT NULL REFERENCES albums(id) ON DELETE CASCADE, "
                    + "title TEXT NOT NULL, "
                    + "track_number INTEGER, "
                    + "disc_number INTEGER NOT NULL DEFAULT 1, "
                    + "duration_ms INTEGER NOT NULL DEFAULT 0, "
                    + "path TEXT NOT NULL UNIQUE, "
                    + "file_size INTEGER NOT NULL DEFAULT 0, "
                    + "format TEXT NOT NULL DEFAULT '', "
                    + "sample_rate INTEGER, "
                    + "bits_per_sample INTEGER, "
                    + "channels INTEGER, "
                    + "created_at TEXT NOT NULL DEFAULT CURRENT_TIMESTAMP, "
                    + "updated_at TEXT NOT NULL DEFAULT CURRENT_TIMESTAMP)",
            "CREATE INDEX IF NOT EXISTS idx_artists_name ON artists(name)",
            "CREATE INDEX IF NOT EXISTS idx_albums_artist_id ON albums(artist_id)",
            "CREATE INDEX IF NOT EXISTS idx_albums_title ON albums(title)",
            "CREATE INDEX IF NOT EXISTS idx_tracks_album_id ON tracks(album_id)",
            "CREATE INDEX IF NOT EXISTS idx_tracks_path ON tracks(path)"
    );

    /** Step N migrates from N-1 to N. */
    private static final Map<Integer, List<String>> STEPS;

    static {
        Map<Integer, List<String>> steps = new LinkedHashMap<>();
        steps.put(2, Collections.singletonList(
                "ALTER TABLE albums ADD COLUMN artwork_path TEXT"));
        steps.put(3, Arrays.asList(
                "ALTER TABLE albums ADD COLUMN format TEXT",
                "ALTER TABLE albums ADD COLUMN bits_per_sample INTEGER",
                "ALTER TABLE albums ADD COLUMN sample_rate INTEGER"));
        steps.put(4, Arrays.asList(
                "ALTER TABLE tracks ADD COLUMN codec TEXT NOT NULL DEFAULT ''",
                "ALTER TABLE tracks ADD COLUMN is_lossless BOOLEAN NOT NULL DEFAULT 0",
                "ALTER TABLE tracks ADD COLUMN is_high_resolution BOOLEAN NOT NULL DEFAULT 0"));
        STEPS = Collections.unmodifiableMap(steps);
    }

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public SchemaStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @PostConstruct
    public void init() {
        enableWriteAheadLog();
        initializeSchema();
    }

    /**
     * Creates or migrates the schema and returns the resulting version.
     *
     * @throws SchemaMigrationException when the stored version is not one this build knows how to migrate
     */
    public int initializeSchema() {
        Integer stored = readStoredVersion();
        if (stored == null) {
            if (tableExists("artists")) {
                throw new SchemaMigrationException("Catalog tables exist without a schema version stamp");
            }
            transactionTemplate.executeWithoutResult(status -> {
                VERSION_1.forEach(jdbcTemplate::execute);
                jdbcTemplate.update("DELETE FROM schema_version");
                jdbcTemplate.update("INSERT INTO schema_version(version) VALUES (1)");
            });
            log.info("SCHEMA_CREATED version=1");
            stored = 1;
        }
        if (stored < 1 || stored > CURRENT_VERSION) {
            throw new SchemaMigrationException("Unknown schema version " + stored
                    + ", this build supports 1.." + CURRENT_VERSION);
        }
        for (int target = stored + 1; target <= CURRENT_VERSION; target++) {
            applyStep(target);
        }
        return CURRENT_VERSION;
    }

    public Integer readStoredVersion() {
        if (!tableExists("schema_version")) {
            return null;
        }
        List<Integer> versions = jdbcTemplate.queryForList(
                "SELECT version FROM schema_version ORDER BY version DESC LIMIT 1", Integer.class);
        return versions.isEmpty() ? null : versions.get(0);
    }

    private void applyStep(int target) {
        List<String> ddl = STEPS.get(target);
        try {
            transactionTemplate.executeWithoutResult(status -> {
                ddl.forEach(jdbcTemplate::execute);
                jdbcTemplate.update("UPDATE schema_version SET version = ?", target);
            });
        } catch (DataAccessException e) {
            throw new SchemaMigrationException("Migration to schema version " + target + " failed", e);
        }
        log.info("SCHEMA_MIGRATED from={} to={}", target - 1, target);
    }

    private boolean tableExists(String table) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(1) FROM sqlite_master WHERE type = 'table' AND name = ?", Integer.class, table);
        return count != null && count > 0;
    }

    private void enableWriteAheadLog() {
        try {
            String mode = jdbcTemplate.queryForObject("PRAGMA journal_mode=WAL", String.class);
            log.debug("SCHEMA_JOURNAL_MODE mode={}", mode);
        } catch (DataAccessException e) {
            log.warn("SCHEMA_JOURNAL_MODE_FAILED reason={}", e.getMessage());
        }
    }
}
