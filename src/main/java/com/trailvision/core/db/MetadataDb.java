package com.trailvision.core.db;

import com.trailvision.app.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Пул соединений к хранилищу метаданных + миграции Flyway (classpath:db/migration).
 * По умолчанию SQLite-файл рядом с данными; PostgreSQL URL тоже поддерживается.
 */
public final class MetadataDb implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MetadataDb.class);

    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    private final String url;
    private HikariDataSource ds;

    private MetadataDb(String url) {
        this.url = url;
    }

    public static MetadataDb open(Config.Db cfg) {
        MetadataDb db = new MetadataDb(cfg.url());
        db.init(cfg);
        return db;
    }

    /** SQLite-файл по пути, остальные параметры по умолчанию. */
    public static MetadataDb openSqlite(Path file) {
        return open(new Config.Db(SQLITE_PREFIX + file.toAbsolutePath(), null, null, 4));
    }

    private void init(Config.Db cfg) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(cfg.url());
        if (cfg.user() != null && !cfg.user().isBlank()) hc.setUsername(cfg.user());
        if (cfg.pass() != null && !cfg.pass().isBlank()) hc.setPassword(cfg.pass());
        hc.setMaximumPoolSize(Math.max(1, cfg.poolSize()));
        hc.setMinimumIdle(1);
        hc.setPoolName("tv-pool");
        // быстрые таймауты и health-check
        hc.setConnectionTimeout(5000);
        hc.setValidationTimeout(3000);
        hc.setIdleTimeout(300000);
        hc.setMaxLifetime(1800000);
        hc.setConnectionTestQuery("SELECT 1");
        if (isSqlite()) {
            ensureSqliteDir(cfg.url());
            // sqlite-jdbc читает pragma из свойств драйвера
            hc.addDataSourceProperty("foreign_keys", "true");
            hc.addDataSourceProperty("busy_timeout", "5000");
        }
        ds = new HikariDataSource(hc);
        log.info("MetadataDb: pool started url={}", cfg.url());

        Flyway fw = Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration")
                .baselineOnMigrate(true)
                .load();
        fw.migrate();
        log.info("MetadataDb: flyway migrate done");
    }

    public Connection get() throws SQLException {
        if (ds == null) {
            throw new SQLException("MetadataDb is closed: " + url);
        }
        return ds.getConnection();
    }

    public boolean isSqlite() {
        return url != null && url.startsWith(SQLITE_PREFIX);
    }

    public String url() {
        return url;
    }

    private static void ensureSqliteDir(String url) {
        String path = url.substring(SQLITE_PREFIX.length());
        int q = path.indexOf('?');
        if (q >= 0) path = path.substring(0, q);
        if (path.startsWith("file:")) path = path.substring("file:".length());
        if (path.isBlank() || path.startsWith(":memory:")) return;
        Path parent = Path.of(path).toAbsolutePath().getParent();
        if (parent == null) return;
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create directory for " + url, e);
        }
    }

    @Override
    public void close() {
        if (ds != null) {
            try {
                ds.close();
                log.info("MetadataDb: pool closed");
            } finally {
                ds = null;
            }
        } else {
            log.debug("MetadataDb: close(): pool already null");
        }
    }
}
