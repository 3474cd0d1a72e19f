package com.trailvision.app;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;


public record Config(Db db, Bulk bulk, CompressConf compress, ClusterConf cluster) {
    public record Db(String url, String user, String pass, int poolSize) {}
    public record Bulk(String dir) {}
    public record CompressConf(int windowMinutes, double minConfidence, double minDurationSeconds,
                               int maxEventMinutes, double reviewConfidence, int workers,
                               boolean skipInvalidGroups) {

        public Duration window() {
            return Duration.ofMinutes(windowMinutes);
        }

        public Duration minDuration() {
            return Duration.ofMillis(Math.round(minDurationSeconds * 1000.0));
        }

        /** null — без ограничения длительности события. */
        public Duration maxEventDuration() {
            return maxEventMinutes > 0 ? Duration.ofMinutes(maxEventMinutes) : null;
        }
    }
    public record ClusterConf(double radiusMeters, int maxStoredLocations) {}

    /** Конфиг из classpath:/application.yaml. */
    public static Config load() {
        try (InputStream in = Config.class.getResourceAsStream("/application.yaml")) {
            if (in == null) {
                throw new IllegalStateException("application.yaml not found on classpath");
            }
            return parse(in);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load application.yaml", e);
        }
    }

    /** Внешний файл (--config=...). */
    public static Config load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load config " + file, e);
        }
    }

    @SuppressWarnings("unchecked")
    static Config parse(InputStream in) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(in);
        if (root == null) root = Map.of();

        Map<String, Object> db  = (Map<String, Object>) root.getOrDefault("db", Map.of());
        Map<String, Object> bk  = (Map<String, Object>) root.getOrDefault("bulk", Map.of());
        Map<String, Object> cmp = (Map<String, Object>) root.getOrDefault("compress", Map.of());
        Map<String, Object> cl  = (Map<String, Object>) root.getOrDefault("cluster", Map.of());

        String url            = db.get("url")        != null ? (String) db.get("url")                          : "jdbc:sqlite:./data/clusters.db";
        int poolSize          = db.get("poolSize")   != null ? ((Number) db.get("poolSize")).intValue()        : 4;
        String bulkDir        = bk.get("dir")        != null ? (String) bk.get("dir")                          : "./data/observations";

        int windowMinutes     = cmp.get("windowMinutes")      != null ? ((Number) cmp.get("windowMinutes")).intValue()         : 10;
        double minConfidence  = cmp.get("minConfidence")      != null ? ((Number) cmp.get("minConfidence")).doubleValue()      : 0.5;
        double minDurationSec = cmp.get("minDurationSeconds") != null ? ((Number) cmp.get("minDurationSeconds")).doubleValue() : 0.0;
        int maxEventMinutes   = cmp.get("maxEventMinutes")    != null ? ((Number) cmp.get("maxEventMinutes")).intValue()       : windowMinutes;
        double reviewConf     = cmp.get("reviewConfidence")   != null ? ((Number) cmp.get("reviewConfidence")).doubleValue()   : 0.8;
        int workers           = cmp.get("workers")            != null ? ((Number) cmp.get("workers")).intValue()               : 4;
        boolean skipInvalid   = cmp.get("skipInvalidGroups")  != null && (Boolean) cmp.get("skipInvalidGroups");

        double radiusMeters   = cl.get("radiusMeters")       != null ? ((Number) cl.get("radiusMeters")).doubleValue()       : 5.0;
        int maxLocations      = cl.get("maxStoredLocations") != null ? ((Number) cl.get("maxStoredLocations")).intValue()    : 100;

        if (windowMinutes <= 0) {
            throw new IllegalArgumentException("compress.windowMinutes must be positive");
        }
        if (minConfidence < 0 || minConfidence > 1) {
            throw new IllegalArgumentException("compress.minConfidence must be within [0,1]");
        }
        if (minDurationSec < 0) {
            throw new IllegalArgumentException("compress.minDurationSeconds must be non-negative");
        }
        if (radiusMeters <= 0) {
            throw new IllegalArgumentException("cluster.radiusMeters must be positive");
        }

        return new Config(
                new Db(url, (String) db.get("user"), (String) db.get("pass"), poolSize),
                new Bulk(bulkDir),
                new CompressConf(windowMinutes, minConfidence, minDurationSec, maxEventMinutes,
                        reviewConf, Math.max(1, workers), skipInvalid),
                new ClusterConf(radiusMeters, Math.max(0, maxLocations))
        );
    }
}
