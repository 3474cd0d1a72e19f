package com.trailvision.core.db;

import com.trailvision.core.geo.Cluster;
import com.trailvision.core.geo.ClusterActivity;
import com.trailvision.core.geo.ClusterAssignment;
import com.trailvision.core.geo.ClusterIds;
import com.trailvision.core.geo.ClusterMetadataStore;
import com.trailvision.core.geo.GeoPoint;
import com.trailvision.core.geo.MetadataStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Метаданные кластеров в реляционной БД (SQLite по умолчанию).
 * Запись — одна JDBC-транзакция на вызов, при любой ошибке rollback.
 * Писатели внутри процесса сериализуются (synchronized), читатели идут параллельно.
 */
public final class JdbcClusterMetadataStore implements ClusterMetadataStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcClusterMetadataStore.class);

    private static final int IN_CHUNK = 500;

    private final MetadataDb db;
    private final int maxStoredLocations;

    public JdbcClusterMetadataStore(MetadataDb db, int maxStoredLocations) {
        this.db = Objects.requireNonNull(db, "db");
        this.maxStoredLocations = Math.max(0, maxStoredLocations);
    }

    @FunctionalInterface
    private interface TxWork<T> {
        T run(Connection c) throws SQLException;
    }

    /** Чтение в одной транзакции: кластер и его точки из одного снимка. */
    private <T> T read(String what, TxWork<T> work) {
        try (Connection c = db.get()) {
            c.setTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE);
            c.setAutoCommit(false);
            try {
                T out = work.run(c);
                c.commit();
                return out;
            } catch (SQLException | RuntimeException e) {
                rollback(c, what);
                throw e;
            }
        } catch (SQLException e) {
            throw new MetadataStoreException(what + " failed sqlstate=" + e.getSQLState(), e);
        }
    }

    private <T> T write(String what, TxWork<T> work) {
        try (Connection c = db.get()) {
            c.setAutoCommit(false);
            try {
                T out = work.run(c);
                c.commit();
                return out;
            } catch (SQLException | RuntimeException e) {
                rollback(c, what);
                throw e;
            }
        } catch (SQLException e) {
            throw new MetadataStoreException(what + " failed sqlstate=" + e.getSQLState(), e);
        }
    }

    private static void rollback(Connection c, String what) {
        try {
            c.rollback();
        } catch (SQLException re) {
            log.warn("JdbcClusterMetadataStore: rollback failed for {}: {}", what, re.toString());
        }
    }

    @Override
    public Optional<Cluster> get(String clusterId) {
        return read("get cluster_id=" + clusterId, c -> Optional.ofNullable(readCluster(c, clusterId)));
    }

    @Override
    public synchronized boolean upsertName(String clusterId, String name, String description) {
        final String sql = "UPDATE clusters SET name=?, description=?, updated_at_ms=? WHERE cluster_id=?";
        boolean updated = write("upsertName cluster_id=" + clusterId, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, name);
                ps.setString(2, description);
                ps.setLong(3, System.currentTimeMillis());
                ps.setString(4, clusterId);
                return ps.executeUpdate() == 1;
            }
        });
        if (updated) {
            log.info("JdbcClusterMetadataStore: named {} as '{}'", clusterId, name);
        } else {
            log.warn("JdbcClusterMetadataStore: upsertName: no cluster {}", clusterId);
        }
        return updated;
    }

    @Override
    public synchronized Cluster batchUpsertLocations(String clusterId, List<GeoPoint> points) {
        Objects.requireNonNull(points, "points");
        List<ClusterAssignment> asAssignments = new ArrayList<>(points.size());
        for (GeoPoint p : points) {
            asAssignments.add(new ClusterAssignment(null, clusterId, Objects.requireNonNull(p, "point"), 0.0, false));
        }
        return upsert(clusterId, asAssignments, false);
    }

    @Override
    public synchronized Cluster batchUpsertAssignments(String clusterId, List<ClusterAssignment> assignments) {
        Objects.requireNonNull(assignments, "assignments");
        for (ClusterAssignment a : assignments) {
            if (!clusterId.equals(a.clusterId())) {
                throw new IllegalArgumentException("assignment for " + a.clusterId() + " in batch of " + clusterId);
            }
        }
        return upsert(clusterId, assignments, true);
    }

    private Cluster upsert(String clusterId, List<ClusterAssignment> batch, boolean recordAssignments) {
        Objects.requireNonNull(clusterId, "clusterId");
        return write("batchUpsertLocations cluster_id=" + clusterId + " points=" + batch.size(), c -> {
            long now = System.currentTimeMillis();
            Cluster before = readCluster(c, clusterId);
            Cluster after = before;
            int from = 0;
            if (before == null) {
                if (batch.isEmpty()) {
                    throw new IllegalArgumentException("cannot create cluster " + clusterId + " without points");
                }
                after = Cluster.seed(clusterId, batch.get(0).point(), maxStoredLocations);
                from = 1;
            }
            for (int i = from; i < batch.size(); i++) {
                after = after.withPoint(batch.get(i).point(), maxStoredLocations);
            }

            if (before == null) {
                insertCluster(c, after, now);
            } else {
                updateCentroid(c, after, now);
            }
            int storedBefore = before == null ? 0 : before.locations().size();
            insertLocations(c, clusterId, after.locations(), storedBefore);
            if (recordAssignments) {
                insertAssignments(c, batch, before == null ? 0 : before.pointCount(), now);
            }
            return readCluster(c, clusterId);
        });
    }

    private static void insertCluster(Connection c, Cluster cl, long now) throws SQLException {
        final String sql = """
                INSERT INTO clusters(cluster_id, name, description, mean_latitude, mean_longitude,
                                     point_count, created_at_ms, updated_at_ms)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, cl.clusterId());
            ps.setString(2, cl.name());
            ps.setString(3, cl.description());
            ps.setDouble(4, cl.meanLatitude());
            ps.setDouble(5, cl.meanLongitude());
            ps.setLong(6, cl.pointCount());
            ps.setLong(7, now);
            ps.setLong(8, now);
            ps.executeUpdate();
        }
    }

    private static void updateCentroid(Connection c, Cluster cl, long now) throws SQLException {
        final String sql = """
                UPDATE clusters
                   SET mean_latitude = ?,
                       mean_longitude = ?,
                       point_count = ?,
                       updated_at_ms = ?
                 WHERE cluster_id = ?
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setDouble(1, cl.meanLatitude());
            ps.setDouble(2, cl.meanLongitude());
            ps.setLong(3, cl.pointCount());
            ps.setLong(4, now);
            ps.setString(5, cl.clusterId());
            int n = ps.executeUpdate();
            if (n != 1) {
                throw new SQLException("centroid update touched " + n + " rows for " + cl.clusterId());
            }
        }
    }

    private static void insertLocations(Connection c, String clusterId, List<GeoPoint> locations, int from)
            throws SQLException {
        if (from >= locations.size()) return;
        final String sql = "INSERT INTO cluster_locations(cluster_id, seq, latitude, longitude) VALUES (?,?,?,?)";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = from; i < locations.size(); i++) {
                GeoPoint p = locations.get(i);
                ps.setString(1, clusterId);
                ps.setInt(2, i);
                ps.setDouble(3, p.latitude());
                ps.setDouble(4, p.longitude());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    /** point_seq: номер точки в кластере, продолжает pointCount до батча. */
    private static void insertAssignments(Connection c, List<ClusterAssignment> batch, long firstSeq, long now)
            throws SQLException {
        if (batch.isEmpty()) return;
        final String sql = """
                INSERT INTO cluster_assignments(assignment_id, cluster_id, observation_id, latitude, longitude,
                                                distance_m, created, assigned_at_ms, point_seq)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            long seq = firstSeq;
            for (ClusterAssignment a : batch) {
                ps.setString(1, UUID.randomUUID().toString());
                ps.setString(2, a.clusterId());
                if (a.observationId() == null) ps.setNull(3, Types.VARCHAR); else ps.setString(3, a.observationId());
                ps.setDouble(4, a.point().latitude());
                ps.setDouble(5, a.point().longitude());
                ps.setDouble(6, a.distanceToCentroid());
                ps.setBoolean(7, a.created());
                ps.setLong(8, now);
                ps.setLong(9, seq++);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static Cluster readCluster(Connection c, String clusterId) throws SQLException {
        final String sql = """
                SELECT cluster_id, name, description, mean_latitude, mean_longitude, point_count
                FROM clusters
                WHERE cluster_id = ?
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, clusterId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return null;
                return mapCluster(rs, readLocations(c, clusterId));
            }
        }
    }

    private static Cluster mapCluster(ResultSet rs, List<GeoPoint> locations) throws SQLException {
        return new Cluster(
                rs.getString(1),
                rs.getString(2),
                rs.getString(3),
                rs.getDouble(4),
                rs.getDouble(5),
                rs.getLong(6),
                locations);
    }

    private static List<GeoPoint> readLocations(Connection c, String clusterId) throws SQLException {
        final String sql = "SELECT latitude, longitude FROM cluster_locations WHERE cluster_id = ? ORDER BY seq";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, clusterId);
            try (ResultSet rs = ps.executeQuery()) {
                List<GeoPoint> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(new GeoPoint(rs.getDouble(1), rs.getDouble(2)));
                }
                return out;
            }
        }
    }

    @Override
    public List<Cluster> allClusters() {
        return read("allClusters", c -> {
            Map<String, List<GeoPoint>> locs = new HashMap<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT cluster_id, latitude, longitude FROM cluster_locations ORDER BY cluster_id, seq");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    locs.computeIfAbsent(rs.getString(1), k -> new ArrayList<>())
                            .add(new GeoPoint(rs.getDouble(2), rs.getDouble(3)));
                }
            }
            List<Cluster> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT cluster_id, name, description, mean_latitude, mean_longitude, point_count
                    FROM clusters
                    """);
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapCluster(rs, locs.getOrDefault(rs.getString(1), List.of())));
                }
            }
            out.sort(Comparator.comparing(Cluster::clusterId, ClusterIds.ORDER));
            return out;
        });
    }

    @Override
    public Set<String> unknownClusters(Set<String> candidateIds) {
        List<String> ids = new ArrayList<>();
        for (String id : candidateIds) {
            if (id != null) ids.add(id);
        }
        if (ids.isEmpty()) return Set.of();
        Set<String> known = read("unknownClusters", c -> {
            Set<String> found = new HashSet<>();
            for (int i = 0; i < ids.size(); i += IN_CHUNK) {
                List<String> chunk = ids.subList(i, Math.min(ids.size(), i + IN_CHUNK));
                String in = String.join(",", Collections.nCopies(chunk.size(), "?"));
                String sql = "SELECT cluster_id FROM clusters WHERE cluster_id IN (" + in + ")"
                        + " UNION SELECT alias_id FROM cluster_aliases WHERE alias_id IN (" + in + ")";
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    for (int j = 0; j < chunk.size(); j++) {
                        ps.setString(j + 1, chunk.get(j));
                        ps.setString(chunk.size() + j + 1, chunk.get(j));
                    }
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) found.add(rs.getString(1));
                    }
                }
            }
            return found;
        });
        Set<String> out = new LinkedHashSet<>();
        for (String id : ids) {
            if (!known.contains(id)) out.add(id);
        }
        return out;
    }

    @Override
    public List<Cluster> unnamedClusters() {
        List<Cluster> out = new ArrayList<>();
        for (Cluster c : allClusters()) {
            if (!c.named()) out.add(c);
        }
        out.sort(Comparator.comparingLong(Cluster::pointCount).reversed()
                .thenComparing(Cluster::clusterId, ClusterIds.ORDER));
        return out;
    }

    @Override
    public Optional<Cluster> findByName(String name) {
        return read("findByName name=" + name, c -> {
            List<String> ids = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("SELECT cluster_id FROM clusters WHERE name = ?")) {
                ps.setString(1, name);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) ids.add(rs.getString(1));
                }
            }
            if (ids.isEmpty()) return Optional.empty();
            ids.sort(ClusterIds.ORDER);
            return Optional.ofNullable(readCluster(c, ids.get(0)));
        });
    }

    @Override
    public List<ClusterAssignment> assignments(String clusterId) {
        final String sql = """
                SELECT observation_id, cluster_id, latitude, longitude, distance_m, created
                FROM cluster_assignments
                WHERE cluster_id = ?
                ORDER BY point_seq
                """;
        return read("assignments cluster_id=" + clusterId, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, clusterId);
                try (ResultSet rs = ps.executeQuery()) {
                    List<ClusterAssignment> out = new ArrayList<>();
                    while (rs.next()) {
                        out.add(new ClusterAssignment(
                                rs.getString(1),
                                rs.getString(2),
                                new GeoPoint(rs.getDouble(3), rs.getDouble(4)),
                                rs.getDouble(5),
                                rs.getBoolean(6)));
                    }
                    return out;
                }
            }
        });
    }

    @Override
    public synchronized boolean deleteCluster(String clusterId) {
        boolean deleted = write("deleteCluster cluster_id=" + clusterId, c -> {
            for (String sql : List.of(
                    "DELETE FROM cluster_assignments WHERE cluster_id = ?",
                    "DELETE FROM cluster_locations WHERE cluster_id = ?",
                    "DELETE FROM cluster_activity WHERE cluster_id = ?",
                    "DELETE FROM cluster_aliases WHERE cluster_id = ?")) {
                deleteWhere(c, sql, clusterId);
            }
            return deleteWhere(c, "DELETE FROM clusters WHERE cluster_id = ?", clusterId) == 1;
        });
        if (deleted) log.info("JdbcClusterMetadataStore: deleted cluster {}", clusterId);
        return deleted;
    }

    private static int deleteWhere(Connection c, String sql, String clusterId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, clusterId);
            return ps.executeUpdate();
        }
    }

    @Override
    public synchronized Cluster mergeClusters(Collection<String> clusterIds, String name, String description) {
        List<String> ids = ClusterIds.mergeOrder(clusterIds);
        String target = ids.get(0);
        Cluster merged = write("mergeClusters " + ids, c -> {
            List<Cluster> parts = new ArrayList<>(ids.size());
            List<String> missing = new ArrayList<>();
            for (String id : ids) {
                Cluster cl = readCluster(c, id);
                if (cl == null) missing.add(id); else parts.add(cl);
            }
            if (!missing.isEmpty()) {
                throw new IllegalArgumentException("unknown clusters: " + missing);
            }
            Cluster m = Cluster.merged(parts, name, description, maxStoredLocations);
            long now = System.currentTimeMillis();
            updateMerged(c, m, now);

            // point_seq влитых назначений сдвигается за точки предыдущих кластеров
            long offset = parts.get(0).pointCount();
            for (Cluster from : parts.subList(1, parts.size())) {
                repointAssignments(c, from.clusterId(), target, offset);
                offset += from.pointCount();
                addAlias(c, from.clusterId(), target, now);
            }
            for (String id : ids) {
                deleteWhere(c, "DELETE FROM cluster_locations WHERE cluster_id = ?", id);
                deleteWhere(c, "DELETE FROM cluster_activity WHERE cluster_id = ?", id);
            }
            insertLocations(c, target, m.locations(), 0);
            for (String id : ids.subList(1, ids.size())) {
                deleteWhere(c, "DELETE FROM clusters WHERE cluster_id = ?", id);
            }
            return readCluster(c, target);
        });
        log.info("JdbcClusterMetadataStore: merged {} into {} (points={})", ids, target, merged.pointCount());
        return merged;
    }

    private static void updateMerged(Connection c, Cluster m, long now) throws SQLException {
        final String sql = """
                UPDATE clusters
                   SET name = ?,
                       description = ?,
                       mean_latitude = ?,
                       mean_longitude = ?,
                       point_count = ?,
                       updated_at_ms = ?
                 WHERE cluster_id = ?
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, m.name());
            ps.setString(2, m.description());
            ps.setDouble(3, m.meanLatitude());
            ps.setDouble(4, m.meanLongitude());
            ps.setLong(5, m.pointCount());
            ps.setLong(6, now);
            ps.setString(7, m.clusterId());
            ps.executeUpdate();
        }
    }

    private static void repointAssignments(Connection c, String from, String to, long seqOffset) throws SQLException {
        final String sql = "UPDATE cluster_assignments SET cluster_id = ?, point_seq = point_seq + ? WHERE cluster_id = ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, to);
            ps.setLong(2, seqOffset);
            ps.setString(3, from);
            ps.executeUpdate();
        }
    }

    /** from становится alias'ом to; alias'ы, смотревшие на from, перевешиваются на to. */
    private static void addAlias(Connection c, String from, String to, long now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("UPDATE cluster_aliases SET cluster_id = ? WHERE cluster_id = ?")) {
            ps.setString(1, to);
            ps.setString(2, from);
            ps.executeUpdate();
        }
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO cluster_aliases(alias_id, cluster_id, merged_at_ms) VALUES (?, ?, ?)")) {
            ps.setString(1, from);
            ps.setString(2, to);
            ps.setLong(3, now);
            ps.executeUpdate();
        }
    }

    @Override
    public Map<String, String> aliases() {
        return read("aliases", c -> {
            Map<String, String> sorted = new TreeMap<>(ClusterIds.ORDER);
            try (PreparedStatement ps = c.prepareStatement("SELECT alias_id, cluster_id FROM cluster_aliases");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) sorted.put(rs.getString(1), rs.getString(2));
            }
            return new LinkedHashMap<>(sorted);
        });
    }

    @Override
    public synchronized boolean importCluster(Cluster cluster) {
        Cluster cl = Objects.requireNonNull(cluster, "cluster").checkedForImport(maxStoredLocations);
        String id = cl.clusterId();
        return write("importCluster cluster_id=" + id, c -> {
            if (readCluster(c, id) != null || isAlias(c, id)) return false;
            insertCluster(c, cl, System.currentTimeMillis());
            insertLocations(c, id, cl.locations(), 0);
            return true;
        });
    }

    private static boolean isAlias(Connection c, String id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM cluster_aliases WHERE alias_id = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public synchronized void replaceActivity(List<ClusterActivity> activity) {
        final String ins = """
                INSERT INTO cluster_activity(cluster_id, observation_count, species_count,
                                             first_seen_ms, last_seen_ms, refreshed_at_ms)
                VALUES (?, ?, ?, ?, ?, ?)
                """;
        write("replaceActivity rows=" + activity.size(), c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM cluster_activity")) {
                ps.executeUpdate();
            }
            long now = System.currentTimeMillis();
            try (PreparedStatement ps = c.prepareStatement(ins)) {
                for (ClusterActivity a : activity) {
                    ps.setString(1, a.clusterId());
                    ps.setLong(2, a.observationCount());
                    ps.setInt(3, a.speciesCount());
                    setMillis(ps, 4, a.firstSeen());
                    setMillis(ps, 5, a.lastSeen());
                    ps.setLong(6, now);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            return null;
        });
    }

    @Override
    public Map<String, ClusterActivity> activity() {
        final String sql = """
                SELECT cluster_id, observation_count, species_count, first_seen_ms, last_seen_ms
                FROM cluster_activity
                """;
        return read("activity", c -> {
            List<ClusterActivity> rows = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql);
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(new ClusterActivity(
                            rs.getString(1),
                            rs.getLong(2),
                            rs.getInt(3),
                            getInstant(rs, 4),
                            getInstant(rs, 5)));
                }
            }
            rows.sort(Comparator.comparing(ClusterActivity::clusterId, ClusterIds.ORDER));
            Map<String, ClusterActivity> out = new LinkedHashMap<>();
            for (ClusterActivity a : rows) out.put(a.clusterId(), a);
            return out;
        });
    }

    private static void setMillis(PreparedStatement ps, int idx, Instant t) throws SQLException {
        if (t == null) ps.setNull(idx, Types.BIGINT); else ps.setLong(idx, t.toEpochMilli());
    }

    private static Instant getInstant(ResultSet rs, int idx) throws SQLException {
        long v = rs.getLong(idx);
        return rs.wasNull() ? null : Instant.ofEpochMilli(v);
    }
}
