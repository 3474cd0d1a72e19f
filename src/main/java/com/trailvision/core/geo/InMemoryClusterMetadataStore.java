package com.trailvision.core.geo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Хранилище метаданных в памяти: для тестов и встраивания без БД.
 * Записи кластеров неизменяемые и подменяются целиком под монитором.
 */
public class InMemoryClusterMetadataStore implements ClusterMetadataStore {

    private final Map<String, Cluster> clusters = new HashMap<>();
    private final Map<String, List<ClusterAssignment>> assignments = new HashMap<>();
    private final Map<String, ClusterActivity> activity = new TreeMap<>(ClusterIds.ORDER);
    private final Map<String, String> aliases = new TreeMap<>(ClusterIds.ORDER);
    private final int maxStoredLocations;

    public InMemoryClusterMetadataStore() {
        this(100);
    }

    public InMemoryClusterMetadataStore(int maxStoredLocations) {
        this.maxStoredLocations = Math.max(0, maxStoredLocations);
    }

    @Override
    public synchronized Optional<Cluster> get(String clusterId) {
        return Optional.ofNullable(clusters.get(clusterId));
    }

    @Override
    public synchronized boolean upsertName(String clusterId, String name, String description) {
        Cluster c = clusters.get(clusterId);
        if (c == null) return false;
        clusters.put(clusterId, c.withName(name, description));
        return true;
    }

    @Override
    public synchronized Cluster batchUpsertLocations(String clusterId, List<GeoPoint> points) {
        Objects.requireNonNull(points, "points");
        Cluster c = apply(clusterId, points);
        clusters.put(clusterId, c);
        return c;
    }

    @Override
    public synchronized Cluster batchUpsertAssignments(String clusterId, List<ClusterAssignment> batch) {
        Objects.requireNonNull(batch, "assignments");
        List<GeoPoint> points = new ArrayList<>(batch.size());
        for (ClusterAssignment a : batch) {
            if (!clusterId.equals(a.clusterId())) {
                throw new IllegalArgumentException("assignment for " + a.clusterId() + " in batch of " + clusterId);
            }
            points.add(a.point());
        }
        // сначала считаем всё, потом публикуем: частичного состояния не бывает
        Cluster c = apply(clusterId, points);
        clusters.put(clusterId, c);
        assignments.computeIfAbsent(clusterId, k -> new ArrayList<>()).addAll(batch);
        return c;
    }

    private Cluster apply(String clusterId, List<GeoPoint> points) {
        Objects.requireNonNull(clusterId, "clusterId");
        Cluster c = clusters.get(clusterId);
        int from = 0;
        if (c == null) {
            if (points.isEmpty()) {
                throw new IllegalArgumentException("cannot create cluster " + clusterId + " without points");
            }
            c = Cluster.seed(clusterId, Objects.requireNonNull(points.get(0), "point"), maxStoredLocations);
            from = 1;
        }
        for (int i = from; i < points.size(); i++) {
            c = c.withPoint(Objects.requireNonNull(points.get(i), "point"), maxStoredLocations);
        }
        return c;
    }

    @Override
    public synchronized List<Cluster> allClusters() {
        List<Cluster> out = new ArrayList<>(clusters.values());
        out.sort(Comparator.comparing(Cluster::clusterId, ClusterIds.ORDER));
        return out;
    }

    @Override
    public synchronized Set<String> unknownClusters(Set<String> candidateIds) {
        Set<String> out = new LinkedHashSet<>();
        for (String id : candidateIds) {
            if (id != null && !clusters.containsKey(id) && !aliases.containsKey(id)) out.add(id);
        }
        return out;
    }

    @Override
    public synchronized List<Cluster> unnamedClusters() {
        List<Cluster> out = new ArrayList<>();
        for (Cluster c : clusters.values()) {
            if (!c.named()) out.add(c);
        }
        out.sort(Comparator.comparingLong(Cluster::pointCount).reversed()
                .thenComparing(Cluster::clusterId, ClusterIds.ORDER));
        return out;
    }

    @Override
    public synchronized Optional<Cluster> findByName(String name) {
        return clusters.values().stream()
                .filter(c -> Objects.equals(c.name(), name))
                .min(Comparator.comparing(Cluster::clusterId, ClusterIds.ORDER));
    }

    @Override
    public synchronized List<ClusterAssignment> assignments(String clusterId) {
        return List.copyOf(assignments.getOrDefault(clusterId, List.of()));
    }

    @Override
    public synchronized boolean deleteCluster(String clusterId) {
        assignments.remove(clusterId);
        activity.remove(clusterId);
        aliases.values().removeIf(clusterId::equals);
        return clusters.remove(clusterId) != null;
    }

    @Override
    public synchronized Cluster mergeClusters(Collection<String> clusterIds, String name, String description) {
        List<String> ids = ClusterIds.mergeOrder(clusterIds);
        List<Cluster> parts = new ArrayList<>(ids.size());
        List<String> missing = new ArrayList<>();
        for (String id : ids) {
            Cluster c = clusters.get(id);
            if (c == null) missing.add(id); else parts.add(c);
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("unknown clusters: " + missing);
        }
        Cluster merged = Cluster.merged(parts, name, description, maxStoredLocations);
        String target = merged.clusterId();

        List<ClusterAssignment> moved = new ArrayList<>();
        for (String id : ids) {
            for (ClusterAssignment a : assignments.getOrDefault(id, List.of())) {
                moved.add(id.equals(target) ? a : a.withClusterId(target));
            }
        }
        for (String id : ids.subList(1, ids.size())) {
            clusters.remove(id);
            assignments.remove(id);
            aliases.replaceAll((alias, to) -> to.equals(id) ? target : to);
            aliases.put(id, target);
        }
        ids.forEach(activity::remove);
        clusters.put(target, merged);
        if (!moved.isEmpty()) assignments.put(target, moved);
        return merged;
    }

    @Override
    public synchronized Map<String, String> aliases() {
        return new LinkedHashMap<>(aliases);
    }

    @Override
    public synchronized boolean importCluster(Cluster cluster) {
        Cluster c = Objects.requireNonNull(cluster, "cluster").checkedForImport(maxStoredLocations);
        if (clusters.containsKey(c.clusterId()) || aliases.containsKey(c.clusterId())) return false;
        clusters.put(c.clusterId(), c);
        return true;
    }

    @Override
    public synchronized void replaceActivity(List<ClusterActivity> rows) {
        activity.clear();
        for (ClusterActivity a : rows) {
            activity.put(a.clusterId(), a);
        }
    }

    @Override
    public synchronized Map<String, ClusterActivity> activity() {
        return new LinkedHashMap<>(activity);
    }
}
