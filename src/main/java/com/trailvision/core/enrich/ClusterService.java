package com.trailvision.core.enrich;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.trailvision.core.geo.Cluster;
import com.trailvision.core.geo.ClusterIds;
import com.trailvision.core.geo.ClusterMetadataStore;
import com.trailvision.core.geo.GeoClusterIndex.NearbyCluster;
import com.trailvision.core.geo.GeoPoint;
import com.trailvision.core.store.BulkStoreException;
import com.trailvision.core.store.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Операции обслуживания кластеров: сводка, именование, поиск рядом,
 * поиск перекрытий и слияние, экспорт и импорт.
 */
public final class ClusterService {
    private static final Logger log = LoggerFactory.getLogger(ClusterService.class);

    /** Центры ближе этого считаются перекрывающимися, м. */
    public static final double DEFAULT_OVERLAP_METERS = 10.0;

    private final ClusterMetadataStore store;

    public ClusterService(ClusterMetadataStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public record Summary(int totalClusters, int namedClusters, int unnamedClusters,
                          long totalPoints, double avgPointsPerCluster) {}

    /** Группа перекрывающихся кластеров; minDistanceMeters — от первого до ближайшего из остальных. */
    public record OverlapGroup(List<Cluster> clusters, double minDistanceMeters) {

        public List<String> clusterIds() {
            return clusters.stream().map(Cluster::clusterId).toList();
        }
    }

    public record ImportResult(int imported, int skipped) {}

    public Summary summary() {
        List<Cluster> all = store.allClusters();
        int named = 0;
        long points = 0;
        for (Cluster c : all) {
            if (c.named()) named++;
            points += c.pointCount();
        }
        return new Summary(all.size(), named, all.size() - named, points,
                all.isEmpty() ? 0.0 : (double) points / all.size());
    }

    /**
     * Назвать кластер. Пустое имя не принимается.
     *
     * @return false, если кластера нет
     */
    public boolean name(String clusterId, String name, String description) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("cluster name must not be blank");
        }
        boolean ok = store.upsertName(clusterId, name.trim(), description);
        if (ok) {
            log.info("Clusters: {} named '{}'", clusterId, name.trim());
        } else {
            log.warn("Clusters: {} not found, name not set", clusterId);
        }
        return ok;
    }

    /**
     * Назвать несколько кластеров. Имена проверяются все до первой записи.
     *
     * @return id → найден ли кластер, в порядке id
     */
    public Map<String, Boolean> batchName(Map<String, String> names) {
        for (Map.Entry<String, String> e : names.entrySet()) {
            if (e.getValue() == null || e.getValue().isBlank()) {
                throw new IllegalArgumentException("cluster name must not be blank: " + e.getKey());
            }
        }
        Map<String, Boolean> out = new TreeMap<>(ClusterIds.ORDER);
        names.forEach((id, name) -> out.put(id, store.upsertName(id, name.trim(), null)));
        long named = out.values().stream().filter(Boolean::booleanValue).count();
        log.info("Clusters: batch naming {} of {} clusters", named, out.size());
        return out;
    }

    /** Имена из JSON-объекта {"cluster_001": "Bäckdalen", ...}. */
    public Map<String, Boolean> batchName(Path namesJson) {
        Map<String, String> names;
        try {
            names = Json.mapper().readValue(namesJson.toFile(), new TypeReference<Map<String, String>>() {});
        } catch (IOException e) {
            throw new BulkStoreException("cannot read cluster names from " + namesJson, e);
        }
        return batchName(names);
    }

    public List<NearbyCluster> nearby(double latitude, double longitude, double radiusMeters) {
        GeoPoint p = new GeoPoint(latitude, longitude);
        List<NearbyCluster> out = new ArrayList<>();
        for (Cluster c : store.allClusters()) {
            double d = p.distanceMeters(c.centroid());
            if (d <= radiusMeters) out.add(new NearbyCluster(c, d));
        }
        out.sort(Comparator.comparingDouble(NearbyCluster::distanceMeters));
        return out;
    }

    public List<Cluster> unnamed() {
        return store.unnamedClusters();
    }

    /**
     * Кандидаты на слияние. Жадно, в порядке id: кластер забирает все ещё
     * свободные кластеры в пределах thresholdMeters от своего центра.
     */
    public List<OverlapGroup> overlaps(double thresholdMeters) {
        if (!(thresholdMeters >= 0)) {
            throw new IllegalArgumentException("overlap threshold must be non-negative: " + thresholdMeters);
        }
        List<Cluster> all = store.allClusters();
        Set<String> grouped = new HashSet<>();
        List<OverlapGroup> out = new ArrayList<>();
        for (int i = 0; i < all.size(); i++) {
            Cluster head = all.get(i);
            if (grouped.contains(head.clusterId())) continue;
            List<Cluster> group = new ArrayList<>();
            group.add(head);
            double min = Double.POSITIVE_INFINITY;
            for (Cluster other : all.subList(i + 1, all.size())) {
                if (grouped.contains(other.clusterId())) continue;
                double d = head.centroid().distanceMeters(other.centroid());
                if (d <= thresholdMeters) {
                    group.add(other);
                    grouped.add(other.clusterId());
                    min = Math.min(min, d);
                }
            }
            if (group.size() > 1) {
                grouped.add(head.clusterId());
                out.add(new OverlapGroup(List.copyOf(group), min));
            }
        }
        log.info("Clusters: {} overlap groups within {} m", out.size(), thresholdMeters);
        return out;
    }

    /** См. {@link ClusterMetadataStore#mergeClusters}. Пустое имя значит «не менять». */
    public Cluster merge(Collection<String> clusterIds, String name, String description) {
        String n = name == null || name.isBlank() ? null : name.trim();
        Cluster merged = store.mergeClusters(clusterIds, n, description);
        log.info("Clusters: merged {} into {} ({} points)", clusterIds, merged.clusterId(), merged.pointCount());
        return merged;
    }

    public void exportJson(Path out) {
        List<Cluster> all = store.allClusters();
        try {
            Path parent = out.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Json.mapper().writer(SerializationFeature.INDENT_OUTPUT).writeValue(out.toFile(), all);
        } catch (IOException e) {
            throw new BulkStoreException("cluster export failed for " + out, e);
        }
        log.info("Clusters: exported {} clusters to {}", all.size(), out);
    }

    /**
     * Загрузить выгрузку {@link #exportJson}. Кластеры с уже занятым id пропускаются,
     * существующие записи не перезаписываются.
     */
    public ImportResult importJson(Path in) {
        List<Cluster> clusters;
        try {
            clusters = Json.mapper().readValue(in.toFile(), new TypeReference<List<Cluster>>() {});
        } catch (IOException e) {
            throw new BulkStoreException("cluster import failed for " + in, e);
        }
        // битая запись отклоняет весь файл до первой вставки
        for (Cluster c : clusters) {
            c.checkedForImport(Integer.MAX_VALUE);
        }
        int imported = 0;
        int skipped = 0;
        for (Cluster c : clusters) {
            if (store.importCluster(c)) {
                imported++;
            } else {
                skipped++;
                log.warn("Clusters: {} already exists, not imported", c.clusterId());
            }
        }
        log.info("Clusters: imported {} clusters from {}, skipped {}", imported, in, skipped);
        return new ImportResult(imported, skipped);
    }
}
