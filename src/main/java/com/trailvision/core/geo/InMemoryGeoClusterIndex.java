package com.trailvision.core.geo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Кластеризация в памяти: линейный проход по всем кластерам (их десятки-сотни).
 */
public class InMemoryGeoClusterIndex implements GeoClusterIndex {
    private static final Logger log = LoggerFactory.getLogger(InMemoryGeoClusterIndex.class);

    private final Map<String, Cluster> clusters = new HashMap<>();
    // id, которые нельзя выдавать заново (alias'ы влитых кластеров)
    private final Set<String> reserved = new HashSet<>();
    private final int maxStoredLocations;

    public InMemoryGeoClusterIndex() {
        this(List.of(), 100);
    }

    public InMemoryGeoClusterIndex(Collection<Cluster> seed, int maxStoredLocations) {
        this(seed, List.of(), maxStoredLocations);
    }

    public InMemoryGeoClusterIndex(Collection<Cluster> seed, Collection<String> reservedIds, int maxStoredLocations) {
        this.maxStoredLocations = Math.max(0, maxStoredLocations);
        for (Cluster c : seed) {
            clusters.put(c.clusterId(), c);
        }
        reserved.addAll(reservedIds);
    }

    @Override
    public synchronized ClusterAssignment assign(String observationId, GeoPoint point, double radiusMeters) {
        Objects.requireNonNull(point, "point");
        if (!(radiusMeters >= 0)) {
            throw new IllegalArgumentException("radiusMeters must be non-negative: " + radiusMeters);
        }

        Cluster best = null;
        double bestDist = Double.POSITIVE_INFINITY;
        for (Cluster c : clusters.values()) {
            double d = point.distanceMeters(c.centroid());
            if (d < bestDist || (d == bestDist && best != null
                    && ClusterIds.ORDER.compare(c.clusterId(), best.clusterId()) < 0)) {
                best = c;
                bestDist = d;
            }
        }

        if (best != null && bestDist <= radiusMeters) {
            clusters.put(best.clusterId(), best.withPoint(point, maxStoredLocations));
            log.debug("GeoIndex: {} -> {} ({} m)", observationId, best.clusterId(), bestDist);
            return new ClusterAssignment(observationId, best.clusterId(), point, bestDist, false);
        }

        Set<String> taken = new HashSet<>(clusters.keySet());
        taken.addAll(reserved);
        String id = ClusterIds.next(taken);
        clusters.put(id, Cluster.seed(id, point, maxStoredLocations));
        log.info("GeoIndex: new cluster {} at ({}, {})", id, point.latitude(), point.longitude());
        return new ClusterAssignment(observationId, id, point, 0.0, true);
    }

    @Override
    public synchronized List<Cluster> clusters() {
        List<Cluster> out = new ArrayList<>(clusters.values());
        out.sort(Comparator.comparing(Cluster::clusterId, ClusterIds.ORDER));
        return out;
    }

    @Override
    public synchronized List<NearbyCluster> nearby(GeoPoint point, double radiusMeters) {
        List<NearbyCluster> out = new ArrayList<>();
        for (Cluster c : clusters.values()) {
            double d = point.distanceMeters(c.centroid());
            if (d <= radiusMeters) {
                out.add(new NearbyCluster(c, d));
            }
        }
        out.sort(Comparator.comparingDouble(NearbyCluster::distanceMeters)
                .thenComparing(n -> n.cluster().clusterId(), ClusterIds.ORDER));
        return out;
    }

    /** Текущее состояние кластера (после всех назначений). */
    public synchronized Cluster get(String clusterId) {
        return clusters.get(clusterId);
    }
}
