package com.trailvision.core.geo;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Постоянная именованная локация.
 * mean* — среднее всех когда-либо назначенных точек (считается инкрементально),
 * locations — первые maxStoredLocations сырых точек, не больше.
 */
public record Cluster(
        String clusterId,
        String name,            // null, пока человек не назвал
        String description,
        double meanLatitude,
        double meanLongitude,
        long pointCount,
        List<GeoPoint> locations
) {

    public Cluster {
        Objects.requireNonNull(clusterId, "clusterId");
        if (pointCount < 0) {
            throw new IllegalArgumentException("pointCount < 0 for " + clusterId);
        }
        locations = locations == null ? List.of() : List.copyOf(locations);
    }

    /** Новый кластер из первой точки. */
    public static Cluster seed(String clusterId, GeoPoint p, int maxStoredLocations) {
        return new Cluster(clusterId, null, null, p.latitude(), p.longitude(), 1,
                maxStoredLocations > 0 ? List.of(p) : List.of());
    }

    public GeoPoint centroid() {
        return new GeoPoint(meanLatitude, meanLongitude);
    }

    public boolean named() {
        return name != null && !name.isBlank();
    }

    /** Имя для отчётов: name, иначе сам id. */
    public String displayName() {
        return named() ? name : clusterId;
    }

    /** new_mean = old_mean + (p - old_mean) / (count + 1); count + 1. */
    public Cluster withPoint(GeoPoint p, int maxStoredLocations) {
        long n = pointCount + 1;
        double lat = meanLatitude + (p.latitude() - meanLatitude) / n;
        double lon = meanLongitude + (p.longitude() - meanLongitude) / n;
        List<GeoPoint> locs = locations;
        if (locations.size() < maxStoredLocations) {
            locs = new ArrayList<>(locations);
            locs.add(p);
        }
        return new Cluster(clusterId, name, description, lat, lon, n, locs);
    }

    /**
     * Слияние кластеров под id первого из parts. Центр — среднее всех точек,
     * взвешенное по pointCount; locations склеиваются по порядку parts.
     * name/description null — берутся у первого названного кластера.
     */
    public static Cluster merged(List<Cluster> parts, String name, String description, int maxStoredLocations) {
        if (parts.size() < 2) {
            throw new IllegalArgumentException("merge needs at least two clusters, got " + parts.size());
        }
        long count = 0;
        double lat = 0;
        double lon = 0;
        List<GeoPoint> locs = new ArrayList<>();
        String mergedName = name;
        String mergedDescription = description;
        for (Cluster c : parts) {
            count += c.pointCount;
            lat += c.meanLatitude * c.pointCount;
            lon += c.meanLongitude * c.pointCount;
            for (GeoPoint p : c.locations) {
                if (locs.size() < maxStoredLocations) locs.add(p);
            }
            if (mergedName == null && c.named()) {
                mergedName = c.name;
                if (mergedDescription == null) mergedDescription = c.description;
            }
        }
        if (count == 0) {
            throw new IllegalArgumentException("cannot merge clusters without points");
        }
        return new Cluster(parts.get(0).clusterId, mergedName, mergedDescription,
                lat / count, lon / count, count, locs);
    }

    /**
     * Проверка записи из выгрузки перед вставкой: хотя бы одна точка, валидный центр.
     * Лишние locations сверх лимита отрезаются.
     */
    public Cluster checkedForImport(int maxStoredLocations) {
        if (pointCount < 1) {
            throw new IllegalArgumentException("imported cluster " + clusterId + " has no points");
        }
        centroid();
        if (locations.size() <= maxStoredLocations) return this;
        return new Cluster(clusterId, name, description, meanLatitude, meanLongitude, pointCount,
                locations.subList(0, Math.max(0, maxStoredLocations)));
    }

    public Cluster withName(String newName, String newDescription) {
        return new Cluster(clusterId, newName, newDescription, meanLatitude, meanLongitude, pointCount, locations);
    }
}
