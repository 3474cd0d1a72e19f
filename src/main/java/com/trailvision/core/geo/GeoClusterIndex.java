package com.trailvision.core.geo;

import java.util.List;

/**
 * Инкрементальная кластеризация GPS-точек.
 * Реализации single-writer, assign() сериализуется внутри.
 */
public interface GeoClusterIndex {

    /**
     * Ближайший кластер в пределах radiusMeters получает точку (центр пересчитывается),
     * иначе заводится новый. Ничья по расстоянию → меньший clusterId ({@link ClusterIds#ORDER}).
     */
    ClusterAssignment assign(String observationId, GeoPoint point, double radiusMeters);

    default ClusterAssignment assign(String observationId, double latitude, double longitude, double radiusMeters) {
        return assign(observationId, new GeoPoint(latitude, longitude), radiusMeters);
    }

    /** Снимок кластеров, порядок по {@link ClusterIds#ORDER}. */
    List<Cluster> clusters();

    /** Кластеры с центром не дальше radiusMeters, ближайшие первыми. */
    List<NearbyCluster> nearby(GeoPoint point, double radiusMeters);

    record NearbyCluster(Cluster cluster, double distanceMeters) {}
}
