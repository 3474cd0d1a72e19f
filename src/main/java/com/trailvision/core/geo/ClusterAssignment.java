package com.trailvision.core.geo;

import java.util.Objects;

/**
 * Связь наблюдения (точки) с кластером. Неизменяемая.
 *
 * @param distanceToCentroid расстояние до центра кластера на момент назначения (до пересчёта), м
 * @param created            true, если под эту точку был заведён новый кластер
 */
public record ClusterAssignment(
        String observationId,
        String clusterId,
        GeoPoint point,
        double distanceToCentroid,
        boolean created
) {
    public ClusterAssignment {
        Objects.requireNonNull(clusterId, "clusterId");
        Objects.requireNonNull(point, "point");
    }

    public ClusterAssignment withClusterId(String newClusterId) {
        return new ClusterAssignment(observationId, newClusterId, point, distanceToCentroid, created);
    }
}
