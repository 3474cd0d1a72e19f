package com.trailvision.core.enrich;

import com.trailvision.core.detection.CompressedObservation;
import com.trailvision.core.geo.Cluster;
import com.trailvision.core.geo.ClusterActivity;

import java.time.Instant;

/**
 * Плоская строка отчёта: наблюдение + текущие метаданные его кластера.
 * Поля кластера null, если у наблюдения нет кластера или кластер не найден.
 */
public record EnrichedObservation(
        String observationId,
        String cameraId,
        String species,
        Instant startTime,
        Instant endTime,
        double durationSeconds,
        int frameCount,
        double maxConfidence,
        double avgConfidence,
        boolean needsReview,
        String sourceVideo,
        Double latitude,
        Double longitude,
        String clusterId,
        String displayName,       // имя кластера, иначе его id
        String clusterName,
        String clusterDescription,
        Double clusterLatitude,
        Double clusterLongitude,
        Long clusterPointCount,
        Long clusterObservationCount,
        Integer clusterSpeciesCount
) {

    static EnrichedObservation of(CompressedObservation o, Cluster c, ClusterActivity a) {
        return of(o, o.clusterId(), c, a);
    }

    /** clusterId — действующий id кластера (после разрешения alias'а влитого кластера). */
    static EnrichedObservation of(CompressedObservation o, String clusterId, Cluster c, ClusterActivity a) {
        String display = c != null ? c.displayName() : clusterId;
        return new EnrichedObservation(
                o.observationId(),
                o.cameraId(),
                o.species(),
                o.startTime(),
                o.endTime(),
                o.durationSeconds(),
                o.frameCount(),
                o.maxConfidence(),
                o.avgConfidence(),
                o.needsReview(),
                o.sourceVideo(),
                o.latitude(),
                o.longitude(),
                clusterId,
                display,
                c == null ? null : c.name(),
                c == null ? null : c.description(),
                c == null ? null : c.meanLatitude(),
                c == null ? null : c.meanLongitude(),
                c == null ? null : c.pointCount(),
                a == null ? null : a.observationCount(),
                a == null ? null : a.speciesCount());
    }

    public boolean clusterKnown() {
        return clusterPointCount != null;
    }
}
