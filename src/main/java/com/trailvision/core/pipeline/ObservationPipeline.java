package com.trailvision.core.pipeline;

import com.trailvision.core.detection.AggregationReport;
import com.trailvision.core.detection.AggregationResult;
import com.trailvision.core.detection.CompressedObservation;
import com.trailvision.core.detection.ObservationAggregator;
import com.trailvision.core.detection.RawDetection;
import com.trailvision.core.geo.ClusterAssignment;
import com.trailvision.core.geo.ClusterMetadataStore;
import com.trailvision.core.geo.GeoPoint;
import com.trailvision.core.geo.StoreBackedGeoClusterIndex;
import com.trailvision.core.store.BulkObservationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Детекции → события → кластеры → bulk.
 * Порядок записи: сначала метаданные кластеров, затем bulk. Если метаданные не записались,
 * bulk не трогается вовсе.
 */
public final class ObservationPipeline {
    private static final Logger log = LoggerFactory.getLogger(ObservationPipeline.class);

    private final ObservationAggregator aggregator;
    private final ClusterMetadataStore metadata;
    private final BulkObservationStore bulk;
    private final double radiusMeters;
    private final int maxStoredLocations;

    public ObservationPipeline(ObservationAggregator aggregator, ClusterMetadataStore metadata,
                               BulkObservationStore bulk, double radiusMeters, int maxStoredLocations) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.bulk = Objects.requireNonNull(bulk, "bulk");
        if (!(radiusMeters > 0)) {
            throw new IllegalArgumentException("radiusMeters must be positive: " + radiusMeters);
        }
        this.radiusMeters = radiusMeters;
        this.maxStoredLocations = maxStoredLocations;
    }

    public record RunResult(List<CompressedObservation> observations, AggregationReport report,
                            int clustersCreated, int assignedObservations) {}

    public RunResult run(Iterable<RawDetection> detections) {
        AggregationResult agg = aggregator.aggregate(detections);

        // один писатель: события с GPS в порядке начала
        StoreBackedGeoClusterIndex index = new StoreBackedGeoClusterIndex(metadata, maxStoredLocations);
        List<CompressedObservation> out = new ArrayList<>(agg.events().size());
        int created = 0;
        int assigned = 0;
        for (CompressedObservation o : agg.events()) {
            if (!o.hasLocation()) {
                out.add(o);
                continue;
            }
            ClusterAssignment a = index.assign(o.observationId(), new GeoPoint(o.latitude(), o.longitude()), radiusMeters);
            if (a.created()) created++;
            assigned++;
            out.add(o.withClusterId(a.clusterId()));
        }
        index.flush();

        bulk.append(out);
        log.info("Pipeline: {} observations stored, {} with cluster ({} new clusters)",
                out.size(), assigned, created);
        return new RunResult(out, agg.report(), created, assigned);
    }
}
