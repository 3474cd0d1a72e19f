package com.trailvision.core.enrich;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.trailvision.core.detection.AggregationReport;
import com.trailvision.core.detection.CompressedObservation;
import com.trailvision.core.geo.ClusterMetadataStore;
import com.trailvision.core.store.BulkObservationStore;
import com.trailvision.core.store.BulkStoreException;
import com.trailvision.core.store.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Отчёт по сохранённым наблюдениям: обогащённые строки + сводка.
 * Один проход по bulk-хранилищу.
 */
public final class ObservationReportService {
    private static final Logger log = LoggerFactory.getLogger(ObservationReportService.class);

    static final String CSV_HEADER = "observation_id,camera_id,species,start_time,end_time,duration_s,"
            + "frame_count,max_confidence,avg_confidence,needs_review,source_video,cluster_id,location_name,"
            + "cluster_lat,cluster_lon,cluster_points";

    private final BulkObservationStore bulk;
    private final EnrichmentJoiner joiner;

    public ObservationReportService(BulkObservationStore bulk, ClusterMetadataStore metadata) {
        this.bulk = bulk;
        this.joiner = new EnrichmentJoiner(metadata);
    }

    public record Report(List<EnrichedObservation> rows, AggregationReport summary) {}

    public Report build() {
        List<EnrichedObservation> rows = new ArrayList<>();
        AggregationReport.Builder summary = new AggregationReport.Builder();
        long frames = 0;
        try (Stream<CompressedObservation> s = bulk.read()) {
            var it = joiner.enrich(s.peek(summary::add)).iterator();
            while (it.hasNext()) {
                EnrichedObservation row = it.next();
                frames += row.frameCount();
                rows.add(row);
            }
        }
        AggregationReport built = summary.rawDetections(frames).build(null);
        log.info("Report: {} observations, {} species", built.totalObservations(), built.speciesSummary().size());
        return new Report(rows, built);
    }

    public void writeCsv(List<EnrichedObservation> rows, Path out) {
        StringBuilder sb = new StringBuilder(CSV_HEADER).append("\r\n");
        for (EnrichedObservation r : rows) {
            sb.append(csv(r.observationId())).append(',')
                    .append(csv(r.cameraId())).append(',')
                    .append(csv(r.species())).append(',')
                    .append(r.startTime()).append(',')
                    .append(r.endTime()).append(',')
                    .append(r.durationSeconds()).append(',')
                    .append(r.frameCount()).append(',')
                    .append(r.maxConfidence()).append(',')
                    .append(r.avgConfidence()).append(',')
                    .append(r.needsReview()).append(',')
                    .append(csv(r.sourceVideo())).append(',')
                    .append(csv(r.clusterId())).append(',')
                    .append(csv(r.displayName())).append(',')
                    .append(orEmpty(r.clusterLatitude())).append(',')
                    .append(orEmpty(r.clusterLongitude())).append(',')
                    .append(orEmpty(r.clusterPointCount()))
                    .append("\r\n");
        }
        write(out, sb.toString());
        log.info("Report: wrote {} rows to {}", rows.size(), out);
    }

    public void writeJson(Report report, Path out) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("summary", report.summary());
        doc.put("observations", report.rows());
        try {
            write(out, Json.mapper().writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(doc));
        } catch (IOException e) {
            throw new BulkStoreException("cannot serialize report", e);
        }
        log.info("Report: wrote JSON to {}", out);
    }

    static String csv(String v) {
        if (v == null) return "";
        if (v.indexOf(',') < 0 && v.indexOf('"') < 0 && v.indexOf('\n') < 0 && v.indexOf('\r') < 0) return v;
        return "\"" + v.replace("\"", "\"\"") + "\"";
    }

    private static String orEmpty(Object v) {
        return v == null ? "" : v.toString();
    }

    private static void write(Path out, String text) {
        try {
            Path parent = out.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(out, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BulkStoreException("cannot write " + out, e);
        }
    }
}
