package com.trailvision.ui;

import com.trailvision.core.enrich.EnrichedObservation;
import com.trailvision.core.geo.Cluster;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Locale;

/**
 * Текстовые строки для консольного вывода: "#<id> | ...".
 */
public class ObservationRowFormat {

    private ObservationRowFormat() {
        // no-op
    }

    public static String formatObservationRow(EnrichedObservation row) {
        return formatObservationRow(row, ZoneId.systemDefault());
    }

    static String formatObservationRow(EnrichedObservation row, ZoneId zone) {
        String location = row.displayName() == null ? "-" : row.displayName();
        return "#" + row.observationId()
                + " | " + row.species() + " @ " + row.cameraId()
                + " | " + when(row.startTime(), zone)
                + " | " + String.format(Locale.ROOT, "%.1fs", row.durationSeconds())
                + " | " + row.frameCount() + " fr"
                + " | max=" + String.format(Locale.ROOT, "%.2f", row.maxConfidence())
                + (row.needsReview() ? " REVIEW" : "")
                + " | " + location;
    }

    public static String formatClusterRow(Cluster c) {
        return "#" + c.clusterId()
                + " | " + (c.named() ? c.name() : "(unnamed)")
                + " | " + String.format(Locale.ROOT, "%.6f,%.6f", c.meanLatitude(), c.meanLongitude())
                + " | " + c.pointCount() + " pts";
    }

    private static String when(Instant ts, ZoneId zone) {
        if (ts == null) return "";
        return ts.atZone(zone).toLocalDateTime().toString().replace('T', ' ');
    }
}
