package com.trailvision.core.detection;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Событие наблюдения: склеенная серия детекций одного вида на одной камере.
 * После создания меняются только clusterId и needsReview (через with*-копии).
 */
public record CompressedObservation(
        String observationId,
        String cameraId,
        String species,
        Instant startTime,
        Instant endTime,
        double durationSeconds,          // = end - start
        int frameCount,                  // = detectionTimeline.size()
        double maxConfidence,
        double avgConfidence,
        List<TimelineEntry> detectionTimeline,
        String sourceVideo,              // null, если событие собрано из фото
        boolean needsReview,
        String clusterId,                // null до назначения кластера
        Double latitude,                 // первая детекция серии с GPS, иначе null
        Double longitude
) {

    public CompressedObservation {
        Objects.requireNonNull(observationId, "observationId");
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(endTime, "endTime");
        detectionTimeline = detectionTimeline == null ? List.of() : List.copyOf(detectionTimeline);
        if (endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("endTime < startTime for " + observationId);
        }
        if (frameCount != detectionTimeline.size()) {
            throw new IllegalArgumentException("frameCount=" + frameCount
                    + " but timeline has " + detectionTimeline.size() + " entries, id=" + observationId);
        }
    }

    public GroupKey groupKey() {
        return new GroupKey(cameraId, species);
    }

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }

    public CompressedObservation withClusterId(String id) {
        return new CompressedObservation(observationId, cameraId, species, startTime, endTime,
                durationSeconds, frameCount, maxConfidence, avgConfidence, detectionTimeline,
                sourceVideo, needsReview, id, latitude, longitude);
    }

    public CompressedObservation withNeedsReview(boolean flag) {
        return new CompressedObservation(observationId, cameraId, species, startTime, endTime,
                durationSeconds, frameCount, maxConfidence, avgConfidence, detectionTimeline,
                sourceVideo, flag, clusterId, latitude, longitude);
    }

    /** Стабильный id события: одинаковый вход → одинаковый id при повторном прогоне. */
    public static String idOf(GroupKey key, Instant start) {
        String raw = key.cameraId() + '\u0000' + key.species() + '\u0000' + start.toEpochMilli();
        return UUID.nameUUIDFromBytes(raw.getBytes(StandardCharsets.UTF_8)).toString();
    }

    public static double secondsBetween(Instant start, Instant end) {
        return Duration.between(start, end).toMillis() / 1000.0;
    }
}
