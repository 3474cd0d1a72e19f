package com.trailvision.core.detection;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Сводка по прогону склейки. Считается одним проходом по событиям (Builder.add),
 * сырые детекции повторно не сканируются. Сериализуется Jackson'ом как есть.
 */
public record AggregationReport(
        int totalObservations,
        long rawDetections,
        double compressionRatio,                  // rawDetections / totalObservations, 0 если событий нет
        Map<String, SpeciesSummary> speciesSummary,
        Map<String, CameraSummary> cameraSummary,
        int videoObservations,
        int imageObservations,
        TimeRange timeRange,                      // null, если событий нет
        Filtered filtered,
        Settings settings,                        // null для отчётов по уже сохранённым данным
        List<String> failedGroups
) {

    public record SpeciesSummary(int count, double totalDurationSeconds, double maxConfidence, double avgConfidence) {}

    public record CameraSummary(int count, List<String> species) {}

    public record TimeRange(Instant start, Instant end, double durationHours) {}

    public record Filtered(long lowConfidenceDetections, long shortEvents, long shortEventDetections) {}

    /** Параметры прогона в секундах, без округления до минут. */
    public record Settings(double windowSeconds, double minConfidence, double minDurationSeconds,
                           Double maxEventSeconds) {

        public static Settings of(MergeSettings s) {
            return new Settings(
                    seconds(s.window()),
                    s.minConfidence(),
                    seconds(s.minDuration()),
                    s.maxEventDuration() == null ? null : seconds(s.maxEventDuration()));
        }

        private static double seconds(Duration d) {
            return d.toMillis() / 1000.0;
        }
    }

    public AggregationReport {
        speciesSummary = Collections.unmodifiableMap(new TreeMap<>(speciesSummary));
        cameraSummary = Collections.unmodifiableMap(new TreeMap<>(cameraSummary));
        failedGroups = List.copyOf(failedGroups);
    }

    public static AggregationReport of(List<CompressedObservation> events) {
        Builder b = new Builder();
        events.forEach(b::add);
        return b.build(null);
    }

    public static final class Builder {
        private int total;
        private long raw;
        private int video;
        private int image;
        private Instant start;
        private Instant end;
        private long lowConf;
        private long shortEvents;
        private long shortEventDetections;
        private final Map<String, SpeciesAcc> species = new TreeMap<>();
        private final Map<String, CameraAcc> cameras = new TreeMap<>();
        private final List<String> failed = new ArrayList<>();

        public Builder add(CompressedObservation o) {
            total++;
            species.computeIfAbsent(o.species(), k -> new SpeciesAcc()).add(o);
            cameras.computeIfAbsent(o.cameraId(), k -> new CameraAcc()).add(o);
            if (o.sourceVideo() != null) video++; else image++;
            if (start == null || o.startTime().isBefore(start)) start = o.startTime();
            if (end == null || o.endTime().isAfter(end)) end = o.endTime();
            return this;
        }

        /** Счётчики отброшенного по группе (события группы добавляются отдельно через add). */
        public Builder addMergeStats(MergeResult r) {
            raw += r.inputDetections();
            lowConf += r.droppedLowConfidence();
            shortEvents += r.droppedShortEvents();
            shortEventDetections += r.droppedShortEventDetections();
            return this;
        }

        public Builder rawDetections(long n) {
            raw = n;
            return this;
        }

        public Builder failedGroup(GroupKey key, String reason) {
            failed.add(key + ": " + reason);
            return this;
        }

        public AggregationReport build(MergeSettings settings) {
            Map<String, SpeciesSummary> sp = new TreeMap<>();
            species.forEach((k, v) -> sp.put(k, v.summary()));
            Map<String, CameraSummary> cam = new TreeMap<>();
            cameras.forEach((k, v) -> cam.put(k, new CameraSummary(v.count, List.copyOf(v.species))));
            TimeRange range = start == null
                    ? null
                    : new TimeRange(start, end, Duration.between(start, end).toMillis() / 3_600_000.0);
            return new AggregationReport(
                    total,
                    raw,
                    total == 0 ? 0.0 : (double) raw / total,
                    sp,
                    cam,
                    video,
                    image,
                    range,
                    new Filtered(lowConf, shortEvents, shortEventDetections),
                    settings == null ? null : Settings.of(settings),
                    failed);
        }
    }

    private static final class SpeciesAcc {
        int count;
        double totalDuration;
        double maxConf;
        double sumAvgConf;

        void add(CompressedObservation o) {
            count++;
            totalDuration += o.durationSeconds();
            maxConf = Math.max(maxConf, o.maxConfidence());
            sumAvgConf += o.avgConfidence();
        }

        SpeciesSummary summary() {
            return new SpeciesSummary(count, totalDuration, maxConf, sumAvgConf / count);
        }
    }

    private static final class CameraAcc {
        int count;
        final TreeSet<String> species = new TreeSet<>();

        void add(CompressedObservation o) {
            count++;
            species.add(o.species());
        }
    }
}
