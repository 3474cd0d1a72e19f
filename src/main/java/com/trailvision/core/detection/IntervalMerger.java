package com.trailvision.core.detection;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Склейка детекций одной пары (камера, вид) в события по временному окну.
 *
 * Допущения:
 * - detections отсортированы по timestamp (ответственность вызывающего; нарушение → исключение);
 * - все детекции принадлежат одной группе (cameraId + species).
 *
 * Правила:
 * - детекции с confidence < minConfidence выкидываются до склейки, даже если стоят внутри серии;
 * - детекция продлевает открытое событие, если t - t(последней принятой) <= window
 *   и (если задан потолок) t - start <= maxEventDuration;
 * - иначе событие закрывается и открывается новое;
 * - закрытые события короче minDuration отбрасываются, их детекции никуда не переносятся.
 */
public final class IntervalMerger {

    private IntervalMerger() {
        // no-op
    }

    public static List<CompressedObservation> merge(List<RawDetection> detections, MergeSettings settings) {
        return mergeDetailed(detections, settings).events();
    }

    public static List<CompressedObservation> merge(List<RawDetection> detections, Duration window,
                                                    double minConfidence, Duration minDuration) {
        return merge(detections, MergeSettings.gapOnly(window, minConfidence, minDuration));
    }

    public static MergeResult mergeDetailed(List<RawDetection> detections, MergeSettings settings) {
        if (detections == null || detections.isEmpty()) {
            return MergeResult.EMPTY;
        }
        final GroupKey key = GroupKey.of(detections.get(0));
        final long windowMs = settings.window().toMillis();
        final Long capMs = settings.maxEventDuration() == null ? null : settings.maxEventDuration().toMillis();

        List<CompressedObservation> events = new ArrayList<>();
        int droppedLow = 0;
        int droppedShort = 0;
        int droppedShortDetections = 0;

        OpenEvent open = null;
        Instant prev = null;
        for (RawDetection d : detections) {
            if (!key.cameraId().equals(d.cameraId()) || !key.species().equals(d.species())) {
                throw new InvalidDetectionException(key, "foreign detection in group: " + GroupKey.of(d)
                        + ", source=" + d.sourceId());
            }
            if (prev != null && d.timestamp().isBefore(prev)) {
                throw new InvalidDetectionException(key, "detections are not sorted by timestamp at source="
                        + d.sourceId() + " (" + d.timestamp() + " < " + prev + ")");
            }
            prev = d.timestamp();

            if (d.confidence() < settings.minConfidence()) {
                droppedLow++;
                continue;
            }

            if (open != null && open.accepts(d.timestamp(), windowMs, capMs)) {
                open.add(d);
                continue;
            }
            if (open != null && !open.finishInto(events, key, settings)) {
                droppedShort++;
                droppedShortDetections += open.size();
            }
            open = new OpenEvent(d);
        }
        if (open != null && !open.finishInto(events, key, settings)) {
            droppedShort++;
            droppedShortDetections += open.size();
        }

        return new MergeResult(events, detections.size(), droppedLow, droppedShort, droppedShortDetections);
    }

    /** Открытое (ещё не закрытое) событие. */
    private static final class OpenEvent {
        private final Instant start;
        private Instant last;
        private final List<RawDetection> frames = new ArrayList<>();
        private double maxConf;
        private double sumConf;

        OpenEvent(RawDetection first) {
            this.start = first.timestamp();
            this.last = first.timestamp();
            add(first);
        }

        boolean accepts(Instant t, long windowMs, Long capMs) {
            long gap = t.toEpochMilli() - last.toEpochMilli();
            if (gap > windowMs) return false;
            return capMs == null || t.toEpochMilli() - start.toEpochMilli() <= capMs;
        }

        void add(RawDetection d) {
            frames.add(d);
            last = d.timestamp();
            maxConf = frames.size() == 1 ? d.confidence() : Math.max(maxConf, d.confidence());
            sumConf += d.confidence();
        }

        int size() {
            return frames.size();
        }

        /** false — событие короче minDuration и отброшено. */
        boolean finishInto(List<CompressedObservation> out, GroupKey key, MergeSettings s) {
            Duration duration = Duration.between(start, last);
            if (duration.compareTo(s.minDuration()) < 0) {
                return false;
            }
            List<TimelineEntry> timeline = new ArrayList<>(frames.size());
            String sourceVideo = null;
            Double lat = null;
            Double lon = null;
            for (RawDetection f : frames) {
                timeline.add(new TimelineEntry(f.timestamp(), f.confidence(), f.sourceId(), f.frameNumber()));
                if (sourceVideo == null && f.video()) {
                    sourceVideo = RawDetection.videoRefOf(f.sourceId());
                }
                if (lat == null && f.hasLocation()) {
                    lat = f.latitude();
                    lon = f.longitude();
                }
            }
            out.add(new CompressedObservation(
                    CompressedObservation.idOf(key, start),
                    key.cameraId(),
                    key.species(),
                    start,
                    last,
                    CompressedObservation.secondsBetween(start, last),
                    frames.size(),
                    maxConf,
                    sumConf / frames.size(),
                    timeline,
                    sourceVideo,
                    maxConf < s.reviewConfidence(),
                    null,
                    lat,
                    lon));
            return true;
        }
    }
}
