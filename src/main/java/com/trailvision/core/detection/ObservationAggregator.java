package com.trailvision.core.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Группирует сырые детекции по (камера, вид), сортирует группы по времени
 * и склеивает каждую группу через {@link IntervalMerger}.
 * Группы независимы и при workers > 1 обрабатываются параллельно.
 */
public final class ObservationAggregator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ObservationAggregator.class);

    /** Канонический порядок событий в результате. */
    public static final Comparator<CompressedObservation> EVENT_ORDER =
            Comparator.comparing(CompressedObservation::startTime)
                    .thenComparing(CompressedObservation::cameraId)
                    .thenComparing(CompressedObservation::species);

    private static final Comparator<RawDetection> BY_TIME = Comparator.comparing(RawDetection::timestamp);

    private final MergeSettings settings;
    private final boolean skipInvalidGroups;
    private final ExecutorService exec; // null → всё в вызывающем потоке

    public ObservationAggregator(MergeSettings settings) {
        this(settings, 1, false);
    }

    public ObservationAggregator(MergeSettings settings, int workers, boolean skipInvalidGroups) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.skipInvalidGroups = skipInvalidGroups;
        if (workers > 1) {
            AtomicInteger seq = new AtomicInteger(1);
            this.exec = Executors.newFixedThreadPool(workers, r -> {
                Thread t = new Thread(r, "tv-merge-worker-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            });
        } else {
            this.exec = null;
        }
    }

    public MergeSettings settings() {
        return settings;
    }

    public AggregationResult aggregate(Iterable<RawDetection> detections) {
        Objects.requireNonNull(detections, "detections");

        Map<GroupKey, List<RawDetection>> groups = new HashMap<>();
        int index = 0;
        for (RawDetection d : detections) {
            if (d == null) {
                throw new InvalidDetectionException("null detection at index " + index);
            }
            groups.computeIfAbsent(GroupKey.of(d), k -> new ArrayList<>()).add(d);
            index++;
        }
        log.info("Aggregator: {} detections in {} camera/species groups", index, groups.size());

        List<GroupKey> keys = new ArrayList<>(groups.keySet());
        keys.sort(null);

        Map<GroupKey, MergeResult> results = new LinkedHashMap<>();
        AggregationReport.Builder report = new AggregationReport.Builder();
        if (exec == null) {
            for (GroupKey key : keys) {
                try {
                    results.put(key, mergeGroup(groups.get(key)));
                } catch (InvalidDetectionException e) {
                    onGroupFailure(key, e, report);
                }
            }
        } else {
            Map<GroupKey, Future<MergeResult>> futures = new LinkedHashMap<>();
            for (GroupKey key : keys) {
                List<RawDetection> group = groups.get(key);
                futures.put(key, exec.submit(() -> mergeGroup(group)));
            }
            for (Map.Entry<GroupKey, Future<MergeResult>> e : futures.entrySet()) {
                try {
                    results.put(e.getKey(), e.getValue().get());
                } catch (ExecutionException ee) {
                    Throwable cause = ee.getCause();
                    if (cause instanceof InvalidDetectionException) {
                        try {
                            onGroupFailure(e.getKey(), (InvalidDetectionException) cause, report);
                        } catch (InvalidDetectionException fatal) {
                            cancelAll(futures);
                            throw fatal;
                        }
                    } else if (cause instanceof RuntimeException) {
                        cancelAll(futures);
                        throw (RuntimeException) cause;
                    } else {
                        cancelAll(futures);
                        throw new IllegalStateException("group " + e.getKey() + " failed", cause);
                    }
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    cancelAll(futures);
                    throw new IllegalStateException("aggregation interrupted", ie);
                }
            }
        }

        List<CompressedObservation> events = new ArrayList<>();
        for (MergeResult r : results.values()) {
            report.addMergeStats(r);
            events.addAll(r.events());
        }
        events.sort(EVENT_ORDER);
        events.forEach(report::add);

        AggregationReport built = report.build(settings);
        log.info("Aggregator: {} detections -> {} observations (low confidence dropped={}, short events dropped={})",
                index, events.size(), built.filtered().lowConfidenceDetections(), built.filtered().shortEvents());
        return new AggregationResult(events, built);
    }

    private MergeResult mergeGroup(List<RawDetection> group) {
        group.sort(BY_TIME);
        return IntervalMerger.mergeDetailed(group, settings);
    }

    private void onGroupFailure(GroupKey key, InvalidDetectionException e, AggregationReport.Builder report) {
        if (!skipInvalidGroups) {
            throw e.group() != null ? e : new InvalidDetectionException(key, e.getMessage(), e);
        }
        log.warn("Aggregator: group {} skipped: {}", key, e.getMessage());
        report.failedGroup(key, e.getMessage());
    }

    private static void cancelAll(Map<GroupKey, Future<MergeResult>> futures) {
        futures.values().forEach(f -> f.cancel(true));
    }

    @Override
    public void close() {
        if (exec != null) exec.shutdownNow();
    }
}
