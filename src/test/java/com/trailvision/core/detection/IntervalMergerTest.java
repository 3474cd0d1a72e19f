package com.trailvision.core.detection;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class IntervalMergerTest {

    private static final Instant T0 = Instant.parse("2024-06-01T10:00:00Z");

    private static final MergeSettings TEN_MIN = new MergeSettings(
            Duration.ofSeconds(600), 0.5, Duration.ZERO, Duration.ofSeconds(600), 0.8);

    private static RawDetection moose(long sec, double conf) {
        return RawDetection.image("cam1/IMG_" + sec + ".JPG", "cam1", T0.plusSeconds(sec), "moose", conf);
    }

    @Test
    void emptyInputGivesNoEvents() {
        assertTrue(IntervalMerger.merge(List.of(), TEN_MIN).isEmpty());
        assertSame(MergeResult.EMPTY, IntervalMerger.mergeDetailed(null, TEN_MIN));
    }

    @Test
    void mooseScenarioGivesTwoEvents() {
        List<RawDetection> in = List.of(moose(0, 0.9), moose(30, 0.8), moose(630, 0.85));

        var events = IntervalMerger.merge(in, TEN_MIN);

        assertEquals(2, events.size());
        CompressedObservation first = events.get(0);
        assertEquals(T0, first.startTime());
        assertEquals(T0.plusSeconds(30), first.endTime());
        assertEquals(2, first.frameCount());
        assertEquals(0.9, first.maxConfidence(), 1e-9);
        assertEquals(30.0, first.durationSeconds(), 1e-9);

        CompressedObservation second = events.get(1);
        assertEquals(T0.plusSeconds(630), second.startTime());
        assertEquals(1, second.frameCount());
        assertEquals(0.0, second.durationSeconds(), 1e-9);
    }

    @Test
    void mooseScenarioDropsZeroLengthEventWithMinDuration() {
        List<RawDetection> in = List.of(moose(0, 0.9), moose(30, 0.8), moose(630, 0.85));
        MergeSettings s = new MergeSettings(Duration.ofSeconds(600), 0.5, Duration.ofSeconds(1),
                Duration.ofSeconds(600), 0.8);

        MergeResult r = IntervalMerger.mergeDetailed(in, s);

        assertEquals(1, r.events().size());
        assertEquals(1, r.droppedShortEvents());
        assertEquals(1, r.droppedShortEventDetections());
        assertEquals(3, r.inputDetections());
    }

    @Test
    void gapOnlyExtendsFromLastDetection() {
        // без потолка: 630 - 30 = 600 <= окна → одно событие
        List<RawDetection> in = List.of(moose(0, 0.9), moose(30, 0.8), moose(630, 0.85));

        var events = IntervalMerger.merge(in, Duration.ofSeconds(600), 0.5, Duration.ZERO);

        assertEquals(1, events.size());
        assertEquals(3, events.get(0).frameCount());
        assertEquals(630.0, events.get(0).durationSeconds(), 1e-9);
    }

    @Test
    void lowConfidenceDroppedBeforeWindowing() {
        // слабая детекция в середине не склеивает и не рвёт серию
        List<RawDetection> in = List.of(moose(0, 0.9), moose(100, 0.2), moose(200, 0.7));

        MergeResult r = IntervalMerger.mergeDetailed(in, TEN_MIN);

        assertEquals(1, r.events().size());
        assertEquals(2, r.events().get(0).frameCount());
        assertEquals(1, r.droppedLowConfidence());
        assertEquals(0.8, r.events().get(0).avgConfidence(), 1e-9);
    }

    @Test
    void needsReviewWhenMaxConfidenceBelowThreshold() {
        var events = IntervalMerger.merge(List.of(moose(0, 0.6), moose(10, 0.7)), TEN_MIN);
        assertTrue(events.get(0).needsReview());

        events = IntervalMerger.merge(List.of(moose(0, 0.6), moose(10, 0.95)), TEN_MIN);
        assertFalse(events.get(0).needsReview());
    }

    @Test
    void unsortedInputIsRejected() {
        List<RawDetection> in = List.of(moose(100, 0.9), moose(50, 0.9));

        InvalidDetectionException e = assertThrows(InvalidDetectionException.class,
                () -> IntervalMerger.merge(in, TEN_MIN));
        assertEquals(new GroupKey("cam1", "moose"), e.group());
    }

    @Test
    void foreignGroupIsRejected() {
        List<RawDetection> in = List.of(moose(0, 0.9),
                RawDetection.image("x.jpg", "cam1", T0.plusSeconds(5), "deer", 0.9));

        assertThrows(InvalidDetectionException.class, () -> IntervalMerger.merge(in, TEN_MIN));
    }

    @Test
    void videoFramesKeepSourceVideoAndFrameNumbers() {
        List<RawDetection> in = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            in.add(new RawDetection("clip01_frame_00000" + i + ".jpg", "cam2", T0.plusSeconds(i), "boar", 0.9,
                    null, true, null, null, null));
        }

        CompressedObservation o = IntervalMerger.merge(in, TEN_MIN).get(0);

        assertEquals("clip01", o.sourceVideo());
        assertEquals(Integer.valueOf(2), o.detectionTimeline().get(2).frameNumber());
    }

    @Test
    void eventTakesFirstKnownLocation() {
        List<RawDetection> in = List.of(moose(0, 0.9), moose(10, 0.9).withLocation(59.30, 18.10),
                moose(20, 0.9).withLocation(60.0, 19.0));

        CompressedObservation o = IntervalMerger.merge(in, TEN_MIN).get(0);

        assertEquals(59.30, o.latitude(), 1e-12);
        assertEquals(18.10, o.longitude(), 1e-12);
    }

    @Test
    void eventsAreDisjointAndCoverEveryAcceptedDetection() {
        Random rnd = new Random(42);
        List<RawDetection> in = new ArrayList<>();
        long t = 0;
        for (int i = 0; i < 500; i++) {
            t += 1 + rnd.nextInt(900);
            in.add(moose(t, rnd.nextDouble()));
        }
        MergeSettings s = new MergeSettings(Duration.ofSeconds(300), 0.4, Duration.ofSeconds(5),
                Duration.ofSeconds(1200), 0.8);

        MergeResult r = IntervalMerger.mergeDetailed(in, s);

        Set<String> seen = new HashSet<>();
        Instant prevEnd = null;
        int frames = 0;
        for (CompressedObservation o : r.events()) {
            assertEquals(o.detectionTimeline().size(), o.frameCount());
            assertEquals(CompressedObservation.secondsBetween(o.startTime(), o.endTime()), o.durationSeconds(), 1e-9);
            double max = o.detectionTimeline().stream().mapToDouble(TimelineEntry::confidence).max().orElseThrow();
            assertEquals(max, o.maxConfidence(), 1e-12);
            if (prevEnd != null) {
                assertTrue(o.startTime().isAfter(prevEnd), "events overlap");
            }
            prevEnd = o.endTime();
            for (TimelineEntry e : o.detectionTimeline()) {
                assertTrue(seen.add(e.sourceId()), "duplicated " + e.sourceId());
            }
            frames += o.frameCount();
        }
        assertEquals(in.size(), frames + r.droppedLowConfidence() + r.droppedShortEventDetections());
    }
}
