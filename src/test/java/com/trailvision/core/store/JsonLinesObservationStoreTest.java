package com.trailvision.core.store;

import com.trailvision.core.detection.CompressedObservation;
import com.trailvision.core.detection.IntervalMerger;
import com.trailvision.core.detection.MergeSettings;
import com.trailvision.core.detection.RawDetection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesObservationStoreTest {

    private static final Instant T0 = Instant.parse("2024-06-01T10:00:00Z");

    @TempDir
    Path tmp;

    private static List<CompressedObservation> events(String cam, long offsetSec) {
        List<RawDetection> in = new ArrayList<>();
        in.add(RawDetection.image(cam + "/a.jpg", cam, T0.plusSeconds(offsetSec), "moose", 0.9).withLocation(59.30, 18.10));
        in.add(new RawDetection("clip_frame_000004.jpg", cam, T0.plusSeconds(offsetSec + 5), "moose", 0.7,
                null, true, null, null, null));
        return IntervalMerger.merge(in, MergeSettings.DEFAULTS);
    }

    @Test
    void appendWritesNumberedPartsAndReadsThemInOrder() {
        var store = new JsonLinesObservationStore(tmp.resolve("obs"));
        List<CompressedObservation> first = events("cam1", 0);
        List<CompressedObservation> second = List.of(events("cam2", 3600).get(0).withClusterId("cluster_007"));

        store.append(first);
        store.append(List.of());
        store.append(second);

        assertEquals(List.of("part-00001.jsonl", "part-00002.jsonl"),
                store.parts().stream().map(p -> p.getFileName().toString()).toList());
        try (Stream<CompressedObservation> s = store.read()) {
            List<CompressedObservation> all = s.toList();
            assertEquals(2, all.size());
            assertEquals(first.get(0), all.get(0));
            assertEquals(second.get(0), all.get(1));
        }
    }

    @Test
    void readingEmptyDirectoryGivesNothing() {
        var store = new JsonLinesObservationStore(tmp.resolve("empty"));
        try (Stream<CompressedObservation> s = store.read()) {
            assertEquals(0, s.count());
        }
    }

    @Test
    void corruptLineIsReported() throws Exception {
        Path dir = tmp.resolve("obs");
        var store = new JsonLinesObservationStore(dir);
        store.append(events("cam1", 0));
        Files.writeString(dir.resolve("part-00002.jsonl"), "{not json\n");

        try (Stream<CompressedObservation> s = store.read()) {
            BulkStoreException e = assertThrows(BulkStoreException.class, s::toList);
            assertTrue(e.getMessage().contains("part-00002.jsonl"));
        }
    }

    @Test
    void strayFilesAreIgnored() throws Exception {
        Path dir = tmp.resolve("obs");
        var store = new JsonLinesObservationStore(dir);
        Files.writeString(dir.resolve(".part-00001.jsonl.tmp"), "garbage");
        Files.writeString(dir.resolve("notes.txt"), "hello");

        store.append(events("cam1", 0));

        assertEquals(1, store.parts().size());
        try (Stream<CompressedObservation> s = store.read()) {
            assertEquals(1, s.count());
        }
    }

    @Test
    void concurrentWritersOnOneDirectoryKeepEveryPart() throws Exception {
        Path dir = tmp.resolve("obs");
        int writers = 4;
        int appends = 100;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                var store = new JsonLinesObservationStore(dir);
                String cam = "cam" + w;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < appends; i++) {
                        store.append(events(cam, i * 3600L));
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(60, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        var reader = new JsonLinesObservationStore(dir);
        assertEquals(writers * appends, reader.parts().size());
        try (Stream<CompressedObservation> s = reader.read()) {
            List<CompressedObservation> all = s.toList();
            assertEquals(writers * appends, all.size());
            assertEquals(writers * appends, all.stream().map(CompressedObservation::observationId).distinct().count());
        }
        try (Stream<Path> left = Files.list(dir)) {
            assertEquals(0, left.filter(p -> p.getFileName().toString().endsWith(".tmp")).count());
        }
    }

    @Test
    void partNamesUseAsciiDigitsUnderAnyLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("ar-EG"));
        try {
            var store = new JsonLinesObservationStore(tmp.resolve("obs"));
            store.append(events("cam1", 0));

            assertEquals("part-00001.jsonl", store.parts().get(0).getFileName().toString());
            try (Stream<CompressedObservation> s = store.read()) {
                assertEquals(1, s.count());
            }
        } finally {
            Locale.setDefault(saved);
        }
    }
}
