package com.trailvision.core.store;

import com.trailvision.core.detection.InvalidDetectionException;
import com.trailvision.core.detection.RawDetection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RawDetectionReaderTest {

    @TempDir
    Path tmp;

    private final RawDetectionReader reader = new RawDetectionReader();

    @Test
    void readsSnakeAndCamelCaseRows() throws Exception {
        String jsonl = """
                {"source_id":"cam1/IMG_0001.JPG","camera_id":"cam1","timestamp":"2024-06-01T10:00:00Z","species":"moose","confidence":0.92,"bbox":[0.1,0.2,0.4,0.6],"latitude":59.30,"longitude":18.10}

                {"sourceId":"clip_frame_000042.jpg","cameraId":"cam2","timestamp":"2024-06-01T10:00:05Z","species":"fox","confidence":0.6,"video":true}
                """;

        List<RawDetection> out = reader.read(new StringReader(jsonl), "mem");

        assertEquals(2, out.size());
        RawDetection a = out.get(0);
        assertEquals("cam1", a.cameraId());
        assertEquals(Instant.parse("2024-06-01T10:00:00Z"), a.timestamp());
        assertEquals(0.4, a.bbox().x2(), 1e-12);
        assertTrue(a.hasLocation());
        RawDetection b = out.get(1);
        assertTrue(b.video());
        assertEquals(Integer.valueOf(42), b.frameNumber());
        assertFalse(b.hasLocation());
    }

    @Test
    void missingTimestampRejectsWholeInputWithLineNumber() throws Exception {
        Path f = tmp.resolve("d.jsonl");
        Files.writeString(f, """
                {"source_id":"a","camera_id":"cam1","timestamp":"2024-06-01T10:00:00Z","species":"moose","confidence":0.9}
                {"source_id":"b","camera_id":"cam1","species":"moose","confidence":0.9}
                """);

        InvalidDetectionException e = assertThrows(InvalidDetectionException.class, () -> reader.read(f));
        assertTrue(e.getMessage().contains(":2:"), e.getMessage());
        assertTrue(e.getMessage().contains("timestamp"), e.getMessage());
    }

    @Test
    void outOfRangeValuesAreRejected() {
        String badConf = "{\"camera_id\":\"c\",\"timestamp\":\"2024-06-01T10:00:00Z\",\"species\":\"s\",\"confidence\":1.2}";
        String badLat = "{\"camera_id\":\"c\",\"timestamp\":\"2024-06-01T10:00:00Z\",\"species\":\"s\",\"confidence\":0.5,"
                + "\"latitude\":123.0,\"longitude\":18.0}";

        assertThrows(InvalidDetectionException.class, () -> reader.read(new StringReader(badConf), "mem"));
        assertThrows(InvalidDetectionException.class, () -> reader.read(new StringReader(badLat), "mem"));
    }

    @Test
    void malformedJsonIsRejected() {
        InvalidDetectionException e = assertThrows(InvalidDetectionException.class,
                () -> reader.read(new StringReader("{\"camera_id\":"), "mem"));
        assertTrue(e.getMessage().startsWith("mem:1:"));
    }
}
