package com.trailvision.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trailvision.core.detection.BoundingBox;
import com.trailvision.core.detection.InvalidDetectionException;
import com.trailvision.core.detection.RawDetection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Читает детекции из JSON Lines. Одна строка — одна детекция:
 * <pre>
 * {"source_id":"cam1/IMG_0001.JPG","camera_id":"cam1","timestamp":"2024-06-01T10:00:00Z",
 *  "species":"moose","confidence":0.92,"bbox":[0.1,0.2,0.4,0.6],"is_video":false,
 *  "latitude":59.30,"longitude":18.10}
 * </pre>
 * Поля принимаются и в camelCase. Любая битая строка отклоняет весь вход с номером строки.
 */
public final class RawDetectionReader {
    private static final Logger log = LoggerFactory.getLogger(RawDetectionReader.class);

    private final ObjectMapper mapper = Json.mapper();

    public List<RawDetection> read(Path file) {
        try (BufferedReader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<RawDetection> out = read(r, file.toString());
            log.info("DetectionReader: {} detections from {}", out.size(), file);
            return out;
        } catch (IOException e) {
            throw new BulkStoreException("cannot read detections from " + file, e);
        }
    }

    public List<RawDetection> read(Reader in, String name) throws IOException {
        BufferedReader r = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        List<RawDetection> out = new ArrayList<>();
        String line;
        int no = 0;
        while ((line = r.readLine()) != null) {
            no++;
            if (line.isBlank()) continue;
            try {
                out.add(parse(mapper.readTree(line)));
            } catch (JsonProcessingException e) {
                throw new InvalidDetectionException(name + ":" + no + ": malformed JSON: " + e.getOriginalMessage());
            } catch (InvalidDetectionException e) {
                throw new InvalidDetectionException(name + ":" + no + ": " + e.getMessage());
            }
        }
        return out;
    }

    RawDetection parse(JsonNode n) {
        if (!n.isObject()) {
            throw new InvalidDetectionException("expected JSON object");
        }
        String sourceId = text(n, "source_id", "sourceId");
        String ts = text(n, "timestamp", "timestamp");
        if (ts == null) {
            throw new InvalidDetectionException("timestamp is missing, source=" + sourceId);
        }
        Instant timestamp;
        try {
            timestamp = Instant.parse(ts);
        } catch (DateTimeParseException e) {
            throw new InvalidDetectionException("bad timestamp '" + ts + "', source=" + sourceId);
        }
        JsonNode conf = field(n, "confidence", "confidence");
        if (conf == null || !conf.isNumber()) {
            throw new InvalidDetectionException("confidence is missing, source=" + sourceId);
        }
        JsonNode video = field(n, "is_video", "video");
        JsonNode frame = field(n, "frame_number", "frameNumber");
        return new RawDetection(
                sourceId,
                text(n, "camera_id", "cameraId"),
                timestamp,
                text(n, "species", "species"),
                conf.asDouble(),
                bbox(field(n, "bbox", "bbox")),
                video != null && video.asBoolean(false),
                frame != null && frame.canConvertToInt() ? frame.asInt() : null,
                number(n, "latitude"),
                number(n, "longitude"));
    }

    private static JsonNode field(JsonNode n, String snake, String camel) {
        JsonNode v = n.get(snake);
        if (v == null || v.isNull()) v = n.get(camel);
        return v == null || v.isNull() ? null : v;
    }

    private static String text(JsonNode n, String snake, String camel) {
        JsonNode v = field(n, snake, camel);
        return v == null ? null : v.asText();
    }

    private static Double number(JsonNode n, String name) {
        JsonNode v = field(n, name, name);
        if (v == null) return null;
        if (!v.isNumber()) {
            throw new InvalidDetectionException(name + " is not a number: " + v);
        }
        return v.asDouble();
    }

    // [x1, y1, x2, y2] или {"x1":..,"y1":..,"x2":..,"y2":..}
    private static BoundingBox bbox(JsonNode v) {
        if (v == null) return null;
        if (v.isArray() && v.size() == 4) {
            return new BoundingBox(v.get(0).asDouble(), v.get(1).asDouble(), v.get(2).asDouble(), v.get(3).asDouble());
        }
        if (v.isObject()) {
            return new BoundingBox(v.path("x1").asDouble(), v.path("y1").asDouble(),
                    v.path("x2").asDouble(), v.path("y2").asDouble());
        }
        throw new InvalidDetectionException("bbox must be [x1,y1,x2,y2], got " + v);
    }
}
