package com.trailvision.core.detection;

import com.trailvision.core.geo.GeoPoint;

import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Одна детекция на кадре / фото от внешней стадии распознавания.
 * Неизменяемая; валидируется при создании.
 */
public record RawDetection(
        String sourceId,      // фото или кадр видео
        String cameraId,
        Instant timestamp,    // UTC
        String species,
        double confidence,    // 0..1
        BoundingBox bbox,
        boolean video,
        Integer frameNumber,  // null для фото; для кадров может вычисляться из sourceId
        Double latitude,
        Double longitude
) {

    // ".../clip_frame_000123.jpg"
    private static final Pattern FRAME_REF = Pattern.compile("_frame_(\\d+)");

    public RawDetection {
        if (cameraId == null || cameraId.isBlank()) {
            throw new InvalidDetectionException("cameraId is missing, source=" + sourceId);
        }
        if (species == null || species.isBlank()) {
            throw new InvalidDetectionException("species is missing, source=" + sourceId);
        }
        if (timestamp == null) {
            throw new InvalidDetectionException("timestamp is missing, source=" + sourceId);
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new InvalidDetectionException("confidence out of [0,1]: " + confidence + ", source=" + sourceId);
        }
        if ((latitude == null) != (longitude == null)) {
            throw new InvalidDetectionException("latitude/longitude must be both set or both empty, source=" + sourceId);
        }
        if (latitude != null && !GeoPoint.isValid(latitude, longitude)) {
            throw new InvalidDetectionException("coordinates out of range: (" + latitude + ", " + longitude + "), source=" + sourceId);
        }
        if (frameNumber == null && video) {
            frameNumber = frameNumberOf(sourceId);
        }
    }

    public static RawDetection image(String sourceId, String cameraId, Instant timestamp,
                                     String species, double confidence) {
        return new RawDetection(sourceId, cameraId, timestamp, species, confidence,
                null, false, null, null, null);
    }

    public RawDetection withLocation(double lat, double lon) {
        return new RawDetection(sourceId, cameraId, timestamp, species, confidence,
                bbox, video, frameNumber, lat, lon);
    }

    public boolean hasLocation() {
        return latitude != null;
    }

    /** Ссылка на исходное видео: "clip_frame_000123.jpg" → "clip". */
    static String videoRefOf(String sourceId) {
        if (sourceId == null) return null;
        int i = sourceId.lastIndexOf("_frame_");
        return i > 0 ? sourceId.substring(0, i) : sourceId;
    }

    /** Номер кадра из ссылки вида "clip_frame_000123.jpg", иначе null. */
    static Integer frameNumberOf(String sourceId) {
        if (sourceId == null) return null;
        Matcher m = FRAME_REF.matcher(sourceId);
        Integer last = null;
        while (m.find()) {
            try {
                last = Integer.parseInt(m.group(1));
            } catch (NumberFormatException ignore) {
                // слишком длинный номер, считаем, что номера нет
                last = null;
            }
        }
        return last;
    }
}
