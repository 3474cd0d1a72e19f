package com.trailvision.core.detection;

import java.time.Instant;

/**
 * Один кадр в истории события (provenance).
 */
public record TimelineEntry(
        Instant timestamp,
        double confidence,
        String sourceId,
        Integer frameNumber  // null для фото
) {
}
