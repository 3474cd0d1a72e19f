package com.trailvision.core.detection;

import com.trailvision.app.Config;

import java.time.Duration;
import java.util.Objects;

/**
 * Параметры склейки детекций в события.
 *
 * @param window            максимальный разрыв между соседними принятыми детекциями события
 * @param minConfidence     детекции ниже порога отбрасываются до склейки
 * @param minDuration       события короче отбрасываются
 * @param maxEventDuration  потолок длительности события от его начала; null — без потолка
 * @param reviewConfidence  maxConfidence ниже порога → needsReview
 */
public record MergeSettings(Duration window, double minConfidence, Duration minDuration,
                            Duration maxEventDuration, double reviewConfidence) {

    public static final MergeSettings DEFAULTS = new MergeSettings(
            Duration.ofMinutes(10), 0.5, Duration.ZERO, Duration.ofMinutes(10), 0.8);

    public MergeSettings {
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(minDuration, "minDuration");
        if (window.isNegative()) {
            throw new IllegalArgumentException("window must be non-negative");
        }
        if (minDuration.isNegative()) {
            throw new IllegalArgumentException("minDuration must be non-negative");
        }
        if (minConfidence < 0 || minConfidence > 1) {
            throw new IllegalArgumentException("minConfidence must be within [0,1]: " + minConfidence);
        }
        if (maxEventDuration != null && (maxEventDuration.isNegative() || maxEventDuration.isZero())) {
            maxEventDuration = null;
        }
    }

    /** Без потолка длительности, только правило разрыва. */
    public static MergeSettings gapOnly(Duration window, double minConfidence, Duration minDuration) {
        return new MergeSettings(window, minConfidence, minDuration, null, 0.8);
    }

    public static MergeSettings from(Config.CompressConf c) {
        return new MergeSettings(c.window(), c.minConfidence(), c.minDuration(),
                c.maxEventDuration(), c.reviewConfidence());
    }
}
