package com.trailvision.core.detection;

import java.util.List;

/**
 * Результат склейки одной группы: события + счётчики отброшенного.
 */
public record MergeResult(
        List<CompressedObservation> events,
        int inputDetections,
        int droppedLowConfidence,          // детекции ниже minConfidence
        int droppedShortEvents,            // события короче minDuration
        int droppedShortEventDetections    // детекции внутри отброшенных событий
) {
    public static final MergeResult EMPTY = new MergeResult(List.of(), 0, 0, 0, 0);

    public MergeResult {
        events = List.copyOf(events);
    }
}
