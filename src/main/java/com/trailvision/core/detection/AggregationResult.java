package com.trailvision.core.detection;

import java.util.List;

public record AggregationResult(List<CompressedObservation> events, AggregationReport report) {

    public AggregationResult {
        events = List.copyOf(events);
    }
}
