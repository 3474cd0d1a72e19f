package com.trailvision.core.store;

import com.trailvision.core.detection.CompressedObservation;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

public class InMemoryObservationStore implements BulkObservationStore {

    private final List<List<CompressedObservation>> parts = new ArrayList<>();

    @Override
    public synchronized void append(List<CompressedObservation> observations) {
        if (observations.isEmpty()) return;
        parts.add(List.copyOf(observations));
    }

    @Override
    public synchronized Stream<CompressedObservation> read() {
        return List.copyOf(parts).stream().flatMap(List::stream);
    }

    public synchronized int partCount() {
        return parts.size();
    }
}
