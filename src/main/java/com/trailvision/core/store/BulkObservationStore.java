package com.trailvision.core.store;

import com.trailvision.core.detection.CompressedObservation;

import java.util.List;
import java.util.stream.Stream;

/**
 * Большое append-only хранилище наблюдений. Записанное не переписывается:
 * правки метаданных кластеров сюда не доходят, только повторный join.
 */
public interface BulkObservationStore {

    /** Дописать пачку наблюдений одной неизменяемой частью. Пустая пачка — no-op. */
    void append(List<CompressedObservation> observations);

    /**
     * Ленивое чтение всех наблюдений в порядке записи.
     * Поток держит файлы открытыми, закрывать через try-with-resources.
     */
    Stream<CompressedObservation> read();
}
