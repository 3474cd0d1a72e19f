package com.trailvision.core.geo;

import java.time.Instant;

/**
 * Кэшированная производная статистика по кластеру (считается из bulk-данных,
 * хранится рядом с метаданными, чтобы отчёты не сканировали bulk заново).
 */
public record ClusterActivity(
        String clusterId,
        long observationCount,
        int speciesCount,
        Instant firstSeen,
        Instant lastSeen
) {
}
