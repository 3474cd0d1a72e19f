package com.trailvision.core.enrich;

import com.trailvision.core.detection.CompressedObservation;
import com.trailvision.core.geo.ClusterActivity;
import com.trailvision.core.geo.ClusterIds;
import com.trailvision.core.geo.ClusterMetadataStore;
import com.trailvision.core.store.BulkObservationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Пересчитывает кэш активности кластеров (наблюдения, число видов, первое/последнее появление)
 * одним проходом по bulk-хранилищу и целиком заменяет его в хранилище метаданных.
 * Наблюдения влитых кластеров считаются за выживший кластер.
 */
public final class ClusterActivityRefresher {
    private static final Logger log = LoggerFactory.getLogger(ClusterActivityRefresher.class);

    private final BulkObservationStore bulk;
    private final ClusterMetadataStore metadata;

    public ClusterActivityRefresher(BulkObservationStore bulk, ClusterMetadataStore metadata) {
        this.bulk = bulk;
        this.metadata = metadata;
    }

    public List<ClusterActivity> refresh() {
        Map<String, Acc> acc = new TreeMap<>(ClusterIds.ORDER);
        Map<String, String> aliases = metadata.aliases();
        try (Stream<CompressedObservation> s = bulk.read()) {
            s.filter(o -> o.clusterId() != null)
                    .forEach(o -> acc.computeIfAbsent(aliases.getOrDefault(o.clusterId(), o.clusterId()), k -> new Acc())
                            .add(o));
        }
        List<ClusterActivity> rows = new ArrayList<>(acc.size());
        acc.forEach((id, a) -> rows.add(new ClusterActivity(id, a.count, a.species.size(), a.first, a.last)));
        metadata.replaceActivity(rows);
        log.info("ActivityRefresher: {} clusters refreshed", rows.size());
        return rows;
    }

    private static final class Acc {
        long count;
        final Set<String> species = new HashSet<>();
        Instant first;
        Instant last;

        void add(CompressedObservation o) {
            count++;
            species.add(o.species());
            if (first == null || o.startTime().isBefore(first)) first = o.startTime();
            if (last == null || o.endTime().isAfter(last)) last = o.endTime();
        }
    }
}
