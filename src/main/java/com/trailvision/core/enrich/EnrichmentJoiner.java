package com.trailvision.core.enrich;

import com.trailvision.core.detection.CompressedObservation;
import com.trailvision.core.geo.Cluster;
import com.trailvision.core.geo.ClusterActivity;
import com.trailvision.core.geo.ClusterMetadataStore;
import com.trailvision.core.store.BulkObservationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Left outer join наблюдений с метаданными кластеров.
 * Метаданные снимаются один раз на вызов enrich(); bulk-сторона читается лениво.
 * Правка имени кластера видна при следующем вызове, bulk не пересчитывается.
 * Id влитых кластеров разрешаются в id выжившего.
 */
public final class EnrichmentJoiner {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentJoiner.class);

    private final ClusterMetadataStore metadata;

    public EnrichmentJoiner(ClusterMetadataStore metadata) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public Stream<EnrichedObservation> enrich(Stream<CompressedObservation> observations) {
        Map<String, Cluster> clusters = new HashMap<>();
        for (Cluster c : metadata.allClusters()) {
            clusters.put(c.clusterId(), c);
        }
        Map<String, ClusterActivity> activity = metadata.activity();
        Map<String, String> aliases = metadata.aliases();
        log.debug("Joiner: snapshot of {} clusters, {} aliases, {} activity rows",
                clusters.size(), aliases.size(), activity.size());
        return observations.map(o -> join(o, clusters, aliases, activity));
    }

    /** Поток держит файлы bulk-хранилища, закрывать через try-with-resources. */
    public Stream<EnrichedObservation> enrich(BulkObservationStore bulk) {
        return enrich(bulk.read());
    }

    public static Stream<EnrichedObservation> enrich(Stream<CompressedObservation> observations,
                                                     ClusterMetadataStore metadata) {
        return new EnrichmentJoiner(metadata).enrich(observations);
    }

    private static EnrichedObservation join(CompressedObservation o,
                                            Map<String, Cluster> clusters,
                                            Map<String, String> aliases,
                                            Map<String, ClusterActivity> activity) {
        if (o.clusterId() == null) {
            return EnrichedObservation.of(o, null, null);
        }
        // наблюдение могло ссылаться на кластер, позже влитый в другой
        String id = aliases.getOrDefault(o.clusterId(), o.clusterId());
        Cluster c = clusters.get(id);
        if (c == null) {
            // промах join'а — не ошибка
            log.trace("Joiner: no metadata for {} (observation {})", id, o.observationId());
        }
        return EnrichedObservation.of(o, id, c, activity.get(id));
    }
}
