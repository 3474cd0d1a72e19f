package com.trailvision.core.geo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Индекс поверх {@link ClusterMetadataStore}: стартует со снимка хранилища,
 * решения принимает в памяти, назначения копит по кластерам и пишет их
 * в {@link #flush()}, одна транзакция на кластер.
 * <p>
 * Рассчитан на один пишущий прогон на хранилище: новые id выдаются по снимку.
 * Если другой прогон успел занять тот же id, flush отказывает целиком и ничего
 * не пишет, вместо того чтобы слить две разные локации в один кластер.
 */
public class StoreBackedGeoClusterIndex implements GeoClusterIndex {
    private static final Logger log = LoggerFactory.getLogger(StoreBackedGeoClusterIndex.class);

    private final ClusterMetadataStore store;
    private final InMemoryGeoClusterIndex memory;
    private final Map<String, List<ClusterAssignment>> pending = new LinkedHashMap<>();
    private final Set<String> minted = new TreeSet<>(ClusterIds.ORDER);

    public StoreBackedGeoClusterIndex(ClusterMetadataStore store, int maxStoredLocations) {
        this.store = Objects.requireNonNull(store, "store");
        List<Cluster> snapshot = store.allClusters();
        this.memory = new InMemoryGeoClusterIndex(snapshot, store.aliases().keySet(), maxStoredLocations);
        log.info("GeoIndex: loaded {} clusters from metadata store", snapshot.size());
    }

    @Override
    public synchronized ClusterAssignment assign(String observationId, GeoPoint point, double radiusMeters) {
        ClusterAssignment a = memory.assign(observationId, point, radiusMeters);
        pending.computeIfAbsent(a.clusterId(), k -> new ArrayList<>()).add(a);
        if (a.created()) minted.add(a.clusterId());
        return a;
    }

    @Override
    public List<Cluster> clusters() {
        return memory.clusters();
    }

    @Override
    public List<NearbyCluster> nearby(GeoPoint point, double radiusMeters) {
        return memory.nearby(point, radiusMeters);
    }

    public synchronized int pendingAssignments() {
        int n = 0;
        for (List<ClusterAssignment> l : pending.values()) n += l.size();
        return n;
    }

    /**
     * Записать накопленные назначения. При ошибке кластер, на котором упали,
     * и все следующие остаются в pending; уже записанные батчи не повторяются.
     *
     * @return число записанных батчей (кластеров)
     * @throws MetadataStoreException если новый id уже занят в хранилище; ничего не записано
     */
    public synchronized int flush() {
        checkMintedIdsAreFree();
        int batches = 0;
        Iterator<Map.Entry<String, List<ClusterAssignment>>> it = pending.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, List<ClusterAssignment>> e = it.next();
            Cluster stored = store.batchUpsertAssignments(e.getKey(), e.getValue());
            log.debug("GeoIndex: flushed {} points to {} (count={})", e.getValue().size(), e.getKey(), stored.pointCount());
            it.remove();
            minted.remove(e.getKey());
            batches++;
        }
        if (batches > 0) {
            log.info("GeoIndex: flushed {} cluster batches", batches);
        }
        return batches;
    }

    private void checkMintedIdsAreFree() {
        if (minted.isEmpty()) return;
        Set<String> taken = new TreeSet<>(ClusterIds.ORDER);
        taken.addAll(minted);
        taken.removeAll(store.unknownClusters(minted));
        if (!taken.isEmpty()) {
            log.error("GeoIndex: new cluster ids {} already exist in metadata store, another run wrote them", taken);
            throw new MetadataStoreException("cluster id collision with a concurrent run: " + taken);
        }
    }
}
