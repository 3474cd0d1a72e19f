package com.trailvision.core.geo;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StoreBackedGeoClusterIndexTest {

    @Test
    void assignmentsReachStoreOnlyOnFlush() {
        var store = new InMemoryClusterMetadataStore();
        var index = new StoreBackedGeoClusterIndex(store, 100);

        index.assign("o1", 59.30, 18.10, 50.0);
        index.assign("o2", 59.3001, 18.1001, 50.0);
        index.assign("o3", 60.0, 18.0, 50.0);

        assertTrue(store.allClusters().isEmpty());
        assertEquals(3, index.pendingAssignments());

        assertEquals(2, index.flush());
        assertEquals(0, index.pendingAssignments());

        Cluster c = store.get("cluster_001").orElseThrow();
        assertEquals(2, c.pointCount());
        assertEquals(index.clusters().get(0), c);
        assertEquals(List.of("o1", "o2"),
                store.assignments("cluster_001").stream().map(ClusterAssignment::observationId).toList());
    }

    @Test
    void continuesFromStoredClusters() {
        var store = new InMemoryClusterMetadataStore();
        store.batchUpsertLocations("cluster_001", List.of(new GeoPoint(59.30, 18.10)));
        store.upsertName("cluster_001", "Bäckdalen");

        var index = new StoreBackedGeoClusterIndex(store, 100);
        ClusterAssignment a = index.assign("o1", 59.30001, 18.10001, 5.0);
        ClusterAssignment b = index.assign("o2", 10.0, 10.0, 5.0);
        index.flush();

        assertEquals("cluster_001", a.clusterId());
        assertEquals("cluster_002", b.clusterId());
        Cluster named = store.get("cluster_001").orElseThrow();
        assertEquals("Bäckdalen", named.name());
        assertEquals(2, named.pointCount());
    }

    @Test
    void failedBatchStaysPending() {
        var store = new InMemoryClusterMetadataStore() {
            @Override
            public synchronized Cluster batchUpsertAssignments(String clusterId, List<ClusterAssignment> batch) {
                if (clusterId.equals("cluster_002")) throw new MetadataStoreException("disk full");
                return super.batchUpsertAssignments(clusterId, batch);
            }
        };
        var index = new StoreBackedGeoClusterIndex(store, 100);
        index.assign("o1", 1.0, 1.0, 5.0);
        index.assign("o2", 2.0, 2.0, 5.0);

        assertThrows(MetadataStoreException.class, index::flush);
        assertTrue(store.get("cluster_001").isPresent());
        assertTrue(store.get("cluster_002").isEmpty());
        assertEquals(1, index.pendingAssignments());
    }

    @Test
    void idTakenByAnotherRunFailsFlushWithoutWriting() {
        var store = new InMemoryClusterMetadataStore();
        var first = new StoreBackedGeoClusterIndex(store, 100);
        var second = new StoreBackedGeoClusterIndex(store, 100);

        assertEquals("cluster_001", first.assign("a1", 59.30, 18.10, 50.0).clusterId());
        assertEquals("cluster_001", second.assign("b1", 61.00, 15.00, 50.0).clusterId());
        assertEquals(1, first.flush());

        MetadataStoreException e = assertThrows(MetadataStoreException.class, second::flush);
        assertTrue(e.getMessage().contains("cluster_001"));

        Cluster c = store.get("cluster_001").orElseThrow();
        assertEquals(1, c.pointCount());
        assertEquals(59.30, c.meanLatitude(), 1e-9);
        assertEquals(List.of("a1"),
                store.assignments("cluster_001").stream().map(ClusterAssignment::observationId).toList());
        assertEquals(1, second.pendingAssignments());
    }

    @Test
    void retriedFlushDoesNotTripOverOwnClusters() {
        var store = new InMemoryClusterMetadataStore() {
            private boolean failed;

            @Override
            public synchronized Cluster batchUpsertAssignments(String clusterId, List<ClusterAssignment> batch) {
                if (clusterId.equals("cluster_002") && !failed) {
                    failed = true;
                    throw new MetadataStoreException("locked");
                }
                return super.batchUpsertAssignments(clusterId, batch);
            }
        };
        var index = new StoreBackedGeoClusterIndex(store, 100);
        index.assign("o1", 1.0, 1.0, 5.0);
        index.assign("o2", 2.0, 2.0, 5.0);

        assertThrows(MetadataStoreException.class, index::flush);
        assertEquals(1, index.flush());
        assertEquals(2, store.allClusters().size());
    }

    @Test
    void idsOfMergedClustersAreNotHandedOutAgain() {
        var store = new InMemoryClusterMetadataStore();
        store.batchUpsertLocations("cluster_001", List.of(new GeoPoint(59.30, 18.10)));
        store.batchUpsertLocations("cluster_002", List.of(new GeoPoint(59.30002, 18.10)));
        store.mergeClusters(List.of("cluster_001", "cluster_002"), null, null);

        var index = new StoreBackedGeoClusterIndex(store, 100);
        ClusterAssignment a = index.assign("o1", 61.0, 15.0, 50.0);
        index.flush();

        assertEquals("cluster_003", a.clusterId());
        assertEquals(List.of("cluster_001", "cluster_003"),
                store.allClusters().stream().map(Cluster::clusterId).toList());
    }
}
