package com.trailvision.core.enrich;

import com.fasterxml.jackson.databind.JsonNode;
import com.trailvision.core.geo.Cluster;
import com.trailvision.core.geo.GeoPoint;
import com.trailvision.core.geo.InMemoryClusterMetadataStore;
import com.trailvision.core.store.Json;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClusterServiceTest {

    @TempDir
    Path tmp;

    private static InMemoryClusterMetadataStore store() {
        var s = new InMemoryClusterMetadataStore();
        s.batchUpsertLocations("cluster_001", List.of(new GeoPoint(59.30, 18.10), new GeoPoint(59.30, 18.10)));
        s.batchUpsertLocations("cluster_002", List.of(new GeoPoint(59.301, 18.10)));
        s.batchUpsertLocations("cluster_003", List.of(new GeoPoint(60.0, 18.0)));
        return s;
    }

    @Test
    void summaryCountsNamedAndPoints() {
        var store = store();
        var svc = new ClusterService(store);
        svc.name("cluster_001", "  Bäckdalen ", null);

        ClusterService.Summary s = svc.summary();

        assertEquals(3, s.totalClusters());
        assertEquals(1, s.namedClusters());
        assertEquals(2, s.unnamedClusters());
        assertEquals(4, s.totalPoints());
        assertEquals(4.0 / 3.0, s.avgPointsPerCluster(), 1e-9);
        assertEquals("Bäckdalen", store.get("cluster_001").orElseThrow().name());
    }

    @Test
    void blankNameIsRejectedAndMissingClusterReported() {
        var svc = new ClusterService(store());
        assertThrows(IllegalArgumentException.class, () -> svc.name("cluster_001", " ", null));
        assertFalse(svc.name("cluster_404", "x", null));
    }

    @Test
    void nearbyIsSortedByDistance() {
        var svc = new ClusterService(store());

        var near = svc.nearby(59.3009, 18.10, 500.0);

        assertEquals(2, near.size());
        assertEquals("cluster_002", near.get(0).cluster().clusterId());
        assertTrue(near.get(0).distanceMeters() < near.get(1).distanceMeters());
    }

    @Test
    void exportWritesAllClusters() throws Exception {
        var svc = new ClusterService(store());
        Path out = tmp.resolve("export/clusters.json");

        svc.exportJson(out);

        JsonNode arr = Json.mapper().readTree(out.toFile());
        assertEquals(3, arr.size());
        assertEquals("cluster_001", arr.get(0).get("clusterId").asText());
        assertEquals(2, arr.get(0).get("pointCount").asInt());
    }

    @Test
    void overlapsGroupCentroidsWithinThreshold() {
        var store = store();
        store.batchUpsertLocations("cluster_004", List.of(new GeoPoint(59.30003, 18.10)));
        var svc = new ClusterService(store);

        List<ClusterService.OverlapGroup> groups = svc.overlaps(ClusterService.DEFAULT_OVERLAP_METERS);

        assertEquals(1, groups.size());
        assertEquals(List.of("cluster_001", "cluster_004"), groups.get(0).clusterIds());
        assertEquals(3.34, groups.get(0).minDistanceMeters(), 0.05);

        List<ClusterService.OverlapGroup> wide = svc.overlaps(200.0);
        assertEquals(1, wide.size());
        assertEquals(List.of("cluster_001", "cluster_002", "cluster_004"), wide.get(0).clusterIds());
        assertThrows(IllegalArgumentException.class, () -> svc.overlaps(-1.0));
    }

    @Test
    void mergeKeepsLowestIdAndWeightsCentroidByPoints() {
        var store = store();
        var svc = new ClusterService(store);

        Cluster merged = svc.merge(List.of("cluster_002", "cluster_001"), " Ridge ", "salt lick");

        assertEquals("cluster_001", merged.clusterId());
        assertEquals("Ridge", merged.name());
        assertEquals("salt lick", merged.description());
        assertEquals(3, merged.pointCount());
        assertEquals((59.30 * 2 + 59.301) / 3, merged.meanLatitude(), 1e-9);
        assertEquals(merged, store.get("cluster_001").orElseThrow());
        assertTrue(store.get("cluster_002").isEmpty());
        assertEquals(Map.of("cluster_002", "cluster_001"), store.aliases());
        assertEquals(2, svc.summary().totalClusters());
    }

    @Test
    void mergeWithoutNameKeepsExistingName() {
        var store = store();
        var svc = new ClusterService(store);
        svc.name("cluster_003", "Fjället", null);

        Cluster merged = svc.merge(List.of("cluster_001", "cluster_003"), null, null);

        assertEquals("Fjället", merged.name());
        assertEquals("cluster_001", merged.clusterId());
    }

    @Test
    void mergeOfUnknownOrSingleClusterChangesNothing() {
        var store = store();
        var svc = new ClusterService(store);
        List<Cluster> before = store.allClusters();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> svc.merge(List.of("cluster_001", "cluster_404"), "x", null));
        assertTrue(e.getMessage().contains("cluster_404"));
        assertThrows(IllegalArgumentException.class, () -> svc.merge(List.of("cluster_001", "cluster_001"), "x", null));

        assertEquals(before, store.allClusters());
        assertTrue(store.aliases().isEmpty());
    }

    @Test
    void batchNameReportsMissingClusters() {
        var store = store();
        var svc = new ClusterService(store);
        Map<String, String> names = new LinkedHashMap<>();
        names.put("cluster_404", "Nowhere");
        names.put("cluster_002", " Myren ");

        Map<String, Boolean> result = svc.batchName(names);

        assertEquals(List.of("cluster_002", "cluster_404"), List.copyOf(result.keySet()));
        assertTrue(result.get("cluster_002"));
        assertFalse(result.get("cluster_404"));
        assertEquals("Myren", store.get("cluster_002").orElseThrow().name());
    }

    @Test
    void batchNameWithBlankNameWritesNothing() {
        var store = store();
        var svc = new ClusterService(store);
        Map<String, String> names = new LinkedHashMap<>();
        names.put("cluster_001", "Bäckdalen");
        names.put("cluster_002", "  ");

        assertThrows(IllegalArgumentException.class, () -> svc.batchName(names));
        assertNull(store.get("cluster_001").orElseThrow().name());
    }

    @Test
    void importReadsExportAndSkipsTakenIds() {
        var source = store();
        new ClusterService(source).name("cluster_003", "Fjället", "old clearcut");
        Path file = tmp.resolve("clusters.json");
        new ClusterService(source).exportJson(file);

        var target = new InMemoryClusterMetadataStore();
        target.batchUpsertLocations("cluster_001", List.of(new GeoPoint(10.0, 10.0)));
        var svc = new ClusterService(target);

        ClusterService.ImportResult r = svc.importJson(file);

        assertEquals(2, r.imported());
        assertEquals(1, r.skipped());
        assertEquals(10.0, target.get("cluster_001").orElseThrow().meanLatitude());
        assertEquals(source.get("cluster_002"), target.get("cluster_002"));
        assertEquals(source.get("cluster_003"), target.get("cluster_003"));

        assertEquals(new ClusterService.ImportResult(0, 3), svc.importJson(file));
    }

    @Test
    void importRejectsBrokenFileBeforeWriting() throws Exception {
        Path file = tmp.resolve("broken.json");
        Files.writeString(file, """
                [
                  {"clusterId":"cluster_001","meanLatitude":59.3,"meanLongitude":18.1,"pointCount":2},
                  {"clusterId":"cluster_002","meanLatitude":123.0,"meanLongitude":18.1,"pointCount":1}
                ]
                """);
        var target = new InMemoryClusterMetadataStore();

        assertThrows(IllegalArgumentException.class, () -> new ClusterService(target).importJson(file));
        assertTrue(target.allClusters().isEmpty());
    }
}
