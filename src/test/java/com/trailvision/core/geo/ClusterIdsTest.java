package com.trailvision.core.geo;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ClusterIdsTest {

    @Test
    void formatPadsToThreeDigits() {
        assertEquals("cluster_007", ClusterIds.format(7));
        assertEquals("cluster_1000", ClusterIds.format(1000));
    }

    @Test
    void nextIgnoresForeignIds() {
        assertEquals("cluster_001", ClusterIds.next(List.of()));
        assertEquals("cluster_013", ClusterIds.next(List.of("cluster_002", "cluster_012", "home", "cluster_x")));
    }

    @Test
    void orderIsLengthThenLexicographic() {
        List<String> ids = new ArrayList<>(List.of("cluster_1000", "cluster_999", "cluster_010", "cluster_002"));
        ids.sort(ClusterIds.ORDER);
        assertEquals(List.of("cluster_002", "cluster_010", "cluster_999", "cluster_1000"), ids);
    }

    @Test
    void idsStayAsciiUnderLocaleWithNativeDigits() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("ar-EG"));
        try {
            assertEquals("cluster_001", ClusterIds.format(1));
            assertEquals("cluster_004", ClusterIds.next(List.of("cluster_003")));
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void nonAsciiDigitsAreNotClusterNumbers() {
        assertEquals(0, ClusterIds.numberOf("cluster_\u0661\u0662"));
        assertEquals("cluster_001", ClusterIds.next(List.of("cluster_\u0661\u0662")));
    }

    @Test
    void mergeOrderPutsSurvivorFirst() {
        assertEquals(List.of("cluster_002", "cluster_010", "cluster_1000"),
                ClusterIds.mergeOrder(List.of("cluster_1000", " cluster_010", "cluster_002", "cluster_010")));
        assertThrows(IllegalArgumentException.class, () -> ClusterIds.mergeOrder(List.of("cluster_001")));
        assertThrows(IllegalArgumentException.class, () -> ClusterIds.mergeOrder(List.of("cluster_001", " ")));
    }
}
