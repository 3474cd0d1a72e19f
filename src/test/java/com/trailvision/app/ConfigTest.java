package com.trailvision.app;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void classpathConfigLoads() {
        Config cfg = Config.load();
        assertTrue(cfg.db().url().startsWith("jdbc:sqlite:"));
        assertEquals(Duration.ofMinutes(10), cfg.compress().window());
        assertEquals(5.0, cfg.cluster().radiusMeters());
    }

    @Test
    void emptyDocumentGivesDefaults() {
        Config cfg = Config.parse(yaml(""));

        assertEquals("jdbc:sqlite:./data/clusters.db", cfg.db().url());
        assertEquals("./data/observations", cfg.bulk().dir());
        assertEquals(0.5, cfg.compress().minConfidence());
        assertEquals(Duration.ZERO, cfg.compress().minDuration());
        assertEquals(Duration.ofMinutes(10), cfg.compress().maxEventDuration());
        assertFalse(cfg.compress().skipInvalidGroups());
        assertEquals(100, cfg.cluster().maxStoredLocations());
    }

    @Test
    void overridesAreApplied() {
        Config cfg = Config.parse(yaml("""
                db:
                  url: jdbc:postgresql://localhost:5432/trail
                  user: trail
                  pass: secret
                compress:
                  windowMinutes: 5
                  minDurationSeconds: 2.5
                  maxEventMinutes: 0
                  skipInvalidGroups: true
                cluster:
                  radiusMeters: 50
                """));

        assertEquals("trail", cfg.db().user());
        assertEquals(Duration.ofMinutes(5), cfg.compress().window());
        assertEquals(Duration.ofMillis(2500), cfg.compress().minDuration());
        assertNull(cfg.compress().maxEventDuration());
        assertTrue(cfg.compress().skipInvalidGroups());
        assertEquals(50.0, cfg.cluster().radiusMeters());
    }

    @Test
    void maxEventFollowsWindowWhenUnset() {
        Config cfg = Config.parse(yaml("compress:\n  windowMinutes: 3\n"));
        assertEquals(Duration.ofMinutes(3), cfg.compress().maxEventDuration());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Config.parse(yaml("compress:\n  minConfidence: 1.5\n")));
        assertThrows(IllegalArgumentException.class, () -> Config.parse(yaml("compress:\n  windowMinutes: 0\n")));
        assertThrows(IllegalArgumentException.class, () -> Config.parse(yaml("cluster:\n  radiusMeters: -1\n")));
    }
}
