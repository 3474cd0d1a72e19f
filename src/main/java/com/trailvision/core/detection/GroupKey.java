package com.trailvision.core.detection;

import java.util.Comparator;
import java.util.Objects;

/**
 * Ключ группировки детекций: камера + вид.
 */
public record GroupKey(String cameraId, String species) implements Comparable<GroupKey> {

    private static final Comparator<GroupKey> ORDER =
            Comparator.comparing(GroupKey::cameraId).thenComparing(GroupKey::species);

    public GroupKey {
        Objects.requireNonNull(cameraId, "cameraId");
        Objects.requireNonNull(species, "species");
    }

    public static GroupKey of(RawDetection d) {
        return new GroupKey(d.cameraId(), d.species());
    }

    @Override
    public int compareTo(GroupKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return cameraId + "/" + species;
    }
}
