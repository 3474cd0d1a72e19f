package com.trailvision.core.geo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Идентификаторы кластеров: "cluster_001", "cluster_002", ...
 */
public final class ClusterIds {

    public static final String PREFIX = "cluster_";

    /**
     * Сначала по длине, потом лексикографически: cluster_999 < cluster_1000.
     * Используется как правило разрешения ничьих (меньший id выигрывает).
     */
    public static final Comparator<String> ORDER =
            Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder());

    private ClusterIds() {
        // no-op
    }

    public static String format(long n) {
        return String.format(Locale.ROOT, "%s%03d", PREFIX, n);
    }

    /** Следующий id после максимального числового суффикса среди existing. */
    public static String next(Collection<String> existing) {
        long max = 0;
        for (String id : existing) {
            max = Math.max(max, numberOf(id));
        }
        return format(max + 1);
    }

    /**
     * Различные id слияния в порядке ORDER; первый выживает.
     *
     * @throws IllegalArgumentException меньше двух различных id
     */
    public static List<String> mergeOrder(Collection<String> ids) {
        TreeSet<String> sorted = new TreeSet<>(ORDER);
        for (String id : ids) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("blank cluster id in merge list");
            }
            sorted.add(id.trim());
        }
        if (sorted.size() < 2) {
            throw new IllegalArgumentException("merge needs at least two distinct clusters, got " + sorted);
        }
        return new ArrayList<>(sorted);
    }

    /** Числовой суффикс id или 0, если id не в формате cluster_NNN. */
    static long numberOf(String id) {
        if (id == null || !id.startsWith(PREFIX) || id.length() == PREFIX.length()) return 0;
        String tail = id.substring(PREFIX.length());
        for (int i = 0; i < tail.length(); i++) {
            char c = tail.charAt(i);
            if (c < '0' || c > '9') return 0;
        }
        try {
            return Long.parseLong(tail);
        } catch (NumberFormatException ignore) {
            return 0;
        }
    }
}
