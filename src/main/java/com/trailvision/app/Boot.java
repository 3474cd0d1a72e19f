package com.trailvision.app;

import com.trailvision.core.db.JdbcClusterMetadataStore;
import com.trailvision.core.db.MetadataDb;
import com.trailvision.core.detection.CompressedObservation;
import com.trailvision.core.detection.MergeSettings;
import com.trailvision.core.detection.ObservationAggregator;
import com.trailvision.core.detection.RawDetection;
import com.trailvision.core.enrich.ClusterActivityRefresher;
import com.trailvision.core.enrich.ClusterService;
import com.trailvision.core.enrich.EnrichedObservation;
import com.trailvision.core.enrich.ObservationReportService;
import com.trailvision.core.geo.Cluster;
import com.trailvision.core.geo.ClusterMetadataStore;
import com.trailvision.core.geo.GeoClusterIndex.NearbyCluster;
import com.trailvision.core.pipeline.ObservationPipeline;
import com.trailvision.core.store.BulkObservationStore;
import com.trailvision.core.store.JsonLinesObservationStore;
import com.trailvision.core.store.RawDetectionReader;
import com.trailvision.ui.ObservationRowFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Точка входа: trail-vision &lt;command&gt; [--key=value ...]
 * <pre>
 * compress         --input=detections.jsonl [--window=10] [--min-confidence=0.5] [--min-duration=0] [--radius=5]
 * report           [--csv=out.csv] [--json=out.json]
 * clusters         [--near=lat,lon] [--radius=100]
 * unknown
 * name             --cluster=cluster_001 --name=... [--description=...]
 * name-batch       --file=names.json            ({"cluster_001": "...", ...})
 * overlaps         [--threshold=10]
 * merge            --clusters=cluster_001,cluster_004 [--name=...] [--description=...]
 * refresh-activity
 * export-clusters  --out=clusters.json
 * import-clusters  --in=clusters.json
 * </pre>
 * Общий параметр --config=path подменяет classpath:application.yaml.
 */
public final class Boot {
    private static final Logger log = LoggerFactory.getLogger(Boot.class);

    private Boot() {
        // no-op
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        if (args.length == 0) {
            out.println(usage());
            return 2;
        }
        String command = args[0];
        Map<String, String> a = parseArgs(args);
        Config cfg;
        try {
            cfg = a.containsKey("config") ? Config.load(Path.of(a.get("config"))) : Config.load();
        } catch (RuntimeException e) {
            log.error("Boot: config failed: {}", e.getMessage());
            return 1;
        }

        try (MetadataDb db = MetadataDb.open(cfg.db())) {
            ClusterMetadataStore metadata = new JdbcClusterMetadataStore(db, cfg.cluster().maxStoredLocations());
            BulkObservationStore bulk = new JsonLinesObservationStore(Path.of(cfg.bulk().dir()));
            return switch (command) {
                case "compress" -> compress(cfg, a, metadata, bulk, out);
                case "report" -> report(a, metadata, bulk, out);
                case "clusters" -> clusters(a, metadata, out);
                case "unknown" -> unknown(metadata, bulk, out);
                case "name" -> name(a, metadata, out);
                case "name-batch" -> nameBatch(a, metadata, out);
                case "overlaps" -> overlaps(a, metadata, out);
                case "merge" -> merge(a, metadata, out);
                case "refresh-activity" -> {
                    int n = new ClusterActivityRefresher(bulk, metadata).refresh().size();
                    out.println("Activity refreshed for " + n + " clusters");
                    yield 0;
                }
                case "export-clusters" -> {
                    new ClusterService(metadata).exportJson(Path.of(req(a, "out")));
                    yield 0;
                }
                case "import-clusters" -> {
                    ClusterService.ImportResult r = new ClusterService(metadata).importJson(Path.of(req(a, "in")));
                    out.println("Imported " + r.imported() + " clusters, skipped " + r.skipped());
                    yield 0;
                }
                default -> {
                    out.println("unknown command: " + command);
                    out.println(usage());
                    yield 2;
                }
            };
        } catch (IllegalArgumentException e) {
            log.error("Boot: {}: {}", command, e.getMessage());
            return 2;
        } catch (RuntimeException e) {
            log.error("Boot: {} failed", command, e);
            return 1;
        }
    }

    private static int compress(Config cfg, Map<String, String> a, ClusterMetadataStore metadata,
                                BulkObservationStore bulk, PrintStream out) {
        Config.CompressConf c = cfg.compress();
        Config.CompressConf eff = new Config.CompressConf(
                a.containsKey("window") ? Integer.parseInt(a.get("window")) : c.windowMinutes(),
                a.containsKey("min-confidence") ? Double.parseDouble(a.get("min-confidence")) : c.minConfidence(),
                a.containsKey("min-duration") ? Double.parseDouble(a.get("min-duration")) : c.minDurationSeconds(),
                a.containsKey("max-event") ? Integer.parseInt(a.get("max-event"))
                        : a.containsKey("window") ? Integer.parseInt(a.get("window")) : c.maxEventMinutes(),
                c.reviewConfidence(),
                c.workers(),
                a.containsKey("skip-invalid") ? Boolean.parseBoolean(a.get("skip-invalid")) : c.skipInvalidGroups());
        double radius = a.containsKey("radius") ? Double.parseDouble(a.get("radius")) : cfg.cluster().radiusMeters();

        List<RawDetection> detections = new RawDetectionReader().read(Path.of(req(a, "input")));
        try (ObservationAggregator agg = new ObservationAggregator(MergeSettings.from(eff), eff.workers(), eff.skipInvalidGroups())) {
            var pipeline = new ObservationPipeline(agg, metadata, bulk, radius, cfg.cluster().maxStoredLocations());
            var result = pipeline.run(detections);
            out.printf(Locale.ROOT, "Detections: %d -> observations: %d (ratio %.1fx), new clusters: %d%n",
                    result.report().rawDetections(), result.observations().size(),
                    result.report().compressionRatio(), result.clustersCreated());
            result.report().speciesSummary().forEach((sp, s) ->
                    out.printf(Locale.ROOT, "  %-20s %4d events, %.0fs total%n", sp, s.count(), s.totalDurationSeconds()));
            if (!result.report().failedGroups().isEmpty()) {
                out.println("Skipped groups: " + result.report().failedGroups());
            }
        }
        return 0;
    }

    private static int report(Map<String, String> a, ClusterMetadataStore metadata,
                              BulkObservationStore bulk, PrintStream out) {
        ObservationReportService svc = new ObservationReportService(bulk, metadata);
        ObservationReportService.Report r = svc.build();
        boolean written = false;
        if (a.containsKey("csv")) {
            svc.writeCsv(r.rows(), Path.of(a.get("csv")));
            written = true;
        }
        if (a.containsKey("json")) {
            svc.writeJson(r, Path.of(a.get("json")));
            written = true;
        }
        if (!written) {
            for (EnrichedObservation row : r.rows()) {
                out.println(ObservationRowFormat.formatObservationRow(row));
            }
        }
        out.printf(Locale.ROOT, "Observations: %d, species: %d, cameras: %d%n",
                r.summary().totalObservations(), r.summary().speciesSummary().size(), r.summary().cameraSummary().size());
        return 0;
    }

    private static int clusters(Map<String, String> a, ClusterMetadataStore metadata, PrintStream out) {
        ClusterService svc = new ClusterService(metadata);
        if (a.containsKey("near")) {
            String[] p = a.get("near").split(",", -1);
            if (p.length != 2) throw new IllegalArgumentException("--near must be lat,lon");
            double radius = Double.parseDouble(a.getOrDefault("radius", "100"));
            List<NearbyCluster> near = svc.nearby(Double.parseDouble(p[0].trim()), Double.parseDouble(p[1].trim()), radius);
            for (NearbyCluster n : near) {
                out.printf(Locale.ROOT, "%s | %.1f m%n", ObservationRowFormat.formatClusterRow(n.cluster()), n.distanceMeters());
            }
            return 0;
        }
        ClusterService.Summary s = svc.summary();
        out.printf(Locale.ROOT, "Clusters: %d (named %d, unnamed %d), points: %d, avg %.1f per cluster%n",
                s.totalClusters(), s.namedClusters(), s.unnamedClusters(), s.totalPoints(), s.avgPointsPerCluster());
        for (Cluster c : metadata.allClusters()) {
            out.println(ObservationRowFormat.formatClusterRow(c));
        }
        return 0;
    }

    /** Кластеры, на которые ссылается bulk, но которых нет в метаданных. */
    private static int unknown(ClusterMetadataStore metadata, BulkObservationStore bulk, PrintStream out) {
        Set<String> referenced = new TreeSet<>();
        try (Stream<CompressedObservation> s = bulk.read()) {
            s.map(CompressedObservation::clusterId).filter(id -> id != null).forEach(referenced::add);
        }
        Set<String> unknown = metadata.unknownClusters(referenced);
        out.println("Referenced clusters: " + referenced.size() + ", unknown: " + unknown.size());
        unknown.forEach(out::println);
        for (Cluster c : metadata.unnamedClusters()) {
            out.println(ObservationRowFormat.formatClusterRow(c));
        }
        return 0;
    }

    private static int name(Map<String, String> a, ClusterMetadataStore metadata, PrintStream out) {
        String id = req(a, "cluster");
        boolean ok = new ClusterService(metadata).name(id, req(a, "name"), a.get("description"));
        out.println(ok ? "Named " + id : "No such cluster: " + id);
        return ok ? 0 : 1;
    }

    private static int nameBatch(Map<String, String> a, ClusterMetadataStore metadata, PrintStream out) {
        Map<String, Boolean> result = new ClusterService(metadata).batchName(Path.of(req(a, "file")));
        int missing = 0;
        for (Map.Entry<String, Boolean> e : result.entrySet()) {
            if (!e.getValue()) {
                out.println("No such cluster: " + e.getKey());
                missing++;
            }
        }
        out.println("Named " + (result.size() - missing) + " of " + result.size() + " clusters");
        return missing == 0 ? 0 : 1;
    }

    private static int overlaps(Map<String, String> a, ClusterMetadataStore metadata, PrintStream out) {
        double threshold = a.containsKey("threshold")
                ? Double.parseDouble(a.get("threshold"))
                : ClusterService.DEFAULT_OVERLAP_METERS;
        List<ClusterService.OverlapGroup> groups = new ClusterService(metadata).overlaps(threshold);
        out.printf(Locale.ROOT, "Overlapping groups within %.1f m: %d%n", threshold, groups.size());
        for (ClusterService.OverlapGroup g : groups) {
            out.printf(Locale.ROOT, "%s (closest %.1f m)%n", String.join(",", g.clusterIds()), g.minDistanceMeters());
        }
        return 0;
    }

    private static int merge(Map<String, String> a, ClusterMetadataStore metadata, PrintStream out) {
        List<String> ids = List.of(req(a, "clusters").split(","));
        Cluster merged = new ClusterService(metadata).merge(ids, a.get("name"), a.get("description"));
        out.println("Merged into " + merged.clusterId());
        out.println(ObservationRowFormat.formatClusterRow(merged));
        return 0;
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new HashMap<>();
        for (String s : args) {
            int i = s.indexOf('=');
            if (i > 0) m.put(s.substring(0, i).replaceFirst("^--", ""), s.substring(i + 1));
        }
        return m;
    }

    static String req(Map<String, String> a, String k) {
        String v = a.get(k);
        if (v == null || v.isBlank()) throw new IllegalArgumentException("missing --" + k);
        return v;
    }

    static String usage() {
        return "usage: trail-vision <compress|report|clusters|unknown|name|name-batch|overlaps|merge"
                + "|refresh-activity|export-clusters|import-clusters>"
                + " [--config=path] [--key=value ...]";
    }
}
