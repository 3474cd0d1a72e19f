package com.trailvision.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trailvision.core.detection.CompressedObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Bulk-хранилище: каталог неизменяемых частей part-00001.jsonl, part-00002.jsonl, ...
 * Часть пишется в уникальный временный файл и публикуется жёсткой ссылкой под
 * свободным номером: читатель никогда не видит недописанную часть, а параллельные
 * писатели в один каталог не затирают друг друга.
 */
public final class JsonLinesObservationStore implements BulkObservationStore {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesObservationStore.class);

    private static final Pattern PART = Pattern.compile("part-([0-9]+)\\.jsonl");
    private static final int MAX_COMMIT_ATTEMPTS = 1000;

    private final Path dir;
    private final ObjectMapper mapper = Json.mapper();

    public JsonLinesObservationStore(Path dir) {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new BulkStoreException("cannot create bulk dir " + dir, e);
        }
    }

    public Path dir() {
        return dir;
    }

    @Override
    public synchronized void append(List<CompressedObservation> observations) {
        if (observations.isEmpty()) return;
        Path tmp = null;
        Path target = null;
        try {
            tmp = Files.createTempFile(dir, ".part-", ".tmp");
            try (BufferedWriter w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                for (CompressedObservation o : observations) {
                    w.write(mapper.writeValueAsString(o));
                    w.newLine();
                }
            }
            target = commit(tmp);
        } catch (IOException e) {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw new BulkStoreException("append failed in " + dir, e);
        }
        log.info("BulkStore: wrote {} observations to {}", observations.size(), target);
    }

    /**
     * Публикует готовый временный файл под следующим свободным номером.
     * Жёсткая ссылка не заменяет существующую часть: при гонке с другим
     * писателем (другой процесс или экземпляр) берётся следующий номер.
     */
    private Path commit(Path tmp) throws IOException {
        int next = nextPartNumber();
        for (int attempt = 0; attempt < MAX_COMMIT_ATTEMPTS; attempt++) {
            Path target = dir.resolve(partName(next));
            try {
                publish(tmp, target);
                return target;
            } catch (FileAlreadyExistsException e) {
                log.debug("BulkStore: {} already taken, retrying", target.getFileName());
                next = Math.max(next + 1, nextPartNumber());
            }
        }
        throw new IOException("no free part number in " + dir + " after " + MAX_COMMIT_ATTEMPTS + " attempts");
    }

    // move без REPLACE_EXISTING тоже отказывает на занятом имени, если ФС не умеет жёсткие ссылки
    private static void publish(Path tmp, Path target) throws IOException {
        try {
            Files.createLink(target, tmp);
        } catch (UnsupportedOperationException e) {
            Files.move(tmp, target);
            return;
        }
        Files.delete(tmp);
    }

    private int nextPartNumber() {
        int next = 1;
        for (Path p : parts()) {
            next = Math.max(next, partNumber(p) + 1);
        }
        return next;
    }

    static String partName(int n) {
        return String.format(Locale.ROOT, "part-%05d.jsonl", n);
    }

    @Override
    public Stream<CompressedObservation> read() {
        return parts().stream().flatMap(this::readPart);
    }

    /** Части в порядке номеров. */
    public List<Path> parts() {
        List<Path> out = new ArrayList<>();
        try (Stream<Path> s = Files.list(dir)) {
            s.filter(p -> PART.matcher(p.getFileName().toString()).matches()).forEach(out::add);
        } catch (IOException e) {
            throw new BulkStoreException("cannot list " + dir, e);
        }
        out.sort((a, b) -> Integer.compare(partNumber(a), partNumber(b)));
        return out;
    }

    private Stream<CompressedObservation> readPart(Path part) {
        Stream<String> lines;
        try {
            lines = Files.lines(part, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BulkStoreException("cannot open " + part, e);
        }
        return lines.filter(l -> !l.isBlank()).map(l -> parse(part, l));
    }

    private CompressedObservation parse(Path part, String line) {
        try {
            return mapper.readValue(line, CompressedObservation.class);
        } catch (JsonProcessingException e) {
            throw new BulkStoreException("corrupt line in " + part, e);
        }
    }

    private static int partNumber(Path p) {
        Matcher m = PART.matcher(p.getFileName().toString());
        return m.matches() ? Integer.parseInt(m.group(1)) : 0;
    }
}
