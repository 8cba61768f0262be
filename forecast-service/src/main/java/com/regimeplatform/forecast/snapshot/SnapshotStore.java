package com.regimeplatform.forecast.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.regimeplatform.common.exception.ValidationException;
import com.regimeplatform.common.snapshot.ServiceSnapshot;
import com.regimeplatform.common.state.ForecastStateManager;
import com.regimeplatform.forecast.config.ForecastProperties;
import com.regimeplatform.forecast.exception.SnapshotNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File-backed persistence of {@link ServiceSnapshot}s.
 *
 * <p>Each save writes {@code snapshot-yyyyMMdd-HHmmss-SSS.json} and refreshes {@code latest.json},
 * both through a temp file and a move. A save never reuses an existing name: the stamp moves
 * forward a millisecond at a time until it is free. Only the newest {@code stateKeep} timestamped files are
 * kept. Startup restore and shutdown save are best effort: failures are logged, never rethrown.
 */
@Component
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    static final String LATEST = "latest.json";
    // second-resolution names from older saves stay listable and restorable
    private static final Pattern SNAPSHOT_NAME = Pattern.compile("snapshot-\\d{8}-\\d{6}(-\\d{3})?\\.json");
    private static final DateTimeFormatter STAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS").withZone(ZoneOffset.UTC);

    private final ForecastStateManager stateManager;
    private final ObjectMapper objectMapper;
    private final ForecastProperties.Service settings;
    private final Path stateDir;

    public SnapshotStore(ForecastStateManager stateManager, ObjectMapper objectMapper, ForecastProperties properties) {
        this.stateManager = stateManager;
        this.objectMapper = objectMapper;
        this.settings     = properties.getService();
        this.stateDir     = Paths.get(settings.getStateDir());
    }

    @PostConstruct
    public void restoreOnStartup() {
        if (!settings.isRestoreOnStartup()) {
            return;
        }
        if (!Files.exists(stateDir.resolve(LATEST))) {
            log.info("[SnapshotStore] no snapshot to restore. stateDir={}", stateDir.toAbsolutePath());
            return;
        }
        try {
            int restored = restore(null);
            log.info("[SnapshotStore] restored on startup. series={}", restored);
        } catch (RuntimeException e) {
            log.warn("[SnapshotStore] startup restore failed, starting empty. stateDir={}", stateDir, e);
        }
    }

    @PreDestroy
    public void saveOnShutdown() {
        if (!settings.isSnapshotOnShutdown()) {
            return;
        }
        try {
            String name = save();
            log.info("[SnapshotStore] saved on shutdown. name={}", name);
        } catch (RuntimeException e) {
            log.warn("[SnapshotStore] shutdown save failed. stateDir={}", stateDir, e);
        }
    }

    /** Writes a new snapshot and returns its file name. */
    public synchronized String save() {
        ServiceSnapshot snapshot = stateManager.snapshot();
        String name = null;
        try {
            Files.createDirectories(stateDir);
            name = freeName(snapshot.capturedAt());
            byte[] json = objectMapper.writeValueAsBytes(snapshot);
            writeAtomically(stateDir.resolve(name), json);
            writeAtomically(stateDir.resolve(LATEST), json);
            rotate();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write snapshot " + name, e);
        }
        log.info("[SnapshotStore] snapshot written. name={} series={}", name, snapshot.series().size());
        return name;
    }

    /** Restores {@code name}, or {@code latest.json} when null. Returns the number of series restored. */
    public int restore(String name) {
        String file = name == null || name.isBlank() ? LATEST : name.trim();
        if (!LATEST.equals(file) && !SNAPSHOT_NAME.matcher(file).matches()) {
            throw ValidationException.invalidParameter("name", file, "snapshot-yyyyMMdd-HHmmss-SSS.json or latest.json");
        }
        Path path = stateDir.resolve(file);
        if (!Files.isRegularFile(path)) {
            throw new SnapshotNotFoundException(file);
        }
        ServiceSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(path.toFile(), ServiceSnapshot.class);
        } catch (IOException e) {
            throw new ValidationException("Unreadable snapshot " + file + ": " + e.getMessage(), e);
        }
        return stateManager.restore(snapshot);
    }

    /** Timestamped snapshot names, newest first. */
    public List<String> list() {
        if (!Files.isDirectory(stateDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(stateDir)) {
            return files.map(p -> p.getFileName().toString())
                .filter(n -> SNAPSHOT_NAME.matcher(n).matches())
                .sorted(Comparator.reverseOrder())
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + stateDir, e);
        }
    }

    private String freeName(Instant capturedAt) {
        Instant stamp = capturedAt.truncatedTo(ChronoUnit.MILLIS);
        String name = "snapshot-" + STAMP.format(stamp) + ".json";
        while (Files.exists(stateDir.resolve(name))) {
            stamp = stamp.plusMillis(1);
            name = "snapshot-" + STAMP.format(stamp) + ".json";
        }
        return name;
    }

    private void rotate() throws IOException {
        List<String> names = list();
        for (String stale : names.subList(Math.min(Math.max(1, settings.getStateKeep()), names.size()), names.size())) {
            Files.deleteIfExists(stateDir.resolve(stale));
            log.debug("[SnapshotStore] rotated out name={}", stale);
        }
    }

    private void writeAtomically(Path target, byte[] content) throws IOException {
        Path tmp = Files.createTempFile(stateDir, ".snapshot-", ".tmp");
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    Path stateDir() {
        return stateDir;
    }
}
