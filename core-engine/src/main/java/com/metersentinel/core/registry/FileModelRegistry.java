package com.metersentinel.core.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.metersentinel.core.error.PromotionConsistencyException;
import com.metersentinel.core.ml.ForestOutlierModel;
import com.metersentinel.core.ml.ForestOutlierState;
import com.metersentinel.core.ml.SeasonalForecastModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * {@link ModelRegistry} backed by a directory of JSON files.
 *
 * <h3>Layout</h3>
 * <pre>
 *   &lt;root&gt;/artifacts/forecasting_&lt;version&gt;.json
 *   &lt;root&gt;/artifacts/outlier_&lt;version&gt;.json
 *   &lt;root&gt;/backups/&lt;kind&gt;_&lt;version&gt;.json     rejected candidates
 *   &lt;root&gt;/production.json                    both pointers
 *   &lt;root&gt;/metrics_history.jsonl              one entry per attempt
 * </pre>
 *
 * <h3>Atomic promotion</h3>
 * <p>
 * Artifacts are written first. The new pointer file is then written next to
 * {@code production.json} and moved over it with
 * {@link StandardCopyOption#ATOMIC_MOVE}, and only after that succeeds is the
 * in-memory snapshot swapped. A reader therefore sees either the old pair of
 * pointers or the new pair, each referencing complete artifacts.
 * </p>
 *
 * @since 1.0.0
 */
public class FileModelRegistry implements ModelRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(FileModelRegistry.class);

    static final String ARTIFACTS_DIR = "artifacts";
    static final String BACKUPS_DIR = "backups";
    static final String PRODUCTION_FILE = "production.json";
    static final String HISTORY_FILE = "metrics_history.jsonl";

    private static final Pattern ARTIFACT_NAME =
            Pattern.compile("(forecasting|outlier)_(v\\d{8}_\\d{6}(?:_\\d+)?)\\.json");

    private final Path root;
    private final Path artifactsDir;
    private final Path backupsDir;
    private final Path productionFile;
    private final Path historyFile;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final VersionIdGenerator versionIds;

    private final AtomicReference<ProductionSnapshot> production = new AtomicReference<>();
    private final AtomicReference<ProductionModels> loadedModels = new AtomicReference<>();

    /**
     * Open (and if needed create) a registry rooted at {@code root}.
     *
     * @param root  registry directory
     * @param clock clock for version ids and timestamps
     * @throws IllegalStateException if the directory cannot be prepared or
     *                               {@code production.json} is unreadable
     */
    public FileModelRegistry(Path root, Clock clock) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.artifactsDir = root.resolve(ARTIFACTS_DIR);
        this.backupsDir = root.resolve(BACKUPS_DIR);
        this.productionFile = root.resolve(PRODUCTION_FILE);
        this.historyFile = root.resolve(HISTORY_FILE);
        this.mapper = newMapper();

        try {
            Files.createDirectories(artifactsDir);
            Files.createDirectories(backupsDir);
            if (Files.exists(productionFile)) {
                production.set(mapper.readValue(productionFile.toFile(), ProductionSnapshot.class));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to open model registry at " + root, e);
        }
        this.versionIds = new VersionIdGenerator(clock, highestKnownVersion());
        LOG.info("Opened model registry at {} (production: {})", root,
                production.get() != null ? production.get().getForecastingVersion() : "none");
    }

    /**
     * @return a Jackson mapper configured for registry documents
     */
    public static ObjectMapper newMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    // ---------------------------------------------------------------
    // Readers
    // ---------------------------------------------------------------

    @Override
    public Optional<ProductionSnapshot> currentProduction() {
        return Optional.ofNullable(production.get());
    }

    @Override
    public Optional<ProductionModels> loadProductionModels() {
        ProductionSnapshot snapshot = production.get();
        if (snapshot == null) {
            return Optional.empty();
        }
        ProductionModels cached = loadedModels.get();
        if (cached != null && cached.getSnapshot() == snapshot) {
            return Optional.of(cached);
        }

        try {
            ModelArtifact forecast = readArtifact(artifactsDir.resolve(
                    ModelKind.FORECASTING.fileName(snapshot.getForecastingVersion())));
            ModelArtifact outlier = readArtifact(artifactsDir.resolve(
                    ModelKind.OUTLIER.fileName(snapshot.getOutlierVersion())));
            ProductionModels models = new ProductionModels(snapshot,
                    mapper.treeToValue(forecast.getPayload(), SeasonalForecastModel.class),
                    ForestOutlierModel.fromState(mapper.treeToValue(outlier.getPayload(), ForestOutlierState.class)));
            loadedModels.set(models);
            LOG.info("Loaded production models {}", snapshot.getForecastingVersion());
            return Optional.of(models);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load production artifacts for "
                    + snapshot.getForecastingVersion(), e);
        }
    }

    @Override
    public String nextVersionId() {
        return versionIds.next();
    }

    // ---------------------------------------------------------------
    // Writers
    // ---------------------------------------------------------------

    @Override
    public synchronized ProductionSnapshot promote(ModelCandidate candidate) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        String version = candidate.getVersionId();
        ProductionSnapshot next = new ProductionSnapshot(version, version, clock.instant(),
                candidate.getTrainingRecordCount(), candidate.getMetrics());

        List<Path> written = new ArrayList<>();
        try {
            for (ModelArtifact artifact : toArtifacts(candidate)) {
                Path target = artifactsDir.resolve(artifact.getKind().fileName(version));
                writeAtomically(target, mapper.writeValueAsBytes(artifact));
                written.add(target);
            }
            writeAtomically(productionFile, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(next));
        } catch (IOException e) {
            removeAfterFailedPromotion(written, e);
            throw new PromotionConsistencyException("Promotion of " + version
                    + " failed; production pointers left at "
                    + (production.get() != null ? production.get().getForecastingVersion() : "none"), e);
        }

        ProductionSnapshot previous = production.getAndSet(next);
        LOG.info("Promoted {} to production (previous: {})", version,
                previous != null ? previous.getForecastingVersion() : "none");
        return next;
    }

    @Override
    public synchronized void backup(ModelCandidate candidate) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        try {
            for (ModelArtifact artifact : toArtifacts(candidate)) {
                writeAtomically(backupsDir.resolve(artifact.getKind().fileName(candidate.getVersionId())),
                        mapper.writeValueAsBytes(artifact));
            }
            LOG.info("Stored candidate {} as backup", candidate.getVersionId());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to back up candidate " + candidate.getVersionId(), e);
        }
    }

    @Override
    public synchronized void appendHistory(MetricsHistoryEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        try {
            String line = mapper.writeValueAsString(entry) + System.lineSeparator();
            Files.writeString(historyFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append metrics history for " + entry.getVersionId(), e);
        }
    }

    // ---------------------------------------------------------------
    // History
    // ---------------------------------------------------------------

    @Override
    public synchronized List<MetricsHistoryEntry> history() {
        if (!Files.exists(historyFile)) {
            return Collections.emptyList();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(historyFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read metrics history", e);
        }
        List<MetricsHistoryEntry> entries = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(mapper.readValue(line, MetricsHistoryEntry.class));
            } catch (JsonProcessingException e) {
                LOG.warn("Skipping unreadable metrics history line {}: {}", i + 1, e.getOriginalMessage());
            }
        }
        return Collections.unmodifiableList(entries);
    }

    @Override
    public Optional<MetricsHistoryEntry> lastCompletedTraining() {
        List<MetricsHistoryEntry> entries = history();
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (entries.get(i).getTerminalState().isCompletedTraining()) {
                return Optional.of(entries.get(i));
            }
        }
        return Optional.empty();
    }

    // ---------------------------------------------------------------
    // Retention
    // ---------------------------------------------------------------

    @Override
    public synchronized int cleanupOldVersions(int keep) {
        if (keep < 1) {
            throw new IllegalArgumentException("keep must be >= 1, got: " + keep);
        }
        Set<String> protectedVersions = new HashSet<>();
        ProductionSnapshot snapshot = production.get();
        if (snapshot != null) {
            protectedVersions.add(snapshot.getForecastingVersion());
            protectedVersions.add(snapshot.getOutlierVersion());
        }

        int deleted = 0;
        for (Path dir : List.of(artifactsDir, backupsDir)) {
            List<String> versions = new ArrayList<>(versionsIn(dir));
            versions.sort((a, b) -> VersionIdGenerator.compare(b, a));
            Set<String> retained = new HashSet<>(versions.subList(0, Math.min(keep, versions.size())));
            retained.addAll(protectedVersions);
            for (String version : versions) {
                if (retained.contains(version)) {
                    continue;
                }
                for (ModelKind kind : ModelKind.values()) {
                    try {
                        if (Files.deleteIfExists(dir.resolve(kind.fileName(version)))) {
                            deleted++;
                        }
                    } catch (IOException e) {
                        LOG.warn("Could not delete old artifact {} in {}: {}", version, dir, e.getMessage());
                    }
                }
            }
        }
        if (deleted > 0) {
            LOG.info("Removed {} old artifact file(s), keeping the newest {} version(s)", deleted, keep);
        }
        return deleted;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * Replace {@code target} with {@code source} in one filesystem operation.
     * Overridable so tests can simulate a failed swap.
     */
    protected void replaceAtomically(Path source, Path target) throws IOException {
        Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    private void writeAtomically(Path target, byte[] content) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(tmp, content);
        try {
            replaceAtomically(tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private List<ModelArtifact> toArtifacts(ModelCandidate candidate) {
        ForestOutlierModel outlier = candidate.getOutlierModel();
        return List.of(
                new ModelArtifact(ModelKind.FORECASTING, candidate.getVersionId(), candidate.getTrainedAt(),
                        candidate.getTrainingRecordCount(), candidate.getMetrics().toMap(),
                        mapper.valueToTree(candidate.getForecastModel())),
                new ModelArtifact(ModelKind.OUTLIER, candidate.getVersionId(), candidate.getTrainedAt(),
                        candidate.getTrainingRecordCount(), outlier.describe(),
                        mapper.valueToTree(outlier.toState())));
    }

    private ModelArtifact readArtifact(Path path) throws IOException {
        return mapper.readValue(path.toFile(), ModelArtifact.class);
    }

    private void removeAfterFailedPromotion(List<Path> written, IOException cause) {
        for (Path path : written) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                cause.addSuppressed(e);
                LOG.error("Could not remove partially promoted artifact {}", path, e);
            }
        }
    }

    private Set<String> versionsIn(Path dir) {
        Set<String> versions = new TreeSet<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.forEach(file -> {
                Matcher m = ARTIFACT_NAME.matcher(file.getFileName().toString());
                if (m.matches()) {
                    versions.add(m.group(2));
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
        return versions;
    }

    private String highestKnownVersion() {
        List<String> known = new ArrayList<>();
        known.addAll(versionsIn(artifactsDir));
        known.addAll(versionsIn(backupsDir));
        history().forEach(e -> known.add(e.getVersionId()));
        return known.stream().max(VersionIdGenerator::compare).orElse(null);
    }

    public Path getRoot() {
        return root;
    }
}
