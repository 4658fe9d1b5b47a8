/* (C)2026 */
package com.ammann.regimeshift.source;

import com.ammann.regimeshift.model.DetectionEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Detection source backed by a labelled image dataset on disk.
 *
 * <p>Expects one sub-directory per species under the dataset root; every image file found below a
 * species directory counts as one detection, observed at the file's last-modified time. The first
 * configured root that exists is used. A missing root yields no events, and a species directory
 * that cannot be read is skipped.
 */
@ApplicationScoped
public class DirectoryDetectionSource implements DetectionSource {

    private static final Logger LOG = Logger.getLogger(DirectoryDetectionSource.class);

    private final List<Path> candidateRoots;
    private final Set<String> extensions;
    private final Clock clock;

    @Inject
    public DirectoryDetectionSource(
            @ConfigProperty(name = "regime.dataset.dirs",
                    defaultValue = "/app/data/temp_extract/train,/app/data/butterflies/train")
                    List<String> dirs,
            @ConfigProperty(name = "regime.dataset.extensions", defaultValue = "jpg,jpeg,png")
                    List<String> extensions,
            Clock clock) {
        this.candidateRoots = dirs.stream().map(String::trim).map(Paths::get).toList();
        this.extensions = extensions.stream()
                .map(e -> e.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.clock = clock;
    }

    @Override
    public List<DetectionEvent> listEvents() {
        Optional<Path> root = findDatasetRoot();
        if (root.isEmpty()) {
            LOG.debugf("No dataset directory found among %s", candidateRoots);
            return List.of();
        }

        List<Path> speciesDirs;
        try (Stream<Path> entries = Files.list(root.get())) {
            speciesDirs = entries.filter(Files::isDirectory).toList();
        } catch (IOException | UncheckedIOException e) {
            LOG.warnf(e, "Failed to list dataset directory %s", root.get());
            return List.of();
        }

        List<DetectionEvent> events = new ArrayList<>();
        for (Path speciesDir : speciesDirs) {
            try {
                events.addAll(scanSpecies(speciesDir));
            } catch (IOException | UncheckedIOException e) {
                LOG.warnf(e, "Skipping unreadable species directory %s", speciesDir);
            }
        }

        LOG.debugf("Scanned %d detections under %s", events.size(), root.get());
        return events;
    }

    /** Files whose modification time cannot be read fall back to the scan time. */
    @Override
    public Instant fallbackObservedAt() {
        return clock.instant();
    }

    Optional<Path> findDatasetRoot() {
        return candidateRoots.stream().filter(Files::isDirectory).findFirst();
    }

    /** Detections of one species; a directory that fails part-way contributes nothing. */
    List<DetectionEvent> scanSpecies(Path speciesDir) throws IOException {
        String species = speciesDir.getFileName().toString();
        try (Stream<Path> files = Files.walk(speciesDir)) {
            return files.filter(Files::isRegularFile)
                    .filter(this::isImage)
                    .map(file -> new DetectionEvent(species, lastModified(file)))
                    .toList();
        }
    }

    private boolean isImage(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private Instant lastModified(Path file) {
        try {
            return Files.getLastModifiedTime(file).toInstant();
        } catch (IOException e) {
            LOG.debugf("Cannot read modification time of %s: %s", file, e.getMessage());
            return null;
        }
    }
}
