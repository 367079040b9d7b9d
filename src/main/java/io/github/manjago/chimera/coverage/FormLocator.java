package io.github.manjago.chimera.coverage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Resolves {@code (file, line)} to the runtime form id by predecessor search:
 * the form whose start line is the greatest one not after the queried line.
 * <p>
 * When several forms start on the same line the last one registered wins.
 * Such files (generated or minified code) are not resolved any further.
 */
public final class FormLocator {

    private static final Logger log = LoggerFactory.getLogger(FormLocator.class);

    private final Map<Path, TreeMap<Integer, String>> byFile = new HashMap<>();

    public FormLocator(FormLocationBridge bridge) {
        for (Map.Entry<String, FormLocation> e : bridge.locations().entrySet()) {
            FormLocation location = e.getValue();
            TreeMap<Integer, String> lines = byFile.computeIfAbsent(normalize(location.file()), k -> new TreeMap<>());
            String previous = lines.put(location.startLine(), e.getKey());
            if (previous != null) {
                log.debug("Forms {} and {} both start at {}:{}; resolving to {}",
                        previous, e.getKey(), location.file(), location.startLine(), e.getKey());
            }
        }
    }

    public Optional<String> resolve(Path file, int line) {
        TreeMap<Integer, String> lines = byFile.get(normalize(file));
        if (lines == null) {
            return Optional.empty();
        }
        Map.Entry<Integer, String> entry = lines.floorEntry(line);
        return entry != null ? Optional.of(entry.getValue()) : Optional.empty();
    }

    private static Path normalize(Path file) {
        return file.toAbsolutePath().normalize();
    }
}
