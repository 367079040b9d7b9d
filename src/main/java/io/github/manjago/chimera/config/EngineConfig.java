package io.github.manjago.chimera.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import io.github.manjago.chimera.operator.Preset;
import io.github.manjago.chimera.pipeline.ClusterKey;
import io.github.manjago.chimera.schemata.SchemataCompiler;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Configuration for the mutation engine.
 * 
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record EngineConfig(
    // Operators
    Preset preset,

    // Clustering
    ClusterKey clusterKey,
    int prefixDepth,

    // Execution
    Duration testTimeout,
    int testParallelism,

    // Coverage
    int coverageParallelism,

    // Schemata
    boolean schemataEnabled,
    int batchSize,
    String selector,

    // Persistence
    Path stateFile,
    Path backupDir
) {

    /**
     * Load default configuration.
     */
    public static EngineConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static EngineConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     */
    public static EngineConfig fromConfig(Config config) {
        Config c = config.getConfig("chimera");

        return new EngineConfig(
            parseEnum(c, "operators.preset", Preset.class),
            parseEnum(c, "clustering.key", ClusterKey.class),
            c.getInt("clustering.prefix-depth"),
            c.getDuration("execution.test-timeout"),
            c.getInt("execution.test-parallelism"),
            c.getInt("coverage.parallelism"),
            c.getBoolean("schemata.enabled"),
            c.getInt("schemata.batch-size"),
            c.getString("schemata.selector"),
            Path.of(c.getString("persistence.file")),
            Path.of(c.getString("persistence.backup-dir"))
        );
    }

    /**
     * Enum value written in kebab case, e.g. {@code form-coordinate-prefix}.
     */
    private static <E extends Enum<E>> E parseEnum(Config c, String path, Class<E> type) {
        String raw = c.getString(path);
        try {
            return Enum.valueOf(type, raw.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(c.origin(), path, "unknown " + type.getSimpleName() + ": " + raw);
        }
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Preset preset = Preset.STANDARD;
        private ClusterKey clusterKey = ClusterKey.NONE;
        private int prefixDepth = 2;
        private Duration testTimeout = Duration.ofMillis(2000);
        private int testParallelism = 1;
        private int coverageParallelism = 1;
        private boolean schemataEnabled = true;
        private int batchSize = 64;
        private String selector = SchemataCompiler.DEFAULT_SELECTOR;
        private Path stateFile = Path.of("chimera-state.mv");
        private Path backupDir = Path.of(".chimera", "backups");

        public Builder preset(Preset preset) { this.preset = preset; return this; }
        public Builder clusterKey(ClusterKey key) { this.clusterKey = key; return this; }
        public Builder prefixDepth(int depth) { this.prefixDepth = depth; return this; }
        public Builder testTimeout(Duration timeout) { this.testTimeout = timeout; return this; }
        public Builder testParallelism(int parallelism) { this.testParallelism = parallelism; return this; }
        public Builder coverageParallelism(int parallelism) { this.coverageParallelism = parallelism; return this; }
        public Builder schemataEnabled(boolean enabled) { this.schemataEnabled = enabled; return this; }
        public Builder batchSize(int size) { this.batchSize = size; return this; }
        public Builder selector(String selector) { this.selector = selector; return this; }
        public Builder stateFile(Path file) { this.stateFile = file; return this; }
        public Builder backupDir(Path dir) { this.backupDir = dir; return this; }

        public EngineConfig build() {
            return new EngineConfig(
                preset, clusterKey, prefixDepth, testTimeout, testParallelism,
                coverageParallelism, schemataEnabled, batchSize, selector, stateFile, backupDir
            );
        }
    }

    @Override
    public String toString() {
        return String.format("""
            EngineConfig:
              operators.preset:           %s
              clustering.key:             %s
              clustering.prefix-depth:    %d
              execution.test-timeout:     %,d ms
              execution.test-parallelism: %d
              coverage.parallelism:       %d
              schemata.enabled:           %s
              schemata.batch-size:        %d
              schemata.selector:          %s
              persistence.file:           %s
              persistence.backup-dir:     %s
            """,
            preset.name().toLowerCase(Locale.ROOT),
            clusterKey.name().toLowerCase(Locale.ROOT).replace('_', '-'),
            prefixDepth,
            testTimeout.toMillis(),
            testParallelism,
            coverageParallelism,
            schemataEnabled,
            batchSize,
            selector,
            stateFile,
            backupDir
        );
    }
}
