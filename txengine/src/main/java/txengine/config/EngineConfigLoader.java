package txengine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import txengine.state.CompressionType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

/**
 * Loads engine configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code txengine.properties} on the classpath</li>
 *   <li>{@code txengine.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties override file-based configuration, using the same keys
 * (e.g., {@code -Dtxengine.alert.level=DEBUG}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code txengine.history.size} - number of transaction results kept</li>
 *   <li>{@code txengine.alert.level} - DEBUG, WARNING, or ERROR</li>
 *   <li>{@code txengine.operation.timeout.enforced} - true to enforce operation timeouts</li>
 *   <li>{@code txengine.rollback.parallelism} - workers for parallel rollback</li>
 *   <li>{@code txengine.rollback.max.age} - seconds before a rollback point is stale</li>
 *   <li>{@code txengine.snapshot.compression} - NONE or GZIP</li>
 *   <li>{@code txengine.snapshot.checksum.algorithm} - e.g. SHA-256</li>
 * </ul>
 *
 * @see EngineConfig
 */
public final class EngineConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(EngineConfigLoader.class);

    private EngineConfigLoader() {}

    /**
     * Load from classpath (txengine.properties or txengine.yml).
     * @throws EngineConfigException if no config file found
     */
    public static EngineConfig load() {
        InputStream is = getResource("txengine.properties");
        if (is != null) {
            return loadProperties(is, "txengine.properties");
        }

        is = getResource("txengine.yml");
        if (is != null) {
            return loadYaml(is, "txengine.yml");
        }

        throw new EngineConfigException(
                "Config file required: txengine.properties or txengine.yml");
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     */
    public static EngineConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return EngineConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static EngineConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new EngineConfigException("Failed to load " + source, e);
        }
    }

    private static EngineConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try (is) {
            root = new Yaml().load(is);
        } catch (IOException e) {
            throw new EngineConfigException("Failed to load " + source, e);
        } catch (RuntimeException e) {
            throw new EngineConfigException("Invalid YAML in " + source, e);
        }
        if (root == null) {
            return EngineConfig.DEFAULTS;
        }
        Properties props = new Properties();
        flatten("", root, props);
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    // nested YAML maps become dotted keys: txengine: {history: {size: 5}} -> txengine.history.size
    private static void flatten(String prefix, Map<?, ?> node, Properties out) {
        node.forEach((k, v) -> {
            String key = prefix.isEmpty() ? String.valueOf(k) : prefix + "." + k;
            if (v instanceof Map<?, ?> child) {
                flatten(key, child, out);
            } else if (v != null) {
                out.setProperty(key, v.toString());
            }
        });
    }

    private static EngineConfig parse(Properties props) {
        EngineConfig.Builder b = EngineConfig.builder();

        positiveInt(props, "txengine.history.size").ifPresent(b::historySize);
        enumValue(props, "txengine.alert.level", AlertLevel.class).ifPresent(b::alertLevel);
        getString(props, "txengine.operation.timeout.enforced")
                .map(Boolean::parseBoolean)
                .ifPresent(b::operationTimeoutEnforced);
        positiveInt(props, "txengine.rollback.parallelism").ifPresent(b::rollbackParallelism);
        number(props, "txengine.rollback.max.age", Long::parseLong).ifPresent(b::rollbackMaxAgeSeconds);
        enumValue(props, "txengine.snapshot.compression", CompressionType.class).ifPresent(b::snapshotCompression);
        getString(props, "txengine.snapshot.checksum.algorithm")
                .filter(EngineConfigLoader::isDigestAvailable)
                .ifPresent(b::checksumAlgorithm);

        return b.build();
    }

    private static boolean isDigestAvailable(String algorithm) {
        try {
            MessageDigest.getInstance(algorithm);
            return true;
        } catch (NoSuchAlgorithmException e) {
            log.warn("Unsupported snapshot checksum algorithm {}, keeping default", algorithm);
            return false;
        }
    }

    private static Optional<String> getString(Properties props, String key) {
        String override = System.getProperty(key);
        String raw = override != null ? override : props.getProperty(key);
        return Optional.ofNullable(raw).map(String::trim);
    }

    private static <E extends Enum<E>> Optional<E> enumValue(Properties props, String key, Class<E> type) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Enum.valueOf(type, v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring {}={}: not a {}", key, v, type.getSimpleName());
                return Optional.empty();
            }
        });
    }

    private static <N extends Number> Optional<N> number(Properties props, String key, Function<String, N> parser) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(parser.apply(v));
            } catch (NumberFormatException e) {
                log.warn("Ignoring {}={}: not a number", key, v);
                return Optional.empty();
            }
        });
    }

    private static Optional<Integer> positiveInt(Properties props, String key) {
        return number(props, key, Integer::parseInt).filter(v -> {
            if (v <= 0) {
                log.warn("Ignoring {}={}: must be positive", key, v);
            }
            return v > 0;
        });
    }
}
