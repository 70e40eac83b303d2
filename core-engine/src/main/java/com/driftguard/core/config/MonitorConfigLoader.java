package com.driftguard.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.introspector.Property;
import org.yaml.snakeyaml.introspector.PropertyUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the monitor YAML into a {@link MonitorConfig}.
 *
 * <p>
 * A document is handled in two passes. The first reads it as a plain map so
 * that misspelt sections or keys are reported by name instead of aborting the
 * job; the second binds the known keys onto the settings beans. Sections that
 * are missing or empty keep their defaults. The bound configuration is always
 * passed through {@link MonitorConfig#validate()}.
 * </p>
 *
 * <p>
 * {@link #load()} looks at {@value #ENV_CONFIG_PATH} first and falls back to
 * the bundled {@value #DEFAULT_RESOURCE}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitorConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(MonitorConfigLoader.class);

    /** Environment variable naming a config file on disk. */
    public static final String ENV_CONFIG_PATH = "DRIFTGUARD_CONFIG_PATH";

    /** Bundled classpath config. */
    public static final String DEFAULT_RESOURCE = "driftguard.yml";

    private MonitorConfigLoader() {
    }

    public static MonitorConfig load() {
        return load(System.getenv(ENV_CONFIG_PATH));
    }

    /**
     * Load {@code path} if it names an existing file, otherwise the bundled
     * resource. A configured but missing path is logged and skipped.
     *
     * @param path config file path, may be {@code null} or blank
     * @return validated configuration
     * @throws IllegalStateException if the document is malformed or invalid
     */
    public static MonitorConfig load(String path) {
        if (path == null || path.isBlank()) {
            return fromClasspath(DEFAULT_RESOURCE);
        }
        if (!Files.isRegularFile(Path.of(path))) {
            LOG.warn("Monitor config {} does not exist, using bundled {}", path, DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        return fromFile(path);
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if it cannot be read, is malformed or
     *                                  is invalid
     */
    public static MonitorConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        String text;
        try {
            text = Files.readString(Path.of(path), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read config file " + path, e);
        }
        return parse(text, path);
    }

    /**
     * @throws IllegalArgumentException if no such resource is on the classpath
     * @throws IllegalStateException    if it is malformed or invalid
     */
    public static MonitorConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        try (InputStream in = MonitorConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Config resource not found on classpath: " + resource);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), "classpath:" + resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read config resource " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Parsing
    // ---------------------------------------------------------------

    static MonitorConfig parse(String text, String source) {
        Object document;
        try {
            document = new Yaml(new SafeConstructor(loaderOptions())).load(text);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed monitor config " + source + ": " + e.getMessage(), e);
        }

        MonitorConfig config;
        if (document == null) {
            LOG.warn("Monitor config {} is empty, every section uses its defaults", source);
            config = new MonitorConfig();
        } else if (!(document instanceof Map)) {
            throw new IllegalStateException("Monitor config " + source
                    + " must be a YAML mapping, got " + document.getClass().getSimpleName());
        } else {
            List<String> unknown = unknownKeys((Map<?, ?>) document);
            if (!unknown.isEmpty()) {
                LOG.warn("Ignoring unknown keys in monitor config {}: {}", source, unknown);
            }
            config = bind(text, source);
        }

        config.validate();
        LOG.info("Loaded monitor config from {}: {}", source, config);
        return config;
    }

    /**
     * Dotted names of the keys in {@code document} that neither
     * {@link MonitorConfig} nor its sections declare.
     */
    static List<String> unknownKeys(Map<?, ?> document) {
        PropertyUtils introspector = new PropertyUtils();
        Map<String, Property> sections = propertiesOf(introspector, MonitorConfig.class);
        List<String> unknown = new ArrayList<>();
        for (Map.Entry<?, ?> entry : document.entrySet()) {
            String name = String.valueOf(entry.getKey());
            Property section = sections.get(name);
            if (section == null) {
                unknown.add(name);
            } else if (entry.getValue() instanceof Map && section.getType() != String.class) {
                Set<String> known = propertiesOf(introspector, section.getType()).keySet();
                for (Object key : ((Map<?, ?>) entry.getValue()).keySet()) {
                    if (!known.contains(String.valueOf(key))) {
                        unknown.add(name + "." + key);
                    }
                }
            }
        }
        return unknown;
    }

    private static MonitorConfig bind(String text, String source) {
        PropertyUtils lenient = new PropertyUtils();
        lenient.setSkipMissingProperties(true);
        Constructor constructor = new Constructor(MonitorConfig.class, loaderOptions());
        constructor.setPropertyUtils(lenient);
        try {
            MonitorConfig config = new Yaml(constructor).load(text);
            return config != null ? config : new MonitorConfig();
        } catch (YAMLException e) {
            throw new IllegalStateException("Cannot bind monitor config " + source + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, Property> propertiesOf(PropertyUtils introspector, Class<?> type) {
        return introspector.getProperties(type).stream()
                .collect(Collectors.toMap(Property::getName, p -> p));
    }

    private static LoaderOptions loaderOptions() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return options;
    }
}
