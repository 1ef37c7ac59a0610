package org.scalebaron.utilities;

import org.scalebaron.controller.BatchConfig;
import org.scalebaron.model.ElementKey;
import org.scalebaron.model.ScaleConfig;
import org.scalebaron.model.ScaleMode;
import org.scalebaron.progress.OutputLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * EngineConfigManager
 *
 * <p>Loads batch defaults from YAML:
 *   - The bundled {@value #DEFAULTS_RESOURCE} supplies every key.
 *   - An optional user file is merged over it, section by section.
 *   - Type safe getters (getDouble, getInteger, getBoolean, getString, getSection) take a key path
 *     and fall back to the bundled value when the user value is missing or has the wrong type.
 *
 * <p>{@link #toBatchConfigBuilder(Path)} turns the loaded values into a {@link BatchConfig.Builder}
 * that callers can adjust further before building.
 */
public class EngineConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfigManager.class);

    public static final String DEFAULTS_RESOURCE = "scalebaron-defaults.yml";

    private final Map<String, Object> defaults;
    private final Map<String, Object> configData;
    private final Path configPath;

    private EngineConfigManager(Map<String, Object> defaults, Map<String, Object> user, Path configPath) {
        this.defaults = defaults;
        this.configData = deepMerge(defaults, user);
        this.configPath = configPath;
    }

    /**
     * @return a manager holding only the bundled defaults
     */
    public static EngineConfigManager defaults() {
        return new EngineConfigManager(loadResource(DEFAULTS_RESOURCE), new LinkedHashMap<>(), null);
    }

    /**
     * Loads {@code configPath} over the bundled defaults. A missing or unreadable file leaves the
     * defaults in place.
     */
    public static EngineConfigManager load(Path configPath) {
        Map<String, Object> user = new LinkedHashMap<>();
        if (configPath == null || !Files.isRegularFile(configPath)) {
            logger.warn("Configuration file not found: {} - using built-in defaults", configPath);
        } else {
            try (InputStream in = Files.newInputStream(configPath)) {
                user = parse(in, configPath.toString());
            } catch (IOException e) {
                logger.error("Could not read configuration {}", configPath, e);
            }
        }
        return new EngineConfigManager(loadResource(DEFAULTS_RESOURCE), user, configPath);
    }

    public Map<String, Object> getAllConfig() {
        return Collections.unmodifiableMap(configData);
    }

    /**
     * @return the file loaded over the defaults, or null
     */
    public Path getConfigPath() {
        return configPath;
    }

    /**
     * @param keys key path, e.g. {@code "layout", "rows"}
     * @return the value at the path or null
     */
    public Object getConfigItem(String... keys) {
        return lookup(configData, keys);
    }

    public String getString(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof String s) ? s : null;
    }

    public Double getDouble(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.doubleValue();
        try {
            return (v != null) ? Double.parseDouble(v.toString()) : fallbackDouble(keys);
        } catch (NumberFormatException e) {
            logger.warn("Expected number at {} but got {} - using default", String.join("/", keys), v);
            return fallbackDouble(keys);
        }
    }

    public Integer getInteger(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.intValue();
        try {
            return (v != null) ? Integer.parseInt(v.toString()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected integer at {} but got {} - using default", String.join("/", keys), v);
            Object d = lookup(defaults, keys);
            return (d instanceof Number n) ? n.intValue() : null;
        }
    }

    public Boolean getBoolean(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Boolean b) return b;
        if (v == null) {
            Object d = lookup(defaults, keys);
            return d instanceof Boolean b ? b : null;
        }
        return Boolean.parseBoolean(v.toString());
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getSection(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof Map<?, ?>) ? (Map<String, Object>) v : null;
    }

    /**
     * Seeds a {@link BatchConfig.Builder} from the loaded values.
     */
    public BatchConfig.Builder toBatchConfigBuilder(Path outputFolder) {
        BatchConfig.Builder builder = new BatchConfig.Builder()
                .outputFolder(outputFolder)
                .defaultPixelSize(orElse(getDouble("pixel_size", "default_microns"), BatchConfig.DEFAULT_PIXEL_SIZE))
                .scaleBarMicrons(orElse(getDouble("scale_bar", "length_microns"), 1000.0))
                .defaultScale(scaleConfig(getString("scaling", "mode"), getConfigItem("scaling", "value"), "scaling"))
                .userRows(getInteger("layout", "rows"))
                .autoFallback(Boolean.TRUE.equals(getBoolean("layout", "auto_fallback")))
                .targetAspect(orElse(getDouble("layout", "target_aspect"), 1.3))
                .downsample(orElse(getInteger("downsample", "threshold_samples"), BatchConfig.DEFAULT_DOWNSAMPLE_THRESHOLD),
                        orElse(getInteger("downsample", "target_max_pixels"), 512))
                .maxUpdatesPerSecond(orElse(getInteger("progress", "max_updates_per_second"), 10))
                .exportIndividualImages(Boolean.TRUE.equals(getBoolean("export", "individual_images")))
                .exportCompositeMatrix(Boolean.TRUE.equals(getBoolean("export", "composite_matrix")));

        Map<String, Object> elements = getSection("scaling", "elements");
        if (elements != null) {
            for (Map.Entry<String, Object> entry : elements.entrySet()) {
                if (!(entry.getValue() instanceof Map<?, ?> section)) {
                    logger.warn("Ignoring scaling override for {}: expected a section, got {}", entry.getKey(), entry.getValue());
                    continue;
                }
                Object mode = section.get("mode");
                ScaleConfig config = scaleConfig(mode == null ? null : mode.toString(), section.get("value"), entry.getKey());
                ElementKey element = OutputLayout.parseFolderName(entry.getKey());
                builder.scaleConfig(element, config);
            }
        }
        return builder;
    }

    /**
     * Parses a scale mode name ({@code auto}, {@code fixed}, {@code log}, {@code ecdf}). An unknown
     * name, or {@code fixed} without a value, falls back to auto with a warning.
     */
    static ScaleConfig scaleConfig(String mode, Object value, String where) {
        Double number = null;
        if (value instanceof Number n) {
            number = n.doubleValue();
        } else if (value != null) {
            try {
                number = Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                logger.warn("Scale value for {} is not a number: {}", where, value);
            }
        }
        String name = mode == null ? "auto" : mode.trim().toLowerCase(Locale.ROOT);
        switch (name) {
            case "auto":
                return ScaleConfig.AUTO;
            case "fixed":
                if (number == null) {
                    logger.warn("Fixed scale for {} has no value - using auto", where);
                    return ScaleConfig.AUTO;
                }
                return ScaleConfig.fixed(number);
            case "log":
                return new ScaleConfig(ScaleMode.LOG, number);
            case "ecdf":
                return new ScaleConfig(ScaleMode.ECDF, number);
            default:
                logger.warn("Unknown scale mode '{}' for {} - using auto", mode, where);
                return ScaleConfig.AUTO;
        }
    }

    private Double fallbackDouble(String... keys) {
        Object d = lookup(defaults, keys);
        return (d instanceof Number n) ? n.doubleValue() : null;
    }

    private static <T> T orElse(T value, T fallback) {
        return value != null ? value : fallback;
    }

    private static Object lookup(Map<String, Object> root, String... keys) {
        Object current = root;
        for (String key : keys) {
            if (current instanceof Map<?, ?> map && map.containsKey(key)) {
                current = map.get(key);
            } else {
                return null;
            }
        }
        return current;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> deepMerge(Map<String, Object> base, Map<String, Object> overlay) {
        Map<String, Object> merged = new LinkedHashMap<>(base);
        for (Map.Entry<String, Object> entry : overlay.entrySet()) {
            Object existing = merged.get(entry.getKey());
            if (existing instanceof Map<?, ?> a && entry.getValue() instanceof Map<?, ?> b) {
                merged.put(entry.getKey(), deepMerge((Map<String, Object>) a, (Map<String, Object>) b));
            } else {
                merged.put(entry.getKey(), entry.getValue());
            }
        }
        return merged;
    }

    private static Map<String, Object> loadResource(String name) {
        try (InputStream in = EngineConfigManager.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                logger.error("Bundled defaults {} not found on the classpath", name);
                return new LinkedHashMap<>();
            }
            return parse(in, name);
        } catch (IOException e) {
            logger.error("Could not read bundled defaults {}", name, e);
            return new LinkedHashMap<>();
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(InputStream in, String source) {
        Yaml yaml = new Yaml();
        try {
            Object loaded = yaml.load(in);
            if (loaded instanceof Map) {
                return new LinkedHashMap<>((Map<String, Object>) loaded);
            }
            if (loaded != null) {
                logger.error("YAML root is not a map: {}", source);
            }
        } catch (RuntimeException e) {
            logger.error("Error parsing YAML: {}", source, e);
        }
        return new LinkedHashMap<>();
    }
}
