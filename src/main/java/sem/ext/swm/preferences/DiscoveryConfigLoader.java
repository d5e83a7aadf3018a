package sem.ext.swm.preferences;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.FileNotFoundException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@link DiscoveryConfig} settings from a YAML file.
 *
 * <p>Expected layout (every key optional):</p>
 * <pre>
 * mode_grid:
 *   scene_match_tolerance: 0.03
 *   magnification_tolerance: 0.1
 *   working_distance_tolerance: 0.05
 *   preferred_modes_order: [sed, bsd, topo, chemsem, edx]
 * mag_grid:
 *   template_match_threshold: 0.5
 *   containment_ratio: 1.5
 *   containment_generosity: 0.5
 *   fallback_scale: 0.5
 *   max_correlation_dimension: 1024
 * chem_pairing:
 *   chem_image_marker: ChemiSEM
 *   chem_image_extensions: [.tiff, .tif]
 * </pre>
 *
 * <p>Problems never abort loading: a missing file, unparsable YAML or a wrong-typed value
 * is logged and the default kept.</p>
 */
public class DiscoveryConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(DiscoveryConfigLoader.class);

    public static final String MODE_GRID_SECTION = "mode_grid";
    public static final String MAG_GRID_SECTION = "mag_grid";
    public static final String CHEM_PAIRING_SECTION = "chem_pairing";

    private final Map<String, Object> configData;

    private DiscoveryConfigLoader(Map<String, Object> configData) {
        this.configData = configData;
    }

    /**
     * Loads settings from the given YAML file.
     *
     * @param path YAML file; may be null
     * @return the resulting configuration, defaults for anything missing
     */
    public static DiscoveryConfig load(Path path) {
        if (path == null) {
            logger.info("No discovery configuration file given, using defaults");
            return DiscoveryConfig.defaults();
        }
        return new DiscoveryConfigLoader(loadYaml(path)).toConfig();
    }

    /**
     * Loads settings from an already open YAML stream, e.g. a classpath resource.
     */
    public static DiscoveryConfig load(InputStream in) {
        return new DiscoveryConfigLoader(parse(in, "<stream>")).toConfig();
    }

    private static Map<String, Object> loadYaml(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        } catch (NoSuchFileException | FileNotFoundException e) {
            logger.warn("Discovery configuration not found: {}", path);
        } catch (Exception e) {
            logger.error("Error reading discovery configuration: {}", path, e);
        }
        return new LinkedHashMap<>();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(InputStream in, String source) {
        Yaml yaml = new Yaml();
        try {
            Object loaded = yaml.load(in);
            if (loaded instanceof Map) {
                return new LinkedHashMap<>((Map<String, Object>) loaded);
            } else if (loaded != null) {
                logger.error("YAML root is not a map: {}", source);
            }
        } catch (Exception e) {
            logger.error("Error parsing YAML: {}", source, e);
        }
        return new LinkedHashMap<>();
    }

    private DiscoveryConfig toConfig() {
        DiscoveryConfig.Builder builder = new DiscoveryConfig.Builder();

        Double value;
        if ((value = getDouble(MODE_GRID_SECTION, "scene_match_tolerance")) != null) {
            builder.sceneMatchTolerance(value);
        }
        if ((value = getDouble(MODE_GRID_SECTION, "magnification_tolerance")) != null) {
            builder.magnificationTolerance(value);
        }
        if ((value = getDouble(MODE_GRID_SECTION, "working_distance_tolerance")) != null) {
            builder.workingDistanceTolerance(value);
        }
        List<String> modes = getStringList(MODE_GRID_SECTION, "preferred_modes_order");
        if (modes != null) {
            builder.preferredModesOrder(modes);
        }

        if ((value = getDouble(MAG_GRID_SECTION, "template_match_threshold")) != null) {
            builder.templateMatchThreshold(value);
        }
        if ((value = getDouble(MAG_GRID_SECTION, "containment_ratio")) != null) {
            builder.containmentRatio(value);
        }
        if ((value = getDouble(MAG_GRID_SECTION, "containment_generosity")) != null) {
            builder.containmentGenerosity(value);
        }
        if ((value = getDouble(MAG_GRID_SECTION, "fallback_scale")) != null) {
            builder.fallbackScale(value);
        }
        if ((value = getDouble(MAG_GRID_SECTION, "max_correlation_dimension")) != null) {
            builder.maxCorrelationDimension(value.intValue());
        }

        Object marker = getConfigItem(CHEM_PAIRING_SECTION, "chem_image_marker");
        if (marker != null) {
            builder.chemImageMarker(marker.toString());
        }
        List<String> extensions = getStringList(CHEM_PAIRING_SECTION, "chem_image_extensions");
        if (extensions != null) {
            builder.chemImageExtensions(extensions);
        }

        try {
            DiscoveryConfig config = builder.build();
            logger.info("Loaded discovery configuration: {}", config);
            return config;
        } catch (IllegalStateException e) {
            logger.error("Discovery configuration rejected, using defaults: {}", e.getMessage());
            return DiscoveryConfig.defaults();
        }
    }

    /**
     * Walks nested maps by key. Falls back to the bare leaf key at the root so flat files
     * ({@code scene_match_tolerance: 0.05}) work too.
     */
    Object getConfigItem(String... keys) {
        Object current = configData;
        for (String key : keys) {
            if (current instanceof Map<?, ?> map && map.containsKey(key)) {
                current = map.get(key);
            } else {
                current = null;
                break;
            }
        }
        if (current == null && keys.length > 1) {
            current = configData.get(keys[keys.length - 1]);
        }
        if (current != null) {
            logger.debug("Config lookup {} -> {}", Arrays.toString(keys), current);
        }
        return current;
    }

    private Double getDouble(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.doubleValue();
        try {
            return (v != null) ? Double.parseDouble(v.toString()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected number at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    private List<String> getStringList(String... keys) {
        Object v = getConfigItem(keys);
        if (v == null) {
            return null;
        }
        if (!(v instanceof List<?> list)) {
            logger.warn("Expected list at {} but got {}", String.join("/", keys), v);
            return null;
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (item != null) {
                result.add(item.toString().trim());
            }
        }
        return result;
    }
}
