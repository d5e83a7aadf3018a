package sem.ext.swm.preferences;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Immutable tolerances and ordering rules for collection discovery.
 *
 * <p>Passed explicitly into the matcher and builder constructors, so two discovery runs
 * with different settings never share state. Use {@link #defaults()} or the
 * {@link Builder}; {@link DiscoveryConfigLoader} fills a builder from YAML.</p>
 *
 * <pre>{@code
 * DiscoveryConfig config = new DiscoveryConfig.Builder()
 *     .sceneMatchTolerance(0.05)
 *     .templateMatchThreshold(0.6)
 *     .preferredModesOrder(List.of("bsd", "sed"))
 *     .build();
 * }</pre>
 */
public class DiscoveryConfig {
    private static final Logger logger = LoggerFactory.getLogger(DiscoveryConfig.class);

    public static final double DEFAULT_SCENE_MATCH_TOLERANCE = 0.03;
    public static final double DEFAULT_MAGNIFICATION_TOLERANCE = 0.1;
    public static final double DEFAULT_WORKING_DISTANCE_TOLERANCE = 0.05;
    public static final double DEFAULT_TEMPLATE_MATCH_THRESHOLD = 0.5;
    public static final double DEFAULT_CONTAINMENT_RATIO = 1.5;
    public static final double DEFAULT_CONTAINMENT_GENEROSITY = 0.5;
    public static final double DEFAULT_MIN_SCALE = 0.01;
    public static final double DEFAULT_MAX_SCALE = 0.9;
    public static final double DEFAULT_FALLBACK_SCALE = 0.5;
    public static final int DEFAULT_MAX_CORRELATION_DIMENSION = 1024;
    public static final List<String> DEFAULT_PREFERRED_MODES = List.of("sed", "bsd", "topo", "chemsem", "edx");
    public static final String DEFAULT_CHEM_IMAGE_MARKER = "ChemiSEM";
    public static final List<String> DEFAULT_CHEM_IMAGE_EXTENSIONS = List.of(".tiff", ".tif");

    private double sceneMatchTolerance = DEFAULT_SCENE_MATCH_TOLERANCE;
    private double magnificationTolerance = DEFAULT_MAGNIFICATION_TOLERANCE;
    private double workingDistanceTolerance = DEFAULT_WORKING_DISTANCE_TOLERANCE;
    private double templateMatchThreshold = DEFAULT_TEMPLATE_MATCH_THRESHOLD;
    private double containmentRatio = DEFAULT_CONTAINMENT_RATIO;
    private double containmentGenerosity = DEFAULT_CONTAINMENT_GENEROSITY;
    private double minScale = DEFAULT_MIN_SCALE;
    private double maxScale = DEFAULT_MAX_SCALE;
    private double fallbackScale = DEFAULT_FALLBACK_SCALE;
    private int maxCorrelationDimension = DEFAULT_MAX_CORRELATION_DIMENSION;
    private List<String> preferredModesOrder = DEFAULT_PREFERRED_MODES;
    private String chemImageMarker = DEFAULT_CHEM_IMAGE_MARKER;
    private List<String> chemImageExtensions = DEFAULT_CHEM_IMAGE_EXTENSIONS;

    private DiscoveryConfig() {
    }

    private DiscoveryConfig copy() {
        DiscoveryConfig copy = new DiscoveryConfig();
        copy.sceneMatchTolerance = sceneMatchTolerance;
        copy.magnificationTolerance = magnificationTolerance;
        copy.workingDistanceTolerance = workingDistanceTolerance;
        copy.templateMatchThreshold = templateMatchThreshold;
        copy.containmentRatio = containmentRatio;
        copy.containmentGenerosity = containmentGenerosity;
        copy.minScale = minScale;
        copy.maxScale = maxScale;
        copy.fallbackScale = fallbackScale;
        copy.maxCorrelationDimension = maxCorrelationDimension;
        copy.preferredModesOrder = preferredModesOrder;
        copy.chemImageMarker = chemImageMarker;
        copy.chemImageExtensions = chemImageExtensions;
        return copy;
    }

    public static DiscoveryConfig defaults() {
        return new Builder().build();
    }

    /** Position tolerance as a fraction of the smaller field of view. */
    public double getSceneMatchTolerance() { return sceneMatchTolerance; }
    /** Allowed relative magnification difference for scene equivalence. */
    public double getMagnificationTolerance() { return magnificationTolerance; }
    /** Allowed relative working distance difference for scene equivalence. */
    public double getWorkingDistanceTolerance() { return workingDistanceTolerance; }
    /** Minimum correlation score that confirms a pyramid step. */
    public double getTemplateMatchThreshold() { return templateMatchThreshold; }
    /** A child must be at least this many times the parent's magnification. */
    public double getContainmentRatio() { return containmentRatio; }
    /** Fraction of the child frame allowed to spill outside the parent frame. */
    public double getContainmentGenerosity() { return containmentGenerosity; }
    public double getMinScale() { return minScale; }
    public double getMaxScale() { return maxScale; }
    public double getFallbackScale() { return fallbackScale; }
    /** Longest image side used for correlation; larger images are reduced first. */
    public int getMaxCorrelationDimension() { return maxCorrelationDimension; }
    public List<String> getPreferredModesOrder() { return preferredModesOrder; }
    /** Filename substring that marks a chemical-imaging derivative. */
    public String getChemImageMarker() { return chemImageMarker; }
    /** Extensions stripped when pairing chemical images with regular ones. */
    public List<String> getChemImageExtensions() { return chemImageExtensions; }

    @Override
    public String toString() {
        return String.format("DiscoveryConfig[sceneTol=%.3f, magTol=%.3f, wdTol=%.3f, threshold=%.2f, "
                        + "containment=%.2fx/%.2f, modes=%s, marker=%s]",
                sceneMatchTolerance, magnificationTolerance, workingDistanceTolerance,
                templateMatchThreshold, containmentRatio, containmentGenerosity,
                preferredModesOrder, chemImageMarker);
    }

    public static class Builder {
        private final DiscoveryConfig config = new DiscoveryConfig();

        public Builder sceneMatchTolerance(double tolerance) {
            config.sceneMatchTolerance = tolerance;
            return this;
        }

        public Builder magnificationTolerance(double tolerance) {
            config.magnificationTolerance = tolerance;
            return this;
        }

        public Builder workingDistanceTolerance(double tolerance) {
            config.workingDistanceTolerance = tolerance;
            return this;
        }

        public Builder templateMatchThreshold(double threshold) {
            config.templateMatchThreshold = threshold;
            return this;
        }

        public Builder containmentRatio(double ratio) {
            config.containmentRatio = ratio;
            return this;
        }

        public Builder containmentGenerosity(double generosity) {
            config.containmentGenerosity = generosity;
            return this;
        }

        public Builder scaleRange(double min, double max) {
            config.minScale = min;
            config.maxScale = max;
            return this;
        }

        public Builder fallbackScale(double scale) {
            config.fallbackScale = scale;
            return this;
        }

        public Builder maxCorrelationDimension(int dimension) {
            config.maxCorrelationDimension = dimension;
            return this;
        }

        public Builder preferredModesOrder(List<String> order) {
            config.preferredModesOrder = order == null ? DEFAULT_PREFERRED_MODES : List.copyOf(order);
            return this;
        }

        public Builder chemImageMarker(String marker) {
            config.chemImageMarker = marker;
            return this;
        }

        public Builder chemImageExtensions(List<String> extensions) {
            config.chemImageExtensions = extensions == null ? DEFAULT_CHEM_IMAGE_EXTENSIONS : List.copyOf(extensions);
            return this;
        }

        /**
         * Validates and returns the configuration.
         *
         * @throws IllegalStateException when a tolerance or threshold is outside its range
         */
        public DiscoveryConfig build() {
            if (config.sceneMatchTolerance < 0 || config.magnificationTolerance < 0
                    || config.workingDistanceTolerance < 0) {
                String error = "Tolerances must not be negative: " + config;
                logger.error("Build validation failed: {}", error);
                throw new IllegalStateException(error);
            }
            if (config.templateMatchThreshold < -1 || config.templateMatchThreshold > 1) {
                String error = "Template match threshold must lie in [-1, 1]: " + config.templateMatchThreshold;
                logger.error("Build validation failed: {}", error);
                throw new IllegalStateException(error);
            }
            if (config.containmentGenerosity < 0 || config.containmentGenerosity >= 1) {
                String error = "Containment generosity must lie in [0, 1): " + config.containmentGenerosity;
                logger.error("Build validation failed: {}", error);
                throw new IllegalStateException(error);
            }
            if (config.minScale <= 0 || config.maxScale <= config.minScale
                    || config.fallbackScale <= 0 || config.fallbackScale > 1) {
                String error = String.format("Invalid scale range: [%f, %f], fallback %f",
                        config.minScale, config.maxScale, config.fallbackScale);
                logger.error("Build validation failed: {}", error);
                throw new IllegalStateException(error);
            }
            if (config.maxCorrelationDimension < 16) {
                String error = "Correlation dimension too small: " + config.maxCorrelationDimension;
                logger.error("Build validation failed: {}", error);
                throw new IllegalStateException(error);
            }
            if (config.chemImageMarker == null || config.chemImageMarker.isBlank()) {
                String error = "Chemical image marker must not be blank";
                logger.error("Build validation failed: {}", error);
                throw new IllegalStateException(error);
            }
            logger.debug("Built {}", config);
            // Later builder calls must not leak into a config already handed out
            return config.copy();
        }
    }
}
