package sem.ext.swm.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured metadata for a single SEM micrograph.
 *
 * <p>Records are produced by the metadata extraction layer and consumed read-only by the
 * collection discovery engine. Every field except the reference may be missing; the
 * engine only matches records for which {@link #isValid()} holds.</p>
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * ImageRecord record = new ImageRecord.Builder("/session/img_001.tif")
 *     .pixels(1024, 943)
 *     .fieldOfView(26.9, 24.8)
 *     .magnification(5000.0)
 *     .detector("SED")
 *     .highVoltageKv(15.0)
 *     .stagePosition(1203.5, -88.1)
 *     .build();
 * }</pre>
 *
 * <p>Units: field of view and stage position in micrometers, pixel size in nanometers,
 * working distance in millimeters, emission current in microamperes.</p>
 *
 * @since 0.1.0
 */
public class ImageRecord {
    private static final Logger logger = LoggerFactory.getLogger(ImageRecord.class);

    /** Free-form key carrying an operator-assigned collection name. */
    public static final String COLLECTION_KEY = "Collection";
    /** Free-form key some exports use for the emission current. */
    public static final String EMISSION_CURRENT_KEY = "emission_current_uA";
    /** Free-form key some exports use for the frame integration count. */
    public static final String INTEGRATIONS_KEY = "integrations";

    /**
     * Width of the reference display (the 127 mm Polaroid frame) used by SEM vendors to
     * define magnification, in micrometers.
     */
    public static final double REFERENCE_DISPLAY_WIDTH_UM = 127_000.0;

    private final String reference;
    private String filename;

    private Integer pixelsWidth;
    private Integer pixelsHeight;
    private Double pixelSizeNm;
    private Double fieldOfViewWidth;
    private Double fieldOfViewHeight;
    private Double magnification;

    private String detector;
    private Map<String, Double> detectorMixFactors;
    private Double highVoltageKv;
    private Double workingDistanceMm;
    private Double emissionCurrentUa;
    private Integer integrations;

    private Double stageX;
    private Double stageY;

    private Map<String, Object> additionalParams = Collections.emptyMap();

    private ImageRecord(String reference) {
        this.reference = reference;
    }

    public String getReference() { return reference; }
    public String getFilename() { return filename; }
    public Integer getPixelsWidth() { return pixelsWidth; }
    public Integer getPixelsHeight() { return pixelsHeight; }
    public Double getPixelSizeNm() { return pixelSizeNm; }
    public Double getFieldOfViewWidth() { return fieldOfViewWidth; }
    public Double getFieldOfViewHeight() { return fieldOfViewHeight; }
    public Double getMagnification() { return magnification; }
    public String getDetector() { return detector; }
    public Double getHighVoltageKv() { return highVoltageKv; }
    public Double getWorkingDistanceMm() { return workingDistanceMm; }
    public Double getStageX() { return stageX; }
    public Double getStageY() { return stageY; }

    /**
     * Per-segment detector mix weights, keyed by segment name (bsdA..bsdD).
     *
     * @return unmodifiable weights, or null when the acquisition recorded none
     */
    public Map<String, Double> getDetectorMixFactors() { return detectorMixFactors; }

    /**
     * @return unmodifiable free-form parameters, never null
     */
    public Map<String, Object> getAdditionalParams() { return additionalParams; }

    /**
     * Emission current in µA, falling back to the free-form parameter when the
     * typed field was not filled by the extractor.
     */
    public Double getEmissionCurrentUa() {
        if (emissionCurrentUa != null) {
            return emissionCurrentUa;
        }
        return asDouble(additionalParams.get(EMISSION_CURRENT_KEY));
    }

    /**
     * Frame integration count, falling back to the free-form parameter.
     */
    public Integer getIntegrations() {
        if (integrations != null) {
            return integrations;
        }
        Double value = asDouble(additionalParams.get(INTEGRATIONS_KEY));
        return value != null ? (int) Math.round(value) : null;
    }

    /**
     * @return the trimmed {@code Collection} tag, or null when absent or blank
     */
    public String getCollectionTag() {
        Object tag = additionalParams.get(COLLECTION_KEY);
        if (tag == null) {
            return null;
        }
        String text = tag.toString().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Magnification as stored, or derived from the field of view width against the
     * reference display width when the instrument did not record it.
     *
     * @return magnification, or null when neither is available
     */
    public Double getEffectiveMagnification() {
        if (magnification != null && magnification > 0) {
            return magnification;
        }
        if (fieldOfViewWidth != null && fieldOfViewWidth > 0) {
            return REFERENCE_DISPLAY_WIDTH_UM / fieldOfViewWidth;
        }
        return null;
    }

    /**
     * A record takes part in matching only when pixel geometry, stage position and
     * field of view are all present.
     */
    public boolean isValid() {
        return pixelsWidth != null && pixelsHeight != null
                && stageX != null && stageY != null
                && fieldOfViewWidth != null && fieldOfViewHeight != null;
    }

    private ImageRecord copy() {
        ImageRecord copy = new ImageRecord(reference);
        copy.filename = filename;
        copy.pixelsWidth = pixelsWidth;
        copy.pixelsHeight = pixelsHeight;
        copy.pixelSizeNm = pixelSizeNm;
        copy.fieldOfViewWidth = fieldOfViewWidth;
        copy.fieldOfViewHeight = fieldOfViewHeight;
        copy.magnification = magnification;
        copy.detector = detector;
        copy.detectorMixFactors = detectorMixFactors;
        copy.highVoltageKv = highVoltageKv;
        copy.workingDistanceMm = workingDistanceMm;
        copy.emissionCurrentUa = emissionCurrentUa;
        copy.integrations = integrations;
        copy.stageX = stageX;
        copy.stageY = stageY;
        copy.additionalParams = additionalParams;
        return copy;
    }

    private static Double asDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                logger.debug("Ignoring non-numeric parameter value: {}", value);
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageRecord other)) return false;
        return reference.equals(other.reference)
                && Objects.equals(filename, other.filename)
                && Objects.equals(pixelsWidth, other.pixelsWidth)
                && Objects.equals(pixelsHeight, other.pixelsHeight)
                && Objects.equals(pixelSizeNm, other.pixelSizeNm)
                && Objects.equals(fieldOfViewWidth, other.fieldOfViewWidth)
                && Objects.equals(fieldOfViewHeight, other.fieldOfViewHeight)
                && Objects.equals(magnification, other.magnification)
                && Objects.equals(detector, other.detector)
                && Objects.equals(detectorMixFactors, other.detectorMixFactors)
                && Objects.equals(highVoltageKv, other.highVoltageKv)
                && Objects.equals(workingDistanceMm, other.workingDistanceMm)
                && Objects.equals(emissionCurrentUa, other.emissionCurrentUa)
                && Objects.equals(integrations, other.integrations)
                && Objects.equals(stageX, other.stageX)
                && Objects.equals(stageY, other.stageY)
                && Objects.equals(additionalParams, other.additionalParams);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reference, filename, detector, stageX, stageY, magnification);
    }

    @Override
    public String toString() {
        return String.format("ImageRecord[%s, detector=%s, mag=%s, pos=(%s, %s)]",
                filename, detector, magnification, stageX, stageY);
    }

    /**
     * Builder for {@link ImageRecord}. Only the reference is required.
     */
    public static class Builder {
        private final ImageRecord record;

        public Builder(String reference) {
            Objects.requireNonNull(reference, "reference");
            this.record = new ImageRecord(reference);
        }

        /**
         * Starts a builder pre-filled with every field of an existing record.
         */
        public static Builder from(ImageRecord source) {
            Builder builder = new Builder(source.reference)
                    .filename(source.filename)
                    .pixels(source.pixelsWidth, source.pixelsHeight)
                    .pixelSizeNm(source.pixelSizeNm)
                    .fieldOfView(source.fieldOfViewWidth, source.fieldOfViewHeight)
                    .magnification(source.magnification)
                    .detector(source.detector)
                    .highVoltageKv(source.highVoltageKv)
                    .workingDistanceMm(source.workingDistanceMm)
                    .emissionCurrentUa(source.emissionCurrentUa)
                    .integrations(source.integrations)
                    .stagePosition(source.stageX, source.stageY)
                    .additionalParams(source.additionalParams);
            if (source.detectorMixFactors != null) {
                builder.detectorMixFactors(source.detectorMixFactors);
            }
            return builder;
        }

        public Builder filename(String filename) {
            record.filename = filename;
            return this;
        }

        public Builder pixels(Integer width, Integer height) {
            record.pixelsWidth = width;
            record.pixelsHeight = height;
            return this;
        }

        public Builder pixelSizeNm(Double pixelSizeNm) {
            record.pixelSizeNm = pixelSizeNm;
            return this;
        }

        public Builder fieldOfView(Double width, Double height) {
            record.fieldOfViewWidth = width;
            record.fieldOfViewHeight = height;
            return this;
        }

        public Builder magnification(Double magnification) {
            record.magnification = magnification;
            return this;
        }

        public Builder detector(String detector) {
            record.detector = detector;
            return this;
        }

        public Builder detectorMixFactors(Map<String, Double> factors) {
            record.detectorMixFactors = factors == null
                    ? null
                    : Collections.unmodifiableMap(new LinkedHashMap<>(factors));
            return this;
        }

        public Builder highVoltageKv(Double kv) {
            record.highVoltageKv = kv;
            return this;
        }

        public Builder workingDistanceMm(Double mm) {
            record.workingDistanceMm = mm;
            return this;
        }

        public Builder emissionCurrentUa(Double ua) {
            record.emissionCurrentUa = ua;
            return this;
        }

        public Builder integrations(Integer integrations) {
            record.integrations = integrations;
            return this;
        }

        public Builder stagePosition(Double x, Double y) {
            record.stageX = x;
            record.stageY = y;
            return this;
        }

        public Builder additionalParams(Map<String, ?> params) {
            record.additionalParams = params == null
                    ? Collections.emptyMap()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(params));
            return this;
        }

        /**
         * Convenience for setting the {@code Collection} tag alongside any existing parameters.
         */
        public Builder collectionTag(String tag) {
            Map<String, Object> params = new LinkedHashMap<>(record.additionalParams);
            params.put(COLLECTION_KEY, tag);
            record.additionalParams = Collections.unmodifiableMap(params);
            return this;
        }

        public ImageRecord build() {
            if (record.filename == null) {
                Object name = Paths.get(record.reference).getFileName();
                record.filename = name != null ? name.toString() : record.reference;
            }
            logger.trace("Built {}", record);
            return record.copy();
        }
    }
}
