package sem.ext.swm.modality;

import sem.ext.swm.model.ImageRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a record says about its detector, reduced to the three shapes the mode ladder
 * distinguishes: nothing recorded, a named detector, or a mixed acquisition with
 * optional per-segment weights.
 */
public interface DetectorReading {

    /** Detector name that denotes a weighted mix of backscatter segments. */
    String MIX_DETECTOR = "mix";
    /** Key under which some exports nest the mix weights inside the free-form parameters. */
    String MIX_FACTORS_KEY = "detectorMixFactors";
    /** Segment channel names, in A..D order. */
    String[] SEGMENTS = {"bsdA", "bsdB", "bsdC", "bsdD"};

    /** No detector recorded. */
    record Unset() implements DetectorReading { }

    /** A single named detector, as written by the instrument. */
    record Named(String name) implements DetectorReading { }

    /**
     * A mixed acquisition.
     *
     * @param weights segment weights keyed by segment name, or null when none could be found
     */
    record Mixed(Map<String, Double> weights) implements DetectorReading {
        public boolean hasWeights() {
            return weights != null && !weights.isEmpty();
        }

        public double weight(String segment) {
            if (weights == null) {
                return 0.0;
            }
            Double w = weights.get(segment);
            return w == null || w.isNaN() ? 0.0 : w;
        }
    }

    /**
     * Reads the detector fields of a record.
     */
    static DetectorReading of(ImageRecord record) {
        String detector = record.getDetector();
        if (detector == null || detector.isBlank()) {
            return new Unset();
        }
        String name = detector.trim();
        if (MIX_DETECTOR.equalsIgnoreCase(name)) {
            return new Mixed(reconcileWeights(record));
        }
        return new Named(name);
    }

    /**
     * Finds the segment weights wherever the extractor left them: the typed field, a map
     * nested in the free-form parameters, or flattened {@code detectorMixFactors_bsdX} keys.
     *
     * @return weights for the segments found, or null when none were found
     */
    static Map<String, Double> reconcileWeights(ImageRecord record) {
        Map<String, Double> structured = pickSegments(record.getDetectorMixFactors());
        if (structured != null) {
            return structured;
        }
        Map<String, Object> params = record.getAdditionalParams();
        if (params.get(MIX_FACTORS_KEY) instanceof Map<?, ?> nested) {
            Map<String, Double> fromNested = pickSegments(nested);
            if (fromNested != null) {
                return fromNested;
            }
        }
        Map<String, Object> flattened = new LinkedHashMap<>();
        for (String segment : SEGMENTS) {
            Object value = params.get(MIX_FACTORS_KEY + "_" + segment);
            if (value != null) {
                flattened.put(segment, value);
            }
        }
        return pickSegments(flattened);
    }

    private static Map<String, Double> pickSegments(Map<?, ?> source) {
        if (source == null || source.isEmpty()) {
            return null;
        }
        Map<String, Double> weights = new LinkedHashMap<>();
        for (String segment : SEGMENTS) {
            Double value = toDouble(source.get(segment));
            if (value != null) {
                weights.put(segment, value);
            }
        }
        return weights.isEmpty() ? null : Collections.unmodifiableMap(weights);
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
