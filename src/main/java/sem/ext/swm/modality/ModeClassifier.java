package sem.ext.swm.modality;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sem.ext.swm.model.ImageRecord;
import sem.ext.swm.preferences.DiscoveryConfig;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Derives the canonical detector mode label of a record.
 *
 * <p>The label is resolved by an ordered ladder of rules; the first rule that answers
 * wins and the last rule always answers, so every record gets exactly one label:</p>
 * <ol>
 *   <li>filename carries the chemical-image marker: {@value #CHEMSEM}</li>
 *   <li>no detector recorded: {@value #UNKNOWN}</li>
 *   <li>direct detectors: {@value #SED}, {@value #BSD}, {@value #BSD_ALL}</li>
 *   <li>mixed acquisition: {@value #TOPO_H} / {@value #TOPO_V} from the segment weights,
 *       {@value #TOPO} on an exact tie, {@value #MIX} without weights</li>
 *   <li>anything else: the detector name in lower case</li>
 * </ol>
 *
 * <p>Classification is a pure function of the filename, detector field and mix weights.</p>
 *
 * <pre>{@code
 * ModeClassifier classifier = new ModeClassifier(DiscoveryConfig.defaults());
 * String label = classifier.classify(record);          // "topo-h"
 * String qualified = classifier.qualifiedLabel(record); // "topo-h_15kv"
 * }</pre>
 */
public class ModeClassifier {
    private static final Logger logger = LoggerFactory.getLogger(ModeClassifier.class);

    public static final String CHEMSEM = "chemsem";
    public static final String UNKNOWN = "unknown";
    public static final String SED = "sed";
    public static final String BSD = "bsd";
    public static final String BSD_ALL = "bsd-all";
    public static final String MIX = "mix";
    public static final String TOPO = "topo";
    public static final String TOPO_H = "topo-h";
    public static final String TOPO_V = "topo-v";

    /**
     * One step of the ladder.
     */
    @FunctionalInterface
    interface ModeRule {
        /**
         * @return the label, or null to defer to the next rule
         */
        String apply(ImageRecord record, DetectorReading reading);
    }

    private final String chemImageMarker;
    private final List<ModeRule> ladder;

    public ModeClassifier(DiscoveryConfig config) {
        Objects.requireNonNull(config, "config");
        this.chemImageMarker = config.getChemImageMarker();
        this.ladder = List.of(
                this::chemicalImage,
                ModeClassifier::unset,
                ModeClassifier::directDetector,
                ModeClassifier::mixedSegments,
                ModeClassifier::rawName);
    }

    /**
     * @return the canonical mode label, never null
     */
    public String classify(ImageRecord record) {
        Objects.requireNonNull(record, "record");
        DetectorReading reading = DetectorReading.of(record);
        for (ModeRule rule : ladder) {
            String label = rule.apply(record, reading);
            if (label != null) {
                logger.trace("{} classified as {}", record.getFilename(), label);
                return label;
            }
        }
        // rawName answers for every reading that reaches it
        throw new IllegalStateException("Mode ladder produced no label for " + record.getFilename());
    }

    /**
     * Mode label with the accelerating voltage appended, e.g. {@code sed_15kv}. Used for
     * captions and file naming, not for grouping.
     */
    public String qualifiedLabel(ImageRecord record) {
        String label = classify(record);
        Double kv = record.getHighVoltageKv();
        if (kv == null) {
            return label;
        }
        double volts = Math.abs(kv);
        String number = volts == Math.rint(volts) ? String.valueOf((long) volts) : String.valueOf(volts);
        return label + "_" + number + "kv";
    }

    /**
     * @return true when the filename marks a chemical-imaging derivative
     */
    public boolean isChemicalImage(ImageRecord record) {
        String filename = record.getFilename();
        return filename != null && filename.contains(chemImageMarker);
    }

    private String chemicalImage(ImageRecord record, DetectorReading reading) {
        return isChemicalImage(record) ? CHEMSEM : null;
    }

    private static String unset(ImageRecord record, DetectorReading reading) {
        return reading instanceof DetectorReading.Unset ? UNKNOWN : null;
    }

    private static String directDetector(ImageRecord record, DetectorReading reading) {
        if (reading instanceof DetectorReading.Named named) {
            return switch (named.name().toLowerCase(Locale.ROOT)) {
                case SED -> SED;
                case BSD -> BSD;
                case BSD_ALL -> BSD_ALL;
                default -> null;
            };
        }
        return null;
    }

    /**
     * Topographic mixes weight opposing backscatter segments. Segments B and C oppose
     * horizontally (about 136 degrees), A and D vertically (about 44 degrees).
     */
    private static String mixedSegments(ImageRecord record, DetectorReading reading) {
        if (!(reading instanceof DetectorReading.Mixed mixed)) {
            return null;
        }
        if (!mixed.hasWeights()) {
            return MIX;
        }
        double horizontal = Math.abs(mixed.weight("bsdB")) + Math.abs(mixed.weight("bsdC"));
        double vertical = Math.abs(mixed.weight("bsdA")) + Math.abs(mixed.weight("bsdD"));
        if (horizontal > vertical) {
            return TOPO_H;
        } else if (vertical > horizontal) {
            return TOPO_V;
        }
        logger.debug("Balanced segment weights for {}: {}", record.getFilename(), mixed.weights());
        return TOPO;
    }

    private static String rawName(ImageRecord record, DetectorReading reading) {
        if (reading instanceof DetectorReading.Named named) {
            return named.name().toLowerCase(Locale.ROOT);
        }
        return UNKNOWN;
    }
}
