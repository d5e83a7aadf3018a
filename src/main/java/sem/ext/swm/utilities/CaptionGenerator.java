package sem.ext.swm.utilities;

import sem.ext.swm.modality.ModeDisplayNames;
import sem.ext.swm.model.CollectionKind;
import sem.ext.swm.model.CollectionMember;
import sem.ext.swm.model.ImageCollection;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Figure captions for discovered collections.
 */
public final class CaptionGenerator {

    static final String UNKNOWN = "Unknown";

    private CaptionGenerator() {
        // Utility class - no instantiation
    }

    /**
     * @param sampleId sample identifier of the session, or null when not known
     */
    public static String caption(ImageCollection collection, String sampleId) {
        String sample = (sampleId == null || sampleId.isBlank()) ? UNKNOWN : sampleId.trim();
        if (collection.getKind() == CollectionKind.PYRAMID) {
            return pyramidCaption(collection, sample);
        }
        return modeGridCaption(collection, sample);
    }

    private static String pyramidCaption(ImageCollection collection, String sample) {
        List<String> modes = collection.getModes();
        String mode = modes.isEmpty() ? UNKNOWN : ModeDisplayNames.displayName(modes.get(0), null);
        Double kv = collection.getHighVoltageKv();
        String voltage = kv == null ? UNKNOWN : formatNumber(kv);
        String series = collection.getMagnifications().stream()
                .map(mag -> mag == null ? "?" : formatNumber(mag) + "x")
                .collect(Collectors.joining(", "));
        return "Sample " + sample + " imaged with " + mode + " detector at " + voltage + " kV.\n"
                + "Magnification series: " + series + ".";
    }

    private static String modeGridCaption(ImageCollection collection, String sample) {
        double width = collection.getReferenceFieldOfViewWidth() == null ? 0 : collection.getReferenceFieldOfViewWidth();
        double height = collection.getReferenceFieldOfViewHeight() == null ? 0 : collection.getReferenceFieldOfViewHeight();
        String modes = collection.getMembers().stream()
                .map(CollectionMember::displayName)
                .map(name -> name == null ? UNKNOWN : name)
                .collect(Collectors.joining(", "));
        return "Sample " + sample + " comparison of imaging modes.\n"
                + String.format(Locale.ROOT, "Field of view: %.1f x %.1f μm.", width, height) + "\n"
                + "Modes shown: " + modes + ".";
    }

    /** Whole numbers without a decimal point, others rounded to one decimal. */
    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
