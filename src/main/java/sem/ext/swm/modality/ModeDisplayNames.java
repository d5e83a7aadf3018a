package sem.ext.swm.modality;

import java.util.Locale;

/**
 * Human readable names for mode labels, as printed on grid cells and in captions.
 */
public final class ModeDisplayNames {

    private ModeDisplayNames() {
        // Utility class - no instantiation
    }

    /**
     * @param modeLabel canonical label from {@link ModeClassifier}
     * @param highVoltageKv accelerating voltage, or null to omit it
     * @return e.g. {@code "Topo 136° 15 kV"}
     */
    public static String displayName(String modeLabel, Double highVoltageKv) {
        String base = baseName(modeLabel);
        if (highVoltageKv == null) {
            return base;
        }
        return base + " " + (int) Math.abs(highVoltageKv) + " kV";
    }

    static String baseName(String modeLabel) {
        if (modeLabel == null || modeLabel.isEmpty()) {
            return "Unknown";
        }
        return switch (modeLabel) {
            case ModeClassifier.SED -> "SED";
            case ModeClassifier.BSD -> "BSD";
            case ModeClassifier.BSD_ALL -> "BSD All";
            case ModeClassifier.TOPO_H -> "Topo 136°";
            case ModeClassifier.TOPO_V -> "Topo 44°";
            case ModeClassifier.TOPO -> "Topo";
            case ModeClassifier.CHEMSEM -> "ChemSEM";
            case ModeClassifier.MIX -> "Mix";
            case ModeClassifier.UNKNOWN -> "Unknown";
            case "edx" -> "EDX";
            default -> modeLabel.toUpperCase(Locale.ROOT);
        };
    }
}
