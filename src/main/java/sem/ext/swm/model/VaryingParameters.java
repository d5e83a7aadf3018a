package sem.ext.swm.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Flags telling the caption and label layers which acquisition parameters differ
 * between the members of a collection.
 *
 * @param highVoltage more than one accelerating voltage observed
 * @param emissionCurrent more than one emission current observed
 * @param integrations more than one frame integration count observed
 */
public record VaryingParameters(boolean highVoltage, boolean emissionCurrent, boolean integrations) {

    /**
     * Computes the flags over a set of records. Missing values are ignored.
     */
    public static VaryingParameters of(List<ImageRecord> records) {
        Set<Double> voltages = new HashSet<>();
        Set<Double> currents = new HashSet<>();
        Set<Integer> frameCounts = new HashSet<>();
        for (ImageRecord record : records) {
            voltages.add(record.getHighVoltageKv());
            currents.add(record.getEmissionCurrentUa());
            frameCounts.add(record.getIntegrations());
        }
        voltages.removeIf(Objects::isNull);
        currents.removeIf(Objects::isNull);
        frameCounts.removeIf(Objects::isNull);
        return new VaryingParameters(voltages.size() > 1, currents.size() > 1, frameCounts.size() > 1);
    }
}
