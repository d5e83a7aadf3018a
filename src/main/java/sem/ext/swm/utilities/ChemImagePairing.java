package sem.ext.swm.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sem.ext.swm.model.ImageRecord;
import sem.ext.swm.preferences.DiscoveryConfig;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Pairs chemical-imaging derivatives with the regular image they were computed from.
 *
 * <p>The instrument writes the derivative next to the source with a marker in the name,
 * e.g. {@code site3_ChemiSEM.tiff} for {@code site3.tiff}. Pairing is purely by name so
 * it survives stage positions that were re-read or rounded differently.</p>
 */
public class ChemImagePairing {
    private static final Logger logger = LoggerFactory.getLogger(ChemImagePairing.class);

    private final String marker;
    private final List<String> extensions;

    public ChemImagePairing(DiscoveryConfig config) {
        Objects.requireNonNull(config, "config");
        this.marker = config.getChemImageMarker();
        this.extensions = config.getChemImageExtensions();
    }

    public boolean isChemicalImage(String filename) {
        return filename != null && filename.contains(marker);
    }

    /**
     * Strips the marker (with a leading underscore if present) and a known extension.
     * {@code site3_ChemiSEM.tiff} and {@code site3.tif} both become {@code site3}.
     */
    public String normalizedName(String filename) {
        if (filename == null) {
            return null;
        }
        String name = filename.replace("_" + marker, "").replace(marker, "");
        String lower = name.toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (lower.endsWith(extension.toLowerCase(Locale.ROOT))) {
                return name.substring(0, name.length() - extension.length());
            }
        }
        return name;
    }

    /**
     * Matches each chemical image with the regular image of the same normalized name.
     *
     * @param records records in store order
     * @return chemical image reference mapped to its regular counterpart's reference, in
     *         store order of the chemical images; unpaired chemical images are absent
     */
    public Map<String, String> pair(List<ImageRecord> records) {
        Map<String, String> regularByName = new LinkedHashMap<>();
        for (ImageRecord record : records) {
            if (!isChemicalImage(record.getFilename())) {
                regularByName.putIfAbsent(normalizedName(record.getFilename()), record.getReference());
            }
        }

        Map<String, String> pairs = new LinkedHashMap<>();
        int chemCount = 0;
        for (ImageRecord record : records) {
            if (!isChemicalImage(record.getFilename())) {
                continue;
            }
            chemCount++;
            String regular = regularByName.get(normalizedName(record.getFilename()));
            if (regular != null) {
                pairs.put(record.getReference(), regular);
                logger.debug("Paired chemical image {} with {}", record.getFilename(), regular);
            } else {
                logger.debug("No regular image found for chemical image {}", record.getFilename());
            }
        }
        logger.info("Found {} regular and {} chemical images, {} paired",
                records.size() - chemCount, chemCount, pairs.size());
        return pairs;
    }
}
