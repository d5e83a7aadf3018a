package sem.ext.swm.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sem.ext.swm.model.ImageRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link MetadataStore} backed by an insertion-ordered map.
 */
public class InMemoryMetadataStore implements MetadataStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryMetadataStore.class);

    private final Map<String, ImageRecord> records = new LinkedHashMap<>();

    public InMemoryMetadataStore() {
    }

    public InMemoryMetadataStore(Collection<ImageRecord> records) {
        records.forEach(this::add);
    }

    /**
     * Adds or replaces the record under its reference. Replacing keeps the original position.
     */
    public void add(ImageRecord record) {
        if (records.put(record.getReference(), record) != null) {
            logger.debug("Replaced metadata for {}", record.getReference());
        }
    }

    @Override
    public Map<String, ImageRecord> getRecords() {
        return Collections.unmodifiableMap(records);
    }
}
