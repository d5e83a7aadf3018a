package sem.ext.swm.service;

import sem.ext.swm.model.ImageRecord;

import java.util.Map;

/**
 * Read-only view of the metadata extracted for a session's images.
 */
public interface MetadataStore {

    /**
     * @return image reference mapped to its record, in insertion order
     */
    Map<String, ImageRecord> getRecords();

    /**
     * @return the record for a reference, or null when unknown
     */
    default ImageRecord getRecord(String reference) {
        return getRecords().get(reference);
    }
}
