package sem.ext.swm.service;

import sem.ext.swm.model.ImageCollection;

/**
 * Destination for accepted collections.
 */
public interface CollectionStore {

    /**
     * Stores a collection under its id, replacing any earlier version.
     *
     * @return true if the collection was stored
     */
    boolean save(String id, ImageCollection collection);
}
