package sem.ext.swm.controller;

import sem.ext.swm.model.ImageCollection;
import sem.ext.swm.service.MetadataStore;

import java.util.List;

/**
 * A discovery strategy that groups session images into one kind of collection.
 */
public interface CollectionWorkflow {

    /**
     * @return short workflow name, also used as the collection type in saved files
     */
    String name();

    String description();

    /**
     * Finds every collection of this workflow's kind. Never throws for bad data; images
     * that cannot be used are skipped.
     *
     * @return collections in discovery order, each with at least two members
     */
    List<ImageCollection> discoverCollections(MetadataStore store);
}
