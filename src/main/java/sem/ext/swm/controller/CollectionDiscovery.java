package sem.ext.swm.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sem.ext.swm.modality.ModeClassifier;
import sem.ext.swm.model.ImageCollection;
import sem.ext.swm.preferences.DiscoveryConfig;
import sem.ext.swm.service.CollectionStore;
import sem.ext.swm.service.MetadataStore;
import sem.ext.swm.utilities.ChemImagePairing;
import sem.ext.swm.utilities.NccTemplateMatcher;
import sem.ext.swm.utilities.SpatialMatcher;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Runs every collection workflow over a session and hands the results to a store.
 *
 * <pre>{@code
 * CollectionDiscovery discovery = CollectionDiscovery.standard(config, new JsonCollectionStore(dir));
 * List<ImageCollection> found = discovery.discoverAll(metadataStore);
 * }</pre>
 */
public class CollectionDiscovery {
    private static final Logger logger = LoggerFactory.getLogger(CollectionDiscovery.class);

    private final List<CollectionWorkflow> workflows;
    private final CollectionStore collectionStore;

    /**
     * @param collectionStore receives each accepted collection; may be null
     */
    public CollectionDiscovery(List<CollectionWorkflow> workflows, CollectionStore collectionStore) {
        this.workflows = List.copyOf(Objects.requireNonNull(workflows, "workflows"));
        this.collectionStore = collectionStore;
    }

    /**
     * Pyramid and mode grid discovery with the default pixel correlator.
     */
    public static CollectionDiscovery standard(DiscoveryConfig config, CollectionStore collectionStore) {
        ModeClassifier classifier = new ModeClassifier(config);
        SpatialMatcher matcher = new SpatialMatcher(config, classifier);
        List<CollectionWorkflow> workflows = List.of(
                new PyramidBuilder(config, classifier, matcher, new NccTemplateMatcher(config)),
                new ModeCollectionBuilder(config, classifier, matcher, new ChemImagePairing(config),
                        null, collectionStore));
        return new CollectionDiscovery(workflows, collectionStore);
    }

    public List<CollectionWorkflow> getWorkflows() {
        return workflows;
    }

    /**
     * @return every collection found, in workflow order
     */
    public List<ImageCollection> discoverAll(MetadataStore store) {
        List<ImageCollection> all = new ArrayList<>();
        if (store.getRecords().isEmpty()) {
            logger.info("No images in session, nothing to discover");
            return all;
        }
        logger.info("Discovering collections in {} images", store.getRecords().size());
        Set<String> ids = new HashSet<>();

        for (CollectionWorkflow workflow : workflows) {
            List<ImageCollection> found;
            try {
                found = workflow.discoverCollections(store);
            } catch (RuntimeException e) {
                logger.error("{} discovery failed", workflow.name(), e);
                continue;
            }
            logger.info("{}: {} collections", workflow.name(), found.size());
            for (ImageCollection collection : CollectionIds.disambiguate(found, ids)) {
                save(collection);
                all.add(collection);
            }
        }
        return all;
    }

    private void save(ImageCollection collection) {
        if (collectionStore == null) {
            return;
        }
        try {
            if (!collectionStore.save(collection.getId(), collection)) {
                logger.warn("Collection {} was not saved", collection.getId());
            }
        } catch (RuntimeException e) {
            logger.error("Saving collection {} failed", collection.getId(), e);
        }
    }
}
