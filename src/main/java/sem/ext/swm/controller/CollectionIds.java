package sem.ext.swm.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sem.ext.swm.model.ImageCollection;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Keeps collection ids unique within one discovery run. A repeated id gets a numeric
 * suffix: {@code mode_grid_a}, {@code mode_grid_a_2}, {@code mode_grid_a_3}.
 */
final class CollectionIds {
    private static final Logger logger = LoggerFactory.getLogger(CollectionIds.class);

    private CollectionIds() {
    }

    /**
     * @param taken ids already in use; updated with every id returned
     * @return the collections in order, renamed where their id was taken
     */
    static List<ImageCollection> disambiguate(List<ImageCollection> collections, Set<String> taken) {
        List<ImageCollection> result = new ArrayList<>(collections.size());
        for (ImageCollection collection : collections) {
            String id = collection.getId();
            if (taken.add(id)) {
                result.add(collection);
                continue;
            }
            int suffix = 2;
            while (!taken.add(id + "_" + suffix)) {
                suffix++;
            }
            String unique = id + "_" + suffix;
            logger.info("Collection id {} already in use, renamed to {}", id, unique);
            result.add(collection.withId(unique));
        }
        return result;
    }
}
