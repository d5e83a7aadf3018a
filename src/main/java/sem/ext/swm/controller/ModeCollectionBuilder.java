package sem.ext.swm.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sem.ext.swm.modality.ModeClassifier;
import sem.ext.swm.modality.ModeDisplayNames;
import sem.ext.swm.model.CollectionKind;
import sem.ext.swm.model.CollectionMember;
import sem.ext.swm.model.ImageCollection;
import sem.ext.swm.model.ImageRecord;
import sem.ext.swm.preferences.DiscoveryConfig;
import sem.ext.swm.service.CollectionStore;
import sem.ext.swm.service.MetadataStore;
import sem.ext.swm.utilities.ChemImagePairing;
import sem.ext.swm.utilities.SpatialMatcher;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Discovers mode grids: the same field of view imaged with different detectors.
 *
 * <p>Two sources of groups are merged:</p>
 * <ul>
 *   <li>operator tags: records sharing a {@code Collection} value</li>
 *   <li>positions: records at exactly the same stage coordinates, with chemical-imaging
 *       derivatives attached to their source image by file name</li>
 * </ul>
 * <p>A group needs at least two distinct modes to become a collection. Members are sorted
 * by the preferred mode order; images sharing a mode list each other as alternatives.</p>
 *
 * <p>{@link #switchImageAlternative} is the one supported change to a built collection.</p>
 */
public class ModeCollectionBuilder implements CollectionWorkflow {
    private static final Logger logger = LoggerFactory.getLogger(ModeCollectionBuilder.class);

    public static final String NAME = CollectionKind.MODE_GRID.getWorkflowName();
    static final int UNLISTED_MODE_KEY = 999;

    /**
     * Where a candidate group came from.
     */
    public enum GroupSource { TAG, POSITION }

    /**
     * Records proposed as one mode grid, before sorting.
     *
     * @param key tag value or position key, used in the collection id
     */
    public record CandidateGroup(GroupSource source, String key, List<ImageRecord> records) {
        public CandidateGroup {
            records = List.copyOf(records);
        }

        public Set<String> references() {
            Set<String> refs = new HashSet<>();
            for (ImageRecord record : records) {
                refs.add(record.getReference());
            }
            return refs;
        }
    }

    private final DiscoveryConfig config;
    private final ModeClassifier classifier;
    private final SpatialMatcher matcher;
    private final ChemImagePairing pairing;
    private final CollectionStore collectionStore;
    private MetadataStore metadataStore;

    public ModeCollectionBuilder(DiscoveryConfig config, ModeClassifier classifier,
                                 SpatialMatcher matcher, ChemImagePairing pairing) {
        this(config, classifier, matcher, pairing, null, null);
    }

    /**
     * @param metadataStore store used to look up swapped-in images; replaced by the store of
     *                      the latest {@link #discoverCollections} call. May be null.
     * @param collectionStore where swapped collections are saved again. May be null.
     */
    public ModeCollectionBuilder(DiscoveryConfig config, ModeClassifier classifier,
                                 SpatialMatcher matcher, ChemImagePairing pairing,
                                 MetadataStore metadataStore, CollectionStore collectionStore) {
        this.config = Objects.requireNonNull(config, "config");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.pairing = Objects.requireNonNull(pairing, "pairing");
        this.metadataStore = metadataStore;
        this.collectionStore = collectionStore;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "The same area imaged with different detectors or modes";
    }

    @Override
    public List<ImageCollection> discoverCollections(MetadataStore store) {
        this.metadataStore = store;
        List<ImageRecord> records = new ArrayList<>(store.getRecords().values());

        List<CandidateGroup> tagGroups = discoverByTag(records);
        List<CandidateGroup> positionGroups = discoverByPosition(records);
        List<CandidateGroup> merged = merge(tagGroups, positionGroups);

        List<ImageCollection> collections = new ArrayList<>();
        for (CandidateGroup group : merged) {
            collections.add(buildCollection(group));
        }
        logger.info("Found {} mode grids ({} from tags, {} from positions before merging)",
                collections.size(), tagGroups.size(), positionGroups.size());
        return CollectionIds.disambiguate(collections, new HashSet<>());
    }

    /**
     * Groups valid records by their {@code Collection} tag.
     */
    public List<CandidateGroup> discoverByTag(List<ImageRecord> records) {
        Map<String, List<ImageRecord>> byTag = new LinkedHashMap<>();
        for (ImageRecord record : records) {
            String tag = record.getCollectionTag();
            if (tag != null && record.isValid()) {
                byTag.computeIfAbsent(tag, k -> new ArrayList<>()).add(record);
            }
        }

        List<CandidateGroup> groups = new ArrayList<>();
        for (Map.Entry<String, List<ImageRecord>> entry : byTag.entrySet()) {
            List<ImageRecord> members = entry.getValue();
            if (members.size() < 2) {
                logger.debug("Tag {} has a single image, skipped", entry.getKey());
                continue;
            }
            if (distinctModes(members) < 2) {
                logger.debug("Tag {} has only one mode, skipped", entry.getKey());
                continue;
            }
            groups.add(new CandidateGroup(GroupSource.TAG, entry.getKey(), members));
        }
        return groups;
    }

    /**
     * Groups valid records by exact stage position. Chemical images join the group of the
     * regular image they were derived from, wherever it was recorded.
     */
    public List<CandidateGroup> discoverByPosition(List<ImageRecord> records) {
        List<ImageRecord> valid = new ArrayList<>();
        for (ImageRecord record : records) {
            if (record.isValid()) {
                valid.add(record);
            } else {
                logger.debug("Skipping invalid record {}", record.getFilename());
            }
        }
        Map<String, String> chemToRegular = pairing.pair(valid);

        Map<String, List<ImageRecord>> byPosition = new LinkedHashMap<>();
        Map<String, String> positionOfReference = new HashMap<>();
        for (ImageRecord record : valid) {
            if (pairing.isChemicalImage(record.getFilename())) {
                continue;
            }
            String key = positionKey(record);
            byPosition.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
            positionOfReference.put(record.getReference(), key);
        }

        for (ImageRecord record : valid) {
            if (!pairing.isChemicalImage(record.getFilename())) {
                continue;
            }
            String regular = chemToRegular.get(record.getReference());
            String key = regular != null ? positionOfReference.get(regular) : positionKey(record);
            byPosition.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
            if (regular != null) {
                logger.debug("Added chemical image {} to position group {}", record.getFilename(), key);
            }
        }

        List<CandidateGroup> groups = new ArrayList<>();
        for (Map.Entry<String, List<ImageRecord>> entry : byPosition.entrySet()) {
            List<ImageRecord> members = entry.getValue();
            int modes = distinctModes(members);
            logger.debug("Position group {}: {} images, {} modes", entry.getKey(), members.size(), modes);
            if (modes < 2) {
                continue;
            }
            reportOutliers(entry.getKey(), members);
            groups.add(new CandidateGroup(GroupSource.POSITION, entry.getKey(), members));
        }
        return groups;
    }

    /**
     * Drops position groups with exactly the same images as an earlier group. Tag groups
     * come first, so they win.
     */
    public List<CandidateGroup> merge(List<CandidateGroup> tagGroups, List<CandidateGroup> positionGroups) {
        List<CandidateGroup> merged = new ArrayList<>();
        Set<Set<String>> seen = new HashSet<>();
        for (CandidateGroup group : tagGroups) {
            if (seen.add(group.references())) {
                merged.add(group);
            }
        }
        for (CandidateGroup group : positionGroups) {
            if (seen.add(group.references())) {
                merged.add(group);
            } else {
                logger.debug("Position group {} duplicates an earlier group", group.key());
            }
        }
        return merged;
    }

    /**
     * Turns a group into a collection. Every record becomes a member; the member order
     * follows the preferred mode order, with unlisted modes last in encounter order.
     */
    public ImageCollection buildCollection(CandidateGroup group) {
        List<ImageRecord> sorted = new ArrayList<>(group.records());
        Map<String, String> labels = new HashMap<>();
        for (ImageRecord record : sorted) {
            labels.put(record.getReference(), classifier.classify(record));
        }
        sorted.sort(Comparator.comparingInt(r -> modeSortKey(labels.get(r.getReference()))));

        List<CollectionMember> members = new ArrayList<>();
        for (ImageRecord record : sorted) {
            String label = labels.get(record.getReference());
            List<String> alternatives = new ArrayList<>();
            for (ImageRecord other : sorted) {
                if (other != record && label.equals(labels.get(other.getReference()))) {
                    alternatives.add(other.getReference());
                }
            }
            members.add(new CollectionMember(record.getReference(), record, label,
                    ModeDisplayNames.displayName(label, record.getHighVoltageKv()), alternatives, null));
        }

        String id = "mode_grid_" + group.key();
        String description = group.source() == GroupSource.TAG
                ? "Images tagged " + group.key()
                : "Different modes at position " + group.key();
        ImageCollection collection = new ImageCollection(id, CollectionKind.MODE_GRID, members, description);
        logger.info("Mode grid {}: {} images, modes {}", id, collection.size(), collection.getModes());
        return collection;
    }

    /**
     * Replaces the image in one slot with one of its alternatives.
     *
     * <p>The previous image becomes an alternative of the slot. When the chosen image is
     * itself shown in another slot, the two slots exchange images. Returns the given
     * collection unchanged if it is not a mode grid, the slot does not exist, the
     * reference is not an alternative of the slot or its metadata is unknown.</p>
     *
     * @return the updated collection, or {@code collection} itself when nothing changed
     */
    public ImageCollection switchImageAlternative(ImageCollection collection, int slotIndex, String alternativeRef) {
        if (collection == null || collection.getKind() != CollectionKind.MODE_GRID) {
            logger.warn("Alternative swap is only supported for mode grids");
            return collection;
        }
        if (slotIndex < 0 || slotIndex >= collection.size()) {
            logger.warn("Slot {} out of range for {}", slotIndex, collection.getId());
            return collection;
        }
        CollectionMember current = collection.getMembers().get(slotIndex);
        if (alternativeRef == null || !current.alternatives().contains(alternativeRef)) {
            logger.warn("{} is not an alternative for slot {} of {}", alternativeRef, slotIndex, collection.getId());
            return collection;
        }
        ImageRecord replacement = metadataStore == null ? null : metadataStore.getRecord(alternativeRef);
        if (replacement == null) {
            logger.warn("No metadata for alternative {}", alternativeRef);
            return collection;
        }

        ImageCollection updated = collection.withMember(slotIndex,
                memberFor(replacement, current.alternatives(), alternativeRef, current.reference(), current));

        List<CollectionMember> members = updated.getMembers();
        for (int i = 0; i < members.size(); i++) {
            CollectionMember other = members.get(i);
            if (i != slotIndex && other.reference().equals(alternativeRef)) {
                updated = updated.withMember(i,
                        memberFor(current.record(), other.alternatives(), current.reference(), alternativeRef, other));
                break;
            }
        }

        logger.info("Slot {} of {} switched from {} to {}", slotIndex, collection.getId(),
                current.reference(), alternativeRef);
        if (collectionStore != null && !collectionStore.save(updated.getId(), updated)) {
            logger.warn("Could not save updated collection {}", updated.getId());
        }
        return updated;
    }

    private CollectionMember memberFor(ImageRecord record, List<String> alternatives,
                                       String removed, String added, CollectionMember previous) {
        Set<String> updated = new LinkedHashSet<>(alternatives);
        updated.remove(removed);
        updated.add(added);
        String label = classifier.classify(record);
        return new CollectionMember(record.getReference(), record, label,
                ModeDisplayNames.displayName(label, record.getHighVoltageKv()),
                new ArrayList<>(updated), previous.matchRect());
    }

    int modeSortKey(String label) {
        List<String> order = config.getPreferredModesOrder();
        for (int i = 0; i < order.size(); i++) {
            if (label.startsWith(order.get(i))) {
                return i;
            }
        }
        return UNLISTED_MODE_KEY;
    }

    private int distinctModes(List<ImageRecord> records) {
        Set<String> modes = new HashSet<>();
        for (ImageRecord record : records) {
            modes.add(classifier.classify(record));
        }
        return modes.size();
    }

    /**
     * Logs members that would not pass the scene tolerance against the group's first
     * regular image. They stay in the group.
     */
    private void reportOutliers(String key, List<ImageRecord> members) {
        ImageRecord anchor = null;
        for (ImageRecord record : members) {
            if (!pairing.isChemicalImage(record.getFilename())) {
                anchor = record;
                break;
            }
        }
        if (anchor == null) {
            return;
        }
        for (ImageRecord record : members) {
            if (record != anchor && !matcher.positionsMatch(anchor, record)) {
                logger.info("{} grouped at {} but outside scene tolerance of {}",
                        record.getFilename(), key, anchor.getFilename());
            }
        }
    }

    static String positionKey(ImageRecord record) {
        // 0.0 and -0.0 are the same stage position
        return (record.getStageX() + 0.0) + "_" + (record.getStageY() + 0.0);
    }
}
