package sem.ext.swm.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sem.ext.swm.modality.ModeClassifier;
import sem.ext.swm.modality.ModeDisplayNames;
import sem.ext.swm.model.CollectionKind;
import sem.ext.swm.model.CollectionMember;
import sem.ext.swm.model.ImageCollection;
import sem.ext.swm.model.ImageRecord;
import sem.ext.swm.model.MatchRect;
import sem.ext.swm.preferences.DiscoveryConfig;
import sem.ext.swm.service.MetadataStore;
import sem.ext.swm.utilities.SpatialMatcher;
import sem.ext.swm.utilities.TemplateMatch;
import sem.ext.swm.utilities.TemplateMatcher;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Discovers magnification pyramids: chains of images of the same mode and voltage where
 * each step zooms into the previous frame.
 *
 * <p>Within a (mode, voltage) group, sorted by increasing magnification, a chain grows
 * from its head by taking the first later image that passes the geometric containment
 * check and correlates with the head above the template match threshold. That image
 * becomes the new head. Images already placed in a chain do not start a new one but can
 * still be picked up by later chains.</p>
 *
 * <p>Match rectangles are stored on the higher-magnification member of each step, in the
 * pixel space of the image before it.</p>
 */
public class PyramidBuilder implements CollectionWorkflow {
    private static final Logger logger = LoggerFactory.getLogger(PyramidBuilder.class);

    public static final String NAME = CollectionKind.PYRAMID.getWorkflowName();

    private final DiscoveryConfig config;
    private final ModeClassifier classifier;
    private final SpatialMatcher matcher;
    private final TemplateMatcher templateMatcher;

    public PyramidBuilder(DiscoveryConfig config, ModeClassifier classifier,
                          SpatialMatcher matcher, TemplateMatcher templateMatcher) {
        this.config = Objects.requireNonNull(config, "config");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.templateMatcher = Objects.requireNonNull(templateMatcher, "templateMatcher");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Magnification series of the same area with the same detector and voltage";
    }

    @Override
    public List<ImageCollection> discoverCollections(MetadataStore store) {
        Map<String, List<ImageRecord>> groups = groupByModeAndVoltage(store.getRecords().values());
        logger.info("Searching {} mode/voltage groups for magnification pyramids", groups.size());

        List<ImageCollection> collections = new ArrayList<>();
        for (Map.Entry<String, List<ImageRecord>> entry : groups.entrySet()) {
            List<ImageRecord> sorted = new ArrayList<>(entry.getValue());
            // stable: equal magnifications keep store order
            sorted.sort(Comparator.comparing(ImageRecord::getEffectiveMagnification,
                    Comparator.nullsLast(Comparator.naturalOrder())));
            if (sorted.size() < 2) {
                continue;
            }
            for (List<Step> chain : findChains(sorted)) {
                collections.add(toCollection(chain));
            }
        }
        logger.info("Found {} magnification pyramids", collections.size());
        return CollectionIds.disambiguate(collections, new HashSet<>());
    }

    /**
     * Valid records keyed by mode label and voltage, in store order.
     */
    Map<String, List<ImageRecord>> groupByModeAndVoltage(Iterable<ImageRecord> records) {
        Map<String, List<ImageRecord>> groups = new LinkedHashMap<>();
        for (ImageRecord record : records) {
            if (!record.isValid()) {
                logger.debug("Skipping invalid record {}", record.getFilename());
                continue;
            }
            String key = classifier.classify(record) + "|" + record.getHighVoltageKv();
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        }
        return groups;
    }

    /**
     * Grows chains over one magnification-sorted group.
     */
    List<List<Step>> findChains(List<ImageRecord> sorted) {
        List<List<Step>> chains = new ArrayList<>();
        Set<Integer> consumed = new HashSet<>();

        for (int i = 0; i < sorted.size(); i++) {
            if (consumed.contains(i)) {
                continue;
            }
            List<Step> chain = new ArrayList<>();
            chain.add(new Step(sorted.get(i), null));
            int head = i;

            for (int j = i + 1; j < sorted.size(); j++) {
                ImageRecord parent = sorted.get(head);
                ImageRecord child = sorted.get(j);
                if (!matcher.contains(parent, child)) {
                    continue;
                }
                TemplateMatch match = correlate(parent, child);
                if (match == null) {
                    continue;
                }
                if (match.score() >= config.getTemplateMatchThreshold()) {
                    logger.info("Pyramid step {} -> {} (score {})", parent.getFilename(), child.getFilename(),
                            String.format("%.3f", match.score()));
                    chain.add(new Step(child, match.rect()));
                    consumed.add(j);
                    head = j;
                } else {
                    logger.debug("No match for {} in {}: score {} below {}", child.getFilename(),
                            parent.getFilename(), String.format("%.3f", match.score()),
                            config.getTemplateMatchThreshold());
                }
            }

            if (chain.size() >= 2) {
                chains.add(chain);
            }
        }
        return chains;
    }

    /**
     * @return the match, or null when the pair could not be compared
     */
    private TemplateMatch correlate(ImageRecord parent, ImageRecord child) {
        double scale = scaleFactor(parent, child);
        try {
            return templateMatcher.match(parent, child, scale);
        } catch (IOException e) {
            logger.warn("Cannot compare {} with {}: {}", child.getFilename(), parent.getFilename(), e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("Template matching failed for {} in {}", child.getFilename(), parent.getFilename(), e);
        }
        return null;
    }

    /**
     * Size of the child frame relative to the parent frame: the field of view ratio, or
     * the inverse magnification ratio when a field of view is missing. Values that are
     * not finite or outside the configured range are replaced by the fallback.
     */
    double scaleFactor(ImageRecord parent, ImageRecord child) {
        double scale = Double.NaN;
        Double parentFov = parent.getFieldOfViewWidth();
        Double childFov = child.getFieldOfViewWidth();
        if (parentFov != null && childFov != null && parentFov > 0) {
            scale = childFov / parentFov;
        } else {
            Double parentMag = parent.getEffectiveMagnification();
            Double childMag = child.getEffectiveMagnification();
            if (parentMag != null && childMag != null && childMag > 0) {
                scale = parentMag / childMag;
            }
        }
        if (!Double.isFinite(scale) || scale < config.getMinScale() || scale > config.getMaxScale()) {
            logger.warn("Unusable scale factor {} for {} in {}, using {}", scale,
                    child.getFilename(), parent.getFilename(), config.getFallbackScale());
            return config.getFallbackScale();
        }
        return scale;
    }

    private ImageCollection toCollection(List<Step> chain) {
        ImageRecord first = chain.get(0).record();
        String label = classifier.classify(first);
        Double kv = first.getHighVoltageKv();

        List<CollectionMember> members = new ArrayList<>();
        for (Step step : chain) {
            members.add(new CollectionMember(step.record().getReference(), step.record(), label,
                    ModeDisplayNames.displayName(label, kv), List.of(), step.rect()));
        }
        String id = "mag_grid_" + classifier.qualifiedLabel(first) + "_" + stem(first.getFilename());
        String description = String.format("%s magnification series, %d levels",
                ModeDisplayNames.displayName(label, kv), chain.size());
        return new ImageCollection(id, CollectionKind.PYRAMID, members, description);
    }

    private static String stem(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }

    /**
     * One chain element; the rect places it inside the previous element.
     */
    record Step(ImageRecord record, MatchRect rect) {
    }
}
