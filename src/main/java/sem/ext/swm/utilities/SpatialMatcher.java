package sem.ext.swm.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sem.ext.swm.modality.ModeClassifier;
import sem.ext.swm.model.ImageRecord;
import sem.ext.swm.preferences.DiscoveryConfig;

import java.util.Objects;

/**
 * Geometric tests between two records.
 *
 * <ul>
 *   <li>{@link #positionsMatch} decides whether two frames show the same scene, for
 *       grouping images taken with different detectors.</li>
 *   <li>{@link #contains} is the cheap pre-filter for magnification pyramids: can the
 *       child frame plausibly sit inside the parent frame? It is necessary but not
 *       sufficient; pixel correlation confirms it.</li>
 * </ul>
 *
 * <p>Invalid records (see {@link ImageRecord#isValid()}) never match anything.</p>
 */
public class SpatialMatcher {
    private static final Logger logger = LoggerFactory.getLogger(SpatialMatcher.class);

    private final DiscoveryConfig config;
    private final ModeClassifier classifier;

    public SpatialMatcher(DiscoveryConfig config, ModeClassifier classifier) {
        this.config = Objects.requireNonNull(config, "config");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    /**
     * Same as {@link #positionsMatch(ImageRecord, ImageRecord, double)} with the
     * configured scene match tolerance.
     */
    public boolean positionsMatch(ImageRecord a, ImageRecord b) {
        return positionsMatch(a, b, config.getSceneMatchTolerance());
    }

    /**
     * Decides whether two records describe the same scene.
     *
     * <p>Bit-identical stage positions always match. Otherwise the X and Y offsets,
     * relative to the smaller field of view, must both be within {@code tolerance}, and
     * magnification and working distance must agree within their own tolerances. Two
     * records carrying the same {@code Collection} tag match regardless of the numbers.</p>
     *
     * @param tolerance allowed offset as a fraction of the smaller field of view
     */
    public boolean positionsMatch(ImageRecord a, ImageRecord b, double tolerance) {
        if (a == null || b == null || !a.isValid() || !b.isValid()) {
            return false;
        }
        if (sameValue(a.getStageX(), b.getStageX()) && sameValue(a.getStageY(), b.getStageY())) {
            return true;
        }
        if (tagsMatch(a, b)) {
            logger.debug("{} and {} share collection tag {}", a.getFilename(), b.getFilename(), a.getCollectionTag());
            return true;
        }

        boolean positionMatch = positionWithin(a, b, tolerance);
        boolean magMatch = ratioWithin(a.getEffectiveMagnification(), b.getEffectiveMagnification(),
                config.getMagnificationTolerance());
        boolean wdMatch = ratioWithin(a.getWorkingDistanceMm(), b.getWorkingDistanceMm(),
                config.getWorkingDistanceTolerance());

        logger.trace("Scene match {} vs {}: position={}, magnification={}, workingDistance={}",
                a.getFilename(), b.getFilename(), positionMatch, magMatch, wdMatch);
        return positionMatch && magMatch && wdMatch;
    }

    /**
     * Pre-filter for pyramid steps.
     *
     * <p>Requires the same mode label and voltage, a child magnification of at least
     * {@code containmentRatio} times the parent's, and the child frame, shrunk by the
     * containment generosity around its centre, to lie inside the parent frame.</p>
     */
    public boolean contains(ImageRecord parent, ImageRecord child) {
        if (parent == null || child == null || !parent.isValid() || !child.isValid()) {
            return false;
        }
        Double parentMag = parent.getEffectiveMagnification();
        Double childMag = child.getEffectiveMagnification();
        if (parentMag == null || childMag == null) {
            return false;
        }
        if (childMag < parentMag * config.getContainmentRatio()) {
            return false;
        }
        if (!Objects.equals(parent.getHighVoltageKv(), child.getHighVoltageKv())) {
            return false;
        }
        if (!classifier.classify(parent).equals(classifier.classify(child))) {
            return false;
        }

        StageRect parentRect = frameOf(parent);
        StageRect childRect = frameOf(child).scaled(1.0 - config.getContainmentGenerosity());
        boolean inside = parentRect.contains(childRect);
        logger.trace("Containment {} in {}: {} within {} -> {}",
                child.getFilename(), parent.getFilename(), childRect, parentRect, inside);
        return inside;
    }

    /**
     * @return the stage rectangle covered by a valid record's frame
     */
    public static StageRect frameOf(ImageRecord record) {
        return StageRect.centered(record.getStageX(), record.getStageY(),
                record.getFieldOfViewWidth(), record.getFieldOfViewHeight());
    }

    private static boolean positionWithin(ImageRecord a, ImageRecord b, double tolerance) {
        double fovWidth = Math.min(a.getFieldOfViewWidth(), b.getFieldOfViewWidth());
        double fovHeight = Math.min(a.getFieldOfViewHeight(), b.getFieldOfViewHeight());
        if (!(fovWidth > 0) || !(fovHeight > 0)) {
            return false;
        }
        double xDiff = Math.abs(a.getStageX() - b.getStageX()) / fovWidth;
        double yDiff = Math.abs(a.getStageY() - b.getStageY()) / fovHeight;
        return xDiff <= tolerance && yDiff <= tolerance;
    }

    /**
     * Relative deviation {@code |a - b| / max(a, b)} within tolerance. A value missing on
     * either side does not veto the match.
     */
    static boolean ratioWithin(Double a, Double b, double tolerance) {
        if (a == null || b == null) {
            return true;
        }
        double larger = Math.max(Math.abs(a), Math.abs(b));
        if (larger == 0.0) {
            return true;
        }
        return Math.abs(a - b) / larger <= tolerance;
    }

    private static boolean sameValue(Double a, Double b) {
        return a.doubleValue() == b.doubleValue() || a.equals(b);
    }

    private static boolean tagsMatch(ImageRecord a, ImageRecord b) {
        String tagA = a.getCollectionTag();
        return tagA != null && tagA.equals(b.getCollectionTag());
    }
}
