package sem.ext.swm.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A discovered group of images handed to rendering and export.
 *
 * <p>Collections are immutable once built. Summary fields (reference position and field
 * of view, modes, magnifications, varying parameter flags) are derived from the members
 * at construction time; the first member is the reference. Rebuilding means running
 * discovery again; the only supported change to an existing collection is swapping in
 * an alternative image, which produces a new instance through {@link #withMember}.</p>
 *
 * <p>A collection always has at least two members.</p>
 */
public final class ImageCollection {

    private final String id;
    private final CollectionKind kind;
    private final List<CollectionMember> members;
    private final String description;

    private final Double referenceX;
    private final Double referenceY;
    private final Double referenceFieldOfViewWidth;
    private final Double referenceFieldOfViewHeight;
    private final Double highVoltageKv;
    private final List<String> modes;
    private final List<Double> magnifications;
    private final VaryingParameters varyingParameters;

    public ImageCollection(String id, CollectionKind kind, List<CollectionMember> members, String description) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(members, "members");
        if (members.size() < 2) {
            throw new IllegalArgumentException(
                    "A collection needs at least 2 members, got " + members.size() + " for " + id);
        }
        this.id = id;
        this.kind = kind;
        this.members = List.copyOf(members);
        this.description = description;

        ImageRecord reference = this.members.get(0).record();
        this.referenceX = reference.getStageX();
        this.referenceY = reference.getStageY();
        this.referenceFieldOfViewWidth = reference.getFieldOfViewWidth();
        this.referenceFieldOfViewHeight = reference.getFieldOfViewHeight();
        this.highVoltageKv = reference.getHighVoltageKv();

        Set<String> distinctModes = new LinkedHashSet<>();
        List<Double> mags = new ArrayList<>();
        List<ImageRecord> records = new ArrayList<>();
        for (CollectionMember member : this.members) {
            distinctModes.add(member.modeLabel());
            mags.add(member.record().getEffectiveMagnification());
            records.add(member.record());
        }
        this.modes = List.copyOf(distinctModes);
        this.magnifications = Collections.unmodifiableList(mags);
        this.varyingParameters = VaryingParameters.of(records);
    }

    /**
     * Returns a copy of this collection with one slot replaced. Summary fields are
     * recomputed from the new member list.
     */
    public ImageCollection withMember(int index, CollectionMember replacement) {
        List<CollectionMember> updated = new ArrayList<>(members);
        updated.set(index, replacement);
        return new ImageCollection(id, kind, updated, description);
    }

    /**
     * @return a copy of this collection stored under another id
     */
    public ImageCollection withId(String newId) {
        return new ImageCollection(newId, kind, members, description);
    }

    public String getId() { return id; }
    public CollectionKind getKind() { return kind; }
    public List<CollectionMember> getMembers() { return members; }
    public String getDescription() { return description; }
    public Double getReferenceX() { return referenceX; }
    public Double getReferenceY() { return referenceY; }
    public Double getReferenceFieldOfViewWidth() { return referenceFieldOfViewWidth; }
    public Double getReferenceFieldOfViewHeight() { return referenceFieldOfViewHeight; }

    /**
     * @return voltage of the reference member; shared by all members of a pyramid
     */
    public Double getHighVoltageKv() { return highVoltageKv; }

    /**
     * @return distinct mode labels in member order
     */
    public List<String> getModes() { return modes; }

    /**
     * @return effective magnification of each member in member order (may contain null)
     */
    public List<Double> getMagnifications() { return magnifications; }

    public VaryingParameters getVaryingParameters() { return varyingParameters; }

    public int size() {
        return members.size();
    }

    /**
     * Match rectangles of a pyramid in chain order, one per adjacent member pair.
     * Empty for mode grids.
     */
    public List<MatchRect> getMatchRects() {
        List<MatchRect> rects = new ArrayList<>();
        for (CollectionMember member : members) {
            if (member.matchRect() != null) {
                rects.add(member.matchRect());
            }
        }
        return rects;
    }

    /**
     * @return the set of image references, used to detect duplicate groups
     */
    public Set<String> getMemberReferences() {
        Set<String> refs = new LinkedHashSet<>();
        for (CollectionMember member : members) {
            refs.add(member.reference());
        }
        return refs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageCollection other)) return false;
        return id.equals(other.id) && kind == other.kind
                && members.equals(other.members)
                && Objects.equals(description, other.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, members);
    }

    @Override
    public String toString() {
        return String.format("%s[%s, %d members, modes=%s]", kind.getWorkflowName(), id, members.size(), modes);
    }
}
