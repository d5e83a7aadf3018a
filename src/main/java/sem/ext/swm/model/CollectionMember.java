package sem.ext.swm.model;

import java.util.List;
import java.util.Objects;

/**
 * One slot of a collection.
 *
 * @param reference image reference (path) shown in this slot
 * @param record metadata snapshot taken when the collection was built
 * @param modeLabel canonical detector mode label
 * @param displayName human readable mode name, used for grid labels
 * @param alternatives other images that fit this slot and can be swapped in
 * @param matchRect for pyramid members after the first, where this frame sits inside
 *                  the previous member; null otherwise
 */
public record CollectionMember(String reference,
                               ImageRecord record,
                               String modeLabel,
                               String displayName,
                               List<String> alternatives,
                               MatchRect matchRect) {

    public CollectionMember {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(record, "record");
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public boolean hasAlternatives() {
        return !alternatives.isEmpty();
    }
}
