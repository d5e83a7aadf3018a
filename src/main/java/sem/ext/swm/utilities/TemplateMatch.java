package sem.ext.swm.utilities;

import sem.ext.swm.model.MatchRect;

/**
 * Best placement of a scaled high-magnification frame inside a low-magnification frame.
 *
 * @param rect placement in the low-magnification image's pixel space
 * @param score normalized cross-correlation at that placement, in [-1, 1]
 */
public record TemplateMatch(MatchRect rect, double score) {
}
