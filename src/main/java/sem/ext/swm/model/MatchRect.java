package sem.ext.swm.model;

/**
 * Where a higher-magnification frame sits inside the lower-magnification frame of a
 * pyramid, in the lower image's pixel space.
 *
 * @param x left edge in pixels
 * @param y top edge in pixels
 * @param width width in pixels
 * @param height height in pixels
 */
public record MatchRect(int x, int y, int width, int height) {

    public MatchRect {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException(
                    String.format("Match rectangle must have non-negative size: %dx%d", width, height));
        }
    }
}
