package sem.ext.swm.utilities;

/**
 * Axis-aligned rectangle on the sample stage, in micrometers.
 *
 * <p>SEM records store the stage position of the frame centre together with the field of
 * view, so rectangles are usually built with {@link #centered}. Corner order does not
 * matter for the two-corner constructor; bounds are normalized by the getters.</p>
 *
 * <pre>{@code
 * StageRect parent = StageRect.centered(0, 0, 100, 80);   // -50..50, -40..40
 * StageRect child  = StageRect.centered(10, 5, 20, 16).scaled(0.5);
 * boolean inside = parent.contains(child);                // true
 * }</pre>
 *
 * <p>No unit or range validation is done; zero-area rectangles are valid.</p>
 *
 * @since 0.1.0
 */
public class StageRect {
    private final double x1;
    private final double y1;
    private final double x2;
    private final double y2;

    /**
     * Creates a rectangle from two corner points given in any order.
     */
    public StageRect(double x1, double y1, double x2, double y2) {
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    /**
     * Creates a rectangle of the given size centred on a stage position.
     *
     * @param centerX stage X of the frame centre
     * @param centerY stage Y of the frame centre
     * @param width field of view width
     * @param height field of view height
     */
    public static StageRect centered(double centerX, double centerY, double width, double height) {
        double halfW = Math.abs(width) / 2.0;
        double halfH = Math.abs(height) / 2.0;
        return new StageRect(centerX - halfW, centerY - halfH, centerX + halfW, centerY + halfH);
    }

    public double getMinX() { return Math.min(x1, x2); }
    public double getMaxX() { return Math.max(x1, x2); }
    public double getMinY() { return Math.min(y1, y2); }
    public double getMaxY() { return Math.max(y1, y2); }
    public double getWidth() { return Math.abs(x2 - x1); }
    public double getHeight() { return Math.abs(y2 - y1); }
    public double getCenterX() { return (x1 + x2) / 2.0; }
    public double getCenterY() { return (y1 + y2) / 2.0; }

    /**
     * Returns a rectangle with the same centre and both sides multiplied by {@code factor}.
     */
    public StageRect scaled(double factor) {
        return centered(getCenterX(), getCenterY(), getWidth() * factor, getHeight() * factor);
    }

    /**
     * @return true when {@code other} lies within this rectangle on both axes, edges included
     */
    public boolean contains(StageRect other) {
        return other.getMinX() >= getMinX() && other.getMaxX() <= getMaxX()
                && other.getMinY() >= getMinY() && other.getMaxY() <= getMaxY();
    }

    @Override
    public String toString() {
        return String.format("StageRect[x=%.3f..%.3f, y=%.3f..%.3f]", getMinX(), getMaxX(), getMinY(), getMaxY());
    }
}
