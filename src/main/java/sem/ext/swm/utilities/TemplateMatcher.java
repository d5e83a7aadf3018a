package sem.ext.swm.utilities;

import sem.ext.swm.model.ImageRecord;

import java.io.IOException;

/**
 * Locates a higher-magnification image inside a lower-magnification one.
 *
 * <p>Implementations report the best placement found and its score; deciding whether the
 * score is good enough is up to the caller.</p>
 */
public interface TemplateMatcher {

    /**
     * @param low record of the lower-magnification image (the search image)
     * @param high record of the higher-magnification image (the template)
     * @param scale factor applied to the template so it has the low image's pixel scale
     * @return best placement and its correlation score
     * @throws IOException when either image cannot be read, or the scaled template does
     *                     not fit inside the search image
     */
    TemplateMatch match(ImageRecord low, ImageRecord high, double scale) throws IOException;
}
