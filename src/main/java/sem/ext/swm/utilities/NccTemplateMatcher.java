package sem.ext.swm.utilities;

import org.bytedeco.javacpp.DoublePointer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sem.ext.swm.model.ImageRecord;
import sem.ext.swm.model.MatchRect;
import sem.ext.swm.preferences.DiscoveryConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * OpenCV template matcher using {@code TM_CCOEFF_NORMED} (zero-mean normalized cross
 * correlation) over every placement of the template.
 *
 * <p>Both images are read as 8-bit grey. The high-magnification image is resized by the
 * scale factor so it shares the pixel scale of the low-magnification image. When the
 * search image is larger than the configured maximum correlation dimension, both are
 * reduced first and the winning rectangle is mapped back to full resolution.</p>
 *
 * <p>Decoded images are kept in a small per-instance cache, since one overview is usually
 * compared with many zoomed frames.</p>
 *
 * @since 0.1.0
 */
public class NccTemplateMatcher implements TemplateMatcher {
    private static final Logger logger = LoggerFactory.getLogger(NccTemplateMatcher.class);

    private static final int CACHE_SIZE = 16;

    private final int maxDimension;
    private final Map<String, Mat> cache = new LinkedHashMap<>(CACHE_SIZE, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Mat> eldest) {
            if (size() > CACHE_SIZE) {
                eldest.getValue().close();
                return true;
            }
            return false;
        }
    };

    public NccTemplateMatcher(DiscoveryConfig config) {
        this.maxDimension = Objects.requireNonNull(config, "config").getMaxCorrelationDimension();
    }

    @Override
    public TemplateMatch match(ImageRecord low, ImageRecord high, double scale) throws IOException {
        if (!(scale > 0) || Double.isInfinite(scale)) {
            throw new IllegalArgumentException("Scale factor must be positive: " + scale);
        }
        Mat search = load(low);
        Mat template = load(high);

        int templateWidth = (int) Math.round(template.cols() * scale);
        int templateHeight = (int) Math.round(template.rows() * scale);
        if (templateWidth < 1 || templateHeight < 1
                || templateWidth > search.cols() || templateHeight > search.rows()) {
            throw new IOException(String.format("Template %dx%d does not fit in %dx%d search image %s",
                    templateWidth, templateHeight, search.cols(), search.rows(), low.getFilename()));
        }

        // working resolution
        double reduction = 1.0;
        int longest = Math.max(search.cols(), search.rows());
        if (longest > maxDimension) {
            reduction = (double) maxDimension / longest;
        }

        try (Mat searchWork = resized(search, scaledSize(search.cols(), reduction), scaledSize(search.rows(), reduction));
             Mat templateWork = resized(template, scaledSize(templateWidth, reduction), scaledSize(templateHeight, reduction));
             Mat scores = new Mat();
             DoublePointer minScore = new DoublePointer(1);
             DoublePointer maxScore = new DoublePointer(1);
             Point minLoc = new Point();
             Point maxLoc = new Point()) {
            if (templateWork.cols() > searchWork.cols() || templateWork.rows() > searchWork.rows()) {
                throw new IOException("Template does not fit after reduction for " + low.getFilename());
            }
            logger.debug("Correlating {} ({}x{}) in {} ({}x{}), scale {}, reduction {}",
                    high.getFilename(), templateWork.cols(), templateWork.rows(),
                    low.getFilename(), searchWork.cols(), searchWork.rows(),
                    String.format("%.4f", scale), String.format("%.4f", reduction));

            opencv_imgproc.matchTemplate(searchWork, templateWork, scores, opencv_imgproc.TM_CCOEFF_NORMED);
            opencv_core.minMaxLoc(scores, minScore, maxScore, minLoc, maxLoc, null);

            double score = maxScore.get();
            // flat windows can leave NaN in the score map
            score = Double.isFinite(score) ? Math.max(-1.0, Math.min(1.0, score)) : 0.0;

            MatchRect rect = new MatchRect(
                    (int) Math.round(maxLoc.x() / reduction),
                    (int) Math.round(maxLoc.y() / reduction),
                    templateWidth, templateHeight);
            logger.debug("Best placement of {} in {}: {} score {}",
                    high.getFilename(), low.getFilename(), rect, String.format("%.4f", score));
            return new TemplateMatch(rect, score);
        }
    }

    private Mat load(ImageRecord record) throws IOException {
        String reference = record.getReference();
        Mat cached = cache.get(reference);
        if (cached != null) {
            return cached;
        }
        if (!Files.isRegularFile(Paths.get(reference))) {
            throw new IOException("Image file not found: " + reference);
        }
        Mat grey = opencv_imgcodecs.imread(reference, opencv_imgcodecs.IMREAD_GRAYSCALE);
        if (grey == null || grey.empty()) {
            throw new IOException("OpenCV could not decode " + reference);
        }
        cache.put(reference, grey);
        logger.debug("Decoded {} ({}x{})", record.getFilename(), grey.cols(), grey.rows());
        return grey;
    }

    /**
     * @return a new image of the given size; area averaging when shrinking, bilinear otherwise
     */
    static Mat resized(Mat image, int width, int height) {
        if (image.cols() == width && image.rows() == height) {
            return image.clone();
        }
        boolean shrinking = width < image.cols() && height < image.rows();
        Mat result = new Mat();
        try (Size size = new Size(width, height)) {
            opencv_imgproc.resize(image, result, size, 0, 0,
                    shrinking ? opencv_imgproc.INTER_AREA : opencv_imgproc.INTER_LINEAR);
        }
        return result;
    }

    private static int scaledSize(int size, double factor) {
        return Math.max(1, (int) Math.round(size * factor));
    }
}
