package sem.ext.swm;

import sem.ext.swm.model.ImageRecord;

/**
 * Record fixtures shared by the tests. Frames are 1024 x 768 pixels with a 4:3 field of view.
 */
public final class TestRecords {

    private TestRecords() {
    }

    public static ImageRecord.Builder builder(String filename, String detector,
                                              double x, double y, double fovWidth) {
        return new ImageRecord.Builder("/session/" + filename)
                .pixels(1024, 768)
                .fieldOfView(fovWidth, fovWidth * 0.75)
                .detector(detector)
                .highVoltageKv(15.0)
                .stagePosition(x, y);
    }

    public static ImageRecord record(String filename, String detector, double x, double y, double fovWidth) {
        return builder(filename, detector, x, y, fovWidth).build();
    }

    public static ImageRecord tagged(String filename, String detector, double x, double y, String tag) {
        return builder(filename, detector, x, y, 100.0).collectionTag(tag).build();
    }
}
