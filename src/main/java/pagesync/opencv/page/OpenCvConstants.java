package pagesync.opencv.page;

import org.opencv.calib3d.Calib3d;
import org.opencv.imgproc.Imgproc;

import java.util.HashMap;
import java.util.Map;

/**
 * Resolves configured names of OpenCV flags.
 */
public final class OpenCvConstants {

    private static final Map<String, Integer> INTERPOLATIONS = new HashMap<>();
    private static final Map<String, Integer> HOMOGRAPHY_METHODS = new HashMap<>();

    static {
        INTERPOLATIONS.put("INTER_NEAREST", Imgproc.INTER_NEAREST);
        INTERPOLATIONS.put("INTER_LINEAR", Imgproc.INTER_LINEAR);
        INTERPOLATIONS.put("INTER_CUBIC", Imgproc.INTER_CUBIC);
        INTERPOLATIONS.put("INTER_AREA", Imgproc.INTER_AREA);
        INTERPOLATIONS.put("INTER_LANCZOS4", Imgproc.INTER_LANCZOS4);

        HOMOGRAPHY_METHODS.put("LEAST_SQUARES", 0);
        HOMOGRAPHY_METHODS.put("RANSAC", Calib3d.RANSAC);
        HOMOGRAPHY_METHODS.put("LMEDS", Calib3d.LMEDS);
        HOMOGRAPHY_METHODS.put("RHO", Calib3d.RHO);
    }

    private OpenCvConstants() {
    }

    public static int interpolation(String name) {
        return resolve(INTERPOLATIONS, name, "interpolation");
    }

    public static int homographyMethod(String name) {
        return resolve(HOMOGRAPHY_METHODS, name, "homography method");
    }

    private static int resolve(Map<String, Integer> constants, String name, String kind) {
        Integer value = name == null ? null : constants.get(name.toUpperCase());
        if (value == null) {
            throw new IllegalArgumentException("Unknown " + kind + " " + name + ", expected one of " + constants.keySet());
        }
        return value;
    }
}
