package pagesync.opencv.screen;

import pagesync.opencv.frame.Frame;
import pagesync.opencv.quadrangle.ConvexQuadrangle;

import java.util.Collection;

/**
 * Finds projection screens in video frames.
 */
public interface ScreenDetector {

    Collection<ConvexQuadrangle> detect(Frame frame);
}
