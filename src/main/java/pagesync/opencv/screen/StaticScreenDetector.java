package pagesync.opencv.screen;

import pagesync.opencv.frame.Frame;
import pagesync.opencv.quadrangle.ConvexQuadrangle;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Reports the same screens in every frame, e.g. for a fixed camera whose screens were marked by
 * hand.
 */
public class StaticScreenDetector implements ScreenDetector {

    private final List<ConvexQuadrangle> screens;

    public StaticScreenDetector(Collection<ConvexQuadrangle> screens) {
        this.screens = Collections.unmodifiableList(new ArrayList<>(screens));
    }

    @Override
    public Collection<ConvexQuadrangle> detect(Frame frame) {
        return screens;
    }
}
