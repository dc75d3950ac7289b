package pagesync.opencv.page;

import pagesync.opencv.frame.Frame;
import pagesync.opencv.quadrangle.ConvexQuadrangle;
import pagesync.opencv.quadrangle.TrackedQuadrangle;
import pagesync.opencv.quadrangle.TrackerUpdate;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which document page, if any, every tracked screen shows. Frames must be presented in
 * increasing order of their numbers.
 */
public interface PageMatcher {

    /**
     * @return for every appeared and existing screen, the page it shows or an empty optional
     */
    Map<ConvexQuadrangle, Optional<DocumentPage>> detect(Frame frame,
                                                         Collection<TrackedQuadrangle> appeared,
                                                         Collection<TrackedQuadrangle> existing,
                                                         Collection<TrackedQuadrangle> disappeared);

    default Map<ConvexQuadrangle, Optional<DocumentPage>> detect(Frame frame, TrackerUpdate update) {
        return detect(frame, update.getAppeared(), update.getExisting(), update.getDisappeared());
    }
}
