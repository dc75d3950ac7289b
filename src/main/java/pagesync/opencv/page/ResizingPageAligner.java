package pagesync.opencv.page;

import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import pagesync.opencv.frame.Screen;

/**
 * Stretches the page over the whole screen.
 */
public class ResizingPageAligner implements PageAligner {

    private final int interpolation;

    public ResizingPageAligner(int interpolation) {
        this.interpolation = interpolation;
    }

    @Override
    public Mat align(Screen screen, DocumentPage page) {
        Mat pageImage = page.getImage();
        if (pageImage.width() == screen.getWidth() && pageImage.height() == screen.getHeight()) {
            return pageImage;
        }
        Mat resized = new Mat();
        Imgproc.resize(pageImage, resized, new Size(screen.getWidth(), screen.getHeight()), 0, 0, interpolation);
        return resized;
    }
}
