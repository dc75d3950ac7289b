package pagesync.opencv.page;

import nu.pattern.OpenCV;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;
import pagesync.opencv.frame.Frame;
import pagesync.opencv.frame.Screen;
import pagesync.opencv.quadrangle.ConvexQuadrangle;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class ResizingPageAlignerTest {

    @BeforeAll
    static void loadOpenCv() {
        OpenCV.loadLocally();
    }

    @Test
    void stretchesPageOverScreen() {
        Frame frame = new Frame(1, new Mat(48, 64, CvType.CV_8UC4, new Scalar(0, 0, 0, 255)));
        Screen screen = new Screen(frame, ConvexQuadrangle.ofRectangle(0, 0, 64, 48));
        Mat pageImage = new Mat(24, 32, CvType.CV_8UC4, new Scalar(10, 20, 30, 255));
        DocumentPage page = Document.fromImages("small", Collections.singletonList(pageImage)).getPages().get(0);

        Mat aligned = new ResizingPageAligner(Imgproc.INTER_AREA).align(screen, page);
        assertThat(aligned).isNotSameAs(pageImage);
        assertThat(aligned.width()).isEqualTo(64);
        assertThat(aligned.height()).isEqualTo(48);
        assertThat(aligned.get(40, 60)).containsExactly(10, 20, 30, 255);
    }

    @Test
    void pageOfScreenSizeIsUsedAsIs() {
        Frame frame = new Frame(1, new Mat(48, 64, CvType.CV_8UC4, new Scalar(0, 0, 0, 255)));
        Screen screen = new Screen(frame, ConvexQuadrangle.ofRectangle(0, 0, 64, 48));
        Mat pageImage = new Mat(48, 64, CvType.CV_8UC4, new Scalar(1, 2, 3, 255));
        DocumentPage page = Document.fromImages("same", Collections.singletonList(pageImage)).getPages().get(0);

        assertThat(new ResizingPageAligner(Imgproc.INTER_AREA).align(screen, page)).isSameAs(pageImage);
    }
}
