package pagesync.opencv.frame;

import lombok.Getter;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * A numbered video frame. Numbering starts at one and consecutive frames have consecutive numbers.
 */
@Getter
public class Frame {

    private final int number;
    /** RGBA image data, {@code CV_8UC4}. */
    private final Mat image;

    public Frame(int number, Mat image) {
        if (image.type() != CvType.CV_8UC4) {
            throw new IllegalArgumentException("Frame image must be CV_8UC4 (RGBA), got " + CvType.typeToString(image.type()));
        }
        this.number = number;
        this.image = image;
    }

    public int getWidth() {
        return image.width();
    }

    public int getHeight() {
        return image.height();
    }

    public void release() {
        image.release();
    }

    @Override
    public String toString() {
        return "frame " + number + " (" + image.width() + "x" + image.height() + ")";
    }
}
