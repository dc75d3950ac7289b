package pagesync.opencv.page;

import org.opencv.core.Mat;
import pagesync.opencv.frame.Screen;

/**
 * Maps a page image into the coordinate system of a screen image so that pixels at the same row
 * and column can be compared.
 */
public interface PageAligner {

    /**
     * @return RGBA page image with the dimensions of the screen image; may be the page's own image
     * when no change was needed, which callers must not release
     */
    Mat align(Screen screen, DocumentPage page);
}
