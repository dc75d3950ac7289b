package pagesync.opencv.page;

import lombok.Getter;
import org.opencv.core.Mat;

import java.util.function.Supplier;

/**
 * A page of a {@link Document}. The RGBA image is loaded on first use and kept; fully transparent
 * pixels carry no information.
 */
public class DocumentPage {

    @Getter
    private final Document document;
    @Getter
    private final int number;
    private final Supplier<Mat> imageLoader;
    private Mat image;

    DocumentPage(Document document, int number, Supplier<Mat> imageLoader) {
        this.document = document;
        this.number = number;
        this.imageLoader = imageLoader;
    }

    public synchronized Mat getImage() {
        if (image == null) {
            image = imageLoader.get();
        }
        return image;
    }

    /**
     * Unique among all pages of all documents: the document URI and the page number.
     */
    public String getKey() {
        return document.getUri() + "#" + number;
    }

    @Override
    public String toString() {
        return getKey();
    }
}
