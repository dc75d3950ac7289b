package pagesync.opencv.page;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * A document made of page images. Pages are numbered from one.
 */
@Slf4j
public class Document implements Iterable<DocumentPage> {

    private static final AtomicInteger DOCUMENT_COUNTER = new AtomicInteger();

    @Getter
    private final String title;
    @Getter
    private final String author;
    @Getter
    private final String uri;
    @Getter
    private final List<DocumentPage> pages;

    private Document(String title, String author, List<Supplier<Mat>> pageLoaders) {
        if (pageLoaders.isEmpty()) {
            throw new IllegalArgumentException("A document needs at least one page: " + title);
        }
        this.title = title;
        this.author = author;
        this.uri = "urn:pagesync:document:" + DOCUMENT_COUNTER.incrementAndGet();
        List<DocumentPage> pages = new ArrayList<>(pageLoaders.size());
        for (int i = 0; i < pageLoaders.size(); i++) {
            pages.add(new DocumentPage(this, i + 1, pageLoaders.get(i)));
        }
        this.pages = Collections.unmodifiableList(pages);
    }

    /**
     * Pages read lazily from image files and converted to RGBA.
     */
    public static Document fromImageFiles(String title, String author, List<String> pathnames) {
        List<Supplier<Mat>> loaders = new ArrayList<>(pathnames.size());
        for (String pathname : pathnames) {
            loaders.add(() -> readImage(pathname));
        }
        return new Document(title, author, loaders);
    }

    /**
     * Pages from in-memory {@code CV_8UC4} RGBA images.
     */
    public static Document fromImages(String title, List<Mat> rgbaImages) {
        List<Supplier<Mat>> loaders = new ArrayList<>(rgbaImages.size());
        for (Mat image : rgbaImages) {
            if (image.type() != CvType.CV_8UC4) {
                throw new IllegalArgumentException("Page image must be CV_8UC4 (RGBA), got " + CvType.typeToString(image.type()));
            }
            loaders.add(() -> image);
        }
        return new Document(title, null, loaders);
    }

    private static Mat readImage(String pathname) {
        Mat bgr = Imgcodecs.imread(pathname, Imgcodecs.IMREAD_COLOR);
        if (bgr.empty()) {
            throw new IllegalStateException("Cannot read page image " + pathname);
        }
        Mat rgba = new Mat();
        Imgproc.cvtColor(bgr, rgba, Imgproc.COLOR_BGR2RGBA);
        bgr.release();
        log.debug("loaded page image " + pathname + " (" + rgba.width() + "x" + rgba.height() + ")");
        return rgba;
    }

    @Override
    public Iterator<DocumentPage> iterator() {
        return pages.iterator();
    }

    @Override
    public String toString() {
        return uri + (title == null ? "" : " (" + title + ")");
    }
}
