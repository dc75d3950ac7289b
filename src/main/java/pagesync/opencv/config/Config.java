package pagesync.opencv.config;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Point;
import org.yaml.snakeyaml.Yaml;
import pagesync.opencv.quadrangle.ConvexQuadrangle;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the screen tracking and page matching pipeline, read from YAML.
 */
@Slf4j
@Getter @Setter
@ToString
public class Config {

    public static final String DEFAULT_RESOURCE = "pagesync.yml";

    private Video video = new Video();
    private Tracker tracker = new Tracker();
    private PageMatcher pageMatcher = new PageMatcher();
    private Detector detector = new Detector();
    private List<DocumentConfig> documents = new ArrayList<>();

    public static Config load(InputStream in) {
        Config config = new Yaml().loadAs(in, Config.class);
        if (config == null) {
            config = new Config();
        }
        log.debug(config.toString());
        return config;
    }

    /**
     * Reads {@code pathname}, or the {@value #DEFAULT_RESOURCE} classpath resource when it is
     * {@code null}.
     */
    public static Config load(String pathname) throws IOException {
        if (pathname != null) {
            try (InputStream in = Files.newInputStream(Path.of(pathname))) {
                return load(in);
            }
        }
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing configuration resource " + DEFAULT_RESOURCE);
            }
            return load(in);
        }
    }

    @Getter @Setter
    @ToString
    public static class Video {
        private String source;
        /** Frames waiting for processing; the oldest is dropped beyond this. */
        private int queueLimit = 64;
    }

    @Getter @Setter
    @ToString
    public static class Tracker {
        private Integer windowSize = 2;
    }

    @Getter @Setter
    @ToString
    public static class PageMatcher {
        private Integer windowSize = 5;
        private int sampleSize = 1000;
        private double correlationThreshold = 0.5;
        private double significanceLevel = 0.05;
        private boolean useHomography = false;
        private boolean parallel = false;
        private Long seed;
        private int numFeatures = 500;
        private double goodMatchPercentage = 0.15;
        private String descriptorMatcherType = "BruteForce-Hamming";
        private String findHomographyMethod = "RANSAC";
        private String rescaleInterpolation = "INTER_AREA";
        private int featureCacheSize = 64;
    }

    @Getter @Setter
    @ToString
    public static class Detector {
        /** {@code static} or {@code contour}. */
        private String type = "static";
        private List<ScreenConfig> screens = new ArrayList<>();
        private int threshold = 150;
        private double minArea = 2500;
    }

    /**
     * Corners of a screen as {@code [x, y]} pairs.
     */
    @Getter @Setter
    @ToString
    public static class ScreenConfig {
        private List<Double> topLeft;
        private List<Double> topRight;
        private List<Double> bottomLeft;
        private List<Double> bottomRight;

        public ConvexQuadrangle toQuadrangle() {
            return new ConvexQuadrangle(point(topLeft, "topLeft"), point(topRight, "topRight"),
                    point(bottomLeft, "bottomLeft"), point(bottomRight, "bottomRight"));
        }

        private static Point point(List<Double> coordinates, String name) {
            if (coordinates == null || coordinates.size() != 2) {
                throw new IllegalArgumentException("Screen corner " + name + " must be an [x, y] pair, got " + coordinates);
            }
            return new Point(coordinates.get(0), coordinates.get(1));
        }
    }

    @Getter @Setter
    @ToString
    public static class DocumentConfig {
        private String title;
        private String author;
        private List<String> pages = new ArrayList<>();
    }
}
