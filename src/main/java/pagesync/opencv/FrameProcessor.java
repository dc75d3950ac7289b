package pagesync.opencv;

import lombok.extern.slf4j.Slf4j;
import pagesync.opencv.frame.Frame;
import pagesync.opencv.page.DocumentPage;
import pagesync.opencv.page.PageMatcher;
import pagesync.opencv.quadrangle.ConvexQuadrangle;
import pagesync.opencv.quadrangle.QuadrangleTracker;
import pagesync.opencv.quadrangle.TrackedQuadrangle;
import pagesync.opencv.quadrangle.TrackerUpdate;
import pagesync.opencv.screen.ScreenDetector;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;

/**
 * Runs every frame through screen detection, screen tracking and page matching, and keeps the
 * verdicts of the latest frame.
 */
@Slf4j
public class FrameProcessor implements Runnable {

    private static final int LOG_STEP = 100;

    private final Queue<Frame> frames;
    private final ScreenDetector screenDetector;
    private final QuadrangleTracker tracker;
    private final PageMatcher pageMatcher;
    private final FpsMeter fpsMeter = new FpsMeter("processing");
    private final Map<Integer, String> shownPages = new HashMap<>();

    private volatile boolean stopped = false;
    private volatile boolean inputFinished = false;
    private volatile Map<String, String> latestDetections = Collections.emptyMap();
    private volatile long processedFrames = 0;

    public FrameProcessor(Queue<Frame> frames, ScreenDetector screenDetector, QuadrangleTracker tracker,
                          PageMatcher pageMatcher) {
        this.frames = frames;
        this.screenDetector = screenDetector;
        this.tracker = tracker;
        this.pageMatcher = pageMatcher;
    }

    @Override
    public void run() {
        while (!stopped) {
            try {
                Frame frame = frames.poll();
                if (frame == null) {
                    if (inputFinished) {
                        break;
                    }
                    Thread.sleep(10);
                } else {
                    process(frame);
                    frame.release();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stopped = true;
            } catch (Exception e) {
                stopped = true;
                throw new IllegalStateException(e);
            }
        }
        stopped = true;
        log.debug("frame processor finished after " + processedFrames + " frames");
        fpsMeter.summary();
    }

    /**
     * Processes one frame synchronously.
     *
     * @return the page shown in every screen of the frame
     */
    public Map<ConvexQuadrangle, Optional<DocumentPage>> process(Frame frame) {
        Collection<ConvexQuadrangle> quadrangles = screenDetector.detect(frame);
        TrackerUpdate update = tracker.update(quadrangles);
        Map<ConvexQuadrangle, Optional<DocumentPage>> detectedPages = pageMatcher.detect(frame, update);

        for (TrackedQuadrangle screen : update.getDisappeared()) {
            String page = shownPages.remove(screen.getMovingQuadrangle().getId());
            log.info("frame " + frame.getNumber() + ": screen #" + screen.getMovingQuadrangle().getId()
                    + " disappeared" + (page == null ? "" : " showing " + page));
        }
        logPageChanges(frame, update.getAppeared(), detectedPages);
        logPageChanges(frame, update.getExisting(), detectedPages);

        Map<String, String> detections = new LinkedHashMap<>();
        detectedPages.forEach((quadrangle, page) ->
                detections.put(quadrangle.toString(), page.map(DocumentPage::getKey).orElse(null)));
        latestDetections = Collections.unmodifiableMap(detections);

        processedFrames++;
        fpsMeter.measure();
        if (processedFrames % LOG_STEP == 0) {
            log.debug("processed " + processedFrames + " frames, " + tracker.size() + " screens, "
                    + frames.size() + " queued, " + String.format("%.2f", fpsMeter.getFps()) + " FPS");
        }
        return detectedPages;
    }

    private void logPageChanges(Frame frame, List<TrackedQuadrangle> screens,
                                Map<ConvexQuadrangle, Optional<DocumentPage>> detectedPages) {
        for (TrackedQuadrangle screen : screens) {
            int id = screen.getMovingQuadrangle().getId();
            String page = detectedPages.getOrDefault(screen.getQuadrangle(), Optional.empty())
                    .map(DocumentPage::getKey).orElse(null);
            boolean known = shownPages.containsKey(id);
            String previous = shownPages.put(id, page);
            if (!known || (page == null ? previous != null : !page.equals(previous))) {
                log.info("frame " + frame.getNumber() + ": screen #" + id + " shows "
                        + (page == null ? "no page" : page));
            }
        }
    }

    /**
     * No more frames will be queued; the processor stops once the queue is drained.
     */
    public void finishInput() {
        inputFinished = true;
    }

    public void stop() {
        stopped = true;
    }

    public boolean isStopped() {
        return stopped;
    }

    public Map<String, String> getLatestDetections() {
        return latestDetections;
    }

    public long getProcessedFrames() {
        return processedFrames;
    }

    public int getTrackedScreens() {
        return tracker.size();
    }

    public double getFps() {
        return fpsMeter.getFps();
    }
}
