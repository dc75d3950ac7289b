package pagesync.opencv;

import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.opencv.videoio.VideoCapture;
import pagesync.opencv.frame.Frame;

import java.util.Queue;

/**
 * Reads a video file or stream into a queue of numbered RGBA frames. When the queue holds more
 * than {@code queueLimit} frames the oldest one is dropped, which the page matcher sees as a gap
 * in frame numbers.
 */
@Slf4j
public class VideoCaptureThread implements Runnable {

    private final String source;
    private final Queue<Frame> frames;
    private final int queueLimit;
    private final FpsMeter fpsMeter;
    private volatile boolean stopped = false;
    private long dropped = 0;

    public VideoCaptureThread(String source, Queue<Frame> frames, int queueLimit) {
        this.source = source;
        this.frames = frames;
        this.queueLimit = queueLimit;
        this.fpsMeter = new FpsMeter("capture");
    }

    @Override
    public void run() {
        VideoCapture cap = new VideoCapture();
        log.trace("opening " + source);
        cap.open(source);
        if (!cap.isOpened()) {
            log.error("--(!)Error opening video capture " + source);
            stopped = true;
            return;
        }
        log.debug("Started video capture " + source);

        int number = 0;
        Mat bgr = new Mat();
        while (!stopped) {
            if (!cap.read(bgr) || bgr.empty()) {
                break;
            }
            Mat rgba = new Mat();
            Imgproc.cvtColor(bgr, rgba, Imgproc.COLOR_BGR2RGBA);
            frames.offer(new Frame(++number, rgba));
            while (queueLimit > 0 && frames.size() > queueLimit) {
                Frame oldest = frames.poll();
                if (oldest != null) {
                    oldest.release();
                    dropped++;
                }
            }
            fpsMeter.measure();
        }

        bgr.release();
        cap.release();
        stopped = true;
        log.debug("video capture " + source + " finished after " + number + " frames, " + dropped + " dropped");
        fpsMeter.summary();
    }

    public void stop() {
        stopped = true;
    }

    public boolean isStopped() {
        return stopped;
    }
}
