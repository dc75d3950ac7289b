package pagesync.opencv;

import lombok.extern.slf4j.Slf4j;
import nu.pattern.OpenCV;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.context.annotation.ComponentScan;
import pagesync.opencv.config.Config;
import pagesync.opencv.config.PipelineFactory;
import pagesync.opencv.frame.Frame;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

@Slf4j
@ComponentScan
@EnableAutoConfiguration
public class ScreenPageDetectionDemo {

    private static final Queue<Frame> frames = new ConcurrentLinkedQueue<>();
    private static volatile FrameProcessor frameProcessor;

    public static Map<String, String> getLatestDetections() {
        FrameProcessor processor = frameProcessor;
        return processor == null ? Collections.emptyMap() : processor.getLatestDetections();
    }

    public static FrameProcessor getFrameProcessor() {
        return frameProcessor;
    }

    public static int getQueueSize() {
        return frames.size();
    }

    public static void main(String[] args) throws IOException, InterruptedException {

        SpringApplication.run(ScreenPageDetectionDemo.class, args);

        OpenCV.loadLocally();

        Config config = Config.load(args.length > 0 ? args[0] : null);
        if (config.getVideo().getSource() == null) {
            throw new IllegalArgumentException("No video source configured");
        }

        FrameProcessor processor = new FrameProcessor(frames,
                PipelineFactory.screenDetector(config.getDetector()),
                PipelineFactory.tracker(config.getTracker()),
                PipelineFactory.pageMatcher(config.getPageMatcher(), PipelineFactory.documents(config.getDocuments())));
        frameProcessor = processor;

        VideoCaptureThread cap = new VideoCaptureThread(config.getVideo().getSource(), frames,
                config.getVideo().getQueueLimit());
        Thread videoCaptureThread = new Thread(cap, "capture");
        Thread frameProcessorThread = new Thread(processor, "processor");
        videoCaptureThread.start();
        frameProcessorThread.start();

        videoCaptureThread.join();
        log.debug("capture finished");
        processor.finishInput();
        frameProcessorThread.join();
        log.debug("frame processor stopped, latest detections: " + processor.getLatestDetections());
    }
}
