package pagesync.opencv;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class DetectionController {

    /**
     * Page key shown in every screen of the latest processed frame, {@code null} for none.
     */
    @GetMapping("/detections")
    public Map<String, String> detections() {
        return ScreenPageDetectionDemo.getLatestDetections();
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        FrameProcessor processor = ScreenPageDetectionDemo.getFrameProcessor();
        status.put("queued", ScreenPageDetectionDemo.getQueueSize());
        status.put("running", processor != null && !processor.isStopped());
        status.put("processedFrames", processor == null ? 0 : processor.getProcessedFrames());
        status.put("trackedScreens", processor == null ? 0 : processor.getTrackedScreens());
        status.put("fps", processor == null ? 0 : processor.getFps());
        return status;
    }
}
