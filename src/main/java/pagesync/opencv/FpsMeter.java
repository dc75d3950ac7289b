package pagesync.opencv;

import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Core;

/**
 * Measures how many frames per second pass a point of the pipeline, averaged over the last
 * {@value #STEP} frames and over the whole run.
 */
@Slf4j
public class FpsMeter {

    private static final int STEP = 20;

    private final String name;
    private final double frequency;
    private long frames = -1;
    private long stepStartTicks;
    private long startTicks;
    private volatile double fps;

    public FpsMeter(String name) {
        this.name = name;
        this.frequency = Core.getTickFrequency();
    }

    public void measure() {
        long now = Core.getTickCount();
        if (frames < 0) {
            startTicks = now;
            stepStartTicks = now;
            frames = 0;
            return;
        }
        frames++;
        if (frames % STEP == 0) {
            fps = STEP * frequency / (now - stepStartTicks);
            stepStartTicks = now;
            log.trace("FPS (" + name + "): " + fps);
        }
    }

    public double getFps() {
        return fps;
    }

    public double getFpsAvg() {
        if (frames <= 0) {
            return 0;
        }
        return frames * frequency / (Core.getTickCount() - startTicks);
    }

    public void summary() {
        double seconds = frames <= 0 ? 0 : (Core.getTickCount() - startTicks) / frequency;
        log.debug("FPS (" + name + ") elapsed time: " + seconds + "s, frames: " + Math.max(frames, 0)
                + ", average FPS: " + getFpsAvg());
    }
}
