package au.org.ala.raster.control;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pause / save / exit state shared between the {@link ControlChannel}, which is the only writer, and the render
 * loops, which only read it and wait on it.
 */
public class RunState {

    private static final Logger log = LoggerFactory.getLogger(RunState.class);

    public enum Mode {
        RUNNING,
        PAUSED,
        /** Paused, waiting for a second exit command. */
        EXIT_ARMED
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private Mode mode = Mode.RUNNING;
    private boolean saveRequested = false;

    public Mode getMode() {
        lock.lock();
        try {
            return mode;
        } finally {
            lock.unlock();
        }
    }

    public boolean isPaused() {
        return getMode() != Mode.RUNNING;
    }

    public boolean isSaveRequested() {
        lock.lock();
        try {
            return saveRequested;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks while paused, waking at least every {@code pollInterval} to re-check.
     *
     * @return true if a save has been requested
     */
    public boolean awaitWhilePaused(Duration pollInterval) throws InterruptedException {
        lock.lock();
        try {
            if (mode == Mode.PAUSED && !saveRequested) {
                log.info("Paused. Press 'p' to resume, 's' to save and exit.");
            }
            while (mode != Mode.RUNNING && !saveRequested) {
                changed.await(pollInterval.toNanos(), TimeUnit.NANOSECONDS);
            }
            return saveRequested;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Called by the render loop once a requested save has been carried out.
     */
    public void acknowledgeSave() {
        lock.lock();
        try {
            saveRequested = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void update(Mode newMode, boolean newSaveRequested) {
        lock.lock();
        try {
            mode = newMode;
            saveRequested = newSaveRequested;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
