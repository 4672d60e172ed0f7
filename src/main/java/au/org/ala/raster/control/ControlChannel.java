package au.org.ala.raster.control;

import com.google.common.base.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Applies interactive commands to the shared {@link RunState}.
 *
 * <pre>
 * RUNNING    --PAUSE-->  PAUSED
 * PAUSED     --PAUSE-->  RUNNING
 * PAUSED     --SAVE-->   RUNNING, save requested
 * RUNNING    --SAVE-->   (ignored, must pause first)
 * any        --EXIT-->   EXIT_ARMED
 * EXIT_ARMED --EXIT-->   terminate, if inside the exit window; otherwise re-arm
 * EXIT_ARMED --PAUSE-->  RUNNING
 * EXIT_ARMED --SAVE-->   (ignored, the pending exit wins)
 * any        --INTERRUPT--> terminate
 * </pre>
 */
public class ControlChannel {

    private static final Logger log = LoggerFactory.getLogger(ControlChannel.class);

    public static final Duration DEFAULT_EXIT_WINDOW = Duration.ofSeconds(3);

    private final RunState state;
    private final Terminator terminator;
    private final long exitWindowNanos;
    private final Ticker ticker;

    private long armedAt;

    public ControlChannel(RunState state, Terminator terminator) {
        this(state, terminator, DEFAULT_EXIT_WINDOW, Ticker.systemTicker());
    }

    public ControlChannel(RunState state, Terminator terminator, Duration exitWindow, Ticker ticker) {
        this.state = state;
        this.terminator = terminator;
        this.exitWindowNanos = exitWindow.toNanos();
        this.ticker = ticker;
    }

    public RunState getState() {
        return state;
    }

    public synchronized void onCommand(ControlCommand command) {
        RunState.Mode mode = state.getMode();
        boolean save = state.isSaveRequested();
        switch (command) {
            case PAUSE:
                if (mode == RunState.Mode.EXIT_ARMED) {
                    state.update(RunState.Mode.RUNNING, save);
                    log.info("Exit cancelled - resuming");
                } else if (mode == RunState.Mode.RUNNING) {
                    state.update(RunState.Mode.PAUSED, save);
                    log.info("Pause requested - will pause after the current chunk completes");
                } else {
                    state.update(RunState.Mode.RUNNING, save);
                    log.info("Resuming");
                }
                break;
            case SAVE:
                if (mode == RunState.Mode.PAUSED) {
                    state.update(RunState.Mode.RUNNING, true);
                    log.info("Saving and exiting...");
                } else if (mode == RunState.Mode.EXIT_ARMED) {
                    log.info("Force quit pending - press 'e' to quit or 'p' to cancel before saving");
                } else {
                    log.info("Pause first (press 'p') before saving");
                }
                break;
            case EXIT:
                long now = ticker.read();
                if (mode == RunState.Mode.EXIT_ARMED && now - armedAt <= exitWindowNanos) {
                    terminator.terminate("Force quit confirmed - exiting immediately");
                } else {
                    armedAt = now;
                    state.update(RunState.Mode.EXIT_ARMED, save);
                    log.info("Press 'e' again within {}s to force quit, or 'p' to cancel and resume",
                            exitWindowNanos / 1_000_000_000L);
                }
                break;
            case INTERRUPT:
                terminator.terminate("Ctrl+C detected - exiting");
                break;
            default:
                throw new IllegalArgumentException("Unknown command " + command);
        }
    }
}
