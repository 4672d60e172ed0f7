package au.org.ala.raster.control;

import java.util.Optional;

/**
 * Interactive commands accepted during a run.
 */
public enum ControlCommand {
    /** Pause, resume, or cancel a pending force quit. */
    PAUSE,
    /** Finish the current strip, checkpoint and exit. Only honoured while paused. */
    SAVE,
    /** Arm a force quit; a second one inside the exit window terminates. */
    EXIT,
    /** Terminate at once. */
    INTERRUPT;

    private static final char CTRL_C = '\u0003';

    public static Optional<ControlCommand> fromKey(int key) {
        if (key == CTRL_C) {
            return Optional.of(INTERRUPT);
        }
        switch (Character.toLowerCase((char) key)) {
            case 'p':
                return Optional.of(PAUSE);
            case 's':
                return Optional.of(SAVE);
            case 'e':
                return Optional.of(EXIT);
            default:
                return Optional.empty();
        }
    }
}
