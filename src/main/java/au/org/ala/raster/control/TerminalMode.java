package au.org.ala.raster.control;

/**
 * Switches the controlling terminal into single key mode and back.
 */
public interface TerminalMode {

    TerminalMode NONE = new TerminalMode() {
        @Override
        public void enter() {
        }

        @Override
        public void restore() {
        }
    };

    void enter() throws ControlSurfaceException;

    /**
     * Puts the terminal back as it was. Safe to call more than once and from any thread.
     */
    void restore();
}
