package au.org.ala.raster.control;

/**
 * Ends the process without any of the normal cleanup.
 */
public interface Terminator {

    int FORCED_EXIT_CODE = 130;

    void terminate(String reason);

    /**
     * Restores the terminal and halts the JVM; shutdown hooks do not run.
     */
    static Terminator halting(TerminalMode terminalMode) {
        return reason -> {
            System.err.println();
            System.err.println(reason);
            terminalMode.restore();
            Runtime.getRuntime().halt(FORCED_EXIT_CODE);
        };
    }
}
