package au.org.ala.raster.control;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;

/**
 * Reads single keys on a daemon thread and forwards the ones that mean something to a {@link ControlChannel}.
 */
public class KeyboardCommandSource implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(KeyboardCommandSource.class);

    private final Reader input;
    private final ControlChannel channel;
    private final TerminalMode terminalMode;

    private volatile boolean closed = false;
    private Thread thread;

    public KeyboardCommandSource(Reader input, ControlChannel channel, TerminalMode terminalMode) {
        this.input = input;
        this.channel = channel;
        this.terminalMode = terminalMode;
    }

    public synchronized void start() throws ControlSurfaceException {
        if (thread != null) {
            throw new IllegalStateException("Already started");
        }
        terminalMode.enter();
        thread = new Thread(this::readKeys, "keyboard-control");
        thread.setDaemon(true);
        thread.start();
    }

    void readKeys() {
        try {
            int key;
            while (!closed && (key = input.read()) != -1) {
                ControlCommand.fromKey(key).ifPresent(channel::onCommand);
            }
            log.debug("Keyboard input closed");
        } catch (IOException e) {
            if (!closed) {
                log.error("Keyboard control stopped reading input; pause/save are no longer available", e);
            }
        }
    }

    @Override
    public void close() {
        closed = true;
        terminalMode.restore();
    }
}
