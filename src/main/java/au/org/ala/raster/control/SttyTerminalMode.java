package au.org.ala.raster.control;

import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Uses {@code stty} on {@code /dev/tty} to turn off line buffering and echo, so keys arrive one at a time.
 * Output processing and signal keys are left alone, so Ctrl+C still raises SIGINT; a shutdown hook puts the
 * terminal back in that case.
 */
public class SttyTerminalMode implements TerminalMode {

    private static final Logger log = LoggerFactory.getLogger(SttyTerminalMode.class);

    private static final File TTY = new File("/dev/tty");

    private String savedSettings;
    private boolean hookRegistered;

    @Override
    public synchronized void enter() throws ControlSurfaceException {
        if (savedSettings != null) {
            return;
        }
        if (!TTY.exists()) {
            throw new ControlSurfaceException("No controlling terminal (" + TTY + ") for keyboard control");
        }
        try {
            savedSettings = stty("-g").trim();
            stty("-icanon", "-echo", "min", "1");
        } catch (IOException e) {
            savedSettings = null;
            throw new ControlSurfaceException("Unable to switch terminal to single key mode", e);
        } catch (InterruptedException e) {
            savedSettings = null;
            Thread.currentThread().interrupt();
            throw new ControlSurfaceException("Interrupted configuring terminal", e);
        }
        if (!hookRegistered) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::restore, "terminal-restore"));
            hookRegistered = true;
        }
    }

    @Override
    public synchronized void restore() {
        if (savedSettings == null) {
            return;
        }
        try {
            stty(savedSettings);
            savedSettings = null;
        } catch (IOException e) {
            log.warn("Unable to restore terminal settings; run 'stty sane' to fix the terminal", e);
        } catch (InterruptedException e) {
            log.warn("Interrupted restoring terminal settings");
            Thread.currentThread().interrupt();
        }
    }

    private static String stty(String... args) throws IOException, InterruptedException {
        String[] command = new String[args.length + 1];
        command[0] = "stty";
        System.arraycopy(args, 0, command, 1, args.length);
        Process process = new ProcessBuilder(command)
                .redirectInput(ProcessBuilder.Redirect.from(TTY))
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        String output = IOUtils.toString(process.getInputStream(), StandardCharsets.UTF_8);
        int exit = process.waitFor();
        if (exit != 0) {
            throw new IOException("stty " + String.join(" ", args) + " exited with " + exit);
        }
        return output;
    }
}
