package au.org.ala.raster;

import au.org.ala.raster.checkpoint.Checkpoint;
import au.org.ala.raster.checkpoint.CheckpointManager;
import au.org.ala.raster.control.ControlChannel;
import au.org.ala.raster.control.ControlSurfaceException;
import au.org.ala.raster.control.KeyboardCommandSource;
import au.org.ala.raster.control.RunState;
import au.org.ala.raster.control.SttyTerminalMode;
import au.org.ala.raster.control.TerminalMode;
import au.org.ala.raster.control.Terminator;
import au.org.ala.raster.kernel.ColorLookupTable;
import au.org.ala.raster.kernel.EscapeTimeKernel;
import au.org.ala.raster.kernel.TileDownsampler;
import au.org.ala.raster.render.RenderDomain;
import com.google.common.base.Ticker;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

public class LocalRenderer {

    static final int DEFAULT_SCALE = 4;

    public static void main(String[] args) throws InterruptedException {
        if (args.length < 1 || args.length > 2) {
            usage();
            System.exit(0);
        }

        File outputDir = new File(args[0]);
        if (!outputDir.isDirectory() && !outputDir.mkdirs()) {
            error(String.format("Unable to create output directory: %s", outputDir));
        }

        RendererConfig config = RendererConfig.fromSystemProperties();
        CheckpointManager checkpoints = FieldPyramidRenderer.checkpointManager(outputDir, config);
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        Checkpoint resumeFrom = null;
        int scale;
        TileDownsampler downsampler;
        try {
            downsampler = config.createDownsampler();
            Optional<Checkpoint> saved = checkpoints.load();
            if (args.length == 2) {
                scale = parseScale(args[1]);
            } else if (saved.isPresent() && offerResume(saved.get(), config, in)) {
                resumeFrom = saved.get();
                scale = resumeFrom.getScale();
            } else {
                scale = promptForScale(in);
            }
            if (saved.isPresent() && resumeFrom == null && !confirmOverwrite(in)) {
                System.out.println("Keeping the saved progress. Exiting.");
                System.exit(0);
            }
        } catch (IOException | IllegalArgumentException ex) {
            error(ex.getMessage());
            return;
        }

        RunState runState = new RunState();
        TerminalMode terminalMode = config.isInteractive() ? new SttyTerminalMode() : TerminalMode.NONE;
        var channel = new ControlChannel(runState, Terminator.halting(terminalMode), config.getExitWindow(), Ticker.systemTicker());
        var keyboard = new KeyboardCommandSource(in, channel, terminalMode);

        int exitCode = 0;
        try {
            var renderer = new FieldPyramidRenderer(config, RenderDomain.forScale(scale),
                    new EscapeTimeKernel(config.getMaxIterations(), EscapeTimeKernel.DEFAULT_ESCAPE_RADIUS_SQUARED),
                    ColorLookupTable.defaultTable(), downsampler, checkpoints, runState, outputDir);
            if (config.isInteractive()) {
                keyboard.start();
                System.out.println();
                System.out.println("Press 'p' at any time to pause/resume");
                System.out.println("Press 's' while paused to save progress");
                System.out.printf("Press 'e' twice within %d seconds to force quit (or Ctrl+C)%n", config.getExitWindow().toSeconds());
            }
            RenderOutcome outcome = resumeFrom != null ? renderer.resume(resumeFrom) : renderer.renderFresh();
            if (outcome == RenderOutcome.COMPLETED) {
                System.out.printf("Open %s in a Deep Zoom viewer to browse the result%n", renderer.getManifestFile());
            } else {
                System.out.println("Generation paused and saved. Run again and press 'r' to resume.");
            }
        } catch (ControlSurfaceException ex) {
            System.err.println("Keyboard control unavailable: " + ex.getMessage());
            System.err.println("Run with -D" + RendererConfig.PROPERTY_PREFIX + "interactive=false to render without it");
            exitCode = 2;
        } catch (IllegalArgumentException ex) {
            // settings that do not fit the image, or a save made with a different tile size
            System.err.println("Cannot render with these settings: " + ex.getMessage());
            exitCode = 1;
        } catch (RenderException | IOException ex) {
            System.err.println("Rendering failed: " + ex.getMessage());
            ex.printStackTrace();
            System.err.println("Completed strips are kept; run again to resume from the last checkpoint");
            exitCode = 1;
        } finally {
            keyboard.close();
        }
        System.exit(exitCode);
    }

    /**
     * @return true to resume from {@code saved}, false to start again with a new scale
     */
    static boolean offerResume(Checkpoint saved, RendererConfig config, BufferedReader in) throws IOException {
        System.out.println();
        System.out.println("Save Found!");
        System.out.printf("Scale: %dx%n", saved.getScale());
        System.out.printf("Progress: %d/%d strips%n", saved.getCurrentStrip(), saved.getTotalStrips());
        System.out.printf("Completion: %.1f%%%n", saved.getCompletionPercent());
        if (!saved.matches(config.getMaxIterations(), config.getColorReference())) {
            System.out.printf("The save was rendered with max_iter=%d, color_reference=%s but the current settings are max_iter=%d, color_reference=%s.%n",
                    saved.getMaxIterations(), saved.getColorReference(), config.getMaxIterations(), config.getColorReference());
            System.out.println("It cannot be resumed; starting fresh.");
            return false;
        }
        System.out.print("Press 'r' to resume, or press enter to start fresh: ");
        System.out.flush();
        String choice = readLine(in).trim();
        return choice.equalsIgnoreCase("r");
    }

    /**
     * @return true if the user agrees to discard the saved run
     */
    static boolean confirmOverwrite(BufferedReader in) throws IOException {
        System.out.print("This will overwrite the saved progress. Continue? (y/n): ");
        System.out.flush();
        String answer = readLine(in).trim().toLowerCase();
        return answer.equals("y") || answer.equals("yes");
    }

    static int promptForScale(BufferedReader in) throws IOException {
        while (true) {
            System.out.print("Enter image scale factor (default " + DEFAULT_SCALE + "): ");
            System.out.flush();
            String input = readLine(in).trim();
            int scale;
            try {
                scale = input.isEmpty() ? DEFAULT_SCALE : parseScale(input);
            } catch (IllegalArgumentException ex) {
                System.out.println(ex.getMessage());
                continue;
            }
            System.out.printf("%nScale %dx:%n", scale);
            System.out.printf("  Resolution: %,d x %,d pixels%n", RenderDomain.BASE_HEIGHT * scale, RenderDomain.BASE_WIDTH * scale);
            System.out.printf("  Estimated time: %s%n", RenderEstimate.describeTime(scale));
            System.out.printf("  Peak temp storage: %s%n", RenderEstimate.describePeakStorage(scale));
            System.out.printf("  Final DeepZoom size: %s%n", RenderEstimate.describeFinalStorage(scale));
            System.out.print("Continue with this scale? (y/n): ");
            System.out.flush();
            String confirm = readLine(in).trim().toLowerCase();
            if (confirm.equals("y") || confirm.equals("yes")) {
                return scale;
            }
            System.out.println("Let's try a different scale.");
        }
    }

    static int parseScale(String value) {
        int scale;
        try {
            scale = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Please enter a valid integer", e);
        }
        if (scale <= 0) {
            throw new IllegalArgumentException("Scale factor must be positive");
        }
        return scale;
    }

    private static String readLine(BufferedReader in) throws IOException {
        String line = in.readLine();
        if (line == null) {
            throw new IOException("Input closed");
        }
        return line;
    }

    private static void usage() {
        System.out.println("LocalRenderer <outputDir> [scale]");
    }

    private static void error(String message) {
        System.err.println(message);
        System.exit(-1);
    }
}
