package au.org.ala.raster.checkpoint;

import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Reads and writes the progress record as JSON. Writes go to a temporary file that is then moved over the
 * record, so a reader sees either the old record or the new one.
 */
public class CheckpointManager {

    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);

    static final String SCALE = "im_scale";
    static final String CURRENT_STRIP = "current_strip";
    static final String TOTAL_STRIPS = "total_strips";
    static final String MAX_ITERATIONS = "max_iter";
    static final String COLOR_REFERENCE = "color_reference";
    static final String PYRAMID_LEVEL = "pyramid_level";

    private final Path file;

    public CheckpointManager(File file) {
        this.file = file.toPath();
    }

    public File getFile() {
        return file.toFile();
    }

    public void save(Checkpoint checkpoint) throws IOException {
        JSONObject json = new JSONObject();
        json.put(SCALE, checkpoint.getScale());
        json.put(CURRENT_STRIP, checkpoint.getCurrentStrip());
        json.put(TOTAL_STRIPS, checkpoint.getTotalStrips());
        json.put(MAX_ITERATIONS, checkpoint.getMaxIterations());
        json.put(COLOR_REFERENCE, checkpoint.getColorReference());
        if (checkpoint.getPyramidLevel() != Checkpoint.NO_PYRAMID_LEVEL) {
            json.put(PYRAMID_LEVEL, checkpoint.getPyramidLevel());
        }

        Path parent = file.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tmp = parent.resolve(file.getFileName() + ".tmp");
        Files.write(tmp, json.toString(2).getBytes(StandardCharsets.UTF_8));
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move unsupported for {}, replacing instead", file);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("Saved {}", checkpoint);
    }

    /**
     * @return the saved checkpoint, or empty if there is none or it cannot be read
     */
    public Optional<Checkpoint> load() {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            JSONObject json = new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
            return Optional.of(new Checkpoint(
                    json.getInt(SCALE),
                    json.getInt(CURRENT_STRIP),
                    json.getInt(TOTAL_STRIPS),
                    json.getInt(MAX_ITERATIONS),
                    json.getDouble(COLOR_REFERENCE),
                    json.optInt(PYRAMID_LEVEL, Checkpoint.NO_PYRAMID_LEVEL)));
        } catch (IOException | JSONException | IllegalArgumentException e) {
            log.warn("Ignoring unreadable progress file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public void clear() throws IOException {
        if (Files.deleteIfExists(file)) {
            log.info("Removed progress file {}", file);
        }
    }
}
