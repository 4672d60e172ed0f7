package au.org.ala.raster.render;

import au.org.ala.raster.kernel.RgbRaster;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * Transient on-disk home for finished chunks while the rest of their strip is computed. One raw RGB file per
 * chunk index.
 */
public class ChunkSpillStore {

    private static final Logger log = LoggerFactory.getLogger(ChunkSpillStore.class);

    private final File directory;

    public ChunkSpillStore(File directory) {
        this.directory = directory;
    }

    public File getDirectory() {
        return directory;
    }

    File fileFor(int chunkIndex) {
        return new File(directory, String.format("temp_chunk_%04d.rgb", chunkIndex));
    }

    public void spill(int chunkIndex, RgbRaster chunk) throws IOException {
        FileUtils.writeByteArrayToFile(fileFor(chunkIndex), chunk.getData());
    }

    public RgbRaster load(int chunkIndex, int width, int height) throws IOException {
        return new RgbRaster(width, height, FileUtils.readFileToByteArray(fileFor(chunkIndex)));
    }

    /**
     * Removes every spilled chunk.
     */
    public void clear() throws IOException {
        if (directory.exists()) {
            FileUtils.deleteDirectory(directory);
            log.trace("Cleared chunk spill directory {}", directory);
        }
    }
}
