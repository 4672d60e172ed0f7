package au.org.ala.raster.tiling;

import au.org.ala.raster.RenderException;
import au.org.ala.raster.control.RunState;
import au.org.ala.raster.kernel.RgbRaster;
import au.org.ala.raster.kernel.TileDownsampler;
import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Builds the coarse levels of the pyramid from the full resolution tiles. Levels are built one at a time from
 * fine to coarse because each reads the one below it; within a level every tile is independent and runs on the
 * supplied executor. A level is only started once every tile of the previous level has been written.
 */
public class PyramidBuilder {

    private static final Logger log = LoggerFactory.getLogger(PyramidBuilder.class);

    /** Returned by {@link #build} when level 0 has been written. */
    public static final int DONE = -1;

    private final PyramidGeometry geometry;
    private final TileStore tileStore;
    private final TileDownsampler downsampler;
    private final ExecutorService executor;
    private final Duration pollInterval;

    public PyramidBuilder(PyramidGeometry geometry, TileStore tileStore, TileDownsampler downsampler,
                          ExecutorService executor, Duration pollInterval) {
        this.geometry = geometry;
        this.tileStore = tileStore;
        this.downsampler = downsampler;
        this.executor = executor;
        this.pollInterval = pollInterval;
    }

    /**
     * Builds levels {@code fromLevel} down to 0. Pausing holds back new tiles; a save request lets the current
     * level finish and then stops.
     *
     * @return {@link #DONE}, or the next level to build if a save was requested
     */
    public int build(int fromLevel, RunState runState) throws IOException, RenderException, InterruptedException {
        for (int level = fromLevel; level >= 0; level--) {
            boolean save = buildLevel(level, runState);
            if (save && level > 0) {
                log.info("Save requested - stopping after level {}", level);
                return level - 1;
            }
        }
        return DONE;
    }

    /**
     * @return true if a save was requested while the level was being built
     */
    boolean buildLevel(int level, RunState runState) throws IOException, RenderException, InterruptedException {
        int tilesWide = geometry.getTilesWide(level);
        int tilesHigh = geometry.getTilesHigh(level);
        log.debug("Building level {}: {}x{} ({}x{} tiles)", level,
                geometry.getLevelWidth(level), geometry.getLevelHeight(level), tilesWide, tilesHigh);

        Stopwatch sw = Stopwatch.createStarted();
        boolean save = false;
        List<Future<?>> futures = new ArrayList<>(tilesWide * tilesHigh);
        try {
            for (int row = 0; row < tilesHigh; row++) {
                for (int col = 0; col < tilesWide; col++) {
                    if (!save && runState.awaitWhilePaused(pollInterval)) {
                        save = true;
                    }
                    final int c = col;
                    final int r = row;
                    futures.add(executor.submit(() -> {
                        buildTile(level, c, r);
                        return null;
                    }));
                }
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new RenderException("Failed to build a tile of level " + level, cause);
        } catch (InterruptedException e) {
            cancelAll(futures);
            throw e;
        }
        log.info("Level {} complete: {} tiles in {}", level, futures.size(), sw.stop());
        return save || runState.isSaveRequested();
    }

    private static void cancelAll(List<Future<?>> futures) {
        for (Future<?> f : futures) {
            f.cancel(true);
        }
    }

    /**
     * Combines the (up to) four tiles under {@code (level, col, row)} and downsamples them. Source tiles that do
     * not exist, past the right or bottom edge, leave that quarter black.
     */
    void buildTile(int level, int col, int row) throws IOException {
        int tileSize = geometry.getTileSize();
        RgbRaster block = RgbRaster.blank(tileSize * 2, tileSize * 2);
        for (int dy = 0; dy < 2; dy++) {
            for (int dx = 0; dx < 2; dx++) {
                Optional<RgbRaster> source = tileStore.read(level + 1, 2 * col + dx, 2 * row + dy);
                if (source.isPresent()) {
                    block.paste(source.get(), dx * tileSize, dy * tileSize);
                }
            }
        }
        RgbRaster tile = downsampler.downsample(block);
        if (tile.getWidth() != tileSize || tile.getHeight() != tileSize) {
            throw new IllegalStateException(String.format("Downsampler returned %dx%d, expected %dx%d",
                    tile.getWidth(), tile.getHeight(), tileSize, tileSize));
        }
        tileStore.write(level, col, row, tile.crop(0, 0, geometry.getTileWidth(level, col), geometry.getTileHeight(level, row)));
    }
}
