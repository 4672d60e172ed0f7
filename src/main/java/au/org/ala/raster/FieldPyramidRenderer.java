package au.org.ala.raster;

import au.org.ala.raster.checkpoint.Checkpoint;
import au.org.ala.raster.checkpoint.CheckpointManager;
import au.org.ala.raster.control.RunState;
import au.org.ala.raster.kernel.ColorLookupTable;
import au.org.ala.raster.kernel.FieldKernel;
import au.org.ala.raster.kernel.TileDownsampler;
import au.org.ala.raster.render.ChunkGrid;
import au.org.ala.raster.render.ChunkSpillStore;
import au.org.ala.raster.render.ChunkWorkerPool;
import au.org.ala.raster.render.Colorizer;
import au.org.ala.raster.render.RenderDomain;
import au.org.ala.raster.render.StripAssembler;
import au.org.ala.raster.render.StripPartition;
import au.org.ala.raster.render.StripRenderer;
import au.org.ala.raster.tiling.DeepZoomManifest;
import au.org.ala.raster.tiling.PyramidBuilder;
import au.org.ala.raster.tiling.PyramidGeometry;
import au.org.ala.raster.tiling.TileStore;
import au.org.ala.raster.tiling.TilerSink;
import au.org.ala.raster.util.FileByteSinkFactory;
import au.org.ala.raster.util.LimitedQueue;
import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Renders a field into a Deep Zoom pyramid in two phases. First the full resolution level is produced strip by
 * strip, with a checkpoint after each strip; then the coarser levels are built from it, and finally the
 * manifest is written and the checkpoint removed.
 *
 * Output layout under the output directory, for name {@code n}: {@code n.dzi}, {@code n_files/<level>/<col>_<row>.png}
 * and, while a run is incomplete, {@code n_progress.json}.
 */
public class FieldPyramidRenderer {

    private static final Logger log = LoggerFactory.getLogger(FieldPyramidRenderer.class);

    private final RendererConfig config;
    private final RenderDomain domain;
    private final FieldKernel kernel;
    private final ColorLookupTable palette;
    private final TileDownsampler downsampler;
    private final CheckpointManager checkpoints;
    private final RunState runState;
    private final File outputDir;

    private final StripPartition strips;
    private final ChunkGrid chunkGrid;
    private final PyramidGeometry geometry;

    public FieldPyramidRenderer(RendererConfig config, RenderDomain domain, FieldKernel kernel, ColorLookupTable palette,
                                TileDownsampler downsampler, CheckpointManager checkpoints, RunState runState, File outputDir) {
        // strip i becomes tile row (strips - 1 - i), so a short strip would land at the top of the image as a
        // short tile row, which Deep Zoom only allows at the bottom
        Validate.isTrue(domain.getHeight() % config.getTileSize() == 0,
                "Image height %d must be a multiple of the tile size %d: strips are rendered bottom up but tile "
                        + "row 0 is the top of the image, so only full height strips map onto whole tile rows",
                domain.getHeight(), config.getTileSize());
        this.config = config;
        this.domain = domain;
        this.kernel = kernel;
        this.palette = palette;
        this.downsampler = downsampler;
        this.checkpoints = checkpoints;
        this.runState = runState;
        this.outputDir = outputDir;
        this.strips = new StripPartition(domain.getHeight(), config.getTileSize());
        this.chunkGrid = new ChunkGrid(domain.getWidth(), config.getChunksPerStrip());
        this.geometry = new PyramidGeometry(domain.getWidth(), domain.getHeight(), config.getTileSize());
    }

    public static CheckpointManager checkpointManager(File outputDir, RendererConfig config) {
        return new CheckpointManager(new File(outputDir, config.getName() + "_progress.json"));
    }

    public File getTilesDirectory() {
        return new File(outputDir, config.getName() + "_files");
    }

    public File getManifestFile() {
        return new File(outputDir, config.getName() + ".dzi");
    }

    public PyramidGeometry getGeometry() {
        return geometry;
    }

    public StripPartition getStrips() {
        return strips;
    }

    /**
     * Discards any previous progress and output and renders from the first strip.
     */
    public RenderOutcome renderFresh() throws IOException, RenderException, InterruptedException {
        checkpoints.clear();
        return render(0, Checkpoint.NO_PYRAMID_LEVEL, true);
    }

    /**
     * Continues from a checkpoint, keeping the tiles already written.
     */
    public RenderOutcome resume(Checkpoint checkpoint) throws IOException, RenderException, InterruptedException {
        Validate.isTrue(checkpoint.getScale() == domain.getScale(),
                "Checkpoint is for scale %d, not %d", checkpoint.getScale(), domain.getScale());
        Validate.isTrue(checkpoint.getTotalStrips() == strips.getStripCount(),
                "Checkpoint has %d strips, this image has %d", checkpoint.getTotalStrips(), strips.getStripCount());
        Validate.isTrue(checkpoint.matches(config.getMaxIterations(), config.getColorReference()),
                "Checkpoint was rendered with max_iter=%d, color_reference=%s", checkpoint.getMaxIterations(), checkpoint.getColorReference());
        log.info("Resuming - using existing tile directory: {}", getTilesDirectory());
        return render(checkpoint.getCurrentStrip(), checkpoint.getPyramidLevel(), false);
    }

    private RenderOutcome render(int startStrip, int startLevel, boolean fresh) throws IOException, RenderException, InterruptedException {
        var tileStore = new TileStore(
                new TilerSink.PathBasedTilerSink(new FileByteSinkFactory(getTilesDirectory(), fresh), config.getTileFormat()),
                config.getTileFormat());

        log.info("Generating field at {} x {} resolution", domain.getHeight(), domain.getWidth());
        log.info("DeepZoom pyramid will have {} levels", geometry.getMaxLevel() + 1);
        log.info("Processing image in {} strips of {} chunks", strips.getStripCount(), chunkGrid.getChunkCount());

        if (startStrip < strips.getStripCount()) {
            if (!renderStrips(tileStore, startStrip)) {
                return RenderOutcome.SAVED;
            }
        } else {
            log.info("All {} strips already rendered", strips.getStripCount());
        }

        int fromLevel = startLevel == Checkpoint.NO_PYRAMID_LEVEL ? geometry.getMaxLevel() - 1 : startLevel;
        if (!buildPyramid(tileStore, fromLevel)) {
            return RenderOutcome.SAVED;
        }

        DeepZoomManifest.of(geometry, config.getTileFormat()).write(getManifestFile());
        log.info("Created .dzi file: {}", getManifestFile());
        checkpoints.clear();
        log.info("DeepZoom pyramid saved successfully");
        return RenderOutcome.COMPLETED;
    }

    /**
     * @return false if the run stopped early for a save
     */
    boolean renderStrips(TileStore tileStore, int startStrip) throws IOException, RenderException, InterruptedException {
        var workerPool = new ChunkWorkerPool(domain, kernel, new Colorizer(palette, config.getColorReference()),
                config.getWorkerThreads(), config.getQueueDepth());
        ExecutorService producerExecutor = Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat("chunk-producer-%d").setDaemon(true).build());
        var assembler = new StripAssembler(domain.getWidth(), config.getTileSize(), geometry.getMaxLevel(), chunkGrid, strips,
                new ChunkSpillStore(new File(getTilesDirectory(), ".chunks")), tileStore);
        var stripRenderer = new StripRenderer(chunkGrid, strips, workerPool, producerExecutor, assembler, runState,
                config.getPollInterval(), config.getJoinTimeout());

        Exception failure = null;
        try {
            int total = strips.getStripCount();
            Stopwatch sw = Stopwatch.createUnstarted();
            for (int strip = startStrip; strip < total; strip++) {
                sw.reset().start();
                boolean save = stripRenderer.render(strip);
                checkpoints.save(checkpointAt(strip + 1));
                log.info("Strip {}/{} complete in {}", strip + 1, total, sw.stop());

                if (save || runState.awaitWhilePaused(config.getPollInterval())) {
                    runState.acknowledgeSave();
                    log.info("Progress saved at strip {}/{}. Run again and press 'r' to resume.", strip + 1, total);
                    return false;
                }
            }
            log.info("All max-resolution tiles created");
            return true;
        } catch (IOException | RenderException | InterruptedException | RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            producerExecutor.shutdownNow();
            stopWorkers(workerPool, config.getJoinTimeout(), failure);
        }
    }

    /**
     * Shuts the chunk workers down. If the run is already failing with {@code failure}, an interrupt while
     * waiting is attached to it instead of replacing it.
     */
    static void stopWorkers(ChunkWorkerPool workerPool, Duration timeout, Exception failure) throws InterruptedException {
        try {
            workerPool.shutdown(timeout);
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            if (failure == null) {
                throw e;
            }
            failure.addSuppressed(e);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * @return false if the run stopped early for a save
     */
    boolean buildPyramid(TileStore tileStore, int fromLevel) throws IOException, RenderException, InterruptedException {
        int threads = config.getPyramidThreads();
        ExecutorService tileExecutor = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new LimitedQueue<>(2 * threads),
                new ThreadFactoryBuilder().setNameFormat("pyramid-worker-%d").setDaemon(true).build());
        Exception failure = null;
        try {
            log.info("Building pyramid levels {} to 0", fromLevel);
            Stopwatch sw = Stopwatch.createStarted();
            int next = new PyramidBuilder(geometry, tileStore, downsampler, tileExecutor, config.getPollInterval())
                    .build(fromLevel, runState);
            if (next != PyramidBuilder.DONE) {
                checkpoints.save(checkpointAt(strips.getStripCount()).withPyramidLevel(next));
                runState.acknowledgeSave();
                log.info("Progress saved before pyramid level {}. Run again and press 'r' to resume.", next);
                return false;
            }
            log.info("Pyramid built in {}", sw.stop());
            return true;
        } catch (IOException | RenderException | InterruptedException | RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            tileExecutor.shutdown();
            try {
                if (!tileExecutor.awaitTermination(config.getJoinTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Pyramid workers did not stop within {}", config.getJoinTimeout());
                    tileExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                tileExecutor.shutdownNow();
                if (failure == null) {
                    throw e;
                }
                failure.addSuppressed(e);
                Thread.currentThread().interrupt();
            }
        }
    }

    private Checkpoint checkpointAt(int nextStrip) {
        return new Checkpoint(domain.getScale(), nextStrip, strips.getStripCount(),
                config.getMaxIterations(), config.getColorReference());
    }
}
