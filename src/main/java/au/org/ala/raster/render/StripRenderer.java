package au.org.ala.raster.render;

import au.org.ala.raster.RenderException;
import au.org.ala.raster.control.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Renders one strip: a producer feeds its chunks to the worker pool while the calling thread collects the
 * results into the {@link StripAssembler}, checking for pause and save between chunks.
 */
public class StripRenderer {

    private static final Logger log = LoggerFactory.getLogger(StripRenderer.class);

    private final ChunkGrid chunkGrid;
    private final StripPartition strips;
    private final ChunkWorkerPool workerPool;
    private final ExecutorService producerExecutor;
    private final StripAssembler assembler;
    private final RunState runState;
    private final Duration pollInterval;
    private final Duration joinTimeout;

    public StripRenderer(ChunkGrid chunkGrid, StripPartition strips, ChunkWorkerPool workerPool,
                         ExecutorService producerExecutor, StripAssembler assembler, RunState runState,
                         Duration pollInterval, Duration joinTimeout) {
        this.chunkGrid = chunkGrid;
        this.strips = strips;
        this.workerPool = workerPool;
        this.producerExecutor = producerExecutor;
        this.assembler = assembler;
        this.runState = runState;
        this.pollInterval = pollInterval;
        this.joinTimeout = joinTimeout;
    }

    /**
     * Renders and persists strip {@code strip}. A save request does not cut the strip short: the remaining
     * chunks are still collected and the tiles written.
     *
     * @return true if a save was requested while the strip was in progress
     */
    public boolean render(int strip) throws IOException, RenderException, InterruptedException {
        PixelRange rows = strips.getRows(strip);
        int chunkCount = chunkGrid.getChunkCount();
        assembler.begin(strip);

        Future<?> producer = producerExecutor.submit(new ChunkProducer(chunkGrid, rows, workerPool));
        boolean save = false;
        try {
            int received = 0;
            while (received < chunkCount) {
                ChunkResult result = workerPool.poll(pollInterval);
                if (result == null) {
                    checkProducer(producer, strip);
                    continue;
                }
                if (result.isFailed()) {
                    throw new RenderException(String.format("Chunk %d of strip %d failed", result.getChunkIndex(), strip),
                            result.getFailure());
                }
                assembler.accept(result.getChunkIndex(), result.getChunk());
                received++;
                log.trace("Strip {}: {}/{} chunks", strip, received, chunkCount);

                if (!save && runState.awaitWhilePaused(pollInterval)) {
                    save = true;
                    log.info("Save requested - completing strip {} before saving", strip);
                }
            }
            joinProducer(producer, strip);
            assembler.finish();
            return save;
        } catch (IOException | RenderException | InterruptedException | RuntimeException e) {
            producer.cancel(true);
            try {
                assembler.abandon();
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    private void checkProducer(Future<?> producer, int strip) throws RenderException, InterruptedException {
        if (producer.isDone() && !producer.isCancelled()) {
            try {
                producer.get();
            } catch (ExecutionException e) {
                throw new RenderException("Chunk producer for strip " + strip + " failed", e.getCause());
            }
        }
    }

    private void joinProducer(Future<?> producer, int strip) throws RenderException, InterruptedException {
        try {
            producer.get(joinTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Chunk producer for strip {} did not finish within {}; continuing", strip, joinTimeout);
            producer.cancel(true);
        } catch (ExecutionException e) {
            throw new RenderException("Chunk producer for strip " + strip + " failed", e.getCause());
        }
    }
}
