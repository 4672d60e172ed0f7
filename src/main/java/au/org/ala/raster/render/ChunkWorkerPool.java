package au.org.ala.raster.render;

import au.org.ala.raster.kernel.FieldKernel;
import au.org.ala.raster.kernel.RgbRaster;
import au.org.ala.raster.util.LimitedQueue;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Fixed pool of workers that compute and colour chunks. Both the work queue and the result queue are bounded,
 * so at most {@code workers + 2 * queueDepth} chunk buffers exist at any time however many chunks a strip has.
 * Results arrive in completion order, tagged with their chunk index.
 */
public class ChunkWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(ChunkWorkerPool.class);

    private final RenderDomain domain;
    private final FieldKernel kernel;
    private final Colorizer colorizer;
    private final ThreadPoolExecutor executor;
    private final BlockingQueue<ChunkResult> results;

    public ChunkWorkerPool(RenderDomain domain, FieldKernel kernel, Colorizer colorizer, int workers, int queueDepth) {
        Validate.isTrue(workers > 0, "Need at least one worker");
        Validate.isTrue(queueDepth > 0, "Queue depth must be positive");
        this.domain = domain;
        this.kernel = kernel;
        this.colorizer = colorizer;
        this.results = new ArrayBlockingQueue<>(queueDepth);
        this.executor = new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS,
                new LimitedQueue<>(queueDepth),
                new ThreadFactoryBuilder().setNameFormat("chunk-worker-%d").setDaemon(true).build());
        log.debug("Started {} chunk workers, queue depth {}", workers, queueDepth);
    }

    /**
     * Queues a chunk for computation, blocking while the work queue is full.
     */
    public void submit(ChunkTask task) {
        executor.execute(() -> compute(task));
    }

    /**
     * @return the next finished chunk, or null if none arrived within {@code timeout}
     */
    public ChunkResult poll(Duration timeout) throws InterruptedException {
        return results.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void compute(ChunkTask task) {
        ChunkResult result;
        try {
            result = ChunkResult.completed(task.getChunkIndex(), render(task));
        } catch (Exception | Error ex) {
            log.error("Field kernel failed for {}", task, ex);
            result = ChunkResult.failed(task.getChunkIndex(), ex);
        }
        try {
            results.put(result);
        } catch (InterruptedException e) {
            log.debug("Interrupted publishing chunk {}", task.getChunkIndex());
            Thread.currentThread().interrupt();
        }
    }

    RgbRaster render(ChunkTask task) {
        PixelRange cols = task.getColumns();
        PixelRange rows = task.getRows();
        int w = cols.length();
        int h = rows.length();
        double[] xGrid = new double[w * h];
        double[] yGrid = new double[w * h];
        for (int r = 0; r < h; r++) {
            double y = domain.y(rows.getStart() + r);
            for (int c = 0; c < w; c++) {
                xGrid[r * w + c] = domain.x(cols.getStart() + c);
                yGrid[r * w + c] = y;
            }
        }
        float[] field = kernel.computeField(xGrid, yGrid);
        if (field == null || field.length != xGrid.length) {
            throw new IllegalStateException("Field kernel returned " + (field == null ? "null" : field.length + " values")
                    + " for " + xGrid.length + " coordinates");
        }
        return colorizer.colorize(field, w, h);
    }

    /**
     * Stops accepting work and waits up to {@code timeout} for queued chunks to drain. Running past the
     * timeout is logged and the workers are interrupted.
     */
    public void shutdown(Duration timeout) throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("Chunk workers did not stop within {}; interrupting", timeout);
            executor.shutdownNow();
        }
        results.clear();
    }

    public void shutdownNow() {
        executor.shutdownNow();
        results.clear();
    }
}
