package au.org.ala.raster.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits one task per chunk of a strip into the worker pool, blocking whenever the work queue is full.
 */
public class ChunkProducer implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ChunkProducer.class);

    private final ChunkGrid chunkGrid;
    private final PixelRange rows;
    private final ChunkWorkerPool workerPool;

    public ChunkProducer(ChunkGrid chunkGrid, PixelRange rows, ChunkWorkerPool workerPool) {
        this.chunkGrid = chunkGrid;
        this.rows = rows;
        this.workerPool = workerPool;
    }

    @Override
    public void run() {
        for (int i = 0; i < chunkGrid.getChunkCount(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                log.debug("Producer for rows {} interrupted after {} chunks", rows, i);
                return;
            }
            workerPool.submit(new ChunkTask(i, chunkGrid.getColumns(i), rows));
        }
        log.trace("Queued {} chunks for rows {}", chunkGrid.getChunkCount(), rows);
    }
}
