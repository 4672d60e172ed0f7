package au.org.ala.raster.render;

import au.org.ala.raster.TestBase;
import au.org.ala.raster.kernel.ColorLookupTable;
import au.org.ala.raster.kernel.FieldKernel;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.time.Duration;
import java.util.BitSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

@RunWith(JUnit4.class)
public class ChunkWorkerPoolTest extends TestBase {

    private final RenderDomain domain = RenderDomain.of(1, -2.5, 1, -1, 1, 300, 40);
    private final Colorizer colorizer = new Colorizer(ColorLookupTable.defaultTable(), 100.0);

    private void submitAll(ChunkWorkerPool pool, ChunkGrid grid, PixelRange rows) {
        Thread producer = new Thread(new ChunkProducer(grid, rows, pool), "test-producer");
        producer.setDaemon(true);
        producer.start();
    }

    @Test
    public void everyChunkArrivesOnce() throws Exception {
        ChunkGrid grid = new ChunkGrid(domain.getWidth(), 23);
        PixelRange rows = new PixelRange(0, domain.getHeight());
        FieldKernel kernel = (x, y) -> new float[x.length];
        ChunkWorkerPool pool = new ChunkWorkerPool(domain, kernel, colorizer, 3, 2);
        try {
            submitAll(pool, grid, rows);
            BitSet seen = new BitSet();
            for (int i = 0; i < grid.getChunkCount(); i++) {
                ChunkResult result = pool.poll(Duration.ofSeconds(5));
                assertNotNull("timed out waiting for chunk", result);
                assertFalse(result.isFailed());
                assertFalse("chunk delivered twice", seen.get(result.getChunkIndex()));
                seen.set(result.getChunkIndex());
                assertEquals(grid.getColumns(result.getChunkIndex()).length(), result.getChunk().getWidth());
                assertEquals(rows.length(), result.getChunk().getHeight());
            }
            assertEquals(grid.getChunkCount(), seen.cardinality());
        } finally {
            pool.shutdown(Duration.ofSeconds(1));
        }
    }

    @Test
    public void producerStallsWhileWorkQueueIsFull() throws Exception {
        int workers = 2;
        int queueDepth = 3;
        ChunkGrid grid = new ChunkGrid(domain.getWidth(), 12);
        PixelRange rows = new PixelRange(0, 4);
        CountDownLatch release = new CountDownLatch(1);
        FieldKernel held = (x, y) -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new float[x.length];
        };
        ChunkWorkerPool pool = new ChunkWorkerPool(domain, held, colorizer, workers, queueDepth);
        AtomicInteger submitted = new AtomicInteger();
        Thread producer = new Thread(() -> {
            for (int i = 0; i < grid.getChunkCount(); i++) {
                pool.submit(new ChunkTask(i, grid.getColumns(i), rows));
                submitted.incrementAndGet();
            }
        }, "test-producer");
        producer.setDaemon(true);
        try {
            producer.start();
            long deadline = System.currentTimeMillis() + 2000;
            while (submitted.get() < workers + queueDepth && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            Thread.sleep(200);
            println("Submitted %d of %d chunks while workers were held", submitted.get(), grid.getChunkCount());
            assertEquals(workers + queueDepth, submitted.get());
            assertTrue(producer.isAlive());

            release.countDown();
            BitSet seen = new BitSet();
            for (int i = 0; i < grid.getChunkCount(); i++) {
                ChunkResult result = pool.poll(Duration.ofSeconds(5));
                assertNotNull("timed out waiting for chunk", result);
                seen.set(result.getChunkIndex());
            }
            assertEquals(grid.getChunkCount(), seen.cardinality());
            producer.join(2000);
            assertEquals(grid.getChunkCount(), submitted.get());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    public void coordinatesFollowDomain() {
        double[][] captured = new double[2][];
        FieldKernel kernel = (x, y) -> {
            captured[0] = x.clone();
            captured[1] = y.clone();
            return new float[x.length];
        };
        ChunkWorkerPool pool = new ChunkWorkerPool(domain, kernel, colorizer, 1, 1);
        try {
            pool.render(new ChunkTask(0, new PixelRange(10, 13), new PixelRange(5, 7)));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(6, captured[0].length);
        assertEquals(domain.x(10), captured[0][0], 0.0);
        assertEquals(domain.x(12), captured[0][2], 0.0);
        assertEquals(domain.x(10), captured[0][3], 0.0);
        assertEquals(domain.y(5), captured[1][0], 0.0);
        assertEquals(domain.y(6), captured[1][5], 0.0);
    }

    @Test
    public void kernelFailureIsPublished() throws Exception {
        ChunkGrid grid = new ChunkGrid(domain.getWidth(), 4);
        FieldKernel kernel = (x, y) -> {
            throw new IllegalStateException("kernel exploded");
        };
        ChunkWorkerPool pool = new ChunkWorkerPool(domain, kernel, colorizer, 2, 2);
        try {
            submitAll(pool, grid, new PixelRange(0, 8));
            ChunkResult result = pool.poll(Duration.ofSeconds(5));
            assertNotNull(result);
            assertTrue(result.isFailed());
            assertEquals("kernel exploded", result.getFailure().getMessage());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void wrongFieldLengthIsAFailure() throws Exception {
        FieldKernel kernel = (x, y) -> new float[1];
        ChunkWorkerPool pool = new ChunkWorkerPool(domain, kernel, colorizer, 1, 1);
        try {
            pool.submit(new ChunkTask(0, new PixelRange(0, 4), new PixelRange(0, 4)));
            ChunkResult result = pool.poll(Duration.ofSeconds(5));
            assertNotNull(result);
            assertTrue(result.isFailed());
        } finally {
            pool.shutdownNow();
        }
    }
}
