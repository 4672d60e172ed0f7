package au.org.ala.raster.render;

import au.org.ala.raster.TestBase;
import au.org.ala.raster.kernel.RgbRaster;
import au.org.ala.raster.tiling.TileStore;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.io.File;
import java.nio.file.Files;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

@RunWith(JUnit4.class)
public class StripAssemblerTest extends TestBase {

    private static final int WIDTH = 600;
    private static final int HEIGHT = 512;
    private static final int TILE = 256;
    private static final int LEVEL = 10;

    private File dir;
    private TileStore tileStore;
    private ChunkSpillStore spillStore;
    private ChunkGrid grid;
    private StripPartition strips;
    private StripAssembler assembler;

    @Before
    public void setUp() throws Exception {
        dir = Files.createTempDirectory("strip-assembler").toFile();
        tileStore = tileStore(new File(dir, "tiles"), true);
        spillStore = new ChunkSpillStore(new File(dir, "chunks"));
        grid = new ChunkGrid(WIDTH, 7);
        strips = new StripPartition(HEIGHT, TILE);
        assembler = new StripAssembler(WIDTH, TILE, LEVEL, grid, strips, spillStore, tileStore);
    }

    @After
    public void tearDown() throws Exception {
        FileUtils.deleteDirectory(dir);
    }

    /** Encodes the global column in red/blue and the row within the strip in green. */
    private static int expectedRgb(int column, int stripRow) {
        return ((column & 0xff) << 16) | (stripRow << 8) | (column >> 8);
    }

    private RgbRaster chunk(int index, int rows) {
        PixelRange cols = grid.getColumns(index);
        RgbRaster raster = RgbRaster.blank(cols.length(), rows);
        byte[] data = raster.getData();
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols.length(); c++) {
                int rgb = expectedRgb(cols.getStart() + c, r);
                int i = (r * cols.length() + c) * RgbRaster.BANDS;
                data[i] = (byte) (rgb >> 16);
                data[i + 1] = (byte) (rgb >> 8);
                data[i + 2] = (byte) rgb;
            }
        }
        return raster;
    }

    @Test
    public void outOfOrderChunksBecomeFlippedTiles() throws Exception {
        assembler.begin(0);
        for (int i = grid.getChunkCount() - 1; i >= 0; i--) {
            assertFalse(assembler.isComplete());
            assembler.accept(i, chunk(i, TILE));
        }
        assertTrue(assembler.isComplete());
        assertEquals(3, assembler.finish());

        // strip 0 is the bottom tile row
        for (int col = 0; col < 3; col++) {
            RgbRaster tile = tileStore.read(LEVEL, col, 1).get();
            assertEquals(col < 2 ? TILE : WIDTH - 2 * TILE, tile.getWidth());
            assertEquals(TILE, tile.getHeight());
            for (int y = 0; y < TILE; y += 17) {
                for (int x = 0; x < tile.getWidth(); x += 13) {
                    assertEquals(expectedRgb(col * TILE + x, TILE - 1 - y), tile.getRgb(x, y));
                }
            }
        }
        assertFalse(tileStore.read(LEVEL, 0, 0).isPresent());
        assertFalse("spilled chunks left behind", spillStore.getDirectory().exists());
    }

    @Test
    public void duplicateChunkRejected() throws Exception {
        assembler.begin(1);
        assembler.accept(2, chunk(2, TILE));
        try {
            assembler.accept(2, chunk(2, TILE));
            fail("duplicate accepted");
        } catch (IllegalStateException e) {
            println("Expected: %s", e.getMessage());
        }
        assertEquals(1, assembler.getReceivedCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void wrongSizedChunkRejected() throws Exception {
        assembler.begin(0);
        assembler.accept(0, chunk(0, TILE - 1));
    }

    @Test(expected = IllegalStateException.class)
    public void incompleteStripCannotFinish() throws Exception {
        assembler.begin(0);
        assembler.accept(0, chunk(0, TILE));
        assembler.finish();
    }

    @Test
    public void abandonRemovesSpill() throws Exception {
        assembler.begin(0);
        assembler.accept(0, chunk(0, TILE));
        assertTrue(spillStore.fileFor(0).exists());
        assembler.abandon();
        assertFalse(spillStore.getDirectory().exists());
        assertEquals(0, assembler.getReceivedCount());
    }
}
