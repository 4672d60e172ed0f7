package au.org.ala.raster.render;

import au.org.ala.raster.TestBase;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

@RunWith(JUnit4.class)
public class PartitionTest extends TestBase {

    @Test
    public void stripsCoverHeightExactly() {
        for (int tile : new int[] {1, 7, 64, 256}) {
            for (int height = 1; height <= 1000; height++) {
                var strips = new StripPartition(height, tile);
                assertEquals((int) Math.ceil((double) height / tile), strips.getStripCount());
                int expectedStart = 0;
                for (int i = 0; i < strips.getStripCount(); i++) {
                    PixelRange rows = strips.getRows(i);
                    assertEquals("gap or overlap before strip " + i, expectedStart, rows.getStart());
                    assertTrue(rows.length() <= tile);
                    if (i < strips.getStripCount() - 1) {
                        assertEquals(tile, rows.length());
                    }
                    expectedStart = rows.getEnd();
                }
                assertEquals(height, expectedStart);
            }
        }
    }

    @Test
    public void chunksCoverWidthExactly() {
        for (int chunks = 1; chunks <= 70; chunks++) {
            for (int width = 1; width <= 2000; width += 3) {
                var grid = new ChunkGrid(width, chunks);
                assertTrue(grid.getChunkCount() <= chunks);
                int expectedStart = 0;
                for (int i = 0; i < grid.getChunkCount(); i++) {
                    PixelRange cols = grid.getColumns(i);
                    assertEquals(expectedStart, cols.getStart());
                    assertTrue("empty chunk", cols.length() > 0);
                    assertTrue(cols.length() <= grid.getChunkWidth());
                    expectedStart = cols.getEnd();
                }
                assertEquals("width " + width + " chunks " + chunks, width, expectedStart);
            }
        }
    }

    @Test
    public void scenario1024x768() {
        var strips = new StripPartition(768, 256);
        assertEquals(3, strips.getStripCount());
        for (int i = 0; i < 3; i++) {
            assertEquals(256, strips.getRows(i).length());
        }
        assertEquals(2, strips.getTileRow(0));
        assertEquals(0, strips.getTileRow(2));
    }

    @Test
    public void shortLastStrip() {
        var strips = new StripPartition(600, 256);
        assertEquals(3, strips.getStripCount());
        assertEquals(new PixelRange(512, 600), strips.getRows(2));
    }

    @Test
    public void defaultChunkWidthAtScaleOne() {
        var grid = new ChunkGrid(RenderDomain.forScale(1).getWidth(), 160);
        assertEquals(64, grid.getChunkWidth());
        assertEquals(160, grid.getChunkCount());
    }

    @Test
    public void domainScalesLinearly() {
        var one = RenderDomain.forScale(1);
        var three = RenderDomain.forScale(3);
        assertEquals(3 * one.getWidth(), three.getWidth());
        assertEquals(3 * one.getHeight(), three.getHeight());
        assertEquals(-2.5, three.x(0), 0.0);
        assertEquals(1.0, three.x(three.getWidth() - 1), 1e-12);
        assertEquals(-1.0, three.y(0), 0.0);
        assertEquals(1.0, three.y(three.getHeight() - 1), 1e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNonPositiveScale() {
        RenderDomain.forScale(0);
    }
}
