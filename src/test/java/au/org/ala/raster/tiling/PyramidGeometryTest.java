package au.org.ala.raster.tiling;

import au.org.ala.raster.TestBase;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static org.junit.Assert.assertEquals;

@RunWith(JUnit4.class)
public class PyramidGeometryTest extends TestBase {

    @Test
    public void scenario1024x768() {
        PyramidGeometry g = new PyramidGeometry(1024, 768, 256);
        assertEquals(10, g.getMaxLevel());
        assertEquals(4, g.getTilesWide(10));
        assertEquals(3, g.getTilesHigh(10));
        assertEquals(1, g.getLevelWidth(0));
        assertEquals(1, g.getLevelHeight(0));
        assertEquals(512, g.getLevelWidth(9));
        assertEquals(384, g.getLevelHeight(9));
        assertEquals(2, g.getTilesHigh(9));
        assertEquals(128, g.getTileHeight(9, 1));
    }

    @Test
    public void levelsHalveRoundingUp() {
        int[][] sizes = {{1, 1}, {2, 1}, {600, 512}, {10240, 7680}, {1000, 3}, {257, 999}};
        for (int[] size : sizes) {
            PyramidGeometry g = new PyramidGeometry(size[0], size[1], 256);
            assertEquals(size[0], g.getLevelWidth(g.getMaxLevel()));
            assertEquals(size[1], g.getLevelHeight(g.getMaxLevel()));
            assertEquals(1, g.getLevelWidth(0));
            assertEquals(1, g.getLevelHeight(0));
            for (int level = g.getMaxLevel() - 1; level >= 0; level--) {
                assertEquals((g.getLevelWidth(level + 1) + 1) / 2, g.getLevelWidth(level));
                assertEquals((g.getLevelHeight(level + 1) + 1) / 2, g.getLevelHeight(level));
            }
        }
    }

    @Test
    public void maxLevelIsCeilLog2() {
        assertEquals(0, PyramidGeometry.maxLevelFor(1, 1));
        assertEquals(1, PyramidGeometry.maxLevelFor(2, 1));
        assertEquals(2, PyramidGeometry.maxLevelFor(3, 1));
        assertEquals(10, PyramidGeometry.maxLevelFor(1024, 1));
        assertEquals(11, PyramidGeometry.maxLevelFor(1025, 1));
        assertEquals(14, PyramidGeometry.maxLevelFor(10240, 7680));
    }

    @Test
    public void edgeTilesAreCropped() {
        PyramidGeometry g = new PyramidGeometry(600, 512, 256);
        assertEquals(3, g.getTilesWide(10));
        assertEquals(88, g.getTileWidth(10, 2));
        assertEquals(256, g.getTileWidth(10, 1));
        assertEquals(44, g.getTileWidth(9, 1));
        assertEquals(256, g.getTileHeight(9, 0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsLevelOutOfRange() {
        new PyramidGeometry(600, 512, 256).getLevelWidth(11);
    }
}
