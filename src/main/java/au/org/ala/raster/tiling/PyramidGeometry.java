package au.org.ala.raster.tiling;

import org.apache.commons.lang3.Validate;

/**
 * Deep Zoom level arithmetic. Level {@code maxLevel} is full resolution, the smallest level such that
 * {@code 2^maxLevel >= max(width, height)}; each coarser level halves both dimensions, rounding up, down to a
 * single pixel at level 0.
 */
public final class PyramidGeometry {

    private final int width;
    private final int height;
    private final int tileSize;
    private final int maxLevel;

    public PyramidGeometry(int width, int height, int tileSize) {
        Validate.isTrue(width > 0 && height > 0, "Invalid image size %dx%d", width, height);
        Validate.isTrue(tileSize > 0, "Tile size must be positive");
        this.width = width;
        this.height = height;
        this.tileSize = tileSize;
        this.maxLevel = maxLevelFor(width, height);
    }

    static int maxLevelFor(int width, int height) {
        int largest = Math.max(width, height);
        return largest <= 1 ? 0 : 32 - Integer.numberOfLeadingZeros(largest - 1);
    }

    public int getMaxLevel() {
        return maxLevel;
    }

    public int getTileSize() {
        return tileSize;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getLevelWidth(int level) {
        return scaledDimension(width, level);
    }

    public int getLevelHeight(int level) {
        return scaledDimension(height, level);
    }

    private int scaledDimension(int dimension, int level) {
        Validate.isTrue(level >= 0 && level <= maxLevel, "Level %d outside [0, %d]", level, maxLevel);
        long divisor = 1L << (maxLevel - level);
        return (int) Math.max(1L, (dimension + divisor - 1) / divisor);
    }

    public int getTilesWide(int level) {
        return (getLevelWidth(level) + tileSize - 1) / tileSize;
    }

    public int getTilesHigh(int level) {
        return (getLevelHeight(level) + tileSize - 1) / tileSize;
    }

    /** Width of the tile in column {@code col}; edge tiles may be narrower than the tile size. */
    public int getTileWidth(int level, int col) {
        return Math.min(tileSize, getLevelWidth(level) - col * tileSize);
    }

    public int getTileHeight(int level, int row) {
        return Math.min(tileSize, getLevelHeight(level) - row * tileSize);
    }
}
