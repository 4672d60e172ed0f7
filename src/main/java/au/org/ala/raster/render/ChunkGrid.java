package au.org.ala.raster.render;

import org.apache.commons.lang3.Validate;

/**
 * Divides the image width into at most {@code maxChunks} equal column bands. The band width is rounded up, so
 * the last band may be narrower and fewer than {@code maxChunks} bands may be needed; none is ever empty. The
 * same grid applies to every strip.
 */
public final class ChunkGrid {

    private final int width;
    private final int chunkWidth;
    private final int chunkCount;

    public ChunkGrid(int width, int maxChunks) {
        Validate.isTrue(width > 0, "Width must be positive");
        Validate.isTrue(maxChunks > 0, "Chunk count must be positive");
        this.width = width;
        this.chunkWidth = (width + maxChunks - 1) / maxChunks;
        this.chunkCount = (width + chunkWidth - 1) / chunkWidth;
    }

    public int getChunkCount() {
        return chunkCount;
    }

    public int getChunkWidth() {
        return chunkWidth;
    }

    public PixelRange getColumns(int chunk) {
        Validate.isTrue(chunk >= 0 && chunk < chunkCount, "No chunk %d of %d", chunk, chunkCount);
        return new PixelRange(chunk * chunkWidth, Math.min((chunk + 1) * chunkWidth, width));
    }
}
