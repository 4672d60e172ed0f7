package au.org.ala.raster.render;

import au.org.ala.raster.kernel.RgbRaster;

/**
 * The coloured pixels of a finished chunk, or the reason it could not be computed.
 */
public final class ChunkResult {

    private final int chunkIndex;
    private final RgbRaster chunk;
    private final Throwable failure;

    private ChunkResult(int chunkIndex, RgbRaster chunk, Throwable failure) {
        this.chunkIndex = chunkIndex;
        this.chunk = chunk;
        this.failure = failure;
    }

    public static ChunkResult completed(int chunkIndex, RgbRaster chunk) {
        return new ChunkResult(chunkIndex, chunk, null);
    }

    public static ChunkResult failed(int chunkIndex, Throwable failure) {
        return new ChunkResult(chunkIndex, null, failure);
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    public RgbRaster getChunk() {
        return chunk;
    }

    public boolean isFailed() {
        return failure != null;
    }

    public Throwable getFailure() {
        return failure;
    }
}
