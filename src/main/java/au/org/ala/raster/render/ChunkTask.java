package au.org.ala.raster.render;

/**
 * One unit of work: a column band of one strip.
 */
public final class ChunkTask {

    private final int chunkIndex;
    private final PixelRange columns;
    private final PixelRange rows;

    public ChunkTask(int chunkIndex, PixelRange columns, PixelRange rows) {
        this.chunkIndex = chunkIndex;
        this.columns = columns;
        this.rows = rows;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    public PixelRange getColumns() {
        return columns;
    }

    public PixelRange getRows() {
        return rows;
    }

    @Override
    public String toString() {
        return "ChunkTask{" + chunkIndex + ", cols=" + columns + ", rows=" + rows + '}';
    }
}
