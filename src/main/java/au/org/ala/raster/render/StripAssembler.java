package au.org.ala.raster.render;

import au.org.ala.raster.kernel.RgbRaster;
import au.org.ala.raster.tiling.TileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.BitSet;

/**
 * Collects the chunks of one strip in any order, then stitches them into a full width strip, flips it so the
 * first row is the top of the picture, and cuts it into base level tiles.
 */
public class StripAssembler {

    private static final Logger log = LoggerFactory.getLogger(StripAssembler.class);

    private final int width;
    private final int tileSize;
    private final int level;
    private final ChunkGrid chunkGrid;
    private final StripPartition strips;
    private final ChunkSpillStore spillStore;
    private final TileStore tileStore;

    private final BitSet received;
    private int strip = -1;

    /**
     * @param level the pyramid level base tiles are written to, normally the finest
     */
    public StripAssembler(int width, int tileSize, int level, ChunkGrid chunkGrid, StripPartition strips,
                          ChunkSpillStore spillStore, TileStore tileStore) {
        this.width = width;
        this.tileSize = tileSize;
        this.level = level;
        this.chunkGrid = chunkGrid;
        this.strips = strips;
        this.spillStore = spillStore;
        this.tileStore = tileStore;
        this.received = new BitSet(chunkGrid.getChunkCount());
    }

    /**
     * Starts collecting a strip, discarding anything left over from an earlier one.
     */
    public void begin(int strip) throws IOException {
        spillStore.clear();
        received.clear();
        this.strip = strip;
    }

    public void accept(int chunkIndex, RgbRaster chunk) throws IOException {
        if (strip < 0) {
            throw new IllegalStateException("No strip in progress");
        }
        if (received.get(chunkIndex)) {
            throw new IllegalStateException("Chunk " + chunkIndex + " of strip " + strip + " delivered twice");
        }
        PixelRange cols = chunkGrid.getColumns(chunkIndex);
        int rows = strips.getRows(strip).length();
        if (chunk.getWidth() != cols.length() || chunk.getHeight() != rows) {
            throw new IllegalArgumentException(String.format("Chunk %d is %dx%d, expected %dx%d",
                    chunkIndex, chunk.getWidth(), chunk.getHeight(), cols.length(), rows));
        }
        spillStore.spill(chunkIndex, chunk);
        received.set(chunkIndex);
    }

    public int getReceivedCount() {
        return received.cardinality();
    }

    public boolean isComplete() {
        return received.cardinality() == chunkGrid.getChunkCount();
    }

    /**
     * Writes the tiles of the current strip and removes its spilled chunks.
     *
     * @return the number of tiles written
     */
    public int finish() throws IOException {
        if (!isComplete()) {
            throw new IllegalStateException(String.format("Strip %d has %d of %d chunks", strip, getReceivedCount(), chunkGrid.getChunkCount()));
        }
        RgbRaster buffer = assemble();
        buffer.flipVertical();

        int tileRow = strips.getTileRow(strip);
        int cols = (width + tileSize - 1) / tileSize;
        for (int col = 0; col < cols; col++) {
            int x = col * tileSize;
            tileStore.write(level, col, tileRow, buffer.crop(x, 0, Math.min(tileSize, width - x), buffer.getHeight()));
        }
        log.debug("Strip {} written as {} tiles on row {} of level {}", strip, cols, tileRow, level);

        spillStore.clear();
        received.clear();
        strip = -1;
        return cols;
    }

    /**
     * Drops a partially collected strip.
     */
    public void abandon() throws IOException {
        if (strip >= 0) {
            log.debug("Abandoning strip {} with {} chunks received", strip, getReceivedCount());
        }
        spillStore.clear();
        received.clear();
        strip = -1;
    }

    RgbRaster assemble() throws IOException {
        int rows = strips.getRows(strip).length();
        RgbRaster buffer = RgbRaster.blank(width, rows);
        for (int i = 0; i < chunkGrid.getChunkCount(); i++) {
            PixelRange cols = chunkGrid.getColumns(i);
            buffer.paste(spillStore.load(i, cols.length(), rows), cols.getStart(), 0);
        }
        return buffer;
    }
}
