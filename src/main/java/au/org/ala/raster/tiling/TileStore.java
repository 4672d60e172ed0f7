package au.org.ala.raster.tiling;

import au.org.ala.raster.kernel.RgbRaster;
import au.org.ala.raster.util.ImageUtils;
import com.google.common.io.ByteSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Optional;

/**
 * Encodes and decodes tiles through a {@link TilerSink}. Safe for concurrent use on distinct tiles.
 */
public class TileStore {

    private static final Logger log = LoggerFactory.getLogger(TileStore.class);

    static {
        ImageIO.setUseCache(false);
    }

    private final TilerSink tilerSink;
    private final TileFormat tileFormat;

    public TileStore(TilerSink tilerSink, TileFormat tileFormat) {
        this.tilerSink = tilerSink;
        this.tileFormat = tileFormat;
    }

    public TileFormat getTileFormat() {
        return tileFormat;
    }

    public void write(int level, int col, int row, RgbRaster tile) throws IOException {
        BufferedImage image = ImageUtils.toImage(tile);
        try (OutputStream tileStream = tilerSink.getLevelSink(level).getColumnSink(col).getTileSink(row).openBufferedStream()) {
            if (!ImageIO.write(image, tileFormat.getImageIoName(), tileStream)) {
                throw new IOException("No ImageIO writer for " + tileFormat);
            }
        } finally {
            image.flush();
        }
        log.trace("wrote tile {}/{}_{}", level, col, row);
    }

    /**
     * @return the decoded tile, or empty if it was never written
     */
    public Optional<RgbRaster> read(int level, int col, int row) throws IOException {
        ByteSource source = tilerSink.getLevelSink(level).getColumnSink(col).getTileSource(row);
        if (source == null) {
            return Optional.empty();
        }
        BufferedImage image;
        try (InputStream in = source.openBufferedStream()) {
            image = ImageIO.read(in);
        }
        if (image == null) {
            throw new IOException(String.format("Tile %d/%d_%d is not a readable %s", level, col, row, tileFormat));
        }
        try {
            return Optional.of(ImageUtils.toRaster(image));
        } finally {
            image.flush();
        }
    }
}
