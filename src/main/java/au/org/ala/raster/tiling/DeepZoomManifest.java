package au.org.ala.raster.tiling;

import com.google.common.io.Files;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * The {@code .dzi} descriptor a Deep Zoom viewer reads before requesting tiles.
 */
public final class DeepZoomManifest {

    public static final int TILE_OVERLAP = 0;

    private final TileFormat format;
    private final int tileSize;
    private final int width;
    private final int height;

    public DeepZoomManifest(TileFormat format, int tileSize, int width, int height) {
        this.format = format;
        this.tileSize = tileSize;
        this.width = width;
        this.height = height;
    }

    public static DeepZoomManifest of(PyramidGeometry geometry, TileFormat format) {
        return new DeepZoomManifest(format, geometry.getTileSize(), geometry.getWidth(), geometry.getHeight());
    }

    public String toXml() {
        return "<?xml version=\"1.0\" encoding=\"utf-8\"?>\n" +
                "<Image xmlns=\"http://schemas.microsoft.com/deepzoom/2008\"\n" +
                "       Format=\"" + format.getExtension() + "\"\n" +
                "       Overlap=\"" + TILE_OVERLAP + "\"\n" +
                "       TileSize=\"" + tileSize + "\">\n" +
                "    <Size Height=\"" + height + "\" Width=\"" + width + "\"/>\n" +
                "</Image>\n";
    }

    public void write(File dziFile) throws IOException {
        Files.asCharSink(dziFile, StandardCharsets.UTF_8).write(toXml());
    }
}
