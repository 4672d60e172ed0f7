package au.org.ala.raster.render;

import org.apache.commons.lang3.Validate;

/**
 * Splits the image height into strips one tile high, the last possibly shorter.
 */
public final class StripPartition {

    private final int height;
    private final int stripHeight;
    private final int stripCount;

    public StripPartition(int height, int stripHeight) {
        Validate.isTrue(height > 0, "Height must be positive");
        Validate.isTrue(stripHeight > 0, "Strip height must be positive");
        this.height = height;
        this.stripHeight = stripHeight;
        this.stripCount = (int) Math.ceil((double) height / stripHeight);
    }

    public int getStripCount() {
        return stripCount;
    }

    public int getStripHeight() {
        return stripHeight;
    }

    public PixelRange getRows(int strip) {
        Validate.isTrue(strip >= 0 && strip < stripCount, "No strip %d of %d", strip, stripCount);
        return new PixelRange(strip * stripHeight, Math.min((strip + 1) * stripHeight, height));
    }

    /**
     * Strips are computed from the bottom of the field upward while tile rows count down from the top, so
     * strip 0 lands on the last tile row.
     */
    public int getTileRow(int strip) {
        return stripCount - 1 - strip;
    }
}
