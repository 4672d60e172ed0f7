package au.org.ala.raster.render;

import au.org.ala.raster.kernel.ColorLookupTable;
import au.org.ala.raster.kernel.RgbRaster;
import org.apache.commons.lang3.Validate;

/**
 * Maps raw field values onto the palette: {@code clamp(value / colorReference, 0, 1) * 255}, truncated to a
 * palette index. Holds only read-only state and is shared by all workers.
 */
public final class Colorizer {

    private final ColorLookupTable lookupTable;
    private final double colorReference;

    public Colorizer(ColorLookupTable lookupTable, double colorReference) {
        Validate.isTrue(colorReference > 0, "Colour reference must be positive");
        this.lookupTable = lookupTable;
        this.colorReference = colorReference;
    }

    public double getColorReference() {
        return colorReference;
    }

    public int paletteIndex(float value) {
        double normalized = value / colorReference * 255.0;
        if (!(normalized > 0)) {
            // negative or NaN
            return 0;
        }
        return normalized >= 255.0 ? 255 : (int) normalized;
    }

    public RgbRaster colorize(float[] field, int width, int height) {
        Validate.isTrue(field.length == (long) width * height, "Field has %d values, expected %d", field.length, (long) width * height);
        byte[] rgb = new byte[RgbRaster.byteCount(width, height)];
        for (int i = 0; i < field.length; i++) {
            lookupTable.copyEntry(paletteIndex(field[i]), rgb, i * RgbRaster.BANDS);
        }
        return new RgbRaster(width, height, rgb);
    }
}
