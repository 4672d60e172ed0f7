package au.org.ala.raster.kernel;

import org.apache.commons.lang3.Validate;

/**
 * An 8-bit RGB pixel buffer, row-major with interleaved samples. Row 0 is the first row in memory; whether
 * that is the top or the bottom of the picture is up to the caller.
 */
public final class RgbRaster {

    public static final int BANDS = 3;

    private final int width;
    private final int height;
    private final byte[] data;

    public RgbRaster(int width, int height, byte[] data) {
        Validate.isTrue(width > 0 && height > 0, "Invalid raster size %sx%s", width, height);
        int expected = byteCount(width, height);
        Validate.isTrue(data.length == expected,
                "Expected %s bytes for %sx%s RGB, got %s", expected, width, height, data.length);
        this.width = width;
        this.height = height;
        this.data = data;
    }

    /**
     * A zero-filled (black) raster.
     */
    public static RgbRaster blank(int width, int height) {
        Validate.isTrue(width > 0 && height > 0, "Invalid raster size %sx%s", width, height);
        return new RgbRaster(width, height, new byte[byteCount(width, height)]);
    }

    /**
     * Buffer size for a {@code width x height} raster.
     *
     * @throws ArithmeticException if it does not fit in an array
     */
    public static int byteCount(int width, int height) {
        try {
            return Math.multiplyExact(Math.multiplyExact(width, height), BANDS);
        } catch (ArithmeticException e) {
            throw new ArithmeticException(String.format("A %dx%d RGB raster does not fit in one array", width, height));
        }
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * The backing array, not a copy.
     */
    public byte[] getData() {
        return data;
    }

    public int getRgb(int x, int y) {
        int i = (y * width + x) * BANDS;
        return ((data[i] & 0xff) << 16) | ((data[i + 1] & 0xff) << 8) | (data[i + 2] & 0xff);
    }

    /**
     * Copies all of {@code source} into this raster with its top left corner at (x, y), clipping anything that
     * falls outside.
     */
    public void paste(RgbRaster source, int x, int y) {
        int w = Math.min(source.width, width - x);
        int h = Math.min(source.height, height - y);
        if (w <= 0 || h <= 0) {
            return;
        }
        for (int row = 0; row < h; row++) {
            System.arraycopy(source.data, row * source.width * BANDS,
                    data, ((y + row) * width + x) * BANDS, w * BANDS);
        }
    }

    public RgbRaster crop(int x, int y, int w, int h) {
        Validate.isTrue(x >= 0 && y >= 0 && x + w <= width && y + h <= height,
                "Crop %sx%s+%s+%s outside %sx%s", w, h, x, y, width, height);
        if (x == 0 && y == 0 && w == width && h == height) {
            return this;
        }
        byte[] out = new byte[w * h * BANDS];
        for (int row = 0; row < h; row++) {
            System.arraycopy(data, ((y + row) * width + x) * BANDS, out, row * w * BANDS, w * BANDS);
        }
        return new RgbRaster(w, h, out);
    }

    /**
     * Reverses the row order in place.
     */
    public void flipVertical() {
        int stride = width * BANDS;
        byte[] tmp = new byte[stride];
        for (int top = 0, bottom = height - 1; top < bottom; top++, bottom--) {
            System.arraycopy(data, top * stride, tmp, 0, stride);
            System.arraycopy(data, bottom * stride, data, top * stride, stride);
            System.arraycopy(tmp, 0, data, bottom * stride, stride);
        }
    }
}
