package au.org.ala.raster.kernel;

import org.apache.commons.lang3.Validate;

/**
 * Each output pixel is the rounded mean of the 2x2 input pixels it covers.
 */
public class BoxTileDownsampler implements TileDownsampler {

    @Override
    public RgbRaster downsample(RgbRaster block) {
        Validate.isTrue(block.getWidth() % 2 == 0 && block.getHeight() % 2 == 0,
                "Block dimensions must be even, got %sx%s", block.getWidth(), block.getHeight());
        int w = block.getWidth() / 2;
        int h = block.getHeight() / 2;
        int srcStride = block.getWidth() * RgbRaster.BANDS;
        byte[] src = block.getData();
        byte[] dst = new byte[RgbRaster.byteCount(w, h)];

        for (int y = 0; y < h; y++) {
            int top = 2 * y * srcStride;
            int bottom = top + srcStride;
            for (int x = 0; x < w; x++) {
                int left = 2 * x * RgbRaster.BANDS;
                int right = left + RgbRaster.BANDS;
                int out = (y * w + x) * RgbRaster.BANDS;
                for (int b = 0; b < RgbRaster.BANDS; b++) {
                    int sum = (src[top + left + b] & 0xff) + (src[top + right + b] & 0xff)
                            + (src[bottom + left + b] & 0xff) + (src[bottom + right + b] & 0xff);
                    dst[out + b] = (byte) ((sum + 2) >> 2);
                }
            }
        }
        return new RgbRaster(w, h, dst);
    }
}
