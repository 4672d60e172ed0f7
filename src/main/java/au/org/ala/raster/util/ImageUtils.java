package au.org.ala.raster.util;

import au.org.ala.raster.kernel.RgbRaster;
import org.imgscalr.Scalr;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

public class ImageUtils {

    public static BufferedImage scaleExact(BufferedImage src, int destWidth, int destHeight) {
        return Scalr.resize(src, Scalr.Method.QUALITY, Scalr.Mode.FIT_EXACT, destWidth, destHeight, Scalr.OP_ANTIALIAS);
    }

    /**
     * Copies an RGB raster into a new {@link BufferedImage#TYPE_3BYTE_BGR} image.
     */
    public static BufferedImage toImage(RgbRaster raster) {
        var image = new BufferedImage(raster.getWidth(), raster.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        byte[] bgr = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        byte[] rgb = raster.getData();
        for (int i = 0; i < rgb.length; i += RgbRaster.BANDS) {
            bgr[i] = rgb[i + 2];
            bgr[i + 1] = rgb[i + 1];
            bgr[i + 2] = rgb[i];
        }
        return image;
    }

    /**
     * Copies any image into an RGB raster, dropping alpha.
     */
    public static RgbRaster toRaster(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        byte[] rgb = new byte[w * h * RgbRaster.BANDS];

        if (image.getType() == BufferedImage.TYPE_3BYTE_BGR
                && image.getRaster().getDataBuffer() instanceof DataBufferByte
                && image.getRaster().getParent() == null) {
            byte[] bgr = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
            for (int i = 0; i < rgb.length; i += RgbRaster.BANDS) {
                rgb[i] = bgr[i + 2];
                rgb[i + 1] = bgr[i + 1];
                rgb[i + 2] = bgr[i];
            }
        } else {
            int[] row = new int[w];
            for (int y = 0; y < h; y++) {
                image.getRGB(0, y, w, 1, row, 0, w);
                for (int x = 0; x < w; x++) {
                    int i = (y * w + x) * RgbRaster.BANDS;
                    rgb[i] = (byte) (row[x] >> 16);
                    rgb[i + 1] = (byte) (row[x] >> 8);
                    rgb[i + 2] = (byte) row[x];
                }
            }
        }
        return new RgbRaster(w, h, rgb);
    }
}
