package au.org.ala.raster.kernel;

import au.org.ala.raster.util.ImageUtils;
import org.imgscalr.Scalr;

import java.awt.image.BufferedImage;

/**
 * Halves a block with imgscalr's quality resampling. Smoother than {@link BoxTileDownsampler} but not
 * bit-reproducible across JDKs.
 */
public class ScalrTileDownsampler implements TileDownsampler {

    @Override
    public RgbRaster downsample(RgbRaster block) {
        BufferedImage src = ImageUtils.toImage(block);
        BufferedImage scaled = ImageUtils.scaleExact(src, Math.max(1, block.getWidth() / 2), Math.max(1, block.getHeight() / 2));
        try {
            return ImageUtils.toRaster(scaled);
        } finally {
            scaled.flush();
            src.flush();
        }
    }
}
