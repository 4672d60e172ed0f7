package au.org.ala.raster.kernel;

/**
 * Reduces a 2x2 block of tiles (2T x 2T pixels) to a single T x T tile.
 */
public interface TileDownsampler {

    RgbRaster downsample(RgbRaster block);
}
