package au.org.ala.raster.kernel;

/**
 * Computes a scalar field over a grid of coordinates.
 */
public interface FieldKernel {

    /**
     * @param xGrid x coordinate of every sample
     * @param yGrid y coordinate of every sample, same length and layout as {@code xGrid}
     * @return one value per coordinate pair, in the same order
     */
    float[] computeField(double[] xGrid, double[] yGrid);
}
