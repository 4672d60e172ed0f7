package au.org.ala.raster.kernel;

import org.apache.commons.lang3.Validate;

/**
 * Smoothed escape-time count for z -> z^2 + c. Points that never escape within the iteration limit get 0.
 */
public class EscapeTimeKernel implements FieldKernel {

    public static final int DEFAULT_MAX_ITERATIONS = 750;
    public static final double DEFAULT_ESCAPE_RADIUS_SQUARED = 1 << 18;

    private static final double LOG2 = Math.log(2.0);

    private final int maxIterations;
    private final double escapeRadiusSquared;

    public EscapeTimeKernel() {
        this(DEFAULT_MAX_ITERATIONS, DEFAULT_ESCAPE_RADIUS_SQUARED);
    }

    public EscapeTimeKernel(int maxIterations, double escapeRadiusSquared) {
        Validate.isTrue(maxIterations > 0, "maxIterations must be positive");
        Validate.isTrue(escapeRadiusSquared > 4.0, "escape radius must exceed 2");
        this.maxIterations = maxIterations;
        this.escapeRadiusSquared = escapeRadiusSquared;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    @Override
    public float[] computeField(double[] xGrid, double[] yGrid) {
        Validate.isTrue(xGrid.length == yGrid.length,
                "Coordinate grids differ in size: %s vs %s", xGrid.length, yGrid.length);
        float[] out = new float[xGrid.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = (float) escapeTime(xGrid[i], yGrid[i]);
        }
        return out;
    }

    double escapeTime(double cx, double cy) {
        double zx = 0.0;
        double zy = 0.0;
        double zx2 = 0.0;
        double zy2 = 0.0;
        int n = 0;
        while (n < maxIterations && zx2 + zy2 <= escapeRadiusSquared) {
            zy = 2.0 * zx * zy + cy;
            zx = zx2 - zy2 + cx;
            zx2 = zx * zx;
            zy2 = zy * zy;
            n++;
        }
        if (zx2 + zy2 <= escapeRadiusSquared) {
            return 0.0;
        }
        // log(log|z|) / log 2 with |z| = sqrt(r2)
        double logModulus = 0.5 * Math.log(zx2 + zy2);
        return Math.max(0.0, n + 1 - Math.log(logModulus) / LOG2);
    }
}
