package au.org.ala.raster.render;

import org.apache.commons.lang3.Validate;

/**
 * The coordinate rectangle being rendered and the pixel grid laid over it. Pixel centres run from the lower
 * bound to the upper bound inclusive on both axes, so row 0 is at {@code yMin}.
 */
public final class RenderDomain {

    public static final int BASE_WIDTH = 10240;
    public static final int BASE_HEIGHT = 7680;

    public static final double DEFAULT_X_MIN = -2.5;
    public static final double DEFAULT_X_MAX = 1.0;
    public static final double DEFAULT_Y_MIN = -1.0;
    public static final double DEFAULT_Y_MAX = 1.0;

    private final int scale;
    private final double xMin;
    private final double xMax;
    private final double yMin;
    private final double yMax;
    private final int width;
    private final int height;

    private RenderDomain(int scale, double xMin, double xMax, double yMin, double yMax, int width, int height) {
        Validate.isTrue(scale > 0, "Scale factor must be positive");
        Validate.isTrue(width > 0 && height > 0, "Invalid resolution %dx%d", width, height);
        Validate.isTrue(xMax > xMin && yMax > yMin, "Empty coordinate rectangle");
        this.scale = scale;
        this.xMin = xMin;
        this.xMax = xMax;
        this.yMin = yMin;
        this.yMax = yMax;
        this.width = width;
        this.height = height;
    }

    /**
     * The default rectangle at {@code BASE_WIDTH*scale x BASE_HEIGHT*scale} pixels.
     */
    public static RenderDomain forScale(int scale) {
        Validate.isTrue(scale > 0, "Scale factor must be positive");
        return new RenderDomain(scale, DEFAULT_X_MIN, DEFAULT_X_MAX, DEFAULT_Y_MIN, DEFAULT_Y_MAX,
                Math.multiplyExact(BASE_WIDTH, scale), Math.multiplyExact(BASE_HEIGHT, scale));
    }

    public static RenderDomain of(int scale, double xMin, double xMax, double yMin, double yMax, int width, int height) {
        return new RenderDomain(scale, xMin, xMax, yMin, yMax, width, height);
    }

    public int getScale() {
        return scale;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public double x(int column) {
        return width == 1 ? xMin : xMin + column * (xMax - xMin) / (width - 1);
    }

    public double y(int row) {
        return height == 1 ? yMin : yMin + row * (yMax - yMin) / (height - 1);
    }

    @Override
    public String toString() {
        return String.format("RenderDomain{scale=%d, %dx%d, x=[%s, %s], y=[%s, %s]}", scale, width, height, xMin, xMax, yMin, yMax);
    }
}
