package au.org.ala.raster.checkpoint;

import org.apache.commons.lang3.Validate;

/**
 * Everything needed to pick a run up again at a strip boundary: which strip is next, and the parameters the
 * finished strips were rendered with.
 */
public final class Checkpoint {

    /** Pyramid level value meaning "the pyramid phase has not started". */
    public static final int NO_PYRAMID_LEVEL = -1;

    private final int scale;
    private final int currentStrip;
    private final int totalStrips;
    private final int maxIterations;
    private final double colorReference;
    private final int pyramidLevel;

    public Checkpoint(int scale, int currentStrip, int totalStrips, int maxIterations, double colorReference) {
        this(scale, currentStrip, totalStrips, maxIterations, colorReference, NO_PYRAMID_LEVEL);
    }

    public Checkpoint(int scale, int currentStrip, int totalStrips, int maxIterations, double colorReference, int pyramidLevel) {
        Validate.isTrue(scale > 0, "scale must be positive, got %d", scale);
        Validate.isTrue(totalStrips > 0, "totalStrips must be positive, got %d", totalStrips);
        Validate.isTrue(currentStrip >= 0 && currentStrip <= totalStrips,
                "currentStrip %d outside [0, %d]", currentStrip, totalStrips);
        Validate.isTrue(pyramidLevel >= NO_PYRAMID_LEVEL, "Invalid pyramid level %d", pyramidLevel);
        Validate.isTrue(pyramidLevel == NO_PYRAMID_LEVEL || currentStrip == totalStrips,
                "Pyramid level recorded before all strips were rendered");
        this.scale = scale;
        this.currentStrip = currentStrip;
        this.totalStrips = totalStrips;
        this.maxIterations = maxIterations;
        this.colorReference = colorReference;
        this.pyramidLevel = pyramidLevel;
    }

    public int getScale() {
        return scale;
    }

    public int getCurrentStrip() {
        return currentStrip;
    }

    public int getTotalStrips() {
        return totalStrips;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public double getColorReference() {
        return colorReference;
    }

    /**
     * @return the next coarse level to build, or {@link #NO_PYRAMID_LEVEL}
     */
    public int getPyramidLevel() {
        return pyramidLevel;
    }

    /** All strips are rendered; only the pyramid remains. */
    public boolean isComplete() {
        return currentStrip == totalStrips;
    }

    public double getCompletionPercent() {
        return 100.0 * currentStrip / totalStrips;
    }

    public boolean matches(int maxIterations, double colorReference) {
        return this.maxIterations == maxIterations && Double.compare(this.colorReference, colorReference) == 0;
    }

    public Checkpoint withPyramidLevel(int level) {
        return new Checkpoint(scale, currentStrip, totalStrips, maxIterations, colorReference, level);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Checkpoint)) return false;
        Checkpoint that = (Checkpoint) o;
        return scale == that.scale && currentStrip == that.currentStrip && totalStrips == that.totalStrips
                && maxIterations == that.maxIterations && Double.compare(colorReference, that.colorReference) == 0
                && pyramidLevel == that.pyramidLevel;
    }

    @Override
    public int hashCode() {
        int result = scale;
        result = 31 * result + currentStrip;
        result = 31 * result + totalStrips;
        result = 31 * result + maxIterations;
        result = 31 * result + Double.hashCode(colorReference);
        result = 31 * result + pyramidLevel;
        return result;
    }

    @Override
    public String toString() {
        return "Checkpoint{scale=" + scale +
                ", currentStrip=" + currentStrip +
                ", totalStrips=" + totalStrips +
                ", maxIterations=" + maxIterations +
                ", colorReference=" + colorReference +
                ", pyramidLevel=" + pyramidLevel +
                '}';
    }
}
