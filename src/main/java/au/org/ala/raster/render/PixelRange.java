package au.org.ala.raster.render;

import org.apache.commons.lang3.Validate;

/**
 * Half-open range of pixel indices, {@code [start, end)}.
 */
public final class PixelRange {

    private final int start;
    private final int end;

    public PixelRange(int start, int end) {
        Validate.isTrue(start >= 0 && end > start, "Invalid range [%d, %d)", start, end);
        this.start = start;
        this.end = end;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int length() {
        return end - start;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelRange)) return false;
        PixelRange that = (PixelRange) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
