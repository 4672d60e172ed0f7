package au.org.ala.raster.kernel;

import org.apache.commons.lang3.Validate;

import java.util.List;

/**
 * A 256 entry RGB palette. Immutable, so one instance is shared by every worker.
 */
public final class ColorLookupTable {

    public static final int SIZE = 256;

    public static final List<String> DEFAULT_GRADIENT = List.of(
            "#10001F", "#1A0E36", "#001E71", "#007D7D", "#006C7F",
            "#00B129", "#F2FF00", "#FF6600", "#D60000", "#757575FF");

    private final byte[] table;

    private ColorLookupTable(byte[] table) {
        this.table = table;
    }

    public static ColorLookupTable defaultTable() {
        return fromGradient(DEFAULT_GRADIENT);
    }

    /**
     * Linear interpolation between evenly spaced colour stops. Stops are {@code #RRGGBB}; a trailing alpha
     * byte ({@code #RRGGBBAA}) is accepted and ignored.
     */
    public static ColorLookupTable fromGradient(List<String> stops) {
        Validate.isTrue(stops.size() >= 2, "A gradient needs at least two stops");
        double[][] rgb = new double[stops.size()][];
        for (int i = 0; i < stops.size(); i++) {
            rgb[i] = parseHex(stops.get(i));
        }

        byte[] table = new byte[SIZE * RgbRaster.BANDS];
        int segments = stops.size() - 1;
        for (int i = 0; i < SIZE; i++) {
            double t = (double) i / (SIZE - 1) * segments;
            int seg = Math.min((int) Math.floor(t), segments - 1);
            double f = t - seg;
            for (int b = 0; b < RgbRaster.BANDS; b++) {
                double v = rgb[seg][b] + (rgb[seg + 1][b] - rgb[seg][b]) * f;
                table[i * RgbRaster.BANDS + b] = (byte) (int) (v * 255.0);
            }
        }
        return new ColorLookupTable(table);
    }

    private static double[] parseHex(String stop) {
        String hex = stop.startsWith("#") ? stop.substring(1) : stop;
        Validate.isTrue(hex.length() == 6 || hex.length() == 8, "Not a colour: %s", stop);
        double[] rgb = new double[RgbRaster.BANDS];
        for (int b = 0; b < RgbRaster.BANDS; b++) {
            rgb[b] = Integer.parseInt(hex.substring(b * 2, b * 2 + 2), 16) / 255.0;
        }
        return rgb;
    }

    public byte red(int index) {
        return table[index * RgbRaster.BANDS];
    }

    public byte green(int index) {
        return table[index * RgbRaster.BANDS + 1];
    }

    public byte blue(int index) {
        return table[index * RgbRaster.BANDS + 2];
    }

    /**
     * Writes the three samples of entry {@code index} to {@code dest} at {@code offset}.
     */
    public void copyEntry(int index, byte[] dest, int offset) {
        System.arraycopy(table, index * RgbRaster.BANDS, dest, offset, RgbRaster.BANDS);
    }
}
