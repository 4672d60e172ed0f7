package au.org.ala.raster;

/**
 * Rough run time and disk usage for a scale factor, from power law fits to timed runs at scales 1 to 4.
 */
public final class RenderEstimate {

    private RenderEstimate() {
    }

    public static double seconds(int scale) {
        return 12.977 * Math.pow(scale, 1.804);
    }

    /** Peak transient storage, in GB. */
    public static double peakStorageGb(int scale) {
        return 0.075 * scale;
    }

    /** Size of the finished pyramid, in MB. */
    public static double finalStorageMb(int scale) {
        return 9.58017 * Math.pow(scale, 1.69713);
    }

    public static String describeTime(int scale) {
        double secs = seconds(scale);
        double minutes = secs / 60.0;
        if (minutes < 1) {
            return String.format("%.0f seconds", secs);
        } else if (minutes < 60) {
            return String.format("%.1f minutes", minutes);
        }
        return String.format("%.1f hours", minutes / 60.0);
    }

    public static String describePeakStorage(int scale) {
        double gb = peakStorageGb(scale);
        return gb < 1 ? String.format("%.0f MB", gb * 1024) : String.format("%.1f GB", gb);
    }

    public static String describeFinalStorage(int scale) {
        double mb = finalStorageMb(scale);
        return mb < 1024 ? String.format("%.0f MB", mb) : String.format("%.1f GB", mb / 1024);
    }
}
