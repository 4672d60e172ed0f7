package au.org.ala.raster;

import au.org.ala.raster.kernel.BoxTileDownsampler;
import au.org.ala.raster.kernel.EscapeTimeKernel;
import au.org.ala.raster.kernel.ScalrTileDownsampler;
import au.org.ala.raster.kernel.TileDownsampler;
import au.org.ala.raster.tiling.TileFormat;

import java.time.Duration;
import java.util.Properties;

public class RendererConfig {

    public static final String PROPERTY_PREFIX = "raster.";

    private int _tileSize = 256;
    private int _chunksPerStrip = 160;
    private int _workerThreads = Runtime.getRuntime().availableProcessors();
    private int _queueDepth = 2 * Runtime.getRuntime().availableProcessors();
    private int _pyramidThreads = 2 * Runtime.getRuntime().availableProcessors();
    private TileFormat _tileFormat = TileFormat.PNG;
    private Duration _pollInterval = Duration.ofMillis(100);
    private Duration _joinTimeout = Duration.ofSeconds(1);
    private Duration _exitWindow = Duration.ofSeconds(3);
    private int _maxIterations = EscapeTimeKernel.DEFAULT_MAX_ITERATIONS;
    private double _colorReference = 100.0;
    private String _name = "mandelbrot_deepzoom";
    private boolean _interactive = true;
    private String _downsampler = "box";

    public RendererConfig() {
    }

    /**
     * Defaults overridden by any {@code raster.*} entries, e.g. {@code -Draster.workerThreads=4}.
     */
    public static RendererConfig fromProperties(Properties props) {
        RendererConfig config = new RendererConfig();
        config._tileSize = intProp(props, "tileSize", config._tileSize);
        config._chunksPerStrip = intProp(props, "chunksPerStrip", config._chunksPerStrip);
        config._workerThreads = intProp(props, "workerThreads", config._workerThreads);
        config._queueDepth = intProp(props, "queueDepth", config._queueDepth);
        config._pyramidThreads = intProp(props, "pyramidThreads", config._pyramidThreads);
        config._tileFormat = TileFormat.valueOf(props.getProperty(PROPERTY_PREFIX + "tileFormat", config._tileFormat.name()).toUpperCase());
        config._pollInterval = Duration.ofMillis(intProp(props, "pollIntervalMs", (int) config._pollInterval.toMillis()));
        config._joinTimeout = Duration.ofMillis(intProp(props, "joinTimeoutMs", (int) config._joinTimeout.toMillis()));
        config._exitWindow = Duration.ofMillis(intProp(props, "exitWindowMs", (int) config._exitWindow.toMillis()));
        config._maxIterations = intProp(props, "maxIterations", config._maxIterations);
        config._colorReference = Double.parseDouble(props.getProperty(PROPERTY_PREFIX + "colorReference", Double.toString(config._colorReference)));
        config._name = props.getProperty(PROPERTY_PREFIX + "name", config._name);
        config._interactive = Boolean.parseBoolean(props.getProperty(PROPERTY_PREFIX + "interactive", Boolean.toString(config._interactive)));
        config._downsampler = props.getProperty(PROPERTY_PREFIX + "downsampler", config._downsampler).trim().toLowerCase();
        return config;
    }

    public static RendererConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    private static int intProp(Properties props, String key, int defaultValue) {
        String value = props.getProperty(PROPERTY_PREFIX + key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + PROPERTY_PREFIX + key + " is not an integer: " + value, e);
        }
    }

    public int getTileSize() { return _tileSize; }
    public void setTileSize(int tileSize) { _tileSize = tileSize; }

    public int getChunksPerStrip() { return _chunksPerStrip; }
    public void setChunksPerStrip(int chunks) { _chunksPerStrip = chunks; }

    public int getWorkerThreads() { return _workerThreads; }
    public void setWorkerThreads(int threads) { _workerThreads = threads; }

    public int getQueueDepth() { return _queueDepth; }
    public void setQueueDepth(int depth) { _queueDepth = depth; }

    public int getPyramidThreads() { return _pyramidThreads; }
    public void setPyramidThreads(int threads) { _pyramidThreads = threads; }

    public TileFormat getTileFormat() { return _tileFormat; }
    public void setTileFormat(TileFormat format) { _tileFormat = format; }

    public Duration getPollInterval() { return _pollInterval; }
    public void setPollInterval(Duration interval) { _pollInterval = interval; }

    public Duration getJoinTimeout() { return _joinTimeout; }
    public void setJoinTimeout(Duration timeout) { _joinTimeout = timeout; }

    public Duration getExitWindow() { return _exitWindow; }
    public void setExitWindow(Duration window) { _exitWindow = window; }

    public int getMaxIterations() { return _maxIterations; }
    public void setMaxIterations(int maxIterations) { _maxIterations = maxIterations; }

    public double getColorReference() { return _colorReference; }
    public void setColorReference(double colorReference) { _colorReference = colorReference; }

    /** Base name of the {@code .dzi} file, the {@code _files} tile directory and the progress file. */
    public String getName() { return _name; }
    public void setName(String name) { _name = name; }

    public boolean isInteractive() { return _interactive; }
    public void setInteractive(boolean interactive) { _interactive = interactive; }

    /** "box" for the exact 2x2 mean, "scalr" for imgscalr's smoother resampling. */
    public String getDownsampler() { return _downsampler; }
    public void setDownsampler(String downsampler) { _downsampler = downsampler; }

    public TileDownsampler createDownsampler() {
        switch (_downsampler) {
            case "box":
                return new BoxTileDownsampler();
            case "scalr":
                return new ScalrTileDownsampler();
            default:
                throw new IllegalArgumentException("Unknown downsampler '" + _downsampler + "', expected box or scalr");
        }
    }
}
