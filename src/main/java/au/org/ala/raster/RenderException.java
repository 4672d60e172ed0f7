package au.org.ala.raster;

/**
 * A chunk or tile could not be produced. The run stops rather than persist a bad tile, since every coarser
 * level would inherit it.
 */
public class RenderException extends Exception {

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }

    public RenderException(String message) {
        super(message);
    }
}
