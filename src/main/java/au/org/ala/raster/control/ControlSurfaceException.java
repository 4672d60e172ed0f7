package au.org.ala.raster.control;

/**
 * The interactive control surface could not be set up.
 */
public class ControlSurfaceException extends Exception {

    public ControlSurfaceException(String message, Throwable cause) {
        super(message, cause);
    }

    public ControlSurfaceException(String message) {
        super(message);
    }
}
