package au.org.ala.raster;

public enum RenderOutcome {
    /** Every strip and pyramid level written, manifest created, progress file removed. */
    COMPLETED,
    /** Stopped at a clean boundary on request; the progress file records where to resume. */
    SAVED
}
