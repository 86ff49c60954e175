package ca.gc.cra.geotag.domain.geo;

/**
 * Raised when an operation needs at least one track point but the track is empty.
 *
 * @since 0.1.0
 */
public final class EmptyTrackException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message diagnostic message
   */
  public EmptyTrackException(String message) {
    super(message);
  }
}
