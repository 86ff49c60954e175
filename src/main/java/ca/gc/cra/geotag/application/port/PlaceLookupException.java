package ca.gc.cra.geotag.application.port;

/**
 * External place-lookup fault: network failure, error status, or malformed response.
 *
 * @since 0.1.0
 */
public class PlaceLookupException extends Exception {
  private static final long serialVersionUID = 1L;

  public PlaceLookupException(String message) {
    super(message);
  }

  public PlaceLookupException(String message, Throwable cause) {
    super(message, cause);
  }
}
