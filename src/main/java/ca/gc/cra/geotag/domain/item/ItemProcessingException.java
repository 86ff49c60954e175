package ca.gc.cra.geotag.domain.item;

/**
 * Per-item data fault: a missing or malformed field that prevents one photo from being processed.
 *
 * <p>Stages drop the affected item and continue with the next one.</p>
 *
 * @since 0.1.0
 */
public final class ItemProcessingException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String identity;

  /**
   * Creates the exception.
   *
   * @param identity item identity the fault belongs to
   * @param message diagnostic message
   */
  public ItemProcessingException(String identity, String message) {
    super(message);
    this.identity = identity;
  }

  /**
   * Creates the exception with a cause.
   *
   * @param identity item identity the fault belongs to
   * @param message diagnostic message
   * @param cause underlying failure
   */
  public ItemProcessingException(String identity, String message, Throwable cause) {
    super(message, cause);
    this.identity = identity;
  }

  public String identity() {
    return identity;
  }
}
