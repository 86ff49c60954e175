package ca.gc.cra.geotag.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time and blocking waits.
 * <p><strong>Why:</strong> The geocoder throttle paces outbound calls; tests substitute a virtual clock so pacing
 * can be verified without sleeping.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()} and {@link Thread#sleep(long)}.
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Blocks the calling thread for at least {@code millis}.
   *
   * @param millis duration to wait; non-positive values return immediately
   * @throws InterruptedException if the thread is interrupted while waiting
   */
  default void sleepMillis(long millis) throws InterruptedException {
    if (millis > 0L) {
      Thread.sleep(millis);
    }
  }

  /**
   * Default {@link ClockPort} using the JVM clock.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
