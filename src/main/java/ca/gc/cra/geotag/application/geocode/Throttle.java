package ca.gc.cra.geotag.application.geocode;

import ca.gc.cra.geotag.application.port.ClockPort;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paces outbound calls to at most {@code requestsPerHour} on average.
 *
 * <p>Before each call, {@link #acquire()} sleeps until at least {@code 3600 / requestsPerHour} seconds have
 * elapsed since the previous call. Over any window of {@code I} seconds at most
 * {@code floor(I / (3600 / R)) + 1} calls pass.</p>
 *
 * <p>Not thread-safe; owned by the geocode stage thread.</p>
 *
 * @since 0.1.0
 */
public final class Throttle {
  private static final Logger log = LoggerFactory.getLogger(Throttle.class);
  private static final long MILLIS_PER_HOUR = 3_600_000L;

  private final ClockPort clock;
  private final long intervalMillis;
  private long lastCallMillis;
  private boolean called;

  /**
   * Creates a throttle.
   *
   * @param requestsPerHour maximum average rate; {@code 0} disables pacing
   * @param clock time source
   */
  public Throttle(double requestsPerHour, ClockPort clock) {
    if (!(requestsPerHour >= 0d) || Double.isInfinite(requestsPerHour)) {
      throw new IllegalArgumentException("requestsPerHour must be a finite non-negative number");
    }
    this.clock = Objects.requireNonNull(clock, "clock");
    // rounded up so the pacing never runs faster than the configured rate
    this.intervalMillis = requestsPerHour == 0d ? 0L : (long) Math.ceil(MILLIS_PER_HOUR / requestsPerHour);
  }

  /**
   * Creates a throttle that never waits.
   *
   * @param clock time source
   * @return unthrottled instance
   */
  public static Throttle unlimited(ClockPort clock) {
    return new Throttle(0d, clock);
  }

  /**
   * Blocks until the next call is allowed, then records it.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void acquire() throws InterruptedException {
    if (intervalMillis > 0L && called) {
      long wait = lastCallMillis + intervalMillis - clock.nowMillis();
      if (wait > 0L) {
        log.debug("Throttling geocoder for {} ms", wait);
        clock.sleepMillis(wait);
      }
    }
    lastCallMillis = clock.nowMillis();
    called = true;
  }

  public long intervalMillis() {
    return intervalMillis;
  }
}
