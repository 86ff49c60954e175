package ca.gc.cra.geotag.api;

/**
 * <strong>What:</strong> Process exit statuses returned by the {@code geotag} command.
 * <p><strong>Why:</strong> Lets scripts tell bad input apart from I/O trouble and user interrupts. Photos dropped
 * by a stage do not change the status; they are reported in the run summary.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Run completed, or help/plan output was printed. */
  SUCCESS(0),
  /** Command line could not be parsed. */
  INVALID_ARGS(2),
  /** An input could not be read or an output could not be created. */
  IO_ERROR(3),
  /** Merged configuration is missing a value or combines incompatible settings. */
  CONFIG_ERROR(4),
  /** Unexpected failure. */
  RUNTIME_FAILURE(5),
  /** Submission stopped early on SIGINT; queued photos were still drained. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric status handed to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
