package ca.gc.cra.flapline.api;

/**
 * <strong>What:</strong> Process exit codes returned by FLAPLINE commands.
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since FLAPLINE 0.1
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A configuration file could not be read. */
  IO_ERROR(3),
  /** Configuration was well-formed but inconsistent at run time. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure, including workers that could not be joined. */
  RUNTIME_FAILURE(5),
  /** The run was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric status handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
