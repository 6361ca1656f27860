package ca.gc.cra.warden.api;

import java.io.IOException;

/**
 * <strong>What:</strong> Process exit statuses returned by WARDEN commands.
 * <p><strong>Why:</strong> Lets schedulers and wrapper scripts tell bad input apart from unreadable logs or crashes.</p>
 * <p><strong>Role:</strong> Adapter-facing enum returned by CLI entry points.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Analysis completed and every requested report was written. */
  SUCCESS(0),
  /** Command-line arguments or YAML settings were invalid. */
  INVALID_ARGS(2),
  /** The index, a log file or a report destination could not be read or written. */
  IO_ERROR(3),
  /** Configuration was rejected while the pipeline was running. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }

  /**
   * Maps a failure raised by a running command onto an exit code.
   *
   * @param failure exception thrown by the pipeline
   * @return {@link #CONFIG_ERROR} for rejected arguments, {@link #IO_ERROR} for I/O failures,
   *     {@link #INTERRUPTED} for interruption and {@link #RUNTIME_FAILURE} otherwise
   */
  public static ExitCode forFailure(Throwable failure) {
    if (failure instanceof IllegalArgumentException) {
      return CONFIG_ERROR;
    }
    if (failure instanceof IOException) {
      return IO_ERROR;
    }
    if (failure instanceof InterruptedException) {
      return INTERRUPTED;
    }
    return RUNTIME_FAILURE;
  }
}
