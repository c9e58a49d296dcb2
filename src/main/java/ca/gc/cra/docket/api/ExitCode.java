package ca.gc.cra.docket.api;

/**
 * Process exit codes returned by the docket CLI.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  SUCCESS(0),
  INVALID_ARGS(2),
  IO_ERROR(3),
  CONFIG_ERROR(4),
  RUNTIME_FAILURE(5),
  /** A collection listed in {@code requiredCollections} had no usable route. */
  EXPORT_ABORTED(6),
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
