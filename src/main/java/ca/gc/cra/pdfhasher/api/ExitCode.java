package ca.gc.cra.pdfhasher.api;

/**
 * Process exit codes of the ingest CLI.
 *
 * <p>{@link #SUCCESS} is returned even when individual documents failed; those are reported in the log and
 * retried on the next run.</p>
 */
public enum ExitCode {
  SUCCESS(0),
  INVALID_ARGS(2),
  IO_ERROR(3),
  CONFIG_ERROR(4),
  RUNTIME_FAILURE(5),
  /** The mandatory extractor is not installed. */
  TOOL_UNAVAILABLE(6),
  /** The ledger or a table could not be trusted. */
  DATA_CORRUPTION(7),
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /** Returns the numeric process exit status. */
  public int code() {
    return code;
  }
}
