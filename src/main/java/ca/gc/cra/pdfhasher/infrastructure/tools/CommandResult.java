package ca.gc.cra.pdfhasher.infrastructure.tools;

/**
 * Captured outcome of one external command.
 *
 * @param exitCode process exit code; {@code -1} when the process timed out
 * @param stdout standard output decoded as UTF-8
 * @param stderr standard error decoded as UTF-8
 * @param timedOut {@code true} if the process was killed after the timeout
 * @since 0.1.0
 */
public record CommandResult(int exitCode, String stdout, String stderr, boolean timedOut) {
  /**
   * Indicates a normal zero exit.
   *
   * @return {@code true} when the command succeeded
   */
  public boolean succeeded() {
    return !timedOut && exitCode == 0;
  }
}
