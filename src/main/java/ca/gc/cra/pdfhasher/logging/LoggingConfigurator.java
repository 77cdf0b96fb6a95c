package ca.gc.cra.pdfhasher.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runtime log level switch behind the {@code --verbose} flag.
 * <p><strong>Scope:</strong> Raises the application loggers and the root logger to DEBUG. Loggers with an explicit
 * level in {@code logback.xml} (PDFBox, OpenTelemetry) keep it, so verbose runs stay readable.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  /** Parent logger of every application class. */
  public static final String APPLICATION_LOGGER = "ca.gc.cra.pdfhasher";

  private LoggingConfigurator() {}

  /**
   * Switches application and root logging to DEBUG.
   *
   * @return {@code false} when the SLF4J backend is not Logback and nothing changed
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("--verbose ignored: logging backend {} does not support level changes",
          factory.getClass().getName());
      return false;
    }
    context.getLogger(APPLICATION_LOGGER).setLevel(Level.DEBUG);
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    if (!root.isDebugEnabled()) {
      root.setLevel(Level.DEBUG);
    }
    return true;
  }
}
