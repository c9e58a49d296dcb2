package ca.gc.cra.docket.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures runtime logging for the export CLI.
 * <p><strong>Why:</strong> Lets operators see per-page and per-strategy diagnostics while chasing an upstream
 * contract change without editing {@code logback.xml}.
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Only the {@code ca.gc.cra.docket} hierarchy is raised; the JDK HTTP client and OpenTelemetry keep the
 * levels from {@code logback.xml}. Other SLF4J bindings log a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  static final String DOCKET_LOGGER = "ca.gc.cra.docket";
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises docket loggers to DEBUG within the running JVM.
   *
   * @return {@code true} when the level changed, {@code false} when it was already DEBUG or the backend is not
   *     Logback
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
          factory.getClass().getName());
      return false;
    }
    Logger docket = context.getLogger(DOCKET_LOGGER);
    if (Level.DEBUG.equals(docket.getLevel())) {
      return false;
    }
    docket.setLevel(Level.DEBUG);
    log.debug("DEBUG enabled for {}", DOCKET_LOGGER);
    return true;
  }
}
