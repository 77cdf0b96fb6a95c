package ca.gc.cra.pdfhasher.application.port;

/**
 * <strong>What:</strong> Port abstracting ingest metrics emission.
 * <p><strong>Why:</strong> Lets the coordinator count outcomes and record latencies without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from coordinator workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code ingest.document.ledgered},
 * {@code ingest.document.latencyMillis}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code ingest.dedup.stored}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; unit defined by the key
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
