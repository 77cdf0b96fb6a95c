package ca.gc.cra.pdfhasher.testutil;

import ca.gc.cra.pdfhasher.application.port.MetricsPort;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/** Thread-safe {@link MetricsPort} that remembers everything it receives. */
public final class RecordingMetricsPort implements MetricsPort {
  private final Map<String, Long> counters = new ConcurrentHashMap<>();
  private final Map<String, List<Long>> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.merge(key, 1L, Long::sum);
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(value);
  }

  public long counter(String key) {
    return counters.getOrDefault(key, 0L);
  }

  public List<Long> observations(String key) {
    return observations.getOrDefault(key, List.of());
  }
}
