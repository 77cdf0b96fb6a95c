package ca.gc.cra.pdfhasher.domain.ingest;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate of the results produced by one pass over the input directory.
 *
 * @since 0.1.0
 */
public final class ScanSummary {
  private final EnumMap<DocumentState, Integer> counts = new EnumMap<>(DocumentState.class);
  private final int candidates;

  private ScanSummary(int candidates) {
    this.candidates = candidates;
  }

  /**
   * Builds a summary from per-document results.
   *
   * @param results results of one scan
   * @return summary
   */
  public static ScanSummary of(List<ProcessingResult> results) {
    ScanSummary summary = new ScanSummary(results.size());
    for (ProcessingResult result : results) {
      summary.counts.merge(result.state(), 1, Integer::sum);
    }
    return summary;
  }

  /** Number of documents the scan offered to the coordinator. */
  public int candidates() {
    return candidates;
  }

  /**
   * Returns how many documents ended in {@code state}.
   *
   * @param state outcome state
   * @return count, zero when none
   */
  public int count(DocumentState state) {
    return counts.getOrDefault(state, 0);
  }

  /** Number of documents that failed this scan and will be retried. */
  public int failed() {
    return count(DocumentState.FAILED);
  }

  /** Read-only view of the per-state counts. */
  public Map<DocumentState, Integer> counts() {
    return Map.copyOf(counts);
  }

  @Override
  public String toString() {
    return "ScanSummary{candidates=" + candidates + ", counts=" + counts + '}';
  }
}
