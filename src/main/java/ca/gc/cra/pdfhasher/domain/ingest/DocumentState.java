package ca.gc.cra.pdfhasher.domain.ingest;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * <strong>What:</strong> Lifecycle of one document observed by the coordinator.
 * <p><strong>Why:</strong> Makes the exactly-once protocol explicit: every scan of a document ends in exactly
 * one outcome state.</p>
 * <p><strong>Transitions:</strong> {@code UNSEEN -> QUIESCING -> (one of the SKIPPED_* states | EXTRACTING)},
 * {@code EXTRACTING -> ROWS_EMITTED -> STAMPED -> LEDGERED}, and {@code EXTRACTING|ROWS_EMITTED -> FAILED}.
 * {@link #FAILED} is an outcome of one scan but not final: the document is retried next scan.</p>
 *
 * @since 0.1.0
 */
public enum DocumentState {
  UNSEEN,
  QUIESCING,
  SKIPPED_VANISHED,
  SKIPPED_INFLIGHT,
  SKIPPED_PROCESSED,
  SKIPPED_STAMPED_RECONCILED,
  EXTRACTING,
  ROWS_EMITTED,
  STAMPED,
  LEDGERED,
  FAILED;

  private static final Map<DocumentState, Set<DocumentState>> NEXT = Map.of(
      UNSEEN, EnumSet.of(QUIESCING),
      QUIESCING, EnumSet.of(
          SKIPPED_VANISHED, SKIPPED_INFLIGHT, SKIPPED_PROCESSED, SKIPPED_STAMPED_RECONCILED, EXTRACTING),
      EXTRACTING, EnumSet.of(ROWS_EMITTED, FAILED),
      ROWS_EMITTED, EnumSet.of(STAMPED, FAILED),
      STAMPED, EnumSet.of(LEDGERED));

  /**
   * Indicates whether a scan of the document stops in this state.
   *
   * @return {@code true} for skips, {@link #LEDGERED} and {@link #FAILED}
   */
  public boolean isOutcome() {
    return !NEXT.containsKey(this);
  }

  /**
   * Indicates whether the document will never be processed again.
   *
   * @return {@code true} when the content is already recorded
   */
  public boolean isCompleted() {
    return this == LEDGERED || this == SKIPPED_PROCESSED || this == SKIPPED_STAMPED_RECONCILED;
  }

  /**
   * Checks whether {@code next} is a legal successor of this state.
   *
   * @param next candidate successor
   * @return {@code true} if the transition is allowed
   */
  public boolean canTransitionTo(DocumentState next) {
    Set<DocumentState> allowed = NEXT.get(this);
    return allowed != null && allowed.contains(next);
  }

  /**
   * Returns the metric key counting documents that ended in this state.
   *
   * @return key such as {@code ingest.document.ledgered}
   */
  public String metricKey() {
    return "ingest.document." + name().toLowerCase(Locale.ROOT);
  }
}
