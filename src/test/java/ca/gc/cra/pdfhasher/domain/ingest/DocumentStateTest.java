package ca.gc.cra.pdfhasher.domain.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class DocumentStateTest {
  @Test
  void happyPathTransitionsAreAllowed() {
    assertTrue(DocumentState.UNSEEN.canTransitionTo(DocumentState.QUIESCING));
    assertTrue(DocumentState.QUIESCING.canTransitionTo(DocumentState.EXTRACTING));
    assertTrue(DocumentState.EXTRACTING.canTransitionTo(DocumentState.ROWS_EMITTED));
    assertTrue(DocumentState.ROWS_EMITTED.canTransitionTo(DocumentState.STAMPED));
    assertTrue(DocumentState.STAMPED.canTransitionTo(DocumentState.LEDGERED));
  }

  @Test
  void stampedDocumentCannotFail() {
    assertFalse(DocumentState.STAMPED.canTransitionTo(DocumentState.FAILED));
    assertFalse(DocumentState.LEDGERED.canTransitionTo(DocumentState.EXTRACTING));
  }

  @Test
  void outcomesAndCompletion() {
    assertTrue(DocumentState.LEDGERED.isOutcome());
    assertTrue(DocumentState.SKIPPED_INFLIGHT.isOutcome());
    assertFalse(DocumentState.EXTRACTING.isOutcome());
    assertTrue(DocumentState.SKIPPED_STAMPED_RECONCILED.isCompleted());
    assertFalse(DocumentState.FAILED.isCompleted());
    assertFalse(DocumentState.SKIPPED_VANISHED.isCompleted());
  }

  @Test
  void metricKeyUsesLowerCaseName() {
    assertEquals("ingest.document.skipped_processed", DocumentState.SKIPPED_PROCESSED.metricKey());
  }

  @Test
  void resultRequiresOutcomeState() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ProcessingResult.of(Path.of("a.pdf"), DocumentState.EXTRACTING, null, ""));
  }

  @Test
  void summaryCountsPerState() {
    ScanSummary summary = ScanSummary.of(List.of(
        ProcessingResult.ledgered(Path.of("a.pdf"), "a", 3),
        ProcessingResult.of(Path.of("b.pdf"), DocumentState.FAILED, "b", "boom"),
        ProcessingResult.of(Path.of("c.pdf"), DocumentState.SKIPPED_PROCESSED, "a", "")));

    assertEquals(3, summary.candidates());
    assertEquals(1, summary.count(DocumentState.LEDGERED));
    assertEquals(1, summary.failed());
    assertEquals(0, summary.count(DocumentState.SKIPPED_INFLIGHT));
  }
}
