package ca.gc.cra.pdfhasher.infrastructure.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class FirstLineTest {
  @Test
  void firstLineIsStripped() {
    assertEquals("Jane", FirstLine.of("  Jane \r\nsecond"));
    assertEquals("", FirstLine.of(""));
    assertEquals("", FirstLine.of(null));
  }

  @Test
  void labelledValueIsFound() {
    assertEquals("Fancy Bold", FirstLine.afterLabel("Family: Fancy\nFull name:   Fancy Bold\n", "Full name:"));
    assertEquals("", FirstLine.afterLabel("Family: Fancy\n", "Full name:"));
  }
}
