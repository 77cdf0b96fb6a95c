package ca.gc.cra.pdfhasher.domain.table;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class HashCountTest {
  private static String row(String sha, String document) {
    return "\t\t\t" + sha + "\t" + document + "\tobj\t.png\t";
  }

  @Test
  void countsByHashOrderedByCountThenHash() {
    List<HashCount> counts = HashCount.project(List.of(
        row("bbb", "a.pdf"),
        row("aaa", "a.pdf"),
        row("bbb", "b.pdf"),
        row("ccc", "b.pdf"),
        row("aaa", "c.pdf")));

    assertEquals(
        List.of(new HashCount("aaa", 2), new HashCount("bbb", 2), new HashCount("ccc", 1)),
        counts);
  }

  @Test
  void skipsShortAndBlankHashRows() {
    List<HashCount> counts = HashCount.project(List.of("a\tb\tc", row("", "x.pdf"), row("ddd", "x.pdf"), ""));

    assertEquals(List.of(new HashCount("ddd", 1)), counts);
  }

  @Test
  void rendersTsvLine() {
    assertEquals("abc\t3", new HashCount("abc", 3).toTsvLine());
  }
}
