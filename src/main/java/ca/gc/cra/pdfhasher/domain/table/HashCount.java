package ca.gc.cra.pdfhasher.domain.table;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One line of the hash-count projection.
 *
 * @param sha256 object content hash
 * @param count number of object rows carrying the hash
 * @since 0.1.0
 */
public record HashCount(String sha256, long count) {
  /** Count descending, then hash ascending. */
  public static final Comparator<HashCount> ORDER =
      Comparator.comparingLong(HashCount::count).reversed().thenComparing(HashCount::sha256);

  /**
   * Renders the projection line without its newline.
   *
   * @return {@code sha\tcount}
   */
  public String toTsvLine() {
    return sha256 + TsvFields.TAB + count;
  }

  /**
   * Builds the projection from object table data rows.
   *
   * <p>Rows with fewer than four fields or a blank hash column are ignored.</p>
   *
   * @param dataRows object table lines after the header
   * @return counts sorted by {@link #ORDER}
   */
  public static List<HashCount> project(Iterable<String> dataRows) {
    Map<String, Long> counts = new HashMap<>();
    for (String row : dataRows) {
      String[] fields = TsvFields.split(row);
      if (fields.length <= ObjectsSchema.HASH_COLUMN) {
        continue;
      }
      String sha = fields[ObjectsSchema.HASH_COLUMN];
      if (sha.isEmpty()) {
        continue;
      }
      counts.merge(sha, 1L, Long::sum);
    }
    List<HashCount> result = new ArrayList<>(counts.size());
    counts.forEach((sha, count) -> result.add(new HashCount(sha, count)));
    result.sort(ORDER);
    return result;
  }
}
