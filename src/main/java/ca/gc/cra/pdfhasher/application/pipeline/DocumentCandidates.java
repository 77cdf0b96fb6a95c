package ca.gc.cra.pdfhasher.application.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Selects the input files eligible for ingestion.
 *
 * @since 0.1.0
 */
public final class DocumentCandidates {
  private static final String SUFFIX = ".pdf";

  private DocumentCandidates() {}

  /**
   * Tests whether a file name looks like a PDF document (suffix compared case-insensitively).
   *
   * @param fileName bare file name
   * @return {@code true} for names ending in {@code .pdf} in any case
   */
  public static boolean isCandidateName(String fileName) {
    return fileName != null
        && !fileName.startsWith(".")
        && fileName.toLowerCase(Locale.ROOT).endsWith(SUFFIX)
        && fileName.length() > SUFFIX.length();
  }

  /**
   * Lists candidate documents directly inside {@code directory}, sorted by name.
   *
   * @param directory input directory
   * @return regular files with a PDF suffix; empty when the directory is missing
   * @throws IOException if the directory cannot be listed
   */
  public static List<Path> list(Path directory) throws IOException {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    try (Stream<Path> entries = Files.list(directory)) {
      return entries
          .filter(p -> isCandidateName(p.getFileName().toString()))
          .filter(Files::isRegularFile)
          .sorted(Comparator.comparing(p -> p.getFileName().toString()))
          .collect(Collectors.toList());
    }
  }
}
