package ca.gc.cra.pdfhasher.infrastructure.tools;

/** Picks the first line of tool output. */
final class FirstLine {
  private FirstLine() {}

  static String of(String output) {
    if (output == null || output.isEmpty()) {
      return "";
    }
    int end = 0;
    while (end < output.length() && output.charAt(end) != '\n' && output.charAt(end) != '\r') {
      end++;
    }
    return output.substring(0, end).strip();
  }

  static String afterLabel(String output, String label) {
    if (output == null) {
      return "";
    }
    for (String line : output.split("\\R")) {
      if (line.startsWith(label)) {
        return line.substring(label.length()).strip();
      }
    }
    return "";
  }
}
