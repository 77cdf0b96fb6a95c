package ca.gc.cra.pdfhasher.config;

import ca.gc.cra.pdfhasher.validation.Strings;
import java.util.Map;

/**
 * Configured names or paths of the external tools.
 *
 * @param mutool object extractor; mandatory
 * @param pdfsig signature report tool
 * @param exiftool document property reader
 * @param otfinfo font information tool
 * @param fcScan fontconfig scanner used when {@code otfinfo} yields nothing
 * @since 0.1.0
 */
public record ToolCommands(String mutool, String pdfsig, String exiftool, String otfinfo, String fcScan) {
  public ToolCommands {
    mutool = Strings.requireNonBlank("tools.mutool", mutool);
    pdfsig = Strings.requireNonBlank("tools.pdfsig", pdfsig);
    exiftool = Strings.requireNonBlank("tools.exiftool", exiftool);
    otfinfo = Strings.requireNonBlank("tools.otfinfo", otfinfo);
    fcScan = Strings.requireNonBlank("tools.fcScan", fcScan);
  }

  static ToolCommands fromMap(Map<String, String> args) {
    return new ToolCommands(
        args.getOrDefault("tools.mutool", "mutool"),
        args.getOrDefault("tools.pdfsig", "pdfsig"),
        args.getOrDefault("tools.exiftool", "exiftool"),
        args.getOrDefault("tools.otfinfo", "otfinfo"),
        args.getOrDefault("tools.fcScan", "fc-scan"));
  }
}
