package ca.gc.cra.pdfhasher.config;

import ca.gc.cra.pdfhasher.infrastructure.tools.ToolLocator;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * External tools resolved against the search path at startup.
 *
 * @param commands configured tool names
 * @param mutool resolved extractor
 * @param pdfsig resolved signature tool
 * @param exiftool resolved property reader
 * @param otfinfo resolved font information tool
 * @param fcScan resolved fontconfig scanner
 * @since 0.1.0
 */
public record ToolInventory(
    ToolCommands commands,
    Optional<Path> mutool,
    Optional<Path> pdfsig,
    Optional<Path> exiftool,
    Optional<Path> otfinfo,
    Optional<Path> fcScan) {
  public ToolInventory {
    Objects.requireNonNull(commands, "commands");
    Objects.requireNonNull(mutool, "mutool");
    Objects.requireNonNull(pdfsig, "pdfsig");
    Objects.requireNonNull(exiftool, "exiftool");
    Objects.requireNonNull(otfinfo, "otfinfo");
    Objects.requireNonNull(fcScan, "fcScan");
  }

  /**
   * Resolves every configured tool.
   *
   * @param commands configured names or paths
   * @param locator search-path resolver
   * @return inventory of what is installed
   */
  public static ToolInventory resolve(ToolCommands commands, ToolLocator locator) {
    return new ToolInventory(
        commands,
        locator.locate(commands.mutool()),
        locator.locate(commands.pdfsig()),
        locator.locate(commands.exiftool()),
        locator.locate(commands.otfinfo()),
        locator.locate(commands.fcScan()));
  }

  /** Returns the configured names of optional tools that were not found. */
  public List<String> missingOptional() {
    List<String> missing = new ArrayList<>();
    for (Map.Entry<String, Optional<Path>> entry : optional().entrySet()) {
      if (entry.getValue().isEmpty()) {
        missing.add(entry.getKey());
      }
    }
    return List.copyOf(missing);
  }

  /**
   * Describes each tool as {@code name -> path} or {@code name -> (not found)}.
   *
   * @return display lines, mandatory extractor first
   */
  public List<String> describe() {
    Map<String, Optional<Path>> all = new LinkedHashMap<>();
    all.put(commands.mutool(), mutool);
    all.putAll(optional());
    List<String> lines = new ArrayList<>();
    all.forEach((name, path) ->
        lines.add(name + " -> " + path.map(Path::toString).orElse("(not found)")));
    return List.copyOf(lines);
  }

  private Map<String, Optional<Path>> optional() {
    Map<String, Optional<Path>> map = new LinkedHashMap<>();
    map.put(commands.pdfsig(), pdfsig);
    map.put(commands.exiftool(), exiftool);
    map.put(commands.otfinfo(), otfinfo);
    map.put(commands.fcScan(), fcScan);
    return map;
  }
}
