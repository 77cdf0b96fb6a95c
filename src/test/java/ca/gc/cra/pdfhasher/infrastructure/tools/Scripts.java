package ca.gc.cra.pdfhasher.infrastructure.tools;

import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/** Writes small POSIX shell scripts standing in for external tools. */
final class Scripts {
  private Scripts() {}

  static Path write(Path dir, String name, String body) throws IOException {
    assumeTrue(!System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows"),
        "shell scripts need a POSIX system");
    assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "/bin/sh not available");
    Path script = Files.writeString(dir.resolve(name), "#!/bin/sh\n" + body + "\n");
    assumeTrue(script.toFile().setExecutable(true), "executable bit unsupported");
    return script;
  }
}
