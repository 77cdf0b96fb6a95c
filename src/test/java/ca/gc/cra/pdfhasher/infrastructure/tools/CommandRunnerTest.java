package ca.gc.cra.pdfhasher.infrastructure.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CommandRunnerTest {
  @TempDir Path dir;

  @Test
  void capturesExitCodeAndBothStreams() throws Exception {
    Path tool = Scripts.write(dir, "tool", "echo out; echo err >&2; exit 3");

    CommandResult result = new CommandRunner(Duration.ofSeconds(30)).run(List.of(tool.toString()), null);

    assertEquals(3, result.exitCode());
    assertEquals("out\n", result.stdout());
    assertEquals("err\n", result.stderr());
    assertFalse(result.timedOut());
    assertFalse(result.succeeded());
  }

  @Test
  void runsInWorkingDirectory() throws Exception {
    Path tool = Scripts.write(dir, "where", "pwd");
    Path work = dir.resolve("work");
    Files.createDirectories(work);

    CommandResult result = new CommandRunner(Duration.ofSeconds(30)).run(List.of(tool.toString()), work);

    assertTrue(result.succeeded());
    assertEquals(work.toRealPath().toString(), result.stdout().strip());
  }

  @Test
  void slowCommandIsKilled() throws Exception {
    Path tool = Scripts.write(dir, "slow", "sleep 30");

    CommandResult result = new CommandRunner(Duration.ofMillis(300)).run(List.of(tool.toString()), null);

    assertTrue(result.timedOut());
    assertFalse(result.succeeded());
  }

  @Test
  void missingExecutableRaisesIoException() {
    CommandRunner runner = new CommandRunner(Duration.ofSeconds(5));

    assertThrows(IOException.class,
        () -> runner.run(List.of(dir.resolve("absent").toString()), null));
  }

  @Test
  void timeoutMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new CommandRunner(Duration.ZERO));
  }
}
