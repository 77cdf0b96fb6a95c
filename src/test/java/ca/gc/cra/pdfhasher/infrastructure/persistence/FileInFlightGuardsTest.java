package ca.gc.cra.pdfhasher.infrastructure.persistence;

import static ca.gc.cra.pdfhasher.testutil.Rows.sha;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pdfhasher.application.port.ClockPort;
import ca.gc.cra.pdfhasher.application.port.InFlightGuardPort.Guard;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class FileInFlightGuardsTest {
  @TempDir Path dir;

  @Test
  void secondAcquireFailsUntilReleased() throws IOException {
    FileInFlightGuards guards = new FileInFlightGuards(dir, Duration.ofMinutes(10), ClockPort.SYSTEM);

    Optional<Guard> first = guards.tryAcquire(sha('a'));
    assertTrue(first.isPresent());
    assertTrue(guards.isHeld(sha('a')));
    assertFalse(guards.tryAcquire(sha('a')).isPresent());
    assertFalse(guards.isHeld(sha('b')));

    first.get().close();
    first.get().close();

    assertFalse(guards.isHeld(sha('a')));
    try (Guard again = guards.tryAcquire(sha('a')).orElseThrow()) {
      assertEquals(sha('a'), again.sha256());
    }
  }

  @Test
  void staleGuardIsReclaimedWithWarning() throws IOException {
    new FileInFlightGuards(dir, Duration.ofMinutes(1), ClockPort.SYSTEM).tryAcquire(sha('c')).orElseThrow();
    ClockPort twoHoursLater = () -> System.currentTimeMillis() + Duration.ofHours(2).toMillis();
    FileInFlightGuards later = new FileInFlightGuards(dir, Duration.ofMinutes(1), twoHoursLater);

    Logger logger = (Logger) LoggerFactory.getLogger(FileInFlightGuards.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    Optional<Guard> reclaimed;
    try {
      assertFalse(later.isHeld(sha('c')));
      reclaimed = later.tryAcquire(sha('c'));
    } finally {
      logger.detachAppender(appender);
      appender.stop();
    }

    assertTrue(reclaimed.isPresent());
    assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.WARN
        && e.getFormattedMessage().contains("Reclaimed abandoned in-flight guard")));
    try (Stream<Path> files = Files.list(dir)) {
      assertEquals(1, files.count());
    }
    reclaimed.get().close();
  }

  @Test
  void guardOfDeadLocalProcessIsReclaimedImmediately() throws IOException {
    FileInFlightGuards guards = new FileInFlightGuards(dir, Duration.ZERO, ClockPort.SYSTEM);
    Files.writeString(dir.resolve(sha('e') + ".lock"),
        "2024-01-01T00:00:00Z\t" + Integer.MAX_VALUE + "@localhost\n", StandardCharsets.UTF_8);

    assertFalse(guards.isHeld(sha('e')));
    try (Guard reclaimed = guards.tryAcquire(sha('e')).orElseThrow()) {
      assertTrue(guards.isHeld(sha('e')));
      assertTrue(Files.readString(dir.resolve(sha('e') + ".lock"), StandardCharsets.UTF_8)
          .contains(ProcessHandle.current().pid() + "@"));
    }
  }

  @Test
  void guardOfRemoteHostOnlyAgesOut() throws IOException {
    Files.writeString(dir.resolve(sha('f') + ".lock"),
        "2024-01-01T00:00:00Z\t" + Integer.MAX_VALUE + "@other-host.invalid\n", StandardCharsets.UTF_8);

    assertTrue(new FileInFlightGuards(dir, Duration.ofMinutes(10), ClockPort.SYSTEM).isHeld(sha('f')));
    ClockPort twoHoursLater = () -> System.currentTimeMillis() + Duration.ofHours(2).toMillis();
    assertFalse(new FileInFlightGuards(dir, Duration.ofMinutes(10), twoHoursLater).isHeld(sha('f')));
  }

  @Test
  void zeroStalenessNeverReclaims() throws IOException {
    new FileInFlightGuards(dir, Duration.ZERO, ClockPort.SYSTEM).tryAcquire(sha('d')).orElseThrow();
    ClockPort farFuture = () -> System.currentTimeMillis() + Duration.ofDays(365).toMillis();
    FileInFlightGuards later = new FileInFlightGuards(dir, Duration.ZERO, farFuture);

    assertTrue(later.isHeld(sha('d')));
    assertFalse(later.tryAcquire(sha('d')).isPresent());
  }
}
