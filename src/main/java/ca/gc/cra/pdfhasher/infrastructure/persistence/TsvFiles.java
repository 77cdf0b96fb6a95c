package ca.gc.cra.pdfhasher.infrastructure.persistence;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Line-level file primitives shared by the TSV adapters. Callers hold the relevant table lock.
 */
final class TsvFiles {
  private static final byte NEWLINE = '\n';

  private TsvFiles() {}

  static List<String> readLines(Path file) throws IOException {
    if (!Files.exists(file)) {
      return List.of();
    }
    try (BufferedReader reader = lenientReader(file)) {
      List<String> lines = new ArrayList<>();
      for (String line = reader.readLine(); line != null; line = reader.readLine()) {
        lines.add(line);
      }
      return lines;
    }
  }

  static String firstLine(Path file) throws IOException {
    if (!Files.exists(file) || Files.size(file) == 0) {
      return null;
    }
    try (BufferedReader reader = lenientReader(file)) {
      return reader.readLine();
    }
  }

  /**
   * Opens a UTF-8 reader that substitutes U+FFFD for malformed bytes, so rows written by older tools in
   * another encoding stay readable.
   */
  private static BufferedReader lenientReader(Path file) throws IOException {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPLACE)
        .onUnmappableCharacter(CodingErrorAction.REPLACE);
    return new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder));
  }

  static void createIfMissing(Path file) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    if (!Files.exists(file)) {
      Files.createFile(file);
    }
  }

  /**
   * Appends lines, first terminating a torn last line left by an interrupted writer.
   */
  static void appendLines(Path file, List<String> lines) throws IOException {
    if (lines.isEmpty()) {
      return;
    }
    StringBuilder sb = new StringBuilder(lines.size() * 128);
    for (String line : lines) {
      sb.append(line).append('\n');
    }
    byte[] bytes = sb.toString().getBytes(StandardCharsets.UTF_8);
    try (FileChannel channel = FileChannel.open(
        file, StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
      long size = channel.size();
      if (size > 0 && lastByte(channel, size) != NEWLINE) {
        writeFully(channel, ByteBuffer.wrap(new byte[] {NEWLINE}), size);
        size++;
      }
      writeFully(channel, ByteBuffer.wrap(bytes), size);
      channel.force(false);
    }
  }

  /**
   * Replaces {@code target} with {@code lines} through a hidden temp file in the same directory.
   */
  static void replaceAtomically(Path target, List<String> lines) throws IOException {
    Path absolute = target.toAbsolutePath();
    Path dir = absolute.getParent();
    Files.createDirectories(dir);
    Path temp = Files.createTempFile(dir, "." + absolute.getFileName() + ".", ".tmp");
    try {
      StringBuilder sb = new StringBuilder();
      for (String line : lines) {
        sb.append(line).append('\n');
      }
      Files.writeString(temp, sb.toString(), StandardCharsets.UTF_8);
      moveReplacing(temp, absolute);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  static void moveReplacing(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static byte lastByte(FileChannel channel, long size) throws IOException {
    ByteBuffer one = ByteBuffer.allocate(1);
    channel.read(one, size - 1);
    return one.get(0);
  }

  private static void writeFully(FileChannel channel, ByteBuffer buffer, long position)
      throws IOException {
    long pos = position;
    while (buffer.hasRemaining()) {
      pos += channel.write(buffer, pos);
    }
  }
}
