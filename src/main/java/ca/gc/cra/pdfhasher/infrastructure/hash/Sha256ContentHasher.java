package ca.gc.cra.pdfhasher.infrastructure.hash;

import ca.gc.cra.pdfhasher.application.port.ContentHasher;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 implementation of {@link ContentHasher} using the JDK message digest.
 *
 * <p>Stateless; a new digest is created per call.</p>
 *
 * @since 0.1.0
 */
public final class Sha256ContentHasher implements ContentHasher {
  private static final int BUFFER_SIZE = 64 * 1024;
  private static final HexFormat HEX = HexFormat.of();

  @Override
  public String hash(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return hash(in);
    }
  }

  @Override
  public String hash(InputStream in) throws IOException {
    MessageDigest digest = newDigest();
    byte[] buffer = new byte[BUFFER_SIZE];
    int read;
    while ((read = in.read(buffer)) != -1) {
      digest.update(buffer, 0, read);
    }
    return HEX.formatHex(digest.digest());
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available in this JVM", ex);
    }
  }
}
