package ca.gc.cra.pdfhasher.domain.signature;

import java.util.Arrays;
import java.util.List;

/**
 * Fixed-width view of up to {@value #MAX_BLOCKS} signature blocks.
 *
 * @since 0.1.0
 */
public final class SignatureReport {
  /** Number of signature column groups in the object table. */
  public static final int MAX_BLOCKS = 4;

  private static final SignatureReport EMPTY = new SignatureReport(new SignatureBlock[0]);

  private final List<SignatureBlock> blocks;

  SignatureReport(SignatureBlock[] source) {
    SignatureBlock[] filled = new SignatureBlock[MAX_BLOCKS];
    Arrays.fill(filled, SignatureBlock.empty());
    System.arraycopy(source, 0, filled, 0, Math.min(source.length, MAX_BLOCKS));
    for (int i = 0; i < filled.length; i++) {
      if (filled[i] == null) {
        filled[i] = SignatureBlock.empty();
      }
    }
    this.blocks = List.of(filled);
  }

  /**
   * Returns a report with every block blank.
   *
   * @return shared empty report
   */
  public static SignatureReport empty() {
    return EMPTY;
  }

  /**
   * Returns the block for a one-based signature index.
   *
   * @param index signature number in {@code 1..4}
   * @return block, blank when the report did not contain it
   * @throws IllegalArgumentException if {@code index} is outside {@code 1..4}
   */
  public SignatureBlock block(int index) {
    if (index < 1 || index > MAX_BLOCKS) {
      throw new IllegalArgumentException("signature index must be between 1 and " + MAX_BLOCKS);
    }
    return blocks.get(index - 1);
  }

  /**
   * Returns all four blocks in signature order.
   *
   * @return immutable list of exactly four blocks
   */
  public List<SignatureBlock> blocks() {
    return blocks;
  }

  /**
   * Indicates whether any field of any block is populated.
   *
   * @return {@code true} when at least one field is non-empty
   */
  public boolean hasSignatures() {
    for (SignatureBlock block : blocks) {
      if (!block.commonName().isEmpty() || !block.signingTime().isEmpty() || !block.byteRanges().isEmpty()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof SignatureReport other && blocks.equals(other.blocks);
  }

  @Override
  public int hashCode() {
    return blocks.hashCode();
  }

  @Override
  public String toString() {
    return "SignatureReport" + blocks;
  }
}
