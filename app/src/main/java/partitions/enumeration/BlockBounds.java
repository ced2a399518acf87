package partitions.enumeration;

/**
 * Inclusive range of block counts an enumeration admits.
 *
 * <p>This is the only thing the successor and predecessor steps know about a {@link Mode}: a new
 * mode is added by mapping its request onto a range, without touching the stepping code.
 */
public record BlockBounds(int min, int max) {

  public BlockBounds {
    if (min < 0 || max < min) {
      throw new IllegalArgumentException("Invalid block bounds [" + min + ", " + max + "]");
    }
  }

  public static BlockBounds exactly(int blocks) {
    return new BlockBounds(blocks, blocks);
  }

  public boolean admits(int blocks) {
    return blocks >= min && blocks <= max;
  }
}
