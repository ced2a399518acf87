package partitions.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Blocks of a set partition, ordered by label (the order in which the RGS opens them). */
public record SetPartition(List<Block> blocks) {

  public SetPartition {
    Objects.requireNonNull(blocks, "blocks");
    blocks = List.copyOf(blocks);
  }

  /** Groups positions by label; block {@code j} holds every position whose label is {@code j}. */
  public static SetPartition fromRgs(RestrictedGrowthString rgs) {
    Objects.requireNonNull(rgs, "rgs");
    List<List<Integer>> grouped = new ArrayList<>(rgs.blockCount());
    for (int i = 0; i < rgs.blockCount(); i++) {
      grouped.add(new ArrayList<>());
    }
    for (int position = 1; position <= rgs.length(); position++) {
      grouped.get(rgs.label(position)).add(position);
    }
    List<Block> blocks = new ArrayList<>(grouped.size());
    for (int label = 0; label < grouped.size(); label++) {
      blocks.add(new Block(label, grouped.get(label)));
    }
    return new SetPartition(blocks);
  }

  public int size() {
    return blocks.size();
  }

  public Block block(int label) {
    return blocks.get(label);
  }

  public List<Integer> blockSizes() {
    return blocks.stream().map(Block::size).toList();
  }

  /** Brace form, e.g. {@code { {1, 4}, {2, 3, 5}, {6} }}; the empty partition is {@code { }}. */
  public String format() {
    if (blocks.isEmpty()) {
      return "{ }";
    }
    return blocks.stream().map(Block::format).collect(Collectors.joining(", ", "{ ", " }"));
  }

  @Override
  public String toString() {
    return format();
  }
}
