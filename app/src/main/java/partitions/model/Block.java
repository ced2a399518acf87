package partitions.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** One block of a set partition: its RGS label and its elements in ascending order (1-based). */
public record Block(int label, List<Integer> elements) {

  public Block {
    Objects.requireNonNull(elements, "elements");
    if (elements.isEmpty()) {
      throw new IllegalArgumentException("Block " + label + " has no elements");
    }
    elements = List.copyOf(elements);
  }

  public int size() {
    return elements.size();
  }

  public boolean contains(int element) {
    return elements.contains(element);
  }

  /** Brace form, e.g. {@code {2, 3, 5}}. */
  public String format() {
    return elements.stream().map(String::valueOf).collect(Collectors.joining(", ", "{", "}"));
  }
}
