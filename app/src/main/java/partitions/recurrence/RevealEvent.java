package partitions.recurrence;

import java.util.Objects;
import java.util.Optional;

/**
 * One step of a construction trace: the node revealed at {@code index} and the edge that
 * introduced it ({@code null} for the root).
 */
public record RevealEvent(int index, RecurrenceNode node, RecurrenceEdge edge) {

  public RevealEvent {
    Objects.requireNonNull(node, "node");
  }

  public Optional<RecurrenceEdge> incomingEdge() {
    return Optional.ofNullable(edge);
  }

  public boolean isRoot() {
    return edge == null;
  }
}
