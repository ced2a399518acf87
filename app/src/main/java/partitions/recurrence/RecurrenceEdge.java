package partitions.recurrence;

import java.util.Objects;

/** Parent-to-child link labelled with the term the child stands for. */
public record RecurrenceEdge(RecurrenceNode parent, RecurrenceNode child, Term term) {

  public RecurrenceEdge {
    Objects.requireNonNull(parent, "parent");
    Objects.requireNonNull(child, "child");
    Objects.requireNonNull(term, "term");
  }

  /** {@code 2·S(2,2)} for a K_TIMES edge out of S(3,2). */
  public String label() {
    return term.describe(parent.n(), parent.k());
  }
}
