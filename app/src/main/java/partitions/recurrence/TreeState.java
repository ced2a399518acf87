package partitions.recurrence;

/** Lifecycle of a built tree. Before {@code buildTree} there is no tree object at all. */
public enum TreeState {
  /** Structure exists; recursive nodes are still pending. */
  BUILT,
  /** Every node carries its value. */
  RESOLVED
}
