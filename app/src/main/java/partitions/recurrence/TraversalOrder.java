package partitions.recurrence;

/** Reveal order of a construction trace. Children are always visited K_TIMES first. */
public enum TraversalOrder {
  /** Pre-order: each node, then its whole K_TIMES subtree, then its MINUS_ONE subtree. */
  DFS,
  /** Level by level from the root. */
  BFS
}
