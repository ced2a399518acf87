package partitions.recurrence;

public enum NodeKind {
  /** S(n,n) = 1 or S(n,0) = 0 for n &gt; 0; value known when the node is built. */
  BASE,
  /** Two children, value known once both are resolved. */
  RECURSIVE
}
