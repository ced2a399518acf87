package partitions.recurrence;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One call S(n,k) in the recursion tree. Nodes are never shared: a pair that recurs at several
 * call sites appears as several nodes.
 *
 * <p>{@link #id()} is the node's pre-order index in its tree, so the root is 0 and every child has
 * a larger id than its parent.
 */
public final class RecurrenceNode {
  private final int id;
  private final int n;
  private final int k;
  private final int depth;
  private final NodeKind kind;
  private final List<Integer> childIds = new ArrayList<>(2);
  private BigInteger value;

  RecurrenceNode(int id, int n, int k, int depth, NodeKind kind) {
    this.id = id;
    this.n = n;
    this.k = k;
    this.depth = depth;
    this.kind = kind;
    if (kind == NodeKind.BASE) {
      value = n == k ? BigInteger.ONE : BigInteger.ZERO;
    }
  }

  public int id() {
    return id;
  }

  public int n() {
    return n;
  }

  public int k() {
    return k;
  }

  public int depth() {
    return depth;
  }

  public NodeKind kind() {
    return kind;
  }

  public boolean isBase() {
    return kind == NodeKind.BASE;
  }

  /** Empty while the node is pending. */
  public Optional<BigInteger> value() {
    return Optional.ofNullable(value);
  }

  public boolean isResolved() {
    return value != null;
  }

  /** Ids of the K_TIMES and MINUS_ONE children, in that order; empty for base nodes. */
  public List<Integer> childIds() {
    return Collections.unmodifiableList(childIds);
  }

  /** {@code S(3,2)}. */
  public String call() {
    return "S(" + n + "," + k + ")";
  }

  /** {@code S(3,2) = 3}, or {@code S(3,2) = ?} while pending. */
  public String label() {
    return call() + " = " + (value != null ? value : "?");
  }

  void addChild(int childId) {
    childIds.add(childId);
  }

  void resolve(BigInteger resolved) {
    value = resolved;
  }

  @Override
  public String toString() {
    return "#" + id + " " + label();
  }
}
