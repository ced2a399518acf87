package partitions.recurrence;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Arena holding the unshared recursion tree of S(n,k): nodes indexed by pre-order id, plus the
 * incoming edge of every non-root node. Built by {@link RecurrenceTreeBuilder}; the structure is
 * fixed after construction and only node values change, once, during resolution.
 */
public final class RecurrenceTree {
  private final List<RecurrenceNode> nodes;
  private final List<RecurrenceEdge> edges;
  private final RecurrenceEdge[] incoming;
  private TreeState state = TreeState.BUILT;

  RecurrenceTree(List<RecurrenceNode> nodes, List<RecurrenceEdge> edges) {
    this.nodes = List.copyOf(nodes);
    this.edges = List.copyOf(edges);
    this.incoming = new RecurrenceEdge[nodes.size()];
    for (RecurrenceEdge edge : edges) {
      incoming[edge.child().id()] = edge;
    }
  }

  public RecurrenceNode root() {
    return nodes.get(0);
  }

  public int n() {
    return root().n();
  }

  public int k() {
    return root().k();
  }

  public RecurrenceNode node(int id) {
    return nodes.get(id);
  }

  /** All nodes in pre-order. */
  public List<RecurrenceNode> nodes() {
    return nodes;
  }

  /** All edges, ordered by child id. */
  public List<RecurrenceEdge> edges() {
    return edges;
  }

  public int size() {
    return nodes.size();
  }

  public long recursiveCount() {
    return nodes.stream().filter(node -> !node.isBase()).count();
  }

  public long baseCount() {
    return nodes.stream().filter(RecurrenceNode::isBase).count();
  }

  public int height() {
    return nodes.stream().mapToInt(RecurrenceNode::depth).max().orElse(0);
  }

  public List<RecurrenceNode> children(RecurrenceNode node) {
    List<RecurrenceNode> children = new ArrayList<>(2);
    for (int childId : node.childIds()) {
      children.add(nodes.get(childId));
    }
    return Collections.unmodifiableList(children);
  }

  public Optional<RecurrenceEdge> incomingEdge(RecurrenceNode node) {
    return Optional.ofNullable(incoming[node.id()]);
  }

  public TreeState state() {
    return state;
  }

  /** Root value once resolved. */
  public Optional<BigInteger> value() {
    return root().value();
  }

  void markResolved() {
    state = TreeState.RESOLVED;
  }

  @Override
  public String toString() {
    return "RecurrenceTree{" + root().call() + ", " + size() + " nodes, " + state + "}";
  }
}
