package partitions.recurrence;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import partitions.core.InvalidRequestException;

/**
 * Expands S(n,k) = k·S(n-1,k) + S(n-1,k-1) into its full, unshared recursion tree and evaluates
 * it bottom-up.
 *
 * <p>Requests must satisfy {@code 0 <= k <= n}: pairs with k &gt; n or negative arguments have no
 * recurrence path and are rejected instead of being read as zero-valued leaves. Construction and
 * evaluation both use explicit worklists, so deep trees do not grow the call stack.
 */
public final class RecurrenceTreeBuilder {
  private static final Logger LOG = LoggerFactory.getLogger(RecurrenceTreeBuilder.class);

  /** Default ceiling on tree size; the tree roughly doubles with every unit of n. */
  public static final long DEFAULT_MAX_NODES = 1_000_000L;

  private final long maxNodes;

  public RecurrenceTreeBuilder() {
    this(DEFAULT_MAX_NODES);
  }

  public RecurrenceTreeBuilder(long maxNodes) {
    if (maxNodes < 1) {
      throw new IllegalArgumentException("maxNodes must be positive");
    }
    this.maxNodes = maxNodes;
  }

  /** S(0,0), S(n,n) and S(n,0) terminate the recursion. */
  public static boolean isBase(int n, int k) {
    return k == 0 || k == n;
  }

  /**
   * Number of nodes {@link #buildTree} would create, without building anything. Saturates at
   * {@link Long#MAX_VALUE}.
   */
  public static long nodeCount(int n, int k) {
    validate(n, k);
    // sizes[j] holds the subtree size of S(i, j) for the row i being filled
    long[] sizes = new long[k + 1];
    for (int i = 0; i <= n; i++) {
      for (int j = Math.min(i, k); j >= 0; j--) {
        if (isBase(i, j)) {
          sizes[j] = 1;
        } else {
          sizes[j] = saturatedSum(1, saturatedSum(sizes[j], sizes[j - 1]));
        }
      }
    }
    return sizes[k];
  }

  /**
   * Builds the tree rooted at S(n,k). Nodes are numbered in pre-order and every recursive node
   * gets its K_TIMES child before its MINUS_ONE child.
   *
   * @throws InvalidRequestException if the pair is outside {@code 0 <= k <= n} or the tree would
   *     exceed the configured node limit
   */
  public RecurrenceTree buildTree(int n, int k) {
    long expected = nodeCount(n, k);
    if (expected > maxNodes) {
      throw InvalidRequestException.of(
          "Recursion tree of S(%d,%d) has %d nodes, limit is %d", n, k, expected, maxNodes);
    }

    List<RecurrenceNode> nodes = new ArrayList<>();
    List<RecurrenceEdge> edges = new ArrayList<>();
    Deque<PendingCall> stack = new ArrayDeque<>();
    stack.push(new PendingCall(n, k, 0, null, null));

    while (!stack.isEmpty()) {
      PendingCall call = stack.pop();
      NodeKind kind = isBase(call.n(), call.k()) ? NodeKind.BASE : NodeKind.RECURSIVE;
      RecurrenceNode node =
          new RecurrenceNode(nodes.size(), call.n(), call.k(), call.depth(), kind);
      nodes.add(node);
      if (call.parent() != null) {
        call.parent().addChild(node.id());
        edges.add(new RecurrenceEdge(call.parent(), node, call.term()));
      }
      if (kind == NodeKind.RECURSIVE) {
        stack.push(call.child(node, Term.MINUS_ONE));
        stack.push(call.child(node, Term.K_TIMES));
      }
    }

    LOG.debug(
        "Built recursion tree for S({},{}): {} nodes, {} edges", n, k, nodes.size(), edges.size());
    return new RecurrenceTree(nodes, edges);
  }

  /**
   * Fills in every pending node value bottom-up and returns the root value. Children always have
   * larger ids than their parents, so a descending id sweep is a valid post-order evaluation.
   * Resolving an already resolved tree recomputes the same values.
   */
  public BigInteger resolveValues(RecurrenceTree tree) {
    Objects.requireNonNull(tree, "tree");
    for (int id = tree.size() - 1; id >= 0; id--) {
      RecurrenceNode node = tree.node(id);
      if (node.isBase()) {
        continue;
      }
      List<Integer> children = node.childIds();
      BigInteger timesK = valueOf(tree.node(children.get(0)));
      BigInteger minusOne = valueOf(tree.node(children.get(1)));
      node.resolve(BigInteger.valueOf(node.k()).multiply(timesK).add(minusOne));
    }
    tree.markResolved();
    BigInteger value = valueOf(tree.root());
    LOG.debug("Resolved {} = {}", tree.root().call(), value);
    return value;
  }

  /** Reveal events over {@code tree}; cheap to call repeatedly. */
  public ConstructionTrace trace(RecurrenceTree tree, TraversalOrder order) {
    return new ConstructionTrace(tree, order);
  }

  private static BigInteger valueOf(RecurrenceNode node) {
    return node.value()
        .orElseThrow(() -> new IllegalStateException("Child " + node + " resolved out of order"));
  }

  private static void validate(int n, int k) {
    if (n < 0 || k < 0) {
      throw InvalidRequestException.of("S(n,k) needs non-negative arguments, got S(%d,%d)", n, k);
    }
    if (k > n) {
      throw InvalidRequestException.of("S(%d,%d) has k > n and no recurrence path", n, k);
    }
  }

  private static long saturatedSum(long a, long b) {
    long sum = a + b;
    return sum < 0 ? Long.MAX_VALUE : sum;
  }

  private record PendingCall(int n, int k, int depth, RecurrenceNode parent, Term term) {
    PendingCall child(RecurrenceNode node, Term childTerm) {
      return new PendingCall(childTerm.childN(n), childTerm.childK(k), depth + 1, node, childTerm);
    }
  }
}
