package partitions.recurrence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import partitions.core.InvalidRequestException;
import partitions.core.StirlingNumbers;

final class RecurrenceTreeBuilderTest {
  private final RecurrenceTreeBuilder builder = new RecurrenceTreeBuilder();

  @Test
  void resolvesKnownValues() {
    assertEquals(BigInteger.valueOf(15), resolve(5, 2));
    assertEquals(BigInteger.valueOf(7), resolve(4, 2));
    assertEquals(BigInteger.ONE, resolve(0, 0));
    assertEquals(BigInteger.ZERO, resolve(3, 0));
    assertEquals(BigInteger.ONE, resolve(6, 6));
  }

  @Test
  void resolvedValuesMatchTheMemoizedNumbers() {
    StirlingNumbers numbers = new StirlingNumbers();
    for (int n = 0; n <= 9; n++) {
      for (int k = 0; k <= n; k++) {
        assertEquals(numbers.stirling(n, k), resolve(n, k), "S(" + n + "," + k + ")");
      }
    }
  }

  @Test
  void treeOfThreeTwoHasTwoRecursiveNodesAndThreeLeaves() {
    RecurrenceTree tree = builder.buildTree(3, 2);
    assertEquals(5, tree.size());
    assertEquals(2, tree.recursiveCount());
    assertEquals(3, tree.baseCount());
    assertEquals(2, tree.height());

    RecurrenceNode root = tree.root();
    assertEquals(NodeKind.RECURSIVE, root.kind());
    List<RecurrenceNode> children = tree.children(root);
    assertEquals("S(2,2)", children.get(0).call());
    assertEquals("S(2,1)", children.get(1).call());
    assertTrue(children.get(0).isBase());
    assertEquals(Term.K_TIMES, tree.incomingEdge(children.get(0)).orElseThrow().term());
    assertEquals(Term.MINUS_ONE, tree.incomingEdge(children.get(1)).orElseThrow().term());
    assertEquals(Optional.empty(), tree.incomingEdge(root));
    assertEquals(4, tree.edges().size());
  }

  @Test
  void repeatedCallsGetTheirOwnNodes() {
    RecurrenceTree tree = builder.buildTree(4, 2);
    assertEquals(11, tree.size());
    List<RecurrenceNode> twoOne =
        tree.nodes().stream().filter(node -> node.n() == 2 && node.k() == 1).toList();
    assertEquals(2, twoOne.size());
    assertNotSame(twoOne.get(0), twoOne.get(1));
    assertEquals(2, tree.children(twoOne.get(0)).size());
    assertEquals(2, tree.children(twoOne.get(1)).size());
  }

  @Test
  void baseNodesAreKnownAndRecursiveNodesPendingUntilResolved() {
    RecurrenceTree tree = builder.buildTree(4, 2);
    assertEquals(TreeState.BUILT, tree.state());
    assertFalse(tree.root().isResolved());
    assertEquals("S(4,2) = ?", tree.root().label());
    for (RecurrenceNode node : tree.nodes()) {
      assertEquals(node.isBase(), node.isResolved(), node.toString());
    }

    assertEquals(BigInteger.valueOf(7), builder.resolveValues(tree));
    assertEquals(TreeState.RESOLVED, tree.state());
    assertTrue(tree.nodes().stream().allMatch(RecurrenceNode::isResolved));
    assertEquals("S(4,2) = 7", tree.root().label());
    assertEquals(Optional.of(BigInteger.valueOf(7)), tree.value());
  }

  @Test
  void nodeIdsArePreOrderWithChildrenAfterParents() {
    RecurrenceTree tree = builder.buildTree(5, 3);
    for (int id = 0; id < tree.size(); id++) {
      RecurrenceNode node = tree.node(id);
      assertEquals(id, node.id());
      for (RecurrenceNode child : tree.children(node)) {
        assertTrue(child.id() > id);
        assertEquals(node.depth() + 1, child.depth());
        assertEquals(node.n() - 1, child.n());
      }
    }
  }

  @Test
  void nodeCountPredictsTheTreeSize() {
    for (int n = 0; n <= 9; n++) {
      for (int k = 0; k <= n; k++) {
        assertEquals(
            builder.buildTree(n, k).size(),
            RecurrenceTreeBuilder.nodeCount(n, k),
            "S(" + n + "," + k + ")");
      }
    }
  }

  @Test
  void rejectsPairsWithoutARecurrencePath() {
    assertThrows(InvalidRequestException.class, () -> builder.buildTree(2, 3));
    assertThrows(InvalidRequestException.class, () -> builder.buildTree(-1, 0));
    assertThrows(InvalidRequestException.class, () -> builder.buildTree(3, -1));
  }

  @Test
  void rejectsTreesAboveTheNodeLimit() {
    RecurrenceTreeBuilder small = new RecurrenceTreeBuilder(10);
    assertEquals(5, small.buildTree(3, 2).size());
    InvalidRequestException ex =
        assertThrows(InvalidRequestException.class, () -> small.buildTree(4, 2));
    assertTrue(ex.getMessage().contains("11 nodes"), ex.getMessage());
  }

  @Test
  void edgeLabelsNameTheTerm() {
    RecurrenceTree tree = builder.buildTree(3, 2);
    List<String> labels = tree.edges().stream().map(RecurrenceEdge::label).toList();
    assertEquals(List.of("2·S(2,2)", "S(2,1)", "1·S(1,1)", "S(1,0)"), labels);
  }

  private BigInteger resolve(int n, int k) {
    return builder.resolveValues(builder.buildTree(n, k));
  }
}
