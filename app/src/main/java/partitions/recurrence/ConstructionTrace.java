package partitions.recurrence;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, restartable sequence of reveal events over a built tree. Every {@link #iterator()} starts
 * again from the root and yields the same events in the same order.
 */
public final class ConstructionTrace implements Iterable<RevealEvent> {
  private final RecurrenceTree tree;
  private final TraversalOrder order;

  ConstructionTrace(RecurrenceTree tree, TraversalOrder order) {
    this.tree = Objects.requireNonNull(tree, "tree");
    this.order = Objects.requireNonNull(order, "order");
  }

  public RecurrenceTree tree() {
    return tree;
  }

  public TraversalOrder order() {
    return order;
  }

  /** One event per node. */
  public int size() {
    return tree.size();
  }

  @Override
  public Iterator<RevealEvent> iterator() {
    return new EventIterator();
  }

  public Stream<RevealEvent> stream() {
    return StreamSupport.stream(spliterator(), false);
  }

  public List<RevealEvent> toList() {
    return stream().toList();
  }

  private final class EventIterator implements Iterator<RevealEvent> {
    private final Deque<Integer> pending = new ArrayDeque<>();
    private int emitted;

    EventIterator() {
      pending.add(tree.root().id());
    }

    @Override
    public boolean hasNext() {
      return !pending.isEmpty();
    }

    @Override
    public RevealEvent next() {
      if (pending.isEmpty()) {
        throw new NoSuchElementException("Trace finished after " + emitted + " events");
      }
      RecurrenceNode node = tree.node(pending.poll());
      List<Integer> childIds = node.childIds();
      if (order == TraversalOrder.DFS) {
        // pushed in reverse so the K_TIMES child is popped first
        for (int i = childIds.size() - 1; i >= 0; i--) {
          pending.push(childIds.get(i));
        }
      } else {
        pending.addAll(childIds);
      }
      return new RevealEvent(emitted++, node, tree.incomingEdge(node).orElse(null));
    }
  }
}
