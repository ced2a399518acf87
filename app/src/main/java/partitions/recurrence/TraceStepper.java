package partitions.recurrence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Caller-driven playback of a {@link ConstructionTrace}. Each {@link #step()} reveals one more
 * node; {@link #reset()} rewinds without rebuilding the tree. Timing (autoplay) belongs to the
 * caller, which simply calls {@code step} at its own cadence.
 */
public final class TraceStepper {

  /** Playback position. */
  public enum State {
    TRACE_READY,
    STEPPING,
    DONE
  }

  private final ConstructionTrace trace;
  private final List<RevealEvent> revealed = new ArrayList<>();
  private final Set<Integer> revealedIds = new HashSet<>();
  private Iterator<RevealEvent> events;
  private State state;

  public TraceStepper(ConstructionTrace trace) {
    this.trace = Objects.requireNonNull(trace, "trace");
    reset();
  }

  /** The next event, or empty once every node has been revealed. */
  public Optional<RevealEvent> step() {
    if (!events.hasNext()) {
      state = State.DONE;
      return Optional.empty();
    }
    RevealEvent event = events.next();
    revealed.add(event);
    revealedIds.add(event.node().id());
    state = events.hasNext() ? State.STEPPING : State.DONE;
    return Optional.of(event);
  }

  public void reset() {
    events = trace.iterator();
    revealed.clear();
    revealedIds.clear();
    state = State.TRACE_READY;
  }

  /**
   * Rewinds and reveals the first {@code count} events; {@code count} is clamped to {@code [0,
   * size()]}. Returns the number of revealed events.
   */
  public int seek(int count) {
    int target = Math.max(0, Math.min(count, trace.size()));
    reset();
    for (int i = 0; i < target; i++) {
      step();
    }
    return revealed.size();
  }

  public State state() {
    return state;
  }

  public ConstructionTrace trace() {
    return trace;
  }

  public List<RevealEvent> revealed() {
    return Collections.unmodifiableList(revealed);
  }

  public int revealedCount() {
    return revealed.size();
  }

  public int remaining() {
    return trace.size() - revealed.size();
  }

  public Optional<RevealEvent> latest() {
    return revealed.isEmpty() ? Optional.empty() : Optional.of(revealed.get(revealed.size() - 1));
  }

  public boolean isRevealed(RecurrenceNode node) {
    return revealedIds.contains(node.id());
  }

  /** Edges whose parent and child are both revealed. */
  public List<RecurrenceEdge> visibleEdges() {
    List<RecurrenceEdge> visible = new ArrayList<>();
    for (RevealEvent event : revealed) {
      RecurrenceEdge edge = event.edge();
      if (edge != null && revealedIds.contains(edge.parent().id())) {
        visible.add(edge);
      }
    }
    return visible;
  }
}
