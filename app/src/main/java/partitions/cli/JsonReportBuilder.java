package partitions.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import partitions.enumeration.PartitionRequest;
import partitions.enumeration.PartitionSummary;
import partitions.model.Block;
import partitions.model.RestrictedGrowthString;
import partitions.model.SetPartition;
import partitions.recurrence.RecurrenceEdge;
import partitions.recurrence.RecurrenceNode;
import partitions.recurrence.RecurrenceTree;
import partitions.recurrence.RevealEvent;
import partitions.recurrence.TraceStepper;

/** JSON documents for {@code --format json}, the shape a rendering front end consumes. */
final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

  String enumeration(PartitionRequest request, BigInteger total, List<PartitionSummary> visited) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta());
    root.put("request", request(request));
    root.put("total", total);
    List<Map<String, Object>> partitions = new ArrayList<>(visited.size());
    for (PartitionSummary summary : visited) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("index", summary.ordinal());
      map.put("rgs", summary.rgs().toList());
      map.put("block_count", summary.blockCount());
      map.put("block_sizes", summary.blockSizes());
      map.put("blocks", blocks(summary.partition()));
      partitions.add(map);
    }
    root.put("partitions", partitions);
    return gson.toJson(root);
  }

  String decoded(
      RestrictedGrowthString rgs,
      SetPartition partition,
      BigInteger rankAmongAll,
      BigInteger rankAmongExact) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta());
    root.put("rgs", rgs.toList());
    root.put("block_count", partition.size());
    root.put("blocks", blocks(partition));
    root.put("index_all", rankAmongAll.add(BigInteger.ONE));
    root.put("index_exact_k", rankAmongExact.add(BigInteger.ONE));
    return gson.toJson(root);
  }

  String tree(RecurrenceTree tree, TraceStepper stepper) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta());
    root.put("n", tree.n());
    root.put("k", tree.k());
    root.put("value", tree.value().orElse(null));
    root.put("state", tree.state().name());
    root.put("order", stepper.trace().order().name());
    root.put("node_count", tree.size());
    root.put("nodes", nodes(tree));
    List<Map<String, Object>> events = new ArrayList<>();
    for (RevealEvent event : stepper.revealed()) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("index", event.index());
      map.put("node", event.node().id());
      RecurrenceEdge edge = event.edge();
      map.put("parent", edge != null ? edge.parent().id() : null);
      map.put("term", edge != null ? edge.term().name() : null);
      map.put("label", edge != null ? edge.label() : null);
      events.add(map);
    }
    root.put("events", events);
    return gson.toJson(root);
  }

  private List<Map<String, Object>> nodes(RecurrenceTree tree) {
    List<Map<String, Object>> nodes = new ArrayList<>(tree.size());
    for (RecurrenceNode node : tree.nodes()) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("id", node.id());
      map.put("n", node.n());
      map.put("k", node.k());
      map.put("depth", node.depth());
      map.put("kind", node.kind().name());
      map.put("value", node.value().orElse(null));
      map.put("children", node.childIds());
      nodes.add(map);
    }
    return nodes;
  }

  private List<List<Integer>> blocks(SetPartition partition) {
    return partition.blocks().stream().map(Block::elements).toList();
  }

  private Map<String, Object> request(PartitionRequest request) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("n", request.n());
    map.put("mode", request.mode().name());
    map.put("k", request.mode().usesBlockCount() ? request.k() : null);
    return map;
  }

  private Map<String, Object> meta() {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    return meta;
  }
}
