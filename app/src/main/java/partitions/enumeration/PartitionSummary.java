package partitions.enumeration;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import partitions.model.RestrictedGrowthString;
import partitions.model.SetPartition;

/** Display data for one cursor position: "partition i of N" plus its blocks. */
public record PartitionSummary(
    PartitionRequest request,
    BigInteger index,
    BigInteger total,
    RestrictedGrowthString rgs,
    SetPartition partition) {

  public PartitionSummary {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(index, "index");
    Objects.requireNonNull(total, "total");
    Objects.requireNonNull(rgs, "rgs");
    Objects.requireNonNull(partition, "partition");
  }

  /** One-based index for display. */
  public BigInteger ordinal() {
    return index.add(BigInteger.ONE);
  }

  public int blockCount() {
    return partition.size();
  }

  public List<Integer> blockSizes() {
    return partition.blockSizes();
  }

  public boolean isFirst() {
    return index.signum() == 0;
  }

  public boolean isLast() {
    return ordinal().equals(total);
  }
}
