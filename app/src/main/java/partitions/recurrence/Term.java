package partitions.recurrence;

/** The two additive terms of S(n,k) = k·S(n-1,k) + S(n-1,k-1). Labels only; values ignore it. */
public enum Term {
  /** k·S(n-1,k): element n joins one of the k blocks of a partition of the rest. */
  K_TIMES,
  /** S(n-1,k-1): element n forms a block of its own. */
  MINUS_ONE;

  int childN(int n) {
    return n - 1;
  }

  int childK(int k) {
    return this == K_TIMES ? k : k - 1;
  }

  /** Edge label for a parent S(n,k), e.g. {@code 2·S(2,2)} or {@code S(2,1)}. */
  public String describe(int n, int k) {
    String call = "S(" + childN(n) + "," + childK(k) + ")";
    return this == K_TIMES ? k + "·" + call : call;
  }
}
