package io.wfpath.query;

/** Decides how many executions a list request should fetch, given a prior count. */
public final class ScopeAdvisor {

  private ScopeAdvisor() {}

  public enum Strategy {
    /** Nothing matched; skip the list request. */
    EMPTY,
    /** Every match fits in one page. */
    FULL,
    /** More matches than the cap; fetch a capped sample. */
    SAMPLED
  }

  public record Scope(int limit, Strategy strategy) {}

  /**
   * @param count executions matching the query
   * @param maxLimit largest list size the caller accepts
   * @return limit and strategy for the list request
   * @throws IllegalArgumentException if {@code maxLimit <= 0} or {@code count < 0}
   */
  public static Scope decide(long count, int maxLimit) {
    if (maxLimit <= 0) {
      throw new IllegalArgumentException("maxLimit must be positive: " + maxLimit);
    }
    if (count < 0) {
      throw new IllegalArgumentException("count must not be negative: " + count);
    }
    if (count == 0) {
      return new Scope(0, Strategy.EMPTY);
    }
    if (count <= maxLimit) {
      return new Scope((int) count, Strategy.FULL);
    }
    return new Scope(maxLimit, Strategy.SAMPLED);
  }
}
