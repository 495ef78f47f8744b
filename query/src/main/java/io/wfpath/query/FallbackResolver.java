package io.wfpath.query;

import io.wfpath.query.Expression.Comparison;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries an empty {@code WorkflowType = 'X'} count as {@code WorkflowId STARTS_WITH 'X'}.
 *
 * <p>Only a query that consists of exactly that one comparison is rewritten, and at most once.
 */
public final class FallbackResolver {

  private static final Logger LOG = LoggerFactory.getLogger(FallbackResolver.class);

  public enum State {
    PRIMARY,
    FALLBACK_BY_ID
  }

  /**
   * Outcome of a resolution.
   *
   * @param state which query produced {@link #count()}
   * @param query rendering of the query that produced {@link #count()}
   * @param count matching executions
   * @param attempted every query counted, in order
   */
  public record Resolution(State state, String query, long count, List<String> attempted) {
    public Resolution {
      attempted = List.copyOf(attempted);
    }

    public boolean found() {
      return count > 0;
    }

    public boolean fallbackUsed() {
      return state == State.FALLBACK_BY_ID;
    }

    public Map<String, Object> toMap() {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("query", query);
      map.put("count", count);
      map.put("state", state.name());
      map.put("fallbackUsed", fallbackUsed());
      map.put("attemptedQueries", attempted);
      if (!found()) {
        map.put("message", "No workflows matched " + String.join(" or ", attempted));
      }
      return map;
    }
  }

  private final CountFunction counter;
  private final TypeRegistry registry;

  public FallbackResolver(CountFunction counter, TypeRegistry registry) {
    this.counter = counter;
    this.registry = registry;
  }

  /**
   * Counts a raw filter string. Strings that parse get the same treatment as {@link
   * #resolve(Query)}; strings that do not parse are counted as given, without fallback.
   */
  public Resolution resolve(String query) throws Exception {
    Query parsed;
    try {
      parsed = QueryParser.parse(query, registry);
    } catch (QueryException e) {
      LOG.debug("Query not parseable, counting as given: {}", e.getMessage());
      long count = counter.count(query);
      return new Resolution(State.PRIMARY, query, count, List.of(query));
    }
    return resolve(parsed);
  }

  public Resolution resolve(Query query) throws Exception {
    String primary = query.render();
    List<String> attempted = new ArrayList<>(2);
    attempted.add(primary);
    long count = counter.count(primary);
    if (count > 0 || !eligible(query)) {
      return new Resolution(State.PRIMARY, primary, count, attempted);
    }

    Comparison c = (Comparison) query.root();
    Query fallback =
        new Query(
            Comparisons.make(registry.describe("WorkflowId"), Operator.STARTS_WITH, c.operand()));
    String rendered = fallback.render();
    attempted.add(rendered);
    long fallbackCount = counter.count(rendered);
    LOG.debug("Fallback {} -> {} matched {}", primary, rendered, fallbackCount);
    if (fallbackCount > 0) {
      return new Resolution(State.FALLBACK_BY_ID, rendered, fallbackCount, attempted);
    }
    return new Resolution(State.PRIMARY, primary, 0, attempted);
  }

  /** Whether the query is exactly {@code WorkflowType = '<literal>'}. */
  public static boolean eligible(Query query) {
    return query.root() instanceof Comparison c
        && c.field().name().equals("WorkflowType")
        && !c.field().custom()
        && c.operator() == Operator.EQ;
  }
}
