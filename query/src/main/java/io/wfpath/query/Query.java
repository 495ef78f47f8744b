package io.wfpath.query;

import java.util.Objects;

/** An immutable visibility query: one root expression and its rendering. */
public final class Query {

  private final Expression root;

  public Query(Expression root) {
    this.root = Objects.requireNonNull(root, "root");
  }

  public Expression root() {
    return root;
  }

  /** Filter string accepted by the visibility store. */
  public String render() {
    return QueryRenderer.render(root);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Query q && q.root.equals(root);
  }

  @Override
  public int hashCode() {
    return root.hashCode();
  }

  @Override
  public String toString() {
    return render();
  }
}
