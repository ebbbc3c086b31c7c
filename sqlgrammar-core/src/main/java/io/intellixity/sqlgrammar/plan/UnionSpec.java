package io.intellixity.sqlgrammar.plan;

import java.util.Objects;

public record UnionSpec(QueryPlan query, boolean all) {
  public UnionSpec {
    Objects.requireNonNull(query, "query");
  }
}
