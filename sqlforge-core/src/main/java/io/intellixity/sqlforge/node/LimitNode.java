package io.intellixity.sqlforge.node;

import java.util.Objects;

public record LimitNode(Node limit) implements Node {
  public LimitNode {
    Objects.requireNonNull(limit, "limit");
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
