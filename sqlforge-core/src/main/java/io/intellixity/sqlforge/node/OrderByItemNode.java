package io.intellixity.sqlforge.node;

import java.util.Objects;

public record OrderByItemNode(Node orderBy, Direction direction) implements Node {
  public enum Direction { ASC, DESC }

  public OrderByItemNode {
    Objects.requireNonNull(orderBy, "orderBy");
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
