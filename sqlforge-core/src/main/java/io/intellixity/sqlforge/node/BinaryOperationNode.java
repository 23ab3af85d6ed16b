package io.intellixity.sqlforge.node;

import java.util.Objects;

public record BinaryOperationNode(Node left, Operator operator, Node right) implements Node {
  public BinaryOperationNode {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(right, "right");
    if (!operator.isBinary()) throw new IllegalArgumentException("Not a binary operator: " + operator.sql());
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
