package io.intellixity.sqlforge.node;

import java.util.Objects;

public record UnaryOperationNode(Operator operator, Node operand) implements Node {
  public UnaryOperationNode {
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(operand, "operand");
    if (!operator.isUnary()) throw new IllegalArgumentException("Not a unary operator: " + operator.sql());
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
