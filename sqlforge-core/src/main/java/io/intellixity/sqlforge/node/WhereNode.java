package io.intellixity.sqlforge.node;

import java.util.Objects;

public record WhereNode(Node where) implements Node {
  public WhereNode {
    Objects.requireNonNull(where, "where");
  }

  /**
   * Combine an existing (possibly absent) where with a new predicate. An existing top-level {@code or} is
   * parenthesized before {@code and} is applied, so the new predicate constrains every earlier branch.
   */
  public static WhereNode combine(WhereNode existing, Operator logical, Node predicate) {
    if (existing == null) return new WhereNode(predicate);
    Node left = existing.where();
    if (logical == Operator.AND && left instanceof BinaryOperationNode b && b.operator() == Operator.OR) {
      left = new ParensNode(left);
    }
    return new WhereNode(new BinaryOperationNode(left, logical, predicate));
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
