package io.intellixity.sqlforge.node;

import java.util.Objects;

/** {@code column = value} assignment. */
public record ColumnUpdateNode(ColumnReferenceNode column, Node value) implements Node {
  public ColumnUpdateNode {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(value, "value");
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
