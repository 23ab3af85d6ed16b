package io.intellixity.sqlforge.node;

import java.util.Objects;

/** Column, optionally qualified by a table name ({@code table} may be null). */
public record ColumnReferenceNode(String table, String column) implements Node {
  public ColumnReferenceNode {
    Objects.requireNonNull(column, "column");
    if (column.isBlank()) throw new IllegalArgumentException("column must not be blank");
    if (table != null && table.isBlank()) table = null;
  }

  public static ColumnReferenceNode of(String column) {
    return new ColumnReferenceNode(null, column);
  }

  public boolean isQualified() {
    return table != null;
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
