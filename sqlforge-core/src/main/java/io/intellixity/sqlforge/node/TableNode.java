package io.intellixity.sqlforge.node;

import java.util.Objects;

public record TableNode(String schema, String table) implements Node {
  public TableNode {
    Objects.requireNonNull(table, "table");
    if (table.isBlank()) throw new IllegalArgumentException("table must not be blank");
    if (schema != null && schema.isBlank()) schema = null;
  }

  public static TableNode of(String table) {
    return new TableNode(null, table);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
