package io.intellixity.sqlforge.node;

import java.util.List;

/** Row tuples of an insert, in row-major order. */
public record ValuesNode(List<ValueListNode> rows) implements Node {
  public ValuesNode {
    rows = rows == null ? List.of() : List.copyOf(rows);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
