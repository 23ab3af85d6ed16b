package io.intellixity.sqlforge.node;

import java.util.List;

/** Ordered node list rendered as {@code (a, b, ...)}: a value tuple or the right side of {@code in}. */
public record ValueListNode(List<Node> values) implements Node {
  public ValueListNode {
    values = values == null ? List.of() : List.copyOf(values);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
