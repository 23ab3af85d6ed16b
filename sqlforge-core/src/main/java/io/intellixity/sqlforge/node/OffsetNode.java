package io.intellixity.sqlforge.node;

import java.util.Objects;

public record OffsetNode(Node offset) implements Node {
  public OffsetNode {
    Objects.requireNonNull(offset, "offset");
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
