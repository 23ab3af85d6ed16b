package io.intellixity.sqlforge.node;

import java.util.Objects;

public record ParensNode(Node node) implements Node {
  public ParensNode {
    Objects.requireNonNull(node, "node");
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
