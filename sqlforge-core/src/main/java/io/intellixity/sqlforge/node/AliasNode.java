package io.intellixity.sqlforge.node;

import java.util.Objects;

public record AliasNode(Node node, String alias) implements Node {
  public AliasNode {
    Objects.requireNonNull(node, "node");
    Objects.requireNonNull(alias, "alias");
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
