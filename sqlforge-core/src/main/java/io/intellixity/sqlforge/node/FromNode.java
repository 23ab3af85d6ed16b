package io.intellixity.sqlforge.node;

import java.util.List;

/** One or more from-items, rendered comma separated. */
public record FromNode(List<Node> froms) implements Node {
  public FromNode {
    froms = froms == null ? List.of() : List.copyOf(froms);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
