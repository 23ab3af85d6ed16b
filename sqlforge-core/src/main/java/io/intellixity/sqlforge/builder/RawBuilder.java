package io.intellixity.sqlforge.builder;

import io.intellixity.sqlforge.node.AliasNode;
import io.intellixity.sqlforge.node.NodeSource;
import io.intellixity.sqlforge.node.RawNode;

import java.util.Objects;

public final class RawBuilder implements NodeSource {
  private final RawNode node;

  RawBuilder(RawNode node) {
    this.node = Objects.requireNonNull(node, "node");
  }

  @Override
  public RawNode toNode() {
    return node;
  }

  public NodeSource as(String alias) {
    return () -> new AliasNode(node, alias);
  }
}
