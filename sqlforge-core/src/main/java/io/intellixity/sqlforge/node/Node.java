package io.intellixity.sqlforge.node;

/**
 * Immutable tagged unit representing one fragment of a SQL statement.
 *
 * <p>Variants are records; children are copied on construction and never edited afterwards, so a subtree
 * may be shared between any number of parent trees. Renderers dispatch through {@link #accept(NodeVisitor)}.</p>
 */
public sealed interface Node extends NodeSource
    permits SelectNode, InsertNode, UpdateNode, DeleteNode,
    FromNode, WhereNode, JoinNode,
    OnConflictNode, OnDuplicateKeyUpdateNode, ReturningNode,
    ColumnReferenceNode, SelectAllNode, TableNode, AliasNode,
    ValueNode, RawNode, BinaryOperationNode, UnaryOperationNode, ParensNode,
    ValueListNode, ValuesNode, GeneratedNode,
    ColumnUpdateNode, OrderByItemNode, LimitNode, OffsetNode {

  <R> R accept(NodeVisitor<R> visitor);

  @Override
  default Node toNode() {
    return this;
  }
}
