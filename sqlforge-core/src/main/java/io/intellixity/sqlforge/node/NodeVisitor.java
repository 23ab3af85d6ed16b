package io.intellixity.sqlforge.node;

/** One method per {@link Node} variant. */
public interface NodeVisitor<R> {
  R visit(SelectNode node);
  R visit(InsertNode node);
  R visit(UpdateNode node);
  R visit(DeleteNode node);

  R visit(FromNode node);
  R visit(WhereNode node);
  R visit(JoinNode node);

  R visit(OnConflictNode node);
  R visit(OnDuplicateKeyUpdateNode node);
  R visit(ReturningNode node);

  R visit(ColumnReferenceNode node);
  R visit(SelectAllNode node);
  R visit(TableNode node);
  R visit(AliasNode node);

  R visit(ValueNode node);
  R visit(RawNode node);
  R visit(BinaryOperationNode node);
  R visit(UnaryOperationNode node);
  R visit(ParensNode node);

  R visit(ValueListNode node);
  R visit(ValuesNode node);
  R visit(GeneratedNode node);

  R visit(ColumnUpdateNode node);
  R visit(OrderByItemNode node);
  R visit(LimitNode node);
  R visit(OffsetNode node);
}
