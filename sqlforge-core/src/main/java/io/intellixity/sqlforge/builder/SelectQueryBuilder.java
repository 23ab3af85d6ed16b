package io.intellixity.sqlforge.builder;

import io.intellixity.sqlforge.node.*;
import io.intellixity.sqlforge.node.JoinNode.JoinType;
import io.intellixity.sqlforge.node.OrderByItemNode.Direction;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public final class SelectQueryBuilder extends FilterableBuilder<SelectQueryBuilder> {
  private final SelectNode node;

  SelectQueryBuilder(SelectNode node) {
    this.node = Objects.requireNonNull(node, "node");
  }

  @Override
  public SelectNode toNode() {
    return node;
  }

  @Override
  protected WhereNode whereNode() {
    return node.where();
  }

  @Override
  protected SelectQueryBuilder withWhere(WhereNode where) {
    return new SelectQueryBuilder(node.withWhere(where));
  }

  /** Column references, optionally aliased: {@code "name"}, {@code "pet.name"}, {@code "name as pet_name"}. */
  public SelectQueryBuilder select(String... selections) {
    return new SelectQueryBuilder(node.withSelections(NodeParsers.parseSelections(selections)));
  }

  /** Expressions: aliased raw fragments, subqueries, references. */
  public SelectQueryBuilder select(NodeSource... selections) {
    List<Node> nodes = Arrays.stream(selections).map(NodeSource::toNode).toList();
    return new SelectQueryBuilder(node.withSelections(nodes));
  }

  public SelectQueryBuilder selectAll() {
    return new SelectQueryBuilder(node.withSelections(List.of(SelectAllNode.all())));
  }

  public SelectQueryBuilder selectAll(String table) {
    return new SelectQueryBuilder(node.withSelections(List.of(new SelectAllNode(table))));
  }

  public SelectQueryBuilder distinct() {
    return new SelectQueryBuilder(node.withDistinct());
  }

  public SelectQueryBuilder innerJoin(String table, String lhsRef, String rhsRef) {
    return join(JoinType.INNER, table, lhsRef, rhsRef);
  }

  public SelectQueryBuilder leftJoin(String table, String lhsRef, String rhsRef) {
    return join(JoinType.LEFT, table, lhsRef, rhsRef);
  }

  public SelectQueryBuilder rightJoin(String table, String lhsRef, String rhsRef) {
    return join(JoinType.RIGHT, table, lhsRef, rhsRef);
  }

  public SelectQueryBuilder fullJoin(String table, String lhsRef, String rhsRef) {
    return join(JoinType.FULL, table, lhsRef, rhsRef);
  }

  /** Join on an arbitrary predicate. */
  public SelectQueryBuilder join(JoinType type, String table, NodeSource on) {
    return new SelectQueryBuilder(node.withJoin(
        new JoinNode(type, NodeParsers.parseTableExpression(table), on.toNode())));
  }

  private SelectQueryBuilder join(JoinType type, String table, String lhsRef, String rhsRef) {
    Node on = NodeParsers.parseReferenceFilter(lhsRef, "=", rhsRef);
    return new SelectQueryBuilder(node.withJoin(new JoinNode(type, NodeParsers.parseTableExpression(table), on)));
  }

  public SelectQueryBuilder orderBy(String ref) {
    return new SelectQueryBuilder(node.withOrderByItem(new OrderByItemNode(NodeParsers.parseReference(ref), null)));
  }

  public SelectQueryBuilder orderBy(String ref, Direction direction) {
    return new SelectQueryBuilder(node.withOrderByItem(new OrderByItemNode(NodeParsers.parseReference(ref), direction)));
  }

  public SelectQueryBuilder limit(long limit) {
    return new SelectQueryBuilder(node.withLimit(new LimitNode(new ValueNode(limit))));
  }

  public SelectQueryBuilder offset(long offset) {
    return new SelectQueryBuilder(node.withOffset(new OffsetNode(new ValueNode(offset))));
  }

  /** Use this query as an aliased subquery expression. */
  public NodeSource as(String alias) {
    return () -> new AliasNode(node, alias);
  }
}
