package io.intellixity.sqlforge.node;

import java.util.ArrayList;
import java.util.List;

public record SelectNode(
    boolean distinct,
    List<Node> selections,
    FromNode from,
    List<JoinNode> joins,
    WhereNode where,
    List<OrderByItemNode> orderBy,
    LimitNode limit,
    OffsetNode offset
) implements Node {
  public SelectNode {
    selections = selections == null ? List.of() : List.copyOf(selections);
    joins = joins == null ? List.of() : List.copyOf(joins);
    orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
  }

  public static SelectNode from(FromNode from) {
    return new SelectNode(false, List.of(), from, List.of(), null, List.of(), null, null);
  }

  public SelectNode withDistinct() {
    return new SelectNode(true, selections, from, joins, where, orderBy, limit, offset);
  }

  public SelectNode withSelections(List<? extends Node> more) {
    List<Node> all = new ArrayList<>(selections);
    all.addAll(more);
    return new SelectNode(distinct, all, from, joins, where, orderBy, limit, offset);
  }

  public SelectNode withJoin(JoinNode join) {
    List<JoinNode> all = new ArrayList<>(joins);
    all.add(join);
    return new SelectNode(distinct, selections, from, all, where, orderBy, limit, offset);
  }

  public SelectNode withWhere(WhereNode where) {
    return new SelectNode(distinct, selections, from, joins, where, orderBy, limit, offset);
  }

  public SelectNode withOrderByItem(OrderByItemNode item) {
    List<OrderByItemNode> all = new ArrayList<>(orderBy);
    all.add(item);
    return new SelectNode(distinct, selections, from, joins, where, all, limit, offset);
  }

  public SelectNode withLimit(LimitNode limit) {
    return new SelectNode(distinct, selections, from, joins, where, orderBy, limit, offset);
  }

  public SelectNode withOffset(OffsetNode offset) {
    return new SelectNode(distinct, selections, from, joins, where, orderBy, limit, offset);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
