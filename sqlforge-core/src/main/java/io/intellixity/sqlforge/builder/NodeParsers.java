package io.intellixity.sqlforge.builder;

import io.intellixity.sqlforge.node.*;

import java.util.*;

/**
 * Turns builder arguments into nodes.
 *
 * <p>Only the shape of the arguments is checked here. Whether a referenced table or column exists is the
 * database's business.</p>
 */
final class NodeParsers {
  private NodeParsers() {}

  /** {@code GENERATED} stays a sentinel, nodes and builders are used as-is, anything else is bound. */
  static Node parseValue(Object value) {
    if (value instanceof NodeSource ns) return Objects.requireNonNull(ns.toNode(), "toNode()");
    return new ValueNode(value);
  }

  static List<Node> parseValues(Collection<?> values) {
    List<Node> out = new ArrayList<>(values.size());
    for (Object v : values) out.add(parseValue(v));
    return out;
  }

  /** {@code "*"}, {@code "pet.*"}, {@code "pet.name"} or {@code "name"}. */
  static Node parseReference(String ref) {
    String r = requireText(ref, "reference");
    if ("*".equals(r)) return SelectAllNode.all();
    int dot = r.indexOf('.');
    if (dot < 0) return ColumnReferenceNode.of(r);
    String table = r.substring(0, dot).trim();
    String column = r.substring(dot + 1).trim();
    if ("*".equals(column)) return new SelectAllNode(table);
    return new ColumnReferenceNode(table, column);
  }

  static ColumnReferenceNode parseColumn(String column) {
    Node n = parseReference(column);
    if (!(n instanceof ColumnReferenceNode c)) {
      throw new IllegalArgumentException("Expected a column reference but got: " + column);
    }
    return c;
  }

  static List<ColumnReferenceNode> parseColumns(Collection<String> columns) {
    List<ColumnReferenceNode> out = new ArrayList<>(columns.size());
    for (String c : columns) out.add(parseColumn(c));
    return out;
  }

  /** A reference string or an arbitrary expression. */
  static Node parseReferenceExpression(Object expr) {
    if (expr instanceof String s) return parseReference(s);
    if (expr instanceof NodeSource ns) return ns.toNode();
    throw new IllegalArgumentException("Expected a reference or expression but got: "
        + (expr == null ? "null" : expr.getClass().getName()));
  }

  /** Selection string with optional alias: {@code "first_name as name"}. */
  static Node parseSelection(String selection) {
    String s = requireText(selection, "selection");
    int as = indexOfAs(s);
    if (as < 0) return parseReference(s);
    return new AliasNode(parseReference(s.substring(0, as)), s.substring(as + 4).trim());
  }

  static List<Node> parseSelections(String... selections) {
    List<Node> out = new ArrayList<>(selections.length);
    for (String s : selections) out.add(parseSelection(s));
    return out;
  }

  /** {@code "person"}, {@code "public.person"} or {@code "person as p"}. */
  static Node parseTableExpression(String table) {
    String s = requireText(table, "table");
    int as = indexOfAs(s);
    if (as >= 0) return new AliasNode(parseTable(s.substring(0, as)), s.substring(as + 4).trim());
    return parseTable(s);
  }

  static TableNode parseTable(String table) {
    String s = requireText(table, "table");
    int dot = s.indexOf('.');
    if (dot < 0) return TableNode.of(s);
    return new TableNode(s.substring(0, dot).trim(), s.substring(dot + 1).trim());
  }

  static Node parseFilter(Object lhs, String operator, Object rhs) {
    Operator op = Operator.binary(operator);
    Node left = parseReferenceExpression(lhs);
    return new BinaryOperationNode(left, op, parseFilterValue(op, rhs));
  }

  static Node parseReferenceFilter(Object lhs, String operator, Object rhs) {
    Operator op = Operator.binary(operator);
    return new BinaryOperationNode(parseReferenceExpression(lhs), op, parseReferenceExpression(rhs));
  }

  private static Node parseFilterValue(Operator op, Object rhs) {
    if ((op == Operator.IN || op == Operator.NOT_IN) && rhs instanceof Collection<?> c) {
      return new ValueListNode(parseValues(c));
    }
    if ((op == Operator.IS || op == Operator.IS_NOT) && rhs == null) {
      return RawNode.of("null");
    }
    return parseValue(rhs);
  }

  static List<ColumnUpdateNode> parseUpdates(Map<String, ?> updates) {
    Objects.requireNonNull(updates, "updates");
    List<ColumnUpdateNode> out = new ArrayList<>(updates.size());
    for (Map.Entry<String, ?> e : updates.entrySet()) {
      Node value = parseValue(e.getValue());
      if (value instanceof GeneratedNode) {
        throw new IllegalArgumentException("GENERATED is only valid in insert values (column '" + e.getKey() + "')");
      }
      out.add(new ColumnUpdateNode(parseColumn(e.getKey()), value));
    }
    return out;
  }

  private static int indexOfAs(String s) {
    return s.toLowerCase(Locale.ROOT).lastIndexOf(" as ");
  }

  private static String requireText(String s, String what) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException(what + " must not be blank");
    return s.trim();
  }
}
