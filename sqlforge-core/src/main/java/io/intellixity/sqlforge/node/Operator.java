package io.intellixity.sqlforge.node;

import java.util.Locale;

public enum Operator {
  EQ("=", Arity.BINARY),
  NE("<>", Arity.BINARY),
  BANG_EQ("!=", Arity.BINARY),
  GT(">", Arity.BINARY),
  GE(">=", Arity.BINARY),
  LT("<", Arity.BINARY),
  LE("<=", Arity.BINARY),

  IN("in", Arity.BINARY),
  NOT_IN("not in", Arity.BINARY),

  LIKE("like", Arity.BINARY),
  NOT_LIKE("not like", Arity.BINARY),
  ILIKE("ilike", Arity.BINARY),

  IS("is", Arity.BINARY),
  IS_NOT("is not", Arity.BINARY),

  AND("and", Arity.BINARY),
  OR("or", Arity.BINARY),

  PLUS("+", Arity.BINARY),
  MINUS("-", Arity.BINARY),
  MULTIPLY("*", Arity.BINARY),
  DIVIDE("/", Arity.BINARY),
  CONCAT("||", Arity.BINARY),

  // Unary prefix operators
  NOT("not", Arity.UNARY),
  EXISTS("exists", Arity.UNARY),
  NOT_EXISTS("not exists", Arity.UNARY),
  NEGATE("-", Arity.UNARY);

  private enum Arity { BINARY, UNARY }

  private final String sql;
  private final Arity arity;

  Operator(String sql, Arity arity) {
    this.sql = sql;
    this.arity = arity;
  }

  public String sql() {
    return sql;
  }

  public boolean isBinary() {
    return arity == Arity.BINARY;
  }

  public boolean isUnary() {
    return arity == Arity.UNARY;
  }

  /** Unary operators whose symbol is a word need a space before the operand. */
  public boolean isKeyword() {
    return Character.isLetter(sql.charAt(0));
  }

  /** Resolve a binary operator from its SQL symbol, case-insensitively ({@code "!="}, {@code "not in"}, ...). */
  public static Operator binary(String symbol) {
    return parse(symbol, Arity.BINARY);
  }

  public static Operator unary(String symbol) {
    return parse(symbol, Arity.UNARY);
  }

  private static Operator parse(String symbol, Arity arity) {
    if (symbol == null) throw new IllegalArgumentException("operator is required");
    String s = symbol.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    for (Operator op : values()) {
      if (op.arity == arity && op.sql.equals(s)) return op;
    }
    throw new IllegalArgumentException("Unknown " + arity.name().toLowerCase(Locale.ROOT) + " operator: " + symbol);
  }
}
