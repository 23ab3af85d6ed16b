package io.intellixity.sqlforge.node;

import java.util.ArrayList;
import java.util.List;

/**
 * Opaque SQL text with embedded parameter slots.
 *
 * <p>{@code sqlFragments} always has exactly one more element than {@code parameters}: fragment i is emitted,
 * then parameter i, and so on, ending with the last fragment.</p>
 *
 * <p>{@code literalQuestionMark} is set when the fragments carry a {@code ?} that came from a {@code ??} escape.
 * Dialects whose placeholder token is {@code ?} cannot emit such text without shifting parameter positions.</p>
 */
public record RawNode(List<String> sqlFragments, List<Node> parameters, boolean literalQuestionMark)
    implements Node {
  public RawNode {
    sqlFragments = sqlFragments == null ? List.of("") : List.copyOf(sqlFragments);
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
  }

  public RawNode(List<String> sqlFragments, List<Node> parameters) {
    this(sqlFragments, parameters, false);
  }

  /** Raw SQL without parameters. */
  public static RawNode of(String sql) {
    return new RawNode(List.of(sql == null ? "" : sql), List.of());
  }

  /** Result of scanning raw SQL for slots. */
  public record Slots(List<String> fragments, boolean literalQuestionMark) {
    public Slots {
      fragments = List.copyOf(fragments);
    }
  }

  /** Fragments of {@code sql} around its {@code ?} slots; see {@link #scan(String)}. */
  public static List<String> splitSlots(String sql) {
    return scan(sql).fragments();
  }

  /**
   * Split {@code sql} on {@code ?} slots. Question marks inside single-quoted literals, double-quoted
   * identifiers or backtick-quoted identifiers are not slots, and {@code ??} is an escaped literal question mark.
   *
   * <p>Quotes are closed by the next matching quote character, so doubled quotes ({@code 'it''s'}) work.
   * Backslash escapes inside literals ({@code 'it\'s'}) are not recognised: such a literal ends at the escaped
   * quote. Use doubled quotes or a bound parameter instead.</p>
   */
  public static Slots scan(String sql) {
    List<String> out = new ArrayList<>();
    if (sql == null) {
      out.add("");
      return new Slots(out, false);
    }
    StringBuilder cur = new StringBuilder();
    boolean literal = false;
    char quote = 0;
    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);
      if (quote != 0) {
        if (ch == quote) quote = 0;
        cur.append(ch);
        continue;
      }
      if (ch == '\'' || ch == '"' || ch == '`') {
        quote = ch;
        cur.append(ch);
        continue;
      }
      if (ch == '?') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == '?') {
          cur.append('?');
          literal = true;
          i++;
          continue;
        }
        out.add(cur.toString());
        cur.setLength(0);
        continue;
      }
      cur.append(ch);
    }
    out.add(cur.toString());
    return new Slots(out, literal);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
