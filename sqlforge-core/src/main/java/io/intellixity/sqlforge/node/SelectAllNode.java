package io.intellixity.sqlforge.node;

/** {@code *} or {@code table.*}. */
public record SelectAllNode(String table) implements Node {
  public SelectAllNode {
    if (table != null && table.isBlank()) table = null;
  }

  public static SelectAllNode all() {
    return new SelectAllNode(null);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
