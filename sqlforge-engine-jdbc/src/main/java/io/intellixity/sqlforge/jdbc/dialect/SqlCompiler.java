package io.intellixity.sqlforge.jdbc.dialect;

import io.intellixity.sqlforge.node.*;
import io.intellixity.sqlforge.spi.CompiledQuery;
import io.intellixity.sqlforge.spi.MalformedTreeException;
import io.intellixity.sqlforge.spi.PlaceholderStyle;
import io.intellixity.sqlforge.spi.QueryKind;
import io.intellixity.sqlforge.spi.SqlFeature;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-use, depth-first renderer of one node tree.
 *
 * Text and parameters are appended in the same left-to-right pass, so the Nth placeholder written is always
 * the Nth parameter collected. Any failure throws before a {@link CompiledQuery} exists.
 */
final class SqlCompiler implements NodeVisitor<Void> {
  private final AbstractSqlDialect dialect;
  private final ConflictClauseRenderer conflicts;
  private final StringBuilder sql = new StringBuilder(128);
  private final List<Object> parameters = new ArrayList<>();
  private int statementDepth;
  private boolean bareNextSelect;

  SqlCompiler(AbstractSqlDialect dialect) {
    this.dialect = dialect;
    this.conflicts = new ConflictClauseRenderer(dialect, this);
  }

  CompiledQuery compile(Node root) {
    root.accept(this);
    return new CompiledQuery(sql.toString(), parameters, kindOf(root), returnsRows(root));
  }

  private static QueryKind kindOf(Node root) {
    if (root instanceof SelectNode) return QueryKind.SELECT;
    if (root instanceof InsertNode) return QueryKind.INSERT;
    if (root instanceof UpdateNode) return QueryKind.UPDATE;
    if (root instanceof DeleteNode) return QueryKind.DELETE;
    return QueryKind.RAW;
  }

  private static boolean returnsRows(Node root) {
    if (root instanceof SelectNode) return true;
    if (root instanceof InsertNode i) return i.returning() != null;
    if (root instanceof UpdateNode u) return u.returning() != null;
    if (root instanceof DeleteNode d) return d.returning() != null;
    return false;
  }

  // ---------- statements ----------

  @Override
  public Void visit(SelectNode node) {
    boolean wrap = statementDepth > 0 && !bareNextSelect;
    bareNextSelect = false;
    if (node.selections().isEmpty()) throw new MalformedTreeException("Select has no selections");

    if (wrap) append("(");
    statementDepth++;
    append(node.distinct() ? "select distinct " : "select ");
    join(node.selections(), ", ");
    if (node.from() != null) {
      append(" ");
      node.from().accept(this);
    }
    for (JoinNode j : node.joins()) {
      append(" ");
      j.accept(this);
    }
    if (node.where() != null) {
      append(" ");
      node.where().accept(this);
    }
    if (!node.orderBy().isEmpty()) {
      append(" order by ");
      join(node.orderBy(), ", ");
    }
    if (node.limit() != null) {
      append(" ");
      node.limit().accept(this);
    }
    if (node.offset() != null) {
      append(" ");
      node.offset().accept(this);
    }
    statementDepth--;
    if (wrap) append(")");
    return null;
  }

  @Override
  public Void visit(InsertNode node) {
    if (node.values() == null && node.expression() == null) {
      throw new MalformedTreeException("Insert into '" + node.into().table() + "' has neither values nor an expression");
    }
    if (node.values() != null && node.expression() != null) {
      throw new MalformedTreeException("Insert into '" + node.into().table() + "' has both values and an expression");
    }
    if (node.returning() != null) dialect.requireFeature(SqlFeature.RETURNING);
    ConflictClauseRenderer.Plan plan = conflicts.plan(node);

    statementDepth++;
    append(plan.insertIgnore() ? "insert ignore into " : "insert into ");
    node.into().accept(this);

    if (node.values() != null) {
      renderInsertValues(node);
    } else {
      if (!node.columns().isEmpty()) {
        append(" (");
        join(node.columns(), ", ");
        append(")");
      }
      append(" ");
      bareNextSelect = node.expression() instanceof SelectNode;
      node.expression().accept(this);
    }

    conflicts.render(plan);
    if (node.returning() != null) {
      append(" ");
      node.returning().accept(this);
    }
    statementDepth--;
    return null;
  }

  /** Drops columns whose value is {@link GeneratedNode} in every row, from the column list and each tuple. */
  private void renderInsertValues(InsertNode node) {
    List<ColumnReferenceNode> columns = node.columns();
    List<ValueListNode> rows = node.values().rows();
    String table = node.into().table();
    if (rows.isEmpty()) throw new MalformedTreeException("Insert into '" + table + "' has no rows");
    if (columns.isEmpty()) throw new MalformedTreeException("Insert into '" + table + "' has no columns");

    List<Integer> kept = new ArrayList<>(columns.size());
    for (int c = 0; c < columns.size(); c++) {
      int generated = 0;
      for (ValueListNode row : rows) {
        if (row.values().size() != columns.size()) {
          throw new MalformedTreeException("Insert into '" + table + "' has a row with " + row.values().size()
              + " value(s) for " + columns.size() + " column(s)");
        }
        if (row.values().get(c) instanceof GeneratedNode) generated++;
      }
      if (generated == 0) {
        kept.add(c);
      } else if (generated != rows.size()) {
        throw new MalformedTreeException("Column '" + columns.get(c).column() + "' of insert into '" + table
            + "' is generated in some rows but not in others");
      }
    }
    if (kept.isEmpty()) {
      throw new MalformedTreeException("Insert into '" + table + "' has only generated columns");
    }

    append(" (");
    for (int i = 0; i < kept.size(); i++) {
      if (i > 0) append(", ");
      columns.get(kept.get(i)).accept(this);
    }
    append(") values ");
    for (int r = 0; r < rows.size(); r++) {
      if (r > 0) append(", ");
      List<Node> values = rows.get(r).values();
      append("(");
      for (int i = 0; i < kept.size(); i++) {
        if (i > 0) append(", ");
        values.get(kept.get(i)).accept(this);
      }
      append(")");
    }
  }

  @Override
  public Void visit(UpdateNode node) {
    if (node.updates().isEmpty()) {
      throw new MalformedTreeException("Update of '" + node.table().table() + "' has no assignments");
    }
    if (node.returning() != null) dialect.requireFeature(SqlFeature.RETURNING);

    statementDepth++;
    append("update ");
    node.table().accept(this);
    append(" set ");
    join(node.updates(), ", ");
    if (node.where() != null) {
      append(" ");
      node.where().accept(this);
    }
    if (node.returning() != null) {
      append(" ");
      node.returning().accept(this);
    }
    statementDepth--;
    return null;
  }

  @Override
  public Void visit(DeleteNode node) {
    if (node.returning() != null) dialect.requireFeature(SqlFeature.RETURNING);

    statementDepth++;
    append("delete ");
    node.from().accept(this);
    if (node.where() != null) {
      append(" ");
      node.where().accept(this);
    }
    if (node.returning() != null) {
      append(" ");
      node.returning().accept(this);
    }
    statementDepth--;
    return null;
  }

  // ---------- clauses ----------

  @Override
  public Void visit(FromNode node) {
    if (node.froms().isEmpty()) throw new MalformedTreeException("From clause has no items");
    append("from ");
    join(node.froms(), ", ");
    return null;
  }

  @Override
  public Void visit(WhereNode node) {
    append("where ");
    node.where().accept(this);
    return null;
  }

  @Override
  public Void visit(JoinNode node) {
    if (node.joinType() == JoinNode.JoinType.FULL) dialect.requireFeature(SqlFeature.FULL_JOIN);
    append(node.joinType().sql()).append(" ");
    node.table().accept(this);
    if (node.on() != null) {
      append(" on ");
      node.on().accept(this);
    }
    return null;
  }

  @Override
  public Void visit(OnConflictNode node) {
    conflicts.renderOnConflict(node);
    return null;
  }

  @Override
  public Void visit(OnDuplicateKeyUpdateNode node) {
    conflicts.renderOnDuplicateKeyUpdate(node.updates());
    return null;
  }

  @Override
  public Void visit(ReturningNode node) {
    dialect.requireFeature(SqlFeature.RETURNING);
    if (node.selections().isEmpty()) throw new MalformedTreeException("Returning clause has no selections");
    append("returning ");
    join(node.selections(), ", ");
    return null;
  }

  // ---------- references ----------

  @Override
  public Void visit(ColumnReferenceNode node) {
    if (node.table() != null) append(dialect.quoteIdentifier(node.table())).append(".");
    append(dialect.quoteIdentifier(node.column()));
    return null;
  }

  @Override
  public Void visit(SelectAllNode node) {
    if (node.table() != null) append(dialect.quoteIdentifier(node.table())).append(".");
    append("*");
    return null;
  }

  @Override
  public Void visit(TableNode node) {
    if (node.schema() != null) append(dialect.quoteIdentifier(node.schema())).append(".");
    append(dialect.quoteIdentifier(node.table()));
    return null;
  }

  @Override
  public Void visit(AliasNode node) {
    node.node().accept(this);
    append(" as ").append(dialect.quoteIdentifier(node.alias()));
    return null;
  }

  // ---------- expressions ----------

  @Override
  public Void visit(ValueNode node) {
    parameters.add(node.value());
    append(dialect.placeholder(parameters.size()));
    return null;
  }

  @Override
  public Void visit(RawNode node) {
    List<String> fragments = node.sqlFragments();
    List<Node> params = node.parameters();
    if (fragments.size() != params.size() + 1) {
      throw new MalformedTreeException("Raw SQL has " + (fragments.size() - 1) + " parameter slot(s) but "
          + params.size() + " parameter(s)");
    }
    if (node.literalQuestionMark() && dialect.descriptor().placeholderStyle() == PlaceholderStyle.QUESTION_MARK) {
      throw new MalformedTreeException("Raw SQL contains an escaped '?' that dialect "
          + dialect.descriptor().id() + " would read as a parameter placeholder");
    }
    for (int i = 0; i < params.size(); i++) {
      append(fragments.get(i));
      params.get(i).accept(this);
    }
    append(fragments.get(fragments.size() - 1));
    return null;
  }

  @Override
  public Void visit(BinaryOperationNode node) {
    node.left().accept(this);
    append(" ").append(node.operator().sql()).append(" ");
    node.right().accept(this);
    return null;
  }

  @Override
  public Void visit(UnaryOperationNode node) {
    append(node.operator().sql());
    if (node.operator().isKeyword()) append(" ");
    node.operand().accept(this);
    return null;
  }

  @Override
  public Void visit(ParensNode node) {
    append("(");
    node.node().accept(this);
    append(")");
    return null;
  }

  @Override
  public Void visit(ValueListNode node) {
    if (node.values().isEmpty()) throw new MalformedTreeException("Value list is empty");
    append("(");
    join(node.values(), ", ");
    append(")");
    return null;
  }

  @Override
  public Void visit(ValuesNode node) {
    if (node.rows().isEmpty()) throw new MalformedTreeException("Values clause has no rows");
    append("values ");
    join(node.rows(), ", ");
    return null;
  }

  @Override
  public Void visit(GeneratedNode node) {
    throw new MalformedTreeException("GENERATED is only valid as an insert value");
  }

  @Override
  public Void visit(ColumnUpdateNode node) {
    if (node.value() instanceof GeneratedNode) {
      throw new MalformedTreeException("GENERATED cannot be assigned to column '" + node.column().column() + "'");
    }
    node.column().accept(this);
    append(" = ");
    node.value().accept(this);
    return null;
  }

  @Override
  public Void visit(OrderByItemNode node) {
    node.orderBy().accept(this);
    if (node.direction() != null) append(node.direction() == OrderByItemNode.Direction.DESC ? " desc" : " asc");
    return null;
  }

  @Override
  public Void visit(LimitNode node) {
    append("limit ");
    node.limit().accept(this);
    return null;
  }

  @Override
  public Void visit(OffsetNode node) {
    append("offset ");
    node.offset().accept(this);
    return null;
  }

  // ---------- helpers ----------

  StringBuilder append(String s) {
    return sql.append(s);
  }

  void join(List<? extends Node> nodes, String separator) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) append(separator);
      nodes.get(i).accept(this);
    }
  }
}
