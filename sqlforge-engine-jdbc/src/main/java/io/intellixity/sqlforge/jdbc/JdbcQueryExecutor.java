package io.intellixity.sqlforge.jdbc;

import io.intellixity.sqlforge.node.NodeSource;
import io.intellixity.sqlforge.spi.CompiledQuery;
import io.intellixity.sqlforge.spi.Dialect;
import io.intellixity.sqlforge.spi.QueryKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Hands compiled SQL and its parameters to a JDBC driver.
 *
 * <p>Parameters are bound positionally with {@code setObject}, in compile order. Nothing is retried or
 * pooled here; callers needing a transaction pass their own {@link Connection}.</p>
 */
public final class JdbcQueryExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);

  private final DataSource ds;
  private final Dialect dialect;

  public JdbcQueryExecutor(DataSource ds, Dialect dialect) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public Dialect dialect() {
    return dialect;
  }

  public CompiledQuery compile(NodeSource query) {
    return dialect.compile(query);
  }

  public QueryResult execute(NodeSource query) {
    return execute(compile(query));
  }

  public QueryResult execute(CompiledQuery query) {
    try (Connection c = ds.getConnection()) {
      return execute(c, query);
    } catch (SQLException e) {
      throw new SqlExecutionException("Failed to obtain connection for: " + query.sql(), e);
    }
  }

  public QueryResult execute(Connection c, CompiledQuery query) {
    long start = System.nanoTime();
    boolean generatedKeys = query.kind() == QueryKind.INSERT
        && !query.returnsRows()
        && dialect.descriptor().supportsLastInsertId();
    debugSql(query);
    try (PreparedStatement ps = generatedKeys
        ? c.prepareStatement(query.sql(), Statement.RETURN_GENERATED_KEYS)
        : c.prepareStatement(query.sql())) {
      bindAll(ps, query.parameters());

      if (query.returnsRows()) {
        try (ResultSet rs = ps.executeQuery()) {
          List<Map<String, Object>> rows = readRows(rs);
          debugDone(query, rows.size() + " rows", System.nanoTime() - start);
          return new QueryResult(rows, rows.size(), null);
        }
      }

      if (query.kind() == QueryKind.RAW) {
        if (ps.execute()) {
          try (ResultSet rs = ps.getResultSet()) {
            List<Map<String, Object>> rows = readRows(rs);
            debugDone(query, rows.size() + " rows", System.nanoTime() - start);
            return new QueryResult(rows, rows.size(), null);
          }
        }
        long n = Math.max(0, ps.getUpdateCount());
        debugDone(query, n, System.nanoTime() - start);
        return new QueryResult(List.of(), n, null);
      }

      long n = ps.executeUpdate();
      Long insertId = generatedKeys ? readGeneratedId(ps) : null;
      debugDone(query, n, System.nanoTime() - start);
      return new QueryResult(List.of(), n, insertId);
    } catch (SQLException e) {
      throw new SqlExecutionException("Failed to execute " + query.kind() + ": " + query.sql(), e);
    }
  }

  /** Rows of a select, or of a statement with a returning clause. */
  public List<Map<String, Object>> executeQuery(NodeSource query) {
    CompiledQuery q = compile(query);
    if (!q.returnsRows()) {
      throw new IllegalArgumentException("Query does not return rows: " + q.sql());
    }
    return execute(q).rows();
  }

  public Optional<Map<String, Object>> executeTakeFirst(NodeSource query) {
    List<Map<String, Object>> rows = executeQuery(query);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public InsertResult executeInsert(NodeSource query) {
    QueryResult r = execute(requireKind(compile(query), QueryKind.INSERT));
    return new InsertResult(r.insertId(), r.numAffectedRows());
  }

  public UpdateResult executeUpdate(NodeSource query) {
    QueryResult r = execute(requireKind(compile(query), QueryKind.UPDATE));
    return new UpdateResult(r.numAffectedRows());
  }

  public DeleteResult executeDelete(NodeSource query) {
    QueryResult r = execute(requireKind(compile(query), QueryKind.DELETE));
    return new DeleteResult(r.numAffectedRows());
  }

  private static CompiledQuery requireKind(CompiledQuery q, QueryKind kind) {
    if (q.kind() != kind) {
      throw new IllegalArgumentException("Expected " + kind + " but got " + q.kind() + ": " + q.sql());
    }
    return q;
  }

  private static void bindAll(PreparedStatement ps, List<Object> params) throws SQLException {
    for (int i = 0; i < params.size(); i++) {
      ps.setObject(i + 1, params.get(i));
    }
  }

  private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int cols = md.getColumnCount();
    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 1; i <= cols; i++) {
        row.put(md.getColumnLabel(i), rs.getObject(i));
      }
      out.add(row);
    }
    return out;
  }

  private Long readGeneratedId(PreparedStatement ps) throws SQLException {
    try (ResultSet keys = ps.getGeneratedKeys()) {
      if (keys == null || !keys.next()) return null;
      Object v = keys.getObject(1);
      return (v instanceof Number n) ? n.longValue() : null;
    } catch (SQLFeatureNotSupportedException e) {
      log.debug("sqlforge.jdbc generated keys not supported by driver dialect={}", dialect.id());
      return null;
    }
  }

  private void debugSql(CompiledQuery q) {
    if (!log.isDebugEnabled()) return;
    log.debug("sqlforge.jdbc dialect={} kind={} returnsRows={} paramCount={} sql={}",
        dialect.id(), q.kind(), q.returnsRows(), q.parameters().size(), q.sql());

    // Types only; values may be sensitive.
    if (log.isTraceEnabled()) {
      for (int i = 0; i < q.parameters().size(); i++) {
        Object v = q.parameters().get(i);
        log.trace("sqlforge.jdbc param index={} valueType={}", i + 1, v == null ? "null" : v.getClass().getName());
      }
    }
  }

  private void debugDone(CompiledQuery q, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("sqlforge.jdbc_done dialect={} kind={} durationMs={} result={}",
        dialect.id(), q.kind(), durationNanos / 1_000_000, result);
  }
}
