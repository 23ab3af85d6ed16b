package io.intellixity.sqlforge.jdbc;

import java.util.List;
import java.util.Map;

/**
 * Result of one executed statement.
 *
 * @param rows            rows as returned by the driver (selects and returning clauses), column label to value
 * @param numAffectedRows update count for statements without result rows, otherwise the row count
 * @param insertId        driver-reported generated id; dialect-specific and not guaranteed for no-op upserts
 */
public record QueryResult(List<Map<String, Object>> rows, long numAffectedRows, Long insertId) {
  public QueryResult {
    rows = rows == null ? List.of() : List.copyOf(rows);
  }
}
