package io.intellixity.sqlforge.spi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Output of a compile: SQL text and the parameters in placeholder order.
 *
 * <p>{@code returnsRows} is true for selects and for statements with a returning clause; the driver boundary
 * uses it to pick between a query and an update call.</p>
 */
public record CompiledQuery(String sql, List<Object> parameters, QueryKind kind, boolean returnsRows) {
  public CompiledQuery {
    Objects.requireNonNull(sql, "sql");
    Objects.requireNonNull(kind, "kind");
    // List.copyOf rejects null elements; bound values may be null.
    parameters = parameters == null
        ? List.of()
        : Collections.unmodifiableList(new ArrayList<>(parameters));
  }
}
