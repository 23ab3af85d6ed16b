package io.intellixity.sqlforge.jdbc.dialect;

import io.intellixity.sqlforge.node.ColumnUpdateNode;
import io.intellixity.sqlforge.node.InsertNode;
import io.intellixity.sqlforge.node.OnConflictNode;
import io.intellixity.sqlforge.node.OnDuplicateKeyUpdateNode;
import io.intellixity.sqlforge.spi.DialectDescriptor;
import io.intellixity.sqlforge.spi.MalformedTreeException;
import io.intellixity.sqlforge.spi.SqlFeature;
import io.intellixity.sqlforge.spi.UnsupportedFeatureException;

import java.util.List;

/**
 * Maps the dialect-neutral conflict description of an insert onto the active dialect.
 *
 * <ul>
 *   <li>Dialects with {@code ON_CONFLICT}: {@code on conflict [(cols) | on constraint "c"] [where p]
 *   do nothing | do update set ... [where p]}; {@code ignore()} becomes a bare {@code on conflict do nothing}.</li>
 *   <li>Dialects without it: do-nothing becomes {@code insert ignore}, do-update becomes
 *   {@code on duplicate key update}. Targets and predicates have no equivalent there and are rejected.</li>
 * </ul>
 *
 * {@link #plan(InsertNode)} does every check up front, before the insert writes any text.
 */
final class ConflictClauseRenderer {
  record Plan(boolean insertIgnore, OnConflictNode onConflict, List<ColumnUpdateNode> duplicateKeyUpdates) {}

  private final AbstractSqlDialect dialect;
  private final SqlCompiler out;

  ConflictClauseRenderer(AbstractSqlDialect dialect, SqlCompiler out) {
    this.dialect = dialect;
    this.out = out;
  }

  Plan plan(InsertNode ins) {
    DialectDescriptor d = dialect.descriptor();
    OnConflictNode oc = ins.onConflict();
    OnDuplicateKeyUpdateNode odk = ins.onDuplicateKeyUpdate();
    boolean ignore = ins.ignore();

    if (odk != null) {
      dialect.requireFeature(SqlFeature.ON_DUPLICATE_KEY_UPDATE);
      if (odk.updates().isEmpty()) throw new MalformedTreeException("On duplicate key update has no assignments");
      if (oc != null) {
        throw new MalformedTreeException("On conflict and on duplicate key update cannot be combined");
      }
    }
    if (oc != null) checkOutcome(oc);

    if (d.supportsOnConflict()) {
      if (oc != null) {
        if (ignore) throw new MalformedTreeException("ignore() cannot be combined with an on conflict clause");
        checkTarget(oc);
        return new Plan(false, oc, List.of());
      }
      if (ignore) return new Plan(false, OnConflictNode.create().withDoNothing(), List.of());
      return new Plan(false, null, odk == null ? List.of() : odk.updates());
    }

    if (oc == null) {
      if (ignore) dialect.requireFeature(SqlFeature.INSERT_IGNORE);
      return new Plan(ignore, null, odk == null ? List.of() : odk.updates());
    }

    // No native on conflict: only an untargeted, unfiltered clause has an equivalent.
    if (oc.constraint() != null) {
      throw new UnsupportedFeatureException(dialect.id(), SqlFeature.ON_CONFLICT_CONSTRAINT);
    }
    if (!oc.columns().isEmpty()) {
      throw new UnsupportedFeatureException(dialect.id(), SqlFeature.ON_CONFLICT,
          "Conflict target columns cannot be expressed in dialect: " + dialect.id());
    }
    if (oc.indexWhere() != null || oc.updateWhere() != null) {
      throw new UnsupportedFeatureException(dialect.id(), SqlFeature.ON_CONFLICT,
          "Conflict predicates cannot be expressed in dialect: " + dialect.id());
    }
    boolean insertIgnore = ignore || oc.doNothing();
    if (insertIgnore) dialect.requireFeature(SqlFeature.INSERT_IGNORE);
    if (oc.doNothing()) return new Plan(true, null, List.of());
    dialect.requireFeature(SqlFeature.ON_DUPLICATE_KEY_UPDATE);
    return new Plan(insertIgnore, null, oc.updates());
  }

  void render(Plan plan) {
    if (plan.onConflict() != null) {
      out.append(" ");
      renderOnConflict(plan.onConflict());
    }
    if (!plan.duplicateKeyUpdates().isEmpty()) {
      out.append(" ");
      renderOnDuplicateKeyUpdate(plan.duplicateKeyUpdates());
    }
  }

  void renderOnConflict(OnConflictNode oc) {
    checkOutcome(oc);
    checkTarget(oc);

    out.append("on conflict");
    if (!oc.columns().isEmpty()) {
      out.append(" (");
      out.join(oc.columns(), ", ");
      out.append(")");
    } else if (oc.constraint() != null) {
      out.append(" on constraint ").append(dialect.quoteIdentifier(oc.constraint()));
    }
    if (oc.indexWhere() != null) {
      out.append(" ");
      oc.indexWhere().accept(out);
    }
    if (oc.doNothing()) {
      out.append(" do nothing");
      return;
    }
    out.append(" do update set ");
    out.join(oc.updates(), ", ");
    if (oc.updateWhere() != null) {
      out.append(" ");
      oc.updateWhere().accept(out);
    }
  }

  void renderOnDuplicateKeyUpdate(List<ColumnUpdateNode> updates) {
    dialect.requireFeature(SqlFeature.ON_DUPLICATE_KEY_UPDATE);
    if (updates.isEmpty()) throw new MalformedTreeException("On duplicate key update has no assignments");
    out.append("on duplicate key update ");
    out.join(updates, ", ");
  }

  private static void checkOutcome(OnConflictNode oc) {
    if (oc.doNothing() == !oc.updates().isEmpty()) {
      if (oc.doNothing()) throw new MalformedTreeException("On conflict cannot both do nothing and update");
      throw new MalformedTreeException("On conflict needs doNothing() or doUpdateSet(...)");
    }
    if (oc.doNothing() && oc.updateWhere() != null) {
      throw new MalformedTreeException("On conflict do nothing cannot have an update predicate");
    }
  }

  /** Native form only. */
  private void checkTarget(OnConflictNode oc) {
    dialect.requireFeature(SqlFeature.ON_CONFLICT);
    if (!oc.columns().isEmpty() && oc.constraint() != null) {
      throw new MalformedTreeException("On conflict target cannot be both columns and a constraint");
    }
    if (oc.constraint() != null) dialect.requireFeature(SqlFeature.ON_CONFLICT_CONSTRAINT);
    if (oc.indexWhere() != null && oc.columns().isEmpty()) {
      throw new MalformedTreeException("On conflict index predicate requires target columns");
    }
    if (!oc.doNothing() && !oc.hasTarget()) {
      throw new MalformedTreeException("On conflict do update requires a conflict target");
    }
  }
}
