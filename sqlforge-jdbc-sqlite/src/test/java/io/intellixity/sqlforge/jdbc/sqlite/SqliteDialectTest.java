package io.intellixity.sqlforge.jdbc.sqlite;

import io.intellixity.sqlforge.spi.CompiledQuery;
import io.intellixity.sqlforge.spi.MalformedTreeException;
import io.intellixity.sqlforge.spi.SqlFeature;
import io.intellixity.sqlforge.spi.UnsupportedFeatureException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.intellixity.sqlforge.builder.QueryBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

final class SqliteDialectTest {
  private final SqliteDialect d = new SqliteDialect();

  @Test
  void insertsOneRow() {
    CompiledQuery q = d.compile(insertInto("person")
        .values(row("first_name", "Foo", "last_name", "Barson", "gender", "other")));

    assertEquals("insert into \"person\" (\"first_name\", \"last_name\", \"gender\") values (?, ?, ?)", q.sql());
  }

  @Test
  void insertsComplexValues() {
    CompiledQuery q = d.compile(insertInto("person").values(row(
        "first_name", selectFrom("pet").select(raw("max(name)").as("max_name")),
        "last_name", raw("'Bar' || 'son'"),
        "gender", "other")));

    assertEquals("insert into \"person\" (\"first_name\", \"last_name\", \"gender\") values "
        + "((select max(name) as \"max_name\" from \"pet\"), 'Bar' || 'son', ?)", q.sql());
    assertEquals(List.of("other"), q.parameters());
  }

  @Test
  void onConflictDoNothingAndDoUpdate() {
    CompiledQuery nothing = d.compile(insertInto("pet")
        .values(row("name", "Catto", "owner_id", 1, "species", "cat"))
        .onConflict(oc -> oc.column("name").doNothing()));
    assertEquals("insert into \"pet\" (\"name\", \"owner_id\", \"species\") values (?, ?, ?) "
        + "on conflict (\"name\") do nothing", nothing.sql());

    CompiledQuery update = d.compile(insertInto("pet")
        .values(row("name", "Catto", "owner_id", 1, "species", "cat"))
        .onConflict(oc -> oc.columns(List.of("name")).doUpdateSet(Map.of("species", "hamster"))));
    assertEquals("insert into \"pet\" (\"name\", \"owner_id\", \"species\") values (?, ?, ?) "
        + "on conflict (\"name\") do update set \"species\" = ?", update.sql());
    assertEquals(List.of("Catto", 1, "cat", "hamster"), update.parameters());
  }

  @Test
  void onConflictPredicatesAreSupported() {
    CompiledQuery q = d.compile(insertInto("pet")
        .values(row("name", "Catto", "owner_id", 1, "species", "cat"))
        .onConflict(oc -> oc.column("name")
            .where("name", "=", "Catto")
            .doUpdateSet(Map.of("species", "hamster"))
            .where("excluded.name", "!=", "Doggo"))
        .returningAll());

    assertEquals("insert into \"pet\" (\"name\", \"owner_id\", \"species\") values (?, ?, ?) "
        + "on conflict (\"name\") where \"name\" = ? do update set \"species\" = ? "
        + "where \"excluded\".\"name\" != ? returning *", q.sql());
    assertEquals(List.of("Catto", 1, "cat", "Catto", "hamster", "Doggo"), q.parameters());
  }

  @Test
  void rejectsNamedConstraint() {
    UnsupportedFeatureException ex = assertThrows(UnsupportedFeatureException.class, () -> d.compile(
        insertInto("pet").values(row("name", "Catto")).onConflict(oc -> oc.constraint("pet_name_key").doNothing())));

    assertEquals(SqlFeature.ON_CONFLICT_CONSTRAINT, ex.feature());
    assertEquals("sqlite", ex.dialectId());
  }

  @Test
  void ignoreMapsToOnConflictDoNothing() {
    CompiledQuery q = d.compile(insertInto("pet").values(row("name", "Catto")).ignore());
    assertEquals("insert into \"pet\" (\"name\") values (?) on conflict do nothing", q.sql());

    assertThrows(UnsupportedFeatureException.class, () -> d.compile(
        insertInto("pet").values(row("name", "Catto")).onDuplicateKeyUpdate(Map.of("species", "hamster"))));
  }

  @Test
  void escapedQuestionMarkInRawSqlIsRejected() {
    MalformedTreeException ex = assertThrows(MalformedTreeException.class,
        () -> d.compile(raw("select ?? as a, ? as b", 7)));
    assertTrue(ex.getMessage().contains("sqlite"));

    CompiledQuery q = d.compile(raw("select ? as a, ? as b", 7, 8));
    assertEquals("select ? as a, ? as b", q.sql());
    assertEquals(List.of(7, 8), q.parameters());
  }
}
