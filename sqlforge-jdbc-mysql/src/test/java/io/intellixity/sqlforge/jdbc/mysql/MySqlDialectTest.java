package io.intellixity.sqlforge.jdbc.mysql;

import io.intellixity.sqlforge.spi.CompiledQuery;
import io.intellixity.sqlforge.spi.MalformedTreeException;
import io.intellixity.sqlforge.spi.SqlFeature;
import io.intellixity.sqlforge.spi.UnsupportedFeatureException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.intellixity.sqlforge.builder.QueryBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

final class MySqlDialectTest {
  private final MySqlDialect d = new MySqlDialect();

  @Test
  void insertsOneRowWithBackticksAndQuestionMarks() {
    CompiledQuery q = d.compile(insertInto("person")
        .values(row("id", GENERATED, "first_name", "Foo", "last_name", "Barson", "gender", "other")));

    assertEquals("insert into `person` (`first_name`, `last_name`, `gender`) values (?, ?, ?)", q.sql());
    assertEquals(List.of("Foo", "Barson", "other"), q.parameters());
  }

  @Test
  void insertsTwoRowsInColumnOrder() {
    CompiledQuery q = d.compile(insertInto("person").values(List.of(
        row("id", GENERATED, "first_name", "Foo", "last_name", "Barson", "gender", "other"),
        row("gender", "female", "last_name", "Bazson", "first_name", "Baz", "id", GENERATED))));

    assertEquals("insert into `person` (`first_name`, `last_name`, `gender`) values (?, ?, ?), (?, ?, ?)",
        q.sql());
    assertEquals(List.of("Foo", "Barson", "other", "Baz", "Bazson", "female"), q.parameters());
  }

  @Test
  void escapedQuestionMarkInRawSqlIsRejected() {
    assertThrows(MalformedTreeException.class, () -> d.compile(raw("select ?? as a, ? as b", 7)));

    CompiledQuery q = d.compile(raw("select '??' as a, ? as b", 7));
    assertEquals("select '??' as a, ? as b", q.sql());
    assertEquals(List.of(7), q.parameters());
  }

  @Test
  void insertsComplexValues() {
    CompiledQuery q = d.compile(insertInto("person").values(row(
        "first_name", selectFrom("pet").select(raw("max(name)").as("max_name")),
        "last_name", raw("concat('Bar', 'son')"),
        "gender", "other")));

    assertEquals("insert into `person` (`first_name`, `last_name`, `gender`) values "
        + "((select max(name) as `max_name` from `pet`), concat('Bar', 'son'), ?)", q.sql());
    assertEquals(List.of("other"), q.parameters());
  }

  @Test
  void insertsResultOfSelect() {
    CompiledQuery q = d.compile(insertInto("person")
        .columns(List.of("first_name", "gender"))
        .expression(selectFrom("pet").select(ref("name"), raw("?", "other").as("gender"))));

    assertEquals("insert into `person` (`first_name`, `gender`) select `name`, ? as `gender` from `pet`", q.sql());
  }

  @Test
  void insertIgnore() {
    CompiledQuery q = d.compile(insertInto("pet")
        .values(row("name", "Catto", "owner_id", 1, "species", "cat"))
        .ignore());

    assertEquals("insert ignore into `pet` (`name`, `owner_id`, `species`) values (?, ?, ?)", q.sql());
    assertEquals(List.of("Catto", 1, "cat"), q.parameters());
  }

  @Test
  void onDuplicateKeyUpdate() {
    CompiledQuery q = d.compile(insertInto("pet")
        .values(row("name", "Catto", "owner_id", 1, "species", "cat"))
        .onDuplicateKeyUpdate(Map.of("species", "hamster")));

    assertEquals("insert into `pet` (`name`, `owner_id`, `species`) values (?, ?, ?) "
        + "on duplicate key update `species` = ?", q.sql());
    assertEquals(List.of("Catto", 1, "cat", "hamster"), q.parameters());
  }

  @Test
  void untargetedOnConflictMapsToNativeForms() {
    CompiledQuery nothing = d.compile(insertInto("pet")
        .values(row("name", "Catto"))
        .onConflict(oc -> oc.doNothing()));
    assertEquals("insert ignore into `pet` (`name`) values (?)", nothing.sql());

    CompiledQuery update = d.compile(insertInto("pet")
        .values(row("name", "Catto"))
        .onConflict(oc -> oc.doUpdateSet(Map.of("species", "hamster"))));
    assertEquals("insert into `pet` (`name`) values (?) on duplicate key update `species` = ?", update.sql());
    assertEquals(List.of("Catto", "hamster"), update.parameters());
  }

  @Test
  void rejectsConflictTargets() {
    UnsupportedFeatureException byColumn = assertThrows(UnsupportedFeatureException.class, () -> d.compile(
        insertInto("pet").values(row("name", "Catto")).onConflict(oc -> oc.column("name").doNothing())));
    assertEquals(SqlFeature.ON_CONFLICT, byColumn.feature());
    assertEquals("mysql", byColumn.dialectId());

    UnsupportedFeatureException byConstraint = assertThrows(UnsupportedFeatureException.class, () -> d.compile(
        insertInto("pet").values(row("name", "Catto")).onConflict(oc -> oc.constraint("pet_name_key").doNothing())));
    assertEquals(SqlFeature.ON_CONFLICT_CONSTRAINT, byConstraint.feature());
  }

  @Test
  void rejectsConflictPredicates() {
    assertThrows(UnsupportedFeatureException.class, () -> d.compile(insertInto("pet")
        .values(row("name", "Catto"))
        .onConflict(oc -> oc.doUpdateSet(Map.of("species", "hamster")).where("excluded.name", "!=", "Doggo"))));
  }

  @Test
  void rejectsReturning() {
    UnsupportedFeatureException ex = assertThrows(UnsupportedFeatureException.class,
        () -> d.compile(insertInto("person").values(row("first_name", "Foo")).returningAll()));
    assertEquals(SqlFeature.RETURNING, ex.feature());

    assertThrows(UnsupportedFeatureException.class,
        () -> d.compile(deleteFrom("person").where("id", "=", 1).returning("id")));
  }

  @Test
  void rejectsFullJoin() {
    UnsupportedFeatureException ex = assertThrows(UnsupportedFeatureException.class,
        () -> d.compile(selectFrom("person").selectAll().fullJoin("pet", "pet.owner_id", "person.id")));
    assertEquals(SqlFeature.FULL_JOIN, ex.feature());
  }

  @Test
  void onConflictAndOnDuplicateKeyUpdateCannotBeCombined() {
    assertThrows(MalformedTreeException.class, () -> d.compile(insertInto("pet")
        .values(row("name", "Catto"))
        .onConflict(oc -> oc.doNothing())
        .onDuplicateKeyUpdate(Map.of("species", "hamster"))));
  }

  @Test
  void quotesEmbeddedBacktick() {
    CompiledQuery q = d.compile(selectFrom("odd`table").select("we`ird"));
    assertEquals("select `we``ird` from `odd``table`", q.sql());
  }

  @Test
  void selectsWithJoinAndSubqueryFilter() {
    CompiledQuery q = d.compile(selectFrom("person")
        .select("person.first_name")
        .innerJoin("pet", "pet.owner_id", "person.id")
        .where("pet.species", "in", List.of("cat", "dog"))
        .whereExists(selectFrom("toy").selectAll().whereRef("toy.pet_id", "=", "pet.id"))
        .limit(3));

    assertEquals("select `person`.`first_name` from `person` inner join `pet` on `pet`.`owner_id` = `person`.`id` "
        + "where `pet`.`species` in (?, ?) and exists (select * from `toy` where `toy`.`pet_id` = `pet`.`id`) "
        + "limit ?", q.sql());
    assertEquals(List.of("cat", "dog", 3L), q.parameters());
  }
}
