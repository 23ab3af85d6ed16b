package io.intellixity.sqlforge.jdbc.sqlite;

import io.intellixity.sqlforge.jdbc.DeleteResult;
import io.intellixity.sqlforge.jdbc.InsertResult;
import io.intellixity.sqlforge.jdbc.JdbcQueryExecutor;
import io.intellixity.sqlforge.jdbc.SqlExecutionException;
import io.intellixity.sqlforge.jdbc.UpdateResult;
import io.intellixity.sqlforge.node.OrderByItemNode.Direction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.intellixity.sqlforge.builder.QueryBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

/** Runs compiled statements against a file-backed SQLite database. */
final class SqliteQueryExecutorTest {
  @TempDir
  Path dir;

  private JdbcQueryExecutor db;

  @BeforeEach
  void setUp() {
    SQLiteDataSource ds = new SQLiteDataSource();
    ds.setUrl("jdbc:sqlite:" + dir.resolve("test.db"));
    db = new JdbcQueryExecutor(ds, new SqliteDialect());

    db.execute(raw("create table person (id integer primary key autoincrement, first_name text not null, "
        + "last_name text, gender text)"));
    db.execute(raw("create table pet (id integer primary key autoincrement, name text not null unique, "
        + "owner_id integer not null, species text not null)"));

    db.executeInsert(insertInto("person").values(List.of(
        row("first_name", "Jennifer", "last_name", "Aniston", "gender", "female"),
        row("first_name", "Arnold", "last_name", "Schwarzenegger", "gender", "male"))));
    db.executeInsert(insertInto("pet").values(row("name", "Catto", "owner_id", 1, "species", "cat")));
  }

  @Test
  void insertsAndReportsRowCount() {
    InsertResult r = db.executeInsert(insertInto("person")
        .values(row("id", GENERATED, "first_name", "Foo", "last_name", "Barson", "gender", "other")));

    assertEquals(1, r.numInsertedRows());
    Optional<Map<String, Object>> foo = db.executeTakeFirst(
        selectFrom("person").select("id", "last_name").where("first_name", "=", "Foo"));
    assertEquals("Barson", foo.orElseThrow().get("last_name"));
    assertNotNull(r.insertId());
    assertEquals(3L, r.insertId());
    assertEquals(r.insertId(), ((Number) foo.orElseThrow().get("id")).longValue());
  }

  @Test
  void returningClauseLeavesInsertIdUnset() {
    InsertResult r = db.executeInsert(insertInto("person")
        .values(row("first_name", "Foo", "last_name", "Barson", "gender", "other"))
        .returningAll());

    assertEquals(1, r.numInsertedRows());
    assertNull(r.insertId());
  }

  @Test
  void returningAllGivesInsertedRows() {
    List<Map<String, Object>> rows = db.executeQuery(insertInto("person")
        .values(List.of(
            row("first_name", "Foo", "last_name", "Barson", "gender", "other"),
            row("first_name", "Baz", "last_name", "Spam", "gender", "other")))
        .returningAll());

    assertEquals(2, rows.size());
    assertEquals("Foo", rows.get(0).get("first_name"));
    assertEquals("Spam", rows.get(1).get("last_name"));
    assertTrue(rows.get(0).containsKey("id"));
  }

  @Test
  void onConflictDoNothingInsertsNothing() {
    InsertResult r = db.executeInsert(insertInto("pet")
        .values(row("name", "Catto", "owner_id", 2, "species", "hamster"))
        .onConflict(oc -> oc.column("name").doNothing()));

    assertEquals(0, r.numInsertedRows());
    Map<String, Object> pet = db.executeTakeFirst(selectFrom("pet").select("species").where("name", "=", "Catto"))
        .orElseThrow();
    assertEquals("cat", pet.get("species"));
  }

  @Test
  void onConflictDoUpdateUsesExcludedRow() {
    db.executeInsert(insertInto("pet")
        .values(row("name", "Catto", "owner_id", 1, "species", "hamster"))
        .onConflict(oc -> oc.column("name")
            .doUpdateSet(Map.of("species", ref("excluded.species")))
            .where("excluded.species", "!=", "dog")));

    Map<String, Object> pet = db.executeTakeFirst(selectFrom("pet").select("species").where("name", "=", "Catto"))
        .orElseThrow();
    assertEquals("hamster", pet.get("species"));
  }

  @Test
  void insertsResultOfSelect() {
    db.executeInsert(insertInto("person")
        .columns(List.of("first_name", "gender"))
        .expression(selectFrom("pet").select(ref("name"), raw("?", "other").as("gender"))));

    List<Map<String, Object>> rows = db.executeQuery(selectFrom("person")
        .select("first_name", "gender")
        .where("gender", "=", "other"));
    assertEquals(1, rows.size());
    assertEquals("Catto", rows.get(0).get("first_name"));
  }

  @Test
  void updatesAndDeletes() {
    UpdateResult u = db.executeUpdate(updateTable("person").set("gender", "other").where("gender", "=", "male"));
    assertEquals(1, u.numUpdatedRows());

    DeleteResult del = db.executeDelete(deleteFrom("person").where("first_name", "in", List.of("Jennifer", "Nobody")));
    assertEquals(1, del.numDeletedRows());

    List<Map<String, Object>> rest = db.executeQuery(selectFrom("person").select("first_name", "gender"));
    assertEquals(1, rest.size());
    assertEquals("Arnold", rest.get(0).get("first_name"));
    assertEquals("other", rest.get(0).get("gender"));
  }

  @Test
  void joinsOrdersAndLimits() {
    List<Map<String, Object>> rows = db.executeQuery(selectFrom("person")
        .select("person.first_name", "pet.name as pet_name")
        .leftJoin("pet", "pet.owner_id", "person.id")
        .orderBy("person.first_name", Direction.ASC)
        .limit(1));

    assertEquals(1, rows.size());
    assertEquals("Arnold", rows.get(0).get("first_name"));
    assertNull(rows.get(0).get("pet_name"));
  }

  @Test
  void rejectsWrongStatementKind() {
    assertThrows(IllegalArgumentException.class, () -> db.executeUpdate(deleteFrom("person")));
    assertThrows(IllegalArgumentException.class, () -> db.executeQuery(deleteFrom("person")));
  }

  @Test
  void wrapsDriverErrors() {
    SqlExecutionException ex = assertThrows(SqlExecutionException.class,
        () -> db.executeQuery(selectFrom("no_such_table").selectAll()));
    assertTrue(ex.getMessage().contains("no_such_table"));
    assertNotNull(ex.getCause());
  }
}
