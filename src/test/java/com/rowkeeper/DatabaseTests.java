/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rowkeeper;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class DatabaseTests {
	@Test
	public void testInsert() {
		FakeTransport transport = employeeTransport()
				.respond("INSERT INTO", FakeTransport.rows(List.of("id", "name", "active", "hired"),
						List.of(1, "Ada", true, "2024-01-15")));
		Database database = Database.withTransport(transport).build();

		Map<String, Object> employee = record("name", "Ada", "active", "yes", "nickname", "Countess");
		Map<String, Object> inserted = database.insert("employee", employee);

		Assertions.assertSame(employee, inserted, "Insert should update the given record in place");
		Assertions.assertEquals("INSERT INTO \"employee\" (\"name\", \"active\") VALUES ($1, $2) RETURNING *",
				transport.lastStatement().getSql());
		Assertions.assertEquals(List.of("Ada", "t"), transport.lastStatement().getParameters());
		Assertions.assertEquals(1, employee.get("id"));
		Assertions.assertEquals(true, employee.get("active"));
		Assertions.assertEquals("2024-01-15", employee.get("hired"));
		Assertions.assertEquals("Countess", employee.get("nickname"), "Non-column entries should be left alone");
	}

	@Test
	public void testInsertDefaults() {
		FakeTransport transport = employeeTransport()
				.respond("INSERT INTO", FakeTransport.rows(List.of("id", "name", "active", "hired"),
						Arrays.asList(7, null, false, null)));
		Database database = Database.withTransport(transport).build();

		Map<String, Object> employee = database.insert("employee");

		Assertions.assertEquals("INSERT INTO \"employee\" DEFAULT VALUES RETURNING *", transport.lastStatement().getSql());
		Assertions.assertEquals(7, employee.get("id"));
		Assertions.assertTrue(employee.containsKey("name"));
	}

	@Test
	public void testInsertThenGetByKey() {
		List<String> columnNames = List.of("id", "name", "active", "hired");
		Map<Object, List<Object>> stored = new LinkedHashMap<>();
		FakeTransport transport = employeeTransport()
				.respond((sql, parameters) -> sql.startsWith("INSERT INTO"), (parameters) -> {
					// Server assigns the id and fills in the column defaults
					List<Object> row = Arrays.asList(stored.size() + 1, parameters.get(0), true, "2024-01-15");
					stored.put(row.get(0), row);
					return FakeTransport.rows(columnNames, row);
				})
				.respond((sql, parameters) -> sql.contains("LIMIT 1"), (parameters) ->
						stored.containsKey(parameters.get(0))
								? FakeTransport.rows(columnNames, stored.get(parameters.get(0)))
								: FakeTransport.rows(columnNames));
		Database database = Database.withTransport(transport).build();

		Map<String, Object> inserted = database.insert("employee", record("name", "Ada"));
		Map<String, Object> fetched = database.getByKey("employee", inserted.get("id"));

		Assertions.assertEquals(1, inserted.get("id"));
		Assertions.assertEquals(true, inserted.get("active"), "Server defaults should be populated on insert");
		Assertions.assertEquals("2024-01-15", inserted.get("hired"));
		Assertions.assertEquals(inserted, fetched);
	}

	@Test
	public void testInsertAbsentValuesBecomeNull() {
		FakeTransport transport = employeeTransport();
		Database database = Database.withTransport(transport).build();

		database.insert("employee", record("id", "", "hired", "", "active", ""));

		Assertions.assertEquals("INSERT INTO \"employee\" (\"id\", \"active\", \"hired\") VALUES (NULL, NULL, NULL) RETURNING *",
				transport.lastStatement().getSql());
		Assertions.assertEquals(List.of(), transport.lastStatement().getParameters());
	}

	@Test
	public void testInsertDateKeyword() {
		FakeTransport transport = employeeTransport();
		Database database = Database.withTransport(transport).build();

		database.insert("employee", record("name", "Ada", "hired", "current_date"));

		Assertions.assertEquals("INSERT INTO \"employee\" (\"name\", \"hired\") VALUES ($1, current_date) RETURNING *",
				transport.lastStatement().getSql());
		Assertions.assertEquals(List.of("Ada"), transport.lastStatement().getParameters());
	}

	@Test
	public void testMetadataIsCached() {
		FakeTransport transport = employeeTransport();
		Database database = Database.withTransport(transport).build();

		database.insert("employee", record("name", "Ada"));
		database.insert("employee", record("name", "Bea"));
		database.update("employee", record("id", 1, "name", "Cid"));
		database.update("employee", record("id", 2, "name", "Dee"));

		Assertions.assertEquals(1, transport.statementsContaining("FROM pg_attribute a").size());
		Assertions.assertEquals(1, transport.statementsContaining("i.indisprimary").size());
	}

	@Test
	public void testUpdate() {
		FakeTransport transport = employeeTransport()
				.respond("UPDATE", FakeTransport.rows(List.of("id", "name", "active", "hired"),
						List.of(1, "Bea", false, "2024-01-15")));
		Database database = Database.withTransport(transport).build();

		Map<String, Object> employee = record("id", 1, "name", "Bea");
		database.update("employee", employee);

		Assertions.assertEquals("UPDATE \"employee\" SET \"name\" = $2 WHERE \"id\" = $1 RETURNING *",
				transport.lastStatement().getSql());
		Assertions.assertEquals(List.of(1, "Bea"), transport.lastStatement().getParameters());
		Assertions.assertEquals(false, employee.get("active"));
	}

	@Test
	public void testUpdateNoMatchLeavesRecordUnchanged() {
		FakeTransport transport = employeeTransport();
		Database database = Database.withTransport(transport).build();

		Map<String, Object> employee = record("id", 99, "name", "Nobody");
		database.update("employee", employee);

		Assertions.assertEquals(record("id", 99, "name", "Nobody"), employee);
	}

	@Test
	public void testUpdateRequiresKeyValues() {
		FakeTransport transport = employeeTransport();
		Database database = Database.withTransport(transport).build();

		database.getAttributes("employee");
		database.primaryKey("employee");
		int statementCount = transport.getStatements().size();

		Assertions.assertThrows(IllegalArgumentException.class, () -> database.update("employee", record("name", "Ada")));
		Assertions.assertEquals(statementCount, transport.getStatements().size(), "No SQL should be sent for invalid input");
	}

	@Test
	public void testGet() {
		FakeTransport transport = employeeTransport()
				.respond("LIMIT 1", FakeTransport.rows(List.of("id", "name", "active", "hired"),
						List.of(3, "Cid", true, "2023-05-01")));
		Database database = Database.withTransport(transport).build();

		Map<String, Object> employee = database.getByKey("employee", 3);

		Assertions.assertEquals("SELECT * FROM \"employee\" WHERE \"id\" = $1 LIMIT 1", transport.lastStatement().getSql());
		Assertions.assertEquals(List.of(3), transport.lastStatement().getParameters());
		Assertions.assertEquals(List.of("id", "name", "active", "hired"), new ArrayList<>(employee.keySet()));
		Assertions.assertEquals("Cid", employee.get("name"));
	}

	@Test
	public void testGetByOtherKey() {
		FakeTransport transport = employeeTransport()
				.respond("LIMIT 1", FakeTransport.rows(List.of("id", "name", "active", "hired"),
						List.of(3, "Cid", true, "2023-05-01")));
		Database database = Database.withTransport(transport).build();

		Map<String, Object> employee = record("name", "Cid");
		database.get("employee", employee, List.of("name"));

		Assertions.assertEquals("SELECT * FROM \"employee\" WHERE \"name\" = $1 LIMIT 1", transport.lastStatement().getSql());
		Assertions.assertEquals(3, employee.get("id"));
	}

	@Test
	public void testGetMissingRecord() {
		FakeTransport transport = employeeTransport();
		Database database = Database.withTransport(transport).build();

		NoSuchRecordException e = Assertions.assertThrows(NoSuchRecordException.class,
				() -> database.getByKey("employee", 42));

		Assertions.assertEquals("No such record in employee\nwhere \"id\" = $1\nwith $1=42", e.getMessage());
		Assertions.assertTrue(e instanceof NotFoundException);
		Assertions.assertEquals("employee", e.getTableName());
		Assertions.assertEquals("\"id\" = $1", e.getWhereClause());
	}

	@Test
	public void testGetByKeyValueCountMismatch() {
		FakeTransport transport = employeeTransport();
		Database database = Database.withTransport(transport).build();

		Assertions.assertThrows(IllegalArgumentException.class, () -> database.getByKey("employee", 1, 2));
	}

	@Test
	public void testCompositeKey() {
		FakeTransport transport = new FakeTransport()
				.attributes("assignment", "employee_id", "int4", "project_id", "int4", "role", "text")
				.primaryKey("assignment", "employee_id", "project_id")
				.respond("LIMIT 1", FakeTransport.rows(List.of("employee_id", "project_id", "role"), List.of(1, 2, "lead")));
		Database database = Database.withTransport(transport).build();

		Map<String, Object> assignment = database.getByKey("assignment", 1, 2);

		Assertions.assertEquals("SELECT * FROM \"assignment\" WHERE \"employee_id\" = $1 AND \"project_id\" = $2 LIMIT 1",
				transport.lastStatement().getSql());
		Assertions.assertEquals("lead", assignment.get("role"));
		Assertions.assertEquals(PrimaryKey.of(List.of("employee_id", "project_id")), database.primaryKey("assignment"));
	}

	@Test
	public void testDeleteByCompositeKeyWithoutMatch() {
		FakeTransport transport = new FakeTransport()
				.attributes("assignment", "employee_id", "int4", "project_id", "int4", "role", "text")
				.primaryKey("assignment", "employee_id", "project_id")
				.respond("DELETE FROM", QueryResult.withUpdateCount(0));
		Database database = Database.withTransport(transport).build();

		long deleted = database.delete("assignment", record("employee_id", 1, "project_id", 99));

		Assertions.assertEquals(0L, deleted, "Deleting a missing row is not an error");
		Assertions.assertEquals("DELETE FROM \"assignment\" WHERE \"employee_id\" = $1 AND \"project_id\" = $2",
				transport.lastStatement().getSql());
		Assertions.assertEquals(List.of(1, 99), transport.lastStatement().getParameters());
	}

	@Test
	public void testNoPrimaryKey() {
		FakeTransport transport = new FakeTransport().attributes("log", "message", "text");
		Database database = Database.withTransport(transport).build();

		NoPrimaryKeyException e = Assertions.assertThrows(NoPrimaryKeyException.class, () -> database.primaryKey("log"));
		Assertions.assertEquals("log", e.getTableName());
		Assertions.assertThrows(NoPrimaryKeyException.class, () -> database.delete("log", record("message", "x")));
		Assertions.assertEquals(1, transport.statementsContaining("i.indisprimary").size(),
				"A missing primary key should be cached too");
	}

	@Test
	public void testUpsert() {
		FakeTransport transport = employeeTransport()
				.respond("ON CONFLICT", FakeTransport.rows(List.of("id", "name", "active", "hired"),
						List.of(1, "Ada", true, "2024-01-15")));
		Database database = Database.withTransport(transport).build();

		Map<String, Object> employee = record("id", 1, "name", "Ada");
		database.upsert("employee", employee);

		Assertions.assertEquals("INSERT INTO \"employee\" AS included (\"id\", \"name\") VALUES ($1, $2)"
						+ " ON CONFLICT (\"id\") DO UPDATE SET \"name\" = excluded.\"name\" RETURNING *",
				transport.lastStatement().getSql());
		Assertions.assertEquals(true, employee.get("active"));
	}

	@Test
	public void testUpsertWithUpdateExpressions() {
		FakeTransport transport = employeeTransport();
		Database database = Database.withTransport(transport).build();

		Map<String, Object> updates = new LinkedHashMap<>();
		updates.put("name", false);
		updates.put("active", "included.active AND excluded.active");
		updates.put("hired", true);

		database.upsert("employee", record("id", 1, "name", "Ada", "active", true), updates);

		Statement upsert = transport.statementsContaining("ON CONFLICT").get(0);

		Assertions.assertEquals("INSERT INTO \"employee\" AS included (\"id\", \"name\", \"active\") VALUES ($1, $2, $3)"
						+ " ON CONFLICT (\"id\") DO UPDATE SET \"active\" = included.active AND excluded.active,"
						+ " \"hired\" = excluded.\"hired\" RETURNING *",
				upsert.getSql());
	}

	@Test
	public void testUpsertNothingToUpdate() {
		FakeTransport transport = employeeTransport()
				.respond("LIMIT 1", FakeTransport.rows(List.of("id", "name", "active", "hired"),
						List.of(1, "Ada", true, "2024-01-15")));
		Database database = Database.withTransport(transport).build();

		Map<String, Object> employee = database.upsert("employee", record("id", 1));

		Assertions.assertTrue(transport.statementsContaining("ON CONFLICT").get(0).getSql().contains("DO NOTHING"));
		Assertions.assertEquals("Ada", employee.get("name"), "The existing row should be read back");
	}

	@Test
	public void testUpsertNotSupported() {
		FakeTransport transport = employeeTransport()
				.fail("ON CONFLICT", DatabaseException.withSqlState("syntax error at or near \"ON\"", "42601"))
				.serverVersionNumber(90400);
		Database database = Database.withTransport(transport).build();

		UpsertNotSupportedException e = Assertions.assertThrows(UpsertNotSupportedException.class,
				() -> database.upsert("employee", record("id", 1, "name", "Ada")));

		Assertions.assertEquals(90400, e.getServerVersionNumber());
		Assertions.assertEquals(Optional.of("42601"), e.getSqlState());
	}

	@Test
	public void testUpsertFailureOnRecentServer() {
		DatabaseException failure = DatabaseException.withSqlState("syntax error", "42601");
		FakeTransport transport = employeeTransport()
				.fail("ON CONFLICT", failure)
				.serverVersionNumber(150000);
		Database database = Database.withTransport(transport).build();

		DatabaseException e = Assertions.assertThrows(DatabaseException.class,
				() -> database.upsert("employee", record("id", 1, "name", "Ada")));

		Assertions.assertSame(failure, e);
	}

	@Test
	public void testUpsertFailureInAbortedTransaction() {
		DatabaseException failure = DatabaseException.withSqlState("permission denied for table employee", "42501");
		DatabaseException aborted = DatabaseException.withSqlState(
				"current transaction is aborted, commands ignored until end of transaction block", "25P02");
		FakeTransport transport = employeeTransport()
				.fail("ON CONFLICT", failure)
				.failServerVersionNumber(aborted);
		Database database = Database.withTransport(transport).build();

		database.begin();

		DatabaseException e = Assertions.assertThrows(DatabaseException.class,
				() -> database.upsert("employee", record("id", 1, "name", "Ada")));

		Assertions.assertSame(failure, e, "The rejected upsert should surface, not the version lookup");
		Assertions.assertEquals(Optional.of("42501"), e.getSqlState());
		Assertions.assertEquals(List.of(aborted), Arrays.asList(e.getSuppressed()));
	}

	@Test
	public void testDelete() {
		FakeTransport transport = employeeTransport().respond("DELETE FROM", QueryResult.withUpdateCount(1));
		Database database = Database.withTransport(transport).build();

		long deleted = database.delete("employee", record("id", 5, "name", "Eve"));

		Assertions.assertEquals(1L, deleted);
		Assertions.assertEquals("DELETE FROM \"employee\" WHERE \"id\" = $1", transport.lastStatement().getSql());
		Assertions.assertEquals(List.of(5), transport.lastStatement().getParameters());
	}

	@Test
	public void testQualifiedAndDescendantTableNames() {
		FakeTransport transport = new FakeTransport()
				.attributes("hr.employee", "id", "int4", "name", "text")
				.attributes("employee", "id", "int4", "name", "text");
		Database database = Database.withTransport(transport).build();

		database.insert("hr.employee", record("name", "Ada"));
		Assertions.assertEquals("INSERT INTO hr.employee (\"name\") VALUES ($1) RETURNING *", transport.lastStatement().getSql());
		Assertions.assertTrue(transport.statementsContaining("FROM pg_attribute a").get(0).getSql().contains("a.attrelid = $1::regclass"));

		database.insert("employee *", record("name", "Bea"));
		Assertions.assertEquals("INSERT INTO \"employee\" (\"name\") VALUES ($1) RETURNING *", transport.lastStatement().getSql());
		Assertions.assertTrue(transport.statementsContaining("FROM pg_attribute a").get(1).getSql().contains("quote_ident($1)::regclass"));
	}

	@Test
	public void testOidRows() {
		FakeTransport transport = new FakeTransport()
				.attributes("legacy", "oid", "oid", "name", "text")
				.respond("INSERT INTO", FakeTransport.rows(List.of("oid", "name"), List.of(42L, "x")));
		Database database = Database.withTransport(transport).build();
		String oidKey = Database.oidKey("legacy");

		Map<String, Object> row = database.insert("legacy", record("name", "x", "oid", 7L));

		Assertions.assertEquals("oid(legacy)", oidKey);
		Assertions.assertEquals("INSERT INTO \"legacy\" (\"name\") VALUES ($1) RETURNING oid, *", transport.getStatements()
				.get(transport.getStatements().size() - 1).getSql());
		Assertions.assertEquals(42L, row.get(oidKey));
		Assertions.assertFalse(row.containsKey("oid"));

		row.put("name", "y");
		database.update("legacy", row);

		Assertions.assertEquals("UPDATE \"legacy\" SET \"name\" = $2 WHERE \"oid\" = $1 RETURNING oid, *",
				transport.lastStatement().getSql());
		Assertions.assertEquals(List.of(42L, "y"), transport.lastStatement().getParameters());
		Assertions.assertFalse(row.containsKey("oid"));

		Map<String, Object> stale = record("oid", 42L, "name", "z");
		Assertions.assertThrows(NoPrimaryKeyException.class, () -> database.update("legacy", stale),
				"A literal oid entry should not identify a row");
	}

	@Test
	public void testBinaryColumns() {
		FakeTransport transport = new FakeTransport()
				.attributes("blob", "id", "int4", "data", "bytea")
				.primaryKey("blob", "id")
				.respond("LIMIT 1", FakeTransport.rows(List.of("id", "data"), List.of(1, "\\x0102ff")));
		Database database = Database.withTransport(transport).build();

		database.update("blob", record("id", 1, "data", new byte[]{1, 2, (byte) 0xff}));
		Assertions.assertEquals(List.of(1, "\\x0102ff"), transport.lastStatement().getParameters());

		Map<String, Object> blob = database.getByKey("blob", 1);
		Assertions.assertArrayEquals(new byte[]{1, 2, (byte) 0xff}, (byte[]) blob.get("data"));
	}

	@Test
	public void testTruncate() {
		FakeTransport transport = new FakeTransport();
		Database database = Database.withTransport(transport).build();

		database.truncate("employee");
		Assertions.assertEquals("TRUNCATE \"employee\"", transport.lastStatement().getSql());

		database.truncate(List.of("employee", "project *", "hr.team"), true, true, List.of(true, false, false));
		Assertions.assertEquals("TRUNCATE ONLY \"employee\", \"project\", hr.team RESTART IDENTITY CASCADE",
				transport.lastStatement().getSql());

		Assertions.assertThrows(IllegalArgumentException.class,
				() -> database.truncate(List.of("project *"), false, false, List.of(true)));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> database.truncate(List.of("a", "b"), false, false, List.of(true)));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> database.truncate(List.of(), false, false, false));
		Assertions.assertEquals(2, transport.getStatements().size());
	}

	@Test
	public void testClear() {
		FakeTransport transport = new FakeTransport()
				.attributes("product", "id", "int4", "name", "varchar", "active", "bool", "price", "numeric", "added", "timestamptz");
		Database database = Database.withTransport(transport).build();

		Map<String, Object> product = database.clear("product");

		Assertions.assertEquals(record("id", 0, "name", "", "active", false, "price", 0, "added", ""), product);
	}

	@Test
	public void testAttributeTypeNames() {
		FakeTransport transport = employeeTransport();
		Database database = Database.withTransport(transport).build();

		Assertions.assertEquals(record("id", "int", "name", "text", "active", "bool", "hired", "date"),
				new LinkedHashMap<>(database.getAttributes("employee")));

		database.useRegularTypeNames(true);
		Assertions.assertTrue(database.isUsingRegularTypeNames());
		database.getAttributes("employee");

		List<Statement> lookups = transport.statementsContaining("FROM pg_attribute a");
		Assertions.assertEquals(2, lookups.size(), "Switching type names should flush the attribute cache");
		Assertions.assertTrue(lookups.get(1).getSql().contains("a.atttypid::regtype::text"));
	}

	@Test
	public void testTablePrivileges() {
		FakeTransport transport = new FakeTransport()
				.respond("has_table_privilege", FakeTransport.rows(List.of("has_table_privilege"), List.of(true)));
		Database database = Database.withTransport(transport).build();

		Assertions.assertTrue(database.hasTablePrivilege("employee", "INSERT"));
		Assertions.assertTrue(database.hasTablePrivilege("employee", "insert"));
		Assertions.assertEquals(1, transport.getStatements().size());
		Assertions.assertEquals(List.of("employee", "insert"), transport.lastStatement().getParameters());
	}

	@Test
	public void testTransaction() {
		FakeTransport transport = new FakeTransport();
		Database database = Database.withTransport(transport).build();

		Optional<Integer> result = database.transaction(() -> {
			database.query("SELECT 1");
			return Optional.of(1);
		});

		Assertions.assertEquals(Optional.of(1), result);
		Assertions.assertEquals(List.of("BEGIN", "SELECT 1", "COMMIT"), transport.getSql());
	}

	@Test
	public void testTransactionRollback() {
		FakeTransport transport = new FakeTransport();
		Database database = Database.withTransport(transport).build();

		IllegalStateException e = Assertions.assertThrows(IllegalStateException.class, () -> database.transaction((TransactionalOperation) () -> {
			database.query("DELETE FROM employee");
			throw new IllegalStateException("boom");
		}));

		Assertions.assertEquals("boom", e.getMessage());
		Assertions.assertEquals(List.of("BEGIN", "DELETE FROM employee", "ROLLBACK"), transport.getSql());
	}

	@Test
	public void testSavepointsAndIsolation() {
		FakeTransport transport = new FakeTransport();
		Database database = Database.withTransport(transport).build();

		database.begin(TransactionIsolation.SERIALIZABLE);
		database.savepoint("before");
		database.rollback("before");
		database.release("before");
		database.commit();

		Assertions.assertEquals(List.of("BEGIN ISOLATION LEVEL SERIALIZABLE", "SAVEPOINT \"before\"",
				"ROLLBACK TO SAVEPOINT \"before\"", "RELEASE SAVEPOINT \"before\"", "COMMIT"), transport.getSql());
	}

	@Test
	public void testParameters() {
		FakeTransport transport = new FakeTransport()
				.respond("current_setting", FakeTransport.rows(List.of("current_setting"), List.of("ISO, MDY")));
		Database database = Database.withTransport(transport).build();

		Assertions.assertEquals("ISO, MDY", database.getParameter("DateStyle"));
		Assertions.assertEquals(List.of("datestyle"), transport.lastStatement().getParameters());

		database.setParameter("DateStyle", "ISO, DMY", true);
		Assertions.assertEquals("SELECT set_config($1, $2, $3)", transport.lastStatement().getSql());
		Assertions.assertEquals(List.of("datestyle", "ISO, DMY", true), transport.lastStatement().getParameters());

		database.setParameter("datestyle", null, false);
		Assertions.assertEquals("RESET datestyle", transport.lastStatement().getSql());

		database.resetParameter("datestyle", true);
		Assertions.assertEquals("SET LOCAL datestyle TO DEFAULT", transport.lastStatement().getSql());

		Assertions.assertThrows(IllegalArgumentException.class, () -> database.setParameter("datestyle; drop table x", "ISO", false));
		Assertions.assertThrows(IllegalArgumentException.class, () -> database.getParameter("all"));
	}

	@Test
	public void testBulkParameters() {
		FakeTransport transport = new FakeTransport()
				.respond("current_setting", FakeTransport.rows(List.of("current_setting"), List.of("UTC")))
				.respond("SHOW ALL", FakeTransport.rows(List.of("name", "setting", "description"),
						List.of("datestyle", "ISO, MDY", "Sets the display format for date and time values."),
						Arrays.asList("timezone", null, "Sets the time zone.")));
		Database database = Database.withTransport(transport).build();

		Assertions.assertEquals(List.of("TimeZone", "lc_monetary"),
				new ArrayList<>(database.getParameters(List.of("TimeZone", "lc_monetary")).keySet()));

		Map<String, String> allParameters = database.getAllParameters();
		Assertions.assertEquals("ISO, MDY", allParameters.get("datestyle"));
		Assertions.assertTrue(allParameters.containsKey("timezone"));
		Assertions.assertNull(allParameters.get("timezone"));

		Map<String, String> settings = new LinkedHashMap<>();
		settings.put("TimeZone", "UTC");
		settings.put("search_path", null);

		database.setParameters(settings, false);
		Assertions.assertEquals(2, transport.statementsContaining("set_config").size()
				+ transport.statementsContaining("RESET search_path").size());

		database.resetAllParameters();
		Assertions.assertEquals("RESET ALL", transport.lastStatement().getSql());

		Assertions.assertThrows(IllegalArgumentException.class, () -> database.setParameters(Map.of(), true));
		Assertions.assertThrows(IllegalArgumentException.class, () -> database.getParameters(List.of()));
	}

	@Test
	public void testDatabases() {
		FakeTransport transport = new FakeTransport()
				.respond("FROM pg_database", FakeTransport.rows(List.of("datname"), List.of("postgres"), List.of("rowkeeper")));
		Database database = Database.withTransport(transport).build();

		Assertions.assertEquals(List.of("postgres", "rowkeeper"), database.getDatabases());
	}

	@Test
	public void testStatementLogging() {
		List<StatementLog> statementLogs = new ArrayList<>();
		FakeTransport transport = new FakeTransport()
				.fail("broken", DatabaseException.withSqlState("relation \"broken\" does not exist", "42P01"));
		Database database = Database.withTransport(transport)
				.statementLogger(statementLogs::add)
				.build();

		database.query("SELECT $1::int", 1);
		Assertions.assertThrows(DatabaseException.class, () -> database.query("SELECT * FROM broken"));

		Assertions.assertEquals(2, statementLogs.size());
		Assertions.assertEquals(Statement.of("SELECT $1::int", List.of(1)), statementLogs.get(0).getStatement());
		Assertions.assertTrue(statementLogs.get(0).getException().isEmpty());
		Assertions.assertTrue(statementLogs.get(0).getExecutionDuration().isPresent());
		Assertions.assertTrue(statementLogs.get(1).getException().isPresent());
	}

	@Test
	public void testClosedInstance() {
		FakeTransport transport = employeeTransport();
		Database database = Database.withTransport(transport).build();

		database.close();

		Assertions.assertTrue(database.isClosed());
		Assertions.assertTrue(transport.isOpen(), "A wrapped transport should not be closed");
		Assertions.assertThrows(InvalidConnectionException.class, () -> database.insert("employee", record("name", "Ada")));
		Assertions.assertThrows(InvalidConnectionException.class, () -> database.query("SELECT 1"));
		Assertions.assertThrows(IllegalStateException.class, database::reopen);
		Assertions.assertTrue(transport.getStatements().isEmpty());

		transport.close();
		Assertions.assertThrows(InvalidConnectionException.class, () -> Database.withTransport(transport).build());
	}

	@Test
	public void testRelations() {
		FakeTransport transport = new FakeTransport()
				.respond("FROM pg_class r", FakeTransport.rows(List.of("name"), List.of("public.employee"), List.of("public.project")));
		Database database = Database.withTransport(transport).build();

		Assertions.assertEquals(List.of("public.employee", "public.project"), database.getTables());
		Assertions.assertTrue(transport.lastStatement().getSql().contains("r.relkind IN ('r')"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> database.getRelations("r'; --"));
	}

	@Test
	public void testTableQueryList() {
		FakeTransport transport = employeeTransport()
				.respond("FROM employee", FakeTransport.rows(List.of("id", "name"), List.of(1, "Ada"), List.of(2, "Bea")));
		Database database = Database.withTransport(transport).build();

		List<Map<String, Object>> employees = database.table("employee").fetchList();

		Assertions.assertEquals("SELECT * FROM employee ORDER BY \"id\"", transport.lastStatement().getSql());
		Assertions.assertEquals(2, employees.size());

		List<Object> names = database.table("employee")
				.columns("name")
				.where("active")
				.where("hired > $1", "2020-01-01")
				.limit(10)
				.offset(5)
				.fetchScalars();

		Assertions.assertEquals("SELECT name FROM employee WHERE (active) AND (hired > $1) ORDER BY name LIMIT 10 OFFSET 5",
				transport.lastStatement().getSql());
		Assertions.assertEquals(List.of("2020-01-01"), transport.lastStatement().getParameters());
		Assertions.assertEquals(List.of(1, 2), names, "The first column of each row should be returned");

		database.table("employee").unordered().fetchList();
		Assertions.assertEquals("SELECT * FROM employee", transport.lastStatement().getSql());
	}

	@Test
	public void testTableQueryMap() {
		FakeTransport transport = new FakeTransport()
				.primaryKey("assignment", "employee_id", "project_id")
				.respond("FROM assignment", FakeTransport.rows(List.of("employee_id", "project_id", "role", "hours"),
						List.of(1, 10, "lead", 20), List.of(2, 10, "dev", 40)));
		Database database = Database.withTransport(transport).build();

		Map<Object, Object> assignments = database.table("assignment").fetchMap();

		Assertions.assertEquals("SELECT * FROM assignment ORDER BY \"employee_id\", \"project_id\"", transport.lastStatement().getSql());
		Assertions.assertEquals(List.of(List.of(1, 10), List.of(2, 10)), new ArrayList<>(assignments.keySet()));
		Assertions.assertEquals(record("role", "lead", "hours", 20), assignments.get(List.of(1, 10)));

		Map<Object, Object> roles = database.table("assignment").keyNames("employee_id").scalar().fetchMap();
		Assertions.assertEquals("SELECT * FROM assignment ORDER BY \"employee_id\"", transport.lastStatement().getSql());
		Assertions.assertEquals(10, roles.get(1), "The first non-key column should be used");
	}

	@Test
	public void testNotificationHandler() {
		FakeTransport transport = new FakeTransport();
		Database database = Database.withTransport(transport).build();
		List<Optional<Notification>> received = new ArrayList<>();

		NotificationHandler notificationHandler = database.notificationHandler("jobs", received::add, Duration.ZERO, null);

		Assertions.assertFalse(notificationHandler.notify("ignored"), "Nothing should be sent before listening");

		transport.queueNotifications(new Notification("jobs", 123, "first"));
		notificationHandler.run();

		Assertions.assertEquals(List.of("LISTEN \"jobs\"", "LISTEN \"stop_jobs\""), transport.getSql());
		Assertions.assertEquals(List.of(Optional.of(new Notification("jobs", 123, "first"))), received);
		Assertions.assertTrue(notificationHandler.isListening());

		Assertions.assertTrue(notificationHandler.notify("second"));
		Assertions.assertEquals("SELECT pg_notify($1, $2)", transport.lastStatement().getSql());
		Assertions.assertEquals(List.of("jobs", "second"), transport.lastStatement().getParameters());

		Assertions.assertTrue(notificationHandler.stop());
		Assertions.assertEquals(List.of("stop_jobs", ""), transport.lastStatement().getParameters());

		transport.queueNotifications(new Notification("stop_jobs", 123, null));
		notificationHandler.run();

		Assertions.assertFalse(notificationHandler.isListening());
		Assertions.assertEquals(2, received.size());
		Assertions.assertEquals(List.of("UNLISTEN \"jobs\"", "UNLISTEN \"stop_jobs\""),
				transport.getSql().subList(transport.getSql().size() - 2, transport.getSql().size()));
	}

	@Test
	public void testNotificationHandlerTimeout() {
		FakeTransport transport = new FakeTransport();
		Database database = Database.withTransport(transport).build();
		List<Optional<Notification>> received = new ArrayList<>();

		NotificationHandler notificationHandler = database.notificationHandler("jobs", received::add,
				Duration.ofMillis(10), "halt");
		notificationHandler.run();

		Assertions.assertEquals(List.of(Optional.empty()), received);
		Assertions.assertFalse(notificationHandler.isListening());
		Assertions.assertTrue(transport.getSql().contains("LISTEN \"halt\""));
	}

	@Test
	public void testNotificationHandlerUnexpectedChannel() {
		FakeTransport transport = new FakeTransport().queueNotifications(new Notification("other", 1, null));
		Database database = Database.withTransport(transport).build();

		NotificationHandler notificationHandler = database.notificationHandler("jobs", (notification) -> {});

		Assertions.assertThrows(DatabaseException.class, notificationHandler::run);
		Assertions.assertFalse(notificationHandler.isListening());
	}

	@Test
	public void testTableQueryRequiresTableName() {
		Database database = Database.withTransport(new FakeTransport()).build();
		Assertions.assertThrows(IllegalArgumentException.class, () -> database.table(" "));
	}

	private static FakeTransport employeeTransport() {
		return new FakeTransport()
				.attributes("employee", "id", "int4", "name", "varchar", "active", "bool", "hired", "date")
				.primaryKey("employee", "id");
	}

	private static Map<String, Object> record(Object... namesAndValues) {
		Map<String, Object> record = new LinkedHashMap<>();

		for (int i = 0; i < namesAndValues.length; i += 2)
			record.put((String) namesAndValues[i], namesAndValues[i + 1]);

		return record;
	}
}
