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


/**
 * Rowkeeper is a record-oriented convenience layer for PostgreSQL: rows are read and written as plain
 * {@code Map<String, Object>} records, and the SQL is generated from the table's primary key and column types.
 *
 * <pre>
 * // Minimal setup
 * DataSource dataSource = ...
 * Database database = Database.withDataSource(dataSource).build();
 *
 * // Records
 * Map&lt;String, Object&gt; employee = new LinkedHashMap&lt;&gt;(Map.of("name", "Ada", "hired", "2024-01-15"));
 * database.insert("employee", employee); // employee now holds its id and defaults
 * employee.put("name", "Ada Lovelace");
 * database.update("employee", employee);
 * Map&lt;String, Object&gt; sameEmployee = database.getByKey("employee", employee.get("id"));
 * database.upsert("employee", employee, Map.of("name", "included.name || ' (rehired)'"));
 * database.delete("employee", employee);
 *
 * // Whole tables
 * List&lt;Map&lt;String, Object&gt;&gt; employees = database.table("employee").where("hired &gt; $1", "2020-01-01").fetchList();
 * Map&lt;Object, Object&gt; namesById = database.table("employee").columns("id", "name").scalar().fetchMap();
 *
 * // Transactions
 * database.transaction(() -&gt; {
 *   database.update("account", debit);
 *   database.update("account", credit);
 * });
 *
 * // Plain statements
 * QueryResult result = database.query("SELECT count(*) FROM employee WHERE name = $1", "Ada");</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
package com.rowkeeper;
