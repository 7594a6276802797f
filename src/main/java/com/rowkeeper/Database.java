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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * Main class for working with PostgreSQL tables as records.
 * <p>
 * Records are mutable {@code Map<String, Object>} instances keyed by column name. Record operations look up the
 * table's primary key and column types from the system catalogs, cache them, and generate the SQL for you. Records
 * passed in are updated in place with the values the server reports back, so defaults and trigger effects become
 * visible to the caller.
 * <p>
 * A {@code Database} wraps a single server session and owns its caches exclusively. It must not be shared between
 * threads: a second thread needs its own {@code Database} on its own connection.
 *
 * <pre>
 * Database database = Database.withDataSource(dataSource).build();
 *
 * Map&lt;String, Object&gt; car = new LinkedHashMap&lt;&gt;(Map.of("color", "blue"));
 * database.insert("car", car); // car now holds its generated id
 * car.put("color", "red");
 * database.update("car", car);
 * database.delete("car", car);</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public final class Database implements AutoCloseable {
	/**
	 * Servers before this version do not understand {@code INSERT ... ON CONFLICT}.
	 */
	private static final int UPSERT_MINIMUM_SERVER_VERSION_NUMBER = 90500;

	@NonNull
	private static final Pattern PARAMETER_NAME_PATTERN;

	static {
		PARAMETER_NAME_PATTERN = Pattern.compile("[a-z_][a-z0-9_$]*(\\.[a-z_][a-z0-9_$]*)?");
	}

	@Nullable
	private final DataSource dataSource;
	private final boolean ownsTransport;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final MetadataCache metadataCache;
	@NonNull
	private final PrivilegeCache privilegeCache;
	@NonNull
	private final Logger logger;

	@NonNull
	private PostgresTransport transport;
	@NonNull
	private ParameterPreparer parameterPreparer;
	@NonNull
	private RowMarshaller rowMarshaller;
	private boolean closed;

	protected Database(@NonNull Builder builder,
										 @NonNull PostgresTransport transport) {
		requireNonNull(builder);
		requireNonNull(transport);

		if (!transport.isOpen())
			throw new InvalidConnectionException();

		this.dataSource = builder.dataSource;
		this.ownsTransport = builder.dataSource != null;
		this.statementLogger = builder.statementLogger == null ? (statementLog) -> {} : builder.statementLogger;
		this.metadataCache = new MetadataCache(this::executeStatement, builder.regularTypeNames);
		this.privilegeCache = new PrivilegeCache(this::executeStatement);
		this.logger = Logger.getLogger(getClass().getName());
		this.transport = transport;
		this.parameterPreparer = new ParameterPreparer(transport);
		this.rowMarshaller = new RowMarshaller(transport);
	}

	/**
	 * Provides a {@link Database} builder which wraps the given transport.
	 * <p>
	 * The transport is not closed when the {@link Database} is closed.
	 *
	 * @param transport the transport to wrap
	 * @return a {@link Database} builder
	 */
	@NonNull
	public static Builder withTransport(@NonNull PostgresTransport transport) {
		requireNonNull(transport);
		return new Builder(transport, null);
	}

	/**
	 * Provides a {@link Database} builder which wraps an existing JDBC connection.
	 * <p>
	 * The connection is not closed when the {@link Database} is closed.
	 *
	 * @param connection a connection to a PostgreSQL server
	 * @return a {@link Database} builder
	 */
	@NonNull
	public static Builder withConnection(@NonNull Connection connection) {
		requireNonNull(connection);
		return new Builder(new JdbcPostgresTransport(connection), null);
	}

	/**
	 * Provides a {@link Database} builder which opens its own connection from the given {@link DataSource}.
	 * <p>
	 * That connection is owned by the {@link Database}: it is closed by {@link #close()} and can be replaced via
	 * {@link #reopen()}.
	 *
	 * @param dataSource data source for PostgreSQL connections
	 * @return a {@link Database} builder
	 */
	@NonNull
	public static Builder withDataSource(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);
		return new Builder(null, dataSource);
	}

	/**
	 * Builds the record key under which a row's OID is stored, e.g. {@code oid(employee)}.
	 * <p>
	 * A plain {@code oid} key would collide when one record carries OIDs of several tables.
	 *
	 * @param tableName the table name
	 * @return the OID key for the table
	 */
	@NonNull
	public static String oidKey(@NonNull String tableName) {
		requireNonNull(tableName);
		return format("oid(%s)", tableName);
	}

	// Metadata

	/**
	 * Gets the primary key of a table, consulting the catalogs on first use.
	 *
	 * @param tableName the table name
	 * @return the table's primary key
	 * @throws NoPrimaryKeyException if the table has no primary key
	 */
	@NonNull
	public PrimaryKey primaryKey(@NonNull String tableName) {
		return primaryKey(tableName, false);
	}

	/**
	 * Gets the primary key of a table, optionally flushing all cached primary keys first.
	 * <p>
	 * Flushing may be necessary after the schema or the search path has changed.
	 *
	 * @param tableName the table name
	 * @param flush     {@code true} to discard all cached primary keys first
	 * @return the table's primary key
	 * @throws NoPrimaryKeyException if the table has no primary key
	 */
	@NonNull
	public PrimaryKey primaryKey(@NonNull String tableName,
															 boolean flush) {
		requireNonNull(tableName);
		ensureOpen();

		return getMetadataCache().primaryKey(tableName, flush);
	}

	/**
	 * Gets the columns of a table and their types, in column order.
	 * <p>
	 * Types are simplified to {@link SemanticType} names unless {@link #useRegularTypeNames(boolean)} is in effect.
	 * If the table has OIDs, an {@code oid} entry is included.
	 *
	 * @param tableName the table name
	 * @return an unmodifiable map of column names to type names
	 */
	@NonNull
	public Map<String, String> getAttributes(@NonNull String tableName) {
		return getAttributes(tableName, false);
	}

	@NonNull
	public Map<String, String> getAttributes(@NonNull String tableName,
																					 boolean flush) {
		requireNonNull(tableName);
		ensureOpen();

		return getMetadataCache().attributes(tableName, flush);
	}

	/**
	 * Switches between simplified type names ({@code int}, {@code date}, ...) and full catalog type names
	 * ({@code integer}, {@code timestamp without time zone}, ...) for {@link #getAttributes(String)}.
	 *
	 * @param regularTypeNames {@code true} to use full catalog type names
	 */
	public void useRegularTypeNames(boolean regularTypeNames) {
		ensureOpen();
		getMetadataCache().useRegularTypeNames(regularTypeNames);
	}

	public boolean isUsingRegularTypeNames() {
		return getMetadataCache().isUsingRegularTypeNames();
	}

	/**
	 * Checks whether the current user may {@code SELECT} from a table.
	 *
	 * @param tableName the table name
	 * @return {@code true} if the privilege is held
	 */
	public boolean hasTablePrivilege(@NonNull String tableName) {
		return hasTablePrivilege(tableName, "select");
	}

	/**
	 * Checks whether the current user holds a privilege on a table. Results are cached for the lifetime of this
	 * instance.
	 *
	 * @param tableName the table name
	 * @param privilege the privilege, e.g. {@code insert}
	 * @return {@code true} if the privilege is held
	 */
	public boolean hasTablePrivilege(@NonNull String tableName,
																	 @NonNull String privilege) {
		requireNonNull(tableName);
		requireNonNull(privilege);
		ensureOpen();

		return getPrivilegeCache().hasTablePrivilege(tableName, privilege);
	}

	// Records

	/**
	 * Fetches a row by the key values held in {@code row} and merges its columns into {@code row}.
	 * <p>
	 * The primary key is used, or the row's OID if the table has no primary key (or the row lacks key values) and
	 * the row carries an OID.
	 *
	 * @param tableName the table name
	 * @param row       the record holding the key values, updated in place
	 * @return {@code row}
	 * @throws NoSuchRecordException if no row matches
	 * @throws NoPrimaryKeyException if there is neither a primary key nor an OID to go by
	 */
	@NonNull
	public Map<String, Object> get(@NonNull String tableName,
																 @NonNull Map<String, Object> row) {
		return get(tableName, row, List.of());
	}

	/**
	 * Fetches a row by the given key columns, whose values are taken from {@code row}, and merges its columns into
	 * {@code row}.
	 *
	 * @param tableName the table name
	 * @param row       the record holding the key values, updated in place
	 * @param keyNames  the columns identifying the row; empty to use the primary key
	 * @return {@code row}
	 * @throws NoSuchRecordException if no row matches
	 */
	@NonNull
	public Map<String, Object> get(@NonNull String tableName,
																 @NonNull Map<String, Object> row,
																 @NonNull List<@NonNull String> keyNames) {
		requireNonNull(tableName);
		requireNonNull(row);
		requireNonNull(keyNames);
		ensureOpen();

		String table = stripDescendantsHint(tableName);
		Map<String, String> attributes = getMetadataCache().attributes(table, false);
		String oidKey = attributes.containsKey("oid") ? oidKey(table) : null;

		if (oidKey != null && row.containsKey(oidKey) && !row.containsKey("oid"))
			row.put("oid", row.get(oidKey));

		List<String> resolvedKeyNames = keyNames.isEmpty() ? resolveKeyNames(table, row, oidKey) : keyNames;
		StatementBuilder statementBuilder = new StatementBuilder(getParameterPreparer());
		String where = whereClause(statementBuilder, table, resolvedKeyNames, row, attributes);

		moveOid(row, oidKey);

		Statement statement = statementBuilder.build(format("SELECT %s FROM %s WHERE %s LIMIT 1",
				oidKey == null ? "*" : "oid, *", escapeQualifiedName(table), where));
		List<Map<String, Object>> results = executeStatement(statement).toMaps();

		if (results.isEmpty())
			throw new NoSuchRecordException(table, where, statement.describeParameters());

		return getRowMarshaller().merge(row, results.get(0), attributes, oidKey);
	}

	/**
	 * Fetches a row by its primary key values, in key order.
	 *
	 * @param tableName the table name
	 * @param keyValues the primary key values
	 * @return a new record holding the row
	 * @throws NoSuchRecordException if no row matches
	 */
	@NonNull
	public Map<String, Object> getByKey(@NonNull String tableName,
																			@Nullable Object @NonNull ... keyValues) {
		requireNonNull(keyValues);
		return getByKey(tableName, List.of(), Arrays.asList(keyValues));
	}

	/**
	 * Fetches a row by the values of the given key columns.
	 *
	 * @param tableName the table name
	 * @param keyNames  the columns identifying the row; empty to use the primary key
	 * @param keyValues one value per key column
	 * @return a new record holding the row
	 * @throws NoSuchRecordException if no row matches
	 */
	@NonNull
	public Map<String, Object> getByKey(@NonNull String tableName,
																			@NonNull List<@NonNull String> keyNames,
																			@NonNull List<@Nullable Object> keyValues) {
		requireNonNull(tableName);
		requireNonNull(keyNames);
		requireNonNull(keyValues);
		ensureOpen();

		List<String> resolvedKeyNames = keyNames.isEmpty()
				? getMetadataCache().primaryKey(stripDescendantsHint(tableName), false).getColumns()
				: keyNames;

		if (resolvedKeyNames.size() != keyValues.size())
			throw new IllegalArgumentException(format("Differing number of items in key names %s and key values %s",
					resolvedKeyNames, keyValues));

		Map<String, Object> row = new LinkedHashMap<>();

		for (int i = 0; i < resolvedKeyNames.size(); ++i)
			row.put(resolvedKeyNames.get(i), keyValues.get(i));

		return get(tableName, row, resolvedKeyNames);
	}

	/**
	 * Inserts a row with the table's default values.
	 *
	 * @param tableName the table name
	 * @return a new record holding the inserted row
	 */
	@NonNull
	public Map<String, Object> insert(@NonNull String tableName) {
		return insert(tableName, new LinkedHashMap<>());
	}

	/**
	 * Inserts {@code row} into a table.
	 * <p>
	 * Entries that are not columns of the table are ignored, as is any {@code oid} entry. Afterwards {@code row} holds
	 * the values actually inserted, including defaults and values changed by rules or triggers.
	 *
	 * @param tableName the table name
	 * @param row       the record to insert, updated in place
	 * @return {@code row}
	 */
	@NonNull
	public Map<String, Object> insert(@NonNull String tableName,
																		@NonNull Map<String, Object> row) {
		requireNonNull(tableName);
		requireNonNull(row);
		ensureOpen();

		String table = stripDescendantsHint(tableName);
		row.remove("oid");

		Map<String, String> attributes = getMetadataCache().attributes(table, false);
		String oidKey = attributes.containsKey("oid") ? oidKey(table) : null;
		StatementBuilder statementBuilder = new StatementBuilder(getParameterPreparer());
		List<String> names = new ArrayList<>();
		List<String> values = new ArrayList<>();

		for (Map.Entry<String, String> attribute : attributes.entrySet()) {
			if (row.containsKey(attribute.getKey())) {
				names.add(getTransport().escapeIdentifier(attribute.getKey()));
				values.add(statementBuilder.parameter(row.get(attribute.getKey()), attribute.getValue()));
			}
		}

		String returning = oidKey == null ? "*" : "oid, *";
		String sql = names.isEmpty()
				? format("INSERT INTO %s DEFAULT VALUES RETURNING %s", escapeQualifiedName(table), returning)
				: format("INSERT INTO %s (%s) VALUES (%s) RETURNING %s", escapeQualifiedName(table),
				String.join(", ", names), String.join(", ", values), returning);

		List<Map<String, Object>> results = executeStatement(statementBuilder.build(sql)).toMaps();

		if (!results.isEmpty())
			getRowMarshaller().merge(row, results.get(0), attributes, oidKey);

		return row;
	}

	/**
	 * Updates the row identified by the primary key values (or the {@code oid(<table>)} entry) in {@code row}.
	 * <p>
	 * All other columns present in {@code row} are set. Afterwards {@code row} holds the values actually stored.
	 * If no row matches, {@code row} is returned unchanged.
	 *
	 * @param tableName the table name
	 * @param row       the record to store, updated in place
	 * @return {@code row}
	 */
	@NonNull
	public Map<String, Object> update(@NonNull String tableName,
																		@NonNull Map<String, Object> row) {
		requireNonNull(tableName);
		requireNonNull(row);
		ensureOpen();

		String table = stripDescendantsHint(tableName);
		Map<String, String> attributes = getMetadataCache().attributes(table, false);
		String oidKey = attributes.containsKey("oid") ? oidKey(table) : null;

		// Only the oid(<table>) entry may identify a row by OID
		row.remove("oid");

		if (oidKey != null && row.containsKey(oidKey))
			row.put("oid", row.get(oidKey));

		List<String> keyNames = resolveKeyNames(table, row, oidKey);
		StatementBuilder statementBuilder = new StatementBuilder(getParameterPreparer());
		String where = whereClause(statementBuilder, table, keyNames, row, attributes);

		moveOid(row, oidKey);

		Set<String> keyNameSet = new HashSet<>(keyNames);
		List<String> assignments = new ArrayList<>();

		for (Map.Entry<String, String> attribute : attributes.entrySet())
			if (row.containsKey(attribute.getKey()) && !keyNameSet.contains(attribute.getKey()))
				assignments.add(format("%s = %s", getTransport().escapeIdentifier(attribute.getKey()),
						statementBuilder.parameter(row.get(attribute.getKey()), attribute.getValue())));

		if (assignments.isEmpty())
			return row;

		Statement statement = statementBuilder.build(format("UPDATE %s SET %s WHERE %s RETURNING %s",
				escapeQualifiedName(table), String.join(", ", assignments), where, oidKey == null ? "*" : "oid, *"));
		List<Map<String, Object>> results = executeStatement(statement).toMaps();

		if (!results.isEmpty())
			getRowMarshaller().merge(row, results.get(0), attributes, oidKey);

		return row;
	}

	/**
	 * Inserts {@code row}, or updates the existing row if one with the same primary key exists.
	 * <p>
	 * On conflict, the columns present in {@code row} are set to the values proposed for insertion.
	 *
	 * @param tableName the table name
	 * @param row       the record to store, updated in place
	 * @return {@code row}
	 * @see #upsert(String, Map, Map)
	 */
	@NonNull
	public Map<String, Object> upsert(@NonNull String tableName,
																		@NonNull Map<String, Object> row) {
		return upsert(tableName, row, Map.of());
	}

	/**
	 * Inserts {@code row}, or updates the existing row if one with the same primary key exists, as a single atomic
	 * {@code INSERT ... ON CONFLICT} statement.
	 * <p>
	 * {@code updates} controls what happens to each non-key column on conflict:
	 * <ul>
	 *   <li>a falsy value ({@code false}, {@code null}, {@code ""}, ...) leaves the column as it is</li>
	 *   <li>a {@link String} is used as the update expression; it may refer to the existing value as
	 *   {@code included.<column>} and to the proposed value as {@code excluded.<column>}</li>
	 *   <li>any other truthy value sets the column to the proposed value</li>
	 * </ul>
	 * Columns without an entry in {@code updates} are set to the proposed value if they are present in {@code row}
	 * and left alone otherwise: the proposed row holds column defaults for everything {@code row} omits, so updating
	 * an omitted column would silently reset it. Pass {@code true} for such a column to get that behavior anyway.
	 * If nothing is to be updated, a conflict leaves the existing row untouched.
	 * <p>
	 * Either way, afterwards {@code row} holds the row as it is stored.
	 *
	 * @param tableName the table name
	 * @param row       the record to store, updated in place
	 * @param updates   per-column conflict behavior
	 * @return {@code row}
	 * @throws NoPrimaryKeyException        if the table has no primary key
	 * @throws UpsertNotSupportedException if the server is older than PostgreSQL 9.5
	 */
	@NonNull
	public Map<String, Object> upsert(@NonNull String tableName,
																		@NonNull Map<String, Object> row,
																		@NonNull Map<String, @Nullable Object> updates) {
		requireNonNull(tableName);
		requireNonNull(row);
		requireNonNull(updates);
		ensureOpen();

		String table = stripDescendantsHint(tableName);
		row.remove("oid");

		Map<String, String> attributes = getMetadataCache().attributes(table, false);
		String oidKey = attributes.containsKey("oid") ? oidKey(table) : null;
		StatementBuilder statementBuilder = new StatementBuilder(getParameterPreparer());
		List<String> names = new ArrayList<>();
		List<String> values = new ArrayList<>();

		for (Map.Entry<String, String> attribute : attributes.entrySet()) {
			if (row.containsKey(attribute.getKey())) {
				names.add(getTransport().escapeIdentifier(attribute.getKey()));
				values.add(statementBuilder.parameter(row.get(attribute.getKey()), attribute.getValue()));
			}
		}

		PrimaryKey primaryKey = getMetadataCache().primaryKey(table, false);
		List<String> target = new ArrayList<>(primaryKey.getColumns().size());

		for (String column : primaryKey.getColumns())
			target.add(getTransport().escapeIdentifier(column));

		Set<String> notUpdatable = new HashSet<>(primaryKey.getColumns());
		notUpdatable.add("oid");

		List<String> assignments = new ArrayList<>();

		for (String name : attributes.keySet()) {
			if (notUpdatable.contains(name))
				continue;

			Object update = updates.containsKey(name) ? updates.get(name) : row.containsKey(name);

			if (!ParameterPreparer.isTruthy(update))
				continue;

			String column = getTransport().escapeIdentifier(name);
			String expression = update instanceof String string ? string : format("excluded.%s", column);
			assignments.add(format("%s = %s", column, expression));
		}

		if (names.isEmpty())
			return row;

		String conflictAction = assignments.isEmpty() ? "NOTHING" : format("UPDATE SET %s", String.join(", ", assignments));
		Statement statement = statementBuilder.build(format("INSERT INTO %s AS included (%s) VALUES (%s) ON CONFLICT (%s) DO %s RETURNING %s",
				escapeQualifiedName(table), String.join(", ", names), String.join(", ", values), String.join(", ", target),
				conflictAction, oidKey == null ? "*" : "oid, *"));

		QueryResult queryResult;

		try {
			queryResult = executeStatement(statement);
		} catch (DatabaseException e) {
			if (isRejectedSyntax(e)) {
				int serverVersionNumber;

				try {
					serverVersionNumber = getTransport().getServerVersionNumber();
				} catch (RuntimeException versionFailure) {
					// The rejected statement is the failure the caller needs to see
					e.addSuppressed(versionFailure);
					throw e;
				}

				if (serverVersionNumber < UPSERT_MINIMUM_SERVER_VERSION_NUMBER)
					throw new UpsertNotSupportedException(serverVersionNumber, e);
			}

			throw e;
		}

		List<Map<String, Object>> results = queryResult.toMaps();

		if (results.isEmpty()) {
			// DO NOTHING returns no row on conflict
			if (assignments.isEmpty())
				return get(table, row);

			return row;
		}

		return getRowMarshaller().merge(row, results.get(0), attributes, oidKey);
	}

	/**
	 * Deletes the row identified by the primary key values (or the {@code oid(<table>)} entry) in {@code row}.
	 *
	 * @param tableName the table name
	 * @param row       the record identifying the row
	 * @return the number of deleted rows, {@code 0} if the row did not exist
	 */
	public long delete(@NonNull String tableName,
										 @NonNull Map<String, Object> row) {
		requireNonNull(tableName);
		requireNonNull(row);
		ensureOpen();

		String table = stripDescendantsHint(tableName);
		Map<String, String> attributes = getMetadataCache().attributes(table, false);
		String oidKey = attributes.containsKey("oid") ? oidKey(table) : null;

		row.remove("oid");

		if (oidKey != null && row.containsKey(oidKey))
			row.put("oid", row.get(oidKey));

		List<String> keyNames = resolveKeyNames(table, row, oidKey);
		StatementBuilder statementBuilder = new StatementBuilder(getParameterPreparer());
		String where = whereClause(statementBuilder, table, keyNames, row, attributes);

		moveOid(row, oidKey);

		QueryResult queryResult = executeStatement(statementBuilder.build(format("DELETE FROM %s WHERE %s",
				escapeQualifiedName(table), where)));

		return queryResult.getUpdateCount().orElse(0L);
	}

	/**
	 * Removes all rows from a table and its descendant tables.
	 *
	 * @param tableName the table name
	 */
	public void truncate(@NonNull String tableName) {
		truncate(tableName, false, false, false);
	}

	/**
	 * Removes all rows from a table.
	 *
	 * @param tableName the table name; a trailing {@code *} explicitly includes descendant tables
	 * @param restart   {@code true} to restart sequences owned by the table's columns
	 * @param cascade   {@code true} to also truncate tables with foreign keys referencing this one
	 * @param only      {@code true} to leave descendant tables alone
	 */
	public void truncate(@NonNull String tableName,
											 boolean restart,
											 boolean cascade,
											 boolean only) {
		requireNonNull(tableName);
		truncate(List.of(tableName), restart, cascade, List.of(only));
	}

	/**
	 * Removes all rows from several tables in one statement, applying the same {@code only} option to each.
	 *
	 * @param tableNames the table names
	 * @param restart    {@code true} to restart owned sequences
	 * @param cascade    {@code true} to also truncate referencing tables
	 * @param only       {@code true} to leave descendant tables alone
	 */
	public void truncate(@NonNull Collection<@NonNull String> tableNames,
											 boolean restart,
											 boolean cascade,
											 boolean only) {
		requireNonNull(tableNames);
		truncate(new ArrayList<>(tableNames), restart, cascade, Collections.nCopies(tableNames.size(), only));
	}

	/**
	 * Removes all rows from several tables in one statement, with an {@code only} option per table.
	 *
	 * @param tableNames the table names
	 * @param restart    {@code true} to restart owned sequences
	 * @param cascade    {@code true} to also truncate referencing tables
	 * @param only       one flag per table name
	 */
	public void truncate(@NonNull List<@NonNull String> tableNames,
											 boolean restart,
											 boolean cascade,
											 @NonNull List<@NonNull Boolean> only) {
		requireNonNull(tableNames);
		requireNonNull(only);

		if (tableNames.isEmpty())
			throw new IllegalArgumentException("No table has been specified");

		if (tableNames.size() != only.size())
			throw new IllegalArgumentException(format("Got %d table names but %d only options", tableNames.size(), only.size()));

		List<String> tables = new ArrayList<>(tableNames.size());

		for (int i = 0; i < tableNames.size(); ++i) {
			String tableName = requireNonNull(tableNames.get(i));
			boolean onlyTable = requireNonNull(only.get(i));

			if (tableName.endsWith("*")) {
				if (onlyTable)
					throw new IllegalArgumentException(format("Contradictory table name and only options for %s", tableName));

				tableName = stripDescendantsHint(tableName);
			}

			tables.add(onlyTable ? format("ONLY %s", escapeQualifiedName(tableName)) : escapeQualifiedName(tableName));
		}

		ensureOpen();

		List<String> sql = new ArrayList<>(4);
		sql.add("TRUNCATE");
		sql.add(String.join(", ", tables));

		if (restart)
			sql.add("RESTART IDENTITY");
		if (cascade)
			sql.add("CASCADE");

		executeStatement(Statement.of(String.join(" ", sql)));
	}

	/**
	 * Creates a record with every column of the table set to an empty value for its type.
	 *
	 * @param tableName the table name
	 * @return a new record
	 * @see #clear(String, Map)
	 */
	@NonNull
	public Map<String, Object> clear(@NonNull String tableName) {
		return clear(tableName, new LinkedHashMap<>());
	}

	/**
	 * Sets every column entry of {@code row} to an empty value for its type: {@code 0} for numbers, {@code false}
	 * for booleans and {@code ""} for everything else. Entries that are not columns are left alone.
	 *
	 * @param tableName the table name
	 * @param row       the record to clear
	 * @return {@code row}
	 */
	@NonNull
	public Map<String, Object> clear(@NonNull String tableName,
																	 @NonNull Map<String, Object> row) {
		requireNonNull(tableName);
		requireNonNull(row);
		ensureOpen();

		for (Map.Entry<String, String> attribute : getMetadataCache().attributes(stripDescendantsHint(tableName), false).entrySet()) {
			if ("oid".equals(attribute.getKey()))
				continue;

			SemanticType semanticType = SemanticType.forTypeName(attribute.getValue());

			if (semanticType.isNumeric())
				row.put(attribute.getKey(), 0);
			else if (semanticType == SemanticType.BOOL)
				row.put(attribute.getKey(), false);
			else
				row.put(attribute.getKey(), "");
		}

		return row;
	}

	/**
	 * Provides a fluent builder for reading a whole table, or any other SQL expression returning rows.
	 *
	 * @param tableName the table name or expression; it is used verbatim
	 * @return a fluent query builder
	 */
	@NonNull
	public TableQuery table(@NonNull String tableName) {
		requireNonNull(tableName);
		return new TableQuery(this, tableName);
	}

	// Statements

	/**
	 * Executes a SQL statement whose parameters are referenced as {@code $1}, {@code $2}, ...
	 * <p>
	 * Parameters are passed through as-is.
	 *
	 * @param sql        the SQL statement
	 * @param parameters positional parameter values
	 * @return the resulting rows or update count
	 */
	@NonNull
	public QueryResult query(@NonNull String sql,
													 @Nullable Object @NonNull ... parameters) {
		requireNonNull(sql);
		requireNonNull(parameters);

		return executeStatement(Statement.of(sql, Arrays.asList(parameters)));
	}

	// Transactions

	public void begin() {
		begin(TransactionIsolation.DEFAULT);
	}

	public void begin(@NonNull TransactionIsolation transactionIsolation) {
		requireNonNull(transactionIsolation);

		executeStatement(Statement.of(transactionIsolation.getIsolationLevel()
				.map(isolationLevel -> format("BEGIN ISOLATION LEVEL %s", isolationLevel))
				.orElse("BEGIN")));
	}

	public void commit() {
		executeStatement(Statement.of("COMMIT"));
	}

	public void rollback() {
		executeStatement(Statement.of("ROLLBACK"));
	}

	/**
	 * Rolls back to a savepoint defined via {@link #savepoint(String)}.
	 *
	 * @param savepointName the savepoint name
	 */
	public void rollback(@NonNull String savepointName) {
		requireNonNull(savepointName);
		ensureOpen();

		executeStatement(Statement.of(format("ROLLBACK TO SAVEPOINT %s", getTransport().escapeIdentifier(savepointName))));
	}

	public void savepoint(@NonNull String savepointName) {
		requireNonNull(savepointName);
		ensureOpen();

		executeStatement(Statement.of(format("SAVEPOINT %s", getTransport().escapeIdentifier(savepointName))));
	}

	public void release(@NonNull String savepointName) {
		requireNonNull(savepointName);
		ensureOpen();

		executeStatement(Statement.of(format("RELEASE SAVEPOINT %s", getTransport().escapeIdentifier(savepointName))));
	}

	/**
	 * Performs an operation transactionally.
	 * <p>
	 * The transaction will be automatically rolled back if an exception bubbles out of {@code transactionalOperation}.
	 *
	 * @param transactionalOperation the operation to perform transactionally
	 */
	public void transaction(@NonNull TransactionalOperation transactionalOperation) {
		requireNonNull(transactionalOperation);

		transaction(() -> {
			transactionalOperation.perform();
			return Optional.empty();
		});
	}

	/**
	 * Performs an operation transactionally and optionally returns a value.
	 * <p>
	 * The transaction will be automatically rolled back if an exception bubbles out of {@code transactionalOperation}.
	 *
	 * @param transactionalOperation the operation to perform transactionally
	 * @param <T>                    the type to be returned
	 * @return the result of the transactional operation
	 */
	@NonNull
	public <T> Optional<T> transaction(@NonNull ReturningTransactionalOperation<T> transactionalOperation) {
		requireNonNull(transactionalOperation);

		begin();

		try {
			Optional<T> returnValue = transactionalOperation.perform();

			// Safeguard in case user code accidentally returns null instead of Optional.empty()
			if (returnValue == null)
				returnValue = Optional.empty();

			commit();
			return returnValue;
		} catch (RuntimeException e) {
			rollbackAfterFailure(e);
			restoreInterruptIfNeeded(e);
			throw e;
		} catch (Error e) {
			rollbackAfterFailure(e);
			restoreInterruptIfNeeded(e);
			throw e;
		} catch (Throwable t) {
			rollbackAfterFailure(t);
			restoreInterruptIfNeeded(t);
			throw new RuntimeException(t);
		}
	}

	private void rollbackAfterFailure(@NonNull Throwable failure) {
		requireNonNull(failure);

		try {
			rollback();
		} catch (Exception rollbackException) {
			getLogger().log(WARNING, "Unable to roll back transaction", rollbackException);
			failure.addSuppressed(rollbackException);
		}
	}

	private static void restoreInterruptIfNeeded(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		Throwable current = throwable;

		while (current != null) {
			if (current instanceof InterruptedException) {
				Thread.currentThread().interrupt();
				return;
			}

			current = current.getCause();
		}
	}

	// Run-time parameters

	/**
	 * Gets the current setting of a run-time parameter, e.g. {@code datestyle}.
	 *
	 * @param parameterName the parameter name
	 * @return the current setting
	 */
	@NonNull
	public String getParameter(@NonNull String parameterName) {
		requireNonNull(parameterName);

		String name = normalizeParameterName(parameterName);
		List<List<Object>> rows = executeStatement(Statement.of("SELECT current_setting($1)", List.of(name))).getRows();

		return String.valueOf(rows.get(0).get(0));
	}

	/**
	 * Gets the current settings of several run-time parameters.
	 *
	 * @param parameterNames the parameter names
	 * @return the settings keyed by the names as given, in iteration order
	 */
	@NonNull
	public Map<String, String> getParameters(@NonNull Collection<@NonNull String> parameterNames) {
		requireNonNull(parameterNames);

		if (parameterNames.isEmpty())
			throw new IllegalArgumentException("No parameter has been specified");

		Map<String, String> settings = new LinkedHashMap<>();

		for (String parameterName : parameterNames)
			settings.put(parameterName, getParameter(parameterName));

		return settings;
	}

	/**
	 * @return all run-time parameters and their current settings
	 */
	@NonNull
	public Map<String, String> getAllParameters() {
		Map<String, String> settings = new LinkedHashMap<>();

		for (List<Object> row : executeStatement(Statement.of("SHOW ALL")).getRows())
			settings.put(String.valueOf(row.get(0)), row.get(1) == null ? null : String.valueOf(row.get(1)));

		return settings;
	}

	/**
	 * Sets a run-time parameter, or restores its default if {@code value} is {@code null}.
	 *
	 * @param parameterName the parameter name
	 * @param value         the new setting
	 * @param local         {@code true} to affect the current transaction only
	 */
	public void setParameter(@NonNull String parameterName,
													 @Nullable String value,
													 boolean local) {
		requireNonNull(parameterName);

		if (value == null) {
			resetParameter(parameterName, local);
			return;
		}

		String name = normalizeParameterName(parameterName);
		executeStatement(Statement.of("SELECT set_config($1, $2, $3)", List.of(name, value, local)));
	}

	/**
	 * Sets several run-time parameters; {@code null} values restore defaults.
	 *
	 * @param settings parameter names and their new settings
	 * @param local    {@code true} to affect the current transaction only
	 */
	public void setParameters(@NonNull Map<@NonNull String, @Nullable String> settings,
														boolean local) {
		requireNonNull(settings);

		if (settings.isEmpty())
			throw new IllegalArgumentException("No parameter has been specified");

		for (Map.Entry<String, String> setting : settings.entrySet())
			setParameter(setting.getKey(), setting.getValue(), local);
	}

	public void resetParameter(@NonNull String parameterName,
														 boolean local) {
		requireNonNull(parameterName);

		String name = normalizeParameterName(parameterName);
		executeStatement(Statement.of(local ? format("SET LOCAL %s TO DEFAULT", name) : format("RESET %s", name)));
	}

	public void resetAllParameters() {
		executeStatement(Statement.of("RESET ALL"));
	}

	@NonNull
	private static String normalizeParameterName(@NonNull String parameterName) {
		requireNonNull(parameterName);

		String name = parameterName.trim().toLowerCase(Locale.ROOT);

		if ("all".equals(name))
			throw new IllegalArgumentException("Use the methods for all parameters instead of 'all'");

		if (!PARAMETER_NAME_PATTERN.matcher(name).matches())
			throw new IllegalArgumentException(format("Invalid parameter name '%s'", parameterName));

		return name;
	}

	// Catalog listings

	@NonNull
	public List<String> getDatabases() {
		List<String> databases = new ArrayList<>();

		for (List<Object> row : executeStatement(Statement.of("SELECT datname FROM pg_database")).getRows())
			databases.add((String) row.get(0));

		return databases;
	}

	/**
	 * Lists relations outside the system schemas as schema-qualified, quoted names.
	 *
	 * @param kinds {@code pg_class.relkind} letters to include, e.g. {@code "rv"} for tables and views; empty for all
	 * @return the relation names, ordered by schema and name
	 */
	@NonNull
	public List<String> getRelations(@NonNull String kinds) {
		requireNonNull(kinds);

		List<String> kindLiterals = new ArrayList<>(kinds.length());

		for (char kind : kinds.toCharArray()) {
			if (kind < 'a' || kind > 'z')
				throw new IllegalArgumentException(format("Invalid relation kind '%s'", kind));

			kindLiterals.add(format("'%s'", kind));
		}

		String sql = "SELECT quote_ident(s.nspname)||'.'||quote_ident(r.relname)"
				+ " FROM pg_class r"
				+ " JOIN pg_namespace s ON s.oid = r.relnamespace"
				+ " WHERE s.nspname NOT SIMILAR TO 'pg/_%|information/_schema' ESCAPE '/'"
				+ (kindLiterals.isEmpty() ? "" : format(" AND r.relkind IN (%s)", String.join(",", kindLiterals)))
				+ " ORDER BY s.nspname, r.relname";

		List<String> relations = new ArrayList<>();

		for (List<Object> row : executeStatement(Statement.of(sql)).getRows())
			relations.add((String) row.get(0));

		return relations;
	}

	@NonNull
	public List<String> getTables() {
		return getRelations("r");
	}

	// Notifications

	/**
	 * Creates a handler which listens for notifications on {@code event} and passes them to {@code callback} until
	 * notified on {@code stop_<event>}.
	 *
	 * @param event    the channel to listen on
	 * @param callback receives each notification
	 * @return the notification handler
	 */
	@NonNull
	public NotificationHandler notificationHandler(@NonNull String event,
																								 @NonNull Consumer<Optional<Notification>> callback) {
		return notificationHandler(event, callback, null, null);
	}

	/**
	 * Creates a handler which listens for notifications on {@code event}.
	 *
	 * @param event     the channel to listen on
	 * @param callback  receives each notification, or empty when {@code timeout} elapses without one
	 * @param timeout   how long to wait for a notification; {@code null} to wait forever, zero to poll once
	 * @param stopEvent the channel which stops the handler; {@code null} for {@code stop_<event>}
	 * @return the notification handler
	 */
	@NonNull
	public NotificationHandler notificationHandler(@NonNull String event,
																								 @NonNull Consumer<Optional<Notification>> callback,
																								 @Nullable Duration timeout,
																								 @Nullable String stopEvent) {
		requireNonNull(event);
		requireNonNull(callback);

		return new NotificationHandler(this, event, callback, timeout, stopEvent);
	}

	@NonNull
	List<Notification> pollNotifications(@NonNull Duration timeout) {
		requireNonNull(timeout);
		ensureOpen();

		return getTransport().pollNotifications(timeout);
	}

	@NonNull
	String escapeIdentifier(@NonNull String identifier) {
		requireNonNull(identifier);
		ensureOpen();

		return getTransport().escapeIdentifier(identifier);
	}

	// Lifecycle

	/**
	 * Replaces an owned connection with a fresh one from the same {@link DataSource}. Caches are kept.
	 */
	public void reopen() {
		if (getDataSource().isEmpty())
			throw new IllegalStateException(format("Only a %s created via withDataSource() can be reopened", getClass().getSimpleName()));

		PostgresTransport transport = openTransport(getDataSource().get());

		try {
			if (!this.closed)
				getTransport().close();
		} finally {
			this.transport = transport;
			this.parameterPreparer = new ParameterPreparer(transport);
			this.rowMarshaller = new RowMarshaller(transport);
			this.closed = false;
		}
	}

	/**
	 * Releases this instance. An owned connection is closed; a wrapped connection or transport is left open.
	 * <p>
	 * Any further operation fails with {@link InvalidConnectionException}.
	 */
	@Override
	public void close() {
		if (this.closed)
			return;

		this.closed = true;

		if (this.ownsTransport)
			getTransport().close();
	}

	public boolean isClosed() {
		return this.closed || !getTransport().isOpen();
	}

	@NonNull
	private static PostgresTransport openTransport(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);

		try {
			return new JdbcPostgresTransport(dataSource.getConnection());
		} catch (SQLException e) {
			throw new DatabaseException("Unable to acquire database connection", e);
		}
	}

	// Statement plumbing

	@NonNull
	QueryResult executeStatement(@NonNull Statement statement) {
		requireNonNull(statement);
		ensureOpen();

		QueryResult queryResult = null;
		RuntimeException exception = null;
		long startTime = nanoTime();

		try {
			queryResult = getTransport().execute(statement.getSql(), statement.getParameters());
		} catch (DatabaseException | IllegalArgumentException | IllegalStateException e) {
			// Validation failures are raised before anything reaches the server, so they are not wrapped
			exception = e;
		} catch (RuntimeException e) {
			exception = new DatabaseException(e);
		}

		StatementLog statementLog = StatementLog.withStatement(statement)
				.executionDuration(Duration.ofNanos(nanoTime() - startTime))
				.queryResult(queryResult)
				.exception(exception)
				.build();

		try {
			getStatementLogger().log(statementLog);
		} catch (RuntimeException loggerFailure) {
			if (exception == null)
				throw loggerFailure;

			exception.addSuppressed(loggerFailure);
		}

		if (exception != null)
			throw exception;

		return queryResult;
	}

	private void ensureOpen() {
		if (this.closed || !getTransport().isOpen())
			throw new InvalidConnectionException();
	}

	@NonNull
	private List<String> resolveKeyNames(@NonNull String table,
																			 @NonNull Map<String, Object> row,
																			 @Nullable String oidKey) {
		requireNonNull(table);
		requireNonNull(row);

		PrimaryKey primaryKey;

		try {
			primaryKey = getMetadataCache().primaryKey(table, false);
		} catch (NoPrimaryKeyException e) {
			if (oidKey != null && row.containsKey("oid"))
				return List.of("oid");

			throw e;
		}

		if (!row.keySet().containsAll(primaryKey.getColumns())) {
			if (oidKey != null && row.containsKey("oid"))
				return List.of("oid");

			throw new IllegalArgumentException(format("Missing value in row for primary key %s of table %s",
					primaryKey.getColumns(), table));
		}

		return primaryKey.getColumns();
	}

	@NonNull
	private String whereClause(@NonNull StatementBuilder statementBuilder,
														 @NonNull String table,
														 @NonNull List<String> keyNames,
														 @NonNull Map<String, Object> row,
														 @NonNull Map<String, String> attributes) {
		List<String> conditions = new ArrayList<>(keyNames.size());

		for (String keyName : keyNames) {
			if (!row.containsKey(keyName))
				throw new IllegalArgumentException(format("Missing value in row for key column %s", keyName));

			if (!attributes.containsKey(keyName))
				throw new IllegalArgumentException(format("Table %s has no column %s", table, keyName));

			conditions.add(format("%s = %s", getTransport().escapeIdentifier(keyName),
					statementBuilder.parameter(row.get(keyName), attributes.get(keyName))));
		}

		return String.join(" AND ", conditions);
	}

	/**
	 * Moves a literal {@code oid} entry to the table's {@code oid(<table>)} key, or drops it if the table has no OIDs.
	 */
	private static void moveOid(@NonNull Map<String, Object> row,
															@Nullable String oidKey) {
		if (!row.containsKey("oid"))
			return;

		Object oid = row.remove("oid");

		if (oidKey != null)
			row.put(oidKey, oid);
	}

	/**
	 * Escapes a table name as an identifier unless it contains a dot, in which case it is ambiguous whether it is
	 * schema-qualified and the caller is responsible for quoting.
	 */
	@NonNull
	String escapeQualifiedName(@NonNull String name) {
		requireNonNull(name);
		return name.contains(".") ? name : getTransport().escapeIdentifier(name);
	}

	/**
	 * Strips a trailing {@code *}, the legacy hint to include descendant tables, which changes nothing here.
	 */
	@NonNull
	static String stripDescendantsHint(@NonNull String tableName) {
		requireNonNull(tableName);
		return tableName.endsWith("*") ? tableName.substring(0, tableName.length() - 1).stripTrailing() : tableName;
	}

	private static boolean isRejectedSyntax(@NonNull DatabaseException e) {
		String sqlState = e.getSqlState().orElse(null);
		// 42xxx: syntax error or access rule violation, 0Axxx: feature not supported
		return sqlState == null || sqlState.startsWith("42") || sqlState.startsWith("0A");
	}

	@NonNull
	private Optional<DataSource> getDataSource() {
		return Optional.ofNullable(this.dataSource);
	}

	@NonNull
	private PostgresTransport getTransport() {
		return this.transport;
	}

	@NonNull
	private ParameterPreparer getParameterPreparer() {
		return this.parameterPreparer;
	}

	@NonNull
	private RowMarshaller getRowMarshaller() {
		return this.rowMarshaller;
	}

	@NonNull
	private MetadataCache getMetadataCache() {
		return this.metadataCache;
	}

	@NonNull
	private PrivilegeCache getPrivilegeCache() {
		return this.privilegeCache;
	}

	@NonNull
	private StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}

	/**
	 * Builder used to construct instances of {@link Database}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@Nullable
		private final PostgresTransport transport;
		@Nullable
		private final DataSource dataSource;
		@Nullable
		private StatementLogger statementLogger;
		private boolean regularTypeNames;

		private Builder(@Nullable PostgresTransport transport,
										@Nullable DataSource dataSource) {
			this.transport = transport;
			this.dataSource = dataSource;
		}

		@NonNull
		public Builder statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		/**
		 * @param regularTypeNames {@code true} to start out with full catalog type names, see
		 *                         {@link Database#useRegularTypeNames(boolean)}
		 * @return this builder
		 */
		@NonNull
		public Builder regularTypeNames(boolean regularTypeNames) {
			this.regularTypeNames = regularTypeNames;
			return this;
		}

		@NonNull
		public Database build() {
			PostgresTransport transport = this.transport == null ? openTransport(requireNonNull(this.dataSource)) : this.transport;
			return new Database(this, transport);
		}
	}
}
