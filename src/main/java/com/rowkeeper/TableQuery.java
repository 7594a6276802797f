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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Fluent builder for reading many rows of a table at once, as a list of records or as a map keyed by key columns.
 * <p>
 * The table name, columns, conditions and order expressions are used verbatim as SQL, so they may be arbitrary
 * expressions. Conditions may refer to parameters as {@code $1}, {@code $2}, ..., numbered across all conditions.
 * <p>
 * Note that without a condition or a limit, the whole table is read into memory.
 *
 * <pre>
 * List&lt;Map&lt;String, Object&gt;&gt; cars = database.table("car")
 *   .where("color = $1", "blue")
 *   .limit(10)
 *   .fetchList();</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public final class TableQuery {
	@NonNull
	private final Database database;
	@NonNull
	private final String tableName;
	@NonNull
	private final List<String> columns;
	@NonNull
	private final List<String> conditions;
	@NonNull
	private final List<Object> parameters;
	@Nullable
	private List<String> orderBy;
	@Nullable
	private List<String> keyNames;
	private long limit;
	private long offset;
	private boolean scalar;

	TableQuery(@NonNull Database database,
						 @NonNull String tableName) {
		requireNonNull(database);
		requireNonNull(tableName);

		if (tableName.isBlank())
			throw new IllegalArgumentException("The table name is missing");

		this.database = database;
		this.tableName = tableName;
		this.columns = new ArrayList<>();
		this.conditions = new ArrayList<>();
		this.parameters = new ArrayList<>();
	}

	/**
	 * Restricts the columns read. Unless {@link #orderBy(String...)} is given, rows are then ordered by these columns.
	 */
	@NonNull
	public TableQuery columns(@NonNull String @NonNull ... columns) {
		requireNonNull(columns);

		for (String column : columns)
			this.columns.add(requireNonNull(column));

		return this;
	}

	/**
	 * Adds a condition rows must fulfill. Multiple conditions are combined with {@code AND}.
	 *
	 * @param condition  an SQL expression
	 * @param parameters values for the {@code $N} placeholders the condition introduces
	 * @return this builder
	 */
	@NonNull
	public TableQuery where(@NonNull String condition,
													@Nullable Object @NonNull ... parameters) {
		requireNonNull(condition);
		requireNonNull(parameters);

		this.conditions.add(condition);
		this.parameters.addAll(Arrays.asList(parameters));
		return this;
	}

	@NonNull
	public TableQuery orderBy(@NonNull String @NonNull ... orderBy) {
		requireNonNull(orderBy);

		List<String> expressions = new ArrayList<>(orderBy.length);

		for (String expression : orderBy)
			expressions.add(requireNonNull(expression));

		this.orderBy = expressions;
		return this;
	}

	/**
	 * Skips the default ordering, for when the order does not matter.
	 */
	@NonNull
	public TableQuery unordered() {
		this.orderBy = List.of();
		return this;
	}

	@NonNull
	public TableQuery limit(long limit) {
		if (limit < 0)
			throw new IllegalArgumentException("Limit must not be negative");

		this.limit = limit;
		return this;
	}

	@NonNull
	public TableQuery offset(long offset) {
		if (offset < 0)
			throw new IllegalArgumentException("Offset must not be negative");

		this.offset = offset;
		return this;
	}

	/**
	 * Sets the columns keying the map returned by {@link #fetchMap()}, instead of the primary key.
	 */
	@NonNull
	public TableQuery keyNames(@NonNull String @NonNull ... keyNames) {
		requireNonNull(keyNames);

		if (keyNames.length == 0)
			throw new IllegalArgumentException("No key column has been specified");

		List<String> names = new ArrayList<>(keyNames.length);

		for (String keyName : keyNames)
			names.add(requireNonNull(keyName));

		this.keyNames = names;
		return this;
	}

	/**
	 * Makes {@link #fetchMap()} map each key to the first non-key column instead of a record.
	 */
	@NonNull
	public TableQuery scalar() {
		this.scalar = true;
		return this;
	}

	/**
	 * Reads the rows as records.
	 * <p>
	 * Unless told otherwise, rows are ordered by the selected columns, else by the primary key, else by all columns.
	 *
	 * @return the records, possibly empty
	 */
	@NonNull
	public List<Map<String, Object>> fetchList() {
		List<String> order = this.orderBy;

		if (order == null)
			order = this.columns.isEmpty() ? defaultListOrder() : this.columns;

		return this.database.executeStatement(statement(order)).toMaps();
	}

	/**
	 * Reads the first column of each row.
	 *
	 * @return the values, possibly empty
	 */
	@NonNull
	public List<Object> fetchScalars() {
		List<Object> values = new ArrayList<>();

		for (Map<String, Object> row : fetchList())
			values.add(row.isEmpty() ? null : row.values().iterator().next());

		return values;
	}

	/**
	 * Reads the rows as a map keyed by the key columns, in row order.
	 * <p>
	 * With a single key column the map keys are its values; with several they are lists of values in key column
	 * order. Map values are records of the non-key columns, or with {@link #scalar()} the first non-key column.
	 * Unless told otherwise, rows are ordered by the key columns.
	 *
	 * @return the rows by key, possibly empty
	 * @throws NoPrimaryKeyException if no key columns were given and the table has no primary key
	 */
	@NonNull
	public Map<Object, Object> fetchMap() {
		List<String> keyNames = this.keyNames == null
				? this.database.primaryKey(this.tableName).getColumns()
				: this.keyNames;

		List<String> order = this.orderBy;

		if (order == null)
			order = this.columns.isEmpty() ? quoted(keyNames) : this.columns;

		QueryResult queryResult = this.database.executeStatement(statement(order));
		Map<Object, Object> rowsByKey = new LinkedHashMap<>();

		if (queryResult.getRows().isEmpty())
			return rowsByKey;

		List<String> columnNames = queryResult.getColumnNames();

		for (String keyName : keyNames)
			if (!columnNames.contains(keyName))
				throw new IllegalArgumentException(format("Missing key column %s in result columns %s", keyName, columnNames));

		Set<String> keyNameSet = new HashSet<>(keyNames);

		for (Map<String, Object> row : queryResult.toMaps()) {
			Object key;

			if (keyNames.size() == 1) {
				key = row.get(keyNames.get(0));
			} else {
				List<Object> keyValues = new ArrayList<>(keyNames.size());

				for (String keyName : keyNames)
					keyValues.add(row.get(keyName));

				key = Collections.unmodifiableList(keyValues);
			}

			Map<String, Object> values = new LinkedHashMap<>();

			for (Map.Entry<String, Object> entry : row.entrySet())
				if (!keyNameSet.contains(entry.getKey()))
					values.put(entry.getKey(), entry.getValue());

			rowsByKey.put(key, this.scalar ? (values.isEmpty() ? null : values.values().iterator().next()) : values);
		}

		return rowsByKey;
	}

	@NonNull
	private List<String> defaultListOrder() {
		try {
			return quoted(this.database.primaryKey(this.tableName).getColumns());
		} catch (NoPrimaryKeyException e) {
			List<String> attributeNames = new ArrayList<>(this.database.getAttributes(this.tableName).keySet());
			attributeNames.remove("oid");
			return quoted(attributeNames);
		}
	}

	@NonNull
	private List<String> quoted(@NonNull List<String> names) {
		List<String> quotedNames = new ArrayList<>(names.size());

		for (String name : names)
			quotedNames.add(this.database.escapeIdentifier(name));

		return quotedNames;
	}

	@NonNull
	private Statement statement(@NonNull List<String> order) {
		requireNonNull(order);

		List<String> sql = new ArrayList<>();
		sql.add("SELECT");
		sql.add(this.columns.isEmpty() ? "*" : String.join(", ", this.columns));
		sql.add("FROM");
		sql.add(this.tableName);

		if (!this.conditions.isEmpty()) {
			List<String> conditions = new ArrayList<>(this.conditions.size());

			for (String condition : this.conditions)
				conditions.add(this.conditions.size() == 1 ? condition : format("(%s)", condition));

			sql.add("WHERE");
			sql.add(String.join(" AND ", conditions));
		}

		if (!order.isEmpty()) {
			sql.add("ORDER BY");
			sql.add(String.join(", ", order));
		}

		if (this.limit > 0)
			sql.add(format("LIMIT %d", this.limit));

		if (this.offset > 0)
			sql.add(format("OFFSET %d", this.offset));

		return Statement.of(String.join(" ", sql), this.parameters);
	}
}
