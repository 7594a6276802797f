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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HexFormat;
import java.util.List;
import java.util.function.BiPredicate;
import java.util.function.Function;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Scripted in-memory {@link PostgresTransport} which records every statement it is asked to execute.
 * <p>
 * Responses are matched against the SQL and parameters, most recently registered first. Statements nothing matches
 * produce an empty result.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
class FakeTransport implements PostgresTransport {
	private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

	private final List<Statement> statements = new ArrayList<>();
	private final Deque<Response> responses = new ArrayDeque<>();
	private final Deque<List<Notification>> notifications = new ArrayDeque<>();
	private int serverVersionNumber = 160000;
	@Nullable
	private DatabaseException serverVersionFailure;
	private boolean open = true;

	@Nonnull
	static QueryResult rows(@Nonnull List<String> columnNames,
													@Nonnull List<?>... rows) {
		List<List<Object>> resultRows = new ArrayList<>();

		for (List<?> row : rows)
			resultRows.add(new ArrayList<>(row));

		return QueryResult.withRows(columnNames, resultRows);
	}

	@Nonnull
	FakeTransport respond(@Nonnull BiPredicate<String, List<Object>> matcher,
												@Nonnull Function<List<Object>, QueryResult> response) {
		requireNonNull(matcher);
		requireNonNull(response);

		this.responses.addFirst(new Response(matcher, response));
		return this;
	}

	@Nonnull
	FakeTransport respond(@Nonnull String sqlFragment,
												@Nonnull QueryResult queryResult) {
		requireNonNull(sqlFragment);
		requireNonNull(queryResult);

		return respond((sql, parameters) -> sql.contains(sqlFragment), (parameters) -> queryResult);
	}

	@Nonnull
	FakeTransport fail(@Nonnull String sqlFragment,
										 @Nonnull DatabaseException exception) {
		requireNonNull(sqlFragment);
		requireNonNull(exception);

		return respond((sql, parameters) -> sql.contains(sqlFragment), (parameters) -> {
			throw exception;
		});
	}

	/**
	 * Scripts the catalog lookup for a table's primary key; columns are given in key order and numbered accordingly.
	 */
	@Nonnull
	FakeTransport primaryKey(@Nonnull String tableName,
													 @Nonnull String... columns) {
		List<String> attributeNumbers = new ArrayList<>();

		for (int i = 1; i <= columns.length; ++i)
			attributeNumbers.add(String.valueOf(i));

		List<List<Object>> rows = new ArrayList<>();

		for (int i = 0; i < columns.length; ++i)
			rows.add(Arrays.<Object>asList(columns[i], i + 1, String.join(" ", attributeNumbers)));

		QueryResult queryResult = QueryResult.withRows(List.of("attname", "attnum", "indkey"), rows);
		return respond((sql, parameters) -> sql.contains("i.indisprimary") && tableName.equals(parameters.get(0)),
				(parameters) -> queryResult);
	}

	/**
	 * Scripts the catalog lookup for a table's columns, given as alternating names and catalog type names.
	 */
	@Nonnull
	FakeTransport attributes(@Nonnull String tableName,
													 @Nonnull String... namesAndTypes) {
		if (namesAndTypes.length % 2 != 0)
			throw new IllegalArgumentException("Names and types must come in pairs");

		List<List<Object>> rows = new ArrayList<>();

		for (int i = 0; i < namesAndTypes.length; i += 2)
			rows.add(List.<Object>of(namesAndTypes[i], namesAndTypes[i + 1]));

		QueryResult queryResult = QueryResult.withRows(List.of("attname", "typname"), rows);
		return respond((sql, parameters) -> sql.contains("FROM pg_attribute a") && tableName.equals(parameters.get(0)),
				(parameters) -> queryResult);
	}

	@Nonnull
	FakeTransport queueNotifications(@Nonnull Notification... notifications) {
		this.notifications.addLast(List.of(notifications));
		return this;
	}

	@Nonnull
	FakeTransport serverVersionNumber(int serverVersionNumber) {
		this.serverVersionNumber = serverVersionNumber;
		return this;
	}

	@Nonnull
	FakeTransport failServerVersionNumber(@Nonnull DatabaseException serverVersionFailure) {
		this.serverVersionFailure = requireNonNull(serverVersionFailure);
		return this;
	}

	@Nonnull
	List<Statement> getStatements() {
		return this.statements;
	}

	@Nonnull
	List<Statement> statementsContaining(@Nonnull String sqlFragment) {
		List<Statement> matching = new ArrayList<>();

		for (Statement statement : this.statements)
			if (statement.getSql().contains(sqlFragment))
				matching.add(statement);

		return matching;
	}

	@Nonnull
	Statement lastStatement() {
		if (this.statements.isEmpty())
			throw new IllegalStateException("No statement has been executed");

		return this.statements.get(this.statements.size() - 1);
	}

	@Nonnull
	List<String> getSql() {
		List<String> sql = new ArrayList<>(this.statements.size());

		for (Statement statement : this.statements)
			sql.add(statement.getSql());

		return sql;
	}

	@Override
	@Nonnull
	public QueryResult execute(@Nonnull String sql,
														 @Nonnull List<Object> parameters) {
		if (!this.open)
			throw new IllegalStateException("Transport is closed");

		this.statements.add(Statement.of(sql, parameters));

		for (Response response : this.responses)
			if (response.matcher.test(sql, parameters))
				return response.response.apply(parameters);

		return QueryResult.empty();
	}

	@Override
	@Nonnull
	public String escapeIdentifier(@Nonnull String identifier) {
		return format("\"%s\"", identifier.replace("\"", "\"\""));
	}

	@Override
	@Nonnull
	public String escapeBinary(@Nonnull byte[] bytes) {
		return format("\\x%s", HexFormat.of().formatHex(bytes));
	}

	@Override
	@Nonnull
	public byte[] unescapeBinary(@Nonnull String escaped) {
		if (!escaped.startsWith("\\x"))
			throw new IllegalArgumentException(format("Unsupported binary encoding '%s'", escaped));

		return HexFormat.of().parseHex(escaped.substring(2));
	}

	@Override
	@Nonnull
	public String encodeJson(@Nullable Object value) {
		try {
			return OBJECT_MAPPER.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException(e);
		}
	}

	@Override
	@Nullable
	public Object decodeJson(@Nonnull String json) {
		try {
			return OBJECT_MAPPER.readValue(json, Object.class);
		} catch (JsonProcessingException e) {
			throw new DatabaseException(e);
		}
	}

	@Override
	public int getServerVersionNumber() {
		if (this.serverVersionFailure != null)
			throw this.serverVersionFailure;

		return this.serverVersionNumber;
	}

	@Override
	@Nonnull
	public List<Notification> pollNotifications(@Nonnull Duration timeout) {
		List<Notification> pending = this.notifications.pollFirst();
		return pending == null ? List.of() : pending;
	}

	@Override
	public boolean isOpen() {
		return this.open;
	}

	@Override
	public void close() {
		this.open = false;
	}

	private static final class Response {
		private final BiPredicate<String, List<Object>> matcher;
		private final Function<List<Object>, QueryResult> response;

		private Response(@Nonnull BiPredicate<String, List<Object>> matcher,
										 @Nonnull Function<List<Object>, QueryResult> response) {
			this.matcher = matcher;
			this.response = response;
		}
	}
}
