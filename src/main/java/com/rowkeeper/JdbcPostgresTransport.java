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
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.postgresql.core.Utils;
import org.postgresql.util.PGbytea;

import javax.annotation.concurrent.NotThreadSafe;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Types;
import java.time.Duration;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Locale;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link PostgresTransport} backed by a JDBC {@link Connection} to a PostgreSQL server.
 * <p>
 * {@code $N} placeholders are rewritten to JDBC's {@code ?} form before execution; a placeholder may be referenced
 * more than once. {@link String} parameters are sent untyped so the server infers their type from context, the same
 * way it treats literals.
 * <p>
 * {@code bytea} columns are read in their textual form and {@code json}/{@code jsonb} columns are decoded with
 * Jackson. All other columns are read as the driver maps them.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class JdbcPostgresTransport implements PostgresTransport {
	@NonNull
	private static final ObjectMapper OBJECT_MAPPER;

	static {
		OBJECT_MAPPER = new ObjectMapper();
	}

	@NonNull
	private final Connection connection;
	private final boolean untypedStrings;
	@Nullable
	private Integer serverVersionNumber;
	@Nullable
	private Boolean largeUpdateCountSupported;

	/**
	 * Creates a transport for the given connection. The connection is closed by {@link #close()}.
	 *
	 * @param connection a connection to a PostgreSQL server
	 */
	public JdbcPostgresTransport(@NonNull Connection connection) {
		requireNonNull(connection);

		this.connection = connection;
		this.untypedStrings = isPostgresConnection(connection);
	}

	@Override
	@NonNull
	public QueryResult execute(@NonNull String sql,
														 @NonNull List<@Nullable Object> parameters) {
		requireNonNull(sql);
		requireNonNull(parameters);

		RewrittenSql rewrittenSql = rewritePlaceholders(sql);

		for (Integer parameterNumber : rewrittenSql.getParameterNumbers())
			if (parameterNumber > parameters.size())
				throw new IllegalArgumentException(format("Statement refers to $%d but only %d parameter[s] were given. SQL: %s",
						parameterNumber, parameters.size(), sql));

		try (PreparedStatement preparedStatement = getConnection().prepareStatement(rewrittenSql.getSql())) {
			List<Integer> parameterNumbers = rewrittenSql.getParameterNumbers();

			for (int i = 0; i < parameterNumbers.size(); ++i)
				bindParameter(preparedStatement, i + 1, parameters.get(parameterNumbers.get(i) - 1));

			if (preparedStatement.execute()) {
				try (ResultSet resultSet = preparedStatement.getResultSet()) {
					return readRows(resultSet);
				}
			}

			long updateCount = updateCount(preparedStatement);
			return updateCount < 0 ? QueryResult.empty() : QueryResult.withUpdateCount(updateCount);
		} catch (SQLException e) {
			throw new DatabaseException(e);
		}
	}

	protected void bindParameter(@NonNull PreparedStatement preparedStatement,
															 int parameterIndex,
															 @Nullable Object parameter) throws SQLException {
		requireNonNull(preparedStatement);

		if (parameter == null) {
			preparedStatement.setNull(parameterIndex, Types.NULL);
		} else if (parameter instanceof byte[] bytes) {
			preparedStatement.setBytes(parameterIndex, bytes);
		} else if (parameter instanceof Number || parameter instanceof Boolean || parameter instanceof Temporal
				|| parameter instanceof Date) {
			preparedStatement.setObject(parameterIndex, parameter);
		} else if (this.untypedStrings) {
			preparedStatement.setObject(parameterIndex, parameter.toString(), Types.OTHER);
		} else {
			preparedStatement.setString(parameterIndex, parameter.toString());
		}
	}

	@NonNull
	protected QueryResult readRows(@NonNull ResultSet resultSet) throws SQLException {
		requireNonNull(resultSet);

		ResultSetMetaData resultSetMetaData = resultSet.getMetaData();
		int columnCount = resultSetMetaData.getColumnCount();
		List<String> columnNames = new ArrayList<>(columnCount);
		List<String> columnTypeNames = new ArrayList<>(columnCount);

		for (int i = 1; i <= columnCount; ++i) {
			columnNames.add(resultSetMetaData.getColumnLabel(i));
			String columnTypeName = resultSetMetaData.getColumnTypeName(i);
			columnTypeNames.add(columnTypeName == null ? "" : columnTypeName.toLowerCase(Locale.ROOT));
		}

		List<List<Object>> rows = new ArrayList<>();

		while (resultSet.next()) {
			List<Object> row = new ArrayList<>(columnCount);

			for (int i = 1; i <= columnCount; ++i) {
				String columnTypeName = columnTypeNames.get(i - 1);

				if ("bytea".equals(columnTypeName)) {
					row.add(resultSet.getString(i));
				} else if ("json".equals(columnTypeName) || "jsonb".equals(columnTypeName)) {
					String json = resultSet.getString(i);
					row.add(json == null ? null : decodeJson(json));
				} else {
					row.add(resultSet.getObject(i));
				}
			}

			rows.add(Collections.unmodifiableList(row));
		}

		return QueryResult.withRows(columnNames, rows);
	}

	private long updateCount(@NonNull PreparedStatement preparedStatement) throws SQLException {
		requireNonNull(preparedStatement);

		if (Boolean.FALSE.equals(this.largeUpdateCountSupported))
			return preparedStatement.getUpdateCount();

		// If the driver doesn't support getLargeUpdateCount, then UnsupportedOperationException is thrown.
		try {
			long updateCount = preparedStatement.getLargeUpdateCount();
			this.largeUpdateCountSupported = true;
			return updateCount;
		} catch (SQLFeatureNotSupportedException | UnsupportedOperationException | AbstractMethodError e) {
			this.largeUpdateCountSupported = false;
			return preparedStatement.getUpdateCount();
		}
	}

	@Override
	@NonNull
	public String escapeIdentifier(@NonNull String identifier) {
		requireNonNull(identifier);

		try {
			return Utils.escapeIdentifier(null, identifier).toString();
		} catch (SQLException e) {
			throw new IllegalArgumentException(format("Unable to escape identifier '%s'", identifier), e);
		}
	}

	@Override
	@NonNull
	public String escapeBinary(byte @NonNull [] bytes) {
		requireNonNull(bytes);
		return PGbytea.toPGString(bytes);
	}

	@Override
	public byte @NonNull [] unescapeBinary(@NonNull String escaped) {
		requireNonNull(escaped);

		try {
			return PGbytea.toBytes(escaped.getBytes(StandardCharsets.US_ASCII));
		} catch (SQLException e) {
			throw new DatabaseException("Unable to decode binary data", e);
		}
	}

	@Override
	@NonNull
	public String encodeJson(@Nullable Object value) {
		try {
			return OBJECT_MAPPER.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException(format("Unable to encode %s as JSON", value == null ? null : value.getClass().getName()), e);
		}
	}

	@Override
	@Nullable
	public Object decodeJson(@NonNull String json) {
		requireNonNull(json);

		try {
			return OBJECT_MAPPER.readValue(json, Object.class);
		} catch (JsonProcessingException e) {
			throw new DatabaseException("Unable to decode JSON returned by the server", e);
		}
	}

	/**
	 * Reads the server version from the driver's {@link DatabaseMetaData}, which PostgreSQL reports at connection
	 * startup, so no statement is sent and it works inside an aborted transaction.
	 */
	@Override
	public int getServerVersionNumber() {
		if (this.serverVersionNumber == null) {
			try {
				DatabaseMetaData databaseMetaData = getConnection().getMetaData();
				this.serverVersionNumber = serverVersionNumber(databaseMetaData.getDatabaseMajorVersion(),
						databaseMetaData.getDatabaseMinorVersion());
			} catch (SQLException e) {
				throw new DatabaseException("Unable to determine the server version", e);
			}
		}

		return this.serverVersionNumber;
	}

	// Same numbering as server_version_num: 90400 for 9.4, 160002 for 16.2 (a 9.x patch level is not in the metadata)
	static int serverVersionNumber(int majorVersion,
																 int minorVersion) {
		return majorVersion < 10 ? majorVersion * 10000 + minorVersion * 100 : majorVersion * 10000 + minorVersion;
	}

	@Override
	@NonNull
	public List<@NonNull Notification> pollNotifications(@NonNull Duration timeout) {
		requireNonNull(timeout);

		if (timeout.isNegative())
			throw new IllegalArgumentException("Timeout must not be negative");

		try {
			PGConnection pgConnection = getConnection().unwrap(PGConnection.class);
			// A zero timeout would block indefinitely, the no-argument form only drains what has arrived
			PGNotification[] pgNotifications = timeout.isZero()
					? pgConnection.getNotifications()
					: pgConnection.getNotifications((int) Math.min(Integer.MAX_VALUE, Math.max(1L, timeout.toMillis())));

			if (pgNotifications == null)
				return List.of();

			List<Notification> notifications = new ArrayList<>(pgNotifications.length);

			for (PGNotification pgNotification : pgNotifications) {
				String payload = pgNotification.getParameter();
				notifications.add(new Notification(pgNotification.getName(), pgNotification.getPID(),
						payload == null || payload.isEmpty() ? null : payload));
			}

			return notifications;
		} catch (SQLException e) {
			throw new DatabaseException("Unable to receive notifications", e);
		}
	}

	@Override
	public boolean isOpen() {
		try {
			return !getConnection().isClosed();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to determine connection state", e);
		}
	}

	@Override
	public void close() {
		try {
			getConnection().close();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to close database connection", e);
		}
	}

	/**
	 * Rewrites {@code $N} placeholders to JDBC {@code ?} placeholders.
	 * <p>
	 * Quoted identifiers, string constants (including {@code E''} and {@code U&''} forms), dollar-quoted strings and
	 * comments are left alone. A literal {@code ?} elsewhere is doubled, which is how the PostgreSQL driver expects
	 * operators such as {@code ?|} to be written.
	 *
	 * @param sql SQL with {@code $N} placeholders
	 * @return the rewritten SQL and, per {@code ?}, the number of the placeholder it replaced
	 */
	@NonNull
	static RewrittenSql rewritePlaceholders(@NonNull String sql) {
		requireNonNull(sql);

		StringBuilder rewritten = new StringBuilder(sql.length());
		List<Integer> parameterNumbers = new ArrayList<>();

		boolean inSingleQuote = false;
		boolean inSingleQuoteEscapesBackslash = false;
		boolean inDoubleQuote = false;
		boolean inLineComment = false;
		int blockCommentDepth = 0;
		String dollarQuoteDelimiter = null;

		for (int i = 0; i < sql.length(); ) {
			if (dollarQuoteDelimiter != null) {
				if (sql.startsWith(dollarQuoteDelimiter, i)) {
					rewritten.append(dollarQuoteDelimiter);
					i += dollarQuoteDelimiter.length();
					dollarQuoteDelimiter = null;
				} else {
					rewritten.append(sql.charAt(i));
					++i;
				}

				continue;
			}

			char c = sql.charAt(i);

			if (inLineComment) {
				rewritten.append(c);
				++i;

				if (c == '\n' || c == '\r')
					inLineComment = false;

				continue;
			}

			if (blockCommentDepth > 0) {
				if (c == '*' && i + 1 < sql.length() && sql.charAt(i + 1) == '/') {
					rewritten.append("*/");
					i += 2;
					--blockCommentDepth;
				} else if (c == '/' && i + 1 < sql.length() && sql.charAt(i + 1) == '*') {
					// Block comments nest
					rewritten.append("/*");
					i += 2;
					++blockCommentDepth;
				} else {
					rewritten.append(c);
					++i;
				}

				continue;
			}

			if (inSingleQuote) {
				rewritten.append(c);

				if (inSingleQuoteEscapesBackslash && c == '\\' && i + 1 < sql.length()) {
					rewritten.append(sql.charAt(i + 1));
					i += 2;
					continue;
				}

				if (c == '\'') {
					// Escaped quote: ''
					if (i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
						rewritten.append('\'');
						i += 2;
						continue;
					}

					inSingleQuote = false;
					inSingleQuoteEscapesBackslash = false;
				}

				++i;
				continue;
			}

			if (inDoubleQuote) {
				rewritten.append(c);

				if (c == '"') {
					// Escaped quote: ""
					if (i + 1 < sql.length() && sql.charAt(i + 1) == '"') {
						rewritten.append('"');
						i += 2;
						continue;
					}

					inDoubleQuote = false;
				}

				++i;
				continue;
			}

			if (c == '-' && i + 1 < sql.length() && sql.charAt(i + 1) == '-') {
				rewritten.append("--");
				i += 2;
				inLineComment = true;
				continue;
			}

			if (c == '/' && i + 1 < sql.length() && sql.charAt(i + 1) == '*') {
				rewritten.append("/*");
				i += 2;
				blockCommentDepth = 1;
				continue;
			}

			if ((c == 'U' || c == 'u') && i + 2 < sql.length() && sql.charAt(i + 1) == '&' && sql.charAt(i + 2) == '\''
					&& !precededByIdentifierPart(sql, i)) {
				inSingleQuote = true;
				inSingleQuoteEscapesBackslash = false;
				rewritten.append(c).append("&'");
				i += 3;
				continue;
			}

			if ((c == 'E' || c == 'e') && i + 1 < sql.length() && sql.charAt(i + 1) == '\'' && !precededByIdentifierPart(sql, i)) {
				inSingleQuote = true;
				inSingleQuoteEscapesBackslash = true;
				rewritten.append(c).append('\'');
				i += 2;
				continue;
			}

			if (c == '\'') {
				inSingleQuote = true;
				inSingleQuoteEscapesBackslash = false;
				rewritten.append(c);
				++i;
				continue;
			}

			if (c == '"') {
				inDoubleQuote = true;
				rewritten.append(c);
				++i;
				continue;
			}

			if (c == '$' && !precededByIdentifierPart(sql, i)) {
				int numberEndIndex = i + 1;

				while (numberEndIndex < sql.length() && Character.isDigit(sql.charAt(numberEndIndex)))
					++numberEndIndex;

				if (numberEndIndex > i + 1) {
					int parameterNumber = Integer.parseInt(sql.substring(i + 1, numberEndIndex));

					if (parameterNumber < 1)
						throw new IllegalArgumentException(format("Invalid placeholder $%d. SQL: %s", parameterNumber, sql));

					parameterNumbers.add(parameterNumber);
					rewritten.append('?');
					i = numberEndIndex;
					continue;
				}

				String delimiter = parseDollarQuoteDelimiter(sql, i);

				if (delimiter != null) {
					rewritten.append(delimiter);
					i += delimiter.length();
					dollarQuoteDelimiter = delimiter;
					continue;
				}
			}

			if (c == '?') {
				rewritten.append("??");
				++i;
				continue;
			}

			rewritten.append(c);
			++i;
		}

		return new RewrittenSql(rewritten.toString(), parameterNumbers);
	}

	private static boolean precededByIdentifierPart(@NonNull String sql,
																									int index) {
		if (index == 0)
			return false;

		char c = sql.charAt(index - 1);
		return Character.isLetterOrDigit(c) || c == '_' || c == '$';
	}

	/**
	 * Parses a dollar-quote opening delimiter such as {@code $$} or {@code $body$}.
	 */
	@Nullable
	private static String parseDollarQuoteDelimiter(@NonNull String sql,
																									int startIndex) {
		requireNonNull(sql);

		int i = startIndex + 1;

		if (i < sql.length() && sql.charAt(i) == '$')
			return "$$";

		if (i >= sql.length() || !(Character.isLetter(sql.charAt(i)) || sql.charAt(i) == '_'))
			return null;

		while (i < sql.length()) {
			char c = sql.charAt(i);

			if (c == '$')
				return sql.substring(startIndex, i + 1);

			if (!(Character.isLetterOrDigit(c) || c == '_'))
				return null;

			++i;
		}

		return null;
	}

	private static boolean isPostgresConnection(@NonNull Connection connection) {
		requireNonNull(connection);

		try {
			return connection.isWrapperFor(PGConnection.class);
		} catch (SQLException e) {
			throw new DatabaseException("Unable to inspect database connection", e);
		}
	}

	@NonNull
	protected Connection getConnection() {
		return this.connection;
	}

	/**
	 * SQL rewritten for JDBC plus the placeholder number behind each {@code ?}.
	 */
	static final class RewrittenSql {
		@NonNull
		private final String sql;
		@NonNull
		private final List<Integer> parameterNumbers;

		RewrittenSql(@NonNull String sql,
								 @NonNull List<Integer> parameterNumbers) {
			requireNonNull(sql);
			requireNonNull(parameterNumbers);

			this.sql = sql;
			this.parameterNumbers = List.copyOf(parameterNumbers);
		}

		@NonNull
		String getSql() {
			return this.sql;
		}

		@NonNull
		List<Integer> getParameterNumbers() {
			return this.parameterNumbers;
		}
	}
}
