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
import java.time.Duration;
import java.util.List;

/**
 * The connection-level capabilities a {@link Database} is built on.
 * <p>
 * Implementations own a single server session. They are not expected to be safe for concurrent use: a second thread
 * needs its own transport and its own {@link Database}.
 * <p>
 * See {@link JdbcPostgresTransport} for the implementation backed by the PostgreSQL JDBC driver.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public interface PostgresTransport extends AutoCloseable {
	/**
	 * Executes a statement whose parameters are referenced as {@code $1}, {@code $2}, ...
	 *
	 * @param sql        the statement text
	 * @param parameters positional parameter values, already prepared for the wire
	 * @return the rows or update count produced by the statement
	 * @throws DatabaseException if the server rejects the statement
	 */
	@NonNull
	QueryResult execute(@NonNull String sql,
											@NonNull List<@Nullable Object> parameters);

	/**
	 * Quotes a name for use as an SQL identifier.
	 *
	 * @param identifier the identifier to quote
	 * @return the quoted identifier
	 */
	@NonNull
	String escapeIdentifier(@NonNull String identifier);

	/**
	 * Encodes binary data in a textual form the server accepts as {@code bytea} input.
	 *
	 * @param bytes the data to encode
	 * @return the encoded data
	 */
	@NonNull
	String escapeBinary(byte @NonNull [] bytes);

	/**
	 * Decodes the textual form of a {@code bytea} value as sent by the server.
	 *
	 * @param escaped the encoded data
	 * @return the decoded data
	 */
	byte @NonNull [] unescapeBinary(@NonNull String escaped);

	@NonNull
	String encodeJson(@Nullable Object value);

	@Nullable
	Object decodeJson(@NonNull String json);

	/**
	 * Gets the server version. Implementations should not need a round trip, since this is consulted after a statement
	 * has failed, possibly inside an aborted transaction.
	 *
	 * @return the server version in {@code server_version_num} form, e.g. {@code 90500} for 9.5.0
	 */
	int getServerVersionNumber();

	/**
	 * Waits up to {@code timeout} for asynchronous notifications on channels this session listens to.
	 * <p>
	 * A zero timeout returns whatever has already arrived without waiting.
	 *
	 * @param timeout how long to wait
	 * @return the notifications received, possibly empty
	 */
	@NonNull
	List<@NonNull Notification> pollNotifications(@NonNull Duration timeout);

	/**
	 * @return {@code true} if the underlying session can still execute statements
	 */
	boolean isOpen();

	/**
	 * Releases the underlying session.
	 */
	@Override
	void close();
}
