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
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A collection of SQL statement execution diagnostics.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementLog {
	@NonNull
	private final Statement statement;
	@Nullable
	private final Duration executionDuration;
	@Nullable
	private final QueryResult queryResult;
	@Nullable
	private final Exception exception;

	/**
	 * Creates a {@code StatementLog} for the given {@code builder}.
	 *
	 * @param builder the builder used to construct this {@code StatementLog}
	 */
	private StatementLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.statement = requireNonNull(builder.statement);
		this.executionDuration = builder.executionDuration;
		this.queryResult = builder.queryResult;
		this.exception = builder.exception;
	}

	/**
	 * Creates a {@link StatementLog} builder for the given {@code statement}.
	 *
	 * @param statement the statement that was executed
	 * @return a {@link StatementLog} builder
	 */
	@NonNull
	public static Builder withStatement(@NonNull Statement statement) {
		requireNonNull(statement);
		return new Builder(statement);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(4);

		components.add(format("statement=%s", getStatement()));

		Duration executionDuration = getExecutionDuration().orElse(null);

		if (executionDuration != null)
			components.add(format("executionDuration=%s", executionDuration));

		QueryResult queryResult = getQueryResult().orElse(null);

		if (queryResult != null)
			components.add(format("queryResult=%s", queryResult));

		Exception exception = getException().orElse(null);

		if (exception != null)
			components.add(format("exception=%s", exception));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementLog))
			return false;

		StatementLog statementLog = (StatementLog) object;

		return Objects.equals(getStatement(), statementLog.getStatement())
				&& Objects.equals(getExecutionDuration(), statementLog.getExecutionDuration())
				&& Objects.equals(getQueryResult(), statementLog.getQueryResult())
				&& Objects.equals(getException(), statementLog.getException());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getStatement(), getExecutionDuration(), getQueryResult(), getException());
	}

	@NonNull
	public Statement getStatement() {
		return this.statement;
	}

	/**
	 * How long did the server round-trip take?
	 *
	 * @return how long it took to execute the SQL statement, if available
	 */
	@NonNull
	public Optional<Duration> getExecutionDuration() {
		return Optional.ofNullable(this.executionDuration);
	}

	/**
	 * @return the transport's result, or empty if the statement failed
	 */
	@NonNull
	public Optional<QueryResult> getQueryResult() {
		return Optional.ofNullable(this.queryResult);
	}

	/**
	 * @return the exception thrown while executing the statement, or empty if it succeeded
	 */
	@NonNull
	public Optional<Exception> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link StatementLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Statement statement;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private QueryResult queryResult;
		@Nullable
		private Exception exception;

		private Builder(@NonNull Statement statement) {
			requireNonNull(statement);
			this.statement = statement;
		}

		@NonNull
		public Builder executionDuration(@Nullable Duration executionDuration) {
			this.executionDuration = executionDuration;
			return this;
		}

		@NonNull
		public Builder queryResult(@Nullable QueryResult queryResult) {
			this.queryResult = queryResult;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		@NonNull
		public StatementLog build() {
			return new StatementLog(this);
		}
	}
}
