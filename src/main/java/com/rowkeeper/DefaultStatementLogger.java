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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Basic implementation of {@link StatementLogger} which logs via <a href="https://docs.oracle.com/en/java/javase/17/docs/api/java.logging/java/util/logging/package-summary.html">java.util.logging</a>.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultStatementLogger implements StatementLogger {
	@NonNull
	public static final String DEFAULT_LOGGER_NAME = "com.rowkeeper.SQL";
	@NonNull
	public static final Level DEFAULT_LOGGER_LEVEL = Level.FINE;

	@NonNull
	private final Logger logger;
	@NonNull
	private final Level loggerLevel;

	/**
	 * Creates a new statement logger with the default logger name <code>{@value #DEFAULT_LOGGER_NAME}</code> and level.
	 */
	public DefaultStatementLogger() {
		this(DEFAULT_LOGGER_NAME, DEFAULT_LOGGER_LEVEL);
	}

	/**
	 * Creates a new statement logger with the given logger name and level.
	 *
	 * @param loggerName  the logger name to use
	 * @param loggerLevel the logger level to use
	 */
	public DefaultStatementLogger(@NonNull String loggerName,
																@NonNull Level loggerLevel) {
		requireNonNull(loggerName);
		requireNonNull(loggerLevel);

		this.logger = Logger.getLogger(loggerName);
		this.loggerLevel = loggerLevel;
	}

	@Override
	public void log(@NonNull StatementLog statementLog) {
		requireNonNull(statementLog);

		if (getLogger().isLoggable(getLoggerLevel()))
			getLogger().log(getLoggerLevel(), formatStatementLog(statementLog));
	}

	@NonNull
	protected String formatStatementLog(@NonNull StatementLog statementLog) {
		requireNonNull(statementLog);

		List<String> lines = new ArrayList<>(4);
		Statement statement = statementLog.getStatement();

		lines.add(statement.getSql());

		if (statement.getParameters().size() > 0)
			lines.add(format("Parameters: %s", statement.describeParameters()));

		if (statementLog.getExecutionDuration().isPresent())
			lines.add(format("%s executing statement", statementLog.getExecutionDuration().get()));

		Throwable exception = statementLog.getException().orElse(null);

		if (exception != null) {
			if (exception instanceof DatabaseException && exception.getCause() != null)
				exception = exception.getCause();

			lines.add(format("Failed due to %s", exception.toString()));
		}

		return lines.stream().collect(joining("\n"));
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@NonNull
	protected Level getLoggerLevel() {
		return this.loggerLevel;
	}
}
