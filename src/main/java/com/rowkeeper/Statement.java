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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A SQL statement together with the positional parameters its {@code $N} placeholders refer to.
 * <p>
 * Instances are immutable, so the text and its parameters can never drift apart once built.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Statement {
	/**
	 * The point at which we ellipsize output for parameters.
	 */
	private static final int MAXIMUM_PARAMETER_RENDERING_LENGTH = 100;

	@NonNull
	private final String sql;
	@NonNull
	private final List<Object> parameters;

	private Statement(@NonNull String sql,
										@NonNull List<@Nullable Object> parameters) {
		requireNonNull(sql);
		requireNonNull(parameters);

		this.sql = sql;
		this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
	}

	/**
	 * Factory method for providing {@link Statement} instances.
	 *
	 * @param sql        the SQL text
	 * @param parameters values for the {@code $N} placeholders in {@code sql}
	 * @return a statement instance
	 */
	@NonNull
	public static Statement of(@NonNull String sql,
														 @NonNull List<@Nullable Object> parameters) {
		requireNonNull(sql);
		requireNonNull(parameters);

		return new Statement(sql, parameters);
	}

	@NonNull
	public static Statement of(@NonNull String sql) {
		requireNonNull(sql);
		return new Statement(sql, List.of());
	}

	/**
	 * Renders a parameter value for diagnostics.
	 * <p>
	 * Numbers are shown bare, binary data by its length only, and long text is ellipsized so that escaped
	 * {@code bytea} or encoded JSON values stay readable.
	 *
	 * @param parameter the value to render
	 * @return a human-readable representation
	 */
	@NonNull
	public static String renderParameter(@Nullable Object parameter) {
		if (parameter == null)
			return "null";

		if (parameter instanceof Number || parameter instanceof Boolean)
			return format("%s", parameter);

		if (parameter instanceof byte[] bytes)
			return format("[byte array of length %d]", bytes.length);

		return format("'%s'", ellipsize(parameter.toString(), MAXIMUM_PARAMETER_RENDERING_LENGTH));
	}

	@NonNull
	private static String ellipsize(@NonNull String string,
																	int maximumLength) {
		requireNonNull(string);

		string = string.trim();

		if (string.length() <= maximumLength)
			return string;

		return format("%s...", string.substring(0, maximumLength));
	}

	/**
	 * Describes the parameters in {@code $1='a', $2=42} form, rendered via {@link #renderParameter(Object)}.
	 *
	 * @return the parameter description, empty if there are no parameters
	 */
	@NonNull
	public String describeParameters() {
		List<String> descriptions = new ArrayList<>(getParameters().size());

		for (int i = 0; i < getParameters().size(); ++i)
			descriptions.add(format("$%d=%s", i + 1, renderParameter(getParameters().get(i))));

		return String.join(", ", descriptions);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSql(), getParameters());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Statement))
			return false;

		Statement statement = (Statement) object;

		return Objects.equals(statement.getSql(), getSql())
				&& Objects.equals(statement.getParameters(), getParameters());
	}

	@Override
	@NonNull
	public String toString() {
		// Strip out newlines for more compact SQL representation
		return format("%s{sql=%s, parameters=[%s]}", getClass().getSimpleName(),
				getSql().replaceAll("\n+", " ").trim(), describeParameters());
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}

	@NonNull
	public List<Object> getParameters() {
		return this.parameters;
	}
}
