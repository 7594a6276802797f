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
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Converts caller-supplied values into positional statement parameters according to a column's {@link SemanticType}.
 * <p>
 * A value either becomes a parameter, in which case it is appended to the parameter list and a {@code $N} placeholder
 * is returned, or it is rendered inline: {@code NULL} for values that count as absent for their type, and the bare
 * keyword for date/time keywords such as {@code current_timestamp}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
final class ParameterPreparer {
	@NonNull
	static final String NULL_LITERAL = "NULL";

	@NonNull
	private static final Set<String> TRUE_VALUES;
	@NonNull
	private static final Set<String> DATE_KEYWORDS;

	static {
		TRUE_VALUES = Set.of("t", "true", "1", "y", "yes", "on");
		DATE_KEYWORDS = Set.of("current_date", "current_time", "current_timestamp", "localtime", "localtimestamp");
	}

	@NonNull
	private final PostgresTransport transport;

	ParameterPreparer(@NonNull PostgresTransport transport) {
		requireNonNull(transport);
		this.transport = transport;
	}

	/**
	 * Prepares {@code value} for a column of the given type.
	 *
	 * @param value      the caller's value
	 * @param typeName   the column's type name as held in the attribute cache
	 * @param parameters the parameter list to append to
	 * @return the SQL fragment to use in place of the value
	 */
	@NonNull
	String prepare(@Nullable Object value,
								 @Nullable String typeName,
								 @NonNull List<@Nullable Object> parameters) {
		requireNonNull(parameters);

		SemanticType semanticType = SemanticType.forTypeName(typeName);

		if (value == null || semanticType == SemanticType.TEXT)
			return append(value, parameters);

		switch (semanticType) {
			case BOOL:
				return prepareBool(value, parameters);
			case DATE:
				return prepareDate(value, parameters);
			case INT:
			case FLOAT:
			case NUM:
			case MONEY:
				return prepareNumber(value, parameters);
			case BYTEA:
				return append(getTransport().escapeBinary(toBytes(value)), parameters);
			case JSON:
				return append(getTransport().encodeJson(value), parameters);
			default:
				throw new IllegalStateException(format("Unexpected type %s", semanticType));
		}
	}

	@NonNull
	private String prepareBool(@NonNull Object value,
														 @NonNull List<@Nullable Object> parameters) {
		boolean bool;

		if (value instanceof String string) {
			if (string.isEmpty())
				return NULL_LITERAL;

			bool = TRUE_VALUES.contains(string.toLowerCase(Locale.ROOT));
		} else {
			bool = isTruthy(value);
		}

		return append(bool ? "t" : "f", parameters);
	}

	@NonNull
	private String prepareDate(@NonNull Object value,
														 @NonNull List<@Nullable Object> parameters) {
		if (!isTruthy(value))
			return NULL_LITERAL;

		// Quoting these would turn them into literal strings
		if (value instanceof String string && DATE_KEYWORDS.contains(string.toLowerCase(Locale.ROOT)))
			return string;

		return append(value, parameters);
	}

	@NonNull
	private String prepareNumber(@NonNull Object value,
															 @NonNull List<@Nullable Object> parameters) {
		if (!isTruthy(value) && !isZero(value))
			return NULL_LITERAL;

		return append(value, parameters);
	}

	@NonNull
	private static String append(@Nullable Object value,
															 @NonNull List<@Nullable Object> parameters) {
		parameters.add(value);
		return format("$%d", parameters.size());
	}

	private static byte @NonNull [] toBytes(@NonNull Object value) {
		if (value instanceof byte[] bytes)
			return bytes;

		if (value instanceof String string)
			return string.getBytes(StandardCharsets.UTF_8);

		throw new IllegalArgumentException(format("Cannot use a value of %s as bytea, expected byte[] or String",
				value.getClass().getName()));
	}

	/**
	 * Truthiness of a caller-supplied value.
	 * <p>
	 * {@code null}, {@code false}, numeric zero and empty strings, collections, maps and arrays are falsy;
	 * everything else is truthy.
	 *
	 * @param value the value to test
	 * @return {@code true} if the value is truthy
	 */
	static boolean isTruthy(@Nullable Object value) {
		if (value == null)
			return false;
		if (value instanceof Boolean bool)
			return bool;
		if (value instanceof Number)
			return !isZero(value);
		if (value instanceof CharSequence charSequence)
			return charSequence.length() > 0;
		if (value instanceof Collection<?> collection)
			return !collection.isEmpty();
		if (value instanceof Map<?, ?> map)
			return !map.isEmpty();
		if (value.getClass().isArray())
			return Array.getLength(value) > 0;

		return true;
	}

	private static boolean isZero(@NonNull Object value) {
		if (value instanceof BigDecimal bigDecimal)
			return bigDecimal.signum() == 0;
		if (value instanceof BigInteger bigInteger)
			return bigInteger.signum() == 0;
		if (value instanceof Double || value instanceof Float)
			return ((Number) value).doubleValue() == 0D;
		if (value instanceof Number number)
			return number.longValue() == 0L;
		if (value instanceof Boolean bool)
			return !bool;

		return false;
	}

	@NonNull
	private PostgresTransport getTransport() {
		return this.transport;
	}
}
