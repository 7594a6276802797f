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

import java.util.Locale;

/**
 * Simplified classification of PostgreSQL catalog types.
 * <p>
 * Each class determines how values are prepared as statement parameters and how result values are converted back.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public enum SemanticType {
	BOOL("bool"),
	DATE("date"),
	INT("int"),
	FLOAT("float"),
	NUM("num"),
	MONEY("money"),
	BYTEA("bytea"),
	JSON("json"),
	TEXT("text");

	@NonNull
	private final String typeName;

	SemanticType(@NonNull String typeName) {
		this.typeName = typeName;
	}

	/**
	 * Determines the semantic class of a raw catalog type name, e.g. {@code int4} or {@code timestamptz}.
	 * <p>
	 * Rules are checked in order against the start of the type name and the first match wins, so {@code interval}
	 * is a {@link #DATE} even though it also starts with {@code int}. Unknown types are {@link #TEXT}.
	 *
	 * @param rawTypeName the catalog type name
	 * @return the semantic class, never {@code null}
	 */
	@NonNull
	public static SemanticType classify(@Nullable String rawTypeName) {
		if (rawTypeName == null)
			return TEXT;

		String typeName = rawTypeName.toLowerCase(Locale.ROOT);

		if (typeName.startsWith("bool"))
			return BOOL;
		if (startsWithAny(typeName, "abstime", "date", "interval", "timestamp"))
			return DATE;
		if (startsWithAny(typeName, "cid", "oid", "int", "xid"))
			return INT;
		if (typeName.startsWith("float"))
			return FLOAT;
		if (typeName.startsWith("numeric"))
			return NUM;
		if (typeName.startsWith("money"))
			return MONEY;
		if (typeName.startsWith("bytea"))
			return BYTEA;
		if (typeName.startsWith("json"))
			return JSON;

		return TEXT;
	}

	/**
	 * Resolves a type name as stored in the attribute cache.
	 * <p>
	 * This is either one of our own class names (e.g. {@code num}) or, when regular type names are in use, a full
	 * catalog type name (e.g. {@code double precision}) which is then classified.
	 *
	 * @param typeName a semantic class name or a catalog type name
	 * @return the semantic class, never {@code null}
	 */
	@NonNull
	public static SemanticType forTypeName(@Nullable String typeName) {
		if (typeName == null)
			return TEXT;

		for (SemanticType semanticType : values())
			if (semanticType.getTypeName().equals(typeName))
				return semanticType;

		// Regular type names the prefix rules do not cover
		switch (typeName.toLowerCase(Locale.ROOT)) {
			case "smallint":
			case "bigint":
				return INT;
			case "real":
			case "double precision":
				return FLOAT;
			default:
				return classify(typeName);
		}
	}

	private static boolean startsWithAny(@NonNull String string,
																			 @NonNull String... prefixes) {
		for (String prefix : prefixes)
			if (string.startsWith(prefix))
				return true;

		return false;
	}

	/**
	 * Is this one of the numeric classes ({@code int}, {@code float}, {@code num}, {@code money})?
	 *
	 * @return {@code true} if this class holds numbers
	 */
	public boolean isNumeric() {
		return this == INT || this == FLOAT || this == NUM || this == MONEY;
	}

	/**
	 * @return the lowercase name of this class, as stored in the attribute cache
	 */
	@NonNull
	public String getTypeName() {
		return this.typeName;
	}
}
