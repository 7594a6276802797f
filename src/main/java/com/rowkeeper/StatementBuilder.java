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
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Accumulates prepared parameters while a statement's SQL fragments are composed, then yields a single
 * {@link Statement}.
 * <p>
 * Placeholders are numbered in the order values are handed to {@link #parameter(Object, String)}, which need not be
 * the order they appear in the final SQL text. A builder can be built exactly once.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
final class StatementBuilder {
	@NonNull
	private final ParameterPreparer parameterPreparer;
	@NonNull
	private final List<Object> parameters;
	private boolean built;

	StatementBuilder(@NonNull ParameterPreparer parameterPreparer) {
		requireNonNull(parameterPreparer);

		this.parameterPreparer = parameterPreparer;
		this.parameters = new ArrayList<>();
	}

	/**
	 * Prepares a value for a column of the given type.
	 *
	 * @param value    the value
	 * @param typeName the column's cached type name
	 * @return a {@code $N} placeholder or an inline literal
	 */
	@NonNull
	String parameter(@Nullable Object value,
									 @Nullable String typeName) {
		ensureNotBuilt();
		return this.parameterPreparer.prepare(value, typeName, this.parameters);
	}

	@NonNull
	Statement build(@NonNull String sql) {
		requireNonNull(sql);
		ensureNotBuilt();

		this.built = true;
		return Statement.of(sql, this.parameters);
	}

	private void ensureNotBuilt() {
		if (this.built)
			throw new IllegalStateException("Statement has already been built");
	}
}
