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

import java.util.Optional;

/**
 * Isolation levels a transaction can be started with, see {@link Database#begin(TransactionIsolation)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public enum TransactionIsolation {
	/**
	 * Default isolation (the session's {@code default_transaction_isolation}).
	 */
	DEFAULT(null),

	/**
	 * Maps to {@code ISOLATION LEVEL READ COMMITTED}.
	 */
	READ_COMMITTED("READ COMMITTED"),

	/**
	 * Maps to {@code ISOLATION LEVEL READ UNCOMMITTED}, which PostgreSQL treats as {@code READ COMMITTED}.
	 */
	READ_UNCOMMITTED("READ UNCOMMITTED"),

	/**
	 * Maps to {@code ISOLATION LEVEL REPEATABLE READ}.
	 */
	REPEATABLE_READ("REPEATABLE READ"),

	/**
	 * Maps to {@code ISOLATION LEVEL SERIALIZABLE}.
	 */
	SERIALIZABLE("SERIALIZABLE");

	@Nullable
	private final String isolationLevel;

	TransactionIsolation(@Nullable String isolationLevel) {
		this.isolationLevel = isolationLevel;
	}

	@NonNull
	Optional<String> getIsolationLevel() {
		return Optional.ofNullable(this.isolationLevel);
	}
}
