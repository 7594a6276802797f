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

import javax.annotation.concurrent.NotThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when a lookup by key matches no row.
 * <p>
 * The message carries the table, the {@code WHERE} clause and the rendered parameter values.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class NoSuchRecordException extends NotFoundException {
	@NonNull
	private final String tableName;
	@NonNull
	private final String whereClause;

	public NoSuchRecordException(@NonNull String tableName,
															 @NonNull String whereClause,
															 @NonNull String renderedParameters) {
		super(format("No such record in %s\nwhere %s\nwith %s", requireNonNull(tableName), requireNonNull(whereClause),
				requireNonNull(renderedParameters)));

		this.tableName = tableName;
		this.whereClause = whereClause;
	}

	@NonNull
	public String getTableName() {
		return this.tableName;
	}

	@NonNull
	public String getWhereClause() {
		return this.whereClause;
	}
}
