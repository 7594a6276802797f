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
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The primary key of a table: one column, or several in the order the key's index defines them.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class PrimaryKey {
	@NonNull
	private final List<String> columns;

	private PrimaryKey(@NonNull List<@NonNull String> columns) {
		requireNonNull(columns);

		if (columns.isEmpty())
			throw new IllegalArgumentException("A primary key needs at least one column");

		this.columns = List.copyOf(columns);
	}

	@NonNull
	public static PrimaryKey of(@NonNull List<@NonNull String> columns) {
		requireNonNull(columns);
		return new PrimaryKey(columns);
	}

	@NonNull
	public static PrimaryKey of(@NonNull String column) {
		requireNonNull(column);
		return new PrimaryKey(List.of(column));
	}

	/**
	 * @return the key columns in index order, a single element for single-column keys
	 */
	@NonNull
	public List<String> getColumns() {
		return this.columns;
	}

	public boolean isComposite() {
		return this.columns.size() > 1;
	}

	/**
	 * @return the key column for single-column keys, empty for composite keys
	 */
	@NonNull
	public Optional<String> getColumn() {
		return isComposite() ? Optional.empty() : Optional.of(this.columns.get(0));
	}

	@Override
	public int hashCode() {
		return Objects.hash(getColumns());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof PrimaryKey))
			return false;

		return Objects.equals(((PrimaryKey) object).getColumns(), getColumns());
	}

	@Override
	public String toString() {
		return format("%s{columns=%s}", getClass().getSimpleName(), getColumns());
	}
}
