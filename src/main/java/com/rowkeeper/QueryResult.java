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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * What a {@link PostgresTransport} returns for an executed statement: either result rows, an update count, or neither.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class QueryResult {
	@NonNull
	private static final QueryResult EMPTY;

	static {
		EMPTY = new QueryResult(null, null, null);
	}

	@Nullable
	private final List<String> columnNames;
	@Nullable
	private final List<List<Object>> rows;
	@Nullable
	private final Long updateCount;

	private QueryResult(@Nullable List<String> columnNames,
											@Nullable List<List<Object>> rows,
											@Nullable Long updateCount) {
		this.columnNames = columnNames;
		this.rows = rows;
		this.updateCount = updateCount;
	}

	/**
	 * Creates a result holding rows.
	 * <p>
	 * Every row must have one value per column name.
	 *
	 * @param columnNames the result's column names, in order
	 * @param rows        the result rows
	 * @return the result
	 */
	@NonNull
	public static QueryResult withRows(@NonNull List<@NonNull String> columnNames,
																		 @NonNull List<@NonNull List<@Nullable Object>> rows) {
		requireNonNull(columnNames);
		requireNonNull(rows);

		List<List<Object>> copiedRows = new ArrayList<>(rows.size());

		for (List<Object> row : rows) {
			if (row.size() != columnNames.size())
				throw new IllegalArgumentException(format("Row %s does not match columns %s", row, columnNames));

			copiedRows.add(Collections.unmodifiableList(new ArrayList<>(row)));
		}

		return new QueryResult(List.copyOf(columnNames), Collections.unmodifiableList(copiedRows), null);
	}

	@NonNull
	public static QueryResult withUpdateCount(long updateCount) {
		return new QueryResult(null, null, updateCount);
	}

	/**
	 * @return a result for statements that produce neither rows nor a count, e.g. {@code BEGIN}
	 */
	@NonNull
	public static QueryResult empty() {
		return EMPTY;
	}

	public boolean hasRows() {
		return this.rows != null;
	}

	@NonNull
	public List<String> getColumnNames() {
		return this.columnNames == null ? List.of() : this.columnNames;
	}

	@NonNull
	public List<List<Object>> getRows() {
		return this.rows == null ? List.of() : this.rows;
	}

	@NonNull
	public Optional<Long> getUpdateCount() {
		return Optional.ofNullable(this.updateCount);
	}

	/**
	 * Provides the rows as column name to value maps, preserving column order.
	 *
	 * @return the rows as mutable maps
	 */
	@NonNull
	public List<Map<String, Object>> toMaps() {
		List<Map<String, Object>> maps = new ArrayList<>(getRows().size());

		for (List<Object> row : getRows()) {
			Map<String, Object> map = new LinkedHashMap<>();

			for (int i = 0; i < getColumnNames().size(); ++i)
				map.put(getColumnNames().get(i), row.get(i));

			maps.add(map);
		}

		return maps;
	}

	@Override
	public String toString() {
		if (hasRows())
			return format("%s{columnNames=%s, rows=%d}", getClass().getSimpleName(), getColumnNames(), getRows().size());

		if (this.updateCount != null)
			return format("%s{updateCount=%d}", getClass().getSimpleName(), this.updateCount);

		return format("%s{}", getClass().getSimpleName());
	}
}
