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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Per-table primary keys and column types, read from the system catalogs on first use.
 * <p>
 * Entries stay cached until flushed, which may be necessary after the schema or the search path has changed.
 * Tables are keyed by their name exactly as given.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
final class MetadataCache {
	@NonNull
	private final StatementExecutor statementExecutor;
	@NonNull
	private final Map<String, Optional<PrimaryKey>> primaryKeysByTable;
	@NonNull
	private final Map<String, Map<String, String>> attributesByTable;
	@NonNull
	private final Logger logger;
	private boolean regularTypeNames;

	MetadataCache(@NonNull StatementExecutor statementExecutor,
								boolean regularTypeNames) {
		requireNonNull(statementExecutor);

		this.statementExecutor = statementExecutor;
		this.primaryKeysByTable = new HashMap<>();
		this.attributesByTable = new HashMap<>();
		this.logger = Logger.getLogger(getClass().getName());
		this.regularTypeNames = regularTypeNames;
	}

	/**
	 * Renders the placeholder for a table name passed as a catalog lookup parameter.
	 * <p>
	 * Unqualified names are identifier-quoted server-side. Names containing a dot are passed through unchanged, since
	 * it is ambiguous whether the dot separates a schema or is part of the name.
	 */
	@NonNull
	static String qualifiedParameter(@NonNull String tableName,
																	 @NonNull String placeholder) {
		requireNonNull(tableName);
		requireNonNull(placeholder);

		return tableName.contains(".") ? placeholder : format("quote_ident(%s)", placeholder);
	}

	@NonNull
	PrimaryKey primaryKey(@NonNull String tableName,
												boolean flush) {
		requireNonNull(tableName);

		if (flush)
			flushPrimaryKeys();

		Optional<PrimaryKey> primaryKey = this.primaryKeysByTable.get(tableName);

		if (primaryKey == null) {
			primaryKey = fetchPrimaryKey(tableName);
			this.primaryKeysByTable.put(tableName, primaryKey);
		}

		return primaryKey.orElseThrow(() -> new NoPrimaryKeyException(tableName));
	}

	@NonNull
	private Optional<PrimaryKey> fetchPrimaryKey(@NonNull String tableName) {
		requireNonNull(tableName);

		String sql = "SELECT a.attname, a.attnum, i.indkey::text FROM pg_index i"
				+ " JOIN pg_attribute a ON a.attrelid = i.indrelid"
				+ " AND a.attnum = ANY(i.indkey)"
				+ " AND NOT a.attisdropped"
				+ format(" WHERE i.indrelid = %s::regclass", qualifiedParameter(tableName, "$1"))
				+ " AND i.indisprimary ORDER BY a.attnum";

		List<List<Object>> rows = getStatementExecutor().execute(Statement.of(sql, List.of(tableName))).getRows();

		if (rows.isEmpty())
			return Optional.empty();

		List<List<Object>> keyRows = new ArrayList<>(rows);

		if (keyRows.size() > 1) {
			// Order by position in the key's index rather than by column position in the table
			List<Integer> indexKey = parseIndexKey(String.valueOf(keyRows.get(0).get(2)));
			keyRows.sort(Comparator.comparingInt(row -> indexKey.indexOf(((Number) row.get(1)).intValue())));
		}

		List<String> columns = new ArrayList<>(keyRows.size());

		for (List<Object> keyRow : keyRows)
			columns.add((String) keyRow.get(0));

		return Optional.of(PrimaryKey.of(columns));
	}

	@NonNull
	private static List<Integer> parseIndexKey(@NonNull String indexKey) {
		requireNonNull(indexKey);

		List<Integer> attributeNumbers = new ArrayList<>();

		for (String attributeNumber : indexKey.trim().split("\\s+"))
			if (!attributeNumber.isEmpty())
				attributeNumbers.add(Integer.valueOf(attributeNumber));

		return attributeNumbers;
	}

	@NonNull
	Map<String, String> attributes(@NonNull String tableName,
																 boolean flush) {
		requireNonNull(tableName);

		if (flush)
			flushAttributes();

		Map<String, String> attributes = this.attributesByTable.get(tableName);

		if (attributes == null) {
			attributes = fetchAttributes(tableName);
			this.attributesByTable.put(tableName, attributes);
		}

		return attributes;
	}

	@NonNull
	private Map<String, String> fetchAttributes(@NonNull String tableName) {
		requireNonNull(tableName);

		String sql = format("SELECT a.attname, %s FROM pg_attribute a", isUsingRegularTypeNames() ? "a.atttypid::regtype::text" : "t.typname")
				+ " JOIN pg_type t ON t.oid = a.atttypid"
				+ format(" WHERE a.attrelid = %s::regclass", qualifiedParameter(tableName, "$1"))
				+ " AND (a.attnum > 0 OR a.attname = 'oid')"
				+ " AND NOT a.attisdropped ORDER BY a.attnum";

		List<List<Object>> rows = getStatementExecutor().execute(Statement.of(sql, List.of(tableName))).getRows();
		Map<String, String> attributes = new LinkedHashMap<>();

		for (List<Object> row : rows) {
			String typeName = (String) row.get(1);
			attributes.put((String) row.get(0), isUsingRegularTypeNames() ? typeName : SemanticType.classify(typeName).getTypeName());
		}

		return Collections.unmodifiableMap(attributes);
	}

	void flushPrimaryKeys() {
		this.primaryKeysByTable.clear();
		getLogger().fine("The primary key cache has been flushed");
	}

	void flushAttributes() {
		this.attributesByTable.clear();
		getLogger().fine("The attribute cache has been flushed");
	}

	/**
	 * Switches between simplified and full catalog type names. Changing the mode discards all cached attributes.
	 *
	 * @param regularTypeNames {@code true} to use full catalog type names
	 */
	void useRegularTypeNames(boolean regularTypeNames) {
		if (regularTypeNames == this.regularTypeNames)
			return;

		this.regularTypeNames = regularTypeNames;
		this.attributesByTable.clear();
		getLogger().fine(format("Using %s type names, the attribute cache has been flushed", regularTypeNames ? "regular" : "simplified"));
	}

	boolean isUsingRegularTypeNames() {
		return this.regularTypeNames;
	}

	@NonNull
	private StatementExecutor getStatementExecutor() {
		return this.statementExecutor;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
