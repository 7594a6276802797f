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
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Copies result row values into a caller's record.
 * <p>
 * The {@code oid} column is stored under the table's {@code oid(<table>)} key and {@code bytea} values are decoded;
 * all other values are copied unchanged.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
final class RowMarshaller {
	@NonNull
	private final PostgresTransport transport;

	RowMarshaller(@NonNull PostgresTransport transport) {
		requireNonNull(transport);
		this.transport = transport;
	}

	/**
	 * Merges {@code resultRow} into {@code record}.
	 *
	 * @param record     the record to update in place
	 * @param resultRow  column values as returned by the server
	 * @param attributes the table's cached column types
	 * @param oidKey     the record key for the row's OID, or {@code null} if the table has no OIDs
	 * @return {@code record}
	 */
	@NonNull
	Map<String, Object> merge(@NonNull Map<String, Object> record,
														@NonNull Map<String, Object> resultRow,
														@NonNull Map<String, String> attributes,
														@Nullable String oidKey) {
		requireNonNull(record);
		requireNonNull(resultRow);
		requireNonNull(attributes);

		for (Map.Entry<String, Object> entry : resultRow.entrySet()) {
			String name = entry.getKey();
			Object value = entry.getValue();

			if (oidKey != null && "oid".equals(name))
				name = oidKey;
			else if (value != null && SemanticType.forTypeName(attributes.get(name)) == SemanticType.BYTEA)
				value = unescapeBinary(value);

			record.put(name, value);
		}

		return record;
	}

	@NonNull
	private Object unescapeBinary(@NonNull Object value) {
		if (value instanceof byte[])
			return value;

		return this.transport.unescapeBinary(value.toString());
	}
}
