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
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Remembers the outcome of table privilege checks for the lifetime of its {@link Database}.
 * <p>
 * There is no invalidation: if grants change, use a fresh {@link Database}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
final class PrivilegeCache {
	@NonNull
	private final StatementExecutor statementExecutor;
	@NonNull
	private final Map<PrivilegeKey, Boolean> privileges;

	PrivilegeCache(@NonNull StatementExecutor statementExecutor) {
		requireNonNull(statementExecutor);

		this.statementExecutor = statementExecutor;
		this.privileges = new HashMap<>();
	}

	boolean hasTablePrivilege(@NonNull String tableName,
														@NonNull String privilege) {
		requireNonNull(tableName);
		requireNonNull(privilege);

		PrivilegeKey privilegeKey = new PrivilegeKey(tableName, privilege.toLowerCase(Locale.ROOT));
		Boolean granted = this.privileges.get(privilegeKey);

		if (granted == null) {
			String sql = format("SELECT has_table_privilege(%s, $2)", MetadataCache.qualifiedParameter(tableName, "$1"));
			List<List<Object>> rows = this.statementExecutor.execute(Statement.of(sql, List.of(tableName, privilegeKey.privilege()))).getRows();
			Object value = rows.isEmpty() ? null : rows.get(0).get(0);

			granted = Boolean.TRUE.equals(value) || "t".equals(value);
			this.privileges.put(privilegeKey, granted);
		}

		return granted;
	}

	private record PrivilegeKey(@NonNull String tableName, @NonNull String privilege) {}
}
