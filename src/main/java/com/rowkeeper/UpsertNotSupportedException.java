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

/**
 * Thrown when the server rejects {@code INSERT ... ON CONFLICT} because it predates PostgreSQL 9.5.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class UpsertNotSupportedException extends DatabaseException {
	private final int serverVersionNumber;

	public UpsertNotSupportedException(int serverVersionNumber,
																		 @NonNull Throwable cause) {
		super(format("Upsert operation is not supported by PostgreSQL version %d", serverVersionNumber), cause);
		this.serverVersionNumber = serverVersionNumber;
	}

	public int getServerVersionNumber() {
		return this.serverVersionNumber;
	}
}
