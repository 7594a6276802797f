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
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An asynchronous notification delivered by the server via {@code NOTIFY}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Notification {
	@NonNull
	private final String channel;
	private final int processId;
	@Nullable
	private final String payload;

	public Notification(@NonNull String channel,
											int processId,
											@Nullable String payload) {
		requireNonNull(channel);

		this.channel = channel;
		this.processId = processId;
		this.payload = payload;
	}

	@Override
	public int hashCode() {
		return Objects.hash(getChannel(), getProcessId(), getPayload());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Notification))
			return false;

		Notification notification = (Notification) object;

		return Objects.equals(notification.getChannel(), getChannel())
				&& notification.getProcessId() == getProcessId()
				&& Objects.equals(notification.getPayload(), getPayload());
	}

	@Override
	public String toString() {
		return format("%s{channel=%s, processId=%d, payload=%s}", getClass().getSimpleName(),
				getChannel(), getProcessId(), getPayload().orElse(null));
	}

	@NonNull
	public String getChannel() {
		return this.channel;
	}

	public int getProcessId() {
		return this.processId;
	}

	@NonNull
	public Optional<String> getPayload() {
		return Optional.ofNullable(this.payload);
	}
}
