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
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Client-side handler for asynchronous notifications sent with {@code NOTIFY}.
 * <p>
 * {@link #run()} listens on an event channel and a stop channel ({@code stop_<event>} by default) and passes every
 * notification received to the callback until a notification arrives on the stop channel. If a timeout is set and
 * elapses without a notification, the callback receives {@link Optional#empty()} and the handler stops. With a zero
 * timeout, {@link #run()} hands over what has already arrived and returns, and can be called again to poll.
 * <p>
 * The loop blocks its thread. Notifications sent from other threads must go through a different {@link Database},
 * see {@link #notify(Database, boolean, String)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public final class NotificationHandler implements AutoCloseable {
	/**
	 * How long a single wait lasts when the handler has no timeout.
	 */
	@NonNull
	private static final Duration WAIT_SLICE;

	static {
		WAIT_SLICE = Duration.ofSeconds(1);
	}

	@NonNull
	private final Database database;
	@NonNull
	private final String event;
	@NonNull
	private final String stopEvent;
	@NonNull
	private final Consumer<Optional<Notification>> callback;
	@Nullable
	private final Duration timeout;
	private boolean listening;
	private boolean closed;

	NotificationHandler(@NonNull Database database,
											@NonNull String event,
											@NonNull Consumer<Optional<Notification>> callback,
											@Nullable Duration timeout,
											@Nullable String stopEvent) {
		requireNonNull(database);
		requireNonNull(event);
		requireNonNull(callback);

		if (timeout != null && timeout.isNegative())
			throw new IllegalArgumentException("Timeout must not be negative");

		this.database = database;
		this.event = event;
		this.stopEvent = stopEvent == null || stopEvent.isEmpty() ? format("stop_%s", event) : stopEvent;
		this.callback = callback;
		this.timeout = timeout;
	}

	/**
	 * Starts listening on the event and stop channels, if not already listening.
	 */
	public void listen() {
		if (this.listening)
			return;

		getDatabase().executeStatement(Statement.of(format("LISTEN %s", getDatabase().escapeIdentifier(getEvent()))));
		getDatabase().executeStatement(Statement.of(format("LISTEN %s", getDatabase().escapeIdentifier(getStopEvent()))));
		this.listening = true;
	}

	/**
	 * Stops listening on the event and stop channels, if listening.
	 */
	public void unlisten() {
		if (!this.listening)
			return;

		getDatabase().executeStatement(Statement.of(format("UNLISTEN %s", getDatabase().escapeIdentifier(getEvent()))));
		getDatabase().executeStatement(Statement.of(format("UNLISTEN %s", getDatabase().escapeIdentifier(getStopEvent()))));
		this.listening = false;
	}

	/**
	 * Sends a notification on the event channel through this handler's own {@link Database}.
	 *
	 * @param payload optional payload
	 * @return {@code true} if the notification was sent, {@code false} if the handler is not listening
	 */
	public boolean notify(@Nullable String payload) {
		return notify(getDatabase(), false, payload);
	}

	/**
	 * Asks the handler to stop by notifying its stop channel through its own {@link Database}.
	 *
	 * @return {@code true} if the notification was sent, {@code false} if the handler is not listening
	 */
	public boolean stop() {
		return notify(getDatabase(), true, null);
	}

	/**
	 * Sends a notification on the event channel, or on the stop channel to make the handler stop.
	 *
	 * @param database the {@link Database} to send through; use a different one when the handler runs in another thread
	 * @param stop     {@code true} to notify the stop channel
	 * @param payload  optional payload
	 * @return {@code true} if the notification was sent, {@code false} if the handler is not listening
	 */
	public boolean notify(@NonNull Database database,
												boolean stop,
												@Nullable String payload) {
		requireNonNull(database);

		if (!this.listening)
			return false;

		List<Object> parameters = Arrays.asList(stop ? getStopEvent() : getEvent(), payload == null ? "" : payload);
		database.executeStatement(Statement.of("SELECT pg_notify($1, $2)", parameters));
		return true;
	}

	/**
	 * Listens and dispatches notifications to the callback until stopped, as described in the class documentation.
	 *
	 * @throws DatabaseException if a notification arrives on a channel other than the event and stop channels
	 */
	public void run() {
		listen();

		boolean poll = getTimeout().map(Duration::isZero).orElse(false);

		while (this.listening) {
			if (Thread.currentThread().isInterrupted()) {
				unlisten();
				return;
			}

			List<Notification> notifications = getDatabase().pollNotifications(getTimeout().orElse(WAIT_SLICE));

			if (notifications.isEmpty()) {
				if (poll)
					return;

				if (getTimeout().isEmpty())
					continue;

				unlisten();
				getCallback().accept(Optional.empty());
				return;
			}

			for (Notification notification : notifications) {
				if (!this.listening)
					break;

				String channel = notification.getChannel();

				if (!channel.equals(getEvent()) && !channel.equals(getStopEvent())) {
					unlisten();
					throw new DatabaseException(format("Listening for \"%s\" and \"%s\", but notified of \"%s\"",
							getEvent(), getStopEvent(), channel));
				}

				if (channel.equals(getStopEvent()))
					unlisten();

				getCallback().accept(Optional.of(notification));
			}

			if (poll)
				return;
		}
	}

	/**
	 * Stops listening and closes the handler's {@link Database}.
	 */
	@Override
	public void close() {
		if (this.closed)
			return;

		this.closed = true;

		try {
			unlisten();
		} finally {
			getDatabase().close();
		}
	}

	public boolean isListening() {
		return this.listening;
	}

	@NonNull
	public String getEvent() {
		return this.event;
	}

	@NonNull
	public String getStopEvent() {
		return this.stopEvent;
	}

	@NonNull
	public Optional<Duration> getTimeout() {
		return Optional.ofNullable(this.timeout);
	}

	@NonNull
	private Database getDatabase() {
		return this.database;
	}

	@NonNull
	private Consumer<Optional<Notification>> getCallback() {
		return this.callback;
	}
}
