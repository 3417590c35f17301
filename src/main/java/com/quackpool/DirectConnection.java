/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
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

package com.quackpool;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * A single, unpooled connection that owns its own engine.
 * <p>
 * Operations are serialized: a second caller blocks until the first finishes, and an open {@link ChunkCursor} holds
 * the connection until it is exhausted or closed. {@link #disconnect()} waits for the operation in progress, closes
 * the connection and then releases the engine.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class DirectConnection implements Backend, AutoCloseable {
	@NonNull
	private final EngineHandle engineHandle;
	@NonNull
	private final EngineConnection engineConnection;
	@NonNull
	private final EngineListener engineListener;
	@NonNull
	private final Semaphore inUse;
	@NonNull
	private final Object disconnectLock;
	@GuardedBy("disconnectLock")
	private boolean disconnected;
	@NonNull
	private final Logger logger;

	private DirectConnection(@NonNull EngineHandle engineHandle,
													 @NonNull EngineConnection engineConnection,
													 @NonNull EngineListener engineListener) {
		this.engineHandle = requireNonNull(engineHandle);
		this.engineConnection = requireNonNull(engineConnection);
		this.engineListener = requireNonNull(engineListener);
		this.inUse = new Semaphore(1, true);
		this.disconnectLock = new Object();
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Opens a DuckDB engine at {@code location} and connects to it.
	 *
	 * @param location a database file path, or {@link EngineDriver#IN_MEMORY}
	 * @throws EngineOpenException if the engine cannot be opened
	 */
	@NonNull
	public static DirectConnection connect(@NonNull String location) {
		return connect(location, EngineConfig.defaults());
	}

	@NonNull
	public static DirectConnection connect(@NonNull String location,
																				 @NonNull EngineConfig engineConfig) {
		return connect(new DuckDbEngineDriver(), location, engineConfig, EngineListener.NO_OP, new DefaultStatementLogger());
	}

	@NonNull
	public static DirectConnection connect(@NonNull EngineDriver engineDriver,
																				 @NonNull String location,
																				 @NonNull EngineConfig engineConfig,
																				 @NonNull EngineListener engineListener,
																				 @NonNull StatementLogger statementLogger) {
		requireNonNull(engineDriver);
		requireNonNull(location);
		requireNonNull(engineConfig);
		requireNonNull(engineListener);
		requireNonNull(statementLogger);

		EngineHandle engineHandle = engineDriver.open(location, engineConfig);
		notifyQuietly(() -> engineListener.engineOpened(engineHandle));

		try {
			EngineConnection engineConnection = EngineConnection.open(engineHandle, engineListener, statementLogger,
					format("connection '%s'", location));
			return new DirectConnection(engineHandle, engineConnection, engineListener);
		} catch (SQLException | RuntimeException e) {
			EngineOpenException engineOpenException = new EngineOpenException(location, e);

			try {
				engineHandle.release();
				notifyQuietly(() -> engineListener.engineReleased(engineHandle));
			} catch (RuntimeException cleanupException) {
				engineOpenException.addSuppressed(cleanupException);
			}

			throw engineOpenException;
		}
	}

	@NonNull
	public QueryResult query(@NonNull String sql,
													 @Nullable Object... parameters) {
		return execute(sql, Pool.parametersAsList(parameters), QueryOptions.defaults());
	}

	@NonNull
	public Result<QueryResult> tryQuery(@NonNull String sql,
																			@Nullable Object... parameters) {
		return Result.of(() -> query(sql, parameters));
	}

	@NonNull
	@Override
	public QueryResult execute(@NonNull String sql,
														 @NonNull List<Object> parameters,
														 @NonNull QueryOptions queryOptions) {
		requireNonNull(sql);
		requireNonNull(parameters);
		requireNonNull(queryOptions);

		acquire();

		try {
			return this.engineConnection.execute(Statement.of(queryOptions.getLabel().orElse(null), sql), parameters,
					queryOptions.isCache(), null);
		} finally {
			this.inUse.release();
		}
	}

	@NonNull
	public ChunkCursor queryChunked(@NonNull String sql,
																	@Nullable Object... parameters) {
		return executeChunked(sql, Pool.parametersAsList(parameters), QueryOptions.defaults());
	}

	@NonNull
	public Result<ChunkCursor> tryQueryChunked(@NonNull String sql,
																						 @Nullable Object... parameters) {
		return Result.of(() -> queryChunked(sql, parameters));
	}

	@NonNull
	@Override
	public ChunkCursor executeChunked(@NonNull String sql,
																		@NonNull List<Object> parameters,
																		@NonNull QueryOptions queryOptions) {
		requireNonNull(sql);
		requireNonNull(parameters);
		requireNonNull(queryOptions);

		acquire();

		AtomicBoolean released = new AtomicBoolean(false);
		Runnable releaseOnce = () -> {
			if (released.compareAndSet(false, true))
				this.inUse.release();
		};

		try {
			return this.engineConnection.executeChunked(Statement.of(queryOptions.getLabel().orElse(null), sql), parameters,
					queryOptions.getChunkSize().orElse(Pool.DEFAULT_CHUNK_SIZE), null, releaseOnce);
		} catch (RuntimeException e) {
			releaseOnce.run();
			throw e;
		}
	}

	private void acquire() {
		ensureConnected();

		try {
			this.inUse.acquire();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new DatabaseException(format("Interrupted while waiting for %s", getDescription()), e);
		}

		try {
			ensureConnected();
		} catch (RuntimeException e) {
			this.inUse.release();
			throw e;
		}
	}

	private void ensureConnected() {
		synchronized (this.disconnectLock) {
			if (this.disconnected)
				throw new DatabaseException(format("%s has been disconnected", getDescription()));
		}
	}

	/**
	 * Closes the connection, then releases the engine. Idempotent.
	 * <p>
	 * Waits up to {@link Pool#DEFAULT_SHUTDOWN_TIMEOUT} for a running query or open {@link ChunkCursor} to finish.
	 */
	public void disconnect() {
		disconnect(Pool.DEFAULT_SHUTDOWN_TIMEOUT);
	}

	/**
	 * Closes the connection, then releases the engine. Idempotent.
	 * <p>
	 * New operations are refused at once. An operation already in progress gets up to {@code timeout} to finish; after
	 * that the connection is force-closed underneath it.
	 */
	public void disconnect(@NonNull Duration timeout) {
		requireNonNull(timeout);

		synchronized (this.disconnectLock) {
			if (this.disconnected)
				return;

			this.disconnected = true;
		}

		boolean acquired;

		try {
			acquired = this.inUse.tryAcquire(timeout.toNanos(), NANOSECONDS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			acquired = false;
		}

		if (!acquired)
			this.logger.log(WARNING, format("Force-closing %s, still in use after %s", getDescription(), timeout));

		try {
			closeAndRelease();
		} finally {
			// Waiters blocked in acquire() wake up and see the disconnect
			if (acquired)
				this.inUse.release();
		}
	}

	private void closeAndRelease() {
		DatabaseException failure = null;

		try {
			this.engineConnection.close();
		} catch (DatabaseException e) {
			failure = e;
		}

		try {
			this.engineHandle.release();
			notifyQuietly(() -> this.engineListener.engineReleased(this.engineHandle));
		} catch (RuntimeException e) {
			if (failure == null)
				throw e;

			failure.addSuppressed(e);
		}

		this.logger.log(FINE, format("Disconnected %s", getDescription()));

		if (failure != null)
			throw failure;
	}

	@Override
	public void close() {
		disconnect();
	}

	public boolean isConnected() {
		synchronized (this.disconnectLock) {
			return !this.disconnected;
		}
	}

	@NonNull
	public String getLocation() {
		return this.engineHandle.getLocation();
	}

	@NonNull
	@Override
	public String getDescription() {
		return format("connection '%s'", getLocation());
	}

	@Override
	public String toString() {
		return format("%s{location=%s, connected=%s}", getClass().getSimpleName(), getLocation(), isConnected());
	}

	private static void notifyQuietly(@NonNull Runnable notification) {
		try {
			notification.run();
		} catch (RuntimeException e) {
			Logger.getLogger(DirectConnection.class.getName()).log(WARNING, "Engine listener failed", e);
		}
	}
}
