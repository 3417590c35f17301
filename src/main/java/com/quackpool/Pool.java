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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Stream;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A supervised pool of connections to one embedded engine.
 * <p>
 * Build and start one with {@link #builder(String)}, share the instance with whatever needs it, and
 * {@link #stop()} it when done. Connections are opened lazily, up to the pool size; callers beyond that wait in
 * arrival order for at most the checkout timeout. Every connection keeps its own prepared statement cache and is used
 * by one caller at a time.
 * <p>
 * Example usage:
 * <pre>{@code
 * try (Pool pool = Pool.builder("analytics.duckdb").poolSize(8).start()) {
 *   QueryResult result = pool.query("SELECT id, name FROM users WHERE region = ?", "eu");
 *
 *   long total = pool.withStream("SELECT amount FROM events", List.of(),
 *       chunks -> chunks.mapToLong(List::size).sum());
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Pool implements Backend, AutoCloseable {
	@NonNull
	public static final Duration DEFAULT_CHECKOUT_TIMEOUT = Duration.ofSeconds(5);
	@NonNull
	public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
	public static final int DEFAULT_POOL_SIZE = 4;
	public static final int DEFAULT_CHUNK_SIZE = 2048;

	@NonNull
	private static final AtomicInteger DEFAULT_NAME_COUNTER = new AtomicInteger();

	@NonNull
	private final String name;
	@NonNull
	private final String location;
	@NonNull
	private final Duration checkoutTimeout;
	private final int chunkSize;
	@NonNull
	private final PoolSupervisor poolSupervisor;

	private Pool(@NonNull Builder builder) {
		requireNonNull(builder);

		this.name = builder.name == null ? format("pool-%d", DEFAULT_NAME_COUNTER.incrementAndGet()) : builder.name;
		this.location = builder.location;
		this.checkoutTimeout = builder.checkoutTimeout == null ? DEFAULT_CHECKOUT_TIMEOUT : builder.checkoutTimeout;
		this.chunkSize = builder.chunkSize == null ? DEFAULT_CHUNK_SIZE : builder.chunkSize;

		EngineDriver engineDriver = builder.engineDriver == null ? new DuckDbEngineDriver() : builder.engineDriver;
		EngineConfig engineConfig = builder.engineConfig == null ? EngineConfig.defaults() : builder.engineConfig;
		EngineListener engineListener = builder.engineListener == null ? EngineListener.NO_OP : builder.engineListener;
		StatementLogger statementLogger = builder.statementLogger == null ? new DefaultStatementLogger() : builder.statementLogger;

		this.poolSupervisor = PoolSupervisor.start(this.name,
				builder.poolSize == null ? DEFAULT_POOL_SIZE : builder.poolSize,
				builder.shutdownTimeout == null ? DEFAULT_SHUTDOWN_TIMEOUT : builder.shutdownTimeout,
				new EngineHolder(engineDriver, this.location, engineConfig, engineListener),
				engineListener, statementLogger);
	}

	/**
	 * Creates a {@link Pool} builder for the engine at {@code location}.
	 *
	 * @param location a database file path, or {@link EngineDriver#IN_MEMORY}
	 * @return a {@link Pool} builder
	 */
	@NonNull
	public static Builder builder(@NonNull String location) {
		requireNonNull(location);
		return new Builder(location);
	}

	@NonNull
	public QueryResult query(@NonNull String sql,
													 @Nullable Object... parameters) {
		return execute(sql, parametersAsList(parameters), QueryOptions.defaults());
	}

	@NonNull
	public QueryResult query(@NonNull String sql,
													 @NonNull List<Object> parameters,
													 @NonNull QueryOptions queryOptions) {
		return execute(sql, parameters, queryOptions);
	}

	@NonNull
	public Result<QueryResult> tryQuery(@NonNull String sql,
																			@Nullable Object... parameters) {
		return Result.of(() -> query(sql, parameters));
	}

	@NonNull
	public Result<QueryResult> tryQuery(@NonNull String sql,
																			@NonNull List<Object> parameters,
																			@NonNull QueryOptions queryOptions) {
		return Result.of(() -> query(sql, parameters, queryOptions));
	}

	/**
	 * Runs a statement on a checked-out connection. The connection goes back to the pool healthy whatever the
	 * statement's outcome.
	 */
	@NonNull
	@Override
	public QueryResult execute(@NonNull String sql,
														 @NonNull List<Object> parameters,
														 @NonNull QueryOptions queryOptions) {
		requireNonNull(sql);
		requireNonNull(parameters);
		requireNonNull(queryOptions);

		ConnectionPool.Lease lease = getPoolSupervisor().lease(checkoutTimeoutFor(queryOptions));

		try {
			return lease.getConnection().execute(Statement.of(queryOptions.getLabel().orElse(null), sql), parameters,
					queryOptions.isCache(), lease.getCheckoutDuration());
		} finally {
			lease.release(true);
		}
	}

	@NonNull
	@Override
	public ChunkCursor executeChunked(@NonNull String sql,
																		@NonNull List<Object> parameters,
																		@NonNull QueryOptions queryOptions) {
		requireNonNull(sql);
		requireNonNull(parameters);
		requireNonNull(queryOptions);

		ConnectionPool.Lease lease = getPoolSupervisor().lease(checkoutTimeoutFor(queryOptions));

		try {
			return lease.getConnection().executeChunked(Statement.of(queryOptions.getLabel().orElse(null), sql), parameters,
					queryOptions.getChunkSize().orElse(getChunkSize()), lease.getCheckoutDuration(), () -> lease.release(true));
		} catch (RuntimeException e) {
			lease.release(true);
			throw e;
		}
	}

	/**
	 * Returns an open cursor holding a checked-out connection until it is exhausted or closed.
	 */
	@NonNull
	public ChunkCursor queryChunked(@NonNull String sql,
																	@Nullable Object... parameters) {
		return executeChunked(sql, parametersAsList(parameters), QueryOptions.defaults());
	}

	@NonNull
	public ChunkCursor queryChunked(@NonNull String sql,
																	@NonNull List<Object> parameters,
																	@NonNull QueryOptions queryOptions) {
		return executeChunked(sql, parameters, queryOptions);
	}

	@NonNull
	public Result<ChunkCursor> tryQueryChunked(@NonNull String sql,
																						 @Nullable Object... parameters) {
		return Result.of(() -> queryChunked(sql, parameters));
	}

	@NonNull
	public Result<ChunkCursor> tryQueryChunked(@NonNull String sql,
																						 @NonNull List<Object> parameters,
																						 @NonNull QueryOptions queryOptions) {
		return Result.of(() -> queryChunked(sql, parameters, queryOptions));
	}

	/**
	 * Streams the result of {@code sql} in chunks to {@code streamFunction}. The connection is held until the function
	 * returns, so the stream must not escape it.
	 */
	@Nullable
	public <R> R withStream(@NonNull String sql,
													@NonNull List<Object> parameters,
													@NonNull Function<Stream<List<List<Object>>>, R> streamFunction) {
		return withStream(sql, parameters, QueryOptions.defaults(), streamFunction);
	}

	@Nullable
	public <R> R withStream(@NonNull String sql,
													@NonNull List<Object> parameters,
													@NonNull QueryOptions queryOptions,
													@NonNull Function<Stream<List<List<Object>>>, R> streamFunction) {
		requireNonNull(streamFunction);
		return withStreamAndColumns(sql, parameters, queryOptions, (columns, chunks) -> streamFunction.apply(chunks));
	}

	/**
	 * Like {@link #withStream(String, List, Function)}, also handing over the result's column names.
	 */
	@Nullable
	public <R> R withStreamAndColumns(@NonNull String sql,
																		@NonNull List<Object> parameters,
																		@NonNull BiFunction<List<String>, Stream<List<List<Object>>>, R> streamFunction) {
		return withStreamAndColumns(sql, parameters, QueryOptions.defaults(), streamFunction);
	}

	@Nullable
	public <R> R withStreamAndColumns(@NonNull String sql,
																		@NonNull List<Object> parameters,
																		@NonNull QueryOptions queryOptions,
																		@NonNull BiFunction<List<String>, Stream<List<List<Object>>>, R> streamFunction) {
		requireNonNull(streamFunction);

		try (ChunkCursor chunkCursor = executeChunked(sql, parameters, queryOptions);
				 Stream<List<List<Object>>> chunks = chunkCursor.stream()) {
			return streamFunction.apply(chunkCursor.getColumns(), chunks);
		}
	}

	/**
	 * Like {@link #withStream(String, List, Function)}, capturing a {@link DatabaseException} from the checkout, the
	 * query or {@code streamFunction} as a failed result.
	 */
	@NonNull
	public <R> Result<R> tryWithStream(@NonNull String sql,
																		 @NonNull List<Object> parameters,
																		 @NonNull Function<Stream<List<List<Object>>>, R> streamFunction) {
		return Result.of(() -> withStream(sql, parameters, streamFunction));
	}

	@NonNull
	public <R> Result<R> tryWithStream(@NonNull String sql,
																		 @NonNull List<Object> parameters,
																		 @NonNull QueryOptions queryOptions,
																		 @NonNull Function<Stream<List<List<Object>>>, R> streamFunction) {
		return Result.of(() -> withStream(sql, parameters, queryOptions, streamFunction));
	}

	@NonNull
	public <R> Result<R> tryWithStreamAndColumns(@NonNull String sql,
																							 @NonNull List<Object> parameters,
																							 @NonNull BiFunction<List<String>, Stream<List<List<Object>>>, R> streamFunction) {
		return Result.of(() -> withStreamAndColumns(sql, parameters, streamFunction));
	}

	@NonNull
	public <R> Result<R> tryWithStreamAndColumns(@NonNull String sql,
																							 @NonNull List<Object> parameters,
																							 @NonNull QueryOptions queryOptions,
																							 @NonNull BiFunction<List<String>, Stream<List<List<Object>>>, R> streamFunction) {
		return Result.of(() -> withStreamAndColumns(sql, parameters, queryOptions, streamFunction));
	}

	/**
	 * Holds one connection for the duration of {@code connectionOperation}. The connection goes back to the pool
	 * afterwards, whether the operation returns or throws.
	 */
	@Nullable
	public <T> T withConnection(@NonNull ConnectionOperation<T> connectionOperation) {
		return withConnection(connectionOperation, QueryOptions.defaults());
	}

	@Nullable
	public <T> T withConnection(@NonNull ConnectionOperation<T> connectionOperation,
															@NonNull QueryOptions queryOptions) {
		requireNonNull(connectionOperation);
		return checkout(connection -> Checkin.keep(connectionOperation.perform(connection)), queryOptions);
	}

	/**
	 * Like {@link #withConnection(ConnectionOperation)}, capturing a {@link DatabaseException} as a failed result.
	 * A checked exception from the operation arrives wrapped in a {@link DatabaseException}; other runtime exceptions
	 * propagate.
	 */
	@NonNull
	public <T> Result<T> tryWithConnection(@NonNull ConnectionOperation<T> connectionOperation) {
		return Result.of(() -> withConnection(connectionOperation));
	}

	@NonNull
	public <T> Result<T> tryWithConnection(@NonNull ConnectionOperation<T> connectionOperation,
																				 @NonNull QueryOptions queryOptions) {
		return Result.of(() -> withConnection(connectionOperation, queryOptions));
	}

	/**
	 * Holds one connection for {@code checkoutOperation}, which decides through its {@link Checkin} whether the
	 * connection is kept or discarded. An exception thrown by the operation propagates and the connection is kept.
	 */
	@Nullable
	public <T> T checkout(@NonNull CheckoutOperation<T> checkoutOperation) {
		return checkout(checkoutOperation, QueryOptions.defaults());
	}

	@Nullable
	public <T> T checkout(@NonNull CheckoutOperation<T> checkoutOperation,
												@NonNull QueryOptions queryOptions) {
		requireNonNull(checkoutOperation);
		requireNonNull(queryOptions);

		ConnectionPool.Lease lease = getPoolSupervisor().lease(checkoutTimeoutFor(queryOptions));
		boolean keep = true;

		try {
			Checkin<T> checkin = checkoutOperation.perform(lease.getConnection());

			if (checkin == null)
				throw new IllegalStateException(format("%s must not return null", CheckoutOperation.class.getSimpleName()));

			keep = checkin.isKeep();
			return checkin.getValue();
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Exception e) {
			throw new DatabaseException(e);
		} finally {
			lease.release(keep);
		}
	}

	@NonNull
	public <T> Result<T> tryCheckout(@NonNull CheckoutOperation<T> checkoutOperation) {
		return Result.of(() -> checkout(checkoutOperation));
	}

	@NonNull
	public <T> Result<T> tryCheckout(@NonNull CheckoutOperation<T> checkoutOperation,
																	 @NonNull QueryOptions queryOptions) {
		return Result.of(() -> checkout(checkoutOperation, queryOptions));
	}

	/**
	 * Closes every pooled connection and starts over with fresh ones on the same engine.
	 */
	public void resetConnections() {
		getPoolSupervisor().resetConnections();
	}

	/**
	 * Stops the pool: rejects new checkouts, waits up to the shutdown timeout for checked-out connections, closes
	 * everything and releases the engine. Idempotent.
	 */
	public void stop() {
		getPoolSupervisor().stop();
	}

	@Override
	public void close() {
		stop();
	}

	public boolean isRunning() {
		return getPoolSupervisor().isRunning();
	}

	@NonNull
	public PoolState getState() {
		return getPoolSupervisor().getState();
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public String getLocation() {
		return this.location;
	}

	public int getPoolSize() {
		return getPoolSupervisor().getConnectionPool().getPoolSize();
	}

	@NonNull
	public Duration getCheckoutTimeout() {
		return this.checkoutTimeout;
	}

	public int getChunkSize() {
		return this.chunkSize;
	}

	@NonNull
	@Override
	public String getDescription() {
		return format("pool '%s'", getName());
	}

	@Override
	public String toString() {
		return format("%s{name=%s, location=%s, state=%s}", getClass().getSimpleName(), getName(), getLocation(), getState());
	}

	@NonNull
	PoolSupervisor getPoolSupervisor() {
		return this.poolSupervisor;
	}

	@NonNull
	private Duration checkoutTimeoutFor(@NonNull QueryOptions queryOptions) {
		return queryOptions.getCheckoutTimeout().orElse(getCheckoutTimeout());
	}

	@NonNull
	static List<Object> parametersAsList(@Nullable Object[] parameters) {
		return parameters == null ? List.of() : Arrays.asList(parameters);
	}

	/**
	 * Builder used to construct and start instances of {@link Pool}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String location;
		@Nullable
		private String name;
		@Nullable
		private Integer poolSize;
		@Nullable
		private Duration checkoutTimeout;
		@Nullable
		private Duration shutdownTimeout;
		@Nullable
		private Integer chunkSize;
		@Nullable
		private EngineConfig engineConfig;
		@Nullable
		private EngineDriver engineDriver;
		@Nullable
		private EngineListener engineListener;
		@Nullable
		private StatementLogger statementLogger;

		private Builder(@NonNull String location) {
			this.location = requireNonNull(location);
		}

		@NonNull
		public Builder name(@Nullable String name) {
			this.name = name;
			return this;
		}

		@NonNull
		public Builder poolSize(@Nullable Integer poolSize) {
			if (poolSize != null && poolSize < 1)
				throw new IllegalArgumentException("Pool size must be positive");

			this.poolSize = poolSize;
			return this;
		}

		@NonNull
		public Builder checkoutTimeout(@Nullable Duration checkoutTimeout) {
			if (checkoutTimeout != null && checkoutTimeout.isNegative())
				throw new IllegalArgumentException("Checkout timeout cannot be negative");

			this.checkoutTimeout = checkoutTimeout;
			return this;
		}

		/**
		 * @param shutdownTimeout how long {@link Pool#stop()} waits for checked-out connections before force-closing them
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder shutdownTimeout(@Nullable Duration shutdownTimeout) {
			if (shutdownTimeout != null && shutdownTimeout.isNegative())
				throw new IllegalArgumentException("Shutdown timeout cannot be negative");

			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		@NonNull
		public Builder chunkSize(@Nullable Integer chunkSize) {
			if (chunkSize != null && chunkSize < 1)
				throw new IllegalArgumentException("Chunk size must be positive");

			this.chunkSize = chunkSize;
			return this;
		}

		@NonNull
		public Builder engineConfig(@Nullable EngineConfig engineConfig) {
			this.engineConfig = engineConfig;
			return this;
		}

		@NonNull
		public Builder engineDriver(@Nullable EngineDriver engineDriver) {
			this.engineDriver = engineDriver;
			return this;
		}

		@NonNull
		public Builder engineListener(@Nullable EngineListener engineListener) {
			this.engineListener = engineListener;
			return this;
		}

		@NonNull
		public Builder statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		/**
		 * Opens the engine and starts the pool.
		 *
		 * @return the running pool
		 * @throws EngineOpenException if the engine cannot be opened
		 */
		@NonNull
		public Pool start() {
			return new Pool(this);
		}
	}
}
