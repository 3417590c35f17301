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
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * One native session derived from an {@link EngineHandle}, together with its own {@link StatementCache}.
 * <p>
 * The handle is shared, not owned: closing a connection closes its cached statements and its session, never the
 * engine. A failed query leaves the connection usable.
 * <p>
 * A connection is used by one caller at a time. Pooled connections are only reachable from inside a checkout
 * callback; do not let them escape it.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class EngineConnection implements AutoCloseable {
	@NonNull
	private static final AtomicLong ID_GENERATOR = new AtomicLong();

	private final long id;
	@NonNull
	private final EngineHandle engineHandle;
	@NonNull
	private final Connection session;
	@NonNull
	private final StatementCache statementCache;
	@NonNull
	private final EngineListener engineListener;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final String backendDescription;
	@NonNull
	private final Logger logger;
	private volatile boolean closed;

	private EngineConnection(@NonNull EngineHandle engineHandle,
													 @NonNull Connection session,
													 @NonNull EngineListener engineListener,
													 @NonNull StatementLogger statementLogger,
													 @NonNull String backendDescription) {
		this.id = ID_GENERATOR.incrementAndGet();
		this.engineHandle = requireNonNull(engineHandle);
		this.session = requireNonNull(session);
		this.engineListener = requireNonNull(engineListener);
		this.statementLogger = requireNonNull(statementLogger);
		this.backendDescription = requireNonNull(backendDescription);
		this.statementCache = new StatementCache();
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Opens a new session on {@code engineHandle}.
	 *
	 * @throws SQLException if the handle cannot produce a session
	 */
	@NonNull
	static EngineConnection open(@NonNull EngineHandle engineHandle,
															 @NonNull EngineListener engineListener,
															 @NonNull StatementLogger statementLogger,
															 @NonNull String backendDescription) throws SQLException {
		requireNonNull(engineHandle);
		requireNonNull(engineListener);
		requireNonNull(statementLogger);
		requireNonNull(backendDescription);

		EngineConnection engineConnection = new EngineConnection(engineHandle, engineHandle.openSession(),
				engineListener, statementLogger, backendDescription);

		engineConnection.getLogger().log(FINE, format("Opened %s for %s", engineConnection, backendDescription));
		engineConnection.notifyListener(() -> engineListener.connectionOpened(engineConnection));

		return engineConnection;
	}

	/**
	 * Executes {@code sql} with positional {@code parameters}, using the statement cache.
	 */
	@NonNull
	public QueryResult query(@NonNull String sql,
													 @Nullable Object... parameters) {
		requireNonNull(sql);
		return execute(Statement.of(null, sql), parameters == null ? List.of() : Arrays.asList(parameters), true, null);
	}

	/**
	 * Executes {@code sql} with positional {@code parameters}.
	 *
	 * @param useCache whether to look up and store the prepared statement in this connection's cache
	 * @return the uniform result
	 * @throws QueryExecutionException if preparation or execution fails
	 */
	@NonNull
	public QueryResult execute(@NonNull String sql,
														 @NonNull List<Object> parameters,
														 boolean useCache) {
		requireNonNull(sql);
		requireNonNull(parameters);

		return execute(Statement.of(null, sql), parameters, useCache, null);
	}

	@NonNull
	QueryResult execute(@NonNull Statement statement,
											@NonNull List<Object> parameters,
											boolean useCache,
											@Nullable Duration checkoutDuration) {
		requireNonNull(statement);
		requireNonNull(parameters);

		ensureOpen();

		StatementContext statementContext = StatementContext.of(statement, parameters, getBackendDescription());
		String sql = statement.getSql();
		Boolean statementCacheHit = useCache ? getStatementCache().contains(sql) : null;
		Duration preparationDuration = null;
		Duration executionDuration = null;
		Duration resultMappingDuration = null;
		QueryExecutionException exception = null;
		PreparedStatement uncachedPreparedStatement = null;

		try {
			long startTime = nanoTime();
			PreparedStatement preparedStatement;

			if (useCache) {
				preparedStatement = getStatementCache().lookupOrPrepare(getSession(), sql,
						() -> notifyListener(() -> getEngineListener().statementPrepared(this, sql)));
			} else {
				uncachedPreparedStatement = getSession().prepareStatement(sql);
				notifyListener(() -> getEngineListener().statementPrepared(this, sql));
				preparedStatement = uncachedPreparedStatement;
			}

			ResultValues.bindParameters(preparedStatement, parameters);
			preparationDuration = Duration.ofNanos(nanoTime() - startTime);

			startTime = nanoTime();
			boolean hasResultSet = preparedStatement.execute();
			executionDuration = Duration.ofNanos(nanoTime() - startTime);

			startTime = nanoTime();
			QueryResult queryResult;

			if (hasResultSet) {
				try (ResultSet resultSet = preparedStatement.getResultSet()) {
					queryResult = ResultValues.readAll(resultSet);
				}
			} else {
				queryResult = QueryResult.ofUpdateCount(preparedStatement.getUpdateCount());
			}

			resultMappingDuration = Duration.ofNanos(nanoTime() - startTime);
			return queryResult;
		} catch (SQLException e) {
			exception = new QueryExecutionException(sql, e);
			throw exception;
		} finally {
			if (uncachedPreparedStatement != null) {
				try {
					uncachedPreparedStatement.close();
				} catch (SQLException e) {
					if (exception != null)
						exception.addSuppressed(e);
					else
						getLogger().log(WARNING, "Unable to close prepared statement", e);
				}
			}

			StatementLog.logQuietly(getStatementLogger(), StatementLog.withStatementContext(statementContext)
					.checkoutDuration(checkoutDuration)
					.preparationDuration(preparationDuration)
					.executionDuration(executionDuration)
					.resultMappingDuration(resultMappingDuration)
					.statementCacheHit(statementCacheHit)
					.exception(exception)
					.build());
		}
	}

	/**
	 * Executes {@code sql} and returns a cursor over its rows in chunks of at most {@code chunkSize}.
	 * <p>
	 * Chunked statements bypass the statement cache, since the statement stays open while the cursor is read.
	 */
	@NonNull
	public ChunkCursor executeChunked(@NonNull String sql,
																		@NonNull List<Object> parameters,
																		int chunkSize) {
		return executeChunked(Statement.of(null, sql), parameters, chunkSize, null, () -> {});
	}

	@NonNull
	ChunkCursor executeChunked(@NonNull Statement statement,
														 @NonNull List<Object> parameters,
														 int chunkSize,
														 @Nullable Duration checkoutDuration,
														 @NonNull Runnable onClose) {
		requireNonNull(statement);
		requireNonNull(parameters);
		requireNonNull(onClose);

		ensureOpen();

		return ChunkCursor.open(getSession(), StatementContext.of(statement, parameters, getBackendDescription()),
				chunkSize, getStatementLogger(), checkoutDuration, onClose);
	}

	/**
	 * @return how many prepared statements this connection currently caches
	 */
	public int getCachedStatementCount() {
		return getStatementCache().size();
	}

	public boolean isClosed() {
		return this.closed;
	}

	/**
	 * Closes cached statements and the session. The engine handle is untouched. Idempotent.
	 */
	@Override
	public void close() {
		if (this.closed)
			return;

		this.closed = true;
		DatabaseException failure = null;

		try {
			getStatementCache().clear();
		} catch (SQLException e) {
			failure = new DatabaseException(format("Unable to close cached statements for %s", this), e);
		}

		try {
			getSession().close();
		} catch (SQLException e) {
			DatabaseException sessionFailure = new DatabaseException(format("Unable to close session for %s", this), e);

			if (failure == null)
				failure = sessionFailure;
			else
				failure.addSuppressed(sessionFailure);
		}

		getLogger().log(FINE, format("Closed %s", this));
		notifyListener(() -> getEngineListener().connectionClosed(this));

		if (failure != null)
			throw failure;
	}

	private void ensureOpen() {
		if (this.closed)
			throw new DatabaseException(format("%s is closed", this));
	}

	private void notifyListener(@NonNull Runnable notification) {
		try {
			notification.run();
		} catch (RuntimeException e) {
			getLogger().log(WARNING, "Engine listener failed", e);
		}
	}

	@Override
	public String toString() {
		return format("%s{id=%d, location=%s}", getClass().getSimpleName(), getId(), getEngineHandle().getLocation());
	}

	public long getId() {
		return this.id;
	}

	@NonNull
	public EngineHandle getEngineHandle() {
		return this.engineHandle;
	}

	@NonNull
	String getBackendDescription() {
		return this.backendDescription;
	}

	@NonNull
	Connection getSession() {
		return this.session;
	}

	@NonNull
	private StatementCache getStatementCache() {
		return this.statementCache;
	}

	@NonNull
	private EngineListener getEngineListener() {
		return this.engineListener;
	}

	@NonNull
	private StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
