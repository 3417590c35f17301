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
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;

/**
 * A finite, single-pass sequence of row chunks read lazily from an open result.
 * <p>
 * Each chunk holds at most {@code chunkSize} rows, already normalized. When the rows run out, or the cursor is
 * closed, the native result and statement are closed and whatever was holding the connection (a pool checkout, a
 * server connection) is let go. After that {@link #hasNext()} stays {@code false}. A cursor cannot be restarted.
 * <p>
 * Always close a cursor you do not read to the end, preferably with try-with-resources.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class ChunkCursor implements Iterator<List<List<Object>>>, AutoCloseable {
	@NonNull
	private final StatementContext statementContext;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final List<String> columns;
	private final int chunkSize;
	@Nullable
	private final PreparedStatement preparedStatement;
	@Nullable
	private final ResultSet resultSet;
	@Nullable
	private final Iterator<List<Object>> bufferedRows;
	@NonNull
	private final Runnable onClose;
	@Nullable
	private final Duration checkoutDuration;
	@Nullable
	private final Duration preparationDuration;
	@Nullable
	private final Duration executionDuration;
	@Nullable
	private List<List<Object>> nextChunk;
	private long resultMappingNanos;
	@Nullable
	private Exception exception;
	private boolean closed;

	private ChunkCursor(@NonNull StatementContext statementContext,
											@NonNull StatementLogger statementLogger,
											@NonNull List<String> columns,
											int chunkSize,
											@Nullable PreparedStatement preparedStatement,
											@Nullable ResultSet resultSet,
											@Nullable Iterator<List<Object>> bufferedRows,
											@NonNull Runnable onClose,
											@Nullable Duration checkoutDuration,
											@Nullable Duration preparationDuration,
											@Nullable Duration executionDuration) {
		this.statementContext = requireNonNull(statementContext);
		this.statementLogger = requireNonNull(statementLogger);
		this.columns = List.copyOf(columns);
		this.chunkSize = chunkSize;
		this.preparedStatement = preparedStatement;
		this.resultSet = resultSet;
		this.bufferedRows = bufferedRows;
		this.onClose = requireNonNull(onClose);
		this.checkoutDuration = checkoutDuration;
		this.preparationDuration = preparationDuration;
		this.executionDuration = executionDuration;
	}

	/**
	 * Prepares and executes the statement on {@code session}, leaving the result open for chunked reading.
	 * <p>
	 * {@code onClose} runs exactly once: when the cursor closes, or right away if execution fails.
	 */
	@NonNull
	static ChunkCursor open(@NonNull Connection session,
													@NonNull StatementContext statementContext,
													int chunkSize,
													@NonNull StatementLogger statementLogger,
													@Nullable Duration checkoutDuration,
													@NonNull Runnable onClose) {
		requireNonNull(session);
		requireNonNull(statementContext);
		requireNonNull(statementLogger);
		requireNonNull(onClose);

		if (chunkSize < 1) {
			onClose.run();
			throw new IllegalArgumentException("Chunk size must be positive");
		}

		String sql = statementContext.getStatement().getSql();
		PreparedStatement preparedStatement = null;
		ResultSet resultSet = null;
		Duration preparationDuration = null;

		try {
			long startTime = nanoTime();
			preparedStatement = session.prepareStatement(sql);
			ResultValues.bindParameters(preparedStatement, statementContext.getParameters());
			preparationDuration = Duration.ofNanos(nanoTime() - startTime);

			startTime = nanoTime();
			boolean hasResultSet = preparedStatement.execute();
			Duration executionDuration = Duration.ofNanos(nanoTime() - startTime);

			List<String> columns = List.of();

			if (hasResultSet) {
				preparedStatement.setFetchSize(chunkSize);
				resultSet = preparedStatement.getResultSet();
				columns = ResultValues.readColumns(resultSet.getMetaData());
			}

			return new ChunkCursor(statementContext, statementLogger, columns, chunkSize, preparedStatement, resultSet, null,
					onClose, checkoutDuration, preparationDuration, executionDuration);
		} catch (SQLException | RuntimeException e) {
			// Unchecked failures, such as an unbindable parameter, propagate as they are after the same cleanup
			RuntimeException failure = e instanceof RuntimeException
					? (RuntimeException) e : new QueryExecutionException(sql, e);

			try {
				closeAll(resultSet, preparedStatement);
			} catch (SQLException cleanupException) {
				failure.addSuppressed(cleanupException);
			}

			try {
				onClose.run();
			} catch (RuntimeException cleanupException) {
				failure.addSuppressed(cleanupException);
			}

			StatementLog.logQuietly(statementLogger, StatementLog.withStatementContext(statementContext)
					.checkoutDuration(checkoutDuration)
					.preparationDuration(preparationDuration)
					.exception(failure)
					.build());

			throw failure;
		}
	}

	/**
	 * A cursor over a result that is already in memory, for backends whose drivers do not stream.
	 */
	@NonNull
	static ChunkCursor ofQueryResult(@NonNull StatementContext statementContext,
																	 @NonNull QueryResult queryResult,
																	 int chunkSize,
																	 @NonNull StatementLogger statementLogger,
																	 @Nullable Duration executionDuration) {
		requireNonNull(statementContext);
		requireNonNull(queryResult);
		requireNonNull(statementLogger);

		if (chunkSize < 1)
			throw new IllegalArgumentException("Chunk size must be positive");

		return new ChunkCursor(statementContext, statementLogger, queryResult.getColumns(), chunkSize, null, null,
				queryResult.getRows().iterator(), () -> {}, null, null, executionDuration);
	}

	/**
	 * @return column names in select order; empty for statements that produced no result set
	 */
	@NonNull
	public List<String> getColumns() {
		return this.columns;
	}

	@Override
	public boolean hasNext() {
		if (this.closed)
			return false;

		if (this.nextChunk != null)
			return true;

		if (this.bufferedRows != null) {
			List<List<Object>> chunk = new ArrayList<>(Math.min(this.chunkSize, 1024));

			while (chunk.size() < this.chunkSize && this.bufferedRows.hasNext())
				chunk.add(this.bufferedRows.next());

			if (chunk.isEmpty()) {
				close();
				return false;
			}

			this.nextChunk = chunk;
			return true;
		}

		if (this.resultSet == null) {
			close();
			return false;
		}

		long startTime = nanoTime();

		try {
			List<List<Object>> chunk = new ArrayList<>(Math.min(this.chunkSize, 1024));

			while (chunk.size() < this.chunkSize && this.resultSet.next())
				chunk.add(ResultValues.readRow(this.resultSet, this.columns.size()));

			this.resultMappingNanos += nanoTime() - startTime;

			if (chunk.isEmpty()) {
				close();
				return false;
			}

			this.nextChunk = chunk;
			return true;
		} catch (SQLException e) {
			QueryExecutionException queryExecutionException =
					new QueryExecutionException(this.statementContext.getStatement().getSql(), e);
			this.exception = queryExecutionException;
			closeAfterFailure(queryExecutionException);
			throw queryExecutionException;
		} catch (DatabaseException e) {
			this.exception = e;
			closeAfterFailure(e);
			throw e;
		}
	}

	@Override
	@NonNull
	public List<List<Object>> next() {
		if (!hasNext())
			throw new NoSuchElementException();

		List<List<Object>> chunk = this.nextChunk;
		this.nextChunk = null;
		return requireNonNull(chunk);
	}

	/**
	 * A sequential stream over the remaining chunks. Closing the stream closes this cursor.
	 *
	 * @return a stream of chunks
	 */
	@NonNull
	public Stream<List<List<Object>>> stream() {
		return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
				.onClose(this::close);
	}

	public boolean isClosed() {
		return this.closed;
	}

	@Override
	public void close() {
		if (this.closed)
			return;

		this.closed = true;
		this.nextChunk = null;

		RuntimeException cleanupFailure = null;

		try {
			closeAll(this.resultSet, this.preparedStatement);
		} catch (SQLException e) {
			cleanupFailure = new DatabaseException("Unable to close streaming result", e);
		} finally {
			try {
				this.onClose.run();
			} catch (RuntimeException e) {
				if (cleanupFailure == null)
					cleanupFailure = e;
				else
					cleanupFailure.addSuppressed(e);
			}

			StatementLog.logQuietly(this.statementLogger, StatementLog.withStatementContext(this.statementContext)
					.checkoutDuration(this.checkoutDuration)
					.preparationDuration(this.preparationDuration)
					.executionDuration(this.executionDuration)
					.resultMappingDuration(this.resultMappingNanos == 0L ? null : Duration.ofNanos(this.resultMappingNanos))
					.exception(this.exception)
					.build());
		}

		if (cleanupFailure != null)
			throw cleanupFailure;
	}

	private void closeAfterFailure(@NonNull DatabaseException failure) {
		try {
			close();
		} catch (RuntimeException cleanupException) {
			failure.addSuppressed(cleanupException);
		}
	}

	private static void closeAll(@Nullable ResultSet resultSet,
															 @Nullable PreparedStatement preparedStatement) throws SQLException {
		SQLException failure = null;

		if (resultSet != null) {
			try {
				resultSet.close();
			} catch (SQLException e) {
				failure = e;
			}
		}

		if (preparedStatement != null) {
			try {
				preparedStatement.close();
			} catch (SQLException e) {
				if (failure == null)
					failure = e;
				else
					failure.addSuppressed(e);
			}
		}

		if (failure != null)
			throw failure;
	}
}
