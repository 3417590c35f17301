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

import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * {@link Backend} for a conventional SQL server reached through a {@link DataSource}.
 * <p>
 * Each statement borrows a connection from the data source (which typically pools them itself) and gives it back
 * when done; a chunked statement keeps its connection until the cursor closes. Statements are prepared per call.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class DataSourceBackend implements Backend {
	@NonNull
	private final DataSource dataSource;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final Logger logger;

	public DataSourceBackend(@NonNull DataSource dataSource) {
		this(dataSource, new DefaultStatementLogger());
	}

	public DataSourceBackend(@NonNull DataSource dataSource,
													 @NonNull StatementLogger statementLogger) {
		this.dataSource = requireNonNull(dataSource);
		this.statementLogger = requireNonNull(statementLogger);
		this.logger = Logger.getLogger(getClass().getName());
	}

	@NonNull
	@Override
	public QueryResult execute(@NonNull String sql,
														 @NonNull List<Object> parameters,
														 @NonNull QueryOptions queryOptions) {
		requireNonNull(sql);
		requireNonNull(parameters);
		requireNonNull(queryOptions);

		StatementContext statementContext = StatementContext.of(Statement.of(queryOptions.getLabel().orElse(null), sql),
				parameters, getDescription());

		long startTime = nanoTime();
		Duration acquisitionDuration = null;
		Duration preparationDuration = null;
		Duration executionDuration = null;
		Duration resultMappingDuration = null;
		DatabaseException exception = null;

		try (Connection connection = acquireConnection()) {
			acquisitionDuration = Duration.ofNanos(nanoTime() - startTime);
			startTime = nanoTime();

			try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
				ResultValues.bindParameters(preparedStatement, parameters);
				preparationDuration = Duration.ofNanos(nanoTime() - startTime);

				startTime = nanoTime();
				boolean hasResultSet = preparedStatement.execute();
				executionDuration = Duration.ofNanos(nanoTime() - startTime);

				startTime = nanoTime();
				QueryResult queryResult;

				if (hasResultSet) {
					try (ResultSet resultSet = preparedStatement.getResultSet()) {
						queryResult = ResultExtractor.extract(resultSet);
					}
				} else {
					queryResult = QueryResult.ofUpdateCount(preparedStatement.getUpdateCount());
				}

				resultMappingDuration = Duration.ofNanos(nanoTime() - startTime);
				return queryResult;
			}
		} catch (SQLException e) {
			exception = new QueryExecutionException(sql, e);
			throw exception;
		} catch (DatabaseException e) {
			exception = e;
			throw e;
		} finally {
			StatementLog.logQuietly(getStatementLogger(), StatementLog.withStatementContext(statementContext)
					.checkoutDuration(acquisitionDuration)
					.preparationDuration(preparationDuration)
					.executionDuration(executionDuration)
					.resultMappingDuration(resultMappingDuration)
					.exception(exception)
					.build());
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

		StatementContext statementContext = StatementContext.of(Statement.of(queryOptions.getLabel().orElse(null), sql),
				parameters, getDescription());

		long startTime = nanoTime();
		Connection connection = acquireConnection();
		Duration acquisitionDuration = Duration.ofNanos(nanoTime() - startTime);

		return ChunkCursor.open(connection, statementContext, queryOptions.getChunkSize().orElse(Pool.DEFAULT_CHUNK_SIZE),
				getStatementLogger(), acquisitionDuration, () -> closeConnection(connection));
	}

	@NonNull
	protected Connection acquireConnection() {
		try {
			return getDataSource().getConnection();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to acquire database connection", e);
		}
	}

	protected void closeConnection(@Nullable Connection connection) {
		if (connection == null)
			return;

		try {
			connection.close();
		} catch (SQLException e) {
			getLogger().log(WARNING, "Unable to close database connection", e);
		}
	}

	@NonNull
	@Override
	public String getDescription() {
		return format("data source %s", getDataSource().getClass().getSimpleName());
	}

	@NonNull
	protected DataSource getDataSource() {
		return this.dataSource;
	}

	@NonNull
	protected StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}
}
