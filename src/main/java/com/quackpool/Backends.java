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

import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.time.Duration;
import java.util.List;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;

/**
 * Resolves the objects callers hand to {@link SqlKit} into {@link Backend}s.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Backends {
	private Backends() {
		// Non-instantiable
	}

	/**
	 * Accepts a {@link Backend} (which includes {@link Pool} and {@link DirectConnection}), a {@link DataSource} or a
	 * {@link ServerClient}.
	 *
	 * @param target the object to resolve
	 * @return a backend for {@code target}
	 * @throws IllegalArgumentException if {@code target} is none of the supported types
	 */
	@NonNull
	public static Backend of(@NonNull Object target) {
		return of(target, new DefaultStatementLogger());
	}

	@NonNull
	public static Backend of(@NonNull Object target,
													 @NonNull StatementLogger statementLogger) {
		requireNonNull(target);
		requireNonNull(statementLogger);

		if (target instanceof Backend backend)
			return backend;

		if (target instanceof DataSource dataSource)
			return new DataSourceBackend(dataSource, statementLogger);

		if (target instanceof ServerClient serverClient)
			return new ServerClientBackend(serverClient, statementLogger);

		throw new IllegalArgumentException(format("Unsupported backend %s. Expected a %s, %s, %s, %s or %s.",
				target.getClass().getName(), Backend.class.getSimpleName(), Pool.class.getSimpleName(),
				DirectConnection.class.getSimpleName(), DataSource.class.getSimpleName(), ServerClient.class.getSimpleName()));
	}

	@ThreadSafe
	private static final class ServerClientBackend implements Backend {
		@NonNull
		private final ServerClient serverClient;
		@NonNull
		private final StatementLogger statementLogger;

		private ServerClientBackend(@NonNull ServerClient serverClient,
																@NonNull StatementLogger statementLogger) {
			this.serverClient = requireNonNull(serverClient);
			this.statementLogger = requireNonNull(statementLogger);
		}

		@NonNull
		@Override
		public QueryResult execute(@NonNull String sql,
															 @NonNull List<Object> parameters,
															 @NonNull QueryOptions queryOptions) {
			return executeLogged(context(sql, parameters, queryOptions));
		}

		@NonNull
		@Override
		public ChunkCursor executeChunked(@NonNull String sql,
																			@NonNull List<Object> parameters,
																			@NonNull QueryOptions queryOptions) {
			StatementContext statementContext = context(sql, parameters, queryOptions);
			long startTime = nanoTime();
			QueryResult queryResult = extract(statementContext);

			return ChunkCursor.ofQueryResult(statementContext, queryResult,
					queryOptions.getChunkSize().orElse(Pool.DEFAULT_CHUNK_SIZE), this.statementLogger,
					Duration.ofNanos(nanoTime() - startTime));
		}

		@NonNull
		private QueryResult executeLogged(@NonNull StatementContext statementContext) {
			long startTime = nanoTime();
			DatabaseException exception = null;

			try {
				return extract(statementContext);
			} catch (DatabaseException e) {
				exception = e;
				throw e;
			} finally {
				StatementLog.logQuietly(this.statementLogger, StatementLog.withStatementContext(statementContext)
						.executionDuration(Duration.ofNanos(nanoTime() - startTime))
						.exception(exception)
						.build());
			}
		}

		@NonNull
		private QueryResult extract(@NonNull StatementContext statementContext) {
			String sql = statementContext.getStatement().getSql();
			Object nativeResult;

			try {
				nativeResult = this.serverClient.query(sql, statementContext.getParameters());
			} catch (DatabaseException e) {
				throw e;
			} catch (Exception e) {
				throw new QueryExecutionException(sql, e);
			}

			return ResultExtractor.extract(nativeResult);
		}

		@NonNull
		private StatementContext context(@NonNull String sql,
																		 @NonNull List<Object> parameters,
																		 @NonNull QueryOptions queryOptions) {
			requireNonNull(sql);
			requireNonNull(parameters);
			requireNonNull(queryOptions);

			return StatementContext.of(Statement.of(queryOptions.getLabel().orElse(null), sql), parameters, getDescription());
		}

		@NonNull
		@Override
		public String getDescription() {
			return format("server client %s", this.serverClient.getClass().getSimpleName());
		}
	}
}
