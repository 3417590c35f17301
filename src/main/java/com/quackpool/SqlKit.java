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
import java.time.ZoneId;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Main entry point for running SQL against any {@link Backend} and turning results into maps or typed instances.
 * <p>
 * Example usage:
 * <pre>{@code
 * Pool pool = Pool.builder("analytics.duckdb").name("analytics").start();
 *
 * SqlKit sqlKit = SqlKit.withBackend(pool)
 *   .knownColumns(KnownColumns.of("total", "day"))
 *   .build();
 *
 * List<Map<String, Object>> totals = sqlKit.query("SELECT day, sum(amount) AS total FROM sales GROUP BY day")
 *   .fetchAll();
 * }</pre>
 * <p>
 * Column names are checked against an allow-list. By default it is empty and dynamic columns are off, so a map
 * query whose columns were never declared through {@link Builder#knownColumns(KnownColumns)} or
 * {@link Query#knownColumns(KnownColumns)} fails with {@link UnknownColumnNameException}. Typed fetches also accept
 * the target type's fields. {@link Builder#allowDynamicColumns(boolean)} lifts the check.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class SqlKit {
	@NonNull
	private final Backend backend;
	@NonNull
	private final KnownColumns knownColumns;
	private final boolean allowDynamicColumns;
	@NonNull
	private final RowMaterializer rowMaterializer;

	private SqlKit(@NonNull Builder builder) {
		requireNonNull(builder);

		StatementLogger statementLogger = builder.statementLogger == null ? new DefaultStatementLogger() : builder.statementLogger;
		InstanceProvider instanceProvider = builder.instanceProvider == null ? InstanceProvider.DEFAULT : builder.instanceProvider;
		ZoneId timeZone = builder.timeZone == null ? ZoneId.systemDefault() : builder.timeZone;

		this.backend = Backends.of(builder.target, statementLogger);
		this.knownColumns = builder.knownColumns == null ? KnownColumns.none() : builder.knownColumns;
		this.allowDynamicColumns = builder.allowDynamicColumns;
		this.rowMaterializer = new RowMaterializer(instanceProvider, timeZone);
	}

	/**
	 * Provides a {@link SqlKit} builder for the given backend.
	 *
	 * @param backend a {@link Backend} (such as a {@link Pool} or {@link DirectConnection}), a
	 *                {@link javax.sql.DataSource} or a {@link ServerClient}
	 * @return a {@link SqlKit} builder
	 * @throws IllegalArgumentException when {@link Builder#build()} is called, if {@code backend} is unsupported
	 */
	@NonNull
	public static Builder withBackend(@NonNull Object backend) {
		requireNonNull(backend);
		return new Builder(backend);
	}

	/**
	 * Creates a fluent builder for the given SQL.
	 *
	 * @param sql SQL with positional {@code ?} parameters
	 * @return a fluent query builder
	 */
	@NonNull
	public Query query(@NonNull String sql) {
		requireNonNull(sql);
		return new DefaultQuery(this, sql);
	}

	@NonNull
	public Backend getBackend() {
		return this.backend;
	}

	@NonNull
	public KnownColumns getKnownColumns() {
		return this.knownColumns;
	}

	public boolean isAllowDynamicColumns() {
		return this.allowDynamicColumns;
	}

	@NonNull
	RowMaterializer getRowMaterializer() {
		return this.rowMaterializer;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{backend=%s, knownColumns=%s, allowDynamicColumns=%s}", getClass().getSimpleName(),
				getBackend().getDescription(), getKnownColumns(), isAllowDynamicColumns());
	}

	/**
	 * Builder used to construct instances of {@link SqlKit}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Object target;
		@Nullable
		private KnownColumns knownColumns;
		private boolean allowDynamicColumns;
		@Nullable
		private InstanceProvider instanceProvider;
		@Nullable
		private ZoneId timeZone;
		@Nullable
		private StatementLogger statementLogger;

		private Builder(@NonNull Object target) {
			this.target = requireNonNull(target);
		}

		/**
		 * Column names accepted in results in addition to the fields of a requested target type.
		 *
		 * @param knownColumns the accepted column names (null for none)
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder knownColumns(@Nullable KnownColumns knownColumns) {
			this.knownColumns = knownColumns;
			return this;
		}

		/**
		 * @param allowDynamicColumns whether column names outside the known set are accepted
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder allowDynamicColumns(boolean allowDynamicColumns) {
			this.allowDynamicColumns = allowDynamicColumns;
			return this;
		}

		@NonNull
		public Builder instanceProvider(@Nullable InstanceProvider instanceProvider) {
			this.instanceProvider = instanceProvider;
			return this;
		}

		@NonNull
		public Builder timeZone(@Nullable ZoneId timeZone) {
			this.timeZone = timeZone;
			return this;
		}

		/**
		 * Only used when the backend is adapted here, i.e. for a {@link javax.sql.DataSource} or {@link ServerClient}.
		 * Pools and direct connections log through their own statement logger.
		 *
		 * @param statementLogger the statement logger (null for {@link DefaultStatementLogger})
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		@NonNull
		public SqlKit build() {
			return new SqlKit(this);
		}
	}
}
