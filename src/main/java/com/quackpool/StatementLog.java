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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * A collection of SQL statement execution diagnostics.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementLog {
	@NonNull
	private static final Logger LOGGER = Logger.getLogger(StatementLog.class.getName());

	@NonNull
	private final StatementContext statementContext;
	@NonNull
	private final Duration totalDuration;
	@Nullable
	private final Duration checkoutDuration;
	@Nullable
	private final Duration preparationDuration;
	@Nullable
	private final Duration executionDuration;
	@Nullable
	private final Duration resultMappingDuration;
	@Nullable
	private final Boolean statementCacheHit;
	@Nullable
	private final Exception exception;

	private StatementLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.statementContext = requireNonNull(builder.statementContext);
		this.checkoutDuration = builder.checkoutDuration;
		this.preparationDuration = builder.preparationDuration;
		this.executionDuration = builder.executionDuration;
		this.resultMappingDuration = builder.resultMappingDuration;
		this.statementCacheHit = builder.statementCacheHit;
		this.exception = builder.exception;

		Duration totalDuration = Duration.ZERO;

		if (this.checkoutDuration != null)
			totalDuration = totalDuration.plus(this.checkoutDuration);

		if (this.preparationDuration != null)
			totalDuration = totalDuration.plus(this.preparationDuration);

		if (this.executionDuration != null)
			totalDuration = totalDuration.plus(this.executionDuration);

		if (this.resultMappingDuration != null)
			totalDuration = totalDuration.plus(this.resultMappingDuration);

		this.totalDuration = totalDuration;
	}

	/**
	 * Creates a {@link StatementLog} builder for the given {@code statementContext}.
	 *
	 * @param statementContext current SQL context
	 * @return a {@link StatementLog} builder
	 */
	@NonNull
	public static Builder withStatementContext(@NonNull StatementContext statementContext) {
		requireNonNull(statementContext);
		return new Builder(statementContext);
	}

	/**
	 * Hands {@code statementLog} to {@code statementLogger}; a logger failure is reported and never propagates.
	 */
	static void logQuietly(@NonNull StatementLogger statementLogger,
												 @NonNull StatementLog statementLog) {
		requireNonNull(statementLogger);
		requireNonNull(statementLog);

		try {
			statementLogger.log(statementLog);
		} catch (RuntimeException e) {
			LOGGER.log(WARNING, format("Statement logger failed for %s", statementLog.getStatementContext().getStatement()), e);
		}
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(8);

		components.add(format("statementContext=%s", getStatementContext()));
		components.add(format("totalDuration=%s", getTotalDuration()));

		getCheckoutDuration().ifPresent(duration -> components.add(format("checkoutDuration=%s", duration)));
		getPreparationDuration().ifPresent(duration -> components.add(format("preparationDuration=%s", duration)));
		getExecutionDuration().ifPresent(duration -> components.add(format("executionDuration=%s", duration)));
		getResultMappingDuration().ifPresent(duration -> components.add(format("resultMappingDuration=%s", duration)));
		getStatementCacheHit().ifPresent(hit -> components.add(format("statementCacheHit=%s", hit)));
		getException().ifPresent(exception -> components.add(format("exception=%s", exception)));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementLog statementLog))
			return false;

		return Objects.equals(getStatementContext(), statementLog.getStatementContext())
				&& Objects.equals(getCheckoutDuration(), statementLog.getCheckoutDuration())
				&& Objects.equals(getPreparationDuration(), statementLog.getPreparationDuration())
				&& Objects.equals(getExecutionDuration(), statementLog.getExecutionDuration())
				&& Objects.equals(getResultMappingDuration(), statementLog.getResultMappingDuration())
				&& Objects.equals(getStatementCacheHit(), statementLog.getStatementCacheHit())
				&& Objects.equals(getException(), statementLog.getException());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getStatementContext(), getCheckoutDuration(), getPreparationDuration(),
				getExecutionDuration(), getResultMappingDuration(), getStatementCacheHit(), getException());
	}

	/**
	 * How long did the caller wait for a pooled connection?
	 *
	 * @return how long checkout took, if the statement went through a checkout
	 */
	@NonNull
	public Optional<Duration> getCheckoutDuration() {
		return Optional.ofNullable(this.checkoutDuration);
	}

	/**
	 * How long did it take to prepare (or look up) the statement and bind its parameters?
	 *
	 * @return how long preparation took, if available
	 */
	@NonNull
	public Optional<Duration> getPreparationDuration() {
		return Optional.ofNullable(this.preparationDuration);
	}

	@NonNull
	public Optional<Duration> getExecutionDuration() {
		return Optional.ofNullable(this.executionDuration);
	}

	/**
	 * How long did it take to turn the native result into a {@link QueryResult}?
	 *
	 * @return how long result mapping took, if available
	 */
	@NonNull
	public Optional<Duration> getResultMappingDuration() {
		return Optional.ofNullable(this.resultMappingDuration);
	}

	/**
	 * This is the sum of {@link #getCheckoutDuration()} + {@link #getPreparationDuration()} +
	 * {@link #getExecutionDuration()} + {@link #getResultMappingDuration()}.
	 *
	 * @return how long the operation took in total
	 */
	@NonNull
	public Duration getTotalDuration() {
		return this.totalDuration;
	}

	@NonNull
	public StatementContext getStatementContext() {
		return this.statementContext;
	}

	/**
	 * Was the prepared statement served from a connection's statement cache?
	 *
	 * @return {@code true} for a cache hit, {@code false} for a miss, empty if caching was not in play
	 */
	@NonNull
	public Optional<Boolean> getStatementCacheHit() {
		return Optional.ofNullable(this.statementCacheHit);
	}

	@NonNull
	public Optional<Exception> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link StatementLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final StatementContext statementContext;
		@Nullable
		private Duration checkoutDuration;
		@Nullable
		private Duration preparationDuration;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Duration resultMappingDuration;
		@Nullable
		private Boolean statementCacheHit;
		@Nullable
		private Exception exception;

		private Builder(@NonNull StatementContext statementContext) {
			requireNonNull(statementContext);
			this.statementContext = statementContext;
		}

		@NonNull
		public Builder checkoutDuration(@Nullable Duration checkoutDuration) {
			this.checkoutDuration = checkoutDuration;
			return this;
		}

		@NonNull
		public Builder preparationDuration(@Nullable Duration preparationDuration) {
			this.preparationDuration = preparationDuration;
			return this;
		}

		@NonNull
		public Builder executionDuration(@Nullable Duration executionDuration) {
			this.executionDuration = executionDuration;
			return this;
		}

		@NonNull
		public Builder resultMappingDuration(@Nullable Duration resultMappingDuration) {
			this.resultMappingDuration = resultMappingDuration;
			return this;
		}

		@NonNull
		public Builder statementCacheHit(@Nullable Boolean statementCacheHit) {
			this.statementCacheHit = statementCacheHit;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		@NonNull
		public StatementLog build() {
			return new StatementLog(this);
		}
	}
}
