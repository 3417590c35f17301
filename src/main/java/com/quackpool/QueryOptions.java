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
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Per-call options for backend operations.
 * <p>
 * Anything left unset falls back to the backend's defaults: its checkout timeout, its chunk size and statement
 * caching on.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class QueryOptions {
	@NonNull
	private static final QueryOptions DEFAULTS = builder().build();

	@Nullable
	private final Duration checkoutTimeout;
	@Nullable
	private final Integer chunkSize;
	@Nullable
	private final String label;
	private final boolean cache;

	private QueryOptions(@NonNull Builder builder) {
		requireNonNull(builder);

		this.checkoutTimeout = builder.checkoutTimeout;
		this.chunkSize = builder.chunkSize;
		this.label = builder.label;
		this.cache = builder.cache;
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	@NonNull
	public static QueryOptions defaults() {
		return DEFAULTS;
	}

	@NonNull
	public Optional<Duration> getCheckoutTimeout() {
		return Optional.ofNullable(this.checkoutTimeout);
	}

	@NonNull
	public Optional<Integer> getChunkSize() {
		return Optional.ofNullable(this.chunkSize);
	}

	/**
	 * @return the name the query goes by in diagnostics and exceptions, if one was given
	 */
	@NonNull
	public Optional<String> getLabel() {
		return Optional.ofNullable(this.label);
	}

	public boolean isCache() {
		return this.cache;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof QueryOptions queryOptions))
			return false;

		return Objects.equals(getCheckoutTimeout(), queryOptions.getCheckoutTimeout())
				&& Objects.equals(getChunkSize(), queryOptions.getChunkSize())
				&& Objects.equals(getLabel(), queryOptions.getLabel())
				&& isCache() == queryOptions.isCache();
	}

	@Override
	public int hashCode() {
		return Objects.hash(getCheckoutTimeout(), getChunkSize(), getLabel(), isCache());
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(4);

		getCheckoutTimeout().ifPresent(checkoutTimeout -> components.add(format("checkoutTimeout=%s", checkoutTimeout)));
		getChunkSize().ifPresent(chunkSize -> components.add(format("chunkSize=%d", chunkSize)));
		getLabel().ifPresent(label -> components.add(format("label=%s", label)));
		components.add(format("cache=%s", isCache()));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	/**
	 * Builder used to construct instances of {@link QueryOptions}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@Nullable
		private Duration checkoutTimeout;
		@Nullable
		private Integer chunkSize;
		@Nullable
		private String label;
		private boolean cache;

		private Builder() {
			this.cache = true;
		}

		@NonNull
		public Builder checkoutTimeout(@Nullable Duration checkoutTimeout) {
			if (checkoutTimeout != null && checkoutTimeout.isNegative())
				throw new IllegalArgumentException("Checkout timeout cannot be negative");

			this.checkoutTimeout = checkoutTimeout;
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
		public Builder label(@Nullable String label) {
			this.label = label;
			return this;
		}

		/**
		 * @param cache whether prepared statements should come from (and go into) the connection's statement cache
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder cache(boolean cache) {
			this.cache = cache;
			return this;
		}

		@NonNull
		public QueryOptions build() {
			return new QueryOptions(this);
		}
	}
}
