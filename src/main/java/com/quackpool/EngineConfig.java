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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Engine-level options applied when an engine is opened (worker threads, memory limit, access mode and any other
 * option the engine understands).
 * <p>
 * Options are passed through verbatim; an option the engine rejects fails the open with an
 * {@link EngineOpenException}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class EngineConfig {
	@NonNull
	private static final EngineConfig DEFAULT = builder().build();

	@NonNull
	private final Map<String, String> options;

	private EngineConfig(@NonNull Builder builder) {
		requireNonNull(builder);
		this.options = Collections.unmodifiableMap(new LinkedHashMap<>(builder.options));
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return a configuration with no options set, which leaves every engine default in place
	 */
	@NonNull
	public static EngineConfig defaults() {
		return DEFAULT;
	}

	@NonNull
	public Map<String, String> getOptions() {
		return this.options;
	}

	@NonNull
	public Properties toProperties() {
		Properties properties = new Properties();
		properties.putAll(getOptions());
		return properties;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof EngineConfig engineConfig))
			return false;

		return Objects.equals(getOptions(), engineConfig.getOptions());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getOptions());
	}

	@Override
	public String toString() {
		return format("%s{options=%s}", getClass().getSimpleName(), getOptions());
	}

	/**
	 * Builder used to construct instances of {@link EngineConfig}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Map<String, String> options = new LinkedHashMap<>();

		private Builder() {
			// Use EngineConfig.builder()
		}

		@NonNull
		public Builder threads(int threads) {
			if (threads < 1)
				throw new IllegalArgumentException("Thread count must be positive");

			return option("threads", String.valueOf(threads));
		}

		/**
		 * @param memoryLimit a size string the engine understands, e.g. {@code 512MB} or {@code 2GB}
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder memoryLimit(@NonNull String memoryLimit) {
			return option("memory_limit", requireNonNull(memoryLimit));
		}

		/**
		 * @param accessMode {@code automatic}, {@code read_only} or {@code read_write}
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder accessMode(@NonNull String accessMode) {
			return option("access_mode", requireNonNull(accessMode));
		}

		@NonNull
		public Builder option(@NonNull String name,
													@Nullable String value) {
			requireNonNull(name);

			if (value == null)
				this.options.remove(name);
			else
				this.options.put(name, value);

			return this;
		}

		@NonNull
		public EngineConfig build() {
			return new EngineConfig(this);
		}
	}
}
