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
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when an {@link EngineDriver} is unable to open an engine at a given location (bad path, lock contention,
 * corrupt file, invalid configuration, ...).
 * <p>
 * Opening is never retried automatically.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class EngineOpenException extends DatabaseException {
	@NonNull
	private final String location;

	public EngineOpenException(@NonNull String location,
														 @Nullable Throwable cause) {
		super(format("Unable to open engine at '%s'", requireNonNull(location)), cause);
		this.location = location;
	}

	@NonNull
	@Override
	protected List<String> describe() {
		return List.of(format("location=%s", getLocation()));
	}

	/**
	 * @return the database file path or in-memory sentinel that could not be opened
	 */
	@NonNull
	public String getLocation() {
		return this.location;
	}
}
