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

/**
 * Opens {@link EngineHandle}s.
 * <p>
 * {@link DuckDbEngineDriver} is the default; other in-process engines can be plugged in by implementing this
 * interface.
 *
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface EngineDriver {
	/**
	 * Location sentinel for a private, in-memory database.
	 */
	@NonNull
	String IN_MEMORY = ":memory:";

	/**
	 * Opens the engine at {@code location}. Never retried.
	 *
	 * @param location     a file path or {@link #IN_MEMORY}
	 * @param engineConfig engine options
	 * @return the opened handle
	 * @throws EngineOpenException if the engine cannot be opened
	 */
	@NonNull
	EngineHandle open(@NonNull String location,
										@NonNull EngineConfig engineConfig);
}
