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
 * Lifecycle callbacks for engines and the connections derived from them.
 * <p>
 * Every method is a no-op by default. Implementations should be threadsafe and fast, since they run on the thread
 * performing the lifecycle change. Exceptions thrown from a listener are logged and ignored.
 *
 * @since 1.0.0
 */
@ThreadSafe
public interface EngineListener {
	@NonNull
	EngineListener NO_OP = new EngineListener() {};

	default void engineOpened(@NonNull EngineHandle engineHandle) {
		// No-op by default
	}

	/**
	 * Called once per handle, after the engine's native resources have been released.
	 */
	default void engineReleased(@NonNull EngineHandle engineHandle) {
		// No-op by default
	}

	default void connectionOpened(@NonNull EngineConnection engineConnection) {
		// No-op by default
	}

	default void connectionClosed(@NonNull EngineConnection engineConnection) {
		// No-op by default
	}

	/**
	 * Called for every real statement preparation, i.e. never for a statement-cache hit.
	 */
	default void statementPrepared(@NonNull EngineConnection engineConnection,
																 @NonNull String sql) {
		// No-op by default
	}
}
