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

/**
 * Lifecycle of a {@link Pool}'s supervisor.
 * <p>
 * Normal progression is {@code STARTING -> HANDLE_HELD -> CONNECTIONS_READY -> STOPPING -> STOPPED}. An engine restart
 * passes back through {@code STARTING} and {@code HANDLE_HELD}.
 *
 * @since 1.0.0
 */
public enum PoolState {
	/**
	 * The engine is being opened.
	 */
	STARTING,
	/**
	 * The engine is open; the connection pool is not accepting checkouts yet.
	 */
	HANDLE_HELD,
	/**
	 * Accepting checkouts.
	 */
	CONNECTIONS_READY,
	/**
	 * Rejecting checkouts and draining connections.
	 */
	STOPPING,
	/**
	 * All connections closed and the engine released.
	 */
	STOPPED
}
