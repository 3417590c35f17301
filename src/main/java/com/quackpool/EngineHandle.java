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
import java.sql.Connection;
import java.sql.SQLException;

/**
 * An opened engine database, from which any number of native sessions can be derived.
 * <p>
 * A handle is released at most once; {@link #release()} on a released handle does nothing, and sessions cannot be
 * opened from it afterwards. Releasing a handle does not close sessions already derived from it; their owners close
 * them first.
 *
 * @since 1.0.0
 */
@ThreadSafe
public interface EngineHandle {
	/**
	 * @return the file path, or {@link EngineDriver#IN_MEMORY}, this handle was opened on
	 */
	@NonNull
	String getLocation();

	/**
	 * Derives a new native session from this handle.
	 *
	 * @return a new session, which the caller owns and must close
	 * @throws SQLException if the session cannot be opened, including because this handle was released
	 */
	@NonNull
	Connection openSession() throws SQLException;

	/**
	 * @return {@code true} if this handle has not been released and can still produce sessions
	 */
	boolean isValid();

	/**
	 * Releases the engine. Idempotent.
	 */
	void release();
}
