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

/**
 * Work performed with a checked-out connection that decides the connection's fate.
 * <p>
 * See {@link ConnectionOperation} for a variant that always returns the connection to the pool.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface CheckoutOperation<T> {
	/**
	 * @param connection the checked-out connection, valid only for the duration of this call
	 * @return the caller's value and whether to keep or discard the connection
	 * @throws Exception if an error occurs; the connection is kept
	 */
	@NonNull
	Checkin<T> perform(@NonNull EngineConnection connection) throws Exception;
}
