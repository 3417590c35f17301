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

import javax.annotation.concurrent.NotThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when a {@link Pool} is used after it has been stopped.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class PoolClosedException extends DatabaseException {
	@NonNull
	private final String poolName;

	public PoolClosedException(@NonNull String poolName) {
		super(format("Pool '%s' is not running", requireNonNull(poolName)));
		this.poolName = poolName;
	}

	@NonNull
	public String getPoolName() {
		return this.poolName;
	}
}
