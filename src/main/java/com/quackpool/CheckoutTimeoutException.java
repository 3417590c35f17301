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
import java.time.Duration;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when no pooled connection became available within the checkout timeout.
 * <p>
 * Only the wait is abandoned; no connection is consumed or harmed.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class CheckoutTimeoutException extends DatabaseException {
	@NonNull
	private final String poolName;
	@NonNull
	private final Duration timeout;

	public CheckoutTimeoutException(@NonNull String poolName,
																	@NonNull Duration timeout) {
		super(format("Timed out after %d ms waiting for a connection from pool '%s'",
				requireNonNull(timeout).toMillis(), requireNonNull(poolName)));
		this.poolName = poolName;
		this.timeout = timeout;
	}

	@NonNull
	@Override
	protected List<String> describe() {
		return List.of(format("poolName=%s", getPoolName()), format("timeout=%s", getTimeout()));
	}

	@NonNull
	public String getPoolName() {
		return this.poolName;
	}

	@NonNull
	public Duration getTimeout() {
		return this.timeout;
	}
}
