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
import java.util.List;

/**
 * Something SQL can be executed against: a {@link Pool}, a {@link DirectConnection} or a conventional SQL server
 * ({@link DataSourceBackend}).
 * <p>
 * Every backend produces the same uniform {@link QueryResult}. Use {@link Backends#of(Object)} to adapt other objects.
 *
 * @since 1.0.0
 */
@ThreadSafe
public interface Backend {
	/**
	 * Executes {@code sql} with positional {@code parameters} and returns the whole result.
	 *
	 * @throws QueryExecutionException  if the statement fails
	 * @throws CheckoutTimeoutException if the backend pools connections and none became available in time
	 */
	@NonNull
	QueryResult execute(@NonNull String sql,
											@NonNull List<Object> parameters,
											@NonNull QueryOptions queryOptions);

	/**
	 * Executes {@code sql} and returns an open cursor over its rows. Whatever connection the cursor needs is held until
	 * the cursor is exhausted or closed.
	 */
	@NonNull
	ChunkCursor executeChunked(@NonNull String sql,
														 @NonNull List<Object> parameters,
														 @NonNull QueryOptions queryOptions);

	/**
	 * @return a short human-readable description for diagnostics, e.g. {@code pool 'analytics'}
	 */
	@NonNull
	String getDescription();
}
