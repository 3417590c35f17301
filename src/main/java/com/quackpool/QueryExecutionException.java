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
 * Thrown when a SQL statement fails to prepare or execute.
 * <p>
 * A failed query does not mark the connection it ran on as unhealthy; whether to retry is up to the caller.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class QueryExecutionException extends DatabaseException {
	@NonNull
	private final String sql;

	public QueryExecutionException(@NonNull String sql,
																 @Nullable Throwable cause) {
		super(cause == null ? "Query execution failed" : format("Query execution failed: %s", cause.getMessage()), cause);
		this.sql = requireNonNull(sql);
	}

	@NonNull
	@Override
	protected List<String> describe() {
		return List.of(format("sql=%s", getSql().replaceAll("\\s+", " ").trim()));
	}

	/**
	 * @return the SQL text that failed
	 */
	@NonNull
	public String getSql() {
		return this.sql;
	}
}
