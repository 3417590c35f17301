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
 * Thrown when a query expected to return exactly one row returns none.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class NoResultsException extends DatabaseException {
	@NonNull
	private final String queryLabel;

	public NoResultsException(@NonNull String queryLabel) {
		super(format("expected at least one result but got none for query: %s", requireNonNull(queryLabel)));
		this.queryLabel = queryLabel;
	}

	/**
	 * @return the caller-supplied query label, or the SQL truncated to 50 characters
	 */
	@NonNull
	public String getQueryLabel() {
		return this.queryLabel;
	}
}
