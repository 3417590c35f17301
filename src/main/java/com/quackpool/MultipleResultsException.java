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
 * Thrown when a query expected to return exactly one row returns more than one.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class MultipleResultsException extends DatabaseException {
	@NonNull
	private final String queryLabel;
	private final int count;

	public MultipleResultsException(@NonNull String queryLabel,
																	int count) {
		super(format("expected at most one result but got %d for query: %s", count, requireNonNull(queryLabel)));
		this.queryLabel = queryLabel;
		this.count = count;
	}

	@NonNull
	public String getQueryLabel() {
		return this.queryLabel;
	}

	/**
	 * @return how many rows the query actually returned
	 */
	public int getCount() {
		return this.count;
	}
}
