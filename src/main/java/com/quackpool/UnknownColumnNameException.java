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
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when a result column is not on the declared allow-list of {@link KnownColumns} and dynamic columns are
 * disabled.
 * <p>
 * Column names may be influenced by whoever controls the SQL or the schema, so they are only accepted when declared
 * up front (or when they name a field of the requested target type).
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class UnknownColumnNameException extends DatabaseException {
	@NonNull
	private final String columnName;

	public UnknownColumnNameException(@NonNull String columnName) {
		super(format("Column '%s' is not a known column name. Declare it via %s or enable dynamic columns.",
				requireNonNull(columnName), KnownColumns.class.getSimpleName()));
		this.columnName = columnName;
	}

	@NonNull
	@Override
	protected List<String> describe() {
		return List.of(format("column=%s", getColumnName()));
	}

	@NonNull
	public String getColumnName() {
		return this.columnName;
	}
}
