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
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when a result row cannot be turned into an instance of the requested target type, for example because a
 * column has no matching field or a value cannot be assigned to its field.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class RecordConstructionException extends DatabaseException {
	@NonNull
	private final Class<?> targetType;
	@Nullable
	private final String columnName;

	public RecordConstructionException(@NonNull Class<?> targetType,
																		 @Nullable String columnName,
																		 @NonNull String message) {
		this(targetType, columnName, message, null);
	}

	public RecordConstructionException(@NonNull Class<?> targetType,
																		 @Nullable String columnName,
																		 @NonNull String message,
																		 @Nullable Throwable cause) {
		super(requireNonNull(message), cause);
		this.targetType = requireNonNull(targetType);
		this.columnName = columnName;
	}

	@NonNull
	@Override
	protected List<String> describe() {
		return getColumnName().isPresent()
				? List.of(format("targetType=%s", getTargetType().getName()), format("column=%s", getColumnName().get()))
				: List.of(format("targetType=%s", getTargetType().getName()));
	}

	@NonNull
	public Class<?> getTargetType() {
		return this.targetType;
	}

	@NonNull
	public Optional<String> getColumnName() {
		return Optional.ofNullable(this.columnName);
	}
}
