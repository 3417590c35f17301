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
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An explicit allow-list of column names that results may be keyed by.
 * <p>
 * Result columns are checked against the columns declared on {@link SqlKit}, those declared per query, and the fields
 * of the requested target type. Enabling dynamic columns skips the check without adding anything to the list.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class KnownColumns {
	@NonNull
	private static final KnownColumns NONE = new KnownColumns(Set.of());

	@NonNull
	private final Set<String> columnNames;

	private KnownColumns(@NonNull Set<String> columnNames) {
		this.columnNames = Set.copyOf(requireNonNull(columnNames));
	}

	@NonNull
	public static KnownColumns none() {
		return NONE;
	}

	@NonNull
	public static KnownColumns of(@NonNull String... columnNames) {
		requireNonNull(columnNames);
		return of(Arrays.asList(columnNames));
	}

	@NonNull
	public static KnownColumns of(@NonNull Collection<String> columnNames) {
		requireNonNull(columnNames);

		Set<String> names = new LinkedHashSet<>(columnNames.size());

		for (String columnName : columnNames)
			names.add(requireNonNull(columnName));

		return names.isEmpty() ? NONE : new KnownColumns(names);
	}

	/**
	 * @return a list containing the names of both this list and {@code other}
	 */
	@NonNull
	public KnownColumns union(@NonNull KnownColumns other) {
		requireNonNull(other);

		if (other.columnNames.isEmpty())
			return this;

		if (this.columnNames.isEmpty())
			return other;

		Set<String> names = new LinkedHashSet<>(this.columnNames);
		names.addAll(other.columnNames);
		return new KnownColumns(names);
	}

	public boolean contains(@NonNull String columnName) {
		requireNonNull(columnName);
		return this.columnNames.contains(columnName);
	}

	@NonNull
	public Set<String> getColumnNames() {
		return this.columnNames;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof KnownColumns knownColumns))
			return false;

		return Objects.equals(this.columnNames, knownColumns.columnNames);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.columnNames);
	}

	@Override
	public String toString() {
		return format("%s{columnNames=%s}", getClass().getSimpleName(), this.columnNames);
	}
}
