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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Uniform, immutable result of a query: column names in select order plus rows of values aligned with them.
 * <p>
 * Statements that produce no result set (DDL, most DML) have no columns and no rows, and carry an update count.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class QueryResult {
	@NonNull
	private final List<String> columns;
	@NonNull
	private final List<List<Object>> rows;
	@Nullable
	private final Long updateCount;

	private QueryResult(@NonNull List<String> columns,
											@NonNull List<List<Object>> rows,
											@Nullable Long updateCount) {
		requireNonNull(columns);
		requireNonNull(rows);

		List<List<Object>> copiedRows = new ArrayList<>(rows.size());

		for (List<Object> row : rows) {
			requireNonNull(row);

			if (row.size() != columns.size())
				throw new IllegalArgumentException(format("Row has %d values but there are %d columns", row.size(), columns.size()));

			// Rows may contain nulls
			copiedRows.add(Collections.unmodifiableList(new ArrayList<>(row)));
		}

		this.columns = List.copyOf(columns);
		this.rows = Collections.unmodifiableList(copiedRows);
		this.updateCount = updateCount;
	}

	@NonNull
	public static QueryResult of(@NonNull List<String> columns,
															 @NonNull List<List<Object>> rows) {
		return new QueryResult(columns, rows, null);
	}

	/**
	 * A result for a statement that produced no result set.
	 *
	 * @param updateCount the driver-reported update count
	 * @return an empty result carrying {@code updateCount}
	 */
	@NonNull
	public static QueryResult ofUpdateCount(long updateCount) {
		return new QueryResult(List.of(), List.of(), updateCount);
	}

	@NonNull
	public List<String> getColumns() {
		return this.columns;
	}

	@NonNull
	public List<List<Object>> getRows() {
		return this.rows;
	}

	public int getRowCount() {
		return this.rows.size();
	}

	@NonNull
	public Optional<Long> getUpdateCount() {
		return Optional.ofNullable(this.updateCount);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof QueryResult queryResult))
			return false;

		return Objects.equals(getColumns(), queryResult.getColumns())
				&& Objects.equals(getRows(), queryResult.getRows())
				&& Objects.equals(getUpdateCount(), queryResult.getUpdateCount());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getColumns(), getRows(), getUpdateCount());
	}

	@Override
	public String toString() {
		return this.updateCount == null
				? format("%s{columns=%s, rowCount=%d}", getClass().getSimpleName(), getColumns(), getRowCount())
				: format("%s{updateCount=%d}", getClass().getSimpleName(), this.updateCount);
	}
}
