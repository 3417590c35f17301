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
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;

/**
 * Turns the native result objects handed back by server drivers into a {@link QueryResult}.
 * <p>
 * Recognized shapes are a JDBC {@link ResultSet} (read to the end but not closed), a {@link QueryResult}, and a
 * {@link Map} with a {@code columns} entry (a collection of names) and a {@code rows} entry (a collection of rows, each a
 * collection or an array). Every value passes through the same normalization as engine results.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ResultExtractor {
	@NonNull
	static final String COLUMNS_KEY = "columns";
	@NonNull
	static final String ROWS_KEY = "rows";

	private ResultExtractor() {
		// Non-instantiable
	}

	/**
	 * @param nativeResult the driver's result object
	 * @return the uniform result
	 * @throws UnsupportedResultException if {@code nativeResult} has none of the recognized shapes
	 */
	@NonNull
	public static QueryResult extract(@Nullable Object nativeResult) {
		if (nativeResult instanceof QueryResult queryResult)
			return queryResult;

		if (nativeResult instanceof ResultSet resultSet) {
			try {
				return ResultValues.readAll(resultSet);
			} catch (SQLException e) {
				throw new DatabaseException(format("Unable to read %s", ResultSet.class.getSimpleName()), e);
			}
		}

		if (nativeResult instanceof Map<?, ?> map
				&& map.get(COLUMNS_KEY) instanceof Collection<?> columns
				&& map.get(ROWS_KEY) instanceof Collection<?> rows)
			return fromColumnsAndRows(columns, rows, map);

		throw new UnsupportedResultException(describeShape(nativeResult));
	}

	@NonNull
	private static QueryResult fromColumnsAndRows(@NonNull Collection<?> columns,
																								@NonNull Collection<?> rows,
																								@NonNull Object nativeResult) {
		List<String> columnNames = new ArrayList<>(columns.size());

		for (Object column : columns)
			columnNames.add(String.valueOf(column));

		List<List<Object>> normalizedRows = new ArrayList<>(rows.size());

		for (Object row : rows) {
			List<?> values;

			if (row instanceof Collection<?> collection)
				values = new ArrayList<>(collection);
			else if (row instanceof Object[] array)
				values = Arrays.asList(array);
			else
				throw new UnsupportedResultException(format("%s with a row of type %s", describeShape(nativeResult), describeShape(row)));

			if (values.size() != columnNames.size())
				throw new UnsupportedResultException(format("%s with a row of %d values for %d columns",
						describeShape(nativeResult), values.size(), columnNames.size()));

			List<Object> normalizedRow = new ArrayList<>(values.size());

			for (Object value : values)
				normalizedRow.add(ResultValues.normalize(value));

			normalizedRows.add(normalizedRow);
		}

		return QueryResult.of(columnNames, normalizedRows);
	}

	@NonNull
	private static String describeShape(@Nullable Object nativeResult) {
		return nativeResult == null ? "null" : nativeResult.getClass().getName();
	}
}
