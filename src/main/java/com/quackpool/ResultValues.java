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

import org.duckdb.DuckDBStruct;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigInteger;
import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Struct;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Post-processing applied to every value read from a native result, plus the JDBC plumbing shared by all backends
 * for binding parameters and reading rows.
 * <p>
 * Normalization rules, applied recursively:
 * <ul>
 *   <li>{@link Array} becomes a {@link List}</li>
 *   <li>{@link Struct} becomes an insertion-ordered {@link Map} keyed by field name (positional keys when the driver
 *   does not expose names)</li>
 *   <li>a two-element tuple of integers, either {@code Object[]{Long|Integer, Long|Integer}} or {@code long[2]}, is
 *   read as a 128-bit integer {@code (high, low)} and becomes {@code high * 2^64 + unsigned(low)} as a
 *   {@link BigInteger}</li>
 * </ul>
 * The tuple rule is a shape heuristic: any other driver value that arrives as a two-integer array is misread.
 * DuckDB's JDBC driver already hands back {@link BigInteger} for {@code HUGEINT}, so the rule only matters for
 * drivers using the tuple encoding.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class ResultValues {
	private static final BigInteger TWO_TO_THE_64TH = BigInteger.ONE.shiftLeft(64);

	private ResultValues() {
		// Non-instantiable
	}

	@Nullable
	static Object normalize(@Nullable Object value) {
		if (value == null)
			return null;

		try {
			if (value instanceof Array array)
				return normalizeAll(asObjectArray(array.getArray()));

			if (value instanceof DuckDBStruct duckDbStruct)
				return normalizeMap(duckDbStruct.getMap());

			if (value instanceof Struct struct) {
				Object[] attributes = struct.getAttributes();
				Map<String, Object> normalized = new LinkedHashMap<>(attributes.length * 2);

				for (int i = 0; i < attributes.length; ++i)
					normalized.put(String.valueOf(i), normalize(attributes[i]));

				return normalized;
			}
		} catch (SQLException e) {
			throw new DatabaseException("Unable to read a composite value from the driver", e);
		}

		if (value instanceof long[] longs && longs.length == 2)
			return toWideInteger(longs[0], longs[1]);

		if (value instanceof Object[] objects) {
			if (isWideIntegerTuple(objects))
				return toWideInteger(((Number) objects[0]).longValue(), ((Number) objects[1]).longValue());

			Object[] normalized = new Object[objects.length];

			for (int i = 0; i < objects.length; ++i)
				normalized[i] = normalize(objects[i]);

			return normalized;
		}

		if (value instanceof List<?> list)
			return normalizeAll(list.toArray());

		if (value instanceof Map<?, ?> map)
			return normalizeMap(map);

		return value;
	}

	@NonNull
	static BigInteger toWideInteger(long high,
																	long low) {
		BigInteger unsignedLow = BigInteger.valueOf(low);

		if (low < 0)
			unsignedLow = unsignedLow.add(TWO_TO_THE_64TH);

		return BigInteger.valueOf(high).shiftLeft(64).add(unsignedLow);
	}

	private static boolean isWideIntegerTuple(@NonNull Object[] objects) {
		return objects.length == 2
				&& (objects[0] instanceof Long || objects[0] instanceof Integer)
				&& (objects[1] instanceof Long || objects[1] instanceof Integer);
	}

	@NonNull
	private static List<Object> normalizeAll(@NonNull Object[] values) {
		List<Object> normalized = new ArrayList<>(values.length);

		for (Object element : values)
			normalized.add(normalize(element));

		return normalized;
	}

	@NonNull
	private static Map<String, Object> normalizeMap(@NonNull Map<?, ?> map) {
		Map<String, Object> normalized = new LinkedHashMap<>(map.size() * 2);

		for (Map.Entry<?, ?> entry : map.entrySet())
			normalized.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));

		return normalized;
	}

	@NonNull
	private static Object[] asObjectArray(@Nullable Object array) {
		if (array == null)
			return new Object[0];

		if (array instanceof Object[] objects)
			return objects;

		// Primitive arrays
		int length = java.lang.reflect.Array.getLength(array);
		Object[] boxed = new Object[length];

		for (int i = 0; i < length; ++i)
			boxed[i] = java.lang.reflect.Array.get(array, i);

		return boxed;
	}

	static void bindParameters(@NonNull PreparedStatement preparedStatement,
														 @NonNull List<Object> parameters) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(parameters);

		preparedStatement.clearParameters();

		for (int i = 0; i < parameters.size(); ++i)
			preparedStatement.setObject(i + 1, parameters.get(i));
	}

	@NonNull
	static List<String> readColumns(@NonNull ResultSetMetaData resultSetMetaData) throws SQLException {
		requireNonNull(resultSetMetaData);

		int columnCount = resultSetMetaData.getColumnCount();
		List<String> columns = new ArrayList<>(columnCount);

		for (int i = 1; i <= columnCount; ++i)
			columns.add(resultSetMetaData.getColumnLabel(i));

		return columns;
	}

	/**
	 * Reads the current row of {@code resultSet}, normalizing each value.
	 */
	@NonNull
	static List<Object> readRow(@NonNull ResultSet resultSet,
															int columnCount) throws SQLException {
		requireNonNull(resultSet);

		Object[] row = new Object[columnCount];

		for (int i = 0; i < columnCount; ++i)
			row[i] = normalize(resultSet.getObject(i + 1));

		return Arrays.asList(row);
	}

	/**
	 * Drains {@code resultSet} into a {@link QueryResult}.
	 */
	@NonNull
	static QueryResult readAll(@NonNull ResultSet resultSet) throws SQLException {
		requireNonNull(resultSet);

		List<String> columns = readColumns(resultSet.getMetaData());
		List<List<Object>> rows = new ArrayList<>();

		while (resultSet.next())
			rows.add(readRow(resultSet, columns.size()));

		return QueryResult.of(columns, rows);
	}
}
