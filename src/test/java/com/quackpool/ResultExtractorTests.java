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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class ResultExtractorTests {
	@Test
	public void testColumnsAndRowsMap() {
		QueryResult queryResult = ResultExtractor.extract(Map.of(
				"columns", List.of("id", "total"),
				"rows", List.of(Arrays.asList(1, null), List.of(2, new Object[]{0L, 9L}))));

		Assertions.assertEquals(List.of("id", "total"), queryResult.getColumns());
		Assertions.assertEquals(Arrays.asList(1, null), queryResult.getRows().get(0));
		Assertions.assertEquals(BigInteger.valueOf(9), queryResult.getRows().get(1).get(1), "Row values should be normalized");
	}

	@Test
	public void testQueryResultPassesThrough() {
		QueryResult queryResult = QueryResult.of(List.of("a"), List.of(List.of("x")));
		Assertions.assertSame(queryResult, ResultExtractor.extract(queryResult));
	}

	@Test
	public void testResultSet() throws Exception {
		try (Connection connection = DriverManager.getConnection("jdbc:hsqldb:mem:testResultSet", "sa", "");
				 Statement statement = connection.createStatement();
				 ResultSet resultSet = statement.executeQuery("SELECT 1 AS \"one\", 'two' AS \"two\" FROM (VALUES (0)) AS t(x)")) {
			QueryResult queryResult = ResultExtractor.extract(resultSet);

			Assertions.assertEquals(List.of("one", "two"), queryResult.getColumns());
			Assertions.assertEquals(List.of(List.of(1, "two")), queryResult.getRows());
		}
	}

	@Test
	public void testUnsupportedShapes() {
		Assertions.assertEquals("null", Assertions.assertThrows(UnsupportedResultException.class,
				() -> ResultExtractor.extract(null)).getObservedShape());
		Assertions.assertEquals(Integer.class.getName(), Assertions.assertThrows(UnsupportedResultException.class,
				() -> ResultExtractor.extract(42)).getObservedShape());
		Assertions.assertThrows(UnsupportedResultException.class, () -> ResultExtractor.extract(Map.of("columns", List.of("a"))));
		Assertions.assertThrows(UnsupportedResultException.class,
				() -> ResultExtractor.extract(Map.of("columns", List.of("a", "b"), "rows", List.of(List.of(1)))));
	}

	@Test
	public void testQueryResultRejectsRaggedRows() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> QueryResult.of(List.of("a", "b"), List.of(List.of(1))));
		Assertions.assertEquals(Optional.of(5L), QueryResult.ofUpdateCount(5L).getUpdateCount());
	}
}
