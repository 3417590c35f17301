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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class EngineConnectionTests {
	@Test
	public void testCachedStatementIsPreparedOnce() throws Exception {
		TestEngines.CountingEngineListener engineListener = new TestEngines.CountingEngineListener();
		EngineHandle engineHandle = new DuckDbEngineDriver().open(EngineDriver.IN_MEMORY, EngineConfig.defaults());

		try (EngineConnection engineConnection = EngineConnection.open(engineHandle, engineListener, new DefaultStatementLogger(), "test")) {
			QueryResult first = engineConnection.query("SELECT ? + 1 AS answer", 41);
			QueryResult second = engineConnection.query("SELECT ? + 1 AS answer", 1);

			Assertions.assertEquals(1, engineListener.getStatementsPrepared(), "Cached statement was prepared more than once");
			Assertions.assertEquals(1, engineConnection.getCachedStatementCount());
			Assertions.assertEquals(List.of("answer"), first.getColumns());
			Assertions.assertEquals(42, ((Number) first.getRows().get(0).get(0)).intValue());
			Assertions.assertEquals(2, ((Number) second.getRows().get(0).get(0)).intValue());
		} finally {
			engineHandle.release();
		}
	}

	@Test
	public void testUncachedStatementIsPreparedEveryTime() throws Exception {
		TestEngines.CountingEngineListener engineListener = new TestEngines.CountingEngineListener();
		EngineHandle engineHandle = new DuckDbEngineDriver().open(EngineDriver.IN_MEMORY, EngineConfig.defaults());

		try (EngineConnection engineConnection = EngineConnection.open(engineHandle, engineListener, new DefaultStatementLogger(), "test")) {
			engineConnection.execute("SELECT 1", List.of(), false);
			engineConnection.execute("SELECT 1", List.of(), false);

			Assertions.assertEquals(2, engineListener.getStatementsPrepared());
			Assertions.assertEquals(0, engineConnection.getCachedStatementCount());
		} finally {
			engineHandle.release();
		}
	}

	@Test
	public void testRowsRoundTripInOrder() throws Exception {
		EngineHandle engineHandle = new DuckDbEngineDriver().open(EngineDriver.IN_MEMORY, EngineConfig.defaults());

		try (EngineConnection engineConnection = EngineConnection.open(engineHandle, EngineListener.NO_OP, new DefaultStatementLogger(), "test")) {
			engineConnection.query("CREATE TABLE item (id INTEGER, name VARCHAR)");

			int rowCount = 250;

			// Inserted in reverse so ORDER BY has work to do
			for (int i = rowCount; i > 0; --i)
				engineConnection.query("INSERT INTO item VALUES (?, ?)", i, "item-" + i);

			QueryResult queryResult = engineConnection.query("SELECT id, name FROM item ORDER BY id");

			Assertions.assertEquals(List.of("id", "name"), queryResult.getColumns());
			Assertions.assertEquals(rowCount, queryResult.getRowCount());

			List<Object> ids = new ArrayList<>();

			for (List<Object> row : queryResult.getRows())
				ids.add(row.get(0));

			for (int i = 0; i < rowCount; ++i) {
				Assertions.assertEquals(i + 1, ids.get(i), "Rows came back out of order");
				Assertions.assertEquals("item-" + (i + 1), queryResult.getRows().get(i).get(1));
			}
		} finally {
			engineHandle.release();
		}
	}

	@Test
	public void testCompositeValues() throws Exception {
		EngineHandle engineHandle = new DuckDbEngineDriver().open(EngineDriver.IN_MEMORY, EngineConfig.defaults());

		try (EngineConnection engineConnection = EngineConnection.open(engineHandle, EngineListener.NO_OP, new DefaultStatementLogger(), "test")) {
			QueryResult queryResult = engineConnection.query(
					"SELECT [1, 2] AS pair, {'a': 1, 'b': 'two'} AS shape, CAST(170141183460469231731687303715884105727 AS HUGEINT) AS big");
			List<Object> row = queryResult.getRows().get(0);

			// Two-element lists stay lists
			Assertions.assertEquals(List.of(1, 2), row.get(0));
			Assertions.assertEquals(Map.of("a", 1, "b", "two"), row.get(1));
			Assertions.assertEquals(new BigInteger("170141183460469231731687303715884105727"), row.get(2));
		} finally {
			engineHandle.release();
		}
	}

	@Test
	public void testFailedStatementRaisesQueryExecutionException() throws Exception {
		EngineHandle engineHandle = new DuckDbEngineDriver().open(EngineDriver.IN_MEMORY, EngineConfig.defaults());

		try (EngineConnection engineConnection = EngineConnection.open(engineHandle, EngineListener.NO_OP, new DefaultStatementLogger(), "test")) {
			QueryExecutionException e = Assertions.assertThrows(QueryExecutionException.class,
					() -> engineConnection.query("SELECT * FROM missing_table"));

			Assertions.assertTrue(e.getMessage().contains("missing_table"), "Message should name the failing SQL");

			// Connection is still usable
			Assertions.assertEquals(1, engineConnection.query("SELECT 1 AS one").getRowCount());
		} finally {
			engineHandle.release();
		}
	}

	@Test
	public void testCloseReleasesCachedStatementsButNotEngine() throws Exception {
		TestEngines.CountingEngineListener engineListener = new TestEngines.CountingEngineListener();
		EngineHandle engineHandle = new DuckDbEngineDriver().open(EngineDriver.IN_MEMORY, EngineConfig.defaults());

		try {
			EngineConnection engineConnection = EngineConnection.open(engineHandle, engineListener, new DefaultStatementLogger(), "test");
			engineConnection.query("SELECT 1");
			engineConnection.close();
			engineConnection.close();

			Assertions.assertTrue(engineConnection.isClosed());
			Assertions.assertEquals(0, engineConnection.getCachedStatementCount());
			Assertions.assertEquals(1, engineListener.getConnectionsClosed(), "Close should be idempotent");
			Assertions.assertTrue(engineHandle.isValid(), "Closing a connection must not release its engine");
		} finally {
			engineHandle.release();
		}

		Assertions.assertFalse(engineHandle.isValid());
	}
}
