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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class StatementLoggerTests {
	@Test
	public void testStatementLogsRecordCacheHits() {
		List<StatementLog> statementLogs = Collections.synchronizedList(new ArrayList<>());

		try (Pool pool = Pool.builder(EngineDriver.IN_MEMORY)
				.name("testStatementLogsRecordCacheHits")
				.poolSize(1)
				.statementLogger(statementLogs::add)
				.start()) {
			pool.query("SELECT ? AS val", "first");
			pool.query("SELECT ? AS val", "second");
			pool.query("SELECT ? AS val", List.of("third"), QueryOptions.builder().cache(false).label("uncached").build());
		}

		Assertions.assertEquals(3, statementLogs.size());
		Assertions.assertEquals(Optional.of(false), statementLogs.get(0).getStatementCacheHit());
		Assertions.assertEquals(Optional.of(true), statementLogs.get(1).getStatementCacheHit());
		Assertions.assertEquals(List.of("second"), statementLogs.get(1).getStatementContext().getParameters());
		Assertions.assertEquals("pool 'testStatementLogsRecordCacheHits'", statementLogs.get(1).getStatementContext().getBackendDescription());
		Assertions.assertEquals("uncached", statementLogs.get(2).getStatementContext().getStatement().getLabel());
		Assertions.assertTrue(statementLogs.get(0).getCheckoutDuration().isPresent());
		Assertions.assertTrue(statementLogs.get(0).getExecutionDuration().isPresent());
	}

	@Test
	public void testFailedStatementIsLoggedWithException() {
		List<StatementLog> statementLogs = Collections.synchronizedList(new ArrayList<>());

		try (Pool pool = Pool.builder(EngineDriver.IN_MEMORY)
				.name("testFailedStatementIsLoggedWithException")
				.statementLogger(statementLogs::add)
				.start()) {
			Assertions.assertThrows(QueryExecutionException.class, () -> pool.query("SELECT * FROM nowhere"));
		}

		Assertions.assertEquals(1, statementLogs.size());
		Assertions.assertTrue(statementLogs.get(0).getException().orElseThrow() instanceof QueryExecutionException);
	}

	@Test
	public void testFailingStatementLoggerDoesNotMaskResult() {
		StatementLogger failingStatementLogger = statementLog -> {
			throw new IllegalStateException("logger is broken");
		};

		try (Pool pool = Pool.builder(EngineDriver.IN_MEMORY)
				.name("testFailingStatementLoggerDoesNotMaskResult")
				.statementLogger(failingStatementLogger)
				.start()) {
			Assertions.assertEquals(List.of(List.of(1)), pool.query("SELECT 1 AS one").getRows());
			Assertions.assertThrows(QueryExecutionException.class, () -> pool.query("SELECT * FROM nowhere"));
		}
	}

	@Test
	public void testDefaultStatementLoggerHandlesLongParameters() {
		try (Pool pool = Pool.builder(EngineDriver.IN_MEMORY)
				.name("testDefaultStatementLoggerHandlesLongParameters")
				.statementLogger(new DefaultStatementLogger())
				.start()) {
			String longValue = "x".repeat(500);
			Assertions.assertEquals(List.of(List.of(longValue)), pool.query("SELECT ? AS val", longValue).getRows());
		}
	}

	@Test
	public void testDefaultLabel() {
		Assertions.assertEquals("SELECT 1", Statement.of(null, "SELECT 1").getLabel());
		Assertions.assertEquals("custom", Statement.of("custom", "SELECT 1").getLabel());

		String fifty = "SELECT '" + "a".repeat(41) + "'";
		Assertions.assertEquals(50, fifty.length());
		Assertions.assertEquals(fifty, Statement.defaultLabelFor(fifty));
		Assertions.assertEquals(fifty.substring(0, 49) + "...", Statement.defaultLabelFor(fifty + " "));
	}

	@Test
	public void testDefaultLabelKeepsSurrogatePairsWhole() {
		String duck = "\uD83E\uDD86";
		String prefix = "SELECT '" + "a".repeat(40);
		String sql = prefix + duck + "'";

		Assertions.assertEquals(50, sql.codePointCount(0, sql.length()));
		Assertions.assertEquals(sql, Statement.defaultLabelFor(sql), "50 code points fit even though there are 51 chars");

		String longer = prefix + duck + duck + "'";
		String label = Statement.defaultLabelFor(longer);

		Assertions.assertEquals(prefix + duck + "...", label);
		Assertions.assertFalse(Character.isHighSurrogate(label.charAt(label.length() - 4)), "Label must not end in half a pair");
	}
}
