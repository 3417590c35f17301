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
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class DirectConnectionTests {
	private static final String HSQLDB_SQL = "SELECT 1 AS \"one\" FROM (VALUES (0)) AS t(x)";

	@Test
	public void testQueryAndDisconnect() {
		TestEngines.CountingEngineListener engineListener = new TestEngines.CountingEngineListener();
		DirectConnection directConnection = DirectConnection.connect(new DuckDbEngineDriver(), EngineDriver.IN_MEMORY,
				EngineConfig.builder().threads(1).build(), engineListener, new DefaultStatementLogger());

		Assertions.assertTrue(directConnection.isConnected());
		Assertions.assertEquals(EngineDriver.IN_MEMORY, directConnection.getLocation());
		Assertions.assertEquals("connection ':memory:'", directConnection.getDescription());

		directConnection.query("CREATE TABLE notes (id INTEGER, body VARCHAR)");
		directConnection.query("INSERT INTO notes VALUES (?, ?)", 1, null);

		Assertions.assertEquals(List.of(List.of(1)), directConnection.query("SELECT id FROM notes WHERE body IS NULL").getRows());
		Assertions.assertTrue(directConnection.tryQuery("SELECT * FROM nowhere").isFailure());

		directConnection.disconnect();
		directConnection.disconnect();

		Assertions.assertFalse(directConnection.isConnected());
		Assertions.assertEquals(1, engineListener.getEnginesReleased(), "Engine must be released once");
		Assertions.assertEquals(1, engineListener.getConnectionsClosed());
		Assertions.assertThrows(DatabaseException.class, () -> directConnection.query("SELECT 1"));
	}

	@Test
	public void testChunkedQueryReleasesConnectionOnClose() {
		try (DirectConnection directConnection = DirectConnection.connect(EngineDriver.IN_MEMORY)) {
			QueryOptions twoPerChunk = QueryOptions.builder().chunkSize(2).build();

			try (ChunkCursor chunkCursor = directConnection.executeChunked("SELECT range AS n FROM range(3) ORDER BY n", List.of(), twoPerChunk)) {
				Assertions.assertEquals(List.of(List.of(0L), List.of(1L)), chunkCursor.next());
			}

			// Closing the cursor frees the connection for the next operation
			Assertions.assertEquals(1, directConnection.query("SELECT 1").getRowCount());

			Assertions.assertThrows(QueryExecutionException.class, () -> directConnection.queryChunked("SELECT * FROM nowhere"));

			Assertions.assertEquals(1, directConnection.query("SELECT 1").getRowCount(), "A failed chunked query must free the connection");
		}
	}

	@Test
	public void testSqlKitOverDirectConnection(@TempDir Path temporaryDirectory) {
		String location = temporaryDirectory.resolve("direct.duckdb").toString();

		try (DirectConnection directConnection = DirectConnection.connect(location)) {
			directConnection.query("CREATE TABLE settings (name VARCHAR, value VARCHAR)");
			directConnection.query("INSERT INTO settings VALUES ('theme', 'dark')");
		}

		try (DirectConnection directConnection = DirectConnection.connect(location, EngineConfig.defaults())) {
			SqlKit sqlKit = SqlKit.withBackend(directConnection).allowDynamicColumns(true).build();

			Assertions.assertEquals(Map.of("name", "theme", "value", "dark"),
					sqlKit.query("SELECT name, value FROM settings").fetchOne());
		}
	}

	@Test
	public void testFailedConnectReleasesEngine() {
		TestEngines.HsqldbEngineDriver engineDriver = new TestEngines.HsqldbEngineDriver();
		EngineDriver brokenEngineDriver = (location, engineConfig) -> {
			TestEngines.HsqldbEngineHandle engineHandle = (TestEngines.HsqldbEngineHandle) engineDriver.open(location, engineConfig);
			engineHandle.invalidate();
			return engineHandle;
		};

		EngineOpenException e = Assertions.assertThrows(EngineOpenException.class, () -> DirectConnection.connect(brokenEngineDriver,
				"broken", EngineConfig.defaults(), EngineListener.NO_OP, new DefaultStatementLogger()));

		Assertions.assertTrue(e.getCause() instanceof SQLException);
		Assertions.assertEquals(1, engineDriver.getOpenedHandles().get(0).getReleaseCount());
	}

	@Test
	public void testDisconnectWaitsForOpenCursor() throws Exception {
		TestEngines.HsqldbEngineDriver engineDriver = new TestEngines.HsqldbEngineDriver();
		DirectConnection directConnection = DirectConnection.connect(engineDriver, "waiting", EngineConfig.defaults(),
				EngineListener.NO_OP, new DefaultStatementLogger());
		ExecutorService executorService = Executors.newSingleThreadExecutor();

		try {
			ChunkCursor chunkCursor = directConnection.queryChunked(HSQLDB_SQL);
			Future<?> disconnecting = executorService.submit(() -> directConnection.disconnect(Duration.ofSeconds(30)));

			Assertions.assertThrows(TimeoutException.class, () -> disconnecting.get(300, TimeUnit.MILLISECONDS),
					"Disconnect must wait for the open cursor");
			Assertions.assertEquals(0, engineDriver.getOpenedHandles().get(0).getReleaseCount());
			Assertions.assertThrows(DatabaseException.class, () -> directConnection.query(HSQLDB_SQL),
					"New work is refused once a disconnect has begun");

			Assertions.assertEquals(List.of(List.of(1)), chunkCursor.next());
			chunkCursor.close();

			disconnecting.get(10, TimeUnit.SECONDS);

			Assertions.assertFalse(directConnection.isConnected());
			Assertions.assertEquals(1, engineDriver.getOpenedHandles().get(0).getReleaseCount());
		} finally {
			executorService.shutdownNow();
		}
	}

	@Test
	public void testDisconnectForceClosesAfterTimeout() {
		TestEngines.HsqldbEngineDriver engineDriver = new TestEngines.HsqldbEngineDriver();
		TestEngines.CountingEngineListener engineListener = new TestEngines.CountingEngineListener();
		DirectConnection directConnection = DirectConnection.connect(engineDriver, "stuck", EngineConfig.defaults(),
				engineListener, new DefaultStatementLogger());

		ChunkCursor abandonedCursor = directConnection.queryChunked(HSQLDB_SQL);

		Assertions.assertNotNull(abandonedCursor);

		directConnection.disconnect(Duration.ofMillis(100));

		Assertions.assertFalse(directConnection.isConnected());
		Assertions.assertEquals(1, engineListener.getConnectionsClosed(), "Connection should be force-closed");
		Assertions.assertEquals(1, engineDriver.getOpenedHandles().get(0).getReleaseCount());
	}

	@Test
	public void testTryQueryChunked() {
		try (DirectConnection directConnection = DirectConnection.connect(EngineDriver.IN_MEMORY)) {
			Result<ChunkCursor> failed = directConnection.tryQueryChunked("SELECT * FROM nowhere");

			Assertions.assertTrue(failed.getException().orElseThrow() instanceof QueryExecutionException);

			Result<ChunkCursor> succeeded = directConnection.tryQueryChunked("SELECT 42 AS answer");

			try (ChunkCursor chunkCursor = succeeded.getOrThrow()) {
				Assertions.assertEquals(List.of("answer"), chunkCursor.getColumns());
				Assertions.assertEquals(List.of(List.of(42)), chunkCursor.next());
			}
		}
	}
}
