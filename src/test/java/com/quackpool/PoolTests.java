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
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class PoolTests {
	@Test
	public void testBasicQueries() {
		try (Pool pool = Pool.builder(EngineDriver.IN_MEMORY).name("testBasicQueries").start()) {
			Assertions.assertEquals(PoolState.CONNECTIONS_READY, pool.getState());
			Assertions.assertEquals(Pool.DEFAULT_POOL_SIZE, pool.getPoolSize());
			Assertions.assertEquals(Pool.DEFAULT_CHECKOUT_TIMEOUT, pool.getCheckoutTimeout());

			pool.query("CREATE TABLE users (id INTEGER, name VARCHAR)");
			pool.query("INSERT INTO users VALUES (?, ?), (?, ?)", 1, "Ann", 2, "Bo");

			QueryResult queryResult = pool.query("SELECT id, name FROM users ORDER BY id");

			Assertions.assertEquals(List.of("id", "name"), queryResult.getColumns());
			Assertions.assertEquals(List.of(List.of(1, "Ann"), List.of(2, "Bo")), queryResult.getRows());
		}
	}

	@Test
	public void testTryQueryCarriesException() {
		try (Pool pool = Pool.builder(EngineDriver.IN_MEMORY).name("testTryQueryCarriesException").start()) {
			Result<QueryResult> result = pool.tryQuery("SELECT * FROM nowhere");

			Assertions.assertTrue(result.isFailure());
			Assertions.assertTrue(result.getException().orElseThrow() instanceof QueryExecutionException);
			Assertions.assertThrows(QueryExecutionException.class, result::getOrThrow);

			Assertions.assertTrue(pool.tryQuery("SELECT 1").isSuccess(), "A failed query must not harm the pool");
		}
	}

	@Test
	public void testCheckoutTimeoutAndRecovery() throws Exception {
		ExecutorService executorService = Executors.newSingleThreadExecutor();

		try (Pool pool = Pool.builder(EngineDriver.IN_MEMORY)
				.name("testCheckoutTimeoutAndRecovery")
				.poolSize(1)
				.start()) {
			CountDownLatch held = new CountDownLatch(1);
			CountDownLatch letGo = new CountDownLatch(1);

			Future<Object> holder = executorService.submit(() -> pool.withConnection(engineConnection -> {
				held.countDown();
				letGo.await();
				return null;
			}));

			Assertions.assertTrue(held.await(10, TimeUnit.SECONDS));

			QueryOptions shortWait = QueryOptions.builder().checkoutTimeout(Duration.ofMillis(100)).build();
			CheckoutTimeoutException e = Assertions.assertThrows(CheckoutTimeoutException.class,
					() -> pool.query("SELECT 1", List.of(), shortWait));

			Assertions.assertEquals("testCheckoutTimeoutAndRecovery", e.getPoolName());
			Assertions.assertEquals(Duration.ofMillis(100), e.getTimeout());

			letGo.countDown();
			holder.get(10, TimeUnit.SECONDS);

			Assertions.assertEquals(1, pool.query("SELECT 1 AS one").getRowCount(), "Pool did not recover after timeout");
		} finally {
			executorService.shutdownNow();
		}
	}

	@Test
	public void testCheckoutTimesOutWhenEveryConnectionIsHeld() throws Exception {
		int poolSize = 3;
		ExecutorService executorService = Executors.newFixedThreadPool(poolSize);

		try (Pool pool = Pool.builder(EngineDriver.IN_MEMORY)
				.name("testCheckoutTimesOutWhenEveryConnectionIsHeld")
				.poolSize(poolSize)
				.start()) {
			CountDownLatch held = new CountDownLatch(poolSize);
			CountDownLatch letGo = new CountDownLatch(1);
			List<Future<Long>> holders = new ArrayList<>();

			for (int i = 0; i < poolSize; ++i)
				holders.add(executorService.submit(() -> pool.withConnection(engineConnection -> {
					held.countDown();
					letGo.await();
					return engineConnection.getId();
				})));

			Assertions.assertTrue(held.await(10, TimeUnit.SECONDS), "Every connection should be checked out");

			QueryOptions shortWait = QueryOptions.builder().checkoutTimeout(Duration.ofMillis(100)).build();

			Assertions.assertThrows(CheckoutTimeoutException.class, () -> pool.query("SELECT 1", List.of(), shortWait));
			Assertions.assertTrue(pool.tryQuery("SELECT 1", List.of(), shortWait).getException().orElseThrow() instanceof CheckoutTimeoutException);

			letGo.countDown();

			List<Long> heldIds = new ArrayList<>();

			for (Future<Long> holder : holders)
				heldIds.add(holder.get(10, TimeUnit.SECONDS));

			Assertions.assertEquals(poolSize, heldIds.stream().distinct().count(), "Each holder should have had its own connection");
			Assertions.assertEquals(1, pool.query("SELECT 1 AS one").getRowCount(), "Pool did not recover after timeout");
		} finally {
			executorService.shutdownNow();
		}
	}

	@Test
	public void testUnopenableEngineFailsStart(@TempDir Path temporaryDirectory) {
		String location = temporaryDirectory.resolve("missing").resolve("nested").resolve("pool.duckdb").toString();

		EngineOpenException e = Assertions.assertThrows(EngineOpenException.class, () -> Pool.builder(location)
				.name("testUnopenableEngineFailsStart")
				.start());

		Assertions.assertEquals(location, e.getLocation());
		Assertions.assertNotNull(e.getCause(), "The engine's own failure should be the cause");
		Assertions.assertThrows(EngineOpenException.class, () -> DirectConnection.connect(location));
	}

	@Test
	public void testResultReturningForms() {
		try (Pool pool = Pool.builder(EngineDriver.IN_MEMORY).name("testResultReturningForms").poolSize(1).start()) {
			Result<QueryResult> failedOperation = pool.tryWithConnection(engineConnection -> engineConnection.query("SELECT * FROM nowhere"));
			Assertions.assertTrue(failedOperation.getException().orElseThrow() instanceof QueryExecutionException);

			Result<Long> connectionId = pool.tryWithConnection(EngineConnection::getId);
			Assertions.assertTrue(connectionId.isSuccess());

			Result<Long> discardedId = pool.tryCheckout(engineConnection -> Checkin.discard(engineConnection.getId()));
			Assertions.assertEquals(connectionId.getOrThrow(), discardedId.getOrThrow());

			Result<Long> failedStream = pool.tryWithStream("SELECT * FROM nowhere", List.of(), chunks -> chunks.count());
			Assertions.assertTrue(failedStream.getException().orElseThrow() instanceof QueryExecutionException);

			Result<List<String>> columns = pool.tryWithStreamAndColumns("SELECT range AS n FROM range(5)", List.of(),
					(columnNames, chunks) -> columnNames);
			Assertions.assertEquals(List.of("n"), columns.getOrThrow());

			Assertions.assertTrue(pool.tryQueryChunked("SELECT * FROM nowhere").isFailure());

			try (ChunkCursor chunkCursor = pool.tryQueryChunked("SELECT 7 AS lucky").getOrThrow()) {
				Assertions.assertEquals(List.of(List.of(7)), chunkCursor.next());
			}

			Assertions.assertEquals(1, pool.query("SELECT 1 AS one").getRowCount(), "Failures must not leak the only connection");

			pool.stop();

			Assertions.assertTrue(pool.tryWithConnection(EngineConnection::getId).getException().orElseThrow() instanceof PoolClosedException);
		}
	}

	@Test
	public void testDiscardRecreatesConnection() {
		TestEngines.CountingEngineListener engineListener = new TestEngines.CountingEngineListener();

		try (Pool pool = Pool.builder(EngineDriver.IN_MEMORY)
				.name("testDiscardRecreatesConnection")
				.poolSize(1)
				.engineListener(engineListener)
				.start()) {
			Long keptId = pool.checkout(engineConnection -> Checkin.keep(engineConnection.getId()));
			Long sameId = pool.withConnection(EngineConnection::getId);

			Assertions.assertEquals(keptId, sameId, "A kept connection should be reused");

			Long discardedId = pool.checkout(engineConnection -> Checkin.discard(engineConnection.getId()));
			Long freshId = pool.withConnection(EngineConnection::getId);

			Assertions.assertEquals(keptId, discardedId);
			Assertions.assertNotEquals(discardedId, freshId, "A discarded connection must not be reused");
			Assertions.assertEquals(1, engineListener.getConnectionsClosed());
			Assertions.assertEquals(2, engineListener.getConnectionsOpened());
		}
	}

	@Test
	public void testExceptionInCallbackKeepsConnection() {
		try (Pool pool = Pool.builder(EngineDriver.IN_MEMORY)
				.name("testExceptionInCallbackKeepsConnection")
				.poolSize(1)
				.start()) {
			Long id = pool.withConnection(EngineConnection::getId);

			Assertions.assertThrows(IllegalStateException.class, () -> pool.withConnection(engineConnection -> {
				throw new IllegalStateException("boom");
			}));

			DatabaseException e = Assertions.assertThrows(DatabaseException.class, () -> pool.withConnection(engineConnection -> {
				throw new Exception("checked");
			}));

			Assertions.assertEquals("checked", e.getCause().getMessage());
			Assertions.assertEquals(id, pool.withConnection(EngineConnection::getId));
		}
	}

	@Test
	public void testDataIsSharedAcrossConnections() {
		try (Pool pool = Pool.builder(EngineDriver.IN_MEMORY)
				.name("testDataIsSharedAcrossConnections")
				.poolSize(2)
				.start()) {
			Object count = pool.withConnection(first -> {
				first.query("CREATE TABLE shared (id INTEGER)");
				first.query("INSERT INTO shared VALUES (1), (2), (3)");

				return pool.withConnection(second -> {
					Assertions.assertNotEquals(first.getId(), second.getId());
					return second.query("SELECT count(*) AS total FROM shared").getRows().get(0).get(0);
				});
			});

			Assertions.assertEquals(3L, ((Number) count).longValue());
		}
	}

	@Test
	public void testStopReleasesEngineExactlyOnceUnderLoad() throws Exception {
		TestEngines.CountingEngineListener engineListener = new TestEngines.CountingEngineListener();
		Pool pool = Pool.builder(EngineDriver.IN_MEMORY)
				.name("testStopReleasesEngineExactlyOnceUnderLoad")
				.poolSize(3)
				.engineListener(engineListener)
				.start();

		int workerCount = 8;
		ExecutorService executorService = Executors.newFixedThreadPool(workerCount + 2);
		CountDownLatch started = new CountDownLatch(workerCount);
		AtomicInteger successfulQueries = new AtomicInteger();

		try {
			List<Future<?>> workers = new ArrayList<>();

			for (int i = 0; i < workerCount; ++i) {
				workers.add(executorService.submit(() -> {
					started.countDown();

					while (true) {
						try {
							pool.query("SELECT 42 AS answer");
							successfulQueries.incrementAndGet();
						} catch (PoolClosedException e) {
							return;
						}
					}
				}));
			}

			Assertions.assertTrue(started.await(10, TimeUnit.SECONDS));
			Thread.sleep(100);

			Future<?> firstStop = executorService.submit(pool::stop);
			Future<?> secondStop = executorService.submit(pool::stop);

			firstStop.get(30, TimeUnit.SECONDS);
			secondStop.get(30, TimeUnit.SECONDS);

			for (Future<?> worker : workers)
				worker.get(30, TimeUnit.SECONDS);

			pool.stop();

			Assertions.assertTrue(successfulQueries.get() > 0);
			Assertions.assertEquals(1, engineListener.getEnginesReleased(), "Engine must be released exactly once");
			Assertions.assertEquals(engineListener.getConnectionsOpened(), engineListener.getConnectionsClosed(),
					"Every connection should be closed on stop");
			Assertions.assertEquals(PoolState.STOPPED, pool.getState());
			Assertions.assertFalse(pool.isRunning());
		} finally {
			executorService.shutdownNow();
		}
	}

	@Test
	public void testOperationsAfterStopFail() {
		Pool pool = Pool.builder(EngineDriver.IN_MEMORY).name("testOperationsAfterStopFail").start();
		pool.stop();

		PoolClosedException e = Assertions.assertThrows(PoolClosedException.class, () -> pool.query("SELECT 1"));
		Assertions.assertTrue(e.getMessage().contains("testOperationsAfterStopFail"));
		Assertions.assertTrue(pool.tryQuery("SELECT 1").getException().orElseThrow() instanceof PoolClosedException);
		Assertions.assertThrows(PoolClosedException.class, pool::resetConnections);
	}

	@Test
	public void testResetConnectionsKeepsEngine() {
		TestEngines.CountingEngineListener engineListener = new TestEngines.CountingEngineListener();

		try (Pool pool = Pool.builder(EngineDriver.IN_MEMORY)
				.name("testResetConnectionsKeepsEngine")
				.poolSize(1)
				.engineListener(engineListener)
				.start()) {
			pool.query("CREATE TABLE kept (id INTEGER)");
			pool.query("INSERT INTO kept VALUES (7)");

			Long before = pool.withConnection(EngineConnection::getId);
			pool.resetConnections();
			Long after = pool.withConnection(EngineConnection::getId);

			Assertions.assertNotEquals(before, after, "Reset should replace pooled connections");
			Assertions.assertEquals(1, engineListener.getEnginesOpened());
			Assertions.assertEquals(0, engineListener.getEnginesReleased());
			Assertions.assertEquals(List.of(List.of(7)), pool.query("SELECT id FROM kept").getRows(),
					"Data must survive a connection reset");
		}
	}

	@Test
	public void testFileBackedPoolPersists(@TempDir Path temporaryDirectory) {
		String location = temporaryDirectory.resolve("persisted.duckdb").toString();

		try (Pool pool = Pool.builder(location).name("writer").start()) {
			pool.query("CREATE TABLE events (id INTEGER, kind VARCHAR)");
			pool.query("INSERT INTO events VALUES (1, 'created'), (2, 'deleted')");
		}

		try (Pool pool = Pool.builder(location).name("reader").start()) {
			QueryResult queryResult = pool.query("SELECT kind FROM events ORDER BY id");
			Assertions.assertEquals(List.of(List.of("created"), List.of("deleted")), queryResult.getRows());
		}
	}

	@Test
	public void testWithStreamDeliversChunks() {
		try (Pool pool = Pool.builder(EngineDriver.IN_MEMORY)
				.name("testWithStreamDeliversChunks")
				.chunkSize(10)
				.start()) {
			List<Integer> chunkSizes = pool.withStream("SELECT range AS n FROM range(25) ORDER BY n", List.of(),
					chunks -> chunks.map(List::size).collect(Collectors.toList()));

			Assertions.assertEquals(List.of(10, 10, 5), chunkSizes);

			QueryOptions smallChunks = QueryOptions.builder().chunkSize(20).build();
			String summary = pool.withStreamAndColumns("SELECT range AS n FROM range(25) ORDER BY n", List.of(), smallChunks,
					(columns, chunks) -> columns + ":" + chunks.map(List::size).collect(Collectors.toList()));

			Assertions.assertEquals("[n]:[20, 5]", summary);
		}
	}

	@Test
	public void testChunkCursorHoldsConnectionUntilClosed() {
		try (Pool pool = Pool.builder(EngineDriver.IN_MEMORY)
				.name("testChunkCursorHoldsConnectionUntilClosed")
				.poolSize(1)
				.chunkSize(2)
				.start()) {
			QueryOptions shortWait = QueryOptions.builder().checkoutTimeout(Duration.ofMillis(50)).build();

			try (ChunkCursor chunkCursor = pool.queryChunked("SELECT range AS n FROM range(5) ORDER BY n")) {
				Assertions.assertEquals(List.of("n"), chunkCursor.getColumns());
				Assertions.assertTrue(chunkCursor.hasNext());
				Assertions.assertEquals(2, chunkCursor.next().size());
				Assertions.assertThrows(CheckoutTimeoutException.class, () -> pool.query("SELECT 1", List.of(), shortWait));
			}

			Assertions.assertEquals(1, pool.query("SELECT 1", List.of(), shortWait).getRowCount());

			ChunkCursor exhausted = pool.queryChunked("SELECT range AS n FROM range(3)");
			int chunkCount = 0;

			while (exhausted.hasNext()) {
				exhausted.next();
				++chunkCount;
			}

			Assertions.assertEquals(2, chunkCount);
			Assertions.assertTrue(exhausted.isClosed(), "Exhausting a cursor should close it");
			Assertions.assertEquals(1, pool.query("SELECT 1", List.of(), shortWait).getRowCount());
		}
	}

	@Test
	public void testBuilderRejectsInvalidSettings() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> Pool.builder(EngineDriver.IN_MEMORY).poolSize(0));
		Assertions.assertThrows(IllegalArgumentException.class, () -> Pool.builder(EngineDriver.IN_MEMORY).checkoutTimeout(Duration.ofSeconds(-1)));
	}
}
