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
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Lifecycle of the engine and connection stages, driven through an HSQLDB-backed engine whose handles can be made to
 * fail.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class PoolSupervisorTests {
	private static final String ONE_ROW_SQL = "SELECT 1 AS \"one\" FROM (VALUES (0)) AS t(x)";

	@Test
	public void testStartAndStopTransitions() {
		TestEngines.HsqldbEngineDriver engineDriver = new TestEngines.HsqldbEngineDriver();
		TestEngines.CountingEngineListener engineListener = new TestEngines.CountingEngineListener();

		Pool pool = Pool.builder("supervised")
				.name("testStartAndStopTransitions")
				.engineDriver(engineDriver)
				.engineListener(engineListener)
				.start();

		Assertions.assertEquals(PoolState.CONNECTIONS_READY, pool.getState());
		Assertions.assertEquals(1, engineListener.getEnginesOpened());
		Assertions.assertEquals(List.of(List.of(1)), pool.query(ONE_ROW_SQL).getRows());

		pool.stop();
		pool.stop();

		Assertions.assertEquals(PoolState.STOPPED, pool.getState());
		Assertions.assertEquals(1, engineDriver.getOpenedHandles().get(0).getReleaseCount(), "Handle must be released exactly once");
		Assertions.assertEquals(1, engineListener.getEnginesReleased());
	}

	@Test
	public void testInvalidEngineIsRestarted() {
		TestEngines.HsqldbEngineDriver engineDriver = new TestEngines.HsqldbEngineDriver();
		TestEngines.CountingEngineListener engineListener = new TestEngines.CountingEngineListener();

		try (Pool pool = Pool.builder("supervised")
				.name("testInvalidEngineIsRestarted")
				.poolSize(1)
				.engineDriver(engineDriver)
				.engineListener(engineListener)
				.start()) {
			ConnectionPool firstGeneration = pool.getPoolSupervisor().getConnectionPool();
			engineDriver.getOpenedHandles().get(0).invalidate();

			Assertions.assertEquals(List.of(List.of(1)), pool.query(ONE_ROW_SQL).getRows(), "Query should succeed on the restarted engine");

			ConnectionPool secondGeneration = pool.getPoolSupervisor().getConnectionPool();

			Assertions.assertNotSame(firstGeneration, secondGeneration);
			Assertions.assertTrue(firstGeneration.isRetired());
			Assertions.assertEquals(firstGeneration.getGeneration() + 1, secondGeneration.getGeneration());
			Assertions.assertEquals(2, engineDriver.getOpenedHandles().size());
			Assertions.assertEquals(1, engineDriver.getOpenedHandles().get(0).getReleaseCount());
			Assertions.assertEquals(2, engineListener.getEnginesOpened());
			Assertions.assertEquals(1, engineListener.getEnginesReleased());
			Assertions.assertEquals(PoolState.CONNECTIONS_READY, pool.getState());
		}
	}

	@Test
	public void testEngineIsRestartedAtMostOncePerCheckout() {
		TestEngines.HsqldbEngineDriver hsqldbEngineDriver = new TestEngines.HsqldbEngineDriver();
		EngineDriver brokenEngineDriver = (location, engineConfig) -> {
			TestEngines.HsqldbEngineHandle engineHandle = (TestEngines.HsqldbEngineHandle) hsqldbEngineDriver.open(location, engineConfig);
			engineHandle.invalidate();
			return engineHandle;
		};

		try (Pool pool = Pool.builder("supervised")
				.name("testEngineIsRestartedAtMostOncePerCheckout")
				.poolSize(1)
				.engineDriver(brokenEngineDriver)
				.start()) {
			DatabaseException e = Assertions.assertThrows(DatabaseException.class, () -> pool.query(ONE_ROW_SQL));

			Assertions.assertTrue(e.getCause() instanceof SQLException, "Cause should be the failed session open");
			Assertions.assertEquals(2, hsqldbEngineDriver.getOpenedHandles().size(), "Expected exactly one restart");
		}
	}

	@Test
	public void testEngineOpenFailureFailsStart() {
		EngineDriver failingEngineDriver = (location, engineConfig) -> {
			throw new EngineOpenException(location, new SQLException("disk on fire"));
		};

		EngineOpenException e = Assertions.assertThrows(EngineOpenException.class, () -> Pool.builder("unreachable")
				.name("testEngineOpenFailureFailsStart")
				.engineDriver(failingEngineDriver)
				.start());

		Assertions.assertEquals("unreachable", e.getLocation());
	}

	@Test
	public void testHeldConnectionsAreClosedOnReset() throws Exception {
		TestEngines.HsqldbEngineDriver engineDriver = new TestEngines.HsqldbEngineDriver();
		TestEngines.CountingEngineListener engineListener = new TestEngines.CountingEngineListener();

		try (Pool pool = Pool.builder("supervised")
				.name("testHeldConnectionsAreClosedOnReset")
				.poolSize(2)
				.engineDriver(engineDriver)
				.engineListener(engineListener)
				.start()) {
			Thread resetThread = pool.withConnection(engineConnection -> {
				// Retiring the old generation waits for this lease, so reset from another thread
				Thread thread = new Thread(pool::resetConnections);
				thread.start();

				while (pool.getPoolSupervisor().getConnectionPool().getGeneration() == 1)
					Thread.onSpinWait();

				Assertions.assertEquals(1, engineConnection.query(ONE_ROW_SQL).getRowCount(), "Held connection stays usable until returned");
				return thread;
			});

			resetThread.join(10_000L);

			Assertions.assertFalse(resetThread.isAlive());
			Assertions.assertEquals(1, engineListener.getConnectionsClosed(), "Returned connection from retired generation should be closed");
			Assertions.assertEquals(1, engineListener.getEnginesOpened());
		}
	}

	@Test
	public void testStopWaitsForConnectionStillOpening() throws Exception {
		TestEngines.HsqldbEngineDriver hsqldbEngineDriver = new TestEngines.HsqldbEngineDriver();
		List<String> events = Collections.synchronizedList(new ArrayList<>());
		CountDownLatch opening = new CountDownLatch(1);
		CountDownLatch finishOpening = new CountDownLatch(1);

		EngineDriver slowEngineDriver = (location, engineConfig) -> {
			EngineHandle engineHandle = hsqldbEngineDriver.open(location, engineConfig);

			return new EngineHandle() {
				@Override
				public String getLocation() {
					return engineHandle.getLocation();
				}

				@Override
				public Connection openSession() throws SQLException {
					opening.countDown();

					boolean interrupted = false;

					// Engines do not necessarily honor interrupts while opening
					while (true) {
						try {
							finishOpening.await();
							break;
						} catch (InterruptedException e) {
							interrupted = true;
						}
					}

					if (interrupted)
						Thread.currentThread().interrupt();

					events.add(isValid() ? "sessionOpened" : "sessionOpenedAfterRelease");
					return engineHandle.openSession();
				}

				@Override
				public boolean isValid() {
					return engineHandle.isValid();
				}

				@Override
				public void release() {
					events.add("engineReleased");
					engineHandle.release();
				}
			};
		};

		EngineListener engineListener = new EngineListener() {
			@Override
			public void connectionClosed(EngineConnection engineConnection) {
				events.add("connectionClosed");
			}
		};

		ExecutorService executorService = Executors.newFixedThreadPool(2);

		try {
			Pool pool = Pool.builder("supervised")
					.name("testStopWaitsForConnectionStillOpening")
					.poolSize(1)
					.shutdownTimeout(Duration.ofMillis(100))
					.engineDriver(slowEngineDriver)
					.engineListener(engineListener)
					.start();

			Future<Result<QueryResult>> querying = executorService.submit(() -> pool.tryQuery(ONE_ROW_SQL));

			Assertions.assertTrue(opening.await(10, TimeUnit.SECONDS));

			Future<?> stopping = executorService.submit(pool::stop);

			Assertions.assertThrows(TimeoutException.class, () -> stopping.get(500, TimeUnit.MILLISECONDS),
					"Stop must not finish while a connection is still opening");
			Assertions.assertFalse(events.contains("engineReleased"), "Engine released while a connection was opening");

			finishOpening.countDown();
			stopping.get(10, TimeUnit.SECONDS);

			Result<QueryResult> result = querying.get(10, TimeUnit.SECONDS);

			Assertions.assertTrue(result.getException().orElseThrow() instanceof PoolClosedException);
			Assertions.assertEquals(List.of("sessionOpened", "connectionClosed", "engineReleased"), events);
			Assertions.assertEquals(1, hsqldbEngineDriver.getOpenedHandles().get(0).getReleaseCount());
			Assertions.assertEquals(0, pool.getPoolSupervisor().getConnectionPool().getPendingOpenCount());
		} finally {
			finishOpening.countDown();
			executorService.shutdownNow();
		}
	}
}
