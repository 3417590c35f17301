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
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * Supervises a pool's two stages: the {@link EngineHolder} and, on top of it, the current {@link ConnectionPool}
 * generation.
 * <p>
 * Restarts are rest-for-one. If the engine handle fails, the connection pool is retired first, then the handle is
 * released and reopened, then a new connection pool is built on it. {@link #resetConnections()} replaces only the
 * connection pool.
 * <p>
 * Shutdown runs in order: new checkouts are rejected, connections are drained or force-closed, and the engine handle
 * is released, exactly once.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class PoolSupervisor {
	@NonNull
	private final String poolName;
	private final int poolSize;
	@NonNull
	private final Duration shutdownTimeout;
	@NonNull
	private final EngineHolder engineHolder;
	@NonNull
	private final EngineListener engineListener;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final ExecutorService connectionOpener;
	@NonNull
	private final AtomicReference<ConnectionPool> connectionPool;
	@NonNull
	private final AtomicInteger generation;
	@NonNull
	private final ReentrantLock lifecycleLock;
	@NonNull
	private volatile PoolState state;
	@NonNull
	private final Logger logger;

	private PoolSupervisor(@NonNull String poolName,
												 int poolSize,
												 @NonNull Duration shutdownTimeout,
												 @NonNull EngineHolder engineHolder,
												 @NonNull EngineListener engineListener,
												 @NonNull StatementLogger statementLogger) {
		this.poolName = requireNonNull(poolName);
		this.poolSize = poolSize;
		this.shutdownTimeout = requireNonNull(shutdownTimeout);
		this.engineHolder = requireNonNull(engineHolder);
		this.engineListener = requireNonNull(engineListener);
		this.statementLogger = requireNonNull(statementLogger);
		this.connectionOpener = Executors.newCachedThreadPool(new OpenerThreadFactory(poolName));
		this.connectionPool = new AtomicReference<>();
		this.generation = new AtomicInteger();
		this.lifecycleLock = new ReentrantLock();
		this.state = PoolState.STARTING;
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Opens the engine and builds an empty connection pool on it.
	 *
	 * @throws EngineOpenException if the engine cannot be opened; nothing is left running
	 */
	@NonNull
	static PoolSupervisor start(@NonNull String poolName,
															int poolSize,
															@NonNull Duration shutdownTimeout,
															@NonNull EngineHolder engineHolder,
															@NonNull EngineListener engineListener,
															@NonNull StatementLogger statementLogger) {
		if (poolSize < 1)
			throw new IllegalArgumentException("Pool size must be positive");

		PoolSupervisor poolSupervisor = new PoolSupervisor(poolName, poolSize, shutdownTimeout, engineHolder,
				engineListener, statementLogger);

		poolSupervisor.lifecycleLock.lock();

		try {
			EngineHandle engineHandle;

			try {
				engineHandle = engineHolder.open();
			} catch (RuntimeException e) {
				poolSupervisor.connectionOpener.shutdownNow();
				poolSupervisor.state = PoolState.STOPPED;
				throw e;
			}

			poolSupervisor.state = PoolState.HANDLE_HELD;
			poolSupervisor.connectionPool.set(poolSupervisor.createConnectionPool(engineHandle));
			poolSupervisor.state = PoolState.CONNECTIONS_READY;
		} finally {
			poolSupervisor.lifecycleLock.unlock();
		}

		poolSupervisor.logger.log(FINE, format("Started pool '%s' on '%s' with %d slots", poolName,
				engineHolder.getLocation(), poolSize));

		return poolSupervisor;
	}

	/**
	 * Checks out a connection, waiting at most {@code timeout}.
	 */
	ConnectionPool.@NonNull Lease lease(@NonNull Duration timeout) {
		requireNonNull(timeout);

		long deadline = nanoTime() + timeout.toNanos();
		boolean restarted = false;

		while (true) {
			ensureRunning();

			ConnectionPool currentPool = this.connectionPool.get();
			Duration remaining = Duration.ofNanos(Math.max(0L, deadline - nanoTime()));

			try {
				return currentPool.acquire(remaining, timeout);
			} catch (PoolClosedException e) {
				// The generation was swapped out from under us; wait for the lifecycle change to settle and retry
				if (!isRunning() || !awaitLifecycle(deadline))
					throw e;
			} catch (ConnectionPool.ConnectionOpenFailedException e) {
				if (restarted || currentPool.getEngineHandle().isValid())
					throw e;

				restartEngine(currentPool);
				restarted = true;
			}
		}
	}

	private boolean awaitLifecycle(long deadline) {
		try {
			if (!this.lifecycleLock.tryLock(Math.max(0L, deadline - nanoTime()), NANOSECONDS))
				return false;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}

		this.lifecycleLock.unlock();
		return deadline - nanoTime() > 0L;
	}

	/**
	 * Retires {@code failedPool}, releases and reopens the engine, and builds a fresh connection pool.
	 * A no-op if another thread already replaced {@code failedPool}.
	 */
	void restartEngine(@NonNull ConnectionPool failedPool) {
		requireNonNull(failedPool);

		this.lifecycleLock.lock();

		try {
			if (this.connectionPool.get() != failedPool || !isRunning())
				return;

			this.logger.log(WARNING, format("Engine for pool '%s' is no longer valid, restarting it", this.poolName));

			this.state = PoolState.STARTING;
			failedPool.retire(this.shutdownTimeout);

			EngineHandle engineHandle;

			try {
				engineHandle = this.engineHolder.reopen();
			} catch (RuntimeException e) {
				this.logger.log(WARNING, format("Unable to reopen engine for pool '%s', stopping it", this.poolName), e);
				this.connectionOpener.shutdownNow();
				this.state = PoolState.STOPPED;
				throw e;
			}

			this.state = PoolState.HANDLE_HELD;
			this.connectionPool.set(createConnectionPool(engineHandle));
			this.state = PoolState.CONNECTIONS_READY;
		} finally {
			this.lifecycleLock.unlock();
		}
	}

	/**
	 * Replaces the connection pool with a fresh one on the same engine. Connections checked out from the old pool are
	 * closed when they are given back.
	 */
	void resetConnections() {
		ConnectionPool retiredPool;

		this.lifecycleLock.lock();

		try {
			ensureRunning();

			retiredPool = this.connectionPool.get();
			this.connectionPool.set(createConnectionPool(this.engineHolder.getEngineHandle()));
			this.logger.log(FINE, format("Reset connections for pool '%s'", this.poolName));

			retiredPool.retire(this.shutdownTimeout);
		} finally {
			this.lifecycleLock.unlock();
		}
	}

	/**
	 * Idempotent. When this returns, every connection is closed and the engine is released.
	 */
	void stop() {
		this.lifecycleLock.lock();

		try {
			if (this.state == PoolState.STOPPING || this.state == PoolState.STOPPED)
				return;

			this.state = PoolState.STOPPING;
			this.logger.log(FINE, format("Stopping pool '%s'", this.poolName));

			ConnectionPool currentPool = this.connectionPool.get();

			try {
				if (currentPool != null)
					currentPool.retire(this.shutdownTimeout);
			} finally {
				try {
					this.engineHolder.release();
				} finally {
					this.connectionOpener.shutdownNow();
					this.state = PoolState.STOPPED;
					this.logger.log(FINE, format("Stopped pool '%s'", this.poolName));
				}
			}
		} finally {
			this.lifecycleLock.unlock();
		}
	}

	@NonNull
	private ConnectionPool createConnectionPool(@NonNull EngineHandle engineHandle) {
		return new ConnectionPool(this.poolName, this.generation.incrementAndGet(), engineHandle, this.poolSize,
				this.connectionOpener, this.engineListener, this.statementLogger);
	}

	private void ensureRunning() {
		if (!isRunning())
			throw new PoolClosedException(this.poolName);
	}

	boolean isRunning() {
		PoolState currentState = this.state;
		return currentState != PoolState.STOPPING && currentState != PoolState.STOPPED;
	}

	@NonNull
	PoolState getState() {
		return this.state;
	}

	@NonNull
	ConnectionPool getConnectionPool() {
		return this.connectionPool.get();
	}

	@NonNull
	EngineHolder getEngineHolder() {
		return this.engineHolder;
	}

	@ThreadSafe
	private static final class OpenerThreadFactory implements ThreadFactory {
		@NonNull
		private final String poolName;
		@NonNull
		private final AtomicInteger threadCount;

		private OpenerThreadFactory(@NonNull String poolName) {
			this.poolName = requireNonNull(poolName);
			this.threadCount = new AtomicInteger();
		}

		@Override
		public Thread newThread(@NonNull Runnable runnable) {
			Thread thread = new Thread(runnable, format("quackpool-%s-opener-%d", this.poolName, this.threadCount.incrementAndGet()));
			thread.setDaemon(true);
			return thread;
		}
	}
}
