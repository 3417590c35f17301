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

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * Second supervision stage: a fixed number of connection slots over one {@link EngineHandle}.
 * <p>
 * Slots are guarded by a fair semaphore, so waiters are served in arrival order. A slot's connection is opened
 * lazily, on the supervisor's opener executor, the first time the slot is needed. A caller that gives up waiting for
 * an opening connection leaves it to finish in the background; it then joins the idle connections and the slot is
 * handed back.
 * <p>
 * Once retired, a pool accepts no checkouts and closes every connection given back to it. Retirement does not
 * return while a connection is still being opened from the engine handle.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class ConnectionPool {
	@NonNull
	private final String poolName;
	private final int generation;
	@NonNull
	private final EngineHandle engineHandle;
	private final int poolSize;
	@NonNull
	private final Executor connectionOpener;
	@NonNull
	private final EngineListener engineListener;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final Semaphore slots;
	@NonNull
	private final Set<EngineConnection> leasedConnections;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final Condition leasesReturned;
	@NonNull
	@GuardedBy("lock")
	private final Deque<EngineConnection> idleConnections;
	@GuardedBy("lock")
	private int pendingOpens;
	@GuardedBy("lock")
	private boolean retired;
	@NonNull
	private final Logger logger;

	ConnectionPool(@NonNull String poolName,
								 int generation,
								 @NonNull EngineHandle engineHandle,
								 int poolSize,
								 @NonNull Executor connectionOpener,
								 @NonNull EngineListener engineListener,
								 @NonNull StatementLogger statementLogger) {
		if (poolSize < 1)
			throw new IllegalArgumentException("Pool size must be positive");

		this.poolName = requireNonNull(poolName);
		this.generation = generation;
		this.engineHandle = requireNonNull(engineHandle);
		this.poolSize = poolSize;
		this.connectionOpener = requireNonNull(connectionOpener);
		this.engineListener = requireNonNull(engineListener);
		this.statementLogger = requireNonNull(statementLogger);
		this.slots = new Semaphore(poolSize, true);
		this.leasedConnections = ConcurrentHashMap.newKeySet();
		this.lock = new ReentrantLock();
		this.leasesReturned = this.lock.newCondition();
		this.idleConnections = new ArrayDeque<>(poolSize);
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Waits up to {@code remaining} for a slot and returns a lease on its connection.
	 *
	 * @param remaining        how long this attempt may wait
	 * @param requestedTimeout the caller's full checkout timeout, for reporting
	 * @throws CheckoutTimeoutException if no connection became available in time
	 * @throws PoolClosedException      if this pool is retired
	 * @throws ConnectionOpenFailedException if a new connection could not be opened
	 */
	@NonNull
	Lease acquire(@NonNull Duration remaining,
								@NonNull Duration requestedTimeout) {
		requireNonNull(remaining);
		requireNonNull(requestedTimeout);

		long startTime = nanoTime();
		long deadline = startTime + remaining.toNanos();

		if (isRetired())
			throw new PoolClosedException(this.poolName);

		boolean acquired;

		try {
			acquired = this.slots.tryAcquire(remaining.toNanos(), NANOSECONDS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new DatabaseException(format("Interrupted while waiting for a connection from pool '%s'", this.poolName), e);
		}

		if (!acquired)
			throw new CheckoutTimeoutException(this.poolName, requestedTimeout);

		EngineConnection connection;

		this.lock.lock();

		try {
			if (this.retired) {
				// Pass the slot on so the next waiter wakes up and sees the retirement too
				this.slots.release();
				throw new PoolClosedException(this.poolName);
			}

			connection = this.idleConnections.pollFirst();

			if (connection != null)
				this.leasedConnections.add(connection);
			else
				++this.pendingOpens;
		} finally {
			this.lock.unlock();
		}

		if (connection != null)
			return new Lease(this, connection, Duration.ofNanos(nanoTime() - startTime));

		connection = openConnection(deadline, requestedTimeout);

		this.lock.lock();

		try {
			if (!this.retired) {
				this.leasedConnections.add(connection);
				--this.pendingOpens;
				this.leasesReturned.signalAll();
				return new Lease(this, connection, Duration.ofNanos(nanoTime() - startTime));
			}
		} finally {
			this.lock.unlock();
		}

		// Retired while opening: the connection still counts as pending until it is closed
		closeQuietly(connection);
		openSettled();
		this.slots.release();
		throw new PoolClosedException(this.poolName);
	}

	/**
	 * Opens a connection for a slot already counted in {@link #pendingOpens}. Every path out of here that does not
	 * return a connection settles the pending open and gives the slot back, now or once the abandoned open completes.
	 */
	@NonNull
	private EngineConnection openConnection(long deadline,
																					@NonNull Duration requestedTimeout) {
		CompletableFuture<EngineConnection> pendingConnection;

		try {
			pendingConnection = CompletableFuture.supplyAsync(() -> {
				try {
					return EngineConnection.open(this.engineHandle, this.engineListener, this.statementLogger,
							format("pool '%s'", this.poolName));
				} catch (SQLException e) {
					throw new CompletionException(e);
				}
			}, this.connectionOpener);
		} catch (RejectedExecutionException e) {
			openSettled();
			this.slots.release();
			throw new PoolClosedException(this.poolName);
		}

		try {
			return pendingConnection.get(Math.max(0L, deadline - nanoTime()), NANOSECONDS);
		} catch (TimeoutException e) {
			abandon(pendingConnection);
			throw new CheckoutTimeoutException(this.poolName, requestedTimeout);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			abandon(pendingConnection);
			throw new DatabaseException(format("Interrupted while opening a connection for pool '%s'", this.poolName), e);
		} catch (ExecutionException e) {
			openSettled();
			this.slots.release();

			Throwable cause = e.getCause();

			if (cause instanceof CompletionException && cause.getCause() != null)
				cause = cause.getCause();

			throw new ConnectionOpenFailedException(this.poolName, cause);
		}
	}

	private void abandon(@NonNull CompletableFuture<EngineConnection> pendingConnection) {
		pendingConnection.whenComplete((connection, failure) -> {
			if (connection != null)
				returnToIdle(connection);

			openSettled();
			this.slots.release();
		});
	}

	private void openSettled() {
		this.lock.lock();

		try {
			--this.pendingOpens;
			this.leasesReturned.signalAll();
		} finally {
			this.lock.unlock();
		}
	}

	private void returnToIdle(@NonNull EngineConnection connection) {
		this.lock.lock();

		try {
			if (!this.retired) {
				this.idleConnections.offerFirst(connection);
				return;
			}
		} finally {
			this.lock.unlock();
		}

		closeQuietly(connection);
	}

	private void checkin(@NonNull EngineConnection connection,
											 boolean keep) {
		boolean close;

		this.lock.lock();

		try {
			boolean wasLeased = this.leasedConnections.remove(connection);
			close = !keep || this.retired || !wasLeased || connection.isClosed();

			if (!close)
				this.idleConnections.offerFirst(connection);

			this.leasesReturned.signalAll();
		} finally {
			this.lock.unlock();
		}

		if (close) {
			if (!keep)
				this.logger.log(FINE, format("Discarding %s from pool '%s'", connection, this.poolName));

			closeQuietly(connection);
		}

		this.slots.release();
	}

	/**
	 * Stops accepting checkouts, closes idle connections, waits up to {@code shutdownTimeout} for leased connections to
	 * come back, then force-closes any that did not.
	 * <p>
	 * A connection still being opened cannot be force-closed, so this keeps waiting past {@code shutdownTimeout}
	 * until every pending open has completed and its connection is closed. The engine handle is therefore unused
	 * once this returns.
	 */
	void retire(@NonNull Duration shutdownTimeout) {
		requireNonNull(shutdownTimeout);

		List<EngineConnection> idle;

		this.lock.lock();

		try {
			if (this.retired)
				return;

			this.retired = true;
			idle = new ArrayList<>(this.idleConnections);
			this.idleConnections.clear();
		} finally {
			this.lock.unlock();
		}

		for (EngineConnection connection : idle)
			closeQuietly(connection);

		long deadline = nanoTime() + shutdownTimeout.toNanos();

		this.lock.lock();

		try {
			while (!this.leasedConnections.isEmpty() || this.pendingOpens > 0) {
				long remainingNanos = deadline - nanoTime();

				if (remainingNanos <= 0L)
					break;

				this.leasesReturned.awaitNanos(remainingNanos);
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		} finally {
			this.lock.unlock();
		}

		List<EngineConnection> stragglers = new ArrayList<>(this.leasedConnections);

		for (EngineConnection connection : stragglers) {
			this.logger.log(WARNING, format("Force-closing %s in pool '%s', still checked out after %s",
					connection, this.poolName, shutdownTimeout));
			closeQuietly(connection);
		}

		awaitPendingOpens();

		this.logger.log(FINE, format("Retired generation %d of pool '%s'", this.generation, this.poolName));
	}

	private void awaitPendingOpens() {
		this.lock.lock();

		try {
			if (this.pendingOpens > 0)
				this.logger.log(WARNING, format("Waiting for %d connection(s) still opening in pool '%s'",
						this.pendingOpens, this.poolName));

			while (this.pendingOpens > 0)
				this.leasesReturned.awaitUninterruptibly();
		} finally {
			this.lock.unlock();
		}
	}

	private void closeQuietly(@NonNull EngineConnection connection) {
		try {
			connection.close();
		} catch (RuntimeException e) {
			this.logger.log(WARNING, format("Unable to close %s", connection), e);
		}
	}

	boolean isRetired() {
		this.lock.lock();

		try {
			return this.retired;
		} finally {
			this.lock.unlock();
		}
	}

	int getIdleCount() {
		this.lock.lock();

		try {
			return this.idleConnections.size();
		} finally {
			this.lock.unlock();
		}
	}

	int getPendingOpenCount() {
		this.lock.lock();

		try {
			return this.pendingOpens;
		} finally {
			this.lock.unlock();
		}
	}

	int getLeasedCount() {
		return this.leasedConnections.size();
	}

	int getPoolSize() {
		return this.poolSize;
	}

	int getGeneration() {
		return this.generation;
	}

	@NonNull
	EngineHandle getEngineHandle() {
		return this.engineHandle;
	}

	/**
	 * A checked-out connection, tied to the pool generation it came from.
	 */
	@ThreadSafe
	static final class Lease {
		@NonNull
		private final ConnectionPool connectionPool;
		@NonNull
		private final EngineConnection connection;
		@NonNull
		private final Duration checkoutDuration;
		@NonNull
		private final AtomicBoolean released;

		private Lease(@NonNull ConnectionPool connectionPool,
									@NonNull EngineConnection connection,
									@NonNull Duration checkoutDuration) {
			this.connectionPool = requireNonNull(connectionPool);
			this.connection = requireNonNull(connection);
			this.checkoutDuration = requireNonNull(checkoutDuration);
			this.released = new AtomicBoolean(false);
		}

		@NonNull
		EngineConnection getConnection() {
			return this.connection;
		}

		@NonNull
		Duration getCheckoutDuration() {
			return this.checkoutDuration;
		}

		/**
		 * Gives the connection back to the pool it came from. Only the first call has any effect.
		 *
		 * @param keep {@code false} to close the connection instead of reusing it
		 */
		void release(boolean keep) {
			if (this.released.compareAndSet(false, true))
				this.connectionPool.checkin(this.connection, keep);
		}
	}

	/**
	 * A slot's connection could not be opened.
	 */
	static final class ConnectionOpenFailedException extends DatabaseException {
		private ConnectionOpenFailedException(@NonNull String poolName,
																					@Nullable Throwable cause) {
			super(format("Unable to open a connection for pool '%s'", poolName), cause);
		}
	}
}
