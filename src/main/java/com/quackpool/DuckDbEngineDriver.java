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

import org.duckdb.DuckDBConnection;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * {@link EngineDriver} for DuckDB, via its JDBC driver.
 * <p>
 * The handle holds one root {@link DuckDBConnection}; sessions are {@link DuckDBConnection#duplicate() duplicates} of
 * it, so every session sees the same database, in-memory ones included. Releasing the handle closes the root
 * connection.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class DuckDbEngineDriver implements EngineDriver {
	@NonNull
	private static final String JDBC_URL_PREFIX = "jdbc:duckdb:";

	@NonNull
	private final Logger logger;

	public DuckDbEngineDriver() {
		this.logger = Logger.getLogger(getClass().getName());
	}

	@NonNull
	@Override
	public EngineHandle open(@NonNull String location,
													 @NonNull EngineConfig engineConfig) {
		requireNonNull(location);
		requireNonNull(engineConfig);

		String jdbcUrl = IN_MEMORY.equals(location) ? JDBC_URL_PREFIX : JDBC_URL_PREFIX + location;

		try {
			Connection connection = DriverManager.getConnection(jdbcUrl, engineConfig.toProperties());

			if (!(connection instanceof DuckDBConnection duckDbConnection)) {
				closeQuietly(connection);
				throw new EngineOpenException(location, new SQLException(format("%s did not resolve to a DuckDB connection", jdbcUrl)));
			}

			getLogger().log(FINE, format("Opened DuckDB engine at '%s'", location));
			return new DuckDbEngineHandle(location, duckDbConnection);
		} catch (SQLException e) {
			throw new EngineOpenException(location, e);
		}
	}

	private void closeQuietly(@NonNull Connection connection) {
		try {
			connection.close();
		} catch (SQLException e) {
			getLogger().log(WARNING, "Unable to close non-DuckDB connection", e);
		}
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@ThreadSafe
	private static final class DuckDbEngineHandle implements EngineHandle {
		@NonNull
		private static final Logger LOGGER = Logger.getLogger(DuckDbEngineHandle.class.getName());

		@NonNull
		private final String location;
		@NonNull
		private final DuckDBConnection rootConnection;
		@NonNull
		private final ReentrantLock lock;
		@GuardedBy("lock")
		private boolean released;

		private DuckDbEngineHandle(@NonNull String location,
															 @NonNull DuckDBConnection rootConnection) {
			this.location = requireNonNull(location);
			this.rootConnection = requireNonNull(rootConnection);
			this.lock = new ReentrantLock();
		}

		@NonNull
		@Override
		public String getLocation() {
			return this.location;
		}

		@NonNull
		@Override
		public Connection openSession() throws SQLException {
			this.lock.lock();

			try {
				if (this.released)
					throw new SQLException(format("DuckDB engine at '%s' has been released", getLocation()));

				return this.rootConnection.duplicate();
			} finally {
				this.lock.unlock();
			}
		}

		@Override
		public boolean isValid() {
			this.lock.lock();

			try {
				return !this.released && !this.rootConnection.isClosed();
			} catch (SQLException e) {
				return false;
			} finally {
				this.lock.unlock();
			}
		}

		@Override
		public void release() {
			this.lock.lock();

			try {
				if (this.released)
					return;

				this.released = true;

				try {
					this.rootConnection.close();
					LOGGER.log(FINE, format("Released DuckDB engine at '%s'", getLocation()));
				} catch (SQLException e) {
					throw new DatabaseException(format("Unable to release DuckDB engine at '%s'", getLocation()), e);
				}
			} finally {
				this.lock.unlock();
			}
		}

		@Override
		public String toString() {
			return format("%s{location=%s}", getClass().getSimpleName(), getLocation());
		}
	}
}
