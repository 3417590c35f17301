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

import javax.annotation.concurrent.NotThreadSafe;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Per-connection cache of prepared statements keyed by verbatim SQL text.
 * <p>
 * No normalization is performed, so SQL differing only in whitespace occupies separate entries. There is no eviction;
 * entries live exactly as long as the owning {@link EngineConnection}.
 * <p>
 * Only the lease holding the owning connection touches the cache, so it is not threadsafe.
 *
 * @since 1.0.0
 */
@NotThreadSafe
final class StatementCache {
	@NonNull
	private final Map<String, PreparedStatement> preparedStatementsBySql;

	StatementCache() {
		this.preparedStatementsBySql = new HashMap<>();
	}

	boolean contains(@NonNull String sql) {
		requireNonNull(sql);
		return this.preparedStatementsBySql.containsKey(sql);
	}

	/**
	 * Returns the cached statement for {@code sql}, preparing and caching it against {@code session} on a miss.
	 * <p>
	 * A failed preparation leaves the cache unchanged.
	 */
	@NonNull
	PreparedStatement lookupOrPrepare(@NonNull Connection session,
																		@NonNull String sql,
																		@NonNull Runnable onPrepare) throws SQLException {
		requireNonNull(session);
		requireNonNull(sql);
		requireNonNull(onPrepare);

		PreparedStatement preparedStatement = this.preparedStatementsBySql.get(sql);

		if (preparedStatement != null)
			return preparedStatement;

		preparedStatement = session.prepareStatement(sql);
		this.preparedStatementsBySql.put(sql, preparedStatement);
		onPrepare.run();

		return preparedStatement;
	}

	int size() {
		return this.preparedStatementsBySql.size();
	}

	/**
	 * Closes and forgets every cached statement. All statements are attempted; the first failure is thrown with any
	 * later ones suppressed.
	 */
	void clear() throws SQLException {
		List<PreparedStatement> preparedStatements = new ArrayList<>(this.preparedStatementsBySql.values());
		this.preparedStatementsBySql.clear();

		SQLException failure = null;

		for (PreparedStatement preparedStatement : preparedStatements) {
			try {
				preparedStatement.close();
			} catch (SQLException e) {
				if (failure == null)
					failure = e;
				else
					failure.addSuppressed(e);
			}
		}

		if (failure != null)
			throw failure;
	}
}
