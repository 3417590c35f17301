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

import javax.annotation.concurrent.NotThreadSafe;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Fluent builder for a single SQL statement with positional {@code ?} parameters.
 * <p>
 * Obtain instances via {@link SqlKit#query(String)}.
 * <p>
 * Example usage:
 * <pre>{@code
 * // All rows as maps, in column order
 * List<Map<String, Object>> rows = sqlKit.query("SELECT id, name FROM users WHERE active = ?")
 *   .parameters(true)
 *   .fetchAll();
 *
 * // Exactly one row as a record
 * User user = sqlKit.query("SELECT id, name FROM users WHERE id = ?")
 *   .parameters(42)
 *   .label("user-by-id")
 *   .fetchOne(User.class);
 *
 * // Zero or one row, errors as values
 * Result<Optional<User>> maybeUser = sqlKit.query("SELECT id, name FROM users WHERE email = ?")
 *   .parameters(email)
 *   .tryFetchOne(User.class);
 * }</pre>
 * <p>
 * Every throwing fetch has a {@code try*} form returning a {@link Result} that carries the same exception.
 * <p>
 * Map fetches accept only columns in the allow-list, which is the kit's {@link KnownColumns} plus any added with
 * {@link #knownColumns(KnownColumns)}; both are empty unless declared. Any other column fails with
 * {@link UnknownColumnNameException} unless {@link #allowDynamicColumns(boolean)} is on.
 * <p>
 * Implementations of this interface are intended for use by a single thread.
 *
 * @see SqlKit#query(String)
 * @since 1.0.0
 */
@NotThreadSafe
public interface Query {
	@NonNull
	Query parameters(Object @Nullable ... parameters);

	@NonNull
	Query parameters(@NonNull List<?> parameters);

	/**
	 * Names this query in {@link NoResultsException} and {@link MultipleResultsException} messages and in statement
	 * logs. Defaults to the SQL itself, truncated to 50 characters.
	 *
	 * @param label the label, or {@code null} for the default
	 * @return this builder, for chaining
	 */
	@NonNull
	Query label(@Nullable String label);

	@NonNull
	Query cache(boolean cache);

	@NonNull
	Query checkoutTimeout(@Nullable Duration checkoutTimeout);

	@NonNull
	Query chunkSize(@Nullable Integer chunkSize);

	/**
	 * Adds to the column names the owning {@link SqlKit} already accepts.
	 *
	 * @param knownColumns additional accepted column names
	 * @return this builder, for chaining
	 */
	@NonNull
	Query knownColumns(@NonNull KnownColumns knownColumns);

	@NonNull
	Query allowDynamicColumns(boolean allowDynamicColumns);

	/**
	 * @return the backend's result, untouched by column validation
	 */
	@NonNull
	QueryResult fetchResult();

	@NonNull
	Result<QueryResult> tryFetchResult();

	/**
	 * @return every row as an unmodifiable map from column name to value, in column order
	 * @throws UnknownColumnNameException if a column is not known and dynamic columns are disabled
	 */
	@NonNull
	List<Map<String, Object>> fetchAll();

	@NonNull
	Result<List<Map<String, Object>>> tryFetchAll();

	@NonNull
	<T> List<T> fetchAll(@NonNull Class<T> targetType);

	@NonNull
	<T> Result<List<T>> tryFetchAll(@NonNull Class<T> targetType);

	/**
	 * @return the single row as a map
	 * @throws NoResultsException       if there are no rows
	 * @throws MultipleResultsException if there is more than one row
	 */
	@NonNull
	Map<String, Object> fetchOne();

	/**
	 * Like {@link #fetchOne()}, but no rows is a successful empty {@link Optional}.
	 *
	 * @return the single row if there is one, or a failure carrying {@link MultipleResultsException} or any other error
	 */
	@NonNull
	Result<Optional<Map<String, Object>>> tryFetchOne();

	@NonNull
	<T> T fetchOne(@NonNull Class<T> targetType);

	@NonNull
	<T> Result<Optional<T>> tryFetchOne(@NonNull Class<T> targetType);

	/**
	 * Alias of {@link #fetchOne()}.
	 */
	@NonNull
	default Map<String, Object> query() {
		return fetchOne();
	}

	/**
	 * Alias of {@link #tryFetchOne()}.
	 */
	@NonNull
	default Result<Optional<Map<String, Object>>> tryQuery() {
		return tryFetchOne();
	}

	/**
	 * Hands a stream of row chunks to {@code streamFunction}. The backend holds whatever it needs (for a {@link Pool}, a
	 * checked-out connection) until {@code streamFunction} returns.
	 */
	@Nullable
	<R> R fetchStream(@NonNull Function<Stream<List<List<Object>>>, R> streamFunction);

	@NonNull
	<R> Result<R> tryFetchStream(@NonNull Function<Stream<List<List<Object>>>, R> streamFunction);

	@Nullable
	<R> R fetchStreamWithColumns(@NonNull BiFunction<List<String>, Stream<List<List<Object>>>, R> streamFunction);

	@NonNull
	<R> Result<R> tryFetchStreamWithColumns(@NonNull BiFunction<List<String>, Stream<List<List<Object>>>, R> streamFunction);
}
