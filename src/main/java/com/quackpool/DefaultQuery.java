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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Stream;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Default internal implementation of {@link Query}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
final class DefaultQuery implements Query {
	@NonNull
	private final SqlKit sqlKit;
	@NonNull
	private final String sql;
	@NonNull
	private final List<Object> parameters;
	@NonNull
	private KnownColumns knownColumns;
	private boolean allowDynamicColumns;
	@Nullable
	private String label;
	private boolean cache;
	@Nullable
	private Duration checkoutTimeout;
	@Nullable
	private Integer chunkSize;

	DefaultQuery(@NonNull SqlKit sqlKit,
							 @NonNull String sql) {
		requireNonNull(sqlKit);
		requireNonNull(sql);

		this.sqlKit = sqlKit;
		this.sql = sql;
		this.parameters = new ArrayList<>();
		this.knownColumns = sqlKit.getKnownColumns();
		this.allowDynamicColumns = sqlKit.isAllowDynamicColumns();
		this.cache = true;
	}

	@NonNull
	@Override
	public Query parameters(Object @Nullable ... parameters) {
		this.parameters.clear();

		if (parameters != null)
			this.parameters.addAll(Arrays.asList(parameters));

		return this;
	}

	@NonNull
	@Override
	public Query parameters(@NonNull List<?> parameters) {
		requireNonNull(parameters);

		this.parameters.clear();
		this.parameters.addAll(parameters);
		return this;
	}

	@NonNull
	@Override
	public Query label(@Nullable String label) {
		this.label = label;
		return this;
	}

	@NonNull
	@Override
	public Query cache(boolean cache) {
		this.cache = cache;
		return this;
	}

	@NonNull
	@Override
	public Query checkoutTimeout(@Nullable Duration checkoutTimeout) {
		this.checkoutTimeout = checkoutTimeout;
		return this;
	}

	@NonNull
	@Override
	public Query chunkSize(@Nullable Integer chunkSize) {
		this.chunkSize = chunkSize;
		return this;
	}

	@NonNull
	@Override
	public Query knownColumns(@NonNull KnownColumns knownColumns) {
		requireNonNull(knownColumns);
		this.knownColumns = this.knownColumns.union(knownColumns);
		return this;
	}

	@NonNull
	@Override
	public Query allowDynamicColumns(boolean allowDynamicColumns) {
		this.allowDynamicColumns = allowDynamicColumns;
		return this;
	}

	@NonNull
	@Override
	public QueryResult fetchResult() {
		return this.sqlKit.getBackend().execute(this.sql, nullSafeCopy(), queryOptions());
	}

	@NonNull
	@Override
	public Result<QueryResult> tryFetchResult() {
		return Result.of(this::fetchResult);
	}

	@NonNull
	@Override
	public List<Map<String, Object>> fetchAll() {
		return this.sqlKit.getRowMaterializer().toMaps(fetchResult(), this.knownColumns, this.allowDynamicColumns);
	}

	@NonNull
	@Override
	public Result<List<Map<String, Object>>> tryFetchAll() {
		return Result.of(this::fetchAll);
	}

	@NonNull
	@Override
	public <T> List<T> fetchAll(@NonNull Class<T> targetType) {
		requireNonNull(targetType);
		return this.sqlKit.getRowMaterializer().toInstances(fetchResult(), targetType, this.knownColumns, this.allowDynamicColumns);
	}

	@NonNull
	@Override
	public <T> Result<List<T>> tryFetchAll(@NonNull Class<T> targetType) {
		requireNonNull(targetType);
		return Result.of(() -> fetchAll(targetType));
	}

	@NonNull
	@Override
	public Map<String, Object> fetchOne() {
		return exactlyOne(fetchAll());
	}

	@NonNull
	@Override
	public Result<Optional<Map<String, Object>>> tryFetchOne() {
		return Result.of(() -> atMostOne(fetchAll()));
	}

	@NonNull
	@Override
	public <T> T fetchOne(@NonNull Class<T> targetType) {
		requireNonNull(targetType);
		return exactlyOne(fetchAll(targetType));
	}

	@NonNull
	@Override
	public <T> Result<Optional<T>> tryFetchOne(@NonNull Class<T> targetType) {
		requireNonNull(targetType);
		return Result.of(() -> atMostOne(fetchAll(targetType)));
	}

	@Nullable
	@Override
	public <R> R fetchStream(@NonNull Function<Stream<List<List<Object>>>, R> streamFunction) {
		requireNonNull(streamFunction);
		return fetchStreamWithColumns((columns, stream) -> streamFunction.apply(stream));
	}

	@NonNull
	@Override
	public <R> Result<R> tryFetchStream(@NonNull Function<Stream<List<List<Object>>>, R> streamFunction) {
		requireNonNull(streamFunction);
		return Result.of(() -> fetchStream(streamFunction));
	}

	@Nullable
	@Override
	public <R> R fetchStreamWithColumns(@NonNull BiFunction<List<String>, Stream<List<List<Object>>>, R> streamFunction) {
		requireNonNull(streamFunction);

		try (ChunkCursor chunkCursor = this.sqlKit.getBackend().executeChunked(this.sql, nullSafeCopy(), queryOptions());
				 Stream<List<List<Object>>> stream = chunkCursor.stream()) {
			return streamFunction.apply(chunkCursor.getColumns(), stream);
		}
	}

	@NonNull
	@Override
	public <R> Result<R> tryFetchStreamWithColumns(@NonNull BiFunction<List<String>, Stream<List<List<Object>>>, R> streamFunction) {
		requireNonNull(streamFunction);
		return Result.of(() -> fetchStreamWithColumns(streamFunction));
	}

	@NonNull
	private <T> T exactlyOne(@NonNull List<T> rows) {
		if (rows.isEmpty())
			throw new NoResultsException(getLabel());

		return atMostOne(rows).get();
	}

	@NonNull
	private <T> Optional<T> atMostOne(@NonNull List<T> rows) {
		if (rows.size() > 1)
			throw new MultipleResultsException(getLabel(), rows.size());

		return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
	}

	@NonNull
	private String getLabel() {
		return this.label == null ? Statement.defaultLabelFor(this.sql) : this.label;
	}

	@NonNull
	private QueryOptions queryOptions() {
		return QueryOptions.builder()
				.label(getLabel())
				.cache(this.cache)
				.checkoutTimeout(this.checkoutTimeout)
				.chunkSize(this.chunkSize)
				.build();
	}

	// Parameters may contain SQL NULLs
	@NonNull
	private List<Object> nullSafeCopy() {
		return new ArrayList<>(this.parameters);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{sql=%s, parameters=%s, label=%s}", getClass().getSimpleName(), this.sql, this.parameters, getLabel());
	}
}
