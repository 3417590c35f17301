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
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * A directory of declared SQL files, run through a {@link SqlKit}.
 * <p>
 * Files live in {@code rootDirectory/directoryName}. Only declared file names can be loaded, and each query is
 * labeled with its file name.
 * <pre>{@code
 * SqlFiles reports = SqlFiles.builder(sqlKit, Path.of("sql"), "reports")
 *   .files("stats.sql", "activity.sql")
 *   .loadMode(LoadMode.DYNAMIC)
 *   .build();
 *
 * Map<String, Object> stats = reports.queryOne("stats.sql", reportId);
 * }</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class SqlFiles {
	@NonNull
	private final SqlKit sqlKit;
	@NonNull
	private final Path directory;
	@NonNull
	private final Set<String> fileNames;
	@NonNull
	private final LoadMode loadMode;
	@NonNull
	private final Map<String, String> compiledSqlByFileName;
	@NonNull
	private final Logger logger;

	private SqlFiles(@NonNull Builder builder) {
		requireNonNull(builder);

		this.sqlKit = builder.sqlKit;
		this.directory = builder.rootDirectory.resolve(builder.directoryName);
		this.fileNames = Collections.unmodifiableSet(new LinkedHashSet<>(builder.fileNames));
		this.loadMode = builder.loadMode == null ? LoadMode.COMPILED : builder.loadMode;
		this.logger = Logger.getLogger(getClass().getName());

		Map<String, String> compiledSqlByFileName = new LinkedHashMap<>();

		if (this.loadMode == LoadMode.COMPILED)
			for (String fileName : this.fileNames)
				compiledSqlByFileName.put(fileName, read(fileName));

		this.compiledSqlByFileName = Collections.unmodifiableMap(compiledSqlByFileName);

		this.logger.fine(format("Prepared %d SQL file[s] from %s in %s mode", this.fileNames.size(), this.directory, this.loadMode));
	}

	@NonNull
	public static Builder builder(@NonNull SqlKit sqlKit,
																@NonNull Path rootDirectory,
																@NonNull String directoryName) {
		requireNonNull(sqlKit);
		requireNonNull(rootDirectory);
		requireNonNull(directoryName);

		return new Builder(sqlKit, rootDirectory, directoryName);
	}

	/**
	 * @param fileName a declared file name
	 * @return the file's SQL text
	 * @throws IllegalArgumentException if {@code fileName} was not declared
	 * @throws UncheckedIOException     in {@link LoadMode#DYNAMIC} mode, if the file cannot be read
	 */
	@NonNull
	public String load(@NonNull String fileName) {
		requireNonNull(fileName);

		if (!this.fileNames.contains(fileName))
			throw new IllegalArgumentException(format("SQL file '%s' was not declared for %s. Declared files are %s",
					fileName, this.directory, this.fileNames));

		if (this.loadMode == LoadMode.COMPILED)
			return this.compiledSqlByFileName.get(fileName);

		return read(fileName);
	}

	@NonNull
	public List<Map<String, Object>> queryAll(@NonNull String fileName,
																						Object @Nullable ... parameters) {
		return query(fileName, parameters).fetchAll();
	}

	@NonNull
	public <T> List<T> queryAll(@NonNull String fileName,
															@NonNull Class<T> targetType,
															Object @Nullable ... parameters) {
		requireNonNull(targetType);
		return query(fileName, parameters).fetchAll(targetType);
	}

	/**
	 * @throws NoResultsException       if the file's query returns no rows
	 * @throws MultipleResultsException if it returns more than one
	 */
	@NonNull
	public Map<String, Object> queryOne(@NonNull String fileName,
																			Object @Nullable ... parameters) {
		return query(fileName, parameters).fetchOne();
	}

	@NonNull
	public <T> T queryOne(@NonNull String fileName,
												@NonNull Class<T> targetType,
												Object @Nullable ... parameters) {
		requireNonNull(targetType);
		return query(fileName, parameters).fetchOne(targetType);
	}

	@NonNull
	public Result<Optional<Map<String, Object>>> tryQueryOne(@NonNull String fileName,
																													 Object @Nullable ... parameters) {
		return query(fileName, parameters).tryFetchOne();
	}

	@NonNull
	public <T> Result<Optional<T>> tryQueryOne(@NonNull String fileName,
																						 @NonNull Class<T> targetType,
																						 Object @Nullable ... parameters) {
		requireNonNull(targetType);
		return query(fileName, parameters).tryFetchOne(targetType);
	}

	@NonNull
	public Set<String> getFileNames() {
		return this.fileNames;
	}

	@NonNull
	public Path getDirectory() {
		return this.directory;
	}

	@NonNull
	public LoadMode getLoadMode() {
		return this.loadMode;
	}

	@NonNull
	private Query query(@NonNull String fileName,
											Object @Nullable ... parameters) {
		return this.sqlKit.query(load(fileName))
				.label(fileName)
				.parameters(parameters);
	}

	@NonNull
	private String read(@NonNull String fileName) {
		Path file = this.directory.resolve(fileName);

		try {
			return Files.readString(file, UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(format("Unable to read SQL file '%s' at %s", fileName, file), e);
		}
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{directory=%s, fileNames=%s, loadMode=%s}", getClass().getSimpleName(),
				getDirectory(), getFileNames(), getLoadMode());
	}

	/**
	 * Builder used to construct instances of {@link SqlFiles}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final SqlKit sqlKit;
		@NonNull
		private final Path rootDirectory;
		@NonNull
		private final String directoryName;
		@NonNull
		private final Set<String> fileNames;
		@Nullable
		private LoadMode loadMode;

		private Builder(@NonNull SqlKit sqlKit,
										@NonNull Path rootDirectory,
										@NonNull String directoryName) {
			this.sqlKit = sqlKit;
			this.rootDirectory = rootDirectory;
			this.directoryName = directoryName;
			this.fileNames = new LinkedHashSet<>();
		}

		@NonNull
		public Builder files(@NonNull String... fileNames) {
			requireNonNull(fileNames);
			this.fileNames.addAll(Arrays.asList(fileNames));
			return this;
		}

		/**
		 * @param loadMode how SQL text is obtained (null for {@link LoadMode#COMPILED})
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder loadMode(@Nullable LoadMode loadMode) {
			this.loadMode = loadMode;
			return this;
		}

		/**
		 * @throws UncheckedIOException in {@link LoadMode#COMPILED} mode, if a declared file cannot be read
		 */
		@NonNull
		public SqlFiles build() {
			return new SqlFiles(this);
		}
	}
}
