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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * @since 1.0.0
 */
@NotThreadSafe
public class SqlFilesTests {
	public record User(Integer id, String name) {}

	@TempDir
	Path rootDirectory;

	private Pool pool;
	private SqlKit sqlKit;

	@BeforeEach
	public void createPool() throws IOException {
		this.pool = Pool.builder(EngineDriver.IN_MEMORY).name("sql-files").start();
		this.pool.query("CREATE TABLE users (id INTEGER, name VARCHAR)");
		this.pool.query("INSERT INTO users VALUES (1, 'Ann'), (2, 'Bo'), (3, 'Cy')");
		this.sqlKit = SqlKit.withBackend(this.pool).knownColumns(KnownColumns.of("id", "name")).build();

		Path directory = Files.createDirectories(this.rootDirectory.resolve("users"));
		Files.writeString(directory.resolve("by_id.sql"), "SELECT id, name FROM users WHERE id = ?", UTF_8);
		Files.writeString(directory.resolve("all.sql"), "SELECT id, name FROM users ORDER BY id", UTF_8);
	}

	@AfterEach
	public void stopPool() {
		this.pool.stop();
	}

	@Test
	public void testCompiledMode() throws IOException {
		SqlFiles sqlFiles = SqlFiles.builder(this.sqlKit, this.rootDirectory, "users")
				.files("by_id.sql", "all.sql")
				.build();

		Assertions.assertEquals(LoadMode.COMPILED, sqlFiles.getLoadMode());
		Assertions.assertEquals("SELECT id, name FROM users WHERE id = ?", sqlFiles.load("by_id.sql"));

		// Edits after construction are not seen
		Files.writeString(this.rootDirectory.resolve("users").resolve("by_id.sql"), "SELECT 'changed' AS name", UTF_8);
		Assertions.assertEquals("SELECT id, name FROM users WHERE id = ?", sqlFiles.load("by_id.sql"));

		Assertions.assertEquals(new User(2, "Bo"), sqlFiles.queryOne("by_id.sql", User.class, 2));
		Assertions.assertEquals(Map.of("id", 1, "name", "Ann"), sqlFiles.queryAll("all.sql").get(0));
		Assertions.assertEquals(3, sqlFiles.queryAll("all.sql", User.class).size());
	}

	@Test
	public void testDynamicModeRereadsFiles() throws IOException {
		SqlFiles sqlFiles = SqlFiles.builder(this.sqlKit, this.rootDirectory, "users")
				.files("by_id.sql")
				.loadMode(LoadMode.DYNAMIC)
				.build();

		Assertions.assertEquals(new User(1, "Ann"), sqlFiles.queryOne("by_id.sql", User.class, 1));

		Files.writeString(this.rootDirectory.resolve("users").resolve("by_id.sql"), "SELECT id, upper(name) AS name FROM users WHERE id = ?", UTF_8);

		Assertions.assertEquals(new User(1, "ANN"), sqlFiles.queryOne("by_id.sql", User.class, 1));

		Files.delete(this.rootDirectory.resolve("users").resolve("by_id.sql"));
		Assertions.assertThrows(UncheckedIOException.class, () -> sqlFiles.load("by_id.sql"));
	}

	@Test
	public void testMissingFileFailsCompiledBuild() {
		Assertions.assertThrows(UncheckedIOException.class, () -> SqlFiles.builder(this.sqlKit, this.rootDirectory, "users")
				.files("by_id.sql", "missing.sql")
				.build());

		// Dynamic mode only reads on load
		SqlFiles sqlFiles = SqlFiles.builder(this.sqlKit, this.rootDirectory, "users")
				.files("missing.sql")
				.loadMode(LoadMode.DYNAMIC)
				.build();

		Assertions.assertThrows(UncheckedIOException.class, () -> sqlFiles.load("missing.sql"));
	}

	@Test
	public void testUndeclaredFileIsRejected() {
		SqlFiles sqlFiles = SqlFiles.builder(this.sqlKit, this.rootDirectory, "users")
				.files("by_id.sql")
				.build();

		IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class, () -> sqlFiles.load("all.sql"));
		Assertions.assertTrue(e.getMessage().contains("all.sql"));
	}

	@Test
	public void testQueriesAreLabeledWithFileName() {
		SqlFiles sqlFiles = SqlFiles.builder(this.sqlKit, this.rootDirectory, "users")
				.files("by_id.sql", "all.sql")
				.build();

		NoResultsException noResultsException = Assertions.assertThrows(NoResultsException.class,
				() -> sqlFiles.queryOne("by_id.sql", 99));
		Assertions.assertEquals("by_id.sql", noResultsException.getQueryLabel());

		MultipleResultsException multipleResultsException = Assertions.assertThrows(MultipleResultsException.class,
				() -> sqlFiles.queryOne("all.sql", User.class));
		Assertions.assertEquals("expected at most one result but got 3 for query: all.sql", multipleResultsException.getMessage());

		Assertions.assertEquals(Optional.empty(), sqlFiles.tryQueryOne("by_id.sql", User.class, 99).getOrThrow());
		Assertions.assertEquals(List.of(Map.of("id", 3, "name", "Cy")),
				List.of(sqlFiles.tryQueryOne("by_id.sql", 3).getOrThrow().orElseThrow()));
	}
}
