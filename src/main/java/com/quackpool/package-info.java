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

/**
 * <p>
 * Quackpool is a pooled, supervised access layer for an embedded DuckDB engine, with one query surface over pools,
 * standalone connections and conventional SQL servers.
 * <p>
 * Typical usage:
 * <pre>
 * // One engine handle per pool, connections opened lazily and reused
 * Pool pool = Pool.builder("analytics.duckdb")
 *   .name("analytics")
 *   .poolSize(4)
 *   .start();
 *
 * // Raw results
 * QueryResult result = pool.query("SELECT id, name FROM users ORDER BY id");
 *
 * // Stream large results in chunks while a connection stays checked out
 * long total = pool.withStream("SELECT amount FROM sales", List.of(), chunks -&gt;
 *   chunks.mapToLong(List::size).sum());
 *
 * // Typed access through any backend
 * SqlKit sqlKit = SqlKit.withBackend(pool).build();
 * User user = sqlKit.query("SELECT id, name FROM users WHERE id = ?")
 *   .parameters(42)
 *   .fetchOne(User.class);
 *
 * pool.stop();</pre>
 *
 * @since 1.0.0
 */
package com.quackpool;
