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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Represents a SQL statement and the label it is known by in diagnostics and exceptions.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Statement {
	static final int MAXIMUM_DEFAULT_LABEL_LENGTH = 50;

	@Nonnull
	private final String label;
	@Nonnull
	private final String sql;

	private Statement(@Nonnull String label,
										@Nonnull String sql) {
		requireNonNull(label);
		requireNonNull(sql);

		this.label = label;
		this.sql = sql;
	}

	/**
	 * Factory method for providing {@link Statement} instances.
	 *
	 * @param label the statement's label, or {@code null} to derive one from the SQL
	 * @param sql   the SQL being labeled
	 * @return a statement instance
	 */
	@Nonnull
	public static Statement of(@Nullable String label,
														 @Nonnull String sql) {
		requireNonNull(sql);
		return new Statement(label == null ? defaultLabelFor(sql) : label, sql);
	}

	/**
	 * SQL of 50 characters or fewer is its own label; longer SQL is cut to 49 characters followed by {@code ...}.
	 * Characters are counted as code points, so a cut never splits a surrogate pair.
	 *
	 * @param sql the SQL to label
	 * @return the default label for {@code sql}
	 */
	@Nonnull
	static String defaultLabelFor(@Nonnull String sql) {
		requireNonNull(sql);

		if (sql.codePointCount(0, sql.length()) <= MAXIMUM_DEFAULT_LABEL_LENGTH)
			return sql;

		return format("%s...", sql.substring(0, sql.offsetByCodePoints(0, MAXIMUM_DEFAULT_LABEL_LENGTH - 1)));
	}

	@Override
	public int hashCode() {
		return Objects.hash(getLabel(), getSql());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Statement statement))
			return false;

		return Objects.equals(statement.getLabel(), getLabel())
				&& Objects.equals(statement.getSql(), getSql());
	}

	@Override
	@Nonnull
	public String toString() {
		// Strip out newlines for more compact SQL representation
		return format("%s{label=%s, sql=%s}", getClass().getSimpleName(),
				getLabel(), getSql().replaceAll("\n+", " ").trim());
	}

	@Nonnull
	public String getLabel() {
		return this.label;
	}

	@Nonnull
	public String getSql() {
		return this.sql;
	}
}
