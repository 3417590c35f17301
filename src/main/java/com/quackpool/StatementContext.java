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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Data that represents a SQL statement about to be executed against a {@link Backend}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class StatementContext {
	@Nonnull
	private final Statement statement;
	@Nonnull
	private final List<Object> parameters;
	@Nonnull
	private final String backendDescription;

	protected StatementContext(@Nonnull Statement statement,
														 @Nullable List<Object> parameters,
														 @Nonnull String backendDescription) {
		this.statement = requireNonNull(statement);
		this.parameters = parameters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(parameters));
		this.backendDescription = requireNonNull(backendDescription);
	}

	@Nonnull
	public static StatementContext of(@Nonnull Statement statement,
																		@Nullable List<Object> parameters,
																		@Nonnull String backendDescription) {
		return new StatementContext(statement, parameters, backendDescription);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getStatement(), getParameters(), getBackendDescription());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementContext statementContext))
			return false;

		return Objects.equals(statementContext.getStatement(), getStatement())
				&& Objects.equals(statementContext.getParameters(), getParameters())
				&& Objects.equals(statementContext.getBackendDescription(), getBackendDescription());
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(3);

		components.add(format("statement=%s", getStatement()));

		if (getParameters().size() > 0)
			components.add(format("parameters=%s", getParameters()));

		components.add(format("backend=%s", getBackendDescription()));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Nonnull
	public Statement getStatement() {
		return this.statement;
	}

	/**
	 * @return positional parameter values, possibly containing {@code null}s
	 */
	@Nonnull
	public List<Object> getParameters() {
		return this.parameters;
	}

	/**
	 * @return a short human-readable description of where the statement ran, e.g. {@code pool 'analytics'}
	 */
	@Nonnull
	public String getBackendDescription() {
		return this.backendDescription;
	}

	@Nonnull
	public Optional<String> getLabel() {
		return Optional.of(getStatement().getLabel());
	}
}
