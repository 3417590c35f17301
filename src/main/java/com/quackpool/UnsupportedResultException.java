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
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when a server driver hands back a result object whose shape {@link ResultExtractor} does not recognize.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class UnsupportedResultException extends DatabaseException {
	@NonNull
	private final String observedShape;

	public UnsupportedResultException(@NonNull String observedShape) {
		super(format("Unsupported query result type: %s. Expected a ResultSet, a %s, or a map with 'columns' and 'rows' entries.",
				requireNonNull(observedShape), QueryResult.class.getSimpleName()));
		this.observedShape = observedShape;
	}

	@NonNull
	@Override
	protected List<String> describe() {
		return List.of(format("observedShape=%s", getObservedShape()));
	}

	/**
	 * @return a description (usually the class name) of the unrecognized result object
	 */
	@NonNull
	public String getObservedShape() {
		return this.observedShape;
	}
}
