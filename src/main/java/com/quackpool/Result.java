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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Outcome of a query operation: either a value or the {@link DatabaseException} the throwing form would have raised.
 * <p>
 * Every throwing query method has a {@code try*} counterpart returning a {@code Result}.
 *
 * @param <T> the value type
 * @since 1.0.0
 */
@ThreadSafe
public final class Result<T> {
	@Nullable
	private final T value;
	@Nullable
	private final DatabaseException exception;

	private Result(@Nullable T value,
								 @Nullable DatabaseException exception) {
		this.value = value;
		this.exception = exception;
	}

	@NonNull
	public static <T> Result<T> success(@Nullable T value) {
		return new Result<>(value, null);
	}

	@NonNull
	public static <T> Result<T> failure(@NonNull DatabaseException exception) {
		requireNonNull(exception);
		return new Result<>(null, exception);
	}

	/**
	 * Runs {@code supplier}, capturing a thrown {@link DatabaseException} as a failed result.
	 * <p>
	 * Other runtime exceptions and errors propagate.
	 */
	@NonNull
	public static <T> Result<T> of(@NonNull Supplier<T> supplier) {
		requireNonNull(supplier);

		try {
			return success(supplier.get());
		} catch (DatabaseException e) {
			return failure(e);
		}
	}

	public boolean isSuccess() {
		return this.exception == null;
	}

	public boolean isFailure() {
		return this.exception != null;
	}

	/**
	 * @return the value of a successful result
	 * @throws DatabaseException the captured exception, if this result is a failure
	 */
	@Nullable
	public T getOrThrow() {
		if (this.exception != null)
			throw this.exception;

		return this.value;
	}

	@NonNull
	public Optional<T> getValue() {
		return Optional.ofNullable(this.value);
	}

	@NonNull
	public Optional<DatabaseException> getException() {
		return Optional.ofNullable(this.exception);
	}

	@NonNull
	public <R> Result<R> map(@NonNull Function<? super T, ? extends R> function) {
		requireNonNull(function);

		if (this.exception != null)
			return failure(this.exception);

		return success(function.apply(this.value));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Result<?> result))
			return false;

		return Objects.equals(this.value, result.value) && Objects.equals(this.exception, result.exception);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.value, this.exception);
	}

	@Override
	public String toString() {
		return isSuccess()
				? format("%s{value=%s}", getClass().getSimpleName(), this.value)
				: format("%s{exception=%s}", getClass().getSimpleName(), this.exception);
	}
}
