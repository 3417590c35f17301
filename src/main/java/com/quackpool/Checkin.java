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

import static java.lang.String.format;

/**
 * What a {@link CheckoutOperation} hands back: the caller's value plus whether the connection goes back to the pool.
 * <p>
 * {@link #keep(Object)} returns the connection for reuse. {@link #discard(Object)} closes it, and its slot is
 * refilled with a fresh connection on a later checkout.
 *
 * @param <T> the value type
 * @since 1.0.0
 */
@ThreadSafe
public final class Checkin<T> {
	@Nullable
	private final T value;
	private final boolean keep;

	private Checkin(@Nullable T value,
									boolean keep) {
		this.value = value;
		this.keep = keep;
	}

	@NonNull
	public static <T> Checkin<T> keep(@Nullable T value) {
		return new Checkin<>(value, true);
	}

	@NonNull
	public static <T> Checkin<T> discard(@Nullable T value) {
		return new Checkin<>(value, false);
	}

	@Nullable
	public T getValue() {
		return this.value;
	}

	public boolean isKeep() {
		return this.keep;
	}

	public boolean isDiscard() {
		return !this.keep;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Checkin<?> checkin))
			return false;

		return this.keep == checkin.keep && Objects.equals(this.value, checkin.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.value, this.keep);
	}

	@Override
	public String toString() {
		return format("%s{%s, value=%s}", getClass().getSimpleName(), this.keep ? "keep" : "discard", this.value);
	}
}
