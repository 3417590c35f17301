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
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.Arrays;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Contract for a factory that creates instances given a type.
 * <p>
 * Useful for result mapping, where each row might require a new instance.
 * <p>
 * Implementors are suggested to employ application-specific strategies, such as having a DI container handle instance
 * creation.
 * <p>
 * Implementations should be threadsafe.
 *
 * @since 1.0.0
 */
@ThreadSafe
public interface InstanceProvider {
	@NonNull
	InstanceProvider DEFAULT = new InstanceProvider() {};

	/**
	 * Provides an instance of the given JavaBean {@code instanceType}.
	 *
	 * @param <T>          instance type token
	 * @param instanceType the type of instance to create
	 * @return an instance of the given {@code instanceType}
	 */
	@NonNull
	default <T> T provide(@NonNull Class<T> instanceType) {
		requireNonNull(instanceType);

		try {
			return instanceType.getDeclaredConstructor().newInstance();
		} catch (Exception e) {
			throw new RecordConstructionException(instanceType, null, format(
					"Unable to create an instance of %s. Please verify that %s has a public no-argument constructor",
					instanceType, instanceType.getSimpleName()), e);
		}
	}

	/**
	 * Provides an instance of the given {@code recordType} through its canonical constructor.
	 *
	 * @param <T>        instance type token
	 * @param recordType the type of instance to create (must be a record)
	 * @param initargs   values for the record components, in declaration order
	 * @return an instance of the given {@code recordType}
	 */
	@NonNull
	default <T> T provideRecord(@NonNull Class<T> recordType,
															Object @Nullable ... initargs) {
		requireNonNull(recordType);

		try {
			// Find the canonical constructor for the record.
			// Hat tip to https://stackoverflow.com/a/67127067
			Class<?>[] componentTypes = Arrays.stream(recordType.getRecordComponents())
					.map(RecordComponent::getType)
					.toArray(Class<?>[]::new);

			Constructor<T> constructor = recordType.getDeclaredConstructor(componentTypes);
			constructor.trySetAccessible();
			return constructor.newInstance(initargs);
		} catch (NoSuchMethodException | InstantiationException | IllegalAccessException |
						 IllegalArgumentException | InvocationTargetException e) {
			throw new RecordConstructionException(recordType, null, format("Unable to instantiate record type %s with args %s",
					recordType, initargs == null ? "[none]" : Arrays.asList(initargs)), e);
		}
	}
}
