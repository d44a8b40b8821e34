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

package com.rowbound;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Arrays;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Contract for a factory that creates instances given a type.
 * <p>
 * {@link Model#read(String, java.util.List, String, Class)} asks for one new instance per result row, plus one per
 * embedded value in that row.
 * <p>
 * Implementations should be threadsafe.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public interface InstanceProvider {
	/**
	 * Provides a new instance of the given {@code instanceType}, whose fields are then populated reflectively.
	 *
	 * @param <T>          instance type token
	 * @param instanceType the type of instance to create
	 * @return an instance of the given {@code instanceType}
	 */
	@NonNull
	default <T> T provide(@NonNull Class<T> instanceType) {
		requireNonNull(instanceType);

		try {
			Constructor<T> constructor = instanceType.getDeclaredConstructor();
			constructor.setAccessible(true);
			return constructor.newInstance();
		} catch (Exception e) {
			throw new DatabaseException(format(
					"Unable to create an instance of %s. Please verify that %s has a no-argument constructor",
					instanceType, instanceType.getSimpleName()), e);
		}
	}

	/**
	 * Provides an instance of the given {@code recordType} via its canonical constructor.
	 *
	 * @param <T>        instance type token
	 * @param recordType the type of instance to create (must be a record)
	 * @param initargs   values used to construct the record instance, in component order
	 * @return an instance of the given {@code recordType}
	 */
	@NonNull
	default <T extends Record> T provideRecord(@NonNull Class<T> recordType,
																						 Object @Nullable ... initargs) {
		requireNonNull(recordType);

		try {
			Class<?>[] componentTypes = Arrays.stream(recordType.getRecordComponents())
					.map(recordComponent -> recordComponent.getType())
					.toArray(Class<?>[]::new);

			Constructor<T> constructor = recordType.getDeclaredConstructor(componentTypes);
			constructor.setAccessible(true);
			return constructor.newInstance(initargs);
		} catch (NoSuchMethodException | InstantiationException | IllegalAccessException |
						 IllegalArgumentException | InvocationTargetException e) {
			throw new DatabaseException(format("Unable to instantiate record type %s with args %s", recordType,
					initargs == null ? "[none]" : Arrays.asList(initargs)), e);
		}
	}
}
