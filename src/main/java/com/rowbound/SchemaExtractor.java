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

import javax.annotation.concurrent.ThreadSafe;

/**
 * Contract for deriving the ordered column layout of a mapped type.
 * <p>
 * A production-ready concrete implementation is available via {@link #withDefaultConfiguration()}.
 * <p>
 * Implementations should be threadsafe.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface SchemaExtractor {
	/**
	 * Derives the schema of {@code recordType}: one {@link ColumnDescriptor} per leaf field, in declaration order,
	 * with embedded types flattened in place.
	 *
	 * @param recordType the type to describe
	 * @param <T>        the type to describe
	 * @return the schema of {@code recordType}
	 * @throws IllegalArgumentException if {@code recordType} cannot be mapped
	 */
	@NonNull
	<T> RecordSchema<T> extract(@NonNull Class<T> recordType);

	/**
	 * Acquires a concrete implementation of this interface with out-of-the-box defaults.
	 * <p>
	 * The returned instance is thread-safe and caches schemas per type.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@NonNull
	static SchemaExtractor withDefaultConfiguration() {
		return new DefaultSchemaExtractor();
	}
}
