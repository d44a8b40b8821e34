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

import javax.annotation.concurrent.NotThreadSafe;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One field or record component of a mapped type, possibly with nested properties of its own.
 * <p>
 * Instances are assembled by {@link DefaultSchemaExtractor} and are effectively immutable once the owning
 * {@link RecordSchema} has been published.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
final class SchemaProperty {
	@NonNull
	private final String name;
	@NonNull
	private final Class<?> type;
	@Nullable
	private final Field field;
	@Nullable
	private final Method recordComponentAccessor;
	@NonNull
	private List<@NonNull SchemaProperty> children;
	@Nullable
	private ColumnDescriptor column;

	private SchemaProperty(@NonNull String name,
												 @NonNull Class<?> type,
												 @Nullable Field field,
												 @Nullable Method recordComponentAccessor) {
		this.name = requireNonNull(name);
		this.type = requireNonNull(type);
		this.field = field;
		this.recordComponentAccessor = recordComponentAccessor;
		this.children = List.of();
	}

	@NonNull
	static SchemaProperty forField(@NonNull Field field) {
		requireNonNull(field);
		return new SchemaProperty(field.getName(), field.getType(), field, null);
	}

	@NonNull
	static SchemaProperty forRecordComponent(@NonNull String name,
																					 @NonNull Class<?> type,
																					 @NonNull Method accessor) {
		requireNonNull(name);
		requireNonNull(type);
		requireNonNull(accessor);

		return new SchemaProperty(name, type, null, accessor);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{name=%s, type=%s, nested=%s}", getClass().getSimpleName(), getName(), getType().getName(), isNested());
	}

	@Nullable
	Object read(@NonNull Object owner) {
		requireNonNull(owner);

		try {
			if (this.field != null)
				return this.field.get(owner);

			return requireNonNull(this.recordComponentAccessor).invoke(owner);
		} catch (IllegalAccessException | InvocationTargetException e) {
			throw new DatabaseException(format("Unable to read property '%s' of %s", getName(), owner.getClass().getName()), e);
		}
	}

	void write(@NonNull Object owner,
						 @Nullable Object value) {
		requireNonNull(owner);

		if (this.field == null)
			throw new IllegalStateException(format("Record component '%s' can only be set through its canonical constructor", getName()));

		try {
			this.field.set(owner, value);
		} catch (IllegalAccessException | IllegalArgumentException e) {
			throw new DatabaseException(format("Unable to set property '%s' of %s to %s", getName(), owner.getClass().getName(), value), e);
		}
	}

	@NonNull
	String getName() {
		return this.name;
	}

	@NonNull
	Class<?> getType() {
		return this.type;
	}

	@NonNull
	Boolean isNested() {
		return this.column == null;
	}

	@NonNull
	List<@NonNull SchemaProperty> getChildren() {
		return this.children;
	}

	void setChildren(@NonNull List<@NonNull SchemaProperty> children) {
		requireNonNull(children);
		this.children = List.copyOf(children);
	}

	@NonNull
	Optional<ColumnDescriptor> getColumn() {
		return Optional.ofNullable(this.column);
	}

	void setColumn(@NonNull ColumnDescriptor column) {
		requireNonNull(column);
		this.column = column;
	}
}
