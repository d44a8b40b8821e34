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
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A field-name/column-name pair extracted from a mapped type.
 * <p>
 * {@link #getFieldName()} is the Java name of the leaf field (nested fields are not prefixed by their parent), and
 * {@link #getColumnName()} is the {@link DatabaseColumn} override or, absent one, the field name itself.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class ColumnDescriptor {
	@NonNull
	private final String fieldName;
	@NonNull
	private final String columnName;
	@NonNull
	private final Class<?> fieldType;
	@NonNull
	private final List<@NonNull SchemaProperty> path;

	ColumnDescriptor(@NonNull String columnName,
									 @NonNull List<@NonNull SchemaProperty> path) {
		requireNonNull(columnName);
		requireNonNull(path);

		if (path.isEmpty())
			throw new IllegalArgumentException("Column path must not be empty");

		SchemaProperty leaf = path.get(path.size() - 1);

		this.fieldName = leaf.getName();
		this.columnName = columnName;
		this.fieldType = leaf.getType();
		this.path = List.copyOf(path);
	}

	/**
	 * Walks from {@code record} down to this column's leaf field.
	 * <p>
	 * A {@code null} embedded value along the way yields {@code null}.
	 */
	@Nullable
	Object readValue(@NonNull Object record) {
		requireNonNull(record);

		Object current = record;

		for (SchemaProperty property : this.path) {
			current = property.read(current);

			if (current == null)
				return null;
		}

		return current;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{fieldName=%s, columnName=%s, fieldType=%s}", getClass().getSimpleName(),
				getFieldName(), getColumnName(), getFieldType().getName());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ColumnDescriptor))
			return false;

		ColumnDescriptor columnDescriptor = (ColumnDescriptor) object;

		return Objects.equals(getFieldName(), columnDescriptor.getFieldName())
				&& Objects.equals(getColumnName(), columnDescriptor.getColumnName())
				&& Objects.equals(getFieldType(), columnDescriptor.getFieldType());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getFieldName(), getColumnName(), getFieldType());
	}

	@NonNull
	public String getFieldName() {
		return this.fieldName;
	}

	@NonNull
	public String getColumnName() {
		return this.columnName;
	}

	@NonNull
	public Class<?> getFieldType() {
		return this.fieldType;
	}
}
