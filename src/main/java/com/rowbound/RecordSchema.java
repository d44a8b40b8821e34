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
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The flattened column layout of a mapped type, plus the accessors needed to read values out of instances and to
 * build new instances from column values.
 * <p>
 * Acquire instances via {@link SchemaExtractor#extract(Class)}; a schema is derived once per type and reused.
 *
 * @param <T> the mapped type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class RecordSchema<T> {
	@NonNull
	private final Class<T> recordType;
	@NonNull
	private final List<@NonNull SchemaProperty> properties;
	@NonNull
	private final List<@NonNull ColumnDescriptor> columns;

	RecordSchema(@NonNull Class<T> recordType,
							 @NonNull List<@NonNull SchemaProperty> properties,
							 @NonNull List<@NonNull ColumnDescriptor> columns) {
		requireNonNull(recordType);
		requireNonNull(properties);
		requireNonNull(columns);

		this.recordType = recordType;
		this.properties = List.copyOf(properties);
		this.columns = List.copyOf(columns);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{recordType=%s, columns=%s}", getClass().getSimpleName(), getRecordType().getName(), getColumnNames());
	}

	/**
	 * Extracts one value per column from {@code record}, in column order.
	 *
	 * @param record the instance to read
	 * @return column values, which may contain {@code null}s
	 */
	@NonNull
	public List<@Nullable Object> extractValues(@NonNull Object record) {
		requireNonNull(record);

		if (!getRecordType().isInstance(record))
			throw new IllegalArgumentException(format("Expected an instance of %s but got %s", getRecordType().getName(), record.getClass().getName()));

		List<Object> values = new ArrayList<>(this.columns.size());

		for (ColumnDescriptor column : this.columns)
			values.add(column.readValue(record));

		return values;
	}

	/**
	 * Builds a new instance from column values given in column order.
	 * <p>
	 * Values are assigned by position, so {@code values} must line up with {@link #getColumns()}.
	 *
	 * @param values           one value per column, already converted to each field's type
	 * @param instanceProvider creates the instance and any embedded instances
	 * @return a newly-built instance
	 */
	@NonNull
	public T instantiate(@NonNull List<@Nullable Object> values,
											 @NonNull InstanceProvider instanceProvider) {
		requireNonNull(values);
		requireNonNull(instanceProvider);

		if (values.size() != this.columns.size())
			throw new IllegalArgumentException(format("%s has %d columns but %d values were supplied",
					getRecordType().getName(), this.columns.size(), values.size()));

		Iterator<Object> iterator = values.iterator();
		return getRecordType().cast(instantiate(getRecordType(), this.properties, iterator, instanceProvider));
	}

	@SuppressWarnings("unchecked")
	@NonNull
	private Object instantiate(@NonNull Class<?> type,
														 @NonNull List<@NonNull SchemaProperty> properties,
														 @NonNull Iterator<Object> values,
														 @NonNull InstanceProvider instanceProvider) {
		if (type.isRecord()) {
			Object[] initargs = new Object[properties.size()];

			for (int i = 0; i < properties.size(); ++i)
				initargs[i] = valueFor(properties.get(i), values, instanceProvider);

			return instanceProvider.provideRecord((Class<? extends Record>) type, initargs);
		}

		Object instance = instanceProvider.provide(type);

		for (SchemaProperty property : properties) {
			Object value = valueFor(property, values, instanceProvider);

			// Leave primitives at their defaults rather than failing on null
			if (value == null && property.getType().isPrimitive())
				continue;

			property.write(instance, value);
		}

		return instance;
	}

	@Nullable
	private Object valueFor(@NonNull SchemaProperty property,
													@NonNull Iterator<Object> values,
													@NonNull InstanceProvider instanceProvider) {
		if (property.isNested())
			return instantiate(property.getType(), property.getChildren(), values, instanceProvider);

		return values.next();
	}

	@NonNull
	public Class<T> getRecordType() {
		return this.recordType;
	}

	@NonNull
	public List<@NonNull ColumnDescriptor> getColumns() {
		return this.columns;
	}

	@NonNull
	public List<@NonNull String> getColumnNames() {
		return this.columns.stream().map(ColumnDescriptor::getColumnName).collect(Collectors.toList());
	}

	@NonNull
	public List<@NonNull String> getFieldNames() {
		return this.columns.stream().map(ColumnDescriptor::getFieldName).collect(Collectors.toList());
	}

	@NonNull
	List<@NonNull SchemaProperty> getProperties() {
		return this.properties;
	}
}
