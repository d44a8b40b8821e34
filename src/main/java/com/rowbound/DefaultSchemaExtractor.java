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
import java.lang.reflect.AccessibleObject;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Package-private standard implementation of {@link SchemaExtractor}.
 * <p>
 * Record types contribute their record components; other classes contribute their declared instance fields, superclass
 * fields first. Static, transient and synthetic fields are ignored.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
class DefaultSchemaExtractor implements SchemaExtractor {
	@NonNull
	private final ConcurrentMap<Class<?>, RecordSchema<?>> recordSchemaCache;

	DefaultSchemaExtractor() {
		this.recordSchemaCache = new ConcurrentHashMap<>();
	}

	@Override
	@NonNull
	@SuppressWarnings("unchecked")
	public <T> RecordSchema<T> extract(@NonNull Class<T> recordType) {
		requireNonNull(recordType);
		return (RecordSchema<T>) getRecordSchemaCache().computeIfAbsent(recordType, type -> determineRecordSchema(type));
	}

	@NonNull
	protected <T> RecordSchema<T> determineRecordSchema(@NonNull Class<T> recordType) {
		requireNonNull(recordType);

		if (recordType.isPrimitive() || recordType.isArray() || recordType.isEnum() || recordType.isInterface())
			throw new IllegalArgumentException(format("%s cannot be mapped to table columns", recordType.getName()));

		List<ColumnDescriptor> columns = new ArrayList<>();
		Deque<Class<?>> typesBeingVisited = new ArrayDeque<>();
		typesBeingVisited.push(recordType);

		List<SchemaProperty> properties = determineProperties(recordType, new ArrayList<>(), typesBeingVisited, columns);
		return new RecordSchema<>(recordType, properties, columns);
	}

	@NonNull
	protected List<@NonNull SchemaProperty> determineProperties(@NonNull Class<?> type,
																															 @NonNull List<@NonNull SchemaProperty> parentPath,
																															 @NonNull Deque<Class<?>> typesBeingVisited,
																															 @NonNull List<@NonNull ColumnDescriptor> columns) {
		requireNonNull(type);
		requireNonNull(parentPath);
		requireNonNull(typesBeingVisited);
		requireNonNull(columns);

		List<SchemaProperty> properties = new ArrayList<>();

		for (Member member : determineMembers(type)) {
			SchemaProperty property = member.property();
			List<SchemaProperty> path = new ArrayList<>(parentPath);
			path.add(property);

			if (isNested(property.getType(), member.annotatedElement())) {
				if (typesBeingVisited.contains(property.getType()))
					throw new IllegalArgumentException(format("%s embeds itself via property '%s'", property.getType().getName(), property.getName()));

				typesBeingVisited.push(property.getType());
				property.setChildren(determineProperties(property.getType(), path, typesBeingVisited, columns));
				typesBeingVisited.pop();
			} else {
				DatabaseColumn databaseColumn = member.annotatedElement().getAnnotation(DatabaseColumn.class);
				String columnName = databaseColumn == null ? property.getName() : databaseColumn.value().trim();

				// Duplicate column names are passed through as-is
				ColumnDescriptor column = new ColumnDescriptor(columnName, path);
				property.setColumn(column);
				columns.add(column);
			}

			properties.add(property);
		}

		return properties;
	}

	@NonNull
	protected List<@NonNull Member> determineMembers(@NonNull Class<?> type) {
		requireNonNull(type);

		List<Member> members = new ArrayList<>();

		if (type.isRecord()) {
			for (RecordComponent recordComponent : type.getRecordComponents()) {
				Method accessor = recordComponent.getAccessor();
				makeAccessible(type, accessor);
				members.add(new Member(SchemaProperty.forRecordComponent(recordComponent.getName(), recordComponent.getType(), accessor), recordComponent));
			}

			return members;
		}

		List<Class<?>> hierarchy = new ArrayList<>();

		for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass())
			hierarchy.add(0, current);

		for (Class<?> current : hierarchy) {
			for (Field field : current.getDeclaredFields()) {
				int modifiers = field.getModifiers();

				if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic())
					continue;

				makeAccessible(type, field);
				members.add(new Member(SchemaProperty.forField(field), field));
			}
		}

		return members;
	}

	@NonNull
	protected Boolean isNested(@NonNull Class<?> propertyType,
														 @NonNull AnnotatedElement annotatedElement) {
		requireNonNull(propertyType);
		requireNonNull(annotatedElement);

		if (propertyType.isRecord())
			return true;

		if (!annotatedElement.isAnnotationPresent(Embedded.class))
			return false;

		if (propertyType.isPrimitive() || propertyType.isArray() || propertyType.isEnum() || propertyType.isInterface()
				|| propertyType.getName().startsWith("java."))
			throw new IllegalArgumentException(format("%s cannot be embedded; only records and plain classes can be", propertyType.getName()));

		return true;
	}

	private void makeAccessible(@NonNull Class<?> type,
															@NonNull AccessibleObject accessibleObject) {
		try {
			accessibleObject.setAccessible(true);
		} catch (InaccessibleObjectException | SecurityException e) {
			throw new IllegalArgumentException(format("Unable to access %s while mapping %s", accessibleObject, type.getName()), e);
		}
	}

	@NonNull
	protected ConcurrentMap<Class<?>, RecordSchema<?>> getRecordSchemaCache() {
		return this.recordSchemaCache;
	}

	protected record Member(@NonNull SchemaProperty property,
													@NonNull AnnotatedElement annotatedElement) {}
}
