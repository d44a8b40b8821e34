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
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Currency;
import java.util.Date;
import java.util.IllformedLocaleException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TimeZone;
import java.util.UUID;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Basic implementation of {@link ResultSetMapper}.
 * <p>
 * {@code DATE}, {@code TIME} and {@code TIMESTAMP} columns are scanned as {@link LocalDate}, {@link LocalTime} and
 * {@link LocalDateTime}; everything else is whatever the driver's {@link ResultSet#getObject(int)} returns.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
class DefaultResultSetMapper implements ResultSetMapper {
	@NonNull
	private final ZoneId timeZone;

	DefaultResultSetMapper(@NonNull ZoneId timeZone) {
		requireNonNull(timeZone);
		this.timeZone = timeZone;
	}

	@Override
	@NonNull
	public List<@Nullable Object> scanRow(@NonNull ResultSet resultSet,
																				@NonNull Integer columnCount) throws SQLException {
		requireNonNull(resultSet);
		requireNonNull(columnCount);

		ResultSetMetaData resultSetMetaData = resultSet.getMetaData();
		List<Object> row = new ArrayList<>(columnCount);

		for (int columnIndex = 1; columnIndex <= columnCount; ++columnIndex)
			row.add(extractColumnValue(resultSetMetaData, resultSet, columnIndex).orElse(null));

		return row;
	}

	@Override
	@NonNull
	public <T> T map(@NonNull List<@Nullable Object> row,
									 @NonNull RecordSchema<T> recordSchema,
									 @NonNull InstanceProvider instanceProvider) {
		requireNonNull(row);
		requireNonNull(recordSchema);
		requireNonNull(instanceProvider);

		List<ColumnDescriptor> columns = recordSchema.getColumns();

		if (row.size() != columns.size())
			throw new IllegalArgumentException(format("Row has %d values but %s has %d columns",
					row.size(), recordSchema.getRecordType().getName(), columns.size()));

		List<Object> values = new ArrayList<>(columns.size());

		for (int i = 0; i < columns.size(); ++i) {
			ColumnDescriptor column = columns.get(i);
			Object value = row.get(i);

			if (value == null && column.getFieldType().isPrimitive())
				throw new DatabaseException(format("Column %d ('%s') is NULL but field '%s' is of primitive type %s",
						i + 1, column.getColumnName(), column.getFieldName(), column.getFieldType().getName()));

			values.add(convertResultSetValueToPropertyType(value, column.getFieldType()).orElse(null));
		}

		return recordSchema.instantiate(values, instanceProvider);
	}

	@NonNull
	protected Optional<Object> extractColumnValue(@NonNull ResultSetMetaData resultSetMetaData,
																								@NonNull ResultSet resultSet,
																								int columnIndex) throws SQLException {
		requireNonNull(resultSetMetaData);
		requireNonNull(resultSet);

		int jdbcType = resultSetMetaData.getColumnType(columnIndex);

		if (jdbcType == Types.TIMESTAMP) {
			Timestamp timestamp = resultSet.getTimestamp(columnIndex);
			return Optional.ofNullable(timestamp == null ? null : timestamp.toLocalDateTime());
		}

		if (jdbcType == Types.DATE) {
			java.sql.Date date = resultSet.getDate(columnIndex);
			return Optional.ofNullable(date == null ? null : date.toLocalDate());
		}

		if (jdbcType == Types.TIME) {
			Time time = resultSet.getTime(columnIndex);
			return Optional.ofNullable(time == null ? null : time.toLocalTime());
		}

		return Optional.ofNullable(resultSet.getObject(columnIndex));
	}

	/**
	 * Massages a scanned value to match the given {@code propertyType}.
	 * <p>
	 * For example, MySQL gives us {@link Long} for a {@code BIGINT} column but the corresponding field might be an
	 * {@code int}, so we narrow it ourselves and fail if the value does not fit.
	 *
	 * @param resultSetValue the scanned value
	 * @param propertyType   the field type we'd like to map {@code resultSetValue} to
	 * @return a representation of {@code resultSetValue} that is of type {@code propertyType}
	 * @throws DatabaseException if no conversion exists
	 */
	@NonNull
	protected Optional<Object> convertResultSetValueToPropertyType(@Nullable Object resultSetValue,
																																 @NonNull Class<?> propertyType) {
		requireNonNull(propertyType);

		if (resultSetValue == null)
			return Optional.empty();

		Class<?> targetType = boxedClass(propertyType);

		if (targetType.isInstance(resultSetValue))
			return Optional.of(resultSetValue);

		if (String.class.equals(targetType)) {
			if (resultSetValue instanceof byte[] bytes)
				return Optional.of(new String(bytes, StandardCharsets.UTF_8));

			return Optional.of(resultSetValue.toString());
		}

		// Numbers
		if (resultSetValue instanceof Number number) {
			if (Float.class.equals(targetType))
				return Optional.of(number.floatValue());
			if (Double.class.equals(targetType))
				return Optional.of(number.doubleValue());

			if (Byte.class.equals(targetType) || Short.class.equals(targetType) || Integer.class.equals(targetType)
					|| Long.class.equals(targetType) || BigInteger.class.equals(targetType) || BigDecimal.class.equals(targetType)
					|| Boolean.class.equals(targetType))
				return Optional.of(convertNumber(number, targetType, propertyType));
		}

		// Temporal values arrive as java.time types from scanRow, or as drivers' own types otherwise
		if (resultSetValue instanceof Timestamp timestamp)
			resultSetValue = timestamp.toLocalDateTime();
		else if (resultSetValue instanceof java.sql.Date date)
			resultSetValue = date.toLocalDate();
		else if (resultSetValue instanceof Time time)
			resultSetValue = time.toLocalTime();

		if (resultSetValue instanceof LocalDateTime localDateTime) {
			if (LocalDateTime.class.equals(targetType))
				return Optional.of(localDateTime);
			if (LocalDate.class.equals(targetType))
				return Optional.of(localDateTime.toLocalDate());
			if (LocalTime.class.equals(targetType))
				return Optional.of(localDateTime.toLocalTime());
			if (Instant.class.equals(targetType))
				return Optional.of(localDateTime.atZone(getTimeZone()).toInstant());
			if (OffsetDateTime.class.equals(targetType))
				return Optional.of(localDateTime.atZone(getTimeZone()).toOffsetDateTime());
			if (Timestamp.class.equals(targetType))
				return Optional.of(Timestamp.valueOf(localDateTime));
			if (Date.class.equals(targetType))
				return Optional.of(Date.from(localDateTime.atZone(getTimeZone()).toInstant()));
		}

		if (resultSetValue instanceof LocalDate localDate) {
			if (LocalDate.class.equals(targetType))
				return Optional.of(localDate);
			if (LocalDateTime.class.equals(targetType))
				return Optional.of(localDate.atStartOfDay());
			if (Instant.class.equals(targetType))
				return Optional.of(localDate.atStartOfDay(getTimeZone()).toInstant());
			if (java.sql.Date.class.equals(targetType))
				return Optional.of(java.sql.Date.valueOf(localDate));
			if (Date.class.equals(targetType))
				return Optional.of(Date.from(localDate.atStartOfDay(getTimeZone()).toInstant()));
		}

		if (resultSetValue instanceof LocalTime localTime) {
			if (LocalTime.class.equals(targetType))
				return Optional.of(localTime);
			if (Time.class.equals(targetType))
				return Optional.of(Time.valueOf(localTime));
		}

		if (resultSetValue instanceof OffsetDateTime offsetDateTime) {
			if (Instant.class.equals(targetType))
				return Optional.of(offsetDateTime.toInstant());
			if (LocalDateTime.class.equals(targetType))
				return Optional.of(offsetDateTime.atZoneSameInstant(getTimeZone()).toLocalDateTime());
			if (Timestamp.class.equals(targetType))
				return Optional.of(Timestamp.from(offsetDateTime.toInstant()));
		}

		if (UUID.class.equals(targetType)) {
			try {
				return Optional.of(UUID.fromString(resultSetValue.toString()));
			} catch (IllegalArgumentException e) {
				throw new DatabaseException(format("Unable to convert value '%s' to UUID", resultSetValue), e);
			}
		} else if (ZoneId.class.equals(targetType)) {
			try {
				return Optional.of(ZoneId.of(resultSetValue.toString()));
			} catch (DateTimeException e) {
				throw new DatabaseException(format("Unable to convert value '%s' to ZoneId", resultSetValue), e);
			}
		} else if (TimeZone.class.equals(targetType)) {
			return Optional.of(TimeZone.getTimeZone(resultSetValue.toString().trim()));
		} else if (Locale.class.equals(targetType)) {
			try {
				return Optional.of(new Locale.Builder().setLanguageTag(resultSetValue.toString().trim()).build());
			} catch (IllformedLocaleException e) {
				throw new DatabaseException(format("Unable to convert value '%s' to Locale", resultSetValue), e);
			}
		} else if (Currency.class.equals(targetType)) {
			try {
				return Optional.of(Currency.getInstance(resultSetValue.toString()));
			} catch (IllegalArgumentException e) {
				throw new DatabaseException(format("Unable to convert value '%s' to Currency", resultSetValue), e);
			}
		} else if (targetType.isEnum()) {
			return Optional.of(extractEnumValue(targetType, resultSetValue));
		}

		if (Boolean.class.equals(targetType) && resultSetValue instanceof String string) {
			if ("true".equalsIgnoreCase(string.trim()))
				return Optional.of(true);
			if ("false".equalsIgnoreCase(string.trim()))
				return Optional.of(false);
		}

		if (Character.class.equals(targetType) && resultSetValue instanceof String string) {
			if (string.length() == 1)
				return Optional.of(string.charAt(0));

			throw new DatabaseException(format("Cannot map String value '%s' to %s; expected length 1", string, propertyType.getSimpleName()));
		}

		throw new DatabaseException(format("Cannot map value '%s' (%s) to %s",
				resultSetValue, resultSetValue.getClass().getName(), propertyType.getName()));
	}

	/**
	 * Converts {@code number} to an integral, decimal or boolean {@code targetType} without losing information.
	 *
	 * @throws DatabaseException if {@code number} is out of range for {@code targetType}, has a fractional part that
	 *                           an integral type cannot hold, or is {@code NaN} or infinite
	 */
	@NonNull
	protected Object convertNumber(@NonNull Number number,
																 @NonNull Class<?> targetType,
																 @NonNull Class<?> propertyType) {
		requireNonNull(number);
		requireNonNull(targetType);
		requireNonNull(propertyType);

		BigDecimal decimal;

		if (number instanceof BigDecimal bigDecimal)
			decimal = bigDecimal;
		else if (number instanceof BigInteger bigInteger)
			decimal = new BigDecimal(bigInteger);
		else if (number instanceof Byte || number instanceof Short || number instanceof Integer || number instanceof Long)
			decimal = BigDecimal.valueOf(number.longValue());
		else {
			// Double and Float NaN/Infinity have no decimal form
			try {
				decimal = new BigDecimal(number.toString());
			} catch (NumberFormatException e) {
				throw new DatabaseException(format("Cannot map value '%s' to %s", number, propertyType.getName()), e);
			}
		}

		try {
			if (Byte.class.equals(targetType))
				return decimal.byteValueExact();
			if (Short.class.equals(targetType))
				return decimal.shortValueExact();
			if (Integer.class.equals(targetType))
				return decimal.intValueExact();
			if (Long.class.equals(targetType))
				return decimal.longValueExact();
			if (BigInteger.class.equals(targetType))
				return decimal.toBigIntegerExact();
			if (Boolean.class.equals(targetType))
				return decimal.signum() != 0;

			return decimal;
		} catch (ArithmeticException e) {
			throw new DatabaseException(format("Value %s does not fit in %s", number, propertyType.getName()), e);
		}
	}

	/**
	 * Attempts to convert {@code object} to a corresponding value for enum type {@code enumClass}.
	 * <p>
	 * The {@code toString()} method of {@code object} determines the final value for conversion.
	 *
	 * @param enumClass the enum to which we'd like to convert {@code object}
	 * @param object    the object to convert to an enum value
	 * @return the enum value of {@code object} for {@code enumClass}
	 * @throws DatabaseException if {@code object} does not correspond to a valid enum value
	 */
	@SuppressWarnings({"unchecked", "rawtypes"})
	@NonNull
	protected Enum<?> extractEnumValue(@NonNull Class<?> enumClass,
																		 @NonNull Object object) {
		requireNonNull(enumClass);
		requireNonNull(object);

		String objectAsString = object.toString();

		try {
			return Enum.valueOf((Class<? extends Enum>) enumClass, objectAsString);
		} catch (IllegalArgumentException e) {
			throw new DatabaseException(format("The value '%s' is not present in enum %s", objectAsString, enumClass), e);
		}
	}

	@NonNull
	protected Class<?> boxedClass(@NonNull Class<?> type) {
		requireNonNull(type);

		if (!type.isPrimitive())
			return type;
		if (type == int.class)
			return Integer.class;
		if (type == long.class)
			return Long.class;
		if (type == double.class)
			return Double.class;
		if (type == float.class)
			return Float.class;
		if (type == boolean.class)
			return Boolean.class;
		if (type == short.class)
			return Short.class;
		if (type == byte.class)
			return Byte.class;
		if (type == char.class)
			return Character.class;

		return type;
	}

	@NonNull
	protected ZoneId getTimeZone() {
		return this.timeZone;
	}
}
