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
import java.sql.ParameterMetaData;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Currency;
import java.util.Date;
import java.util.Locale;
import java.util.Optional;
import java.util.TimeZone;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Basic implementation of {@link PreparedStatementBinder}.
 * <p>
 * Values MySQL has no native type for are bound as strings: enums by name, {@link UUID}, {@link Locale} as a language
 * tag, {@link Currency} as its code and {@link ZoneId}/{@link TimeZone} as their IDs. {@code java.time} values are
 * bound through their {@code java.sql} counterparts.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
class DefaultPreparedStatementBinder implements PreparedStatementBinder {
	@Override
	public void bindParameter(@NonNull PreparedStatement preparedStatement,
														@NonNull Integer parameterIndex,
														@Nullable Object parameter) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(parameterIndex);

		if (parameter == null) {
			Optional<Integer> sqlType = determineParameterSqlType(preparedStatement, parameterIndex);
			preparedStatement.setNull(parameterIndex, sqlType.orElse(Types.NULL));
			return;
		}

		Object normalizedParameter = normalizeParameter(parameter);

		if (normalizedParameter instanceof String string)
			preparedStatement.setString(parameterIndex, string);
		else
			preparedStatement.setObject(parameterIndex, normalizedParameter);
	}

	/**
	 * Massages a parameter into a JDBC-friendly format if needed.
	 *
	 * @param parameter the parameter to (possibly) massage
	 * @return the result of the massaging process
	 */
	@NonNull
	protected Object normalizeParameter(@NonNull Object parameter) {
		requireNonNull(parameter);

		if (parameter instanceof Enum<?> enumValue)
			return enumValue.name();
		if (parameter instanceof UUID uuid)
			return uuid.toString();
		if (parameter instanceof Character character)
			return character.toString();
		if (parameter instanceof Locale locale)
			return locale.toLanguageTag();
		if (parameter instanceof Currency currency)
			return currency.getCurrencyCode();
		if (parameter instanceof ZoneId zoneId)
			return zoneId.getId();
		if (parameter instanceof TimeZone timeZone)
			return timeZone.getID();

		// java.sql.* types extend java.util.Date, so check them first
		if (parameter instanceof Timestamp || parameter instanceof java.sql.Date || parameter instanceof Time)
			return parameter;
		if (parameter instanceof Date date)
			return new Timestamp(date.getTime());
		if (parameter instanceof Instant instant)
			return Timestamp.from(instant);
		if (parameter instanceof OffsetDateTime offsetDateTime)
			return Timestamp.from(offsetDateTime.toInstant());
		if (parameter instanceof ZonedDateTime zonedDateTime)
			return Timestamp.from(zonedDateTime.toInstant());
		if (parameter instanceof LocalDateTime localDateTime)
			return Timestamp.valueOf(localDateTime);
		if (parameter instanceof LocalDate localDate)
			return java.sql.Date.valueOf(localDate);
		if (parameter instanceof LocalTime localTime)
			return Time.valueOf(localTime);

		return parameter;
	}

	/**
	 * The declared SQL type of the parameter at {@code parameterIndex}, used when binding {@code NULL}.
	 * <p>
	 * MySQL's client-side prepared statements cannot describe their parameters, in which case this is empty and
	 * {@link Types#NULL} is bound instead.
	 */
	@NonNull
	protected Optional<Integer> determineParameterSqlType(@NonNull PreparedStatement preparedStatement,
																												@NonNull Integer parameterIndex) {
		requireNonNull(preparedStatement);
		requireNonNull(parameterIndex);

		try {
			ParameterMetaData parameterMetaData = preparedStatement.getParameterMetaData();

			if (parameterMetaData == null)
				return Optional.empty();

			return Optional.of(parameterMetaData.getParameterType(parameterIndex));
		} catch (SQLException | AbstractMethodError e) {
			return Optional.empty();
		}
	}
}
