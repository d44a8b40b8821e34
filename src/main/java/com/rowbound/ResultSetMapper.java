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

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.ZoneId;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Contract for turning a {@link ResultSet} row into a record.
 * <p>
 * Mapping is positional: the row's first column feeds the record's first flattened column, and so on. Column labels
 * are never consulted.
 * <p>
 * A production-ready concrete implementation is available via {@link #withDefaultConfiguration()} or
 * {@link #withTimeZone(ZoneId)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public interface ResultSetMapper {
	/**
	 * Scans the current row of {@code resultSet} into one raw value per column.
	 *
	 * @param resultSet   positioned on the row to scan
	 * @param columnCount how many columns to scan
	 * @return the scanned values, in column order
	 * @throws SQLException if a column cannot be read
	 */
	@NonNull
	List<@Nullable Object> scanRow(@NonNull ResultSet resultSet,
																 @NonNull Integer columnCount) throws SQLException;

	/**
	 * Builds a record from values produced by {@link #scanRow(ResultSet, Integer)}, converting each to its field's type.
	 *
	 * @param <T>              record type token
	 * @param row              raw values, one per column of {@code recordSchema}
	 * @param recordSchema     describes the record to build
	 * @param instanceProvider instance-creation factory
	 * @return a new record
	 * @throws DatabaseException if a value cannot be converted, for example SQL {@code NULL} into a primitive field
	 */
	@NonNull
	<T> T map(@NonNull List<@Nullable Object> row,
						@NonNull RecordSchema<T> recordSchema,
						@NonNull InstanceProvider instanceProvider);

	/**
	 * Acquires a concrete implementation of this interface which interprets zoneless temporal values in the JVM's
	 * default time zone.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@NonNull
	static ResultSetMapper withDefaultConfiguration() {
		return new DefaultResultSetMapper(ZoneId.systemDefault());
	}

	/**
	 * Acquires a concrete implementation of this interface which interprets zoneless temporal values in {@code timeZone}.
	 *
	 * @param timeZone the zone used when converting between instants and local date-times
	 * @return a concrete implementation of this interface
	 */
	@NonNull
	static ResultSetMapper withTimeZone(@NonNull ZoneId timeZone) {
		requireNonNull(timeZone);
		return new DefaultResultSetMapper(timeZone);
	}
}
