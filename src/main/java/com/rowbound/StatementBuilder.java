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
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Generates the MySQL statements issued by {@link Model}.
 * <p>
 * Table and column names are inserted verbatim. They come from mapped types and caller code, never from end users.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementBuilder {
	/**
	 * MySQL's hard limit on bound parameters in a single prepared statement.
	 */
	public static final int MAXIMUM_PARAMETERS_PER_STATEMENT = 65_535;

	private StatementBuilder() {}

	/**
	 * Builds the multi-row insert for {@code columns} in the given {@code writeMode}.
	 *
	 * @param table     the table to write to
	 * @param columns   the columns to write, in binding order
	 * @param writeMode how to treat unique-key conflicts
	 * @return the insert statement
	 */
	@NonNull
	public static InsertStatement insert(@NonNull String table,
																			 @NonNull List<@NonNull ColumnDescriptor> columns,
																			 @NonNull WriteMode writeMode) {
		requireNonNull(table);
		requireNonNull(columns);
		requireNonNull(writeMode);

		if (columns.isEmpty())
			throw new IllegalArgumentException(format("No columns to write to table %s", table));

		List<String> columnNames = columns.stream().map(ColumnDescriptor::getColumnName).collect(Collectors.toList());
		String placeholderGroup = columnNames.stream().map(columnName -> "?").collect(Collectors.joining(",", "(", ")"));

		switch (writeMode) {
			case CREATE:
				return new InsertStatement(writeMode,
						format("insert ignore into %s(%s) values ", table, String.join(",", columnNames)),
						"",
						placeholderGroup,
						columnNames.size());
			case UPDATE:
				return new InsertStatement(writeMode,
						format("insert into %s(%s) values ", table, String.join(",", columnNames)),
						format(" on duplicate key update %s", columnNames.stream()
								.map(columnName -> format("%s=values(%s)", columnName, columnName))
								.collect(Collectors.joining(","))),
						placeholderGroup,
						columnNames.size());
			default:
				throw new UnsupportedOperationException(format("Unsupported %s value %s", WriteMode.class.getSimpleName(), writeMode));
		}
	}

	/**
	 * How many rows fit in one statement.
	 *
	 * @param columnCount columns per row
	 * @param batchSize   the caller's upper bound on rows per statement
	 * @return {@code min(batchSize, 65535 / columnCount)}
	 */
	public static int chunkSize(int columnCount,
															int batchSize) {
		if (columnCount < 1)
			throw new IllegalArgumentException(format("Column count must be at least 1, was %d", columnCount));
		if (batchSize < 1)
			throw new IllegalArgumentException(format("Batch size must be at least 1, was %d", batchSize));
		if (columnCount > MAXIMUM_PARAMETERS_PER_STATEMENT)
			throw new IllegalArgumentException(format("%d columns exceed the limit of %d parameters per statement",
					columnCount, MAXIMUM_PARAMETERS_PER_STATEMENT));

		return Math.min(batchSize, MAXIMUM_PARAMETERS_PER_STATEMENT / columnCount);
	}

	/**
	 * Builds {@code select c1,c2 from table <condition>}.
	 * <p>
	 * {@code condition} is raw SQL such as {@code where id > 10 order by id} and is appended without validation.
	 */
	@NonNull
	public static String select(@NonNull String table,
															@NonNull List<@NonNull String> columns,
															@Nullable String condition) {
		requireNonNull(table);
		requireNonNull(columns);

		if (columns.isEmpty())
			throw new IllegalArgumentException(format("No columns to select from table %s", table));

		return format("select %s from %s %s", String.join(",", columns), table, condition == null ? "" : condition).trim();
	}

	@NonNull
	public static String deleteOlderThan(@NonNull String table,
																			 @NonNull String timeColumn) {
		requireNonNull(table);
		requireNonNull(timeColumn);

		return format("delete from %s where %s < ?", table, timeColumn);
	}
}
