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
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A multi-row {@code INSERT} whose {@code VALUES} list is sized per chunk.
 * <p>
 * The text before and after the {@code VALUES} list never changes between chunks; only the number of placeholder
 * groups does.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class InsertStatement {
	/**
	 * Marks where placeholder groups go in {@link #getTemplate()}.
	 */
	@NonNull
	public static final String PLACEHOLDER_GROUPS_MARKER = "%s";

	@NonNull
	private final WriteMode writeMode;
	@NonNull
	private final String prefix;
	@NonNull
	private final String suffix;
	@NonNull
	private final String placeholderGroup;
	@NonNull
	private final Integer columnCount;

	InsertStatement(@NonNull WriteMode writeMode,
									@NonNull String prefix,
									@NonNull String suffix,
									@NonNull String placeholderGroup,
									@NonNull Integer columnCount) {
		this.writeMode = requireNonNull(writeMode);
		this.prefix = requireNonNull(prefix);
		this.suffix = requireNonNull(suffix);
		this.placeholderGroup = requireNonNull(placeholderGroup);
		this.columnCount = requireNonNull(columnCount);
	}

	/**
	 * SQL for a chunk of {@code rowCount} rows, e.g. {@code insert ignore into t(a,b) values (?,?),(?,?)}.
	 *
	 * @param rowCount number of rows in the chunk
	 * @return SQL with {@code rowCount} placeholder groups
	 */
	@NonNull
	public String getSql(int rowCount) {
		if (rowCount < 1)
			throw new IllegalArgumentException(format("Row count must be at least 1, was %d", rowCount));

		StringBuilder sql = new StringBuilder(this.prefix.length() + this.suffix.length()
				+ rowCount * (this.placeholderGroup.length() + 1));

		sql.append(this.prefix);

		for (int i = 0; i < rowCount; ++i) {
			if (i > 0)
				sql.append(',');
			sql.append(this.placeholderGroup);
		}

		sql.append(this.suffix);
		return sql.toString();
	}

	/**
	 * The statement text with {@value #PLACEHOLDER_GROUPS_MARKER} where the placeholder groups go.
	 *
	 * @return the statement template
	 */
	@NonNull
	public String getTemplate() {
		return this.prefix + PLACEHOLDER_GROUPS_MARKER + this.suffix;
	}

	/**
	 * One row's worth of parameter markers, e.g. {@code (?,?,?)}.
	 *
	 * @return the placeholder group
	 */
	@NonNull
	public String getPlaceholderGroup() {
		return this.placeholderGroup;
	}

	@NonNull
	public WriteMode getWriteMode() {
		return this.writeMode;
	}

	@NonNull
	public Integer getColumnCount() {
		return this.columnCount;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{writeMode=%s, template=%s}", getClass().getSimpleName(), getWriteMode(), getTemplate());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof InsertStatement))
			return false;

		InsertStatement insertStatement = (InsertStatement) object;

		return Objects.equals(getWriteMode(), insertStatement.getWriteMode())
				&& Objects.equals(getTemplate(), insertStatement.getTemplate());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getWriteMode(), getTemplate());
	}
}
