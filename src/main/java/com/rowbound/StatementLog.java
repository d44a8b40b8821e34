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
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Diagnostics for one executed SQL statement: one write chunk, one read, one cleanup or one raw statement.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementLog {
	@NonNull
	private final String sql;
	@NonNull
	private final List<@Nullable Object> parameters;
	@NonNull
	private final Duration totalDuration;
	@Nullable
	private final Duration connectionAcquisitionDuration;
	@Nullable
	private final Duration preparationDuration;
	@Nullable
	private final Duration executionDuration;
	@Nullable
	private final Duration resultSetMappingDuration;
	@Nullable
	private final Integer rowCount;
	@Nullable
	private final Exception exception;

	private StatementLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.sql = requireNonNull(builder.sql);
		this.parameters = builder.parameters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(builder.parameters));
		this.connectionAcquisitionDuration = builder.connectionAcquisitionDuration;
		this.preparationDuration = builder.preparationDuration;
		this.executionDuration = builder.executionDuration;
		this.resultSetMappingDuration = builder.resultSetMappingDuration;
		this.rowCount = builder.rowCount;
		this.exception = builder.exception;

		Duration totalDuration = Duration.ZERO;

		if (this.connectionAcquisitionDuration != null)
			totalDuration = totalDuration.plus(this.connectionAcquisitionDuration);

		if (this.preparationDuration != null)
			totalDuration = totalDuration.plus(this.preparationDuration);

		if (this.executionDuration != null)
			totalDuration = totalDuration.plus(this.executionDuration);

		if (this.resultSetMappingDuration != null)
			totalDuration = totalDuration.plus(this.resultSetMappingDuration);

		this.totalDuration = totalDuration;
	}

	/**
	 * Creates a {@link StatementLog} builder for the given {@code sql}.
	 *
	 * @param sql the SQL that was executed
	 * @return a {@link StatementLog} builder
	 */
	@NonNull
	public static Builder withSql(@NonNull String sql) {
		requireNonNull(sql);
		return new Builder(sql);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(8);

		components.add(format("sql=%s", getSql()));
		components.add(format("totalDuration=%s", getTotalDuration()));

		getConnectionAcquisitionDuration().ifPresent(duration -> components.add(format("connectionAcquisitionDuration=%s", duration)));
		getPreparationDuration().ifPresent(duration -> components.add(format("preparationDuration=%s", duration)));
		getExecutionDuration().ifPresent(duration -> components.add(format("executionDuration=%s", duration)));
		getResultSetMappingDuration().ifPresent(duration -> components.add(format("resultSetMappingDuration=%s", duration)));
		getRowCount().ifPresent(rowCount -> components.add(format("rowCount=%s", rowCount)));
		getException().ifPresent(exception -> components.add(format("exception=%s", exception)));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementLog))
			return false;

		StatementLog statementLog = (StatementLog) object;

		return Objects.equals(getSql(), statementLog.getSql())
				&& Objects.equals(getParameters(), statementLog.getParameters())
				&& Objects.equals(getConnectionAcquisitionDuration(), statementLog.getConnectionAcquisitionDuration())
				&& Objects.equals(getPreparationDuration(), statementLog.getPreparationDuration())
				&& Objects.equals(getExecutionDuration(), statementLog.getExecutionDuration())
				&& Objects.equals(getResultSetMappingDuration(), statementLog.getResultSetMappingDuration())
				&& Objects.equals(getRowCount(), statementLog.getRowCount())
				&& Objects.equals(getException(), statementLog.getException());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSql(), getParameters(), getConnectionAcquisitionDuration(), getPreparationDuration(),
				getExecutionDuration(), getResultSetMappingDuration(), getRowCount(), getException());
	}

	/**
	 * The SQL statement that was executed.
	 *
	 * @return the SQL statement that was executed
	 */
	@NonNull
	public String getSql() {
		return this.sql;
	}

	/**
	 * The parameters bound to the statement, in binding order.
	 *
	 * @return the bound parameters
	 */
	@NonNull
	public List<@Nullable Object> getParameters() {
		return this.parameters;
	}

	/**
	 * How long did it take to acquire a {@link java.sql.Connection} from the {@link javax.sql.DataSource}?
	 * <p>
	 * Absent for write chunks after the first, which reuse the transaction's connection.
	 *
	 * @return how long it took to acquire a {@link java.sql.Connection}, if available
	 */
	@NonNull
	public Optional<Duration> getConnectionAcquisitionDuration() {
		return Optional.ofNullable(this.connectionAcquisitionDuration);
	}

	/**
	 * How long did it take to bind data to the {@link java.sql.PreparedStatement}?
	 *
	 * @return how long it took to bind data to the {@link java.sql.PreparedStatement}, if available
	 */
	@NonNull
	public Optional<Duration> getPreparationDuration() {
		return Optional.ofNullable(this.preparationDuration);
	}

	@NonNull
	public Optional<Duration> getExecutionDuration() {
		return Optional.ofNullable(this.executionDuration);
	}

	@NonNull
	public Optional<Duration> getResultSetMappingDuration() {
		return Optional.ofNullable(this.resultSetMappingDuration);
	}

	/**
	 * The sum of every duration recorded for this statement.
	 *
	 * @return how long the database operation took in total
	 */
	@NonNull
	public Duration getTotalDuration() {
		return this.totalDuration;
	}

	/**
	 * How many records the statement carried, for write chunks.
	 *
	 * @return the chunk's record count, if available
	 */
	@NonNull
	public Optional<Integer> getRowCount() {
		return Optional.ofNullable(this.rowCount);
	}

	/**
	 * The exception that occurred during SQL statement execution.
	 *
	 * @return the exception that occurred during SQL statement execution, if available
	 */
	@NonNull
	public Optional<Exception> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link StatementLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String sql;
		@Nullable
		private List<@Nullable Object> parameters;
		@Nullable
		private Duration connectionAcquisitionDuration;
		@Nullable
		private Duration preparationDuration;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Duration resultSetMappingDuration;
		@Nullable
		private Integer rowCount;
		@Nullable
		private Exception exception;

		private Builder(@NonNull String sql) {
			requireNonNull(sql);
			this.sql = sql;
		}

		@NonNull
		public Builder parameters(@Nullable List<@Nullable Object> parameters) {
			this.parameters = parameters;
			return this;
		}

		@NonNull
		public Builder connectionAcquisitionDuration(@Nullable Duration connectionAcquisitionDuration) {
			this.connectionAcquisitionDuration = connectionAcquisitionDuration;
			return this;
		}

		@NonNull
		public Builder preparationDuration(@Nullable Duration preparationDuration) {
			this.preparationDuration = preparationDuration;
			return this;
		}

		@NonNull
		public Builder executionDuration(@Nullable Duration executionDuration) {
			this.executionDuration = executionDuration;
			return this;
		}

		@NonNull
		public Builder resultSetMappingDuration(@Nullable Duration resultSetMappingDuration) {
			this.resultSetMappingDuration = resultSetMappingDuration;
			return this;
		}

		@NonNull
		public Builder rowCount(@Nullable Integer rowCount) {
			this.rowCount = rowCount;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		@NonNull
		public StatementLog build() {
			return new StatementLog(this);
		}
	}
}
